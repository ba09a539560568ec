package com.productscoutai.core.ai;

import com.productscoutai.core.util.Sleeper;

import java.time.Duration;
import java.util.function.LongSupplier;

/** 분당 요청 수 제한: 요청 간 최소 간격 = 60s / rpm. rpm 0 = 무제한. */
public final class RequestThrottle {
    private final long minIntervalNanos;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;
    private long lastNanos = Long.MIN_VALUE;

    public RequestThrottle(int requestsPerMinute, Sleeper sleeper) {
        this(requestsPerMinute, sleeper, System::nanoTime);
    }

    RequestThrottle(int requestsPerMinute, Sleeper sleeper, LongSupplier nanoClock) {
        this.minIntervalNanos = requestsPerMinute <= 0 ? 0 : Duration.ofMinutes(1).toNanos() / requestsPerMinute;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    public synchronized void acquire() throws InterruptedException {
        if (minIntervalNanos == 0) return;
        long now = nanoClock.getAsLong();
        if (lastNanos != Long.MIN_VALUE) {
            long wait = (lastNanos + minIntervalNanos) - now;
            if (wait > 0) {
                sleeper.sleep(Duration.ofNanos(wait));
                now += wait;
            }
        }
        lastNanos = now;
    }
}
