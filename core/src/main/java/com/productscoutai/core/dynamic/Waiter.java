package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.util.Sleeper;

import java.time.Duration;

/**
 * 조건 폴링 대기. 폴링 횟수 = timeout / pollInterval (최소 1).
 * 고정 sleep 대신 상태 조건을 확인한다.
 */
public final class Waiter {

    /** 브라우저 상태 조건(브라우저 호출이 실패할 수 있음) */
    @FunctionalInterface
    public interface Condition {
        boolean test() throws AutomationException;
    }

    private final Duration timeout;
    private final Duration pollInterval;
    private final Sleeper sleeper;

    public Waiter(Duration timeout, Duration pollInterval, Sleeper sleeper) {
        this.timeout = timeout;
        this.pollInterval = pollInterval;
        this.sleeper = sleeper;
    }

    /**
     * @throws AutomationTimeoutException 한도 내에 조건이 참이 되지 않음
     */
    public void until(Condition cond, String what) throws AutomationException {
        long polls = Math.max(1, timeout.toMillis() / Math.max(1, pollInterval.toMillis()));
        for (long i = 0; i <= polls; i++) {
            if (cond.test()) return;
            if (i == polls) break;
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new AutomationException("interrupted while waiting for " + what, ie);
            }
        }
        throw new AutomationTimeoutException("timed out after " + timeout.toMillis() + "ms waiting for " + what);
    }

    public Duration getTimeout() { return timeout; }
}
