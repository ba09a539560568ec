package com.productscoutai.core.http;

import com.productscoutai.core.model.CrawlConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** 429/5xx/네트워크 오류에서만 재시도. base·2^(n-1), 기본 250 → 500 → 1000ms (±10% jitter) */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 250); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
    }

    public static DefaultRetryPolicy from(CrawlConfig.FetchCfg f) {
        return new DefaultRetryPolicy(f.getMaxAttempts(), f.getBackoffBaseMs());
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || statusCode >= 500 || statusCode == -1;
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        return attempt < maxAttempts && isRetryableStatus(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        long raw = baseMillis << Math.max(0, Math.min(20, attempt - 1));
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
