package com.productscoutai.core.http;

import java.time.Duration;

/** fetch 재시도 조건/지연 정책 */
public interface RetryPolicy {
    /** attempt는 1부터(방금 끝난 시도 번호). status -1 = 네트워크 오류. */
    boolean shouldRetry(int statusCode, int attempt);
    /** attempt 실패 후 다음 시도까지의 지연 */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함) */
    int maxAttempts();
}
