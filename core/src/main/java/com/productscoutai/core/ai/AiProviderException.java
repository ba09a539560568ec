package com.productscoutai.core.ai;

/** AI 제공자 통신 실패(전송 오류, 2xx 아님, 응답 텍스트 없음). 크롤을 즉시 중단시킨다. */
public class AiProviderException extends RuntimeException {
    private final int status;

    public AiProviderException(String message) {
        this(message, -1, null);
    }

    public AiProviderException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public AiProviderException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /** HTTP 상태(해당 없으면 -1) */
    public int getStatus() { return status; }
}
