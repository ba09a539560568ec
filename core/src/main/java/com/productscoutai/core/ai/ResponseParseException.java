package com.productscoutai.core.ai;

/** AI 응답 텍스트에서 기대한 JSON을 꺼내지 못함(재요청 대상) */
class ResponseParseException extends Exception {
    ResponseParseException(String message) { super(message); }
    ResponseParseException(String message, Throwable cause) { super(message, cause); }
}
