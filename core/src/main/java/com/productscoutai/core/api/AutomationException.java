package com.productscoutai.core.api;

/** 브라우저 자동화 실패(페이지 열기 실패, Playwright 오류 등) */
public class AutomationException extends Exception {
    public AutomationException(String message) { super(message); }
    public AutomationException(String message, Throwable cause) { super(message, cause); }
}
