package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;

/** Waiter 대기 한도 초과. 해당 핸들러만 중단하고 이미 노출된 링크는 유지한다. */
public class AutomationTimeoutException extends AutomationException {
    public AutomationTimeoutException(String message) { super(message); }
}
