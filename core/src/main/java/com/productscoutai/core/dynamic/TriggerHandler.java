package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;

/** 동적 로딩 컨트롤 하나를 소진(더 이상 새 링크가 안 나올 때까지 활성화). */
interface TriggerHandler {
    void exhaust(HandlerContext ctx) throws AutomationException;
}
