package com.productscoutai.core.api;

import java.net.URI;

/**
 * 헤드리스 브라우저 프리미티브. 셀렉터는 Playwright 문법(:has-text 등 포함).
 * 엔진이 1개를 소유하고 노드 간 재사용한다.
 */
public interface IBrowserSession extends AutoCloseable {

    void open(URI url) throws AutomationException;

    /** 현재 렌더링된 DOM 전체 HTML */
    String html() throws AutomationException;

    /** 현재 페이지 URL (네비게이션 후 변경될 수 있음) */
    URI currentUrl() throws AutomationException;

    int count(String selector) throws AutomationException;

    boolean isVisible(String selector) throws AutomationException;

    void click(String selector) throws AutomationException;

    void clickNth(String selector, int index) throws AutomationException;

    /** index번째 요소의 속성값, 없으면 null */
    String attributeNth(String selector, int index, String name) throws AutomationException;

    /** index번째 요소의 렌더링 높이(px), 없으면 -1 */
    double elementHeight(String selector, int index) throws AutomationException;

    /** document.body.scrollHeight */
    long scrollHeight() throws AutomationException;

    void scrollToBottom() throws AutomationException;

    @Override void close();
}
