package com.productscoutai.core.model;

import java.net.URI;

/** AI 프롬프트에 넣는 현재 페이지 요약 */
public record NodeContext(URI url, String title, String description) {
    public NodeContext {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
    }
}
