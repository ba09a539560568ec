package com.productscoutai.core.model;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/** fetch + 파싱 결과(제목/설명/원시 링크 후보). 링크 id는 아직 미배정. */
public record PageContent(URI url, String title, String description, List<LinkInfo> links) {
    public PageContent {
        Objects.requireNonNull(url, "url");
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static PageContent empty(URI url) {
        return new PageContent(url, "", "", List.of());
    }
}
