package com.productscoutai.core.api;

import com.productscoutai.core.model.PageContent;

import java.net.URI;

/** 페이지 수집 최소 계약: URL을 받아 제목/설명/원시 링크를 돌려준다. */
public interface IPageFetcher extends AutoCloseable {
    PageContent fetch(URI url) throws FetchException;
    @Override default void close() {}
}
