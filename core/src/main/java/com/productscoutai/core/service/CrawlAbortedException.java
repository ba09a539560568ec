package com.productscoutai.core.service;

import com.productscoutai.core.model.CrawlReport;

/** AI 제공자 실패로 크롤 중단. 그때까지의 부분 결과를 담는다. */
public class CrawlAbortedException extends Exception {
    private final transient CrawlReport partial;

    public CrawlAbortedException(String message, CrawlReport partial, Throwable cause) {
        super(message, cause);
        this.partial = partial;
    }

    public CrawlReport getPartialReport() { return partial; }
}
