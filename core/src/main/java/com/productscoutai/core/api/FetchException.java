package com.productscoutai.core.api;

import java.net.URI;

/** 재시도 후에도 페이지를 가져오지 못함(해당 노드는 막다른 길로 처리) */
public class FetchException extends Exception {
    private final URI url;
    private final int status;

    public FetchException(URI url, int status, String message) {
        super(message);
        this.url = url;
        this.status = status;
    }

    public FetchException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = -1;
    }

    public URI getUrl() { return url; }

    /** 마지막 HTTP 상태(네트워크 오류면 -1) */
    public int getStatus() { return status; }
}
