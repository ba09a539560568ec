package com.productscoutai.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** 발견된 상품 1건(출력 JSON의 products[] 원소) */
@JsonPropertyOrder({"productName", "url"})
public record ProductRecord(@JsonProperty("productName") String productName,
                            @JsonProperty("url") String url) {
    public ProductRecord {
        Objects.requireNonNull(productName, "productName");
        Objects.requireNonNull(url, "url");
    }
}
