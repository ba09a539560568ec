package com.productscoutai.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * 크롤 결과 요약(raw/final 출력 파일과 1:1 매핑).
 * 키 이름은 기존 결과 파일 포맷(snake_case)을 유지한다.
 */
@JsonPropertyOrder({"products", "pages_processed", "total_nodes", "base_url", "domain"})
public record CrawlReport(
        @JsonProperty("products") List<ProductRecord> products,
        @JsonProperty("pages_processed") int pagesProcessed,
        @JsonProperty("total_nodes") int totalNodes,
        @JsonProperty("base_url") String baseUrl,
        @JsonProperty("domain") String domain) {

    public CrawlReport {
        products = products == null ? List.of() : List.copyOf(products);
    }

    public CrawlReport withProducts(List<ProductRecord> replaced) {
        return new CrawlReport(replaced, pagesProcessed, totalNodes, baseUrl, domain);
    }
}
