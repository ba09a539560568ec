package com.productscoutai.core.service;

import com.productscoutai.core.model.CrawlReport;
import com.productscoutai.core.model.ProductRecord;
import com.productscoutai.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 결과 정리(결정적, AI 미사용).
 * URL 정규화(추적 파라미터/끝 슬래시/기본 포트/fragment 제거) 후 대소문자 무시 비교, 처음 본 것 유지.
 */
public final class ProductDeduplicator {

    public List<ProductRecord> dedupe(List<ProductRecord> raw) {
        List<ProductRecord> out = new ArrayList<>();
        Set<String> keys = new HashSet<>();
        for (ProductRecord p : raw) {
            String url = normalizeUrl(p.url());
            if (keys.add(url.toLowerCase(Locale.ROOT))) {
                out.add(new ProductRecord(normalizeName(p.productName()), url));
            }
        }
        return out;
    }

    /** 요약 카운터는 그대로, 상품 목록만 정리 */
    public CrawlReport clean(CrawlReport raw) {
        return raw.withProducts(dedupe(raw.products()));
    }

    static String normalizeUrl(String url) {
        Optional<URI> u = UrlUtils.parse(url);
        if (u.isEmpty() || !UrlUtils.isCrawlable(u.get())) return url == null ? "" : url.trim();
        try {
            return UrlUtils.canonicalForDedup(u.get()).toString();
        } catch (IllegalArgumentException e) {
            return url.trim();
        }
    }

    static String normalizeName(String name) {
        return name == null ? "" : name.trim().replaceAll("\\s+", " ");
    }
}
