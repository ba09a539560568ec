package com.productscoutai.core.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** URL 정규화 + 크롤 범위(scope) 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 결과 정리 단계에서 제거하는 추적 파라미터(utm_* 는 접두어로 별도 처리) */
    public static final Set<String> TRACKING_PARAMS = Set.of(
            "gclid", "fbclid", "msclkid", "mc_cid", "mc_eid", "_ga", "igshid", "yclid", "ref", "ref_src");

    /**
     * 문자열 → URI (관대한 파싱). 공백은 %20으로 치환.
     * 파싱 불가면 empty.
     */
    public static Optional<URI> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim().replace(" ", "%20");
        if (s.isEmpty()) return Optional.empty();
        try {
            return Optional.of(URI.create(s));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     * raw path/query는 디코딩하지 않고 그대로 유지.
     */
    public static URI normalize(URI u) {
        if (u == null) return null;
        if (u.isOpaque() || u.getHost() == null) return u; // mailto:, 빈 host 등은 그대로(판정은 isCrawlable 몫)

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null && !u.getRawQuery().isEmpty()) sb.append('?').append(u.getRawQuery());
        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            // 재조립 실패 시 원본 유지(보수적)
            return u;
        }
    }

    /** http(s) + 비어있지 않은 host 만 크롤 대상 */
    public static boolean isCrawlable(URI u) {
        if (u == null || u.isOpaque()) return false;
        String scheme = u.getScheme();
        if (scheme == null) return false;
        String s = scheme.toLowerCase(Locale.ROOT);
        if (!s.equals("http") && !s.equals("https")) return false;
        return !hostOf(u).isEmpty();
    }

    /**
     * 같은 크롤 범위인지: 소문자 hostname 완전 일치(scheme 무관).
     * 한쪽이라도 host가 비어있으면 false (와일드카드 취급 금지).
     * sub.example.com ≠ example.com
     */
    public static boolean sameScope(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = hostOf(a);
        String hb = hostOf(b);
        if (ha.isEmpty() || hb.isEmpty()) return false;
        return ha.equals(hb);
    }

    /** 소문자 host, 없으면 "" */
    public static String domainOf(URI u) {
        return hostOf(u);
    }

    /** host 기준 상대 경로: path + ?query */
    public static String relativePath(URI u) {
        if (u == null) return "";
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        String q = u.getRawQuery();
        return (q == null || q.isEmpty()) ? path : path + "?" + q;
    }

    /**
     * 결과 정리용 정규화: normalize + 추적 파라미터 제거 + 끝 슬래시 제거(루트 제외).
     */
    public static URI canonicalForDedup(URI u) {
        URI n = normalize(u);
        if (n == null || n.getHost() == null) return n;
        String path = n.getRawPath();
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.replaceAll("/+$", "");
            if (path.isEmpty()) path = "/";
        }
        String q = stripTracking(n.getRawQuery());
        StringBuilder sb = new StringBuilder(n.getScheme()).append("://").append(n.getHost());
        if (n.getPort() != -1) sb.append(':').append(n.getPort());
        sb.append(path);
        if (q != null && !q.isEmpty()) sb.append('?').append(q);
        return URI.create(sb.toString());
    }

    /** raw query에서 추적 파라미터 제거. 남는 게 없으면 null */
    public static String stripTracking(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return null;
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = (eq >= 0 ? pair.substring(0, eq) : pair).toLowerCase(Locale.ROOT);
            if (name.startsWith("utm_") || TRACKING_PARAMS.contains(name)) continue;
            kept.add(pair);
        }
        return kept.isEmpty() ? null : String.join("&", kept);
    }

    private static String hostOf(URI u) {
        if (u == null || u.getHost() == null) return "";
        return u.getHost().trim().toLowerCase(Locale.ROOT);
    }
}
