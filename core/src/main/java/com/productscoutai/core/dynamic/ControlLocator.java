package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import com.productscoutai.core.model.LinkInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * AI가 지목한 후보 링크 → 페이지 내 클릭 대상 셀렉터.
 * 순서: 절대 href → 상대 href → 앵커 텍스트 → 의미 있는 경로 조각(4자 이상)
 */
final class ControlLocator {

    static List<String> candidates(LinkInfo link) {
        List<String> out = new ArrayList<>();
        if (link == null) return out;
        out.add("a[href=\"" + esc(link.getAbsoluteUrl().toString()) + "\"]");
        if (!link.getRelativePath().isEmpty()) out.add("a[href=\"" + esc(link.getRelativePath()) + "\"]");
        if (!link.getAnchorText().isBlank()) out.add("a:has-text(\"" + esc(link.getAnchorText()) + "\")");
        significantSegment(link.getRelativePath()).ifPresent(s -> out.add("a[href*=\"" + esc(s) + "\"]"));
        return out;
    }

    /** 페이지에 존재하는 첫 셀렉터 */
    static Optional<String> locate(IBrowserSession session, LinkInfo link) throws AutomationException {
        for (String sel : candidates(link)) {
            if (session.count(sel) > 0) return Optional.of(sel);
        }
        return Optional.empty();
    }

    static Optional<String> significantSegment(String relativePath) {
        if (relativePath == null) return Optional.empty();
        String path = relativePath;
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        String[] parts = path.split("/");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (parts[i].length() > 3) return Optional.of(parts[i]);
        }
        return Optional.empty();
    }

    private static String esc(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private ControlLocator() {}
}
