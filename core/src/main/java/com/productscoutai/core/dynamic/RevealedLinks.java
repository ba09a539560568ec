package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import com.productscoutai.core.crawler.JsoupPageParser;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 브라우저 DOM에서 새로 나타난 링크 수집기.
 * seen에는 최초 페이지의 링크가 미리 들어가므로 정적 fetch로 이미 본 링크는 다시 내보내지 않는다.
 */
final class RevealedLinks {
    private final JsoupPageParser parser = new JsoupPageParser();
    private final Set<URI> seen = new LinkedHashSet<>();
    private final List<LinkInfo> revealed = new ArrayList<>();
    private final String contentSelector;

    RevealedLinks(String contentSelector) {
        this.contentSelector = contentSelector;
    }

    /** 현재 DOM의 링크를 본 것으로만 표시(수집 안 함) */
    void baseline(IBrowserSession session) throws AutomationException {
        for (LinkInfo li : snapshot(session)) seen.add(li.getAbsoluteUrl());
    }

    /** 현재 DOM에서 처음 본 링크를 수집하고 그 개수를 돌려준다 */
    int collect(IBrowserSession session) throws AutomationException {
        int added = 0;
        for (LinkInfo li : snapshot(session)) {
            if (seen.add(li.getAbsoluteUrl())) {
                revealed.add(li);
                added++;
            }
        }
        return added;
    }

    /** 콘텐츠 영역 안의 링크 URL 집합(변화 감지용) */
    Set<URI> contentLinks(IBrowserSession session) throws AutomationException {
        Document doc = Jsoup.parse(session.html(), session.currentUrl().toString());
        Set<URI> out = new LinkedHashSet<>();
        for (Element scope : doc.select(contentSelector)) {
            for (Element a : scope.select("a[href]")) {
                UrlUtils.parse(a.attr("abs:href")).map(UrlUtils::normalize).ifPresent(out::add);
            }
        }
        return out;
    }

    boolean hasUnseen(Set<URI> urls) {
        for (URI u : urls) if (!seen.contains(u)) return true;
        return false;
    }

    List<LinkInfo> revealed() { return Collections.unmodifiableList(revealed); }

    private List<LinkInfo> snapshot(IBrowserSession session) throws AutomationException {
        return parser.parse(session.html(), session.currentUrl()).links();
    }
}
