package com.productscoutai.core.crawler;

import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.PageContent;
import com.productscoutai.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * HTML → PageContent. a[href] → abs:href 수집(id 미배정).
 * 도메인/중복 필터링은 LinkAdmission 몫이며 여기서는 스킴이 없는 링크만 버린다.
 */
public final class JsoupPageParser {

    private static final int MAX_ANCHOR_TEXT = 200;

    public PageContent parse(String html, URI baseUri) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUri.toString());
        String title = doc.title() == null ? "" : doc.title().trim();
        String description = metaDescription(doc);

        List<LinkInfo> links = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href").trim();
            if (isNonNavigational(href)) continue;
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            Optional<URI> u = UrlUtils.parse(abs);
            if (u.isEmpty()) continue; // 잘못된 URL은 무시
            URI n = UrlUtils.normalize(u.get());
            links.add(LinkInfo.candidate(n, UrlUtils.relativePath(n), anchorText(a), tagContext(a)));
        }
        return new PageContent(baseUri, title, description, links);
    }

    /** #frag, javascript:, mailto:, tel: 는 페이지 이동이 아님 */
    static boolean isNonNavigational(String href) {
        if (href.isEmpty() || href.startsWith("#")) return true;
        String l = href.toLowerCase(Locale.ROOT);
        return l.startsWith("javascript:") || l.startsWith("mailto:") || l.startsWith("tel:");
    }

    private static String metaDescription(Document doc) {
        Element m = doc.selectFirst("meta[name=description]");
        if (m == null) m = doc.selectFirst("meta[property=og:description]");
        return m == null ? "" : m.attr("content").trim();
    }

    private static String anchorText(Element a) {
        String t = a.text();
        if (t.isBlank()) t = a.attr("title");
        if (t.isBlank()) t = a.attr("aria-label");
        if (t.isBlank()) {
            Element img = a.selectFirst("img[alt]");
            if (img != null) t = img.attr("alt");
        }
        t = t.trim().replaceAll("\\s+", " ");
        return t.length() > MAX_ANCHOR_TEXT ? t.substring(0, MAX_ANCHOR_TEXT) : t;
    }

    /** "div.product-card > a.title" 형태 */
    static String tagContext(Element a) {
        Element parent = a.parent();
        String self = describe(a);
        return parent == null ? self : describe(parent) + " > " + self;
    }

    private static String describe(Element e) {
        StringBuilder sb = new StringBuilder(e.tagName());
        for (String c : e.classNames()) {
            if (!c.isBlank()) sb.append('.').append(c);
        }
        return sb.toString();
    }
}
