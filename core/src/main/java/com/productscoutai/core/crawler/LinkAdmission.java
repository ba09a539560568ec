package com.productscoutai.core.crawler;

import com.productscoutai.core.model.CrawlStats;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.WebsiteNode;
import com.productscoutai.core.tree.WebsiteTree;
import com.productscoutai.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 후보 링크 입장 심사(일반 자식/동적 노출 링크 공용).
 * 순서: 유효성 → 도메인 → 전역(트리) 중복 → 배치 내 중복(자기 자신 포함) → id 순차 배정.
 */
public final class LinkAdmission {

    private final URI target;
    private final WebsiteTree tree;
    private final CrawlStats stats;

    public LinkAdmission(URI target, WebsiteTree tree, CrawlStats stats) {
        this.target = Objects.requireNonNull(target, "target");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /** 통과한 후보를 0..k-1 id로 돌려준다. 이미 트리에 있는 URL은 referrer만 기록. */
    public List<LinkInfo> admit(WebsiteNode parent, List<LinkInfo> raw) {
        List<LinkInfo> out = new ArrayList<>();
        Set<URI> batch = new HashSet<>();
        int invalid = 0, domain = 0, dup = 0;

        for (LinkInfo li : raw) {
            URI n = UrlUtils.normalize(li.getAbsoluteUrl());
            if (!UrlUtils.isCrawlable(n)) { invalid++; continue; }
            if (!UrlUtils.sameScope(target, n)) { domain++; continue; }
            if (n.equals(parent.getUrl())) { dup++; continue; }     // self-link
            if (tree.contains(n)) {
                tree.recordReferrer(n, parent);
                dup++;
                continue;
            }
            if (!batch.add(n)) { dup++; continue; }
            out.add(li.withAbsoluteUrl(n, UrlUtils.relativePath(n)).withId(out.size()));
        }

        stats.addAdmitted(out.size());
        stats.addRejectedInvalid(invalid);
        stats.addRejectedDomain(domain);
        stats.addRejectedDuplicate(dup);
        return out;
    }
}
