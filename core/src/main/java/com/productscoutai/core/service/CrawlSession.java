package com.productscoutai.core.service;

import com.productscoutai.core.api.IScoringGateway;
import com.productscoutai.core.crawler.LinkAdmission;
import com.productscoutai.core.model.CrawlReport;
import com.productscoutai.core.model.CrawlStats;
import com.productscoutai.core.model.ProductRecord;
import com.productscoutai.core.tree.OpenSet;
import com.productscoutai.core.tree.WebsiteTree;
import com.productscoutai.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** 크롤 1회분의 가변 상태(트리, 큐, 게이트웨이, 상품 누적, 통계). 전역 상태 없음. */
public final class CrawlSession {
    private final URI target;
    private final String domain;
    private final WebsiteTree tree = new WebsiteTree();
    private final OpenSet openSet = new OpenSet(tree);
    private final CrawlStats stats = new CrawlStats();
    private final List<ProductRecord> products = new ArrayList<>();
    private final IScoringGateway gateway;
    private final LinkAdmission admission;

    public CrawlSession(URI target, IScoringGateway gateway) {
        this.target = UrlUtils.normalize(Objects.requireNonNull(target, "target"));
        this.domain = UrlUtils.domainOf(this.target);
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.admission = new LinkAdmission(this.target, tree, stats);
    }

    public URI target() { return target; }
    public String domain() { return domain; }
    public WebsiteTree tree() { return tree; }
    public OpenSet openSet() { return openSet; }
    public CrawlStats stats() { return stats; }
    public IScoringGateway gateway() { return gateway; }
    public LinkAdmission admission() { return admission; }

    void addProduct(ProductRecord p) { products.add(p); }

    /** 완료 순서 그대로(중복 제거 전) */
    public List<ProductRecord> products() { return Collections.unmodifiableList(products); }

    public CrawlReport report() {
        return new CrawlReport(products, stats.getPagesProcessed(), tree.size(), target.toString(), domain);
    }
}
