package com.productscoutai.core.service;

import com.productscoutai.core.ai.AiProviderException;
import com.productscoutai.core.ai.ScoringGateways;
import com.productscoutai.core.api.FetchException;
import com.productscoutai.core.api.IBrowserSession;
import com.productscoutai.core.api.IPageFetcher;
import com.productscoutai.core.api.IScoringGateway;
import com.productscoutai.core.dynamic.DynamicContentExhauster;
import com.productscoutai.core.dynamic.PlaywrightBrowserSession;
import com.productscoutai.core.http.HttpPageFetcher;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlReport;
import com.productscoutai.core.model.CrawlStats;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.LinkScore;
import com.productscoutai.core.model.PageContent;
import com.productscoutai.core.model.ProductRecord;
import com.productscoutai.core.model.WebsiteNode;
import com.productscoutai.core.tree.WebsiteTree;
import com.productscoutai.core.util.DefaultSleeper;
import com.productscoutai.core.util.ProgressListener;
import com.productscoutai.core.util.Sleeper;
import com.productscoutai.core.util.StructuredLog;
import com.productscoutai.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * AI 유도 우선순위 탐색 오케스트레이터.
 *  - pop(최고 키) → fetch → 입장 심사 → 스코어링 → 정책(skip/상품/큐) → [동적 로딩] → 완료 전파
 *  - 단일 스레드, 반복 간 politeness delay
 *  - AI 제공자 실패는 부분 결과를 담은 CrawlAbortedException 으로 중단
 */
public final class ExplorationEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExplorationEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExplorationEngine.class);

    static final double SKIP_BELOW = 1.0;

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final CrawlSession session;
    private final DynamicContentExhauster exhauster; // null이면 동적 로딩 비활성
    private final Sleeper sleeper;
    private final Clock clock;
    private final StructuredLog slog;

    /** 기본 구현(HTTP fetcher + 설정된 AI 제공자 + Playwright) */
    public ExplorationEngine(CrawlConfig config) {
        this(config,
                new HttpPageFetcher(config.fetch()),
                ScoringGateways.create(config.ai()),
                () -> new PlaywrightBrowserSession(config.dynamic()),
                new DefaultSleeper(),
                Clock.systemUTC());
    }

    /** DI/테스트용 */
    public ExplorationEngine(CrawlConfig config, IPageFetcher fetcher, IScoringGateway gateway,
                             Supplier<IBrowserSession> browser, Sleeper sleeper, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");

        URI target = UrlUtils.parse(config.getUrl()).map(UrlUtils::normalize)
                .orElseThrow(() -> new IllegalArgumentException("unparseable url: " + config.getUrl()));
        if (!UrlUtils.isCrawlable(target)) {
            throw new IllegalArgumentException("url has no crawlable host: " + config.getUrl());
        }
        this.session = new CrawlSession(target, Objects.requireNonNull(gateway, "gateway"));
        this.exhauster = config.isEnableDynamicLoading()
                ? new DynamicContentExhauster(gateway, Objects.requireNonNull(browser, "browser"), config.dynamic(), sleeper)
                : null;
        this.slog = SLOG.bind("domain", session.domain());
    }

    public CrawlReport run() throws CrawlAbortedException {
        return run(ProgressListener.NONE);
    }

    public CrawlReport run(ProgressListener listener) throws CrawlAbortedException {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final int maxPages = config.getMaxPages();
        final Duration maxRuntime = config.getMaxRuntime();
        final Instant started = clock.instant();
        final CrawlStats stats = session.stats();

        LOG.info("Crawl start: url={}, maxPages={}, delay={}ms, dynamic={}, provider={}",
                session.target(), maxPages, config.getDelay().toMillis(),
                config.isEnableDynamicLoading(), config.ai().getProvider());
        slog.info("crawl-start",
                "url", session.target().toString(),
                "maxPages", maxPages,
                "dynamic", config.isEnableDynamicLoading(),
                "provider", String.valueOf(config.ai().getProvider()),
                "model", config.ai().getModel());
        pl.onProgress(0.0, "crawl", 0, maxPages);

        if (session.tree().size() == 0) {
            session.openSet().insert(session.tree().addRoot(session.target()));
        }

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("crawl interrupted, returning partial result");
                break;
            }
            if (stats.getPagesProcessed() >= maxPages) {
                LOG.info("page budget {} spent", maxPages);
                break;
            }
            if (!maxRuntime.isZero() && !Duration.between(started, clock.instant()).minus(maxRuntime).isNegative()) {
                LOG.info("runtime budget {}s spent", maxRuntime.toSeconds());
                break;
            }
            Optional<WebsiteNode> next = session.openSet().popMax();
            if (next.isEmpty()) {
                LOG.info("open set empty");
                break;
            }

            try {
                processNode(next.get());
            } catch (AiProviderException e) {
                CrawlReport partial = session.report();
                LOG.error("AI provider failure at {}: {}", next.get().getUrl(), e.getMessage());
                slog.error("crawl-aborted", e, "pages", partial.pagesProcessed(), "products", partial.products().size());
                throw new CrawlAbortedException("AI provider failure: " + e.getMessage(), partial, e);
            }

            int done = stats.getPagesProcessed();
            pl.onProgress(Math.min(1.0, done / (double) maxPages), "crawl", done, maxPages);

            if (session.openSet().isEmpty() || done >= maxPages) continue;
            try {
                sleeper.sleep(config.getDelay());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        CrawlReport report = session.report();
        LOG.info("Crawl done: pages={}, nodes={}, products={}, fetchFailures={}, aiCalls={}",
                report.pagesProcessed(), report.totalNodes(), report.products().size(),
                stats.getFetchFailures(), stats.getScoringCalls() + stats.getDetectionCalls());
        slog.info("crawl-done",
                "pages", report.pagesProcessed(),
                "nodes", report.totalNodes(),
                "products", report.products().size(),
                "admitted", stats.getLinksAdmitted(),
                "rejectedDomain", stats.getRejectedDomain(),
                "rejectedDuplicate", stats.getRejectedDuplicate(),
                "rejectedInvalid", stats.getRejectedInvalid(),
                "dynamicRevealed", stats.getDynamicLinksRevealed(),
                "elapsedMs", Duration.between(started, clock.instant()).toMillis());
        return report;
    }

    /** 노드 1개 처리. fetch 실패는 막다른 길(완료)로 처리하고 계속 진행한다. */
    void processNode(WebsiteNode node) {
        WebsiteTree tree = session.tree();
        CrawlStats stats = session.stats();
        stats.incPagesProcessed();

        PageContent page;
        try {
            page = fetcher.fetch(node.getUrl());
        } catch (FetchException e) {
            stats.incFetchFailures();
            LOG.warn("fetch failed for {} (status {}): {}", node.getUrl(), e.getStatus(), e.getMessage());
            tree.markExplored(node);
            complete(node);
            slog.warn("page-processed", "url", node.getUrl().toString(), "fetched", false);
            return;
        }
        node.cachePage(page.title(), page.description());

        List<LinkInfo> batch = session.admission().admit(node, page.links());
        int products = scoreAndApply(node, batch);

        if (products > 0 && exhauster != null) {
            stats.incDetectionCalls();
            List<LinkInfo> revealed = exhauster.exhaust(node.context(), batch);
            stats.addDynamicLinksRevealed(revealed.size());
            List<LinkInfo> extra = session.admission().admit(node, revealed);
            LOG.info("dynamic content at {} revealed {} link(s), {} admitted", node.getUrl(), revealed.size(), extra.size());
            products += scoreAndApply(node, extra);
        }

        tree.markExplored(node);
        if (tree.isSubtreeComplete(node)) {
            complete(node);
        }
        LOG.debug("processed {} depth={} key={} children={} products={}",
                node.getUrl(), node.getDepth(), tree.averageAncestralScore(node), node.getChildIds().size(), products);
        slog.info("page-processed",
                "url", node.getUrl().toString(),
                "depth", node.getDepth(),
                "admitted", batch.size(),
                "products", products,
                "queued", session.openSet().size());
    }

    /**
     * 스코어링 + 정책 적용(id 순서).
     *  s < 1      : 자식 생성 후 즉시 완료(큐 X)
     *  s > 9      : 상품 기록 + 완료
     *  1 ≤ s ≤ 9  : 자식 생성 후 큐 삽입
     * @return 이번 배치에서 나온 상품 수
     */
    int scoreAndApply(WebsiteNode parent, List<LinkInfo> batch) {
        if (batch.isEmpty()) return 0;
        session.stats().incScoringCalls();
        List<LinkScore> scores = session.gateway().scoreLinks(parent.context(), batch);
        Map<Integer, LinkScore> byId = new HashMap<>();
        for (LinkScore s : scores) byId.putIfAbsent(s.id(), s);

        WebsiteTree tree = session.tree();
        int found = 0;
        for (LinkInfo candidate : batch) {
            LinkScore ls = byId.getOrDefault(candidate.getId(), LinkScore.zero(candidate.getId()));
            LinkInfo link = candidate.scored(ls.score(), ls.productName());
            double s = link.getScore();
            WebsiteNode child = tree.addChild(parent, link, s);
            if (s < SKIP_BELOW) {
                complete(child);
            } else if (s > LinkScore.PRODUCT_THRESHOLD) {
                String name = productName(link);
                child.setProductName(name);
                session.addProduct(new ProductRecord(name, child.getUrl().toString()));
                found++;
                LOG.info("product found: '{}' at {} (score {})", name, child.getUrl(), s);
                slog.info("product-found", "name", name, "url", child.getUrl().toString(), "score", s,
                        "trail", trail(child));
                complete(child);
            } else {
                session.openSet().insert(child);
            }
        }
        return found;
    }

    /** 완료 전파 + 새로 완료된 노드는 큐에서 무효화 */
    private void complete(WebsiteNode node) {
        for (WebsiteNode done : session.tree().markCompleteAndPropagate(node)) {
            session.openSet().invalidate(done);
        }
    }

    /** root → node 상대 경로 */
    private String trail(WebsiteNode node) {
        StringBuilder sb = new StringBuilder();
        for (WebsiteNode n : session.tree().path(node)) {
            if (sb.length() > 0) sb.append(" > ");
            sb.append(UrlUtils.relativePath(n.getUrl()));
        }
        return sb.toString();
    }

    /** AI 이름 → 앵커 텍스트 → 상대 경로 */
    static String productName(LinkInfo link) {
        if (link.getProductName() != null) return link.getProductName();
        if (!link.getAnchorText().isBlank()) return link.getAnchorText().trim();
        return link.getRelativePath();
    }

    public CrawlSession session() { return session; }

    public CrawlStats getStats() { return session.stats(); }

    @Override
    public void close() {
        try {
            if (exhauster != null) exhauster.close();
        } finally {
            try {
                fetcher.close();
            } finally {
                session.gateway().close();
            }
        }
    }
}
