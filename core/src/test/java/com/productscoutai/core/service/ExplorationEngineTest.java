package com.productscoutai.core.service;

import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlReport;
import com.productscoutai.core.model.DynamicDetection;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.NodeState;
import com.productscoutai.core.model.ProductRecord;
import com.productscoutai.core.model.TriggerType;
import com.productscoutai.core.model.WebsiteNode;
import com.productscoutai.core.support.FakeBrowserSession;
import com.productscoutai.core.support.FakeFetcher;
import com.productscoutai.core.support.FakeGateway;
import com.productscoutai.core.support.RecordingSleeper;
import com.productscoutai.core.tree.WebsiteTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.productscoutai.core.support.FakeFetcher.html;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ExplorationEngineTest {

    private static final String ROOT = "https://shop.test/";

    /** sleep 만큼 앞으로 가는 시계 */
    static final class TickingClock extends Clock {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    private final FakeFetcher fetcher = new FakeFetcher();
    private final FakeGateway gateway = new FakeGateway();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final TickingClock clock = new TickingClock();

    private static CrawlConfig cfg() {
        return CrawlConfig.defaults().setUrl(ROOT);
    }

    private ExplorationEngine engine(CrawlConfig cfg) {
        return new ExplorationEngine(cfg, fetcher, gateway, () -> { throw new AssertionError("no browser"); },
                sleeper, clock);
    }

    private static WebsiteNode node(WebsiteTree tree, String url) {
        return tree.find(URI.create(url)).orElseThrow();
    }

    @Test
    @DisplayName("상품은 수집만 하고 방문하지 않으며, 중간 점수만 탐색한다")
    void explores_mid_scores_and_records_products() throws Exception {
        fetcher.page(ROOT, html("Home", "/b", "B", "/c", "C"))
               .page("https://shop.test/c", html("C", "/d", "D"));
        gateway.product("/b", 9.5, "Widget").score("/c", 5).score("/d", 0.3);

        ExplorationEngine e = engine(cfg());
        CrawlReport report = e.run();

        assertThat(report.pagesProcessed()).isEqualTo(2);
        assertThat(report.totalNodes()).isEqualTo(4);
        assertThat(report.products()).containsExactly(new ProductRecord("Widget", "https://shop.test/b"));
        assertThat(report.baseUrl()).isEqualTo(ROOT);
        assertThat(report.domain()).isEqualTo("shop.test");
        assertThat(fetcher.fetched).containsExactly(URI.create(ROOT), URI.create("https://shop.test/c"));

        WebsiteTree tree = e.session().tree();
        assertThat(node(tree, "https://shop.test/d").getState()).isEqualTo(NodeState.COMPLETELY_EXPLORED);
        assertThat(node(tree, "https://shop.test/b").isProduct()).isTrue();
        assertThat(tree.root().isCompletelyExplored()).isTrue();
        assertThat(e.session().openSet().isEmpty()).isTrue();
        // 큐가 비면 마지막 delay는 생략
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("경계값: 1 미만은 건너뛰고 9 초과만 상품")
    void score_boundaries() throws Exception {
        fetcher.page(ROOT, html("Home", "/s099", "a", "/s100", "b", "/s900", "c", "/s901", "d"));
        gateway.score("/s099", 0.99).score("/s100", 1.00).score("/s900", 9.00).product("/s901", 9.01, "Edge");

        ExplorationEngine e = engine(cfg().setMaxPages(1));
        CrawlReport report = e.run();

        WebsiteTree tree = e.session().tree();
        assertThat(node(tree, "https://shop.test/s099").isCompletelyExplored()).isTrue();
        assertThat(e.session().openSet().contains(node(tree, "https://shop.test/s100"))).isTrue();
        assertThat(e.session().openSet().contains(node(tree, "https://shop.test/s900"))).isTrue();
        assertThat(node(tree, "https://shop.test/s900").isProduct()).isFalse();
        assertThat(report.products()).extracting(ProductRecord::productName).containsExactly("Edge");
        assertThat(e.session().openSet().size()).isEqualTo(2);
    }

    @Test
    void highest_ancestral_average_is_explored_first() throws Exception {
        fetcher.page(ROOT, html("Home", "/low", "L", "/high", "H"))
               .page("https://shop.test/high", html("H", "/high/kid", "K"))
               .page("https://shop.test/high/kid", html("K"))
               .page("https://shop.test/low", html("L"));
        // high/kid 평균 (8+2)/2=5.0 > low 3.0
        gateway.score("/low", 3).score("/high", 8).score("/high/kid", 2);

        engine(cfg()).run();

        assertThat(fetcher.fetched).extracting(URI::getPath).containsExactly("/", "/high", "/high/kid", "/low");
    }

    @Test
    @DisplayName("두 부모가 가리킨 URL은 노드 1개, 스코어링 1회")
    void same_url_from_two_parents_is_scored_once() throws Exception {
        fetcher.page(ROOT, html("Home", "/a", "A", "/b", "B"))
               .page("https://shop.test/a", html("A", "/shared", "S"))
               .page("https://shop.test/b", html("B", "/shared", "S", "/a", "A"));
        gateway.score("/a", 5).score("/b", 4).score("/shared", 0.5);

        ExplorationEngine e = engine(cfg());
        CrawlReport report = e.run();

        WebsiteTree tree = e.session().tree();
        assertThat(report.totalNodes()).isEqualTo(4);
        long scoredShared = gateway.scoringBatches.stream().flatMap(List::stream)
                .filter(l -> l.getRelativePath().equals("/shared")).count();
        assertThat(scoredShared).isEqualTo(1);
        assertThat(gateway.scoringBatches).hasSize(2);
        int b = node(tree, "https://shop.test/b").getId();
        assertThat(node(tree, "https://shop.test/shared").getReferrerIds()).containsExactly(b);
        assertThat(node(tree, "https://shop.test/a").getReferrerIds()).containsExactly(b);
        assertThat(tree.root().isCompletelyExplored()).isTrue();
    }

    @Test
    @DisplayName("fetch 실패는 막다른 길로 처리하고 계속 탐색")
    void fetch_failure_is_a_dead_end() throws Exception {
        fetcher.page(ROOT, html("Home", "/missing", "M", "/ok", "OK"))
               .page("https://shop.test/ok", html("OK"));
        gateway.score("/missing", 6).score("/ok", 4);

        ExplorationEngine e = engine(cfg());
        CrawlReport report = e.run();

        assertThat(report.pagesProcessed()).isEqualTo(3);
        assertThat(e.getStats().getFetchFailures()).isEqualTo(1);
        assertThat(node(e.session().tree(), "https://shop.test/missing").isCompletelyExplored()).isTrue();
        assertThat(fetcher.fetched).extracting(URI::getPath).containsExactly("/", "/missing", "/ok");
    }

    @Test
    @DisplayName("AI 제공자 실패는 부분 결과와 함께 중단")
    void provider_failure_aborts_with_partial_report() {
        fetcher.page(ROOT, html("Home", "/p", "Pot", "/a", "A"))
               .page("https://shop.test/a", html("A", "/x", "X"));
        gateway.product("/p", 9.5, "Pot").score("/a", 5).failOnScoringCall(2);

        CrawlAbortedException ex = catchThrowableOfType(() -> engine(cfg()).run(), CrawlAbortedException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getPartialReport().pagesProcessed()).isEqualTo(2);
        assertThat(ex.getPartialReport().products()).extracting(ProductRecord::productName).containsExactly("Pot");
    }

    @Test
    void page_budget_limits_fetches() throws Exception {
        fetcher.page(ROOT, html("Home", "/1", "1"))
               .page("https://shop.test/1", html("1", "/2", "2"))
               .page("https://shop.test/2", html("2", "/3", "3"));
        gateway.defaultScore(5);

        CrawlReport report = engine(cfg().setMaxPages(2)).run();

        assertThat(report.pagesProcessed()).isEqualTo(2);
        assertThat(fetcher.fetched).hasSize(2);
        assertThat(sleeper.sleeps).hasSize(1);
    }

    @Test
    void runtime_budget_stops_the_loop() throws Exception {
        fetcher.page(ROOT, html("Home", "/1", "1"))
               .page("https://shop.test/1", html("1", "/2", "2"));
        gateway.defaultScore(5);
        ExplorationEngine e = new ExplorationEngine(cfg().setMaxRuntime(Duration.ofSeconds(1)), fetcher, gateway,
                () -> { throw new AssertionError("no browser"); },
                d -> clock.now = clock.now.plus(d), clock);

        CrawlReport report = e.run();

        assertThat(report.pagesProcessed()).isEqualTo(1);
    }

    @Test
    void progress_is_reported_per_page() throws Exception {
        fetcher.page(ROOT, html("Home", "/c", "C")).page("https://shop.test/c", html("C"));
        gateway.score("/c", 5);
        List<Long> done = new ArrayList<>();

        engine(cfg().setMaxPages(4)).run((p, phase, d, t) -> done.add(d));

        assertThat(done).containsExactly(0L, 1L, 2L);
    }

    @Test
    void product_name_falls_back_to_anchor_text_then_path() {
        LinkInfo withText = LinkInfo.candidate(URI.create("https://shop.test/p/1"), "/p/1", " Blue Mug ", "a");
        LinkInfo noText = LinkInfo.candidate(URI.create("https://shop.test/p/2"), "/p/2", "", "a");

        assertThat(ExplorationEngine.productName(withText.scored(9.5, "Mug"))).isEqualTo("Mug");
        assertThat(ExplorationEngine.productName(withText.scored(9.5, null))).isEqualTo("Blue Mug");
        assertThat(ExplorationEngine.productName(noText.scored(9.5, null))).isEqualTo("/p/2");
    }

    @Test
    void scored_link_keeps_name_only_above_product_threshold() {
        LinkInfo link = LinkInfo.candidate(URI.create("https://shop.test/p/1"), "/p/1", "Mug", "a");

        assertThat(link.isScored()).isFalse();
        LinkInfo high = link.scored(9.5, " Mug ");
        assertThat(high.isScored()).isTrue();
        assertThat(high.getScore()).isEqualTo(9.5);
        assertThat(high.getProductName()).isEqualTo("Mug");
        assertThat(link.scored(9.0, "Mug").getProductName()).isNull();
    }

    @Test
    void invalid_target_is_rejected_up_front() {
        assertThatThrownBy(() -> engine(CrawlConfig.defaults().setUrl("https:///nohost")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine(CrawlConfig.defaults().setUrl("ftp://shop.test/")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("상품이 나온 페이지에서 페이지네이션으로 드러난 링크도 같은 심사를 거친다")
    void dynamic_pagination_links_are_admitted_and_scored() throws Exception {
        String rootHtml = html("Home", "/p/widget", "Widget", "/list?page=2", "Next");
        fetcher.page(ROOT, rootHtml);
        gateway.product("/p/widget", 9.5, "Widget").score("/list?page=2", 5)
               .detection(new DynamicDetection(1, TriggerType.PAGINATION));
        FakeBrowserSession browser = new FakeBrowserSession(rootHtml, html("Page 2",
                "/p/n1", "1", "/p/n2", "2", "/p/n3", "3", "/p/n4", "4", "/p/n5", "5", "/p/n6", "6", "/p/n7", "7",
                "https://other.com/a", "x", "https://other.com/b", "y", "/", "Home"));

        ExplorationEngine e = new ExplorationEngine(cfg().setMaxPages(1).setEnableDynamicLoading(true),
                fetcher, gateway, () -> browser, sleeper, clock);
        e.run();
        e.close();

        assertThat(e.getStats().getDynamicLinksRevealed()).isEqualTo(10);
        assertThat(e.getStats().getDetectionCalls()).isEqualTo(1);
        assertThat(gateway.scoringBatches).hasSize(2);
        assertThat(gateway.scoringBatches.get(1)).hasSize(7)
                .extracting(LinkInfo::getId).containsExactly(0, 1, 2, 3, 4, 5, 6);
        assertThat(e.session().tree().size()).isEqualTo(1 + 2 + 7);
        assertThat(browser.closed).isTrue();
        assertThat(gateway.closed).isTrue();
    }

    @Test
    void dynamic_loading_is_off_by_default() throws Exception {
        fetcher.page(ROOT, html("Home", "/p/widget", "Widget"));
        gateway.product("/p/widget", 9.5, "Widget");

        engine(cfg()).run();

        assertThat(gateway.detectionBatches).isEmpty();
    }
}
