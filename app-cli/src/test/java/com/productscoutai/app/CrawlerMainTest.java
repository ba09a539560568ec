package com.productscoutai.app;

import com.productscoutai.core.ai.AiProviderException;
import com.productscoutai.core.api.FetchException;
import com.productscoutai.core.api.IPageFetcher;
import com.productscoutai.core.api.IScoringGateway;
import com.productscoutai.core.crawler.JsoupPageParser;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlReport;
import com.productscoutai.core.model.DynamicDetection;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.LinkScore;
import com.productscoutai.core.model.NodeContext;
import com.productscoutai.core.service.ExplorationEngine;
import com.productscoutai.core.service.export.JsonResultExporter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class CrawlerMainTest {

    @TempDir Path tmp;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private static final Map<String, String> SITE = Map.of(
            "https://shop.test/", "<a href='/p/mug?utm_source=x'>Mug</a><a href='/p/mug/'>Mug again</a><a href='/c'>Cat</a>",
            "https://shop.test/c", "<a href='/p/cup'>Cup</a>");

    /** 상대 경로가 /p/ 로 시작하면 상품, 그 외 5점 */
    static final class PathGateway implements IScoringGateway {
        final boolean failing;
        PathGateway(boolean failing) { this.failing = failing; }

        @Override
        public List<LinkScore> scoreLinks(NodeContext page, List<LinkInfo> candidates) {
            if (failing && !page.url().getPath().equals("/")) throw new AiProviderException("quota exceeded", 429, null);
            List<LinkScore> out = new ArrayList<>();
            for (LinkInfo li : candidates) {
                boolean product = li.getRelativePath().startsWith("/p/");
                out.add(new LinkScore(li.getId(), product ? 9.8 : 5, product ? li.getAnchorText() : null));
            }
            return out;
        }

        @Override
        public DynamicDetection detectDynamicLoading(NodeContext page, List<LinkInfo> candidates) {
            return DynamicDetection.none();
        }
    }

    private Function<CrawlConfig, ExplorationEngine> fakeEngines(boolean failing) {
        JsoupPageParser parser = new JsoupPageParser();
        IPageFetcher fetcher = url -> {
            String html = SITE.get(url.toString());
            if (html == null) throw new FetchException(url, 404, "HTTP 404");
            return parser.parse(html, url);
        };
        return cfg -> new ExplorationEngine(cfg, fetcher, new PathGateway(failing),
                () -> { throw new AssertionError("no browser"); }, d -> { }, Clock.systemUTC());
    }

    private CrawlerMain main(Function<CrawlConfig, ExplorationEngine> engines) {
        return new CrawlerMain(engines,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void help_prints_usage() {
        assertThat(main(fakeEngines(false)).run("--help")).isEqualTo(CrawlerMain.EXIT_OK);
        assertThat(out()).contains("usage: crawl");
    }

    @Test
    void usage_errors_exit_2_before_crawling() {
        assertThat(main(fakeEngines(false)).run("--bogus")).isEqualTo(CrawlerMain.EXIT_CONFIG);
        assertThat(err()).contains("unknown option", "usage:");
    }

    @Test
    void missing_url_is_a_configuration_error() throws Exception {
        Path empty = Files.writeString(tmp.resolve("crawl.yml"), "max_pages: 5\n");
        assertThat(main(fakeEngines(false)).run("--config", empty.toString())).isEqualTo(CrawlerMain.EXIT_CONFIG);
        assertThat(err()).contains("configuration error");
    }

    @Test
    void crawl_writes_raw_and_cleaned_results() throws Exception {
        Path output = tmp.resolve("results.json");

        int code = main(fakeEngines(false)).run("--url", "https://shop.test/", "--delay", "0",
                "--output", output.toString());

        assertThat(code).isEqualTo(CrawlerMain.EXIT_OK);
        JsonResultExporter io = new JsonResultExporter();
        CrawlReport raw = io.read(output);
        CrawlReport cleaned = io.read(tmp.resolve("results_cleaned.json"));
        assertThat(raw.products()).hasSize(3);
        assertThat(cleaned.products()).extracting(p -> p.url())
                .containsExactly("https://shop.test/p/mug", "https://shop.test/p/cup");
        assertThat(raw.pagesProcessed()).isEqualTo(2);
        assertThat(out()).contains("found 3 product(s) (2 after cleaning) in 2 page(s)");
    }

    @Test
    void provider_failure_exits_1_and_keeps_partial_results() throws Exception {
        Path output = tmp.resolve("partial.json");

        int code = main(fakeEngines(true)).run("--url", "https://shop.test/", "--output", output.toString());

        assertThat(code).isEqualTo(CrawlerMain.EXIT_FATAL);
        assertThat(err()).contains("crawl aborted");
        CrawlReport partial = new JsonResultExporter().read(output);
        assertThat(partial.pagesProcessed()).isEqualTo(2);
        assertThat(partial.products()).hasSize(2);
    }

    @Test
    void clean_mode_rewrites_an_existing_raw_file() throws Exception {
        Path raw = tmp.resolve("ai_crawl_results_shop_test.json");
        Files.writeString(raw, "{\"products\":["
                + "{\"productName\":\"Mug\",\"url\":\"https://shop.test/p/mug\"},"
                + "{\"productName\":\"Mug\",\"url\":\"https://shop.test/p/mug/?gclid=1\"}],"
                + "\"pages_processed\":4,\"total_nodes\":9,\"base_url\":\"https://shop.test/\",\"domain\":\"shop.test\"}");

        assertThat(main(fakeEngines(false)).run("--clean", raw.toString())).isEqualTo(CrawlerMain.EXIT_OK);

        CrawlReport cleaned = new JsonResultExporter().read(tmp.resolve("ai_crawl_results_shop_test_cleaned.json"));
        assertThat(cleaned.products()).hasSize(1);
        assertThat(cleaned.totalNodes()).isEqualTo(9);
        assertThat(out()).contains("2 -> 1 product(s)");
    }

    @Test
    void clean_mode_with_missing_file_exits_2() {
        assertThat(main(fakeEngines(false)).run("--clean", tmp.resolve("nope.json").toString()))
                .isEqualTo(CrawlerMain.EXIT_CONFIG);
        assertThat(err()).contains("cannot clean");
    }
}
