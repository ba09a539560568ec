package com.productscoutai.app;

import com.productscoutai.app.logging.LogSetup;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlReport;
import com.productscoutai.core.service.CrawlAbortedException;
import com.productscoutai.core.service.ExplorationEngine;
import com.productscoutai.core.service.ProductDeduplicator;
import com.productscoutai.core.service.export.JsonResultExporter;
import com.productscoutai.core.util.ProgressListener;
import com.productscoutai.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * 명령행 진입점.
 * 종료 코드: 0 성공, 1 크롤 중 치명 오류(AI 제공자 실패 등), 2 설정/사용법 오류(크롤 전 거부)
 */
public final class CrawlerMain {
    private static final Logger LOG = LoggerFactory.getLogger(CrawlerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_CONFIG = 2;

    private final Function<CrawlConfig, ExplorationEngine> engineFactory;
    private final JsonResultExporter exporter = new JsonResultExporter();
    private final ProductDeduplicator deduplicator = new ProductDeduplicator();
    private final PrintStream out;
    private final PrintStream err;

    CrawlerMain(Function<CrawlConfig, ExplorationEngine> engineFactory, PrintStream out, PrintStream err) {
        this.engineFactory = engineFactory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        LogSetup.configure(Path.of("out"));
        int code = new CrawlerMain(ExplorationEngine::new, System.out, System.err).run(args);
        System.exit(code);
    }

    int run(String... args) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_CONFIG;
        }
        if (opts.help) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }
        if (opts.verbose) LogSetup.setLevel(Level.FINE);
        if (opts.clean != null) return clean(opts.clean);

        CrawlConfig cfg;
        try {
            cfg = loadConfig(opts);
            cfg.validate();
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            err.println("configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }
        LOG.info("config: {}", cfg);

        ExplorationEngine engine;
        try {
            engine = engineFactory.apply(cfg);
        } catch (IllegalArgumentException | NullPointerException e) {
            err.println("configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        try (engine) {
            CrawlReport raw = engine.run(progress());
            CrawlReport cleaned = deduplicator.clean(raw);
            JsonResultExporter.Written w = exporter.export(raw, cleaned, cfg.getOutput(), cfg.getOutputDir());
            out.printf("found %d product(s) (%d after cleaning) in %d page(s)%n",
                    raw.products().size(), cleaned.products().size(), raw.pagesProcessed());
            out.println("raw:     " + w.raw());
            out.println("cleaned: " + w.cleaned());
            return EXIT_OK;
        } catch (CrawlAbortedException e) {
            err.println("crawl aborted: " + e.getMessage());
            writePartial(e.getPartialReport(), cfg);
            return EXIT_FATAL;
        } catch (IOException e) {
            LOG.error("failed to write results", e);
            err.println("failed to write results: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    /** --clean: 기존 raw 결과 파일만 정리 */
    private int clean(Path rawFile) {
        try {
            CrawlReport raw = exporter.read(rawFile);
            CrawlReport cleaned = deduplicator.clean(raw);
            Path target = exporter.write(cleaned, JsonResultExporter.cleanedPath(rawFile));
            out.printf("%d -> %d product(s): %s%n", raw.products().size(), cleaned.products().size(), target);
            return EXIT_OK;
        } catch (IOException e) {
            err.println("cannot clean " + rawFile + ": " + e.getMessage());
            return EXIT_CONFIG;
        }
    }

    private void writePartial(CrawlReport partial, CrawlConfig cfg) {
        if (partial == null || partial.pagesProcessed() == 0) return;
        Path rawPath = cfg.getOutput() != null
                ? cfg.getOutput()
                : JsonResultExporter.defaultRawPath(cfg.getOutputDir(), partial.domain());
        try {
            exporter.write(partial, rawPath);
            err.println("partial raw results: " + rawPath);
        } catch (IOException e) {
            LOG.error("failed to write partial results to {}", rawPath, e);
        }
    }

    /** --config → ./crawl.yml → 기본값 순 */
    static CrawlConfig loadConfig(CliOptions opts) throws IOException {
        CrawlConfig cfg;
        if (opts.config != null) {
            cfg = YamlConfigLoader.read(opts.config);
        } else if (Files.exists(Path.of("crawl.yml"))) {
            cfg = YamlConfigLoader.read(Path.of("crawl.yml"));
        } else {
            cfg = CrawlConfig.defaults();
        }
        return opts.applyTo(cfg);
    }

    private ProgressListener progress() {
        return (p, phase, done, total) -> LOG.debug("[{}] {}/{} ({}%)", phase, done, total, Math.round(p * 100));
    }
}
