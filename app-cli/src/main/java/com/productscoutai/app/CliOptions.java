package com.productscoutai.app;

import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlConfig.AiProvider;

import java.nio.file.Path;

/**
 * 명령행 인자. 지정된 값만 설정 파일 위에 덮어쓴다.
 * <pre>
 * crawl [--config crawl.yml] [--url U] [--delay S] [--max-pages N] [--output P]
 *       [--dynamic] [--provider P] [--model M] [--verbose]
 * crawl --clean raw.json
 * </pre>
 */
final class CliOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: crawl [--config crawl.yml] [--url U] [--delay S] [--max-pages N] [--output P]",
            "             [--dynamic] [--provider anthropic|openai|google] [--model M] [--verbose]",
            "       crawl --clean RAW_RESULTS.json");

    Path config;
    String url;
    Double delaySeconds;
    Integer maxPages;
    Path output;
    boolean dynamic;
    AiProvider provider;
    String model;
    Path clean;
    boolean verbose;
    boolean help;

    /** @throws IllegalArgumentException 알 수 없는 옵션/값 누락/형식 오류 */
    static CliOptions parse(String... args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--config":    o.config = Path.of(value(args, ++i, a)); break;
                case "--url":       o.url = value(args, ++i, a); break;
                case "--delay":     o.delaySeconds = number(value(args, ++i, a), a); break;
                case "--max-pages": o.maxPages = integer(value(args, ++i, a), a); break;
                case "--output":    o.output = Path.of(value(args, ++i, a)); break;
                case "--dynamic":   o.dynamic = true; break;
                case "--provider":  o.provider = AiProvider.parse(value(args, ++i, a)); break;
                case "--model":     o.model = value(args, ++i, a); break;
                case "--clean":     o.clean = Path.of(value(args, ++i, a)); break;
                case "--verbose":
                case "-v":          o.verbose = true; break;
                case "--help":
                case "-h":          o.help = true; break;
                default: throw new IllegalArgumentException("unknown option: " + a);
            }
        }
        return o;
    }

    /** 지정된 값만 덮어쓴다 */
    CrawlConfig applyTo(CrawlConfig cfg) {
        if (url != null) cfg.setUrl(url);
        if (delaySeconds != null) cfg.setDelaySeconds(delaySeconds);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (output != null) cfg.setOutput(output);
        if (dynamic) cfg.setEnableDynamicLoading(true);
        if (provider != null) cfg.ai().setProvider(provider);
        if (model != null) cfg.ai().setModel(model);
        return cfg;
    }

    private static String value(String[] args, int i, String opt) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException(opt + " requires a value");
        }
        return args[i];
    }

    private static double number(String v, String opt) {
        try {
            double d = Double.parseDouble(v);
            if (d < 0 || Double.isNaN(d)) throw new IllegalArgumentException(opt + " must be >= 0: " + v);
            return d;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects a number: " + v, e);
        }
    }

    private static int integer(String v, String opt) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " expects an integer: " + v, e);
        }
    }
}
