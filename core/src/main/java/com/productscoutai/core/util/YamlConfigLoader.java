package com.productscoutai.core.util;

import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlConfig.AiProvider;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 * 키는 snake_case / camelCase 모두 허용 (max_pages == maxPages).
 *
 * 예상 YAML 키:
 * url: "https://shop.example.com"
 * delay: 1.0                 # 초
 * max_pages: 50
 * max_runtime_seconds: 0     # 0 = 무제한
 * output: "out/result.json"
 * output_dir: "out"
 * enable_dynamic_loading: false
 * ai_provider: anthropic     # anthropic | openai | google
 * ai_model: claude-sonnet-4-20250514
 *
 * fetch:
 *   timeoutMs: 10000
 *   maxAttempts: 3
 *   backoffBaseMs: 250
 *   userAgent: "ProductScoutAI/0.1 (+crawler)"
 * ai:
 *   apiKey: ...              # 없으면 환경변수
 *   timeoutMs: 60000
 *   maxTokens: 4000
 *   temperature: 0.1
 *   maxBatchSize: 100
 *   parseRetries: 2
 *   requestsPerMinute: 50
 * dynamic:
 *   waitTimeoutMs: 10000
 *   pollIntervalMs: 250
 *   scrollPauseMs: 2000
 *   navigationTimeoutMs: 30000
 *   maxPaginationPages: 10
 *   maxLoadMoreClicks: 20
 *   maxScrolls: 10
 *   maxToggles: 30
 *   contentSelector: "body"
 *   headless: true
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    /** 읽기 + validate() */
    public static CrawlConfig load(Path yamlPath) throws IOException {
        CrawlConfig cfg = read(yamlPath);
        cfg.validate();
        return cfg;
    }

    /** 읽기만(검증 없음). CLI 덮어쓰기 후 호출자가 validate() 한다. */
    public static CrawlConfig read(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    static CrawlConfig fromStream(InputStream in) throws IOException {
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (RuntimeException e) {
            throw new IOException("invalid YAML: " + e.getMessage(), e);
        }

        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }
        try {
            apply(cfg, map);
        } catch (NumberFormatException e) {
            throw new IOException("invalid number in config: " + e.getMessage(), e);
        }
        return cfg;
    }

    private static void apply(CrawlConfig cfg, Map<?, ?> map) {
        // 1) 평면 키
        setString(map, "url", cfg::setUrl);
        setDouble(map, "delay", cfg::setDelaySeconds);
        setInt(map, "max_pages", cfg::setMaxPages);
        setLong(map, "max_runtime_seconds", s -> cfg.setMaxRuntime(Duration.ofSeconds(Math.max(0, s))));
        setString(map, "output", s -> cfg.setOutput(Path.of(s)));
        setString(map, "output_dir", s -> cfg.setOutputDir(Path.of(s)));
        setBoolean(map, "enable_dynamic_loading", cfg::setEnableDynamicLoading);
        setString(map, "ai_provider", s -> cfg.ai().setProvider(AiProvider.parse(s)));
        setString(map, "ai_model", s -> cfg.ai().setModel(s));

        // 2) fetch.*
        Map<?, ?> fetch = getMap(map, "fetch");
        if (fetch != null) {
            var f = cfg.fetch();
            setLong(fetch, "timeout_ms", ms -> { if (ms > 0) f.setTimeout(Duration.ofMillis(ms)); });
            setInt(fetch, "max_attempts", f::setMaxAttempts);
            setLong(fetch, "backoff_base_ms", f::setBackoffBaseMs);
            setString(fetch, "user_agent", f::setUserAgent);
        }

        // 3) ai.*
        Map<?, ?> ai = getMap(map, "ai");
        if (ai != null) {
            var a = cfg.ai();
            setString(ai, "provider", s -> a.setProvider(AiProvider.parse(s)));
            setString(ai, "model", a::setModel);
            setString(ai, "api_key", a::setApiKey);
            setString(ai, "base_url", a::setBaseUrl);
            setLong(ai, "timeout_ms", ms -> { if (ms > 0) a.setTimeout(Duration.ofMillis(ms)); });
            setInt(ai, "max_tokens", a::setMaxTokens);
            setDouble(ai, "temperature", a::setTemperature);
            setInt(ai, "max_batch_size", a::setMaxBatchSize);
            setInt(ai, "parse_retries", a::setParseRetries);
            setInt(ai, "requests_per_minute", a::setRequestsPerMinute);
        }

        // 4) dynamic.*
        Map<?, ?> dyn = getMap(map, "dynamic");
        if (dyn != null) {
            var d = cfg.dynamic();
            setLong(dyn, "wait_timeout_ms", ms -> { if (ms > 0) d.setWaitTimeout(Duration.ofMillis(ms)); });
            setLong(dyn, "poll_interval_ms", ms -> { if (ms > 0) d.setPollInterval(Duration.ofMillis(ms)); });
            setLong(dyn, "scroll_pause_ms", ms -> d.setScrollPause(Duration.ofMillis(Math.max(0, ms))));
            setLong(dyn, "navigation_timeout_ms", ms -> { if (ms > 0) d.setNavigationTimeout(Duration.ofMillis(ms)); });
            setInt(dyn, "max_pagination_pages", d::setMaxPaginationPages);
            setInt(dyn, "max_load_more_clicks", d::setMaxLoadMoreClicks);
            setInt(dyn, "max_scrolls", d::setMaxScrolls);
            setInt(dyn, "max_toggles", d::setMaxToggles);
            setString(dyn, "content_selector", d::setContentSelector);
            setString(dyn, "loading_selector", d::setLoadingSelector);
            setString(dyn, "accordion_selector", d::setAccordionSelector);
            setString(dyn, "expander_selector", d::setExpanderSelector);
            setBoolean(dyn, "headless", d::setHeadless);
        }
    }

    // ------------ helpers ------------

    /** max_pages / maxPages / MAX-PAGES 를 같은 키로 본다 */
    static String canonicalKey(String key) {
        return key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    private static Object lookup(Map<?, ?> map, String key) {
        String want = canonicalKey(key);
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (e.getKey() != null && canonicalKey(String.valueOf(e.getKey())).equals(want)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = lookup(map, key);
        if (v instanceof Map<?, ?> m) return m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = lookup(map, key);
        if (v != null) setter.accept(String.valueOf(v).trim());
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = lookup(map, key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = lookup(map, key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = lookup(map, key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = lookup(map, key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }
}
