package com.productscoutai.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * CLI 인자는 YAML 로드 이후 같은 fluent setter로 덮어쓴다.
 */
public final class CrawlConfig {

    /** AI 제공자. 크롤 도중 교체하지 않는다. */
    public enum AiProvider {
        ANTHROPIC("claude-sonnet-4-20250514"),
        OPENAI("gpt-3.5-turbo"),
        GOOGLE("gemini-pro");

        private final String defaultModel;

        AiProvider(String defaultModel) { this.defaultModel = defaultModel; }

        public String defaultModel() { return defaultModel; }

        /** "anthropic" / "claude" / "openai" / "gpt" / "google" / "gemini" 허용 */
        public static AiProvider parse(String raw) {
            String s = Objects.requireNonNull(raw, "provider").trim().toLowerCase(Locale.ROOT);
            switch (s) {
                case "anthropic": case "claude": return ANTHROPIC;
                case "openai": case "gpt": case "chatgpt": return OPENAI;
                case "google": case "gemini": return GOOGLE;
                default: throw new IllegalArgumentException("unknown ai provider: " + raw);
            }
        }
    }

    /** 전송 계층(fetch.*) */
    public static final class FetchCfg {
        private Duration timeout = Duration.ofSeconds(10);
        private int maxAttempts = 3;
        private long backoffBaseMs = 250;
        private String userAgent = "ProductScoutAI/0.1 (+crawler)";

        public Duration getTimeout() { return timeout; }
        public FetchCfg setTimeout(Duration v) { this.timeout = v; return this; }

        public int getMaxAttempts() { return maxAttempts; }
        public FetchCfg setMaxAttempts(int v) { this.maxAttempts = Math.max(1, v); return this; }

        public long getBackoffBaseMs() { return backoffBaseMs; }
        public FetchCfg setBackoffBaseMs(long v) { this.backoffBaseMs = Math.max(0, v); return this; }

        public String getUserAgent() { return userAgent; }
        public FetchCfg setUserAgent(String v) { if (v != null && !v.isBlank()) this.userAgent = v.trim(); return this; }
    }

    /** AI 채널(ai.*) */
    public static final class AiCfg {
        private AiProvider provider = AiProvider.ANTHROPIC;
        private String model;                     // null이면 provider 기본값
        private String apiKey;                    // null이면 환경변수
        private Duration timeout = Duration.ofSeconds(60);
        private int maxTokens = 4000;
        private double temperature = 0.1;
        private int maxBatchSize = 100;
        private int parseRetries = 2;
        private int requestsPerMinute = 50;       // 0 = 무제한
        private String baseUrl;                   // 테스트/프록시용 엔드포인트 덮어쓰기

        public AiProvider getProvider() { return provider; }
        public AiCfg setProvider(AiProvider v) { this.provider = (v != null ? v : AiProvider.ANTHROPIC); return this; }

        /** 설정 모델, 없으면 provider 기본 모델 */
        public String getModel() { return (model == null || model.isBlank()) ? provider.defaultModel() : model; }
        public AiCfg setModel(String v) { this.model = v; return this; }

        public String getApiKey() { return apiKey; }
        public AiCfg setApiKey(String v) { this.apiKey = v; return this; }

        public Duration getTimeout() { return timeout; }
        public AiCfg setTimeout(Duration v) { this.timeout = v; return this; }

        public int getMaxTokens() { return maxTokens; }
        public AiCfg setMaxTokens(int v) { this.maxTokens = Math.max(1, v); return this; }

        public double getTemperature() { return temperature; }
        public AiCfg setTemperature(double v) { this.temperature = v; return this; }

        public int getMaxBatchSize() { return maxBatchSize; }
        public AiCfg setMaxBatchSize(int v) { this.maxBatchSize = Math.max(1, v); return this; }

        public int getParseRetries() { return parseRetries; }
        public AiCfg setParseRetries(int v) { this.parseRetries = Math.max(0, v); return this; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public AiCfg setRequestsPerMinute(int v) { this.requestsPerMinute = Math.max(0, v); return this; }

        public String getBaseUrl() { return baseUrl; }
        public AiCfg setBaseUrl(String v) { this.baseUrl = v; return this; }
    }

    /** 브라우저 자동화(dynamic.*) */
    public static final class DynamicCfg {
        private Duration waitTimeout = Duration.ofSeconds(10);
        private Duration pollInterval = Duration.ofMillis(250);
        private Duration scrollPause = Duration.ofMillis(2000);
        private Duration navigationTimeout = Duration.ofSeconds(30);
        private int maxPaginationPages = 10;
        private int maxLoadMoreClicks = 20;
        private int maxScrolls = 10;
        private int maxToggles = 30;
        private String contentSelector = "body";
        private String loadingSelector = ".loading, .spinner, [aria-busy=true]";
        private String accordionSelector = "[aria-controls][aria-expanded]";
        private String expanderSelector = "button[aria-expanded], a[aria-expanded]";
        private boolean headless = true;

        public Duration getWaitTimeout() { return waitTimeout; }
        public DynamicCfg setWaitTimeout(Duration v) { this.waitTimeout = v; return this; }

        public Duration getPollInterval() { return pollInterval; }
        public DynamicCfg setPollInterval(Duration v) { this.pollInterval = v; return this; }

        public Duration getScrollPause() { return scrollPause; }
        public DynamicCfg setScrollPause(Duration v) { this.scrollPause = v; return this; }

        public Duration getNavigationTimeout() { return navigationTimeout; }
        public DynamicCfg setNavigationTimeout(Duration v) { this.navigationTimeout = v; return this; }

        public int getMaxPaginationPages() { return maxPaginationPages; }
        public DynamicCfg setMaxPaginationPages(int v) { this.maxPaginationPages = Math.max(0, v); return this; }

        public int getMaxLoadMoreClicks() { return maxLoadMoreClicks; }
        public DynamicCfg setMaxLoadMoreClicks(int v) { this.maxLoadMoreClicks = Math.max(0, v); return this; }

        public int getMaxScrolls() { return maxScrolls; }
        public DynamicCfg setMaxScrolls(int v) { this.maxScrolls = Math.max(0, v); return this; }

        public int getMaxToggles() { return maxToggles; }
        public DynamicCfg setMaxToggles(int v) { this.maxToggles = Math.max(0, v); return this; }

        public String getContentSelector() { return contentSelector; }
        public DynamicCfg setContentSelector(String v) { if (v != null && !v.isBlank()) this.contentSelector = v; return this; }

        public String getLoadingSelector() { return loadingSelector; }
        public DynamicCfg setLoadingSelector(String v) { if (v != null && !v.isBlank()) this.loadingSelector = v; return this; }

        public String getAccordionSelector() { return accordionSelector; }
        public DynamicCfg setAccordionSelector(String v) { if (v != null && !v.isBlank()) this.accordionSelector = v; return this; }

        public String getExpanderSelector() { return expanderSelector; }
        public DynamicCfg setExpanderSelector(String v) { if (v != null && !v.isBlank()) this.expanderSelector = v; return this; }

        public boolean isHeadless() { return headless; }
        public DynamicCfg setHeadless(boolean v) { this.headless = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String url;                          // 시작 URL (필수)
    private Duration delay = Duration.ofSeconds(1);
    private int maxPages = 50;
    private Duration maxRuntime = Duration.ZERO; // 0 = 무제한
    private Path output;                          // null이면 out/ai_crawl_results_<domain>.json
    private Path outputDir = Path.of("out");
    private boolean enableDynamicLoading = false;

    private final FetchCfg fetch = new FetchCfg();
    private final AiCfg ai = new AiCfg();
    private final DynamicCfg dynamic = new DynamicCfg();

    // ---------- getters ----------
    public String getUrl() { return url; }
    public Duration getDelay() { return delay; }
    public int getMaxPages() { return maxPages; }
    public Duration getMaxRuntime() { return maxRuntime; }
    public Path getOutput() { return output; }
    public Path getOutputDir() { return outputDir; }
    public boolean isEnableDynamicLoading() { return enableDynamicLoading; }
    public FetchCfg fetch() { return fetch; }
    public AiCfg ai() { return ai; }
    public DynamicCfg dynamic() { return dynamic; }

    // ---------- fluent setters ----------
    public CrawlConfig setUrl(String url) { this.url = url; return this; }
    public CrawlConfig setDelay(Duration delay) { this.delay = delay; return this; }

    /** 초 단위(소수 허용) */
    public CrawlConfig setDelaySeconds(double seconds) {
        this.delay = Duration.ofMillis(Math.round(seconds * 1000.0));
        return this;
    }

    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setMaxRuntime(Duration v) { this.maxRuntime = (v != null ? v : Duration.ZERO); return this; }
    public CrawlConfig setOutput(Path output) { this.output = output; return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setEnableDynamicLoading(boolean v) { this.enableDynamicLoading = v; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(url, "url");
        if (url.isBlank()) throw new IllegalArgumentException("url must not be blank");
        String lower = url.trim().toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new IllegalArgumentException("url must be http(s): " + url);
        }
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (maxRuntime.isNegative()) throw new IllegalArgumentException("maxRuntime must be >= 0");
        Objects.requireNonNull(outputDir, "outputDir");

        Objects.requireNonNull(fetch.getTimeout(), "fetch.timeout");
        if (fetch.getTimeout().isZero() || fetch.getTimeout().isNegative()) {
            throw new IllegalArgumentException("fetch.timeout must be > 0");
        }
        Objects.requireNonNull(ai.getTimeout(), "ai.timeout");
        if (ai.getTimeout().isZero() || ai.getTimeout().isNegative()) {
            throw new IllegalArgumentException("ai.timeout must be > 0");
        }
        if (ai.getTemperature() < 0 || ai.getTemperature() > 2) {
            throw new IllegalArgumentException("ai.temperature must be in [0,2]");
        }
        Objects.requireNonNull(dynamic.getWaitTimeout(), "dynamic.waitTimeout");
        Objects.requireNonNull(dynamic.getPollInterval(), "dynamic.pollInterval");
        Objects.requireNonNull(dynamic.getScrollPause(), "dynamic.scrollPause");
        if (dynamic.getPollInterval().isNegative() || dynamic.getPollInterval().isZero()) {
            throw new IllegalArgumentException("dynamic.pollInterval must be > 0");
        }
    }

    // ---------- defaults ----------
    public static CrawlConfig defaults() {
        return new CrawlConfig();
    }

    @Override
    public String toString() {
        return "CrawlConfig{" +
                "url='" + url + '\'' +
                ", delay=" + delay +
                ", maxPages=" + maxPages +
                ", maxRuntime=" + maxRuntime +
                ", output=" + output +
                ", dynamic=" + enableDynamicLoading +
                ", provider=" + ai.getProvider() +
                ", model=" + ai.getModel() +
                '}';
    }
}
