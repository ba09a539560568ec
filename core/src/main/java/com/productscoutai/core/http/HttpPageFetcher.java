package com.productscoutai.core.http;

import com.productscoutai.core.api.FetchException;
import com.productscoutai.core.api.IPageFetcher;
import com.productscoutai.core.crawler.JsoupPageParser;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.PageContent;
import com.productscoutai.core.util.DefaultSleeper;
import com.productscoutai.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * JDK HttpClient 기반 페이지 수집기.
 * 429/5xx/네트워크 오류는 RetryPolicy 대로 재시도(Retry-After 우선, 상한 30s).
 * HTML이 아니면 링크 없는 페이지로 취급.
 */
public class HttpPageFetcher implements IPageFetcher {
    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);
    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    private final CrawlConfig.FetchCfg cfg;
    private final HttpSender sender;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final JsoupPageParser parser = new JsoupPageParser();

    public HttpPageFetcher(CrawlConfig.FetchCfg cfg) {
        this(cfg, defaultSender(cfg), DefaultRetryPolicy.from(cfg), new DefaultSleeper());
    }

    /** 테스트용 생성자(송신 훅/정책/슬리퍼 주입) */
    public HttpPageFetcher(CrawlConfig.FetchCfg cfg, HttpSender sender, RetryPolicy policy, Sleeper sleeper) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    private static HttpSender defaultSender(CrawlConfig.FetchCfg cfg) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(cfg.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Override
    public PageContent fetch(URI url) throws FetchException {
        Objects.requireNonNull(url, "url");
        HttpRequest req = HttpRequest.newBuilder(url)
                .timeout(cfg.getTimeout())
                .header("User-Agent", cfg.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5")
                .GET()
                .build();

        int attempt = 1;
        while (true) {
            HttpResponse<String> resp = null;
            Exception error = null;
            try {
                resp = sender.send(req);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new FetchException(url, "interrupted", ie);
            } catch (Exception e) {
                error = e;
            }
            int status = (resp == null) ? -1 : resp.statusCode();

            if (resp != null && status >= 200 && status < 300) {
                return toPage(url, resp);
            }
            if (!policy.shouldRetry(status, attempt)) {
                if (error != null) {
                    throw new FetchException(url, "fetch failed after " + attempt + " attempt(s): " + error.getMessage(), error);
                }
                throw new FetchException(url, status, "HTTP " + status + " after " + attempt + " attempt(s)");
            }

            Duration delay = resolveRetryAfterOr(policy.nextDelay(attempt), resp == null ? null : resp.headers());
            LOG.debug("retry {} attempt={} status={} delay={}ms", url, attempt, status, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new FetchException(url, "interrupted", ie);
            }
            attempt++;
        }
    }

    private PageContent toPage(URI requested, HttpResponse<String> resp) {
        URI finalUrl = resp.uri() != null ? resp.uri() : requested;
        String ct = resp.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        String body = resp.body() == null ? "" : resp.body();
        if (!ct.isEmpty() && !ct.contains("html")) {
            LOG.debug("non-HTML content at {} ({}), no links", requested, ct);
            return PageContent.empty(requested);
        }
        PageContent parsed = parser.parse(body, finalUrl);
        return new PageContent(requested, parsed.title(), parsed.description(), parsed.links());
    }

    /** Retry-After(초) 존중, 상한 30초. HTTP-date 형태는 fallback */
    static Duration resolveRetryAfterOr(Duration fallback, HttpHeaders headers) {
        if (headers == null) return fallback;
        String v = headers.firstValue("Retry-After").orElse(null);
        if (v == null || v.isBlank()) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return fallback;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : d;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
