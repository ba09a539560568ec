package com.productscoutai.core.http;

import com.productscoutai.core.api.FetchException;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.PageContent;
import com.productscoutai.core.support.RecordingSleeper;
import com.productscoutai.core.support.StubResponse;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPageFetcherTest {

    private static final URI PAGE = URI.create("https://shop.test/list");

    /** 지터 없는 고정 정책(최대 3회) */
    private static final RetryPolicy FIXED = new RetryPolicy() {
        @Override public boolean shouldRetry(int status, int attempt) {
            return DefaultRetryPolicy.isRetryableStatus(status) && attempt < 3;
        }
        @Override public Duration nextDelay(int attempt) { return Duration.ofMillis(250L << (attempt - 1)); }
        @Override public int maxAttempts() { return 3; }
    };

    private final CrawlConfig.FetchCfg cfg = CrawlConfig.defaults().fetch();
    private final RecordingSleeper sleeper = new RecordingSleeper();

    @Test
    void retryAfter_is_honored_on_429_then_page_is_parsed() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<HttpRequest> seen = new ArrayList<>();
        HttpSender sender = req -> {
            seen.add(req);
            if (calls.incrementAndGet() == 1) {
                return new StubResponse(429, Map.of("Retry-After", List.of("2")), "slow down", PAGE);
            }
            return StubResponse.html(PAGE, "<title>List</title><a href='/p/1'>One</a>");
        };

        PageContent page = new HttpPageFetcher(cfg, sender, FIXED, sleeper).fetch(PAGE);

        assertThat(calls.get()).isEqualTo(2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(2));
        assertThat(page.url()).isEqualTo(PAGE);
        assertThat(page.title()).isEqualTo("List");
        assertThat(page.links()).singleElement()
                .satisfies(l -> assertThat(l.getAbsoluteUrl()).isEqualTo(URI.create("https://shop.test/p/1")));
        assertThat(seen.get(0).headers().firstValue("User-Agent")).contains(cfg.getUserAgent());
    }

    @Test
    void network_errors_use_backoff_and_fail_after_max_attempts() {
        AtomicInteger calls = new AtomicInteger();
        HttpSender sender = req -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        };

        assertThatThrownBy(() -> new HttpPageFetcher(cfg, sender, FIXED, sleeper).fetch(PAGE))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("connection reset")
                .satisfies(e -> assertThat(((FetchException) e).getStatus()).isEqualTo(-1));
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(250), Duration.ofMillis(500));
    }

    @Test
    void not_found_is_not_retried() {
        AtomicInteger calls = new AtomicInteger();
        HttpSender sender = req -> {
            calls.incrementAndGet();
            return new StubResponse(404, Map.of(), "nope", PAGE);
        };

        assertThatThrownBy(() -> new HttpPageFetcher(cfg, sender, FIXED, sleeper).fetch(PAGE))
                .isInstanceOf(FetchException.class)
                .satisfies(e -> assertThat(((FetchException) e).getStatus()).isEqualTo(404));
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    void non_html_content_has_no_links() throws Exception {
        HttpSender sender = req -> new StubResponse(200,
                Map.of("Content-Type", List.of("application/pdf")), "<a href='/x'>x</a>", PAGE);

        PageContent page = new HttpPageFetcher(cfg, sender, FIXED, sleeper).fetch(PAGE);

        assertThat(page.links()).isEmpty();
    }

    @Test
    void interrupt_is_propagated_as_fetch_failure() {
        HttpSender sender = req -> { throw new InterruptedException("stop"); };

        try {
            assertThatThrownBy(() -> new HttpPageFetcher(cfg, sender, FIXED, sleeper).fetch(PAGE))
                    .isInstanceOf(FetchException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
