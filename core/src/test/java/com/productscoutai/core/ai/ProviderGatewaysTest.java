package com.productscoutai.core.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productscoutai.core.http.HttpSender;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlConfig.AiProvider;
import com.productscoutai.core.model.DynamicDetection;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.LinkScore;
import com.productscoutai.core.model.NodeContext;
import com.productscoutai.core.model.TriggerType;
import com.productscoutai.core.support.RecordingSleeper;
import com.productscoutai.core.support.StubResponse;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderGatewaysTest {

    private static final ObjectMapper M = new ObjectMapper();
    private static final NodeContext PAGE = new NodeContext(URI.create("https://shop.test/"), "Shop", "Garden tools");

    /** 요청을 기록하고 준비된 응답을 순서대로 돌려주는 송신 훅 */
    static final class ScriptedSender implements HttpSender {
        final List<HttpRequest> requests = new ArrayList<>();
        final Deque<StubResponse> replies = new ArrayDeque<>();

        ScriptedSender reply(int status, String body) {
            replies.add(StubResponse.json(status, body));
            return this;
        }

        @Override public StubResponse send(HttpRequest req) {
            requests.add(req);
            if (replies.isEmpty()) throw new AssertionError("unexpected request #" + requests.size());
            return replies.poll();
        }
    }

    private static List<LinkInfo> links(int n) {
        List<LinkInfo> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            URI u = URI.create("https://shop.test/p/" + i);
            out.add(LinkInfo.candidate(u, "/p/" + i, "Item " + i, "li > a").withId(i));
        }
        return out;
    }

    private static String anthropic(String text) {
        ObjectNode root = M.createObjectNode();
        root.putArray("content").addObject().put("type", "text").put("text", text);
        return root.toString();
    }

    private static String openai(String text) {
        ObjectNode root = M.createObjectNode();
        root.putArray("choices").addObject().putObject("message").put("role", "assistant").put("content", text);
        return root.toString();
    }

    private static String google(String text) {
        ObjectNode root = M.createObjectNode();
        root.putArray("candidates").addObject().putObject("content").putArray("parts").addObject().put("text", text);
        return root.toString();
    }

    /** 요청 본문(BodyPublisher)을 문자열로 읽는다 */
    private static JsonNode body(HttpRequest req) throws Exception {
        CompletableFuture<String> done = new CompletableFuture<>();
        StringBuilder sb = new StringBuilder();
        req.bodyPublisher().orElseThrow().subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override public void onSubscribe(Flow.Subscription s) { s.request(Long.MAX_VALUE); }
            @Override public void onNext(ByteBuffer item) { sb.append(StandardCharsets.UTF_8.decode(item)); }
            @Override public void onError(Throwable t) { done.completeExceptionally(t); }
            @Override public void onComplete() { done.complete(sb.toString()); }
        });
        return M.readTree(done.get(5, TimeUnit.SECONDS));
    }

    private static CrawlConfig.AiCfg cfg(AiProvider p) {
        return CrawlConfig.defaults().ai().setProvider(p);
    }

    @Test
    void anthropic_sends_messages_request_and_reads_first_content_text() throws Exception {
        ScriptedSender sender = new ScriptedSender()
                .reply(200, anthropic("[{\"id\":0,\"score\":9.6,\"productName\":\"Rake\"},{\"id\":1,\"score\":2}]"));
        var gw = new AnthropicScoringGateway(cfg(AiProvider.ANTHROPIC), "k-1", sender, new RecordingSleeper());

        List<LinkScore> scores = gw.scoreLinks(PAGE, links(2));

        assertThat(scores).extracting(LinkScore::score).containsExactly(9.6, 2.0);
        assertThat(scores.get(0).productName()).isEqualTo("Rake");

        HttpRequest req = sender.requests.get(0);
        assertThat(req.uri()).isEqualTo(URI.create(AnthropicScoringGateway.DEFAULT_ENDPOINT));
        assertThat(req.headers().firstValue("x-api-key")).contains("k-1");
        assertThat(req.headers().firstValue("anthropic-version")).contains("2023-06-01");
        JsonNode b = body(req);
        assertThat(b.get("model").asText()).isEqualTo("claude-sonnet-4-20250514");
        assertThat(b.get("max_tokens").asInt()).isEqualTo(4000);
        assertThat(b.get("system").asText()).isEqualTo(PromptTemplates.SYSTEM_PERSONA);
        String user = b.path("messages").path(0).path("content").asText();
        assertThat(user).contains("Current page: https://shop.test/", "\"relative_path\" : \"/p/1\"", "Item 0");
        assertThat(user).doesNotContain("tag_context");
    }

    @Test
    void openai_uses_bearer_auth_and_reads_choice_content() throws Exception {
        ScriptedSender sender = new ScriptedSender()
                .reply(200, openai("{\"id\": 1, \"triggerType\": \"LoadMore\"}"));
        var gw = new OpenAiScoringGateway(cfg(AiProvider.OPENAI), "k-2", sender, new RecordingSleeper());

        DynamicDetection d = gw.detectDynamicLoading(PAGE, links(3));

        assertThat(d).isEqualTo(new DynamicDetection(1, TriggerType.LOAD_MORE));
        HttpRequest req = sender.requests.get(0);
        assertThat(req.headers().firstValue("Authorization")).contains("Bearer k-2");
        JsonNode b = body(req);
        assertThat(b.get("model").asText()).isEqualTo("gpt-3.5-turbo");
        assertThat(b.path("messages").path(0).path("role").asText()).isEqualTo("system");
        assertThat(b.path("messages").path(1).path("content").asText()).contains("tag_context");
    }

    @Test
    void google_puts_model_in_path_and_reads_candidate_part() throws Exception {
        ScriptedSender sender = new ScriptedSender().reply(200, google("[{\"id\":0,\"score\":5}]"));
        CrawlConfig.AiCfg c = cfg(AiProvider.GOOGLE).setModel("gemini-1.5-flash");
        var gw = new GoogleScoringGateway(c, "k-3", sender, new RecordingSleeper());

        assertThat(gw.scoreLinks(PAGE, links(1))).extracting(LinkScore::score).containsExactly(5.0);

        HttpRequest req = sender.requests.get(0);
        assertThat(req.uri().toString())
                .isEqualTo("https://generativelanguage.googleapis.com/v1beta/models/gemini-1.5-flash:generateContent");
        assertThat(req.headers().firstValue("x-goog-api-key")).contains("k-3");
        JsonNode b = body(req);
        assertThat(b.path("systemInstruction").path("parts").path(0).path("text").asText())
                .isEqualTo(PromptTemplates.SYSTEM_PERSONA);
        assertThat(b.path("generationConfig").path("maxOutputTokens").asInt()).isEqualTo(4000);
    }

    @Test
    void base_url_override_is_used() {
        ScriptedSender sender = new ScriptedSender().reply(200, anthropic("[{\"id\":0,\"score\":1}]"));
        CrawlConfig.AiCfg c = cfg(AiProvider.ANTHROPIC).setBaseUrl("http://localhost:8089/v1/messages");

        new AnthropicScoringGateway(c, "k", sender, new RecordingSleeper()).scoreLinks(PAGE, links(1));

        assertThat(sender.requests.get(0).uri()).isEqualTo(URI.create("http://localhost:8089/v1/messages"));
    }

    @Test
    void large_batches_are_split_and_ids_mapped_back() {
        ScriptedSender sender = new ScriptedSender()
                .reply(200, anthropic("[{\"id\":0,\"score\":1},{\"id\":1,\"score\":2}]"))
                .reply(200, anthropic("[{\"id\":0,\"score\":3},{\"id\":1,\"score\":4}]"))
                .reply(200, anthropic("[{\"id\":0,\"score\":5}]"));
        CrawlConfig.AiCfg c = cfg(AiProvider.ANTHROPIC).setMaxBatchSize(2);

        List<LinkScore> scores = new AnthropicScoringGateway(c, "k", sender, new RecordingSleeper())
                .scoreLinks(PAGE, links(5));

        assertThat(sender.requests).hasSize(3);
        assertThat(scores).extracting(LinkScore::id).containsExactly(0, 1, 2, 3, 4);
        assertThat(scores).extracting(LinkScore::score).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
    }

    @Test
    void malformed_answers_are_retried_then_scored_zero() {
        ScriptedSender sender = new ScriptedSender()
                .reply(200, anthropic("Sorry, I can't help with that."))
                .reply(200, anthropic("Still no JSON"));
        CrawlConfig.AiCfg c = cfg(AiProvider.ANTHROPIC).setParseRetries(1);

        List<LinkScore> scores = new AnthropicScoringGateway(c, "k", sender, new RecordingSleeper())
                .scoreLinks(PAGE, links(3));

        assertThat(sender.requests).hasSize(2);
        assertThat(scores).extracting(LinkScore::score).containsOnly(0.0).hasSize(3);
    }

    @Test
    void provider_errors_abort_with_status() {
        ScriptedSender sender = new ScriptedSender().reply(401, "{\"error\":\"invalid x-api-key\"}");
        var gw = new AnthropicScoringGateway(cfg(AiProvider.ANTHROPIC), "bad", sender, new RecordingSleeper());

        assertThatThrownBy(() -> gw.scoreLinks(PAGE, links(1)))
                .isInstanceOf(AiProviderException.class)
                .hasMessageContaining("HTTP 401")
                .satisfies(e -> assertThat(((AiProviderException) e).getStatus()).isEqualTo(401));
    }

    @Test
    void missing_answer_text_is_a_provider_error() {
        ScriptedSender sender = new ScriptedSender().reply(200, "{\"content\":[]}");
        var gw = new AnthropicScoringGateway(cfg(AiProvider.ANTHROPIC), "k", sender, new RecordingSleeper());

        assertThatThrownBy(() -> gw.scoreLinks(PAGE, links(1)))
                .isInstanceOf(AiProviderException.class)
                .hasMessageContaining("content[0].text");
    }

    @Test
    void empty_candidate_list_makes_no_request() {
        ScriptedSender sender = new ScriptedSender();
        var gw = new OpenAiScoringGateway(cfg(AiProvider.OPENAI), "k", sender, new RecordingSleeper());

        assertThat(gw.scoreLinks(PAGE, List.of())).isEmpty();
        assertThat(gw.detectDynamicLoading(PAGE, List.of()).isFound()).isFalse();
        assertThat(sender.requests).isEmpty();
    }
}
