package com.productscoutai.core.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productscoutai.core.api.IScoringGateway;
import com.productscoutai.core.http.HttpSender;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.DynamicDetection;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.LinkScore;
import com.productscoutai.core.model.NodeContext;
import com.productscoutai.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 채팅형 LLM 기반 게이트웨이 공통부: 프롬프트, 배치 분할, 응답 파싱/재요청, 요청 간격 제한.
 * 제공자 구현은 {@link #complete(String, String)} 하나만 채운다.
 */
public abstract class AbstractChatScoringGateway implements IScoringGateway {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractChatScoringGateway.class);
    protected static final ObjectMapper M = new ObjectMapper();

    protected final CrawlConfig.AiCfg cfg;
    protected final String apiKey;
    private final HttpSender sender;
    private final RequestThrottle throttle;
    private final ScoreResponseParser parser = new ScoreResponseParser();

    protected AbstractChatScoringGateway(CrawlConfig.AiCfg cfg, String apiKey, HttpSender sender, Sleeper sleeper) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.throttle = new RequestThrottle(cfg.getRequestsPerMinute(), Objects.requireNonNull(sleeper, "sleeper"));
    }

    /**
     * 제공자 API 1회 호출 → 응답 텍스트.
     * @throws AiProviderException 전송 실패 / 2xx 아님 / 텍스트 없음
     */
    protected abstract String complete(String system, String user);

    /** 로그용 제공자 이름 */
    protected abstract String providerName();

    @Override
    public List<LinkScore> scoreLinks(NodeContext page, List<LinkInfo> candidates) {
        if (candidates.isEmpty()) return List.of();
        int size = cfg.getMaxBatchSize();
        List<LinkScore> merged = new ArrayList<>(candidates.size());
        for (int from = 0; from < candidates.size(); from += size) {
            List<LinkInfo> chunk = candidates.subList(from, Math.min(candidates.size(), from + size));
            List<LinkInfo> renumbered = new ArrayList<>(chunk.size());
            for (int i = 0; i < chunk.size(); i++) renumbered.add(chunk.get(i).withId(i));

            List<LinkScore> scored = scoreChunk(page, renumbered);
            for (int i = 0; i < chunk.size(); i++) {
                LinkScore s = scored.get(i);
                merged.add(new LinkScore(chunk.get(i).getId(), s.score(), s.productName()));
            }
        }
        return merged;
    }

    private List<LinkScore> scoreChunk(NodeContext page, List<LinkInfo> chunk) {
        String user = PromptTemplates.scoringRequest(page, chunk);
        int attempts = cfg.getParseRetries() + 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String text = call(user);
            try {
                return parser.parseScores(text, chunk.size());
            } catch (ResponseParseException e) {
                LOG.warn("[{}] malformed scoring response (attempt {}/{}): {}",
                        providerName(), attempt, attempts, e.getMessage());
            }
        }
        LOG.warn("[{}] giving up on {} links at {}, all scores default to 0", providerName(), chunk.size(), page.url());
        List<LinkScore> zeros = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) zeros.add(LinkScore.zero(i));
        return zeros;
    }

    @Override
    public DynamicDetection detectDynamicLoading(NodeContext page, List<LinkInfo> candidates) {
        if (candidates.isEmpty()) return DynamicDetection.none();
        String text = call(PromptTemplates.detectionRequest(page, candidates));
        return parser.parseDetection(text, candidates.size());
    }

    private String call(String user) {
        try {
            throttle.acquire();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiProviderException(providerName() + " request interrupted", ie);
        }
        return complete(PromptTemplates.SYSTEM_PERSONA, user);
    }

    // ---------- HTTP 공통 ----------

    /** JSON POST → 응답 JSON. 2xx 가 아니면 AiProviderException */
    protected JsonNode postJson(URI endpoint, Map<String, String> headers, ObjectNode body) {
        HttpRequest.Builder b = HttpRequest.newBuilder(endpoint)
                .timeout(cfg.getTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        headers.forEach(b::header);

        HttpResponse<String> resp;
        try {
            resp = sender.send(b.build());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiProviderException(providerName() + " request interrupted", ie);
        } catch (Exception e) {
            throw new AiProviderException(providerName() + " request failed: " + e.getMessage(), e);
        }
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new AiProviderException(providerName() + " returned HTTP " + status + ": " + abbreviate(resp.body()), status, null);
        }
        try {
            return M.readTree(resp.body() == null ? "" : resp.body());
        } catch (Exception e) {
            throw new AiProviderException(providerName() + " returned non-JSON body", status, e);
        }
    }

    /** 경로의 텍스트 노드, 없거나 비었으면 AiProviderException */
    protected String requireText(JsonNode n, String what) {
        if (n == null || n.isMissingNode() || n.isNull() || !n.isTextual()) {
            throw new AiProviderException(providerName() + " response has no " + what);
        }
        return n.asText();
    }

    protected URI endpoint(String defaultUrl) {
        String base = cfg.getBaseUrl();
        return URI.create(base == null || base.isBlank() ? defaultUrl : base.trim());
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
