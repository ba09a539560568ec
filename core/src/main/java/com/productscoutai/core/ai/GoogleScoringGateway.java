package com.productscoutai.core.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productscoutai.core.http.HttpSender;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.util.Sleeper;

import java.net.URI;
import java.util.Map;

/** Google Gemini generateContent API. 모델명은 URL 경로에 들어간다. */
public final class GoogleScoringGateway extends AbstractChatScoringGateway {
    static final String DEFAULT_BASE = "https://generativelanguage.googleapis.com/v1beta/models/";

    public GoogleScoringGateway(CrawlConfig.AiCfg cfg, String apiKey, HttpSender sender, Sleeper sleeper) {
        super(cfg, apiKey, sender, sleeper);
    }

    @Override
    protected String complete(String system, String user) {
        ObjectNode body = M.createObjectNode();
        body.putObject("systemInstruction").putArray("parts").addObject().put("text", system);
        ObjectNode content = body.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", user);
        ObjectNode gen = body.putObject("generationConfig");
        gen.put("temperature", cfg.getTemperature());
        gen.put("maxOutputTokens", cfg.getMaxTokens());

        JsonNode resp = postJson(modelEndpoint(), Map.of("x-goog-api-key", apiKey), body);
        return requireText(resp.path("candidates").path(0).path("content").path("parts").path(0).path("text"),
                "candidates[0].content.parts[0].text");
    }

    URI modelEndpoint() {
        String base = cfg.getBaseUrl();
        if (base == null || base.isBlank()) base = DEFAULT_BASE;
        if (!base.endsWith("/")) base = base + "/";
        return URI.create(base + cfg.getModel() + ":generateContent");
    }

    @Override
    protected String providerName() { return "google"; }
}
