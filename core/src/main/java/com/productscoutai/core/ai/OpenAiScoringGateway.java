package com.productscoutai.core.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productscoutai.core.http.HttpSender;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.util.Sleeper;

import java.util.Map;

/** OpenAI Chat Completions API */
public final class OpenAiScoringGateway extends AbstractChatScoringGateway {
    static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1/chat/completions";

    public OpenAiScoringGateway(CrawlConfig.AiCfg cfg, String apiKey, HttpSender sender, Sleeper sleeper) {
        super(cfg, apiKey, sender, sleeper);
    }

    @Override
    protected String complete(String system, String user) {
        ObjectNode body = M.createObjectNode();
        body.put("model", cfg.getModel());
        body.put("max_tokens", cfg.getMaxTokens());
        body.put("temperature", cfg.getTemperature());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", system);
        messages.addObject().put("role", "user").put("content", user);

        JsonNode resp = postJson(endpoint(DEFAULT_ENDPOINT), Map.of("Authorization", "Bearer " + apiKey), body);
        return requireText(resp.path("choices").path(0).path("message").path("content"), "choices[0].message.content");
    }

    @Override
    protected String providerName() { return "openai"; }
}
