package com.productscoutai.core.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productscoutai.core.http.HttpSender;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.util.Sleeper;

import java.util.Map;

/** Anthropic Messages API */
public final class AnthropicScoringGateway extends AbstractChatScoringGateway {
    static final String DEFAULT_ENDPOINT = "https://api.anthropic.com/v1/messages";
    static final String API_VERSION = "2023-06-01";

    public AnthropicScoringGateway(CrawlConfig.AiCfg cfg, String apiKey, HttpSender sender, Sleeper sleeper) {
        super(cfg, apiKey, sender, sleeper);
    }

    @Override
    protected String complete(String system, String user) {
        ObjectNode body = M.createObjectNode();
        body.put("model", cfg.getModel());
        body.put("max_tokens", cfg.getMaxTokens());
        body.put("temperature", cfg.getTemperature());
        body.put("system", system);
        ObjectNode msg = body.putArray("messages").addObject();
        msg.put("role", "user");
        msg.put("content", user);

        JsonNode resp = postJson(endpoint(DEFAULT_ENDPOINT),
                Map.of("x-api-key", apiKey, "anthropic-version", API_VERSION), body);
        return requireText(resp.path("content").path(0).path("text"), "content[0].text");
    }

    @Override
    protected String providerName() { return "anthropic"; }
}
