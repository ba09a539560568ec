package com.productscoutai.core.ai;

import com.productscoutai.core.api.IScoringGateway;
import com.productscoutai.core.http.HttpSender;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.CrawlConfig.AiProvider;
import com.productscoutai.core.util.DefaultSleeper;
import com.productscoutai.core.util.Sleeper;

import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.function.Function;

/** 설정의 제공자로 게이트웨이 1개를 만든다(크롤 도중 교체 없음). */
public final class ScoringGateways {
    private ScoringGateways() {}

    public static IScoringGateway create(CrawlConfig.AiCfg cfg) {
        HttpClient client = HttpClient.newBuilder().connectTimeout(cfg.getTimeout()).build();
        HttpSender sender = req -> client.send(req, HttpResponse.BodyHandlers.ofString());
        return create(cfg, System::getenv, sender, new DefaultSleeper());
    }

    /**
     * @param env 환경변수 조회(테스트 주입용)
     * @throws IllegalArgumentException API 키를 찾지 못함
     */
    public static IScoringGateway create(CrawlConfig.AiCfg cfg, Function<String, String> env,
                                         HttpSender sender, Sleeper sleeper) {
        String key = resolveApiKey(cfg, env);
        switch (cfg.getProvider()) {
            case ANTHROPIC: return new AnthropicScoringGateway(cfg, key, sender, sleeper);
            case OPENAI:    return new OpenAiScoringGateway(cfg, key, sender, sleeper);
            case GOOGLE:    return new GoogleScoringGateway(cfg, key, sender, sleeper);
            default: throw new IllegalArgumentException("unsupported provider: " + cfg.getProvider());
        }
    }

    /** ai.apiKey → 제공자별 환경변수(ANTHROPIC_API_KEY / CLAUDE_API_KEY, OPENAI_API_KEY, GOOGLE_API_KEY) */
    static String resolveApiKey(CrawlConfig.AiCfg cfg, Function<String, String> env) {
        if (notBlank(cfg.getApiKey())) return cfg.getApiKey().trim();
        for (String name : envNames(cfg.getProvider())) {
            String v = env.apply(name);
            if (notBlank(v)) return v.trim();
        }
        throw new IllegalArgumentException("no API key for " + cfg.getProvider()
                + ": set ai.apiKey or " + String.join(" / ", envNames(cfg.getProvider())));
    }

    static String[] envNames(AiProvider p) {
        switch (p) {
            case ANTHROPIC: return new String[]{"ANTHROPIC_API_KEY", "CLAUDE_API_KEY"};
            case OPENAI:    return new String[]{"OPENAI_API_KEY"};
            case GOOGLE:    return new String[]{"GOOGLE_API_KEY"};
            default: throw new IllegalArgumentException("unsupported provider: " + p);
        }
    }

    private static boolean notBlank(String s) { return s != null && !s.isBlank(); }
}
