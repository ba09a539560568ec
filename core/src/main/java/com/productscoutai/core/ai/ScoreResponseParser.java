package com.productscoutai.core.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.productscoutai.core.model.DynamicDetection;
import com.productscoutai.core.model.LinkScore;
import com.productscoutai.core.model.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AI 응답 텍스트 → 점수/탐지 결과.
 * 응답에 설명문이 섞여도 첫 '[' ~ 마지막 ']' 구간만 JSON으로 본다.
 */
public final class ScoreResponseParser {
    private static final Logger LOG = LoggerFactory.getLogger(ScoreResponseParser.class);
    private static final ObjectMapper M = new ObjectMapper();

    /**
     * 정확히 expected 개의 점수를 id 0..expected-1 순서로 돌려준다.
     * - 원소에 유효한 id가 하나라도 있으면 id 매칭, 아니면 위치 매칭
     * - 빠진 id는 0점 + 경고, 범위 밖/초과 원소는 무시
     * @throws ResponseParseException JSON 배열을 찾거나 읽을 수 없음
     */
    List<LinkScore> parseScores(String text, int expected) throws ResponseParseException {
        JsonNode arr = extract(text, '[', ']');
        if (!arr.isArray()) throw new ResponseParseException("expected JSON array");

        boolean byId = false;
        for (JsonNode el : arr) {
            if (el.isObject() && el.path("id").canConvertToInt() && el.path("id").isIntegralNumber()) {
                byId = true;
                break;
            }
        }

        Map<Integer, LinkScore> found = new HashMap<>();
        int pos = 0;
        for (JsonNode el : arr) {
            int slot = pos++;
            if (!el.isObject()) continue;
            Optional<Double> score = number(el.get("score"));
            if (score.isEmpty()) continue;
            int id;
            if (byId) {
                JsonNode idNode = el.get("id");
                if (idNode == null || !idNode.isIntegralNumber()) continue;
                id = idNode.intValue();
            } else {
                id = slot;
            }
            if (id < 0 || id >= expected) continue;
            String name = el.hasNonNull("productName") ? el.get("productName").asText() : null;
            found.putIfAbsent(id, new LinkScore(id, score.get(), name));
        }

        List<LinkScore> out = new ArrayList<>(expected);
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < expected; i++) {
            LinkScore s = found.get(i);
            if (s == null) {
                missing.add(i);
                s = LinkScore.zero(i);
            }
            out.add(s);
        }
        if (!missing.isEmpty()) {
            LOG.warn("AI response missing {} of {} scores (ids {}), defaulting to 0", missing.size(), expected, missing);
        }
        return out;
    }

    /**
     * 객체 {"id","triggerType"} 또는 그런 객체의 배열을 허용.
     * 알 수 없는 타입 / 배치 밖 id / 파싱 불가 → none (경고).
     */
    DynamicDetection parseDetection(String text, int batchSize) {
        JsonNode root;
        try {
            int obj = text == null ? -1 : text.indexOf('{');
            int arr = text == null ? -1 : text.indexOf('[');
            if (arr >= 0 && (obj < 0 || arr < obj)) root = extract(text, '[', ']');
            else root = extract(text, '{', '}');
        } catch (ResponseParseException e) {
            LOG.warn("unparseable dynamic-loading response: {}", e.getMessage());
            return DynamicDetection.none();
        }

        JsonNode pick = null;
        if (root.isArray()) {
            for (JsonNode el : root) {
                if (el.isObject() && el.path("id").asInt(-1) != DynamicDetection.NONE_ID) {
                    pick = el;
                    break;
                }
            }
        } else if (root.isObject()) {
            pick = root;
        }
        if (pick == null) return DynamicDetection.none();

        int id = pick.path("id").asInt(DynamicDetection.NONE_ID);
        if (id == DynamicDetection.NONE_ID) return DynamicDetection.none();
        if (id < 0 || id >= batchSize) {
            LOG.warn("dynamic-loading id {} outside batch of {}, ignoring", id, batchSize);
            return DynamicDetection.none();
        }
        String label = pick.path("triggerType").asText(null);
        Optional<TriggerType> type = TriggerType.fromLabel(label).filter(TriggerType::isDetectable);
        if (type.isEmpty()) {
            LOG.warn("unknown trigger type '{}' for id {}, ignoring", label, id);
            return DynamicDetection.none();
        }
        return new DynamicDetection(id, type.get());
    }

    private static JsonNode extract(String text, char open, char close) throws ResponseParseException {
        if (text == null) throw new ResponseParseException("empty response");
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start < 0 || end <= start) throw new ResponseParseException("no JSON " + open + close + " found");
        try {
            return M.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Optional<Double> number(JsonNode n) {
        if (n == null || n.isNull()) return Optional.empty();
        if (n.isNumber()) return Optional.of(n.doubleValue());
        if (n.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(n.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
