package com.productscoutai.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * LogSetup(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 JSON 문자열로 찍힘.
 * bind()로 고정 컨텍스트(예: crawl 도메인)를 붙인 파생 로거를 만들 수 있다.
 */
public final class StructuredLog {
    private static final ObjectMapper M = new ObjectMapper();

    private final Logger jul;
    private final String comp;
    private final Map<String, Object> bound;

    private StructuredLog(Logger jul, String comp, Map<String, Object> bound) {
        this.jul = jul;
        this.comp = comp;
        this.bound = bound;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), Map.of());
    }

    /** 모든 이벤트에 key=value 를 덧붙이는 파생 로거 */
    public StructuredLog bind(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(bound);
        copy.put(key, value);
        return new StructuredLog(jul, comp, copy);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = buildJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String buildJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = M.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        bound.forEach((k, v) -> put(n, k, v));

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return M.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // ObjectNode 직렬화는 사실상 실패하지 않음
            return "{\"event\":\"" + event + "\",\"_json_error\":true}";
        }
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Float f) n.put(k, f);
        else if (v instanceof Boolean b) n.put(k, b);
        else if (v instanceof Number num) n.put(k, num.doubleValue());
        else n.put(k, String.valueOf(v));
    }
}
