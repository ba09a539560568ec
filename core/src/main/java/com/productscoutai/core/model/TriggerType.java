package com.productscoutai.core.model;

import java.util.Locale;
import java.util.Optional;

/** 동적 로딩 UI 컨트롤 분류. INFINITE_SCROLL은 AI 탐지 대상이 아니다(항상 검사). */
public enum TriggerType {
    PAGINATION("Pagination"),
    LOAD_MORE("LoadMore"),
    INFINITE_SCROLL("InfiniteScroll"),
    TABS("Tabs"),
    ACCORDIONS("Accordions"),
    EXPANDERS("Expanders");

    private final String label;

    TriggerType(String label) { this.label = label; }

    public String label() { return label; }

    /** AI가 탐지 응답으로 돌려줄 수 있는 타입인지 */
    public boolean isDetectable() { return this != INFINITE_SCROLL; }

    /**
     * 관대한 파싱: "Load More", "load-more", "LOAD_MORE", "Accordion" 등 허용.
     * 알 수 없으면 empty.
     */
    public static Optional<TriggerType> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String key = raw.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
        if (key.isEmpty()) return Optional.empty();
        for (TriggerType t : values()) {
            String l = t.label.toLowerCase(Locale.ROOT);
            if (l.equals(key) || (l + "s").equals(key) || l.equals(key + "s")) return Optional.of(t);
        }
        return Optional.empty();
    }
}
