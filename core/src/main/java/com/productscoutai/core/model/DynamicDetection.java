package com.productscoutai.core.model;

import java.util.Optional;

/** 동적 로딩 탐지 결과. id = -1 이면 컨트롤 없음. */
public record DynamicDetection(int id, TriggerType triggerType) {

    public static final int NONE_ID = -1;
    private static final DynamicDetection NONE = new DynamicDetection(NONE_ID, null);

    public DynamicDetection {
        if (id < 0 || triggerType == null || !triggerType.isDetectable()) {
            id = NONE_ID;
            triggerType = null;
        }
    }

    public static DynamicDetection none() { return NONE; }

    public boolean isFound() { return id != NONE_ID; }

    public Optional<TriggerType> type() { return Optional.ofNullable(triggerType); }
}
