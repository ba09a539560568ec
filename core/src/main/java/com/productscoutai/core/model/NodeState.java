package com.productscoutai.core.model;

/**
 * 노드 생애주기. 순서는 단조 증가만 허용된다(역방향 전이 없음).
 * UNEXPLORED → EXPLORED → COMPLETELY_EXPLORED
 */
public enum NodeState {
    /** 발견만 됨(아직 fetch 안 함) */
    UNEXPLORED,
    /** fetch + 자식 스코어링 완료 */
    EXPLORED,
    /** 하위에 더 할 일이 없음(종단 상태) */
    COMPLETELY_EXPLORED;

    public boolean isBefore(NodeState other) {
        return other != null && this.ordinal() < other.ordinal();
    }
}
