package com.productscoutai.core.tree;

import com.productscoutai.core.model.NodeState;
import com.productscoutai.core.model.WebsiteNode;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * 미탐색 노드 우선순위 큐(max-heap).
 * 키 = 삽입 시점의 averageAncestralScore. 동점은 삽입 순(FIFO).
 * 삭제는 live 집합에서만 빼고 pop 시점에 버린다(lazy invalidation).
 */
public final class OpenSet {

    private record Entry(WebsiteNode node, double key, long seq) {}

    private static final Comparator<Entry> ORDER =
            Comparator.comparingDouble(Entry::key).reversed().thenComparingLong(Entry::seq);

    private final WebsiteTree tree;
    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private final Set<Integer> live = new HashSet<>();
    private long seq = 0;

    public OpenSet(WebsiteTree tree) {
        this.tree = tree;
    }

    /**
     * @throws IllegalArgumentException UNEXPLORED가 아닌 노드
     */
    public void insert(WebsiteNode node) {
        if (node.getState() != NodeState.UNEXPLORED) {
            throw new IllegalArgumentException("only UNEXPLORED nodes can be queued: " + node);
        }
        if (!live.add(node.getId())) return; // 이미 대기 중
        heap.add(new Entry(node, tree.averageAncestralScore(node), seq++));
    }

    public Optional<WebsiteNode> popMax() {
        while (!heap.isEmpty()) {
            Entry e = heap.poll();
            if (!live.remove(e.node().getId())) continue;               // invalidate됨
            if (e.node().getState() != NodeState.UNEXPLORED) continue;  // 이미 다른 경로로 처리
            return Optional.of(e.node());
        }
        return Optional.empty();
    }

    /** O(1): live에서 제거만, 힙 엔트리는 pop 시 폐기 */
    public void invalidate(WebsiteNode node) {
        live.remove(node.getId());
    }

    public boolean contains(WebsiteNode node) {
        return live.contains(node.getId());
    }

    /** live 노드 수 */
    public int size() { return live.size(); }

    public boolean isEmpty() { return live.isEmpty(); }
}
