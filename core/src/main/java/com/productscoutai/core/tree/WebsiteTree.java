package com.productscoutai.core.tree;

import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.NodeState;
import com.productscoutai.core.model.WebsiteNode;
import com.productscoutai.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 탐색 트리(arena + id).
 * - nodes: id == 인덱스, 삭제 없음
 * - byUrl: 전역 방문 인덱스. 같은 URL은 노드 1개만 존재(재등장은 referrer 기록)
 * 엔진 스레드 전용(동기화 없음).
 */
public final class WebsiteTree {

    /** root 기본 점수(중립 기준선) */
    public static final double ROOT_SCORE = 10.0;

    private final List<WebsiteNode> nodes = new ArrayList<>();
    private final Map<URI, Integer> byUrl = new HashMap<>();

    public WebsiteNode addRoot(URI url) {
        if (!nodes.isEmpty()) throw new IllegalStateException("root already exists");
        URI n = key(url);
        WebsiteNode root = new WebsiteNode(0, n, WebsiteNode.NO_PARENT, 0, ROOT_SCORE);
        nodes.add(root);
        byUrl.put(n, root.getId());
        return root;
    }

    public WebsiteNode root() {
        if (nodes.isEmpty()) throw new IllegalStateException("empty tree");
        return nodes.get(0);
    }

    /**
     * 스코어링된 링크로 자식 노드 생성.
     * @throws IllegalStateException 이미 트리에 있는 URL (호출 전 admission에서 걸러야 함)
     */
    public WebsiteNode addChild(WebsiteNode parent, LinkInfo link, double score) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(link, "link");
        WebsiteNode p = get(parent.getId());
        URI n = key(link.getAbsoluteUrl());
        if (byUrl.containsKey(n)) {
            throw new IllegalStateException("url already in tree: " + n);
        }
        WebsiteNode child = new WebsiteNode(nodes.size(), n, p.getId(), p.getDepth() + 1, score);
        nodes.add(child);
        byUrl.put(n, child.getId());
        p.addChildId(child.getId());
        return child;
    }

    public boolean contains(URI url) {
        return url != null && byUrl.containsKey(key(url));
    }

    public Optional<WebsiteNode> find(URI url) {
        if (url == null) return Optional.empty();
        Integer id = byUrl.get(key(url));
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    public WebsiteNode get(int id) {
        if (id < 0 || id >= nodes.size()) throw new IllegalArgumentException("no node #" + id);
        return nodes.get(id);
    }

    /** 이미 있는 URL을 다른 부모가 가리킨 경우: 기록만(노드/스코어링 추가 없음) */
    public boolean recordReferrer(URI url, WebsiteNode parent) {
        Optional<WebsiteNode> existing = find(url);
        existing.ifPresent(n -> n.addReferrerId(parent.getId()));
        return existing.isPresent();
    }

    public boolean markExplored(WebsiteNode node) {
        return get(node.getId()).advanceTo(NodeState.EXPLORED);
    }

    /**
     * 자신 + 비-root 조상들의 ownScore 산술평균.
     * root 자신은 기준선(10.0).
     * 예) root → 8 → 6 → 4 : (8+6+4)/3 = 6.0
     */
    public double averageAncestralScore(WebsiteNode node) {
        WebsiteNode cur = get(node.getId());
        if (cur.isRoot()) return cur.getOwnScore();
        double sum = 0;
        int n = 0;
        while (!cur.isRoot()) {
            sum += cur.getOwnScore();
            n++;
            cur = nodes.get(cur.getParentId());
        }
        return sum / n;
    }

    /**
     * 노드를 COMPLETELY_EXPLORED로 만들고 위로 전파.
     * 조상은 (EXPLORED 이상) && 모든 자식 완료 일 때만 완료된다.
     * UNEXPLORED 조상이나 미완료 조상을 만나면 멈춘다.
     * @return 이번 호출로 새로 완료된 노드들(아래→위 순서)
     */
    public List<WebsiteNode> markCompleteAndPropagate(WebsiteNode node) {
        List<WebsiteNode> completed = new ArrayList<>();
        WebsiteNode cur = get(node.getId());
        if (cur.advanceTo(NodeState.COMPLETELY_EXPLORED)) completed.add(cur);
        while (!cur.isRoot()) {
            WebsiteNode parent = nodes.get(cur.getParentId());
            if (parent.isCompletelyExplored()) break;
            if (parent.getState() == NodeState.UNEXPLORED) break;
            if (!allChildrenComplete(parent)) break;
            parent.advanceTo(NodeState.COMPLETELY_EXPLORED);
            completed.add(parent);
            cur = parent;
        }
        return completed;
    }

    /** 탐색됨 + 모든 자식 완료(자식 0개 포함) */
    public boolean isSubtreeComplete(WebsiteNode node) {
        WebsiteNode n = get(node.getId());
        if (n.isCompletelyExplored()) return true;
        return n.getState() != NodeState.UNEXPLORED && allChildrenComplete(n);
    }

    private boolean allChildrenComplete(WebsiteNode n) {
        for (int cid : n.getChildIds()) {
            if (!nodes.get(cid).isCompletelyExplored()) return false;
        }
        return true;
    }

    /** root → node 경로 */
    public List<WebsiteNode> path(WebsiteNode node) {
        List<WebsiteNode> out = new ArrayList<>();
        WebsiteNode cur = get(node.getId());
        out.add(cur);
        while (!cur.isRoot()) {
            cur = nodes.get(cur.getParentId());
            out.add(cur);
        }
        Collections.reverse(out);
        return out;
    }

    public int size() { return nodes.size(); }

    public List<WebsiteNode> nodes() { return Collections.unmodifiableList(nodes); }

    private static URI key(URI url) {
        return UrlUtils.normalize(Objects.requireNonNull(url, "url"));
    }
}
