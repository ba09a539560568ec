package com.productscoutai.core.model;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 탐색 트리의 영속 노드. 트리(arena)가 id로 소유/관리한다.
 * - parentId: 비소유 관계(root는 -1)
 * - childIds: 생성 순서 유지
 * - state: 단조 증가만 허용
 */
public final class WebsiteNode {
    public static final int NO_PARENT = -1;

    private final int id;
    private final URI url;
    private final int parentId;
    private final int depth;
    private final double ownScore;
    private final List<Integer> childIds = new ArrayList<>();
    private final Set<Integer> referrerIds = new LinkedHashSet<>(); // 같은 URL을 가리킨 다른 부모들

    private NodeState state = NodeState.UNEXPLORED;
    private String title;
    private String description;
    private String productName;

    public WebsiteNode(int id, URI url, int parentId, int depth, double ownScore) {
        this.id = id;
        this.url = Objects.requireNonNull(url, "url");
        this.parentId = parentId;
        this.depth = depth;
        this.ownScore = ownScore;
    }

    public int getId() { return id; }
    public URI getUrl() { return url; }
    public int getParentId() { return parentId; }
    public boolean isRoot() { return parentId == NO_PARENT; }
    public int getDepth() { return depth; }
    public double getOwnScore() { return ownScore; }
    public NodeState getState() { return state; }
    public boolean isCompletelyExplored() { return state == NodeState.COMPLETELY_EXPLORED; }
    public List<Integer> getChildIds() { return Collections.unmodifiableList(childIds); }
    public Set<Integer> getReferrerIds() { return Collections.unmodifiableSet(referrerIds); }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getProductName() { return productName; }
    public boolean isProduct() { return productName != null; }

    /**
     * 상태 전이. 역방향/동일 상태 요청은 무시하고 false 반환.
     * @return 실제로 전이되었으면 true
     */
    public boolean advanceTo(NodeState next) {
        Objects.requireNonNull(next, "next");
        if (!state.isBefore(next)) return false;
        state = next;
        return true;
    }

    // 트리 내부에서만 조작(패키지 경계 밖 노출 최소화를 위해 public이지만 WebsiteTree 경유 권장)
    public void addChildId(int childId) { childIds.add(childId); }
    public void addReferrerId(int parent) { if (parent != parentId && parent != id) referrerIds.add(parent); }

    public void cachePage(String title, String description) {
        this.title = title;
        this.description = description;
    }

    public void setProductName(String productName) { this.productName = productName; }

    public NodeContext context() {
        return new NodeContext(url, title, description);
    }

    @Override
    public String toString() {
        return "WebsiteNode{#" + id + " " + url + " d=" + depth + " s=" + ownScore + " " + state + "}";
    }
}
