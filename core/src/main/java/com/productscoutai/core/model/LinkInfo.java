package com.productscoutai.core.model;

import java.net.URI;
import java.util.Objects;

/**
 * 스코어링 배치 1건의 후보 링크(임시 객체).
 * id는 현재 배치 안에서의 위치이며 AI 응답과 후보를 짝짓는 데 쓴다.
 * score는 스코어링 전까지 null, productName은 score > 9 일 때만 존재.
 */
public final class LinkInfo {
    public static final int UNASSIGNED = -1;

    private final int id;
    private final String relativePath;
    private final URI absoluteUrl;
    private final String anchorText;
    private final String tagContext;
    private final Double score;
    private final String productName;

    private LinkInfo(int id, String relativePath, URI absoluteUrl, String anchorText,
                     String tagContext, Double score, String productName) {
        this.id = id;
        this.relativePath = relativePath == null ? "" : relativePath;
        this.absoluteUrl = Objects.requireNonNull(absoluteUrl, "absoluteUrl");
        this.anchorText = anchorText == null ? "" : anchorText;
        this.tagContext = tagContext == null ? "" : tagContext;
        this.score = score;
        this.productName = productName;
    }

    /** 파서가 만드는 미배정(id=-1) 후보 */
    public static LinkInfo candidate(URI absoluteUrl, String relativePath, String anchorText, String tagContext) {
        return new LinkInfo(UNASSIGNED, relativePath, absoluteUrl, anchorText, tagContext, null, null);
    }

    public LinkInfo withId(int newId) {
        return new LinkInfo(newId, relativePath, absoluteUrl, anchorText, tagContext, score, productName);
    }

    public LinkInfo withAbsoluteUrl(URI url, String newRelativePath) {
        return new LinkInfo(id, newRelativePath, url, anchorText, tagContext, score, productName);
    }

    /** 스코어 반영. productName은 score > 9 일 때만 유지 */
    public LinkInfo scored(double s, String name) {
        String keep = (s > 9.0 && name != null && !name.isBlank()) ? name.trim() : null;
        return new LinkInfo(id, relativePath, absoluteUrl, anchorText, tagContext, s, keep);
    }

    public int getId() { return id; }
    public String getRelativePath() { return relativePath; }
    public URI getAbsoluteUrl() { return absoluteUrl; }
    public String getAnchorText() { return anchorText; }
    public String getTagContext() { return tagContext; }
    public Double getScore() { return score; }
    public String getProductName() { return productName; }
    public boolean isScored() { return score != null; }

    @Override
    public String toString() {
        return "LinkInfo{#" + id + " " + relativePath + " '" + anchorText + "'"
                + (score != null ? " score=" + score : "") + "}";
    }
}
