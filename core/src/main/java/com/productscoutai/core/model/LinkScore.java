package com.productscoutai.core.model;

/** AI가 매긴 후보 1건의 점수. productName은 score > 9 일 때만 non-null. */
public record LinkScore(int id, double score, String productName) {

    public static final double MIN = 0.0;
    public static final double MAX = 10.0;
    public static final double PRODUCT_THRESHOLD = 9.0;

    public LinkScore {
        if (Double.isNaN(score)) score = MIN;
        score = Math.max(MIN, Math.min(MAX, score));
        if (score <= PRODUCT_THRESHOLD || productName == null || productName.isBlank()) {
            productName = null;
        } else {
            productName = productName.trim();
        }
    }

    public static LinkScore zero(int id) {
        return new LinkScore(id, MIN, null);
    }
}
