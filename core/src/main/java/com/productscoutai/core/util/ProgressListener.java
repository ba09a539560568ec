package com.productscoutai.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (페이지 예산 대비, 모르면 0.0)
     * @param phase    "crawl" | "dynamic" | "dedup" | "export"
     * @param done     처리한 페이지 수(모르면 -1)
     * @param total    페이지 예산(모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
