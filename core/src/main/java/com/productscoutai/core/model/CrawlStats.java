package com.productscoutai.core.model;

import java.util.concurrent.atomic.AtomicInteger;

/** 크롤 런타임 카운터 (진행률 리스너가 다른 스레드에서 읽을 수 있으므로 atomic). */
public final class CrawlStats {
    private final AtomicInteger pagesProcessed = new AtomicInteger();
    private final AtomicInteger fetchFailures = new AtomicInteger();
    private final AtomicInteger scoringCalls = new AtomicInteger();
    private final AtomicInteger detectionCalls = new AtomicInteger();
    private final AtomicInteger linksAdmitted = new AtomicInteger();
    private final AtomicInteger rejectedDomain = new AtomicInteger();
    private final AtomicInteger rejectedDuplicate = new AtomicInteger();
    private final AtomicInteger rejectedInvalid = new AtomicInteger();
    private final AtomicInteger dynamicLinksRevealed = new AtomicInteger();

    public int incPagesProcessed() { return pagesProcessed.incrementAndGet(); }
    public void incFetchFailures() { fetchFailures.incrementAndGet(); }
    public void incScoringCalls() { scoringCalls.incrementAndGet(); }
    public void incDetectionCalls() { detectionCalls.incrementAndGet(); }
    public void addAdmitted(int n) { linksAdmitted.addAndGet(n); }
    public void addRejectedDomain(int n) { rejectedDomain.addAndGet(n); }
    public void addRejectedDuplicate(int n) { rejectedDuplicate.addAndGet(n); }
    public void addRejectedInvalid(int n) { rejectedInvalid.addAndGet(n); }
    public void addDynamicLinksRevealed(int n) { dynamicLinksRevealed.addAndGet(n); }

    public int getPagesProcessed() { return pagesProcessed.get(); }
    public int getFetchFailures() { return fetchFailures.get(); }
    public int getScoringCalls() { return scoringCalls.get(); }
    public int getDetectionCalls() { return detectionCalls.get(); }
    public int getLinksAdmitted() { return linksAdmitted.get(); }
    public int getRejectedDomain() { return rejectedDomain.get(); }
    public int getRejectedDuplicate() { return rejectedDuplicate.get(); }
    public int getRejectedInvalid() { return rejectedInvalid.get(); }
    public int getDynamicLinksRevealed() { return dynamicLinksRevealed.get(); }
}
