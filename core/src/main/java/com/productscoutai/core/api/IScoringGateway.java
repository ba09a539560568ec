package com.productscoutai.core.api;

import com.productscoutai.core.model.DynamicDetection;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.LinkScore;
import com.productscoutai.core.model.NodeContext;

import java.util.List;

/**
 * AI 스코어링 최소 계약.
 * 구현체는 제공자(Anthropic/OpenAI/Google)별 1개이며 크롤 시작 시 한 번 선택된다.
 * 제공자 통신 실패는 AiProviderException(unchecked)으로 올린다.
 */
public interface IScoringGateway extends AutoCloseable {

    /**
     * 후보마다 정확히 1개의 점수(0~10)를 id 순서대로 돌려준다.
     * 응답 파싱이 끝내 실패하면 전부 0점(경고 로그). 블로킹하지 않는다.
     */
    List<LinkScore> scoreLinks(NodeContext page, List<LinkInfo> candidates);

    /** 동적 로딩 컨트롤 탐지. 없으면 {@link DynamicDetection#none()} */
    DynamicDetection detectDynamicLoading(NodeContext page, List<LinkInfo> candidates);

    @Override default void close() {}
}
