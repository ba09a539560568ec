package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.IBrowserSession;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.util.Sleeper;

/** 핸들러 1회 실행에 필요한 것들. control은 AI가 지목한 후보(무한 스크롤이면 null). */
record HandlerContext(IBrowserSession session,
                      Waiter waiter,
                      RevealedLinks links,
                      CrawlConfig.DynamicCfg cfg,
                      Sleeper sleeper,
                      LinkInfo control) {
}
