package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * "더 보기" 반복 클릭. 클릭 후 링크 수 증가, 또는 나타났던 로딩 표시가 사라지기를 기다린다.
 * 로딩 표시 없이 한도 내 변화가 없으면 새 항목 없음으로 본다.
 * 종료: 새 링크 없음 / maxLoadMoreClicks
 */
final class LoadMoreHandler implements TriggerHandler {
    private static final Logger LOG = LoggerFactory.getLogger(LoadMoreHandler.class);
    private static final String ANCHORS = "a[href]";

    @Override
    public void exhaust(HandlerContext ctx) throws AutomationException {
        IBrowserSession s = ctx.session();
        String loading = ctx.cfg().getLoadingSelector();
        int max = ctx.cfg().getMaxLoadMoreClicks();
        for (int click = 1; click <= max; click++) {
            Optional<String> button = ControlLocator.locate(s, ctx.control());
            if (button.isEmpty() || !s.isVisible(button.get())) {
                LOG.debug("load-more control gone after {} click(s)", click - 1);
                return;
            }
            int before = s.count(ANCHORS);
            s.click(button.get());
            boolean[] spinnerSeen = {false};
            try {
                ctx.waiter().until(() -> {
                    if (s.count(ANCHORS) > before) return true;
                    boolean spinning = s.isVisible(loading);
                    if (spinning) spinnerSeen[0] = true;
                    return spinnerSeen[0] && !spinning;
                }, "load-more result");
            } catch (AutomationTimeoutException e) {
                if (spinnerSeen[0]) throw e; // 로딩이 끝나지 않음
                LOG.debug("load-more click {} brought no new items within {}ms", click, ctx.waiter().getTimeout().toMillis());
                return;
            }
            int added = ctx.links().collect(s);
            LOG.debug("load-more click {} revealed {} link(s)", click, added);
            if (added == 0) return;
        }
        LOG.debug("load-more stopped at limit {}", max);
    }
}
