package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 바닥까지 스크롤 → scrollPause 대기 → 높이 비교. 높이가 안 늘거나 maxScrolls 면 종료. */
final class InfiniteScrollHandler implements TriggerHandler {
    private static final Logger LOG = LoggerFactory.getLogger(InfiniteScrollHandler.class);

    @Override
    public void exhaust(HandlerContext ctx) throws AutomationException {
        IBrowserSession s = ctx.session();
        int max = ctx.cfg().getMaxScrolls();
        for (int i = 1; i <= max; i++) {
            long before = s.scrollHeight();
            s.scrollToBottom();
            try {
                ctx.sleeper().sleep(ctx.cfg().getScrollPause());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new AutomationException("interrupted during scroll pause", ie);
            }
            long after = s.scrollHeight();
            int added = ctx.links().collect(s);
            LOG.debug("scroll {} height {} -> {} revealed {} link(s)", i, before, after, added);
            if (after <= before) return;
        }
    }
}
