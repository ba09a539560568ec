package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.Set;

/**
 * "다음" 컨트롤을 반복 클릭.
 * 종료: 새 링크 없음 / 컨트롤 사라짐 / maxPaginationPages
 */
final class PaginationHandler implements TriggerHandler {
    private static final Logger LOG = LoggerFactory.getLogger(PaginationHandler.class);

    @Override
    public void exhaust(HandlerContext ctx) throws AutomationException {
        IBrowserSession s = ctx.session();
        int max = ctx.cfg().getMaxPaginationPages();
        for (int page = 1; page <= max; page++) {
            Optional<String> next = ControlLocator.locate(s, ctx.control());
            if (next.isEmpty() || !s.isVisible(next.get())) {
                LOG.debug("pagination control gone after {} page(s)", page - 1);
                return;
            }
            Set<URI> before = ctx.links().contentLinks(s);
            s.click(next.get());
            try {
                ctx.waiter().until(() -> !ctx.links().contentLinks(s).equals(before), "pagination content refresh");
            } catch (AutomationTimeoutException e) {
                // 마지막 페이지의 비활성 "다음"
                LOG.debug("pagination page {} left the links unchanged, stopping", page);
                return;
            }
            int added = ctx.links().collect(s);
            LOG.debug("pagination page {} revealed {} link(s)", page, added);
            if (added == 0) return;
        }
        LOG.debug("pagination stopped at limit {}", max);
    }
}
