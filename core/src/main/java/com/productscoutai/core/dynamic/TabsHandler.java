package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/** [role=tab] 을 차례로 활성화하고 패널별 링크 수집. ARIA 탭이 없으면 지목된 컨트롤 1회 클릭. */
final class TabsHandler implements TriggerHandler {
    private static final Logger LOG = LoggerFactory.getLogger(TabsHandler.class);
    static final String TAB = "[role=tab]";

    @Override
    public void exhaust(HandlerContext ctx) throws AutomationException {
        IBrowserSession s = ctx.session();
        int tabs = Math.min(s.count(TAB), ctx.cfg().getMaxToggles());
        if (tabs == 0) {
            clickControlOnce(ctx);
            return;
        }
        for (int i = 0; i < tabs; i++) {
            final int idx = i;
            s.clickNth(TAB, idx);
            ctx.waiter().until(() -> "true".equals(s.attributeNth(TAB, idx, "aria-selected")) || panelVisible(s, idx),
                    "tab " + idx + " selected");
            LOG.debug("tab {} revealed {} link(s)", idx, ctx.links().collect(s));
        }
    }

    private static boolean panelVisible(IBrowserSession s, int idx) throws AutomationException {
        String panel = s.attributeNth(TAB, idx, "aria-controls");
        return panel != null && !panel.isBlank() && s.isVisible("[id=\"" + panel + "\"]");
    }

    static void clickControlOnce(HandlerContext ctx) throws AutomationException {
        Optional<String> sel = ControlLocator.locate(ctx.session(), ctx.control());
        if (sel.isEmpty()) {
            LOG.debug("detected control not found on page");
            return;
        }
        int before = ctx.session().count("a[href]");
        ctx.session().click(sel.get());
        ctx.waiter().until(() -> ctx.session().count("a[href]") != before
                        || ctx.links().hasUnseen(ctx.links().contentLinks(ctx.session())),
                "control reveal");
        ctx.links().collect(ctx.session());
    }
}
