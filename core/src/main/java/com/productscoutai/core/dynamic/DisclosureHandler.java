package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import com.productscoutai.core.model.CrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * 아코디언/익스팬더: aria-expanded=false 인 토글을 하나씩 펼친다.
 * 펼침 판정 = aria-expanded=true + 높이가 두 번 연속 같음.
 */
final class DisclosureHandler implements TriggerHandler {
    private static final Logger LOG = LoggerFactory.getLogger(DisclosureHandler.class);

    private final String kind;
    private final Function<CrawlConfig.DynamicCfg, String> selector;

    DisclosureHandler(String kind, Function<CrawlConfig.DynamicCfg, String> selector) {
        this.kind = kind;
        this.selector = selector;
    }

    static DisclosureHandler accordions() {
        return new DisclosureHandler("accordion", CrawlConfig.DynamicCfg::getAccordionSelector);
    }

    static DisclosureHandler expanders() {
        return new DisclosureHandler("expander", CrawlConfig.DynamicCfg::getExpanderSelector);
    }

    @Override
    public void exhaust(HandlerContext ctx) throws AutomationException {
        IBrowserSession s = ctx.session();
        String sel = selector.apply(ctx.cfg());
        int total = s.count(sel);
        int opened = 0;
        for (int i = 0; i < total && opened < ctx.cfg().getMaxToggles(); i++) {
            if (!"false".equals(s.attributeNth(sel, i, "aria-expanded"))) continue;
            final int idx = i;
            s.clickNth(sel, idx);
            double[] last = {Double.NaN};
            ctx.waiter().until(() -> {
                if (!"true".equals(s.attributeNth(sel, idx, "aria-expanded"))) return false;
                double h = s.elementHeight(sel, idx);
                boolean stable = h == last[0];
                last[0] = h;
                return stable;
            }, kind + " " + idx + " expanded");
            opened++;
            LOG.debug("{} {} revealed {} link(s)", kind, idx, ctx.links().collect(s));
        }
        if (opened == 0) {
            TabsHandler.clickControlOnce(ctx);
        }
    }
}
