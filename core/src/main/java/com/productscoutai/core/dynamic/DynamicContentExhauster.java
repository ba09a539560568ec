package com.productscoutai.core.dynamic;

import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import com.productscoutai.core.api.IScoringGateway;
import com.productscoutai.core.model.CrawlConfig;
import com.productscoutai.core.model.DynamicDetection;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.NodeContext;
import com.productscoutai.core.model.TriggerType;
import com.productscoutai.core.util.Sleeper;
import com.productscoutai.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 상품 링크가 나온 페이지의 동적 로딩 UI를 소진해 추가 링크를 모은다.
 * 1) AI 탐지 → 2) 브라우저로 페이지 열기 → 3) 탐지된 핸들러 → 4) 무한 스크롤(항상)
 * 반환 링크는 가공 전 후보이며 입장 심사는 호출자 몫.
 * 브라우저 세션은 첫 사용 시 생성, close()에서 닫는다.
 */
public final class DynamicContentExhauster implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DynamicContentExhauster.class);
    private static final StructuredLog SLOG = StructuredLog.get(DynamicContentExhauster.class);

    private final IScoringGateway gateway;
    private final Supplier<IBrowserSession> sessionFactory;
    private final CrawlConfig.DynamicCfg cfg;
    private final Sleeper sleeper;
    private final Map<TriggerType, TriggerHandler> handlers = new EnumMap<>(TriggerType.class);
    private final TriggerHandler infiniteScroll = new InfiniteScrollHandler();

    private IBrowserSession session;

    public DynamicContentExhauster(IScoringGateway gateway, Supplier<IBrowserSession> sessionFactory,
                                   CrawlConfig.DynamicCfg cfg, Sleeper sleeper) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        handlers.put(TriggerType.PAGINATION, new PaginationHandler());
        handlers.put(TriggerType.LOAD_MORE, new LoadMoreHandler());
        handlers.put(TriggerType.TABS, new TabsHandler());
        handlers.put(TriggerType.ACCORDIONS, DisclosureHandler.accordions());
        handlers.put(TriggerType.EXPANDERS, DisclosureHandler.expanders());
    }

    /**
     * @param batch 방금 스코어링한 후보(id 0..k-1)
     * @return 새로 노출된 원시 링크(id 미배정). 페이지를 못 열면 빈 목록
     */
    public List<LinkInfo> exhaust(NodeContext page, List<LinkInfo> batch) {
        DynamicDetection det = gateway.detectDynamicLoading(page, batch);
        LOG.info("dynamic detection at {}: {}", page.url(), det.isFound() ? det.triggerType() + " #" + det.id() : "none");

        IBrowserSession s;
        RevealedLinks links = new RevealedLinks(cfg.getContentSelector());
        try {
            s = session();
            s.open(page.url());
            links.baseline(s);
        } catch (AutomationException | RuntimeException e) {
            LOG.warn("cannot open {} in browser, skipping dynamic content: {}", page.url(), e.getMessage());
            return List.of();
        }

        Waiter waiter = new Waiter(cfg.getWaitTimeout(), cfg.getPollInterval(), sleeper);
        if (det.isFound()) {
            LinkInfo control = batch.get(det.id());
            run(det.triggerType(), handlers.get(det.triggerType()),
                    new HandlerContext(s, waiter, links, cfg, sleeper, control), page);
        }
        run(TriggerType.INFINITE_SCROLL, infiniteScroll,
                new HandlerContext(s, waiter, links, cfg, sleeper, null), page);

        List<LinkInfo> out = links.revealed();
        SLOG.info("dynamic-exhausted", "url", page.url(), "trigger",
                det.isFound() ? det.triggerType().label() : "none", "revealed", out.size());
        return out;
    }

    private void run(TriggerType type, TriggerHandler handler, HandlerContext ctx, NodeContext page) {
        try {
            handler.exhaust(ctx);
        } catch (AutomationTimeoutException e) {
            LOG.warn("{} handler timed out at {} (keeping {} revealed link(s)): {}",
                    type.label(), page.url(), ctx.links().revealed().size(), e.getMessage());
        } catch (AutomationException e) {
            LOG.warn("{} handler failed at {} (keeping {} revealed link(s)): {}",
                    type.label(), page.url(), ctx.links().revealed().size(), e.getMessage());
        }
    }

    private IBrowserSession session() {
        if (session == null) session = sessionFactory.get();
        return session;
    }

    @Override
    public void close() {
        if (session != null) {
            try {
                session.close();
            } finally {
                session = null;
            }
        }
    }
}
