package com.productscoutai.core.dynamic;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.BoundingBox;
import com.microsoft.playwright.options.LoadState;
import com.productscoutai.core.api.AutomationException;
import com.productscoutai.core.api.IBrowserSession;
import com.productscoutai.core.model.CrawlConfig;

import java.net.URI;

/** Playwright(Chromium) 기반 세션. 페이지 1개를 노드 간 재사용한다. */
public final class PlaywrightBrowserSession implements IBrowserSession {

    private final CrawlConfig.DynamicCfg cfg;
    private final Playwright playwright;
    private final Browser browser;
    private final Page page;

    public PlaywrightBrowserSession(CrawlConfig.DynamicCfg cfg) {
        this.cfg = cfg;
        this.playwright = Playwright.create();
        try {
            this.browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(cfg.isHeadless()));
            this.page = browser.newPage();
            page.setDefaultTimeout(cfg.getWaitTimeout().toMillis());
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    @Override
    public void open(URI url) throws AutomationException {
        try {
            page.navigate(url.toString(), new Page.NavigateOptions().setTimeout(cfg.getNavigationTimeout().toMillis()));
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        } catch (PlaywrightException e) {
            throw new AutomationException("navigate failed: " + url, e);
        }
    }

    @Override
    public String html() throws AutomationException {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw new AutomationException("content failed", e);
        }
    }

    @Override
    public URI currentUrl() throws AutomationException {
        try {
            return URI.create(page.url());
        } catch (PlaywrightException | IllegalArgumentException e) {
            throw new AutomationException("url failed", e);
        }
    }

    @Override
    public int count(String selector) throws AutomationException {
        try {
            return page.locator(selector).count();
        } catch (PlaywrightException e) {
            throw new AutomationException("count failed: " + selector, e);
        }
    }

    @Override
    public boolean isVisible(String selector) throws AutomationException {
        try {
            return page.locator(selector).first().isVisible();
        } catch (PlaywrightException e) {
            throw new AutomationException("visibility check failed: " + selector, e);
        }
    }

    @Override
    public void click(String selector) throws AutomationException {
        clickLocator(page.locator(selector).first(), selector);
    }

    @Override
    public void clickNth(String selector, int index) throws AutomationException {
        clickLocator(page.locator(selector).nth(index), selector + " #" + index);
    }

    private void clickLocator(Locator loc, String what) throws AutomationException {
        try {
            loc.click(new Locator.ClickOptions().setTimeout(cfg.getWaitTimeout().toMillis()));
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        } catch (PlaywrightException e) {
            throw new AutomationException("click failed: " + what, e);
        }
    }

    @Override
    public String attributeNth(String selector, int index, String name) throws AutomationException {
        try {
            return page.locator(selector).nth(index).getAttribute(name);
        } catch (PlaywrightException e) {
            throw new AutomationException("attribute failed: " + selector, e);
        }
    }

    @Override
    public double elementHeight(String selector, int index) throws AutomationException {
        try {
            BoundingBox bb = page.locator(selector).nth(index).boundingBox();
            return bb == null ? -1 : bb.height;
        } catch (PlaywrightException e) {
            throw new AutomationException("bounding box failed: " + selector, e);
        }
    }

    @Override
    public long scrollHeight() throws AutomationException {
        try {
            Object v = page.evaluate("() => document.body.scrollHeight");
            return v instanceof Number n ? n.longValue() : 0L;
        } catch (PlaywrightException e) {
            throw new AutomationException("scrollHeight failed", e);
        }
    }

    @Override
    public void scrollToBottom() throws AutomationException {
        try {
            page.evaluate("() => window.scrollTo(0, document.body.scrollHeight)");
        } catch (PlaywrightException e) {
            throw new AutomationException("scroll failed", e);
        }
    }

    @Override
    public void close() {
        try {
            browser.close();
        } finally {
            playwright.close();
        }
    }
}
