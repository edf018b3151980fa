package com.compcollector.comps.browser;

import com.compcollector.config.CollectorProperties;
import com.compcollector.comps.model.ErrorKind;
import com.compcollector.comps.util.ErrorClassifier;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.AriaRole;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.ScreenshotType;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

class PlaywrightSourcePage implements SourcePage {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightSourcePage.class);
    private static final int CLICK_TIMEOUT_MS = 5000;
    private static final int POST_CLICK_IDLE_MS = 5000;
    private static final int POST_CLICK_DELAY_MS = 600;

    private final Page page;
    private final CollectorProperties.Browser config;

    PlaywrightSourcePage(Page page, CollectorProperties.Browser config) {
        this.page = page;
        this.config = config;
    }

    @Override
    public void navigate(String url) {
        try {
            page.navigate(
                url,
                new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(config.getNavigationTimeoutMs())
            );
        } catch (PlaywrightException e) {
            throw translate("navigate " + url, e);
        }
    }

    @Override
    public boolean waitForSelector(String selector, int timeoutMs) {
        try {
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(Math.max(1, timeoutMs)));
            return true;
        } catch (TimeoutError e) {
            return false;
        } catch (PlaywrightException e) {
            throwIfSessionFault(e);
            log.debug("Wait for selector {} failed: {}", selector, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean waitForTimeout(int millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            if (page.isClosed()) {
                return false;
            }
            page.waitForTimeout(millis);
            return true;
        } catch (PlaywrightException e) {
            return false;
        }
    }

    @Override
    public String content() {
        try {
            return page.content();
        } catch (PlaywrightException e) {
            throw translate("read content", e);
        }
    }

    @Override
    public String url() {
        try {
            return page.url();
        } catch (PlaywrightException e) {
            return "";
        }
    }

    @Override
    public byte[] screenshotJpeg(int quality) {
        try {
            return page.screenshot(
                new Page.ScreenshotOptions()
                    .setType(ScreenshotType.JPEG)
                    .setQuality(quality)
                    .setFullPage(false)
            );
        } catch (PlaywrightException e) {
            throw translate("screenshot", e);
        }
    }

    @Override
    public void reload() {
        try {
            page.reload(new Page.ReloadOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
        } catch (PlaywrightException e) {
            throw translate("reload", e);
        }
    }

    @Override
    public boolean click(String selector) {
        try {
            Locator locator = page.locator(selector);
            if (locator.count() == 0) {
                return false;
            }
            locator.first().click(new Locator.ClickOptions().setTimeout(CLICK_TIMEOUT_MS));
            return true;
        } catch (PlaywrightException e) {
            log.debug("Click on {} failed: {}", selector, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean clickByText(String text) {
        List<Locator> candidates = List.of(
            page.getByRole(AriaRole.LINK, new Page.GetByRoleOptions().setName(text)),
            page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName(text)),
            page.locator("a,button,li,div", new Page.LocatorOptions().setHasText(text))
        );
        for (Locator candidate : candidates) {
            try {
                if (candidate.count() == 0) {
                    continue;
                }
                candidate.first().click(new Locator.ClickOptions().setTimeout(CLICK_TIMEOUT_MS));
                waitForNetworkIdle();
                waitForTimeout(POST_CLICK_DELAY_MS);
                return true;
            } catch (PlaywrightException e) {
                log.debug("Click on text '{}' failed: {}", text, e.getMessage());
            }
        }
        return false;
    }

    @Override
    public boolean scrollByViewport() {
        try {
            page.mouse().wheel(0, config.getViewportHeight());
            return true;
        } catch (PlaywrightException e) {
            throwIfSessionFault(e);
            log.debug("Scroll failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void setExtraHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return;
        }
        try {
            page.setExtraHTTPHeaders(headers);
        } catch (PlaywrightException e) {
            throw translate("set headers", e);
        }
    }

    @Override
    public boolean isClosed() {
        try {
            return page.isClosed();
        } catch (PlaywrightException e) {
            return true;
        }
    }

    @Override
    public void close() {
        try {
            page.close();
        } catch (PlaywrightException e) {
            log.debug("Failed to close page: {}", e.getMessage());
        }
    }

    private void waitForNetworkIdle() {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(POST_CLICK_IDLE_MS));
        } catch (PlaywrightException ignored) {
            // Long-polling pages never go idle.
        }
    }

    private void throwIfSessionFault(PlaywrightException e) {
        ErrorKind kind = ErrorClassifier.classify(e);
        if (kind.isRetryable()) {
            throw new SourceAutomationException(kind, e.getMessage(), e);
        }
    }

    private SourceAutomationException translate(String operation, PlaywrightException e) {
        ErrorKind kind = ErrorClassifier.classify(e);
        String message = e.getMessage() == null ? operation + " failed" : e.getMessage();
        return new SourceAutomationException(kind, message, e);
    }
}
