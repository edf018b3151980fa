package com.compcollector.comps.browser;

import com.compcollector.config.CollectorProperties;
import com.compcollector.comps.util.ErrorClassifier;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class PlaywrightBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final CollectorProperties.Browser config;

    PlaywrightBrowserSession(
        Playwright playwright,
        Browser browser,
        BrowserContext context,
        CollectorProperties.Browser config
    ) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.config = config;
    }

    @Override
    public SourcePage newPage() {
        try {
            Page page = context.newPage();
            page.setDefaultTimeout(config.getNavigationTimeoutMs());
            page.setDefaultNavigationTimeout(config.getNavigationTimeoutMs());
            page.onCrash(crashed -> log.warn("Browser page crashed at {}", crashed.url()));
            return new PlaywrightSourcePage(page, config);
        } catch (PlaywrightException e) {
            throw new SourceAutomationException(ErrorClassifier.classify(e), e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        closeQuietly("context", context);
        closeQuietly("browser", browser);
        closeQuietly("playwright", playwright);
    }

    private void closeQuietly(String label, AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Failed to close {}: {}", label, e.getMessage());
        }
    }
}
