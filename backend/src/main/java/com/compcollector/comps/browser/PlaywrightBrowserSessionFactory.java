package com.compcollector.comps.browser;

import com.compcollector.config.CollectorProperties;
import com.compcollector.comps.model.ErrorKind;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSessionFactory.class);

    private final CollectorProperties properties;

    public PlaywrightBrowserSessionFactory(CollectorProperties properties) {
        this.properties = properties;
    }

    @Override
    public BrowserSession open() {
        CollectorProperties.Browser config = properties.getBrowser();
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(
                new BrowserType.LaunchOptions()
                    .setHeadless(config.isHeadless())
                    .setArgs(config.getLaunchArgs())
            );
            BrowserContext context = browser.newContext(
                new Browser.NewContextOptions()
                    .setViewportSize(config.getViewportWidth(), config.getViewportHeight())
                    .setUserAgent(config.getUserAgent())
            );
            return new PlaywrightBrowserSession(playwright, browser, context, config);
        } catch (PlaywrightException e) {
            if (playwright != null) {
                try {
                    playwright.close();
                } catch (Exception closeError) {
                    log.debug("Failed to close playwright after launch failure: {}", closeError.getMessage());
                }
            }
            throw new SourceAutomationException(ErrorKind.OTHER, "Browser launch failed: " + e.getMessage(), e);
        }
    }
}
