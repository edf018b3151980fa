package com.compcollector.comps.browser;

import java.util.Map;

/**
 * One browser tab owned by a single source attempt.
 *
 * <p>Navigation, content and screenshot calls throw {@link SourceAutomationException} on failure.
 * Waits, clicks and scrolls are best-effort and report success as a boolean instead.</p>
 */
public interface SourcePage extends AutoCloseable {

    void navigate(String url);

    boolean waitForSelector(String selector, int timeoutMs);

    boolean waitForTimeout(int millis);

    String content();

    String url();

    byte[] screenshotJpeg(int quality);

    void reload();

    boolean click(String selector);

    boolean clickByText(String text);

    boolean scrollByViewport();

    void setExtraHeaders(Map<String, String> headers);

    boolean isClosed();

    @Override
    void close();
}
