package com.compcollector.comps.browser;

/**
 * Isolated browser context created for exactly one source attempt and released by its owner.
 */
public interface BrowserSession extends AutoCloseable {

    SourcePage newPage();

    @Override
    void close();
}
