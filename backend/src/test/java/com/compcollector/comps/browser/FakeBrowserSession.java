package com.compcollector.comps.browser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory browser: URLs map to canned HTML, with one HTML state per scroll position.
 */
public class FakeBrowserSession implements BrowserSession {
    final Map<String, List<String>> pages = new HashMap<>();
    final Map<String, String> redirects = new HashMap<>();
    final Map<String, RuntimeException> navigationFailures = new HashMap<>();
    final Deque<RuntimeException> screenshotFailures = new ArrayDeque<>();
    final List<String> clickableTexts = new ArrayList<>();
    private final List<FakeSourcePage> openedPages = new ArrayList<>();
    private final List<String> navigations = new ArrayList<>();
    private RuntimeException closeFailure;
    private boolean closed;

    public FakeBrowserSession page(String url, String... htmlStates) {
        pages.put(url, Arrays.asList(htmlStates));
        return this;
    }

    public FakeBrowserSession redirect(String from, String to) {
        redirects.put(from, to);
        return this;
    }

    public FakeBrowserSession failNavigation(String url, RuntimeException failure) {
        navigationFailures.put(url, failure);
        return this;
    }

    public FakeBrowserSession failScreenshots(RuntimeException... failures) {
        screenshotFailures.addAll(Arrays.asList(failures));
        return this;
    }

    public FakeBrowserSession clickableText(String... texts) {
        clickableTexts.addAll(Arrays.asList(texts));
        return this;
    }

    public FakeBrowserSession failOnClose(RuntimeException failure) {
        this.closeFailure = failure;
        return this;
    }

    @Override
    public SourcePage newPage() {
        FakeSourcePage page = new FakeSourcePage(this);
        openedPages.add(page);
        return page;
    }

    @Override
    public void close() {
        closed = true;
        if (closeFailure != null) {
            throw closeFailure;
        }
    }

    void recordNavigation(String url) {
        navigations.add(url);
    }

    public List<String> navigations() {
        return navigations;
    }

    public List<FakeSourcePage> openedPages() {
        return openedPages;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean allPagesClosed() {
        return openedPages.stream().allMatch(FakeSourcePage::isClosed);
    }
}
