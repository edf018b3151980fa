package com.compcollector.comps.browser;

public interface BrowserSessionFactory {

    BrowserSession open();
}
