package com.compcollector.comps.source;

import com.compcollector.comps.browser.BrowserSession;
import com.compcollector.comps.model.SourceId;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.model.SourceResult;

/**
 * Collects comps from one marketplace inside a browser session owned by the caller.
 *
 * <p>Throws only for navigation-level or session-level failures; content problems surface as
 * empty or partial fields on the returned result.</p>
 */
public interface SourceStrategy {

    SourceId source();

    String searchUrl(String query);

    SourceResult collect(SourceRequest request, BrowserSession session);
}
