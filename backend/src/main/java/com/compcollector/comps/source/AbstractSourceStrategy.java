package com.compcollector.comps.source;

import com.compcollector.comps.browser.BrowserSession;
import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.Comp;
import com.compcollector.comps.model.ErrorKind;
import com.compcollector.comps.model.ListingDetail;
import com.compcollector.comps.model.ListingTile;
import com.compcollector.comps.model.PatternMatch;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.util.ErrorClassifier;
import com.compcollector.comps.util.StorageKeys;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Search, screenshot, extract, then open each kept listing.
 *
 * <p>Subclasses supply the search URL, the ready marker and the extractor; the hooks cover the
 * per-marketplace differences (request headers, category filters, login walls, tile selection).</p>
 */
public abstract class AbstractSourceStrategy implements SourceStrategy {
    private static final Logger log = LoggerFactory.getLogger(AbstractSourceStrategy.class);

    static final String DETAIL_FAILED_NOTE = "Listing page could not be opened; tile fields only.";

    protected final ListingExtractor extractor;
    protected final EvidenceCaptureService captureService;
    protected final PlaybookRuleApplier ruleApplier;
    protected final CollectorProperties properties;

    protected AbstractSourceStrategy(
        ListingExtractor extractor,
        EvidenceCaptureService captureService,
        PlaybookRuleApplier ruleApplier,
        CollectorProperties properties
    ) {
        this.extractor = extractor;
        this.captureService = captureService;
        this.ruleApplier = ruleApplier;
        this.properties = properties;
    }

    /**
     * CSS selector whose presence means results have rendered.
     */
    protected abstract String readySelector();

    /**
     * Note attached to every comp of this source, or {@code null}.
     */
    protected String sourceNote() {
        return null;
    }

    protected void beforeNavigate(SourcePage page, SourceRequest request) {
    }

    protected void afterReady(SourcePage page, SourceRequest request) {
    }

    /**
     * Returns a user-facing reason when the page is a wall (login, captcha) rather than results.
     */
    protected String blockedReason(SourcePage page) {
        return null;
    }

    @Override
    public SourceResult collect(SourceRequest request, BrowserSession session) {
        String searchUrl = searchUrl(request.query());
        SourcePage page = session.newPage();
        try {
            beforeNavigate(page, request);
            openSearch(page, searchUrl, request);
            String blocked = blockedReason(page);
            if (blocked != null) {
                log.info("{} search blocked for job {}: {}", source().key(), request.jobId(), blocked);
                return SourceResult.failed(source().key(), searchUrl, blocked);
            }
            String searchShot = captureService.captureAndUpload(
                page,
                StorageKeys.searchScreenshotKey(request.jobId(), source().key(), request.query())
            );
            SearchOutcome outcome = selectCandidates(request, page, new SearchOutcome(searchUrl, searchShot, List.of()));
            List<Comp> comps = buildComps(request, session, outcome.candidates());
            log.info("{} collected {} comps for job {}", source().key(), comps.size(), request.jobId());
            return SourceResult.success(source().key(), outcome.searchUrl(), outcome.searchScreenshotUrl(), comps);
        } finally {
            closeQuietly(page);
        }
    }

    /**
     * Navigates, waits for the ready marker (absence just means no results), applies playbook
     * rules and lets the page settle.
     */
    protected void openSearch(SourcePage page, String url, SourceRequest request) {
        page.navigate(url);
        if (!page.waitForSelector(readySelector(), properties.getBrowser().getReadyTimeoutMs())) {
            log.debug("{} ready marker {} not found on {}", source().key(), readySelector(), url);
        }
        afterReady(page, request);
        ruleApplier.apply(page, request.rules());
        page.waitForTimeout(properties.getBrowser().getSettleDelayMs());
    }

    /**
     * Picks the listings to turn into comps. The default keeps the first {@code maxComps} tiles.
     */
    protected SearchOutcome selectCandidates(SourceRequest request, SourcePage page, SearchOutcome search) {
        List<ListingTile> tiles = extractor.extractTiles(page.content(), page.url());
        List<Candidate> candidates = new ArrayList<>();
        for (ListingTile tile : truncate(tiles, request.maxComps())) {
            candidates.add(Candidate.of(tile));
        }
        return search.withCandidates(candidates);
    }

    protected List<Comp> buildComps(SourceRequest request, BrowserSession session, List<Candidate> candidates) {
        List<Comp> comps = new ArrayList<>();
        int position = 0;
        for (Candidate candidate : candidates) {
            position++;
            if (!candidate.openDetail()) {
                comps.add(tileComp(candidate, null));
                continue;
            }
            comps.add(openDetail(request, session, candidate, position));
        }
        return comps;
    }

    /**
     * Opens one listing in its own tab. Failures degrade only this comp, except session-level
     * faults and configuration errors which abort the source attempt.
     */
    protected Comp openDetail(SourceRequest request, BrowserSession session, Candidate candidate, int position) {
        ListingTile tile = candidate.tile();
        SourcePage detail = null;
        try {
            detail = session.newPage();
            detail.navigate(tile.url());
            detail.waitForTimeout(properties.getBrowser().getDetailSettleDelayMs());
            ListingDetail parsed = extractor.extractDetail(detail.content(), detail.url());
            String screenshotUrl = captureService.captureAndUpload(
                detail,
                StorageKeys.compScreenshotKey(request.jobId(), source().key(), position, tile.title())
            );
            return new Comp(
                source().key(),
                tile.title(),
                tile.url(),
                parsed.price() != null ? parsed.price() : tile.price(),
                tile.soldDate(),
                screenshotUrl,
                parsed.listingImageUrl() != null ? parsed.listingImageUrl() : tile.imageUrl(),
                joinNotes(sourceNote(), candidate.note()),
                candidate.match()
            );
        } catch (RuntimeException e) {
            ErrorKind kind = ErrorClassifier.classify(e);
            if (kind == ErrorKind.SESSION_CRASHED || kind == ErrorKind.CONFIGURATION) {
                throw e;
            }
            log.warn("{} detail page {} failed for job {}: {}", source().key(), tile.url(), request.jobId(),
                ErrorClassifier.describe(e));
            return tileComp(candidate, DETAIL_FAILED_NOTE);
        } finally {
            closeQuietly(detail);
        }
    }

    protected Comp tileComp(Candidate candidate, String extraNote) {
        ListingTile tile = candidate.tile();
        return new Comp(
            source().key(),
            tile.title(),
            tile.url(),
            tile.price(),
            tile.soldDate(),
            "",
            tile.imageUrl(),
            joinNotes(joinNotes(sourceNote(), candidate.note()), extraNote),
            candidate.match()
        );
    }

    protected static String encode(String query) {
        return URLEncoder.encode(query == null ? "" : query.trim(), StandardCharsets.UTF_8);
    }

    protected static <T> List<T> truncate(List<T> items, int max) {
        if (items.size() <= max) {
            return items;
        }
        return items.subList(0, max);
    }

    static String joinNotes(String first, String second) {
        StringJoiner joiner = new StringJoiner(" ");
        if (first != null && !first.isBlank()) {
            joiner.add(first.trim());
        }
        if (second != null && !second.isBlank()) {
            joiner.add(second.trim());
        }
        String joined = joiner.toString();
        return joined.isEmpty() ? null : joined;
    }

    protected static void closeQuietly(SourcePage page) {
        if (page == null) {
            return;
        }
        try {
            page.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring page close failure: {}", e.getMessage());
        }
    }

    /**
     * A tile chosen for output, with its optional visual match and note.
     */
    protected record Candidate(ListingTile tile, PatternMatch match, String note, boolean openDetail) {
        static Candidate of(ListingTile tile) {
            return new Candidate(tile, null, null, true);
        }
    }

    protected record SearchOutcome(String searchUrl, String searchScreenshotUrl, List<Candidate> candidates) {
        public SearchOutcome {
            candidates = candidates == null ? List.of() : List.copyOf(candidates);
        }

        SearchOutcome withCandidates(List<Candidate> next) {
            return new SearchOutcome(searchUrl, searchScreenshotUrl, next);
        }
    }
}
