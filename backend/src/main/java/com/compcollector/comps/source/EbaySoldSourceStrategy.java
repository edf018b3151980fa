package com.compcollector.comps.source;

import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.ListingTile;
import com.compcollector.comps.model.SourceId;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.pattern.PatternMatcher;
import com.compcollector.comps.pattern.PatternScanResult;
import com.compcollector.comps.pattern.ScoredTile;
import com.compcollector.comps.util.QueryNormalizer;
import com.compcollector.comps.util.StorageKeys;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Sold and completed eBay listings, newest first.
 *
 * <p>When the exact query returns nothing it is retried once with grading and print-run tokens
 * removed. If structured tiles are still missing, bare item links are reported without opening
 * their listing pages. With a reference signature the results page is scanned visually and only
 * resembling listings are kept.</p>
 */
@Component
public class EbaySoldSourceStrategy extends AbstractSourceStrategy {
    private static final Logger log = LoggerFactory.getLogger(EbaySoldSourceStrategy.class);

    static final String TILE_FALLBACK_NOTE = "Search tile fallback (listing page not opened).";
    static final String NO_MATCH_NOTE = "No confident visual match; results are unfiltered.";

    private final EbaySoldListingExtractor ebayExtractor;
    private final PatternMatcher patternMatcher;

    public EbaySoldSourceStrategy(
        EbaySoldListingExtractor extractor,
        EvidenceCaptureService captureService,
        PlaybookRuleApplier ruleApplier,
        PatternMatcher patternMatcher,
        CollectorProperties properties
    ) {
        super(extractor, captureService, ruleApplier, properties);
        this.ebayExtractor = extractor;
        this.patternMatcher = patternMatcher;
    }

    @Override
    public SourceId source() {
        return SourceId.EBAY_SOLD;
    }

    @Override
    public String searchUrl(String query) {
        return "https://www.ebay.com/sch/i.html?_nkw=" + encode(query) + "&LH_Sold=1&LH_Complete=1&_sop=13";
    }

    @Override
    protected String readySelector() {
        return EbaySoldListingExtractor.TILE_SELECTOR;
    }

    @Override
    protected SearchOutcome selectCandidates(SourceRequest request, SourcePage page, SearchOutcome search) {
        SearchOutcome current = search;
        String queryNote = null;
        List<ListingTile> tiles = ebayExtractor.extractTiles(page.content(), page.url());

        if (tiles.isEmpty()) {
            String loosened = QueryNormalizer.loosen(request.query());
            if (QueryNormalizer.differs(request.query(), loosened)) {
                log.info("eBay search for job {} returned no tiles, retrying with '{}'", request.jobId(), loosened);
                String loosenedUrl = searchUrl(loosened);
                openSearch(page, loosenedUrl, request);
                String shot = captureService.captureAndUpload(
                    page,
                    StorageKeys.searchScreenshotKey(request.jobId(), source().key(), loosened)
                );
                current = new SearchOutcome(
                    loosenedUrl,
                    shot.isEmpty() ? search.searchScreenshotUrl() : shot,
                    List.of()
                );
                queryNote = "Results for loosened query \"" + loosened + "\".";
                tiles = ebayExtractor.extractTiles(page.content(), page.url());
            }
        }

        List<Candidate> candidates = new ArrayList<>();
        if (tiles.isEmpty()) {
            List<ListingTile> fallback = ebayExtractor.extractFallbackTiles(page.content(), page.url());
            for (ListingTile tile : truncate(fallback, request.maxComps())) {
                candidates.add(new Candidate(tile, null, joinNotes(queryNote, TILE_FALLBACK_NOTE), false));
            }
            return current.withCandidates(candidates);
        }

        if (request.patternMatchingRequested()) {
            PatternScanResult scan = patternMatcher.scan(page, ebayExtractor, request.referenceSignature(), request.maxComps());
            if (scan.hasMatches()) {
                for (ScoredTile scored : truncate(scan.matched(), request.maxComps())) {
                    candidates.add(new Candidate(scored.tile(), scored.match(), queryNote, true));
                }
                return current.withCandidates(candidates);
            }
            log.info("No visual match among {} eBay tiles for job {}", scan.scannedCount(), request.jobId());
            queryNote = joinNotes(queryNote, NO_MATCH_NOTE);
        }

        for (ListingTile tile : truncate(tiles, request.maxComps())) {
            candidates.add(new Candidate(tile, null, queryNote, true));
        }
        return current.withCandidates(candidates);
    }
}
