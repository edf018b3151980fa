package com.compcollector.comps.pattern;

import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.image.ImageSignatureService;
import com.compcollector.comps.image.ImageSignatures;
import com.compcollector.comps.model.ImageSignature;
import com.compcollector.comps.model.ListingTile;
import com.compcollector.comps.model.MatchTier;
import com.compcollector.comps.model.PatternMatch;
import com.compcollector.comps.model.SignatureComparison;
import com.compcollector.comps.source.ListingExtractor;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scrolls a live results page and keeps the tiles whose thumbnail resembles the reference image.
 *
 * <p>Each tile link is scored at most once. Scanning stops after {@code maxComps} accepted tiles,
 * after the configured number of scroll iterations, or when a scroll surfaces no new tiles.</p>
 */
@Component
public class PatternMatcher {
    private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

    private final ImageSignatureService signatureService;
    private final CollectorProperties properties;

    public PatternMatcher(ImageSignatureService signatureService, CollectorProperties properties) {
        this.signatureService = signatureService;
        this.properties = properties;
    }

    public PatternScanResult scan(SourcePage page, ListingExtractor extractor, ImageSignature reference, int maxComps) {
        CollectorProperties.Pattern config = properties.getPattern();
        int limit = Math.max(1, maxComps);
        Set<String> seen = new HashSet<>();
        List<ScoredTile> matched = new ArrayList<>();
        int scanned = 0;
        int iterations = 0;

        while (iterations < config.getMaxScrollIterations() && matched.size() < limit) {
            iterations++;
            List<ListingTile> tiles = extractor.extractTiles(page.content(), page.url());
            int fresh = 0;
            for (ListingTile tile : tiles) {
                if (!seen.add(tile.url())) {
                    continue;
                }
                fresh++;
                if (!tile.hasImage()) {
                    continue;
                }
                scanned++;
                Optional<ImageSignature> signature = signatureService.computeSignature(tile.imageUrl());
                if (signature.isEmpty()) {
                    continue;
                }
                PatternMatch match = toPatternMatch(ImageSignatures.compare(reference, signature.get()));
                if (match.score() >= config.getMinScore()) {
                    matched.add(new ScoredTile(tile, match));
                    if (matched.size() >= limit) {
                        break;
                    }
                }
            }
            if (matched.size() >= limit || iterations >= config.getMaxScrollIterations()) {
                break;
            }
            if (fresh == 0 && iterations > 1) {
                break;
            }
            if (!page.scrollByViewport()) {
                break;
            }
            page.waitForTimeout(config.getScrollDelayMs());
        }

        matched.sort(Comparator.comparingDouble((ScoredTile scored) -> scored.match().score()).reversed());
        log.debug("Pattern scan scored {} tiles over {} iterations, accepted {}", scanned, iterations, matched.size());
        return new PatternScanResult(matched, scanned, iterations);
    }

    public PatternMatch toPatternMatch(SignatureComparison comparison) {
        CollectorProperties.Pattern config = properties.getPattern();
        MatchTier tier = MatchTier.classify(
            comparison.score(),
            config.getMinScore(),
            config.getLikelyScore(),
            config.getVerifiedScore()
        );
        return new PatternMatch(comparison.score(), comparison.distance(), comparison.colorDistance(), tier);
    }
}
