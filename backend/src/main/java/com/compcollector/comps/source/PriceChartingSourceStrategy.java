package com.compcollector.comps.source;

import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.SourceId;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class PriceChartingSourceStrategy extends AbstractSourceStrategy {
    private static final Logger log = LoggerFactory.getLogger(PriceChartingSourceStrategy.class);

    static final String NOTE = "PriceCharting comp screenshot.";
    private static final Map<String, List<String>> CATEGORY_LABELS = Map.of(
        "sport", List.of("Sports", "Sports Cards", "Baseball", "Basketball", "Football"),
        "tcg", List.of("Pokemon", "Pokémon", "TCG", "Trading Card Game")
    );

    public PriceChartingSourceStrategy(
        PriceChartingListingExtractor extractor,
        EvidenceCaptureService captureService,
        PlaybookRuleApplier ruleApplier,
        CollectorProperties properties
    ) {
        super(extractor, captureService, ruleApplier, properties);
    }

    @Override
    public SourceId source() {
        return SourceId.PRICECHARTING;
    }

    @Override
    public String searchUrl(String query) {
        return "https://www.pricecharting.com/search-products?q=" + encode(query);
    }

    @Override
    protected String readySelector() {
        return PriceChartingListingExtractor.TILE_SELECTOR;
    }

    @Override
    protected String sourceNote() {
        return NOTE;
    }

    /**
     * Narrows results to the job's category through the site's "More" menu when a hint is present.
     */
    @Override
    protected void afterReady(SourcePage page, SourceRequest request) {
        String category = request.categoryType() == null ? null : request.categoryType().trim().toLowerCase(Locale.ROOT);
        List<String> labels = category == null ? null : CATEGORY_LABELS.get(category);
        if (labels == null) {
            return;
        }
        page.clickByText("More");
        for (String label : labels) {
            if (page.clickByText(label)) {
                log.debug("PriceCharting category '{}' selected for job {}", label, request.jobId());
                return;
            }
        }
        log.debug("No PriceCharting category link found for '{}'", category);
    }
}
