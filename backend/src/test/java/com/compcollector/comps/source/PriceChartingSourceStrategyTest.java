package com.compcollector.comps.source;

import com.compcollector.comps.browser.FakeBrowserSession;
import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.storage.RecordingUploader;
import com.compcollector.config.CollectorProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PriceChartingSourceStrategyTest {
    private static final String RESULTS = """
        <html><body><table>
          <tr><td><a href="/game/pokemon-base-set/charizard-4">Charizard #4</a></td>
              <td class="used_price"><span class="js-price">$355.00</span></td></tr>
        </table></body></html>
        """;

    private final CollectorProperties properties = new CollectorProperties();
    private final PriceChartingSourceStrategy strategy = new PriceChartingSourceStrategy(
        new PriceChartingListingExtractor(),
        new EvidenceCaptureService(new RecordingUploader(), properties),
        new PlaybookRuleApplier(),
        properties
    );

    @Test
    void categoryHintOpensMoreMenuAndPicksFirstAvailableLabel() {
        FakeBrowserSession session = new FakeBrowserSession()
            .page(strategy.searchUrl("Charizard Base Set"), RESULTS)
            .clickableText("More", "Pokémon");

        SourceResult result = strategy.collect(request("tcg"), session);

        assertEquals(List.of("More", "Pokemon", "Pokémon"), session.openedPages().get(0).clickedTexts());
        assertEquals(1, result.comps().size());
        assertEquals("$355.00", result.comps().get(0).price());
        assertEquals(PriceChartingSourceStrategy.NOTE, result.comps().get(0).notes());
    }

    @Test
    void unknownCategoryLeavesResultsUnfiltered() {
        FakeBrowserSession session = new FakeBrowserSession().page(strategy.searchUrl("Charizard Base Set"), RESULTS);

        strategy.collect(request("comics"), session);
        strategy.collect(request(null), session);

        assertThat(session.openedPages()).allSatisfy(page -> assertThat(page.clickedTexts()).isEmpty());
    }

    private SourceRequest request(String categoryType) {
        return new SourceRequest("job-2", "Charizard Base Set", 5, categoryType, List.of(), null);
    }
}
