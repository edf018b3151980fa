package com.compcollector.comps.source;

import com.compcollector.comps.browser.FakeBrowserSession;
import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.Comp;
import com.compcollector.comps.model.PlaybookRule;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.storage.RecordingUploader;
import com.compcollector.config.CollectorProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TcgplayerSourceStrategyTest {
    private final CollectorProperties properties = new CollectorProperties();
    private final TcgplayerSourceStrategy strategy = new TcgplayerSourceStrategy(
        new TcgplayerListingExtractor(),
        new EvidenceCaptureService(new RecordingUploader(), properties),
        new PlaybookRuleApplier(),
        properties
    );

    @Test
    void detailPriceAndSourceNoteAreApplied() {
        String results = """
            <html><body>
              <a href="/product/42382/pokemon-base-set-charizard">Charizard - Base Set</a>
              <a href="/product/106999/pokemon-base-set-shadowless-charizard">Charizard (Shadowless)</a>
              <a href="/product/2/other">Blastoise</a>
            </body></html>
            """;
        String detail = """
            <html><body><span data-testid="product-price">$399.99</span></body></html>
            """;
        FakeBrowserSession session = new FakeBrowserSession()
            .page(strategy.searchUrl("Charizard"), results)
            .page("https://www.tcgplayer.com/product/42382/pokemon-base-set-charizard", detail);

        SourceResult result = strategy.collect(new SourceRequest("job-3", "Charizard", 2,
            null, List.of(new PlaybookRule("r1", "tcgplayer", "click", "#onetrust-accept", null, null, 1, true)), null), session);

        assertEquals("https://www.tcgplayer.com/search/all/product?q=Charizard&view=grid", result.searchUrl());
        assertEquals(2, result.comps().size());
        assertEquals("$399.99", result.comps().get(0).price());
        assertThat(result.comps()).extracting(Comp::notes).containsOnly(TcgplayerSourceStrategy.NOTE);
    }
}
