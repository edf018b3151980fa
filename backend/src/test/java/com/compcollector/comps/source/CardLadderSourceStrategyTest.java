package com.compcollector.comps.source;

import com.compcollector.comps.browser.FakeBrowserSession;
import com.compcollector.comps.browser.FakeSourcePage;
import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.storage.RecordingUploader;
import com.compcollector.config.CollectorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CardLadderSourceStrategyTest {
    private static final String RESULTS = """
        <html><body>
          <a href="/card/2020-panini-prizm-justin-herbert-325-psa-10">2020 Prizm Herbert PSA 10</a>
          <a href="/card/2020-panini-prizm-justin-herbert-silver-325-psa-10">2020 Prizm Herbert Silver PSA 10</a>
        </body></html>
        """;

    private CollectorProperties properties;
    private RecordingUploader uploader;
    private CardLadderSourceStrategy strategy;

    @BeforeEach
    void setUp() {
        properties = new CollectorProperties();
        uploader = new RecordingUploader();
        strategy = new CardLadderSourceStrategy(
            new CardLadderListingExtractor(),
            new EvidenceCaptureService(uploader, properties),
            new PlaybookRuleApplier(),
            properties
        );
    }

    @Test
    void loginRedirectIsReportedAsSourceError() {
        FakeBrowserSession session = new FakeBrowserSession()
            .redirect(strategy.searchUrl("Herbert PSA 10"), "https://www.cardladder.com/login?redirect=%2Fsearch")
            .page("https://www.cardladder.com/login?redirect=%2Fsearch", "<html><body><form>Sign in</form></body></html>");

        SourceResult result = strategy.collect(request(), session);

        assertEquals(CardLadderSourceStrategy.LOGIN_REQUIRED, result.error());
        assertEquals(strategy.searchUrl("Herbert PSA 10"), result.searchUrl());
        assertThat(result.comps()).isEmpty();
        assertThat(uploader.keys()).isEmpty();
        assertTrue(session.allPagesClosed());
    }

    @Test
    void configuredTokensAreSentAsHeaders() {
        properties.getCardLadder().setBearerToken(" id-token ");
        properties.getCardLadder().setAppCheckToken("app-check");
        FakeBrowserSession session = new FakeBrowserSession().page(strategy.searchUrl("Herbert PSA 10"), RESULTS);

        SourceResult result = strategy.collect(request(), session);

        assertNull(result.error());
        FakeSourcePage searchPage = session.openedPages().get(0);
        assertEquals(
            Map.of("Authorization", "Bearer id-token", "x-firebase-appcheck", "app-check"),
            searchPage.extraHeaders()
        );
        assertEquals(2, result.comps().size());
        assertThat(result.comps()).allSatisfy(comp -> assertEquals(CardLadderSourceStrategy.NOTE, comp.notes()));
    }

    @Test
    void noTokenMeansNoExtraHeaders() {
        FakeBrowserSession session = new FakeBrowserSession().page(strategy.searchUrl("Herbert PSA 10"), RESULTS);

        strategy.collect(request(), session);

        assertThat(session.openedPages().get(0).extraHeaders()).isEmpty();
    }

    private SourceRequest request() {
        return new SourceRequest("job-9", "Herbert PSA 10", 5, null, List.of(), null);
    }
}
