package com.compcollector.comps.service;

import com.compcollector.comps.browser.BrowserSessionFactory;
import com.compcollector.comps.browser.FakeBrowserSession;
import com.compcollector.comps.browser.SourceAutomationException;
import com.compcollector.comps.model.ErrorKind;
import com.compcollector.comps.model.PlaybookRule;
import com.compcollector.comps.model.SourceId;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.persistence.PlaybookRuleRepository;
import com.compcollector.comps.source.SourceStrategy;
import com.compcollector.config.CollectorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceOrchestratorServiceTest {
    private static final String QUERY = "2020 Prizm Herbert PSA 10";

    @Mock
    private SourceStrategy ebay;

    @Mock
    private SourceStrategy tcgplayer;

    @Mock
    private BrowserSessionFactory sessionFactory;

    @Mock
    private PlaybookRuleRepository ruleRepository;

    private SourceOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        when(ebay.source()).thenReturn(SourceId.EBAY_SOLD);
        when(tcgplayer.source()).thenReturn(SourceId.TCGPLAYER);
        orchestrator = new SourceOrchestratorService(List.of(ebay, tcgplayer), sessionFactory, ruleRepository,
            new CollectorProperties());
    }

    @Test
    void crashedSessionIsRetriedInFreshSession() {
        FakeBrowserSession first = new FakeBrowserSession();
        FakeBrowserSession second = new FakeBrowserSession();
        when(sessionFactory.open()).thenReturn(first, second);
        when(ruleRepository.findEnabledRules("ebay_sold")).thenReturn(List.of());
        when(ebay.collect(any(SourceRequest.class), any()))
            .thenThrow(new RuntimeException("Target crashed"))
            .thenReturn(SourceResult.success("ebay_sold", "https://ebay.test/search", "https://cdn.test/s.jpg", List.of()));

        List<SourceResult> results = orchestrator.collect("job-1", List.of("ebay_sold"), QUERY, 5, null, null);

        assertEquals(1, results.size());
        assertNull(results.get(0).error());
        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
        verify(ebay, times(2)).collect(any(SourceRequest.class), any());
    }

    @Test
    void nonRetryableFailureBecomesSourceErrorAndOtherSourcesRun() {
        when(sessionFactory.open()).thenAnswer(invocation -> new FakeBrowserSession());
        when(ruleRepository.findEnabledRules(anyString())).thenReturn(List.of());
        when(ebay.searchUrl(QUERY)).thenReturn("https://ebay.test/search");
        when(ebay.collect(any(SourceRequest.class), any()))
            .thenThrow(new SourceAutomationException(ErrorKind.NAVIGATION_TIMEOUT, "Timeout 20000ms exceeded."));
        when(tcgplayer.collect(any(SourceRequest.class), any()))
            .thenReturn(SourceResult.success("tcgplayer", "https://tcg.test/search", "", List.of()));

        List<SourceResult> results = orchestrator.collect("job-1", List.of("ebay_sold", "tcgplayer"), QUERY, 5, null, null);

        assertThat(results).extracting(SourceResult::source).containsExactly("ebay_sold", "tcgplayer");
        SourceResult failed = results.get(0);
        assertEquals("Timeout 20000ms exceeded.", failed.error());
        assertEquals("https://ebay.test/search", failed.searchUrl());
        assertThat(failed.comps()).isEmpty();
        assertFalse(results.get(1).hasError());
        verify(ebay, times(1)).collect(any(SourceRequest.class), any());
    }

    @Test
    void exhaustedRetriesReportLastError() {
        when(sessionFactory.open()).thenAnswer(invocation -> new FakeBrowserSession());
        when(ruleRepository.findEnabledRules("ebay_sold")).thenReturn(List.of());
        when(ebay.collect(any(SourceRequest.class), any()))
            .thenThrow(new SourceAutomationException(ErrorKind.SESSION_CRASHED, "Target crashed"));

        List<SourceResult> results = orchestrator.collect("job-1", List.of("ebay_sold"), QUERY, 5, null, null);

        assertEquals("Target crashed", results.get(0).error());
        verify(sessionFactory, times(2)).open();
    }

    @Test
    void unsupportedAndDuplicateSourcesAreNormalized() {
        when(sessionFactory.open()).thenAnswer(invocation -> new FakeBrowserSession());
        when(ruleRepository.findEnabledRules("ebay_sold")).thenReturn(List.of());
        when(ebay.collect(any(SourceRequest.class), any()))
            .thenReturn(SourceResult.success("ebay_sold", "https://ebay.test/search", "", List.of()));

        List<SourceResult> results = orchestrator.collect(
            "job-1", Arrays.asList(" EBAY_SOLD ", "ebay_sold", "goldin", null), QUERY, 5, null, null);

        assertEquals(2, results.size());
        assertEquals("goldin", results.get(1).source());
        assertEquals("Unsupported source: goldin", results.get(1).error());
        verify(ebay, times(1)).collect(any(SourceRequest.class), any());
    }

    @Test
    void sessionCloseFailureDoesNotMaskResult() {
        when(sessionFactory.open()).thenReturn(new FakeBrowserSession().failOnClose(new IllegalStateException("already closed")));
        when(ruleRepository.findEnabledRules("tcgplayer")).thenReturn(List.of());
        when(tcgplayer.collect(any(SourceRequest.class), any()))
            .thenReturn(SourceResult.success("tcgplayer", "https://tcg.test/search", "", List.of()));

        List<SourceResult> results = orchestrator.collect("job-1", List.of("tcgplayer"), QUERY, 5, null, null);

        assertNull(results.get(0).error());
    }

    @Test
    void ruleLookupFailureRunsWithoutRules() {
        when(sessionFactory.open()).thenAnswer(invocation -> new FakeBrowserSession());
        when(ruleRepository.findEnabledRules("ebay_sold")).thenThrow(new DataAccessResourceFailureException("db down"));
        when(ebay.collect(any(SourceRequest.class), any()))
            .thenReturn(SourceResult.success("ebay_sold", "https://ebay.test/search", "", List.of()));

        orchestrator.collect("job-7", List.of("ebay_sold"), QUERY, 3, "sport", null);

        ArgumentCaptor<SourceRequest> captor = ArgumentCaptor.forClass(SourceRequest.class);
        verify(ebay).collect(captor.capture(), any());
        SourceRequest request = captor.getValue();
        assertThat(request.rules()).isEmpty();
        assertEquals("job-7", request.jobId());
        assertEquals(3, request.maxComps());
        assertEquals("sport", request.categoryType());
        assertFalse(request.patternMatchingRequested());
    }

    @Test
    void rulesArePassedToTheStrategy() {
        PlaybookRule rule = new PlaybookRule("r1", "ebay_sold", "click", "#accept", null, null, 1, true);
        when(sessionFactory.open()).thenAnswer(invocation -> new FakeBrowserSession());
        when(ruleRepository.findEnabledRules("ebay_sold")).thenReturn(List.of(rule));
        when(ebay.collect(any(SourceRequest.class), any()))
            .thenReturn(SourceResult.success("ebay_sold", "https://ebay.test/search", "", List.of()));

        orchestrator.collect("job-1", List.of("ebay_sold"), QUERY, 5, null, null);

        ArgumentCaptor<SourceRequest> captor = ArgumentCaptor.forClass(SourceRequest.class);
        verify(ebay).collect(captor.capture(), any());
        assertThat(captor.getValue().rules()).containsExactly(rule);
    }

    @Test
    void distinctSourcesKeepsFirstOccurrenceOrder() {
        assertEquals(List.of("tcgplayer", "ebay_sold"),
            SourceOrchestratorService.distinctSources(Arrays.asList("TCGplayer", " ", "ebay_sold", "tcgplayer")));
        assertThat(SourceOrchestratorService.distinctSources(null)).isEmpty();
    }
}
