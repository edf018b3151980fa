package com.compcollector.comps.service;

import com.compcollector.comps.model.Comp;
import com.compcollector.comps.model.EvidenceItem;
import com.compcollector.comps.model.JobResult;
import com.compcollector.comps.model.MatchTier;
import com.compcollector.comps.model.PatternMatch;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.persistence.EvidenceRepository;
import com.compcollector.config.CollectorProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvidenceAutoAttachServiceTest {

    @Mock
    private EvidenceRepository evidenceRepository;

    @Test
    void matchedCompsRankFirstAndUrlsAreUnique() {
        List<Comp> comps = List.of(
            comp("a", null, "First tile."),
            comp("b", match(0.8125, MatchTier.LIKELY), null),
            comp("a", null, null),
            comp("c", match(0.96875, MatchTier.VERIFIED), null),
            comp("d", null, null)
        );

        List<Comp> top = EvidenceAutoAttachService.topComps(comps, 3);

        assertThat(top).extracting(Comp::url).containsExactly(url("c"), url("b"), url("a"));
    }

    @Test
    void attachesTopCompsNotAlreadyOnTheCard() {
        CollectorProperties properties = new CollectorProperties();
        properties.getAutoAttach().setTopK(3);
        EvidenceAutoAttachService service = new EvidenceAutoAttachService(evidenceRepository, properties);
        when(evidenceRepository.findAttachedUrls("card-1")).thenReturn(Set.of(url("b")));
        when(evidenceRepository.insertEvidence(any(EvidenceItem.class))).thenReturn(true, false);

        int inserted = service.attach("card-1", result(
            SourceResult.success("tcgplayer", "https://tcg.test/s", "", List.of(comp("t", null, null))),
            SourceResult.success("ebay_sold", "https://ebay.test/s", "", List.of(
                comp("a", null, "Results for loosened query \"Herbert\"."),
                comp("b", match(0.9, MatchTier.VERIFIED), null),
                comp("c", match(0.95, MatchTier.VERIFIED), null),
                comp("d", null, null)
            ))
        ));

        assertEquals(1, inserted);
        ArgumentCaptor<EvidenceItem> captor = ArgumentCaptor.forClass(EvidenceItem.class);
        verify(evidenceRepository, times(2)).insertEvidence(captor.capture());
        EvidenceItem best = captor.getAllValues().get(0);
        assertEquals("card-1", best.subjectId());
        assertEquals(url("c"), best.url());
        assertEquals("Visual match verified (0.95).", best.note());
        EvidenceItem plain = captor.getAllValues().get(1);
        assertEquals(url("a"), plain.url());
        assertEquals("Results for loosened query \"Herbert\".", plain.note());
        assertEquals("https://cdn.test/a.jpg", plain.screenshotUrl());
    }

    @Test
    void disabledOrUnlinkedJobsAttachNothing() {
        CollectorProperties properties = new CollectorProperties();
        EvidenceAutoAttachService service = new EvidenceAutoAttachService(evidenceRepository, properties);
        JobResult result = result(SourceResult.success("ebay_sold", "", "", List.of(comp("a", null, null))));

        assertEquals(0, service.attach(null, result));
        assertEquals(0, service.attach(" ", result));
        properties.getAutoAttach().setEnabled(false);
        assertEquals(0, service.attach("card-1", result));
        verifyNoInteractions(evidenceRepository);
    }

    @Test
    void missingOrEmptySourceAttachesNothing() {
        EvidenceAutoAttachService service = new EvidenceAutoAttachService(evidenceRepository, new CollectorProperties());

        assertEquals(0, service.attach("card-1", result(SourceResult.failed("ebay_sold", "", "Target crashed"))));
        assertEquals(0, service.attach("card-1", result(SourceResult.success("tcgplayer", "", "", List.of(comp("t", null, null))))));
        verifyNoInteractions(evidenceRepository);
    }

    private static JobResult result(SourceResult... sources) {
        return new JobResult("job-1", "card-1", "Herbert PSA 10", Instant.now(), List.of(sources));
    }

    private static Comp comp(String id, PatternMatch match, String notes) {
        return new Comp("ebay_sold", "Herbert " + id, url(id), "$100.00", "Oct 1, 2026",
            "https://cdn.test/" + id + ".jpg", null, notes, match);
    }

    private static PatternMatch match(double score, MatchTier tier) {
        return new PatternMatch(score, (int) Math.round((1 - score) * 64), 0.0, tier);
    }

    private static String url(String id) {
        return "https://www.ebay.com/itm/" + id;
    }
}
