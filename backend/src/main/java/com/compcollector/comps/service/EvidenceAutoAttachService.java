package com.compcollector.comps.service;

import com.compcollector.comps.model.Comp;
import com.compcollector.comps.model.EvidenceItem;
import com.compcollector.comps.model.JobResult;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.persistence.EvidenceRepository;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Copies the best comps of one source onto the card asset as permanent evidence rows.
 */
@Service
public class EvidenceAutoAttachService {
    private static final Logger log = LoggerFactory.getLogger(EvidenceAutoAttachService.class);

    private final EvidenceRepository evidenceRepository;
    private final CollectorProperties properties;

    public EvidenceAutoAttachService(EvidenceRepository evidenceRepository, CollectorProperties properties) {
        this.evidenceRepository = evidenceRepository;
        this.properties = properties;
    }

    /**
     * @return number of evidence rows inserted
     */
    public int attach(String subjectId, JobResult result) {
        CollectorProperties.AutoAttach config = properties.getAutoAttach();
        if (!config.isEnabled() || subjectId == null || subjectId.isBlank() || result == null) {
            return 0;
        }
        String sourceKey = config.getSource() == null ? "" : config.getSource().trim().toLowerCase(Locale.ROOT);
        SourceResult source = result.sources().stream()
            .filter(candidate -> sourceKey.equals(candidate.source()))
            .findFirst()
            .orElse(null);
        if (source == null || source.comps().isEmpty()) {
            return 0;
        }

        List<Comp> top = topComps(source.comps(), config.getTopK());
        Set<String> alreadyAttached = evidenceRepository.findAttachedUrls(subjectId);
        int inserted = 0;
        for (Comp comp : top) {
            if (alreadyAttached.contains(comp.url())) {
                continue;
            }
            EvidenceItem item = new EvidenceItem(
                subjectId,
                comp.source(),
                comp.title(),
                comp.url(),
                comp.screenshotUrl(),
                comp.price(),
                comp.soldDate(),
                evidenceNote(comp)
            );
            if (evidenceRepository.insertEvidence(item)) {
                inserted++;
            }
        }
        log.info("Attached {} {} comps as evidence for subject {}", inserted, sourceKey, subjectId);
        return inserted;
    }

    /**
     * Visually matched comps first by score, then the rest in result order; one comp per URL.
     */
    static List<Comp> topComps(List<Comp> comps, int topK) {
        List<Comp> ranked = new ArrayList<>(comps);
        ranked.sort(Comparator.comparingDouble(EvidenceAutoAttachService::rankScore).reversed());
        Set<String> seen = new LinkedHashSet<>();
        List<Comp> top = new ArrayList<>();
        for (Comp comp : ranked) {
            if (top.size() >= topK) {
                break;
            }
            if (comp.url() == null || comp.url().isBlank() || !seen.add(comp.url())) {
                continue;
            }
            top.add(comp);
        }
        return top;
    }

    private static double rankScore(Comp comp) {
        return comp.patternMatch() == null ? -1.0 : comp.patternMatch().score();
    }

    private static String evidenceNote(Comp comp) {
        if (comp.patternMatch() == null) {
            return comp.notes();
        }
        String match = String.format(Locale.ROOT, "Visual match %s (%.2f).",
            comp.patternMatch().tier().value(), comp.patternMatch().score());
        return comp.notes() == null ? match : comp.notes() + " " + match;
    }
}
