package com.compcollector.comps.service;

import com.compcollector.comps.browser.BrowserSession;
import com.compcollector.comps.browser.BrowserSessionFactory;
import com.compcollector.comps.model.ErrorKind;
import com.compcollector.comps.model.ImageSignature;
import com.compcollector.comps.model.PlaybookRule;
import com.compcollector.comps.model.SourceId;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.comps.model.SourceResult;
import com.compcollector.comps.persistence.PlaybookRuleRepository;
import com.compcollector.comps.source.SourceStrategy;
import com.compcollector.comps.util.ErrorClassifier;
import com.compcollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs each requested source in its own browser session and merges the per-source results.
 *
 * <p>Sources run sequentially in request order. A source that keeps failing yields a result with
 * an error instead of aborting the job, so this service never throws for source failures.</p>
 */
@Service
public class SourceOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(SourceOrchestratorService.class);

    private final Map<SourceId, SourceStrategy> strategies;
    private final BrowserSessionFactory sessionFactory;
    private final PlaybookRuleRepository ruleRepository;
    private final CollectorProperties properties;

    public SourceOrchestratorService(
        List<SourceStrategy> strategies,
        BrowserSessionFactory sessionFactory,
        PlaybookRuleRepository ruleRepository,
        CollectorProperties properties
    ) {
        this.strategies = new EnumMap<>(SourceId.class);
        for (SourceStrategy strategy : strategies) {
            this.strategies.put(strategy.source(), strategy);
        }
        this.sessionFactory = sessionFactory;
        this.ruleRepository = ruleRepository;
        this.properties = properties;
    }

    public List<SourceResult> collect(
        String jobId,
        List<String> sources,
        String query,
        int maxComps,
        String categoryType,
        ImageSignature referenceSignature
    ) {
        List<SourceResult> results = new ArrayList<>();
        for (String key : distinctSources(sources)) {
            SourceStrategy strategy = SourceId.fromKey(key).map(strategies::get).orElse(null);
            if (strategy == null) {
                log.warn("Job {} requested unsupported source {}", jobId, key);
                results.add(SourceResult.failed(key, "", "Unsupported source: " + key));
                continue;
            }
            SourceRequest request = new SourceRequest(
                jobId,
                query,
                maxComps,
                categoryType,
                loadRules(key),
                referenceSignature
            );
            results.add(runWithRetry(strategy, request));
        }
        return results;
    }

    SourceResult runWithRetry(SourceStrategy strategy, SourceRequest request) {
        String key = strategy.source().key();
        int maxAttempts = properties.getRetry().getMaxSourceAttempts();
        String searchUrl = safeSearchUrl(strategy, request.query());
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            BrowserSession session = null;
            try {
                session = sessionFactory.open();
                return strategy.collect(request, session);
            } catch (RuntimeException e) {
                ErrorKind kind = ErrorClassifier.classify(e);
                lastError = ErrorClassifier.describe(e);
                if (!kind.isRetryable() || attempt >= maxAttempts) {
                    log.warn("Source {} failed for job {} on attempt {}/{} ({})",
                        key, request.jobId(), attempt, maxAttempts, kind, e);
                    break;
                }
                log.info("Source {} hit {} for job {} on attempt {}/{}, retrying with a fresh session",
                    key, kind, request.jobId(), attempt, maxAttempts);
            } finally {
                releaseQuietly(session);
            }
        }
        return SourceResult.failed(key, searchUrl, lastError);
    }

    static List<String> distinctSources(List<String> sources) {
        if (sources == null) {
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String source : sources) {
            if (source != null && !source.isBlank()) {
                distinct.add(source.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(distinct);
    }

    private List<PlaybookRule> loadRules(String source) {
        try {
            return ruleRepository.findEnabledRules(source);
        } catch (RuntimeException e) {
            log.warn("Failed to load playbook rules for {}; continuing without them", source, e);
            return List.of();
        }
    }

    private String safeSearchUrl(SourceStrategy strategy, String query) {
        try {
            return strategy.searchUrl(query);
        } catch (RuntimeException e) {
            return "";
        }
    }

    private void releaseQuietly(BrowserSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring browser session close failure: {}", e.getMessage());
        }
    }
}
