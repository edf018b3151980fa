package com.compcollector.comps.source;

import com.compcollector.comps.browser.SourceAutomationException;
import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.model.ErrorKind;
import com.compcollector.comps.model.PlaybookRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Replays operator-taught page interactions (dismiss a cookie banner, open a filter) before a
 * search page is read. Rules are advisory: a selector that no longer matches is skipped.
 */
@Component
public class PlaybookRuleApplier {
    private static final Logger log = LoggerFactory.getLogger(PlaybookRuleApplier.class);
    private static final int RULE_WAIT_TIMEOUT_MS = 3000;
    private static final int POST_CLICK_DELAY_MS = 400;

    public int apply(SourcePage page, List<PlaybookRule> rules) {
        List<PlaybookRule> ordered = ordered(rules);
        if (ordered.isEmpty()) {
            return 0;
        }
        String currentUrl = page.url();
        int applied = 0;
        for (PlaybookRule rule : ordered) {
            if (!matchesUrl(rule, currentUrl)) {
                continue;
            }
            try {
                if (applyRule(page, rule)) {
                    applied++;
                } else {
                    log.debug("Playbook rule {} ({} {}) did not match", rule.id(), rule.action(), rule.selector());
                }
            } catch (SourceAutomationException e) {
                if (e.kind() == ErrorKind.SESSION_CRASHED) {
                    throw e;
                }
                log.debug("Playbook rule {} failed: {}", rule.id(), e.getMessage());
            }
        }
        return applied;
    }

    static List<PlaybookRule> ordered(List<PlaybookRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }
        return rules.stream()
            .filter(PlaybookRule::enabled)
            .sorted(Comparator.comparingInt(PlaybookRule::priority).reversed())
            .toList();
    }

    private boolean matchesUrl(PlaybookRule rule, String currentUrl) {
        if (rule.urlContains() == null || rule.urlContains().isBlank()) {
            return true;
        }
        return currentUrl != null && currentUrl.contains(rule.urlContains().trim());
    }

    private boolean applyRule(SourcePage page, PlaybookRule rule) {
        String action = rule.action() == null ? "" : rule.action().trim().toLowerCase(Locale.ROOT);
        switch (action) {
            case "click" -> {
                if (isBlank(rule.selector())) {
                    return false;
                }
                boolean clicked = page.click(rule.selector());
                if (clicked) {
                    page.waitForTimeout(POST_CLICK_DELAY_MS);
                }
                return clicked;
            }
            case "click_text" -> {
                String text = isBlank(rule.label()) ? rule.selector() : rule.label();
                return !isBlank(text) && page.clickByText(text.trim());
            }
            case "wait" -> {
                return !isBlank(rule.selector()) && page.waitForSelector(rule.selector(), RULE_WAIT_TIMEOUT_MS);
            }
            case "scroll" -> {
                return page.scrollByViewport();
            }
            default -> {
                log.debug("Unknown playbook action '{}' on rule {}", rule.action(), rule.id());
                return false;
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
