package com.compcollector.comps.source;

import com.compcollector.comps.browser.SourcePage;
import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.SourceId;
import com.compcollector.comps.model.SourceRequest;
import com.compcollector.config.CollectorProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class CardLadderSourceStrategy extends AbstractSourceStrategy {
    static final String NOTE = "CardLadder comp screenshot.";
    static final String LOGIN_REQUIRED = "Card Ladder login required.";

    public CardLadderSourceStrategy(
        CardLadderListingExtractor extractor,
        EvidenceCaptureService captureService,
        PlaybookRuleApplier ruleApplier,
        CollectorProperties properties
    ) {
        super(extractor, captureService, ruleApplier, properties);
    }

    @Override
    public SourceId source() {
        return SourceId.CARDLADDER;
    }

    @Override
    public String searchUrl(String query) {
        return "https://www.cardladder.com/search?query=" + encode(query);
    }

    @Override
    protected String readySelector() {
        return CardLadderListingExtractor.TILE_SELECTOR;
    }

    @Override
    protected String sourceNote() {
        return NOTE;
    }

    @Override
    protected void beforeNavigate(SourcePage page, SourceRequest request) {
        CollectorProperties.CardLadder config = properties.getCardLadder();
        String bearer = config.getBearerToken();
        if (bearer == null || bearer.isBlank()) {
            return;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + bearer.trim());
        String appCheck = config.getAppCheckToken();
        if (appCheck != null && !appCheck.isBlank()) {
            headers.put("x-firebase-appcheck", appCheck.trim());
        }
        page.setExtraHeaders(headers);
    }

    @Override
    protected String blockedReason(SourcePage page) {
        String current = page.url();
        if (current == null) {
            return null;
        }
        String lower = current.toLowerCase(Locale.ROOT);
        if (lower.contains("login") || lower.contains("signin")) {
            return LOGIN_REQUIRED;
        }
        return null;
    }
}
