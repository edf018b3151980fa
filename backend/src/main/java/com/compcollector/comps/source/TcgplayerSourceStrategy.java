package com.compcollector.comps.source;

import com.compcollector.comps.capture.EvidenceCaptureService;
import com.compcollector.comps.model.SourceId;
import com.compcollector.config.CollectorProperties;
import org.springframework.stereotype.Component;

@Component
public class TcgplayerSourceStrategy extends AbstractSourceStrategy {
    static final String NOTE = "TCGplayer price is market/recent sales when available.";

    public TcgplayerSourceStrategy(
        TcgplayerListingExtractor extractor,
        EvidenceCaptureService captureService,
        PlaybookRuleApplier ruleApplier,
        CollectorProperties properties
    ) {
        super(extractor, captureService, ruleApplier, properties);
    }

    @Override
    public SourceId source() {
        return SourceId.TCGPLAYER;
    }

    @Override
    public String searchUrl(String query) {
        return "https://www.tcgplayer.com/search/all/product?q=" + encode(query) + "&view=grid";
    }

    @Override
    protected String readySelector() {
        return TcgplayerListingExtractor.TILE_SELECTOR;
    }

    @Override
    protected String sourceNote() {
        return NOTE;
    }
}
