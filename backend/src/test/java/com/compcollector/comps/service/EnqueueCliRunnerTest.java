package com.compcollector.comps.service;

import com.compcollector.comps.model.EnqueueJobRequest;
import com.compcollector.config.CollectorProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class EnqueueCliRunnerTest {

    @Test
    void buildsRequestFromCliProperties() {
        CollectorProperties.Cli cli = new CollectorProperties.Cli();
        cli.setQuery("  2020 Prizm Herbert PSA 10 ");
        cli.setSources("ebay_sold, pricecharting,,cardladder ");
        cli.setSubjectId("card-42");
        cli.setMaxComps(3);

        EnqueueJobRequest request = EnqueueCliRunner.toRequest(cli);

        assertEquals("2020 Prizm Herbert PSA 10", request.searchQuery());
        assertEquals(List.of("ebay_sold", "pricecharting", "cardladder"), request.sources());
        assertEquals("card-42", request.subjectId());
        assertEquals(3, request.effectiveMaxComps());
        assertEquals(730, request.effectiveMaxAgeDays());
        assertNull(request.payload());
    }

    @Test
    void emptySourcesFallBackToDefaults() {
        CollectorProperties.Cli cli = new CollectorProperties.Cli();
        cli.setQuery("Charizard");
        cli.setSources(" , ");

        assertEquals(EnqueueJobRequest.DEFAULT_SOURCES, EnqueueCliRunner.toRequest(cli).normalizedSources());
    }

    @Test
    void queryIsRequired() {
        assertThatThrownBy(() -> EnqueueCliRunner.toRequest(new CollectorProperties.Cli()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("collector.cli.query");
    }
}
