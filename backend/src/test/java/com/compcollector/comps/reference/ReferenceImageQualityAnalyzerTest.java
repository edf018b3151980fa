package com.compcollector.comps.reference;

import com.compcollector.comps.image.TestImages;
import com.compcollector.comps.model.ImageQuality;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ReferenceImageQualityAnalyzerTest {

    @Test
    void flatImageScoresOnlyOnResolution() {
        ImageQuality large = ReferenceImageQualityAnalyzer.analyze(TestImages.solid(400, 600, Color.GRAY), 320);
        ImageQuality small = ReferenceImageQualityAnalyzer.analyze(TestImages.solid(160, 240, Color.GRAY), 320);

        assertEquals(0.3, large.score());
        assertEquals(0, large.blur());
        assertEquals(400, large.width());
        assertEquals(600, large.height());
        assertEquals(0.15, small.score());
    }

    @Test
    void sharpLargeImageScoresFull() {
        ImageQuality quality = ReferenceImageQualityAnalyzer.analyze(TestImages.noise(256, 256, 7L), 256);

        assertEquals(1.0, quality.score());
    }

    @Test
    void fitInsideKeepsAspectRatio() {
        BufferedImage fitted = ReferenceImageQualityAnalyzer.fitInside(TestImages.solid(1000, 500, Color.WHITE), 256, 256);

        assertEquals(256, fitted.getWidth());
        assertEquals(128, fitted.getHeight());
    }

    @Test
    void rejectsMissingImage() {
        assertThatThrownBy(() -> ReferenceImageQualityAnalyzer.analyze(null, 320))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
