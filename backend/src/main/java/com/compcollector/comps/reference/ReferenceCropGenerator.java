package com.compcollector.comps.reference;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes a card photo to a fixed portrait frame and cuts the regions used to tell
 * variants apart (border strips, artwork center, the lower-right stamp area).
 */
public final class ReferenceCropGenerator {

    public static final int CARD_WIDTH = 800;
    public static final int CARD_HEIGHT = 1100;
    static final int BACKGROUND_THRESHOLD = 230;

    private ReferenceCropGenerator() {
    }

    /**
     * Crops to the bounding box of non-background pixels and stretches it to
     * {@value #CARD_WIDTH}×{@value #CARD_HEIGHT}. With no detectable card the whole photo is fitted
     * inside that frame instead.
     */
    public static BufferedImage normalizeCard(BufferedImage image) {
        BufferedImage sample = ReferenceImageQualityAnalyzer.fitInside(
            image,
            ReferenceImageQualityAnalyzer.ANALYSIS_SIZE,
            ReferenceImageQualityAnalyzer.ANALYSIS_SIZE
        );
        int[] bounds = detectBounds(sample);
        if (bounds == null) {
            return ReferenceImageQualityAnalyzer.fitInside(image, CARD_WIDTH, CARD_HEIGHT);
        }
        double scaleX = (double) image.getWidth() / sample.getWidth();
        double scaleY = (double) image.getHeight() / sample.getHeight();
        int left = Math.max(0, (int) Math.round(bounds[0] * scaleX));
        int top = Math.max(0, (int) Math.round(bounds[1] * scaleY));
        int width = Math.min(image.getWidth() - left, (int) Math.round((bounds[2] - bounds[0]) * scaleX));
        int height = Math.min(image.getHeight() - top, (int) Math.round((bounds[3] - bounds[1]) * scaleY));
        if (width <= 0 || height <= 0) {
            return ReferenceImageQualityAnalyzer.fitInside(image, CARD_WIDTH, CARD_HEIGHT);
        }
        BufferedImage card = image.getSubimage(left, top, width, height);
        return ReferenceImageQualityAnalyzer.scale(card, CARD_WIDTH, CARD_HEIGHT);
    }

    /**
     * Returns {@code [minX, minY, maxX, maxY]} of pixels darker than the background threshold,
     * or {@code null} when every pixel is background.
     */
    static int[] detectBounds(BufferedImage image) {
        int width = image.getWidth();
        int[] grey = ReferenceImageQualityAnalyzer.greyscalePixels(image);
        int minX = width;
        int minY = image.getHeight();
        int maxX = 0;
        int maxY = 0;
        boolean found = false;
        for (int i = 0; i < grey.length; i++) {
            if (grey[i] >= BACKGROUND_THRESHOLD) {
                continue;
            }
            int x = i % width;
            int y = i / width;
            found = true;
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }
        return found ? new int[] {minX, minY, maxX, maxY} : null;
    }

    public static List<CropSpec> buildCrops(int width, int height) {
        int stripH = Math.max(40, (int) Math.round(height * 0.12));
        int stripW = Math.max(40, (int) Math.round(width * 0.12));
        List<CropSpec> specs = List.of(
            new CropSpec("top", 0, 0, width, stripH),
            new CropSpec("bottom", 0, Math.max(0, height - stripH), width, stripH),
            new CropSpec("left", 0, 0, stripW, height),
            new CropSpec("right", Math.max(0, width - stripW), 0, stripW, height),
            new CropSpec(
                "center",
                (int) Math.round(width * 0.3),
                (int) Math.round(height * 0.3),
                Math.max(80, (int) Math.round(width * 0.4)),
                Math.max(80, (int) Math.round(height * 0.4))
            ),
            new CropSpec(
                "stamp",
                (int) Math.round(width * 0.6),
                (int) Math.round(height * 0.6),
                Math.max(60, (int) Math.round(width * 0.3)),
                Math.max(60, (int) Math.round(height * 0.3))
            )
        );
        List<CropSpec> clamped = new ArrayList<>();
        for (CropSpec spec : specs) {
            int left = Math.min(spec.left(), Math.max(0, width - 1));
            int top = Math.min(spec.top(), Math.max(0, height - 1));
            int cropWidth = Math.min(spec.width(), width - left);
            int cropHeight = Math.min(spec.height(), height - top);
            if (cropWidth > 0 && cropHeight > 0) {
                clamped.add(new CropSpec(spec.label(), left, top, cropWidth, cropHeight));
            }
        }
        return clamped;
    }

    public static BufferedImage crop(BufferedImage image, CropSpec spec) {
        return image.getSubimage(spec.left(), spec.top(), spec.width(), spec.height());
    }
}
