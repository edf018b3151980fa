package com.compcollector.comps.reference;

import com.compcollector.comps.model.ImageQuality;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Scores how usable a reference photo is for visual matching.
 *
 * <p>The score blends sharpness (greyscale variance after fitting inside
 * {@value #ANALYSIS_SIZE}px, saturating at {@value #VARIANCE_SATURATION}) weighted 0.7 with
 * resolution (shorter side against the configured minimum) weighted 0.3, rounded to two decimals.</p>
 */
public final class ReferenceImageQualityAnalyzer {

    static final int ANALYSIS_SIZE = 256;
    static final double VARIANCE_SATURATION = 2000.0;
    private static final double SHARPNESS_WEIGHT = 0.7;
    private static final double SIZE_WEIGHT = 0.3;

    private ReferenceImageQualityAnalyzer() {
    }

    public static ImageQuality analyze(BufferedImage image, int minDimension) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            throw new IllegalArgumentException("Image is empty");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] grey = greyscalePixels(fitInside(image, ANALYSIS_SIZE, ANALYSIS_SIZE));

        double mean = 0;
        for (int value : grey) {
            mean += value;
        }
        mean /= grey.length;
        double variance = 0;
        for (int value : grey) {
            double diff = value - mean;
            variance += diff * diff;
        }
        variance /= grey.length;

        double sharpness = Math.min(1.0, variance / VARIANCE_SATURATION);
        double size = Math.min(1.0, (double) Math.min(width, height) / Math.max(1, minDimension));
        double score = Math.round((SHARPNESS_WEIGHT * sharpness + SIZE_WEIGHT * size) * 100) / 100.0;
        return new ImageQuality(score, Math.round(variance), width, height);
    }

    /**
     * Scales {@code image} to the largest size that fits inside the box, keeping its aspect ratio.
     */
    static BufferedImage fitInside(BufferedImage image, int maxWidth, int maxHeight) {
        double scale = Math.min((double) maxWidth / image.getWidth(), (double) maxHeight / image.getHeight());
        int width = Math.max(1, (int) Math.round(image.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(image.getHeight() * scale));
        return scale(image, width, height);
    }

    static BufferedImage scale(BufferedImage image, int width, int height) {
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    /**
     * Rec. 601 luma of each pixel in row-major order.
     */
    static int[] greyscalePixels(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] grey = new int[width * height];
        int index = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                grey[index++] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return grey;
    }
}
