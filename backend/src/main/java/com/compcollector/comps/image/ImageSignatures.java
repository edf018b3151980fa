package com.compcollector.comps.image;

import com.compcollector.comps.model.ImageSignature;
import com.compcollector.comps.model.RgbColor;
import com.compcollector.comps.model.SignatureComparison;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Average-hash signatures for approximate visual matching of listing photos.
 *
 * <p>The image is squeezed onto a {@value #HASH_SIZE}×{@value #HASH_SIZE} grid (aspect ratio is
 * not preserved), each cell is reduced to its grey level and compared with the grid mean. Two
 * signatures are compared by Hamming distance over the bit string, so the score is symmetric and
 * equals 1 for identical hashes.</p>
 */
public final class ImageSignatures {

    /** Grid edge length. */
    public static final int HASH_SIZE = 8;

    /** Bits per signature. */
    public static final int HASH_BITS = HASH_SIZE * HASH_SIZE;

    private ImageSignatures() {
    }

    public static ImageSignature compute(BufferedImage image) {
        if (image == null || image.getWidth() == 0 || image.getHeight() == 0) {
            throw new IllegalArgumentException("Image is empty");
        }
        BufferedImage grid = resize(image, HASH_SIZE, HASH_SIZE);

        int[] grey = new int[HASH_BITS];
        long sumR = 0;
        long sumG = 0;
        long sumB = 0;
        long sumGrey = 0;
        int index = 0;
        for (int y = 0; y < HASH_SIZE; y++) {
            for (int x = 0; x < HASH_SIZE; x++) {
                int rgb = grid.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                sumR += r;
                sumG += g;
                sumB += b;
                grey[index] = (r + g + b) / 3;
                sumGrey += grey[index];
                index++;
            }
        }

        double mean = (double) sumGrey / HASH_BITS;
        StringBuilder bits = new StringBuilder(HASH_BITS);
        for (int value : grey) {
            bits.append(value >= mean ? '1' : '0');
        }

        RgbColor avg = new RgbColor(
            (int) Math.round((double) sumR / HASH_BITS),
            (int) Math.round((double) sumG / HASH_BITS),
            (int) Math.round((double) sumB / HASH_BITS)
        );
        return new ImageSignature(bits.toString(), avg, image.getWidth(), image.getHeight());
    }

    public static SignatureComparison compare(ImageSignature a, ImageSignature b) {
        String hashA = a.hashBits() == null ? "" : a.hashBits();
        String hashB = b.hashBits() == null ? "" : b.hashBits();
        int length = Math.min(Math.min(hashA.length(), hashB.length()), HASH_BITS);
        int distance = 0;
        for (int i = 0; i < length; i++) {
            if (hashA.charAt(i) != hashB.charAt(i)) {
                distance++;
            }
        }
        // Missing bits count as mismatches so truncated hashes never score as a perfect match.
        distance += HASH_BITS - length;

        double score = Math.max(0.0, 1.0 - (double) distance / HASH_BITS);
        return new SignatureComparison(score, distance, colorDistance(a.avgColor(), b.avgColor()));
    }

    static double colorDistance(RgbColor a, RgbColor b) {
        if (a == null || b == null) {
            return 0.0;
        }
        double dr = a.r() - b.r();
        double dg = a.g() - b.g();
        double db = a.b() - b.b();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    static BufferedImage resize(BufferedImage source, int width, int height) {
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
