package stages;

import image.ColorMode;
import image.PixelBuffer;

/**
 * Per-pixel filters that need no neighbourhood:
 * - Contrast goes through a 256-entry LUT (no float math per pixel)
 * - Everything works on the packed int[] in one contiguous pass
 * All methods return a NEW buffer with the source's mode; alpha is preserved
 * except where noted.
 */
public final class FiltersCPUFast {

    private FiltersCPUFast() {
    }

    /** Luma in all three channels, opaque, same mode as the input. */
    public static PixelBuffer grayscale(PixelBuffer src) {
        int[] px = src.pixels();
        for (int i = 0; i < px.length; i++) {
            int l = PixelBuffer.luma(px[i]);
            px[i] = 0xFF000000 | (l << 16) | (l << 8) | l;
        }
        return PixelBuffer.of(src.width(), src.height(), src.mode(), px);
    }

    /**
     * Saturation: blend between the luma image (factor 0) and the source
     * (factor 1); factor 2 doubles each channel's distance from luma.
     */
    public static PixelBuffer colorEnhance(PixelBuffer src, double factor) {
        if (src.mode() == ColorMode.GRAY)
            return src.toMode(ColorMode.GRAY);
        float f = (float) factor;
        int[] px = src.pixels();
        for (int i = 0; i < px.length; i++) {
            int p = px[i];
            int l = PixelBuffer.luma(p);
            int r = blend(l, (p >>> 16) & 0xFF, f);
            int g = blend(l, (p >>> 8) & 0xFF, f);
            int b = blend(l, p & 0xFF, f);
            px[i] = (p & 0xFF000000) | (r << 16) | (g << 8) | b;
        }
        return PixelBuffer.of(src.width(), src.height(), src.mode(), px);
    }

    /**
     * Contrast: blend between a flat image at the mean luma (factor 0) and the
     * source (factor 1).
     */
    public static PixelBuffer contrastEnhance(PixelBuffer src, double factor) {
        int[] lut = contrastLut(meanLuma(src), (float) factor);
        int[] px = src.pixels();
        for (int i = 0; i < px.length; i++) {
            int p = px[i];
            int r = lut[(p >>> 16) & 0xFF];
            int g = lut[(p >>> 8) & 0xFF];
            int b = lut[p & 0xFF];
            px[i] = (p & 0xFF000000) | (r << 16) | (g << 8) | b;
        }
        return PixelBuffer.of(src.width(), src.height(), src.mode(), px);
    }

    /** Rounded mean of the luma channel. */
    public static int meanLuma(PixelBuffer src) {
        int[] px = src.pixels();
        long sum = 0;
        for (int p : px)
            sum += PixelBuffer.luma(p);
        return (int) ((double) sum / px.length + 0.5);
    }

    // --- helpers ---

    /** degenerate + f * (value - degenerate), truncated and clamped to a byte. */
    static int blend(int degenerate, int value, float f) {
        int v = (int) (degenerate + f * (value - degenerate));
        if (v < 0)
            return 0;
        return Math.min(v, 255);
    }

    private static int[] contrastLut(int mean, float f) {
        int[] lut = new int[256];
        for (int v = 0; v < 256; v++)
            lut[v] = blend(mean, v, f);
        return lut;
    }
}
