package stages;

import image.PixelBuffer;

/**
 * Neighbourhood filters (convolutions).
 * Pure Java. All methods return a NEW buffer with the source's mode.
 */
public final class FiltersCPU {

    private FiltersCPU() {
    }

    /** 3×3 smoothing kernel, weights sum to 13. */
    private static final float[] SMOOTH = new float[] {
            1f / 13, 1f / 13, 1f / 13,
            1f / 13, 5f / 13, 1f / 13,
            1f / 13, 1f / 13, 1f / 13
    };

    private static int clamp(int v, int lo, int hi) {
        return (v < lo) ? lo : (v > hi) ? hi : v;
    }

    // ---------------- Sharpness ----------------

    /**
     * Sharpness: blend between a smoothed copy (factor 0) and the source
     * (factor 1); factor 2 pushes each pixel twice as far from its smoothed
     * value.
     */
    public static PixelBuffer sharpen(PixelBuffer src, double factor) {
        float f = (float) factor;
        int[] smooth = convolve3x3(src, SMOOTH);
        int[] px = src.pixels();
        for (int i = 0; i < px.length; i++) {
            int p = px[i];
            int s = smooth[i];
            int r = FiltersCPUFast.blend((s >>> 16) & 0xFF, (p >>> 16) & 0xFF, f);
            int g = FiltersCPUFast.blend((s >>> 8) & 0xFF, (p >>> 8) & 0xFF, f);
            int b = FiltersCPUFast.blend(s & 0xFF, p & 0xFF, f);
            px[i] = (p & 0xFF000000) | (r << 16) | (g << 8) | b;
        }
        return PixelBuffer.of(src.width(), src.height(), src.mode(), px);
    }

    // ---------------- Blur ----------------

    /**
     * Separable Gaussian with sigma = radius, kernel half-width ceil(3·sigma),
     * edges clamped. All four channels are blurred; radius 0 is a copy.
     */
    public static PixelBuffer gaussianBlur(PixelBuffer src, double radius) {
        if (radius <= 0)
            return PixelBuffer.of(src.width(), src.height(), src.mode(), src.pixels());

        float[] k = gaussianKernel(radius);
        int w = src.width(), h = src.height();
        int[] in = src.pixels();
        int[] tmp = new int[in.length];
        int[] out = new int[in.length];

        for (int y = 0; y < h; y++)
            blurLine(in, tmp, y * w, 1, w, k);
        for (int x = 0; x < w; x++)
            blurLine(tmp, out, x, w, h, k);

        return PixelBuffer.of(w, h, src.mode(), out);
    }

    static float[] gaussianKernel(double sigma) {
        int r = (int) Math.ceil(sigma * 3);
        float[] k = new float[2 * r + 1];
        double twoSigmaSq = 2 * sigma * sigma;
        float sum = 0f;
        for (int i = -r; i <= r; i++) {
            k[i + r] = (float) Math.exp(-(i * i) / twoSigmaSq);
            sum += k[i + r];
        }
        for (int i = 0; i < k.length; i++)
            k[i] /= sum;
        return k;
    }

    /** One row or column: {@code n} samples starting at {@code off}, {@code stride} apart. */
    private static void blurLine(int[] src, int[] dst, int off, int stride, int n, float[] k) {
        int r = k.length / 2;
        for (int i = 0; i < n; i++) {
            float af = 0, rf = 0, gf = 0, bf = 0;
            for (int j = -r; j <= r; j++) {
                int idx = clamp(i + j, 0, n - 1);
                int p = src[off + idx * stride];
                float wt = k[j + r];
                af += (p >>> 24) * wt;
                rf += ((p >>> 16) & 0xFF) * wt;
                gf += ((p >>> 8) & 0xFF) * wt;
                bf += (p & 0xFF) * wt;
            }
            int A = clamp(Math.round(af), 0, 255);
            int R = clamp(Math.round(rf), 0, 255);
            int G = clamp(Math.round(gf), 0, 255);
            int B = clamp(Math.round(bf), 0, 255);
            dst[off + i * stride] = (A << 24) | (R << 16) | (G << 8) | B;
        }
    }

    // ---------------- Convolution helper ----------------

    /** 3×3 convolution (row-major kernel of length 9); preserves alpha, copies borders. */
    private static int[] convolve3x3(PixelBuffer src, float[] k) {
        if (k == null || k.length != 9)
            throw new IllegalArgumentException("kernel must be length 9");

        int w = src.width(), h = src.height();
        int[] in = src.pixels();
        int[] out = in.clone();

        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                float rf = 0, gf = 0, bf = 0;
                int a = in[y * w + x] >>> 24;
                int t = 0;
                for (int j = -1; j <= 1; j++) {
                    for (int i = -1; i <= 1; i++) {
                        int p = in[(y + j) * w + x + i];
                        rf += ((p >>> 16) & 0xFF) * k[t];
                        gf += ((p >>> 8) & 0xFF) * k[t];
                        bf += (p & 0xFF) * k[t];
                        t++;
                    }
                }
                int R = clamp(Math.round(rf), 0, 255);
                int G = clamp(Math.round(gf), 0, 255);
                int B = clamp(Math.round(bf), 0, 255);
                out[y * w + x] = (a << 24) | (R << 16) | (G << 8) | B;
            }
        }
        return out;
    }
}
