package image;

import util.EditException;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * In-memory image: width, height, {@link ColorMode} and one packed ARGB int
 * per pixel, row-major.
 * <p>
 * Instances are immutable. Every operation returns a NEW buffer and the sample
 * array is copied on the way in and on the way out, so two buffers never share
 * storage. GRAY buffers keep r == g == b; GRAY and RGB buffers are opaque.
 */
public final class PixelBuffer {

    /** Formats whose writers keep an alpha channel. */
    private static final Set<String> ALPHA_FORMATS = Set.of("png", "tif", "tiff");

    public static final int WHITE = 0xFFFFFF;

    /** Largest pixel count a resize may produce. */
    public static final long MAX_PIXELS = 178_956_970L;

    private final int width;
    private final int height;
    private final ColorMode mode;
    private final int[] argb;

    private PixelBuffer(int width, int height, ColorMode mode, int[] argb) {
        this.width = width;
        this.height = height;
        this.mode = mode;
        this.argb = argb;
    }

    /**
     * Wrap a copy of {@code argb}. Alpha is forced opaque for GRAY and RGB.
     */
    public static PixelBuffer of(int width, int height, ColorMode mode, int[] argb) {
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("size must be positive: " + width + "x" + height);
        long samples = (long) width * height;
        if (argb.length != samples)
            throw new IllegalArgumentException("expected " + samples + " samples, got " + argb.length);
        int[] copy = Arrays.copyOf(argb, argb.length);
        if (!mode.hasAlpha()) {
            for (int i = 0; i < copy.length; i++)
                copy[i] |= 0xFF000000;
        }
        return new PixelBuffer(width, height, mode, copy);
    }

    // ---------------- Codec bridge ----------------

    public static PixelBuffer decode(byte[] bytes) throws EditException {
        BufferedImage img;
        try {
            img = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new EditException(EditException.Kind.DECODE, "Malformed image data: " + e.getMessage(), e);
        }
        if (img == null)
            throw new EditException(EditException.Kind.DECODE, "Unsupported image format");
        return fromImage(img);
    }

    public static PixelBuffer fromImage(BufferedImage img) {
        int w = img.getWidth(), h = img.getHeight();
        boolean alpha = img.getColorModel().hasAlpha();
        boolean gray = img.getColorModel().getNumColorComponents() == 1;

        if (gray && !alpha) {
            // read samples directly; getRGB() would push linear gray through sRGB
            WritableRaster raster = img.getRaster();
            int bits = raster.getSampleModel().getSampleSize(0);
            int[] px = new int[w * h];
            int[] row = new int[w];
            for (int y = 0; y < h; y++) {
                raster.getSamples(0, y, w, 1, 0, row);
                for (int x = 0; x < w; x++) {
                    int v = bits > 8 ? row[x] >>> (bits - 8) : row[x] * 255 / ((1 << bits) - 1);
                    px[y * w + x] = 0xFF000000 | (v << 16) | (v << 8) | v;
                }
            }
            return new PixelBuffer(w, h, ColorMode.GRAY, px);
        }

        int[] px = img.getRGB(0, 0, w, h, null, 0, w);
        return of(w, h, alpha ? ColorMode.RGBA : ColorMode.RGB, px);
    }

    /** Fresh AWT image holding this buffer's samples. */
    public BufferedImage toImage() {
        switch (mode) {
            case GRAY: {
                BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
                WritableRaster raster = out.getRaster();
                int[] row = new int[width];
                for (int y = 0; y < height; y++) {
                    for (int x = 0; x < width; x++)
                        row[x] = argb[y * width + x] & 0xFF;
                    raster.setSamples(0, y, width, 1, 0, row);
                }
                return out;
            }
            case RGB: {
                BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
                out.setRGB(0, 0, width, height, argb, 0, width);
                return out;
            }
            default: {
                BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
                out.setRGB(0, 0, width, height, argb, 0, width);
                return out;
            }
        }
    }

    /**
     * Encode with the ImageIO writer for {@code format} (png, jpg, bmp, gif,
     * tiff...). Formats without alpha get the image composited onto white.
     */
    public byte[] encode(String format) throws EditException {
        String fmt = format.toLowerCase(Locale.ROOT);
        PixelBuffer target = this;
        if (mode.hasAlpha() && !ALPHA_FORMATS.contains(fmt))
            target = flatten(WHITE);

        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(target.toImage(), fmt, bos))
                throw new EditException(EditException.Kind.IO, "No image writer for format '" + format + "'");
        } catch (IOException e) {
            throw new EditException(EditException.Kind.IO, "Encoding as " + format + " failed: " + e.getMessage(), e);
        }
        return bos.toByteArray();
    }

    // ---------------- Pixel transforms ----------------

    /** Composite onto an opaque background colour; result is RGB. */
    public PixelBuffer flatten(int backgroundRgb) {
        int br = (backgroundRgb >>> 16) & 0xFF;
        int bg = (backgroundRgb >>> 8) & 0xFF;
        int bb = backgroundRgb & 0xFF;
        int[] out = new int[argb.length];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int a = p >>> 24;
            int r = (((p >>> 16) & 0xFF) * a + br * (255 - a) + 127) / 255;
            int g = (((p >>> 8) & 0xFF) * a + bg * (255 - a) + 127) / 255;
            int b = ((p & 0xFF) * a + bb * (255 - a) + 127) / 255;
            out[i] = 0xFF000000 | (r << 16) | (g << 8) | b;
        }
        return new PixelBuffer(width, height, mode == ColorMode.GRAY ? ColorMode.GRAY : ColorMode.RGB, out);
    }

    public PixelBuffer toMode(ColorMode target) {
        if (target == mode)
            return new PixelBuffer(width, height, mode, argb.clone());
        int[] out = new int[argb.length];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            if (target == ColorMode.GRAY) {
                int l = luma(p);
                out[i] = 0xFF000000 | (l << 16) | (l << 8) | l;
            } else if (target == ColorMode.RGB) {
                out[i] = p | 0xFF000000;
            } else {
                out[i] = p;
            }
        }
        return new PixelBuffer(width, height, target, out);
    }

    // ---------------- Geometry ----------------

    public PixelBuffer crop(int x, int y, int w, int h) throws EditException {
        if (x < 0 || y < 0 || w < 1 || h < 1 || w > width - x || h > height - y) {
            throw new EditException(EditException.Kind.BOUNDS, String.format(
                    "Crop rectangle (%d,%d %dx%d) is outside %dx%d", x, y, w, h, width, height));
        }
        int[] out = new int[w * h];
        for (int row = 0; row < h; row++)
            System.arraycopy(argb, (y + row) * width + x, out, row * w, w);
        return new PixelBuffer(w, h, mode, out);
    }

    /**
     * Bicubic resample. Large reductions are done in successive halving
     * steps so every pass samples a neighbourhood that covers the source.
     */
    public PixelBuffer resize(int w, int h) throws EditException {
        if (w <= 0 || h <= 0)
            throw new EditException(EditException.Kind.INVALID_DIMENSION,
                    "Width and height must be positive, got " + w + "x" + h);
        if ((long) w * h > MAX_PIXELS)
            throw new EditException(EditException.Kind.INVALID_DIMENSION,
                    "Size " + w + "x" + h + " exceeds " + MAX_PIXELS + " pixels");

        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        img.setRGB(0, 0, width, height, argb, 0, width);

        int cw = width, ch = height;
        do {
            cw = cw > w ? Math.max(w, cw / 2) : w;
            ch = ch > h ? Math.max(h, ch / 2) : h;

            BufferedImage step = new BufferedImage(cw, ch, BufferedImage.TYPE_INT_ARGB);
            Graphics2D g = step.createGraphics();
            try {
                g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
                g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                g.drawImage(img, 0, 0, cw, ch, null);
            } finally {
                g.dispose();
            }
            img = step;
        } while (cw != w || ch != h);

        int[] out = img.getRGB(0, 0, w, h, null, 0, w);
        PixelBuffer resized = of(w, h, mode == ColorMode.GRAY ? ColorMode.RGB : mode, out);
        return mode == ColorMode.GRAY ? resized.toMode(ColorMode.GRAY) : resized;
    }

    public PixelBuffer rotate90CW() {
        int[] out = new int[argb.length];
        int nw = height;
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                out[x * nw + (height - 1 - y)] = argb[y * width + x];
        return new PixelBuffer(height, width, mode, out);
    }

    public PixelBuffer rotate90CCW() {
        int[] out = new int[argb.length];
        int nw = height;
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                out[(width - 1 - x) * nw + y] = argb[y * width + x];
        return new PixelBuffer(height, width, mode, out);
    }

    public PixelBuffer flipHorizontal() {
        int[] out = new int[argb.length];
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                out[y * width + (width - 1 - x)] = argb[y * width + x];
        return new PixelBuffer(width, height, mode, out);
    }

    // ---------------- Accessors ----------------

    /** ITU-R 601-2 luma of a packed pixel, fixed point. */
    public static int luma(int argb) {
        int r = (argb >>> 16) & 0xFF;
        int g = (argb >>> 8) & 0xFF;
        int b = argb & 0xFF;
        return (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public ColorMode mode() {
        return mode;
    }

    public int getRGB(int x, int y) {
        return argb[y * width + x];
    }

    /** Copy of the packed samples. */
    public int[] pixels() {
        return argb.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PixelBuffer))
            return false;
        PixelBuffer other = (PixelBuffer) o;
        return width == other.width && height == other.height && mode == other.mode
                && Arrays.equals(argb, other.argb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + mode.hashCode()) + Arrays.hashCode(argb);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + " " + mode + "]";
    }
}
