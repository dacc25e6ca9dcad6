package image;

/** Channel layout of a {@link PixelBuffer}. */
public enum ColorMode {
    GRAY(1),
    RGB(3),
    RGBA(4);

    private final int channels;

    ColorMode(int channels) {
        this.channels = channels;
    }

    public int channels() {
        return channels;
    }

    public boolean hasAlpha() {
        return this == RGBA;
    }
}
