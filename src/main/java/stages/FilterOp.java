package stages;

import image.PixelBuffer;

/** A pure transform: never mutates {@code src}. */
@FunctionalInterface
public interface FilterOp {
    PixelBuffer apply(PixelBuffer src, int intensity);
}
