package hw;

import image.PixelBuffer;

/** Shows the session's current buffer somewhere. */
public interface Display {

    void render(PixelBuffer buffer);

    /** Nothing to show; {@code message} explains why. */
    void clear(String message);
}
