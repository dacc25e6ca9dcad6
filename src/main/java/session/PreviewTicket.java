package session;

import image.PixelBuffer;
import stages.Filter;

/**
 * A numbered preview request. {@code baseline} is the buffer the filter must
 * be applied to; {@code generation} identifies the history state it was
 * taken from.
 */
public record PreviewTicket(long sequence, long generation, Filter filter, int intensity, PixelBuffer baseline) {
}
