package stages;

import image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.Timing;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Lookup table from {@link Filter} variant to its pure transform.
 * Parameter mapping is fixed: enhance filters use factor = intensity / 50,
 * blur uses radius = intensity / 10, geometric filters ignore intensity.
 */
public final class FilterLibrary {

    private static final Logger LOG = LoggerFactory.getLogger(FilterLibrary.class);

    private final Map<Filter, FilterOp> table = new EnumMap<>(Filter.class);

    public FilterLibrary() {
        this(false);
    }

    /** @param useGpu route contrast through OpenCL when a device is present */
    public FilterLibrary(boolean useGpu) {
        table.put(Filter.ROTATE_LEFT, (src, i) -> src.rotate90CCW());
        table.put(Filter.ROTATE_RIGHT, (src, i) -> src.rotate90CW());
        table.put(Filter.MIRROR, (src, i) -> src.flipHorizontal());
        table.put(Filter.GRAYSCALE, (src, i) -> FiltersCPUFast.grayscale(src));
        table.put(Filter.COLOR, (src, i) -> FiltersCPUFast.colorEnhance(src, Filter.factor(i)));
        table.put(Filter.CONTRAST, useGpu
                ? (src, i) -> GpuProcessor.contrastEnhance(src, Filter.factor(i))
                : (src, i) -> FiltersCPUFast.contrastEnhance(src, Filter.factor(i)));
        table.put(Filter.SHARPEN, (src, i) -> FiltersCPU.sharpen(src, Filter.factor(i)));
        table.put(Filter.BLUR, (src, i) -> FiltersCPU.gaussianBlur(src, Filter.radius(i)));
    }

    public PixelBuffer apply(Filter filter, PixelBuffer src, int intensity) {
        if (intensity < Filter.MIN_INTENSITY || intensity > Filter.MAX_INTENSITY)
            throw new IllegalArgumentException("intensity must be in [0,100]: " + intensity);
        FilterOp op = table.get(filter);
        if (op == null)
            throw new IllegalArgumentException(filter + " is not a pixel transform");

        Timing timing = new Timing(LOG);
        PixelBuffer out = op.apply(src, intensity);
        timing.stop(filter.label() + "(" + intensity + ") on " + src.width() + "x" + src.height());
        return out;
    }

    /** Variants this table can apply; {@link Filter#ORIGINAL} is not among them. */
    public Set<Filter> supported() {
        return Collections.unmodifiableSet(table.keySet());
    }
}
