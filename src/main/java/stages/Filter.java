package stages;

import util.EditException;

/**
 * The closed set of edits a user can pick. {@link #ORIGINAL} is a reset to the
 * pristine image and is resolved by the session, not by {@link FilterLibrary}.
 */
public enum Filter {
    ORIGINAL("Original", false, "Reset"),
    ROTATE_LEFT("Left", false, "rotateLeft"),
    ROTATE_RIGHT("Right", false, "rotateRight"),
    MIRROR("Mirror", false),
    SHARPEN("Sharpen", true),
    GRAYSCALE("B/W", false, "bw"),
    COLOR("Color", true, "colorEnhance"),
    CONTRAST("Contrast", true, "contrastEnhance"),
    BLUR("Blur", true, "gaussianBlur");

    public static final int MIN_INTENSITY = 0;
    public static final int MAX_INTENSITY = 100;
    /** Slider midpoint; identity for the enhance filters. */
    public static final int DEFAULT_INTENSITY = 50;

    private final String label;
    private final boolean parameterized;
    private final String[] aliases;

    Filter(String label, boolean parameterized, String... aliases) {
        this.label = label;
        this.parameterized = parameterized;
        this.aliases = aliases;
    }

    public String label() {
        return label;
    }

    /** True when the intensity argument changes the result. */
    public boolean parameterized() {
        return parameterized;
    }

    public boolean isReset() {
        return this == ORIGINAL;
    }

    /** Look up by label, alias or constant name, ignoring case. */
    public static Filter fromName(String name) throws EditException {
        if (name != null) {
            String n = name.trim();
            for (Filter f : values()) {
                if (f.label.equalsIgnoreCase(n) || f.name().equalsIgnoreCase(n))
                    return f;
                for (String alias : f.aliases) {
                    if (alias.equalsIgnoreCase(n))
                        return f;
                }
            }
        }
        throw new EditException(EditException.Kind.UNKNOWN_FILTER, "Unknown filter: " + name);
    }

    /** factor = intensity / 50: 0 -> 0.0, 50 -> 1.0, 100 -> 2.0 */
    public static double factor(int intensity) {
        return intensity / 50.0;
    }

    /** radius = intensity / 10: 0 -> 0.0, 100 -> 10.0 */
    public static double radius(int intensity) {
        return intensity / 10.0;
    }
}
