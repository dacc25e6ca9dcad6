package session;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Settings handed to the session and its collaborators. Built from defaults,
 * then {@code photo-edit.properties} on the classpath, then {@code photoedit.*}
 * system properties; the CLI applies its flags last.
 *
 * @param editsDirectory    sub-directory of the image's folder that receives saves
 * @param allowedExtensions suffixes offered by {@code list}
 * @param workerThreads     preview pool size, 0 to derive it from the power state
 */
public record SessionConfig(String editsDirectory,
                            List<String> allowedExtensions,
                            int viewportWidth,
                            int viewportHeight,
                            boolean useGpu,
                            int workerThreads) {

    public static final String RESOURCE = "photo-edit.properties";
    public static final String PREFIX = "photoedit.";

    public SessionConfig {
        if (editsDirectory == null || editsDirectory.isBlank())
            throw new IllegalArgumentException("editsDirectory must not be blank");
        if (viewportWidth <= 0 || viewportHeight <= 0)
            throw new IllegalArgumentException("viewport must be positive");
        if (workerThreads < 0)
            throw new IllegalArgumentException("workerThreads must be >= 0");
        allowedExtensions = List.copyOf(allowedExtensions);
    }

    public static SessionConfig defaults() {
        return new SessionConfig("edits",
                List.of(".jpg", ".jpeg", ".png", ".svg", ".bmp", ".tiff"),
                720, 630, false, 0);
    }

    /** Defaults, overridden by the classpath resource, overridden by system properties. */
    public static SessionConfig load() {
        Properties props = new Properties();
        try (InputStream in = SessionConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX))
                props.setProperty(key, System.getProperty(key));
        }
        // -DuseGPU=true is honoured as well
        if (Boolean.parseBoolean(System.getProperty("useGPU", "false")))
            props.setProperty(PREFIX + "useGpu", "true");
        return fromProperties(props);
    }

    public static SessionConfig fromProperties(Properties p) {
        SessionConfig d = defaults();
        List<String> exts = d.allowedExtensions;
        String extProp = p.getProperty(PREFIX + "extensions");
        if (extProp != null && !extProp.isBlank()) {
            exts = Arrays.stream(extProp.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> s.startsWith(".") ? s : "." + s)
                    .collect(Collectors.toList());
        }
        return new SessionConfig(
                p.getProperty(PREFIX + "editsDirectory", d.editsDirectory).trim(),
                exts,
                intProp(p, "viewportWidth", d.viewportWidth),
                intProp(p, "viewportHeight", d.viewportHeight),
                Boolean.parseBoolean(p.getProperty(PREFIX + "useGpu", String.valueOf(d.useGpu)).trim()),
                intProp(p, "workerThreads", d.workerThreads));
    }

    public SessionConfig withUseGpu(boolean gpu) {
        return new SessionConfig(editsDirectory, allowedExtensions, viewportWidth, viewportHeight, gpu, workerThreads);
    }

    public SessionConfig withWorkerThreads(int threads) {
        return new SessionConfig(editsDirectory, allowedExtensions, viewportWidth, viewportHeight, useGpu, threads);
    }

    private static int intProp(Properties p, String name, int def) {
        String v = p.getProperty(PREFIX + name);
        if (v == null || v.isBlank())
            return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + name + " is not an integer: " + v, e);
        }
    }
}
