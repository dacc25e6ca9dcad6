package io;

import image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.EditException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** {@link ImageStore} on the local file system, encoding through ImageIO. */
public final class ImageLoader implements ImageStore {

    private static final Logger LOG = LoggerFactory.getLogger(ImageLoader.class);

    @Override
    public PixelBuffer decode(Path input) throws EditException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(input);
        } catch (NoSuchFileException e) {
            throw new EditException(EditException.Kind.DECODE, "File not found: " + input, e);
        } catch (IOException e) {
            throw new EditException(EditException.Kind.DECODE, "Failed to read " + input + ": " + e.getMessage(), e);
        }
        try {
            PixelBuffer buffer = PixelBuffer.decode(bytes);
            LOG.debug("Decoded {} as {}", input, buffer);
            return buffer;
        } catch (EditException e) {
            throw new EditException(EditException.Kind.DECODE, input.getFileName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void encode(PixelBuffer buffer, Path output) throws EditException {
        String format = extension(output);
        if (format.isEmpty())
            throw new EditException(EditException.Kind.IO, "Cannot infer image format from " + output);

        byte[] bytes = buffer.encode(format);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
                LOG.info("Created directory {}", parent);
            }
            Files.write(output, bytes);
        } catch (IOException e) {
            throw new EditException(EditException.Kind.IO, "Failed to write " + output + ": " + e.getMessage(), e);
        }
        LOG.debug("Wrote {} bytes to {}", bytes.length, output);
    }

    @Override
    public List<String> listImages(Path directory, List<String> extensions) throws EditException {
        List<String> exts = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> {
                        String lower = name.toLowerCase(Locale.ROOT);
                        return exts.stream().anyMatch(lower::endsWith);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new EditException(EditException.Kind.IO, "Failed to list " + directory + ": " + e.getMessage(), e);
        }
    }

    /** Lower-case extension without the dot, or "" when there is none. */
    static String extension(Path file) {
        Path name = file.getFileName();
        if (name == null)
            return "";
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return (dot < 0 || dot == s.length() - 1) ? "" : s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
