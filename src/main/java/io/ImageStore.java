package io;

import image.PixelBuffer;
import util.EditException;

import java.nio.file.Path;
import java.util.List;

/** Where images come from and go to. The session only sees this interface. */
public interface ImageStore {

    /** @throws EditException {@code DECODE} when the file is missing, unreadable or not an image */
    PixelBuffer decode(Path file) throws EditException;

    /**
     * Write {@code buffer} in the format named by the file extension, creating
     * parent directories as needed.
     *
     * @throws EditException {@code IO} when the format is unknown or the write fails
     */
    void encode(PixelBuffer buffer, Path file) throws EditException;

    /** File names in {@code directory} ending with one of {@code extensions}, sorted. */
    List<String> listImages(Path directory, List<String> extensions) throws EditException;
}
