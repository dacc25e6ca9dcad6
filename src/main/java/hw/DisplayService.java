package hw;

import image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import util.EditException;

import java.awt.Desktop;
import java.awt.Dimension;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link Display} that fits each frame into a viewport (aspect preserved) and
 * writes it as PNG to a preview file, optionally opening it with the desktop
 * image viewer.
 */
public class DisplayService implements Display {

    private static final Logger LOG = LoggerFactory.getLogger(DisplayService.class);

    private final Path previewFile;
    private final int viewportWidth;
    private final int viewportHeight;
    private final boolean openViewer;
    private boolean opened;

    public DisplayService(Path previewFile, int viewportWidth, int viewportHeight, boolean openViewer) {
        if (viewportWidth <= 0 || viewportHeight <= 0)
            throw new IllegalArgumentException("viewport must be positive: " + viewportWidth + "x" + viewportHeight);
        this.previewFile = previewFile.toAbsolutePath();
        this.viewportWidth = viewportWidth;
        this.viewportHeight = viewportHeight;
        this.openViewer = openViewer;
    }

    /** Largest size with the image's aspect ratio that fits the viewport. */
    public static Dimension fit(int width, int height, int viewportWidth, int viewportHeight) {
        double scale = Math.min(viewportWidth / (double) width, viewportHeight / (double) height);
        int w = Math.max(1, (int) Math.round(width * scale));
        int h = Math.max(1, (int) Math.round(height * scale));
        return new Dimension(Math.min(w, viewportWidth), Math.min(h, viewportHeight));
    }

    @Override
    public void render(PixelBuffer buffer) {
        Dimension d = fit(buffer.width(), buffer.height(), viewportWidth, viewportHeight);
        try {
            PixelBuffer frame = (d.width == buffer.width() && d.height == buffer.height())
                    ? buffer
                    : buffer.resize(d.width, d.height);
            Files.write(previewFile, frame.encode("png"));
            LOG.debug("Rendered {} as {}x{} to {}", buffer, d.width, d.height, previewFile);
        } catch (EditException | IOException e) {
            LOG.warn("Preview could not be written to {}: {}", previewFile, e.getMessage());
            return;
        }
        open();
    }

    @Override
    public void clear(String message) {
        try {
            Files.deleteIfExists(previewFile);
        } catch (IOException e) {
            LOG.warn("Could not remove stale preview {}: {}", previewFile, e.getMessage());
        }
        LOG.info("Display cleared: {}", message);
    }

    public Path previewFile() {
        return previewFile;
    }

    // the external viewer refreshes on its own once the file exists
    private void open() {
        if (!openViewer || opened || GraphicsEnvironment.isHeadless())
            return;
        try {
            if (Desktop.isDesktopSupported()) {
                Desktop.getDesktop().open(previewFile.toFile());
                opened = true;
            }
        } catch (IOException | UnsupportedOperationException e) {
            LOG.warn("Could not open viewer: {}", e.getMessage());
        }
    }
}
