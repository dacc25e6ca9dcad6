package session;

import hw.Display;
import image.PixelBuffer;
import io.ImageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stages.Filter;
import stages.FilterLibrary;
import util.EditException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Non-destructive edit of one image.
 * <p>
 * Holds the pristine original, a linear history of committed buffers with an
 * index into it, and the buffer currently on display. A <em>preview</em>
 * replaces only the displayed buffer; a <em>commit</em> appends to history
 * (dropping any redo entries past the index) and writes the result to
 * {@code <image dir>/<edits>/<image name>}. Filters always apply to the
 * history entry at the index; {@link Filter#ORIGINAL} yields the original.
 * <p>
 * All methods are synchronized. Previews computed on other threads go through
 * {@link #requestPreview} / {@link #offerPreview}, which reject results that
 * were overtaken by a newer request or by any change of history.
 */
public class EditSession {

    private static final Logger LOG = LoggerFactory.getLogger(EditSession.class);

    private final SessionConfig config;
    private final ImageStore store;
    private final Display display;
    private final FilterLibrary filters;

    private PixelBuffer original;
    private PixelBuffer current;
    private final List<PixelBuffer> history = new ArrayList<>();
    private int historyIndex = -1;
    private boolean previewing;

    private Path sourcePath;
    private String sourceFilename;

    // last preview number handed out; bumped by every preview request
    private long previewSequence;
    // bumped whenever history, the index or the loaded image changes
    private long generation;

    public EditSession(SessionConfig config, ImageStore store, Display display) {
        this(config, store, display, new FilterLibrary(config.useGpu()));
    }

    public EditSession(SessionConfig config, ImageStore store, Display display, FilterLibrary filters) {
        this.config = config;
        this.store = store;
        this.display = display;
        this.filters = filters;
    }

    // ---------------- Load ----------------

    /**
     * Replace the whole session with the image at {@code path}. On failure the
     * session is left empty.
     */
    public synchronized void load(Path path) throws EditException {
        PixelBuffer decoded;
        try {
            decoded = store.decode(path);
        } catch (EditException e) {
            clear();
            display.clear("Error loading image.");
            LOG.warn("Load of {} failed: {}", path, e.getMessage());
            throw e;
        }

        clear();
        original = decoded;
        current = decoded;
        history.add(decoded);
        historyIndex = 0;
        sourcePath = path.toAbsolutePath();
        sourceFilename = sourcePath.getFileName().toString();
        LOG.info("Loaded {} ({}x{} {})", sourcePath, decoded.width(), decoded.height(), decoded.mode());
        display.render(current);
    }

    private void clear() {
        original = null;
        current = null;
        history.clear();
        historyIndex = -1;
        previewing = false;
        sourcePath = null;
        sourceFilename = null;
        generation++;
    }

    // ---------------- Preview / commit ----------------

    /** Show {@code filter} applied to the baseline without recording it. */
    public synchronized PixelBuffer preview(Filter filter, int intensity) throws EditException {
        PreviewTicket ticket = requestPreview(filter, intensity);
        PixelBuffer result = computePreview(ticket);
        offerPreview(ticket, result);
        return result;
    }

    public PixelBuffer preview(String filterName, int intensity) throws EditException {
        return preview(Filter.fromName(filterName), intensity);
    }

    /**
     * Apply {@code filter} to the baseline, append the result to history and
     * save it to the default target. If the save fails the edit stays in
     * history and the {@code IO} error is thrown afterwards.
     */
    public synchronized PixelBuffer commit(Filter filter, int intensity) throws EditException {
        requireLoaded("commit");
        PixelBuffer result = compute(filter, intensity, filter.isReset() ? original : baseline());
        record(result, filter.label() + (filter.parameterized() ? " " + intensity : ""));
        return result;
    }

    public synchronized PixelBuffer commit(Filter filter) throws EditException {
        return commit(filter, Filter.DEFAULT_INTENSITY);
    }

    public PixelBuffer commit(String filterName, int intensity) throws EditException {
        return commit(Filter.fromName(filterName), intensity);
    }

    public PixelBuffer commit(String filterName) throws EditException {
        return commit(Filter.fromName(filterName));
    }

    // ---------------- Crop / resize ----------------

    /** Crop the displayed buffer and commit the result. */
    public synchronized PixelBuffer crop(int x, int y, int width, int height) throws EditException {
        requireLoaded("crop");
        PixelBuffer cropped = current.crop(x, y, width, height);
        record(cropped, "Crop " + x + "," + y + " " + width + "x" + height);
        return cropped;
    }

    /** Resample the displayed buffer and commit the result. */
    public synchronized PixelBuffer resize(int width, int height) throws EditException {
        requireLoaded("resize");
        if (width <= 0 || height <= 0)
            throw new EditException(EditException.Kind.INVALID_DIMENSION,
                    "Width and height must be positive, got " + width + "x" + height);
        PixelBuffer resized = current.resize(width, height);
        record(resized, "Resize " + width + "x" + height);
        return resized;
    }

    // ---------------- Undo / redo ----------------

    public synchronized void undo() throws EditException {
        if (historyIndex <= 0)
            throw new EditException(EditException.Kind.UNDO_UNAVAILABLE, "Cannot undo further.");
        historyIndex--;
        moved("Undo");
    }

    public synchronized void redo() throws EditException {
        if (historyIndex < 0 || historyIndex >= history.size() - 1)
            throw new EditException(EditException.Kind.REDO_UNAVAILABLE, "Cannot redo further.");
        historyIndex++;
        moved("Redo");
    }

    private void moved(String what) {
        current = history.get(historyIndex);
        previewing = false;
        generation++;
        LOG.info("{} -> position {}/{}", what, historyIndex + 1, history.size());
        display.render(current);
    }

    // ---------------- Save ----------------

    /** Write the displayed buffer to {@link #defaultSaveTarget()}. */
    public synchronized Path save() throws EditException {
        requireLoaded("save");
        Path target = defaultSaveTarget();
        persist(target);
        return target;
    }

    /** Write the displayed buffer to {@code path}; history is not touched. */
    public synchronized void saveAs(Path path) throws EditException {
        requireLoaded("save");
        persist(path);
    }

    private void persist(Path target) throws EditException {
        try {
            store.encode(current, target);
        } catch (EditException e) {
            LOG.warn("Error saving image to {}: {}", target, e.getMessage());
            throw e;
        }
        LOG.info("Image saved to: {}", target);
    }

    // ---------------- Async previews ----------------

    /** Number a preview request and capture the buffer it applies to. */
    public synchronized PreviewTicket requestPreview(Filter filter, int intensity) throws EditException {
        requireLoaded("preview");
        checkIntensity(intensity);
        PixelBuffer base = filter.isReset() ? original : baseline();
        return new PreviewTicket(++previewSequence, generation, filter, intensity, base);
    }

    /** Pure; safe to call from any thread. */
    public PixelBuffer computePreview(PreviewTicket ticket) {
        return compute(ticket.filter(), ticket.intensity(), ticket.baseline());
    }

    /**
     * Display {@code result} unless a newer preview was requested or history
     * changed after the ticket was issued.
     *
     * @return whether the result was applied
     */
    public synchronized boolean offerPreview(PreviewTicket ticket, PixelBuffer result) {
        if (ticket.generation() != generation || ticket.sequence() != previewSequence) {
            LOG.debug("Discarding stale preview #{} ({})", ticket.sequence(), ticket.filter().label());
            return false;
        }
        current = result;
        previewing = true;
        LOG.debug("Preview #{}: {} {}", ticket.sequence(), ticket.filter().label(), ticket.intensity());
        display.render(current);
        return true;
    }

    // ---------------- Internals ----------------

    private PixelBuffer compute(Filter filter, int intensity, PixelBuffer base) {
        checkIntensity(intensity);
        if (filter.isReset())
            return base;
        return filters.apply(filter, base, intensity);
    }

    private void record(PixelBuffer result, String what) throws EditException {
        if (historyIndex < history.size() - 1) {
            int dropped = history.size() - 1 - historyIndex;
            history.subList(historyIndex + 1, history.size()).clear();
            LOG.debug("Pruned {} redo entr{}", dropped, dropped == 1 ? "y" : "ies");
        }
        history.add(result);
        historyIndex = history.size() - 1;
        current = result;
        previewing = false;
        generation++;
        LOG.info("Committed {} (history {}/{})", what, historyIndex + 1, history.size());
        display.render(current);
        persist(defaultSaveTarget());
    }

    private PixelBuffer baseline() {
        return history.get(historyIndex);
    }

    private void requireLoaded(String op) throws EditException {
        if (history.isEmpty())
            throw new EditException(EditException.Kind.NO_IMAGE, "Cannot " + op + ": no image loaded.");
    }

    private static void checkIntensity(int intensity) {
        if (intensity < Filter.MIN_INTENSITY || intensity > Filter.MAX_INTENSITY)
            throw new IllegalArgumentException("intensity must be in [0,100]: " + intensity);
    }

    // ---------------- Accessors ----------------

    public synchronized SessionState state() {
        if (history.isEmpty())
            return SessionState.EMPTY;
        return previewing ? SessionState.PREVIEWING : SessionState.COMMITTED;
    }

    public synchronized PixelBuffer current() {
        return current;
    }

    public synchronized PixelBuffer original() {
        return original;
    }

    /** Snapshot of the committed buffers, oldest first. */
    public synchronized List<PixelBuffer> history() {
        return List.copyOf(history);
    }

    public synchronized int historySize() {
        return history.size();
    }

    /** -1 when nothing is loaded. */
    public synchronized int historyIndex() {
        return historyIndex;
    }

    public synchronized boolean canUndo() {
        return historyIndex > 0;
    }

    public synchronized boolean canRedo() {
        return historyIndex >= 0 && historyIndex < history.size() - 1;
    }

    public synchronized Path sourcePath() {
        return sourcePath;
    }

    public synchronized String sourceFilename() {
        return sourceFilename;
    }

    /** {@code <image dir>/<edits>/<image name>}, or null when empty. */
    public synchronized Path defaultSaveTarget() {
        if (sourcePath == null)
            return null;
        return sourcePath.getParent().resolve(config.editsDirectory()).resolve(sourceFilename);
    }

    public SessionConfig config() {
        return config;
    }
}
