package session;

import hw.RecordingDisplay;
import image.ColorMode;
import image.PixelBuffer;
import image.TestImages;
import io.ImageLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import stages.Filter;
import stages.FilterLibrary;
import util.EditException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditSessionTest {

    @TempDir
    Path dir;

    private final ImageLoader store = new ImageLoader();
    private final FilterLibrary library = new FilterLibrary();
    private RecordingDisplay display;
    private EditSession session;
    private PixelBuffer image;
    private Path photo;

    @BeforeEach
    void setUp() throws EditException {
        display = new RecordingDisplay();
        session = new EditSession(SessionConfig.defaults(), store, display, library);
        image = TestImages.gradient(100, 100, ColorMode.RGB);
        photo = dir.resolve("photo.png");
        store.encode(image, photo);
    }

    // --- load ---

    @Test
    void loadStartsWithOriginalAsOnlyEntry() throws EditException {
        assertEquals(SessionState.EMPTY, session.state());
        assertEquals(-1, session.historyIndex());

        session.load(photo);

        assertEquals(SessionState.COMMITTED, session.state());
        assertEquals(1, session.historySize());
        assertEquals(0, session.historyIndex());
        assertEquals(image, session.original());
        assertEquals(image, session.current());
        assertEquals("photo.png", session.sourceFilename());
        assertEquals(dir.resolve("edits").resolve("photo.png").toAbsolutePath(), session.defaultSaveTarget());
        assertEquals(image, display.last());
    }

    @Test
    void failedLoadEmptiesTheSession() throws Exception {
        session.load(photo);
        session.commit(Filter.GRAYSCALE);
        Path junk = dir.resolve("junk.png");
        Files.writeString(junk, "not a png");

        EditException e = assertThrows(EditException.class, () -> session.load(junk));

        assertEquals(EditException.Kind.DECODE, e.kind());
        assertEquals(SessionState.EMPTY, session.state());
        assertEquals(0, session.historySize());
        assertEquals(-1, session.historyIndex());
        assertNull(session.current());
        assertNull(session.original());
        assertNull(session.defaultSaveTarget());
        assertEquals(1, display.messages.size());
    }

    @Test
    void loadOfMissingFileIsADecodeError() {
        EditException e = assertThrows(EditException.class, () -> session.load(dir.resolve("nope.png")));
        assertEquals(EditException.Kind.DECODE, e.kind());
    }

    @Test
    void nextLoadReplacesPreviousSession() throws EditException {
        session.load(photo);
        session.commit(Filter.MIRROR);
        Path other = dir.resolve("other.png");
        PixelBuffer small = TestImages.gradient(10, 5, ColorMode.RGBA);
        store.encode(small, other);

        session.load(other);

        assertEquals(1, session.historySize());
        assertEquals(small, session.original());
        assertEquals("other.png", session.sourceFilename());
    }

    // --- commit ---

    @Test
    void everyCommitAppendsOneEntry() throws EditException {
        session.load(photo);
        int n = 5;
        for (int i = 0; i < n; i++)
            session.commit(Filter.CONTRAST, 60);

        assertEquals(n + 1, session.historySize());
        assertEquals(n, session.historyIndex());
    }

    @Test
    void identicalCommitsAreNotDeduplicated() throws EditException {
        session.load(photo);
        session.commit(Filter.COLOR, 50);
        session.commit(Filter.COLOR, 50);
        assertEquals(3, session.historySize());
    }

    @Test
    void filtersComposeFromLastCommittedState() throws EditException {
        session.load(photo);
        session.commit(Filter.ROTATE_RIGHT);
        session.commit(Filter.MIRROR);

        assertEquals(image.rotate90CW().flipHorizontal(), session.current());
    }

    @Test
    void commitWritesToEditsDirectoryLazily() throws EditException {
        session.load(photo);
        Path edits = dir.resolve("edits");
        assertFalse(Files.exists(edits));

        session.commit(Filter.GRAYSCALE);

        Path saved = edits.resolve("photo.png");
        assertTrue(Files.isRegularFile(saved));
        assertEquals(session.current(), store.decode(saved).toMode(ColorMode.RGB));
    }

    @Test
    void failedPersistKeepsTheEdit() throws Exception {
        session.load(photo);
        Files.writeString(dir.resolve("edits"), "a file where the directory should be");

        EditException e = assertThrows(EditException.class, () -> session.commit(Filter.MIRROR));

        assertEquals(EditException.Kind.IO, e.kind());
        assertEquals(2, session.historySize());
        assertEquals(1, session.historyIndex());
        assertEquals(image.flipHorizontal(), session.current());
    }

    @Test
    void unknownFilterLeavesStateAlone() throws EditException {
        session.load(photo);
        EditException e = assertThrows(EditException.class, () -> session.commit("Posterize", 10));
        assertEquals(EditException.Kind.UNKNOWN_FILTER, e.kind());
        assertEquals(1, session.historySize());
    }

    @Test
    void operationsNeedAnImage() {
        assertKind(EditException.Kind.NO_IMAGE, () -> session.preview(Filter.BLUR, 10));
        assertKind(EditException.Kind.NO_IMAGE, () -> session.commit(Filter.BLUR, 10));
        assertKind(EditException.Kind.NO_IMAGE, () -> session.crop(0, 0, 1, 1));
        assertKind(EditException.Kind.NO_IMAGE, () -> session.resize(1, 1));
        assertKind(EditException.Kind.NO_IMAGE, () -> session.saveAs(dir.resolve("x.png")));
        assertKind(EditException.Kind.UNDO_UNAVAILABLE, () -> session.undo());
        assertKind(EditException.Kind.REDO_UNAVAILABLE, () -> session.redo());
    }

    // --- preview ---

    @Test
    void previewsNeverTouchHistory() throws EditException {
        session.load(photo);
        session.commit(Filter.GRAYSCALE);
        List<PixelBuffer> before = session.history();

        for (int i = 0; i <= 100; i += 10)
            session.preview(Filter.BLUR, i);

        assertEquals(before, session.history());
        assertEquals(1, session.historyIndex());
        assertEquals(SessionState.PREVIEWING, session.state());
        assertEquals(library.apply(Filter.BLUR, before.get(1), 100), session.current());
    }

    @Test
    void commitAfterPreviewUsesTheBaselineNotThePreview() throws EditException {
        session.load(photo);
        session.preview(Filter.CONTRAST, 90);
        session.commit(Filter.CONTRAST, 70);

        assertEquals(library.apply(Filter.CONTRAST, image, 70), session.current());
        assertEquals(SessionState.COMMITTED, session.state());
    }

    @Test
    void resetRestoresTheOriginal() throws EditException {
        session.load(photo);
        session.commit(Filter.ROTATE_LEFT);
        session.commit(Filter.COLOR, 0);

        session.preview("Reset", 0);
        assertEquals(image, session.current());
        assertEquals(3, session.historySize());

        session.commit(Filter.ORIGINAL);
        assertEquals(4, session.historySize());
        assertEquals(image, session.history().get(3));
    }

    @Test
    void previewIsRenderedButNotSaved() throws EditException {
        session.load(photo);
        int framesBefore = display.frames.size();

        session.preview(Filter.SHARPEN, 80);

        assertEquals(framesBefore + 1, display.frames.size());
        assertFalse(Files.exists(dir.resolve("edits")));
    }

    // --- undo / redo ---

    @Test
    void undoThenRedoRestoresIdenticalBuffer() throws EditException {
        session.load(photo);
        session.commit(Filter.BLUR, 20);
        PixelBuffer before = session.current();

        session.undo();
        assertEquals(image, session.current());
        session.redo();

        assertEquals(before, session.current());
        assertSame(before, session.current());
    }

    @Test
    void undoFromPreviewGoesBackOneCommit() throws EditException {
        session.load(photo);
        session.commit(Filter.MIRROR);
        session.preview(Filter.BLUR, 40);

        session.undo();

        assertEquals(image, session.current());
        assertEquals(SessionState.COMMITTED, session.state());
    }

    @Test
    void undoAtStartIsUnavailable() throws EditException {
        session.load(photo);
        assertKind(EditException.Kind.UNDO_UNAVAILABLE, () -> session.undo());
        assertEquals(0, session.historyIndex());
        assertFalse(session.canUndo());
    }

    @Test
    void grayUndoBlurPrunesTheBranch() throws EditException {
        session.load(photo);
        session.commit("grayscale");
        PixelBuffer gray = session.current();
        assertEquals(List.of(image, gray), session.history());

        session.undo();
        assertEquals(image, session.current());

        session.commit("blur", 30);

        assertEquals(List.of(image, library.apply(Filter.BLUR, image, 30)), session.history());
        assertEquals(1, session.historyIndex());
        assertFalse(session.canRedo());
        assertKind(EditException.Kind.REDO_UNAVAILABLE, () -> session.redo());
    }

    @Test
    void commitAfterUndoTruncatesToIndexPlusTwo() throws EditException {
        session.load(photo);
        for (int i = 0; i < 4; i++)
            session.commit(Filter.ROTATE_RIGHT);
        session.undo();
        session.undo();
        int index = session.historyIndex();

        session.commit(Filter.MIRROR);

        assertEquals(index + 2, session.historySize());
    }

    // --- crop / resize ---

    @Test
    void cropCommitsTheCroppedBuffer() throws EditException {
        session.load(photo);
        session.crop(10, 20, 30, 40);

        assertEquals(2, session.historySize());
        assertEquals(30, session.current().width());
        assertEquals(40, session.current().height());
        assertEquals(image.getRGB(10, 20), session.current().getRGB(0, 0));
    }

    @Test
    void invalidCropChangesNothing() throws EditException {
        session.load(photo);
        session.preview(Filter.MIRROR, 0);
        PixelBuffer shown = session.current();

        assertKind(EditException.Kind.BOUNDS, () -> session.crop(90, 90, 20, 20));
        assertKind(EditException.Kind.BOUNDS, () -> session.crop(10, 0, Integer.MAX_VALUE - 5, 2));

        assertEquals(1, session.historySize());
        assertSame(shown, session.current());
        assertEquals(SessionState.PREVIEWING, session.state());
    }

    @Test
    void resizeToZeroIsRejectedAndChangesNothing() throws EditException {
        session.load(photo);
        session.commit(Filter.COLOR, 80);
        List<PixelBuffer> history = session.history();
        PixelBuffer current = session.current();

        assertKind(EditException.Kind.INVALID_DIMENSION, () -> session.resize(0, 50));
        assertKind(EditException.Kind.INVALID_DIMENSION, () -> session.resize(70000, 70000));

        assertEquals(history, session.history());
        assertSame(current, session.current());
        assertEquals(1, session.historyIndex());
    }

    @Test
    void resizeCommits() throws EditException {
        session.load(photo);
        session.resize(50, 25);
        assertEquals(50, session.current().width());
        assertEquals(25, session.current().height());
        assertEquals(2, session.historySize());
    }

    // --- save ---

    @Test
    void saveAsToUnwritablePathKeepsState() throws Exception {
        session.load(photo);
        session.commit(Filter.CONTRAST, 30);
        List<PixelBuffer> history = session.history();
        PixelBuffer current = session.current();
        Path blocker = dir.resolve("readonly");
        Files.writeString(blocker, "plain file, not a directory");

        assertKind(EditException.Kind.IO, () -> session.saveAs(blocker.resolve("out.png")));

        assertEquals(history, session.history());
        assertSame(current, session.current());
    }

    @Test
    void saveAsWritesTheDisplayedBuffer() throws EditException {
        session.load(photo);
        session.preview(Filter.ROTATE_LEFT, 0);
        Path out = dir.resolve("exports").resolve("rotated.png");

        session.saveAs(out);

        assertEquals(image.rotate90CCW(), store.decode(out));
        assertEquals(1, session.historySize());
    }

    @Test
    void saveUsesDefaultTarget() throws EditException {
        session.load(photo);
        Path target = session.save();
        assertEquals(session.defaultSaveTarget(), target);
        assertEquals(image, store.decode(target));
    }

    // --- async tickets ---

    @Test
    void olderPreviewTicketIsDiscarded() throws EditException {
        session.load(photo);
        PreviewTicket older = session.requestPreview(Filter.BLUR, 10);
        PreviewTicket newer = session.requestPreview(Filter.BLUR, 20);
        assertTrue(newer.sequence() > older.sequence());

        assertTrue(session.offerPreview(newer, session.computePreview(newer)));
        assertFalse(session.offerPreview(older, session.computePreview(older)));

        assertEquals(library.apply(Filter.BLUR, image, 20), session.current());
    }

    @Test
    void previewFinishingAfterCommitIsDiscarded() throws EditException {
        session.load(photo);
        PreviewTicket inFlight = session.requestPreview(Filter.CONTRAST, 10);

        session.commit(Filter.CONTRAST, 90);
        PixelBuffer committed = session.current();

        assertFalse(session.offerPreview(inFlight, session.computePreview(inFlight)));
        assertSame(committed, session.current());
        assertEquals(SessionState.COMMITTED, session.state());
    }

    @Test
    void previewFinishingAfterUndoIsDiscarded() throws EditException {
        session.load(photo);
        session.commit(Filter.MIRROR);
        PreviewTicket inFlight = session.requestPreview(Filter.BLUR, 50);

        session.undo();

        assertFalse(session.offerPreview(inFlight, session.computePreview(inFlight)));
        assertEquals(image, session.current());
    }

    private static void assertKind(EditException.Kind kind, org.junit.jupiter.api.function.Executable call) {
        EditException e = assertThrows(EditException.class, call);
        assertEquals(kind, e.kind());
    }
}
