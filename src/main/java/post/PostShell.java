package post;

import image.PixelBuffer;
import io.ImageStore;
import pipeline.PreviewScheduler;
import session.EditSession;
import stages.Filter;
import util.EditException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Line-oriented front end for an {@link EditSession}. Edit errors are printed
 * and the shell keeps going.
 */
public class PostShell {

    private static final Logger LOG = LoggerFactory.getLogger(PostShell.class);

    private final EditSession session;
    private final PreviewScheduler scheduler;
    private final ImageStore store;
    private final Path workingDirectory;
    private List<String> listing = new ArrayList<>();

    public PostShell(EditSession session, PreviewScheduler scheduler, ImageStore store, Path workingDirectory) {
        this.session = session;
        this.scheduler = scheduler;
        this.store = store;
        this.workingDirectory = workingDirectory;
    }

    public void run() {
        run(new BufferedReader(new InputStreamReader(System.in)), System.out);
    }

    public void run(BufferedReader in, PrintStream out) {
        printHelp(out);
        try {
            while (true) {
                out.print("post> ");
                out.flush();
                String line = in.readLine();
                if (line == null)
                    break;
                line = line.trim();
                if (line.isEmpty())
                    continue;

                String[] parts = line.split("\\s+");
                String cmd = parts[0].toLowerCase();
                String[] args = (parts.length > 1) ? Arrays.copyOfRange(parts, 1, parts.length)
                        : new String[0];
                if (cmd.equals("quit") || cmd.equals("exit"))
                    break;

                try {
                    execute(cmd, args, out);
                } catch (EditException e) {
                    out.println(e.kind() + ": " + e.getMessage());
                } catch (NumberFormatException e) {
                    out.println("Not a number: " + e.getMessage());
                } catch (IllegalArgumentException e) {
                    out.println(e.getMessage());
                } catch (RuntimeException e) {
                    LOG.error("Command '{}' failed", line, e);
                    out.println("Command failed: " + e);
                }
            }
        } catch (IOException e) {
            System.err.println("Shell I/O error: " + e.getMessage());
        }
    }

    void execute(String cmd, String[] args, PrintStream out) throws EditException {
        switch (cmd) {
            case "help" -> printHelp(out);
            case "list" -> {
                listing = store.listImages(workingDirectory, session.config().allowedExtensions());
                if (listing.isEmpty())
                    out.println("No images found in " + workingDirectory);
                for (int i = 0; i < listing.size(); i++)
                    out.println("  [" + i + "] " + listing.get(i));
            }
            case "open" -> {
                require(args, 1, "open <file|index>");
                session.load(workingDirectory.resolve(resolveName(args[0])));
                status(out);
            }
            case "filters" -> {
                for (Filter f : Filter.values())
                    out.println("  " + f.label() + (f.parameterized() ? " <0..100>" : ""));
            }
            case "preview" -> {
                require(args, 1, "preview <filter> [intensity]");
                session.preview(Filter.fromName(args[0]), intensity(args));
                out.println("Updated preview.");
            }
            case "apply" -> {
                require(args, 1, "apply <filter> [intensity]");
                commit(Filter.fromName(args[0]), intensity(args), out);
            }
            case "slide" -> slide(args, out);
            case "undo" -> {
                session.undo();
                status(out);
            }
            case "redo" -> {
                session.redo();
                status(out);
            }
            case "crop" -> {
                require(args, 4, "crop <x> <y> <width> <height>");
                guardedSave(out, () -> session.crop(Integer.parseInt(args[0]), Integer.parseInt(args[1]),
                        Integer.parseInt(args[2]), Integer.parseInt(args[3])));
            }
            case "resize" -> {
                require(args, 2, "resize <width> <height>");
                guardedSave(out, () -> session.resize(Integer.parseInt(args[0]), Integer.parseInt(args[1])));
            }
            case "save" -> out.println("Saved: " + session.save());
            case "saveas" -> {
                require(args, 1, "saveas <path>");
                Path target = workingDirectory.resolve(args[0]);
                session.saveAs(target);
                out.println("Saved: " + target);
            }
            case "status" -> status(out);
            default -> out.println("Unknown command: " + cmd);
        }
    }

    /**
     * Simulates dragging a slider from one value to another: every step is
     * previewed on the worker pool, the final value is committed.
     */
    private void slide(String[] args, PrintStream out) throws EditException {
        require(args, 3, "slide <filter> <from> <to> [step]");
        Filter filter = Filter.fromName(args[0]);
        int from = Integer.parseInt(args[1]);
        int to = Integer.parseInt(args[2]);
        int step = Math.max(1, args.length > 3 ? Integer.parseInt(args[3]) : 5);
        int dir = to >= from ? 1 : -1;

        List<CompletableFuture<Boolean>> pending = new ArrayList<>();
        for (int v = from; dir > 0 ? v < to : v > to; v += dir * step)
            pending.add(scheduler.submit(filter, v));
        long shown;
        try {
            shown = pending.stream().filter(CompletableFuture::join).count();
        } catch (CompletionException e) {
            throw new IllegalArgumentException("Preview failed: " + e.getCause().getMessage(), e.getCause());
        }
        out.println("Previewed " + pending.size() + " value(s), " + shown + " displayed.");
        commit(filter, to, out);
    }

    private void commit(Filter filter, int intensity, PrintStream out) throws EditException {
        guardedSave(out, () -> session.commit(filter, intensity));
    }

    @FunctionalInterface
    private interface Edit {
        PixelBuffer run() throws EditException;
    }

    /** A failed save after a commit is reported, the edit itself stands. */
    private void guardedSave(PrintStream out, Edit edit) throws EditException {
        try {
            PixelBuffer result = edit.run();
            out.println("Applied. Now " + result.width() + "x" + result.height()
                    + ", saved to " + session.defaultSaveTarget());
        } catch (EditException e) {
            if (e.kind() != EditException.Kind.IO)
                throw e;
            out.println("Applied, but saving failed: " + e.getMessage());
        }
        status(out);
    }

    private void status(PrintStream out) {
        PixelBuffer cur = session.current();
        if (cur == null) {
            out.println("No image loaded.");
            return;
        }
        out.printf("%s  %dx%d %s  history %d/%d  [%s]%n",
                session.sourceFilename(), cur.width(), cur.height(), cur.mode(),
                session.historyIndex() + 1, session.historySize(), session.state());
    }

    private String resolveName(String arg) {
        if (arg.chars().allMatch(Character::isDigit)) {
            int i = Integer.parseInt(arg);
            if (i < listing.size())
                return listing.get(i);
        }
        return arg;
    }

    private static int intensity(String[] args) {
        return args.length > 1 ? Integer.parseInt(args[1]) : Filter.DEFAULT_INTENSITY;
    }

    private static void require(String[] args, int n, String usage) {
        if (args.length < n)
            throw new IllegalArgumentException("Usage: " + usage);
    }

    private static void printHelp(PrintStream out) {
        out.println();
        out.println("Edit shell. Commands:");
        out.println("  list                       images in the working directory");
        out.println("  open <file|index>");
        out.println("  filters");
        out.println("  preview <filter> [0..100]  e.g., preview Blur 30");
        out.println("  apply <filter> [0..100]    e.g., apply Contrast 70");
        out.println("  slide <filter> <from> <to> [step]");
        out.println("  undo | redo");
        out.println("  crop <x> <y> <w> <h>");
        out.println("  resize <w> <h>");
        out.println("  save | saveas <path>");
        out.println("  status");
        out.println("  quit");
        out.println();
    }
}
