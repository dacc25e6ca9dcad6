package app;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import hw.DisplayService;
import io.ImageLoader;
import pipeline.PreviewScheduler;
import post.PostShell;
import session.EditSession;
import session.SessionConfig;
import util.EditException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry for the photo editor.
 * Example:
 * java -jar photo-edit.jar --dir=C:\photos --input=cat.jpg
 *
 * # OpenCL contrast (falls back to CPU when no device is present)
 * java -DuseGPU=true -jar photo-edit.jar --dir=C:\photos
 * # or
 * java -jar photo-edit.jar --dir=C:\photos --gpu
 */
public final class CLI {

    // -------------------- Args --------------------
    private static final class Args {
        @Parameter(names = "--dir", description = "Working directory holding the images")
        String dir = ".";

        @Parameter(names = "--input", description = "Image to open at start (relative to --dir)")
        String input;

        @Parameter(names = "--preview", description = "File the display writes frames to (default <dir>/preview.png)")
        String preview;

        @Parameter(names = "--open-viewer", description = "Open the preview file in the desktop image viewer")
        boolean openViewer = false;

        @Parameter(names = "--threads", description = "Preview worker threads (0 = follow power state)")
        Integer threads;

        @Parameter(names = "--gpu", description = "Use GPU acceleration (OpenCL). Also honored via -DuseGPU=true")
        boolean gpu = false;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show help")
        boolean help = false;
    }

    public static void main(String[] argv) {
        Args args = new Args();
        JCommander jc = JCommander.newBuilder().addObject(args).programName("photo-edit").build();
        try {
            jc.parse(argv);
        } catch (ParameterException pe) {
            System.err.println(pe.getMessage());
            jc.usage();
            System.exit(1);
        }
        if (args.help) {
            jc.usage();
            return;
        }

        SessionConfig config = SessionConfig.load();
        if (args.gpu)
            config = config.withUseGpu(true);
        if (args.threads != null)
            config = config.withWorkerThreads(args.threads);

        Path dir = Paths.get(args.dir).toAbsolutePath().normalize();
        Path previewOut = args.preview != null ? dir.resolve(args.preview) : dir.resolve("preview.png");

        // Banner
        System.out.println("== Photo Edit ==");
        System.out.println("Directory: " + dir);
        System.out.println("GPU: " + config.useGpu() + "  Preview: " + previewOut);

        ImageLoader store = new ImageLoader();
        DisplayService display = new DisplayService(previewOut, config.viewportWidth(), config.viewportHeight(),
                args.openViewer);
        EditSession session = new EditSession(config, store, display);

        if (args.input != null) {
            try {
                session.load(dir.resolve(args.input));
                System.out.println("Opened " + session.sourceFilename());
            } catch (EditException e) {
                System.err.println("Could not open " + args.input + ": " + e.getMessage());
            }
        }

        try (PreviewScheduler scheduler = new PreviewScheduler(session, config.workerThreads())) {
            new PostShell(session, scheduler, store, dir).run();
        }
    }
}
