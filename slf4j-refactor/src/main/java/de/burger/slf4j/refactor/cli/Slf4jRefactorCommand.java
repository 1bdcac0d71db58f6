package de.burger.slf4j.refactor.cli;

import de.burger.slf4j.refactor.engine.LocatorSettings;
import de.burger.slf4j.refactor.engine.SupplierChainRefactorer;
import de.burger.slf4j.refactor.io.FileOutcome;
import de.burger.slf4j.refactor.io.RewriteSettings;
import de.burger.slf4j.refactor.io.RunSummary;
import de.burger.slf4j.refactor.io.SourceTreeRewriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
        name = "slf4j-refactor",
        mixinStandardHelpOptions = true,
        version = "slf4j-refactor 1.0",
        description = "Refactor SLF4J supplier-style log chains into parameterized messages (no backups, use VCS).")
public final class Slf4jRefactorCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_FILE_ERRORS = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_NOT_FOUND = 3;

    private static final Logger log = LoggerFactory.getLogger(Slf4jRefactorCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<root>", description = "Directory or file with Java sources.")
    Path root;

    @Option(names = "--dry-run", description = "Report changes without writing.")
    boolean dryRun;

    @Option(names = "--threads", defaultValue = "1", description = "Worker threads (default: ${DEFAULT-VALUE}).")
    int threads;

    @Option(names = "--max-file-bytes", defaultValue = "" + RewriteSettings.DEFAULT_MAX_FILE_BYTES,
            description = "Skip files larger than this; 0 disables the limit (default: ${DEFAULT-VALUE}).")
    long maxFileBytes;

    @Option(names = "--max-span-chars", defaultValue = "" + LocatorSettings.DEFAULT_MAX_SPAN_CHARS,
            description = "Longest log chain considered, in characters (default: ${DEFAULT-VALUE}).")
    int maxSpanChars;

    @Option(names = "--extension", split = ",", description = "File suffixes to process (default: .java).")
    List<String> extensions = new ArrayList<>();

    @Option(names = "--receiver", split = ",", description = "Logger variable names (default: log, LOGGER, logger).")
    List<String> receivers = new ArrayList<>();

    @Option(names = "--no-verify", negatable = false, description = "Do not reject rewrites that break parsing.")
    boolean noVerify;

    public static void main(String... args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new Slf4jRefactorCommand()).execute(args);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (root == null) {
            err.println("Error: please provide a root directory");
            return EXIT_USAGE;
        }
        if (!Files.exists(root)) {
            err.println("Error: path not found: " + root);
            return EXIT_NOT_FOUND;
        }

        LocatorSettings locatorSettings = LocatorSettings.defaults().withMaxSpanChars(maxSpanChars);
        if (!receivers.isEmpty()) {
            locatorSettings = locatorSettings.withReceivers(receivers);
        }
        RewriteSettings settings = new RewriteSettings(dryRun, extensions, maxFileBytes, threads, !noVerify);
        SourceTreeRewriter rewriter = new SourceTreeRewriter(settings, new SupplierChainRefactorer(locatorSettings));

        RunSummary summary;
        try {
            summary = rewriter.run(root);
        } catch (IOException e) {
            log.error("Cannot traverse {}", root, e);
            err.println("Error: cannot traverse " + root + ": " + e.getMessage());
            return EXIT_FILE_ERRORS;
        }

        for (FileOutcome outcome : summary.outcomes()) {
            switch (outcome.status()) {
                case WOULD_REWRITE -> out.println("[DRY] Transformed: " + outcome.path());
                case REWRITTEN -> out.println("Transformed: " + outcome.path());
                case REJECTED -> err.println("Skipped (result would not parse): " + outcome.path());
                case FAILED -> err.println("Error processing " + outcome.path() + ": " + outcome.detail());
                default -> {
                }
            }
        }
        out.println();
        out.printf("Scanned %d files. %s %d files.%n",
                summary.filesScanned(), dryRun ? "Would change" : "Changed", summary.filesChanged());
        out.flush();
        err.flush();
        return summary.hasFailures() ? EXIT_FILE_ERRORS : EXIT_OK;
    }
}
