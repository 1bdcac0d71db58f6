package de.burger.slf4j.refactor.io;

import de.burger.slf4j.refactor.engine.RewriteResult;
import de.burger.slf4j.refactor.engine.SupplierChainRefactorer;
import de.burger.slf4j.refactor.util.HashUtil;
import de.burger.slf4j.refactor.verify.JavaSyntaxVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Applies the rewrite engine to every matching file below a root. Files are independent, so with
 * more than one thread they are partitioned into stable shards, one shard per worker.
 * I/O problems are recorded per file; the run always continues with the remaining files.
 */
public final class SourceTreeRewriter {
    private static final Logger log = LoggerFactory.getLogger(SourceTreeRewriter.class);
    private static final int MAX_DEPTH = 64;

    private final RewriteSettings settings;
    private final SupplierChainRefactorer refactorer;
    private final JavaSyntaxVerifier verifier;

    public SourceTreeRewriter(RewriteSettings settings, SupplierChainRefactorer refactorer) {
        this(settings, refactorer, new JavaSyntaxVerifier());
    }

    public SourceTreeRewriter(RewriteSettings settings, SupplierChainRefactorer refactorer, JavaSyntaxVerifier verifier) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.refactorer = Objects.requireNonNull(refactorer, "refactorer");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
    }

    public RunSummary run(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        List<FileOutcome> outcomes = new ArrayList<>();
        List<Path> files = collectFiles(root, outcomes);
        log.info("Processing {} file(s) below {} with {} thread(s){}", files.size(), root,
                settings.threads(), settings.dryRun() ? " (dry run)" : "");
        if (settings.threads() == 1 || files.size() <= 1) {
            outcomes.addAll(processAll(files));
        } else {
            outcomes.addAll(processSharded(files));
        }
        return new RunSummary(outcomes);
    }

    List<Path> collectFiles(Path root, List<FileOutcome> failures) throws IOException {
        if (Files.isRegularFile(root)) {
            return SourceFileGuards.hasExtension(root, settings.extensions()) ? List.of(root) : List.of();
        }
        List<Path> files = new ArrayList<>();
        // Bounded depth; directory symlinks are skipped to avoid cycles.
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), MAX_DEPTH, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (Files.isSymbolicLink(dir)) return FileVisitResult.SKIP_SUBTREE;
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && SourceFileGuards.hasExtension(file, settings.extensions())) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot visit {}: {}", file, exc.getMessage());
                failures.add(new FileOutcome(file, FileOutcome.Status.FAILED, 0, exc.getMessage()));
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);
        return files;
    }

    private List<FileOutcome> processAll(List<Path> files) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        for (Path file : files) {
            outcomes.add(process(file));
        }
        return outcomes;
    }

    private List<FileOutcome> processSharded(List<Path> files) {
        int shards = settings.threads();
        List<List<Path>> partitions = new ArrayList<>(shards);
        for (int i = 0; i < shards; i++) {
            partitions.add(new ArrayList<>());
        }
        for (Path file : files) {
            partitions.get(HashUtil.stableShard(file.toString(), shards)).add(file);
        }
        ExecutorService pool = Executors.newFixedThreadPool(shards);
        try {
            List<Future<List<FileOutcome>>> futures = new ArrayList<>(shards);
            for (List<Path> partition : partitions) {
                futures.add(pool.submit(() -> processAll(partition)));
            }
            List<FileOutcome> outcomes = new ArrayList<>(files.size());
            for (Future<List<FileOutcome>> future : futures) {
                outcomes.addAll(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while rewriting files", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Worker failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /** Rewrites a single file according to the settings; never throws for I/O problems. */
    public FileOutcome process(Path file) {
        try {
            if (SourceFileGuards.shouldSkipLargeFile(file, settings.maxFileBytes(), log::info)) {
                return FileOutcome.of(file, FileOutcome.Status.SKIPPED_LARGE);
            }
            String original = readLenient(file);
            RewriteResult result = refactorer.rewrite(original, file);
            if (!(result instanceof RewriteResult.Rewritten rewritten)) {
                return FileOutcome.of(file, FileOutcome.Status.UNCHANGED);
            }
            if (settings.verifySyntax() && !verifier.acceptsRewrite(original, rewritten.text())) {
                log.warn("Rewrite of {} does not parse any more, file left untouched", file);
                return new FileOutcome(file, FileOutcome.Status.REJECTED, rewritten.chainsRewritten(),
                        "rewritten source does not parse");
            }
            if (settings.dryRun()) {
                return new FileOutcome(file, FileOutcome.Status.WOULD_REWRITE, rewritten.chainsRewritten(), null);
            }
            Files.writeString(file, rewritten.text(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chain(s))", file, rewritten.chainsRewritten());
            return new FileOutcome(file, FileOutcome.Status.REWRITTEN, rewritten.chainsRewritten(), null);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Error processing {}: {}", file, e.getMessage());
            return new FileOutcome(file, FileOutcome.Status.FAILED, 0, String.valueOf(e.getMessage()));
        }
    }

    /** UTF-8, dropping malformed byte sequences instead of failing. */
    static String readLenient(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        return decoder.decode(ByteBuffer.wrap(Files.readAllBytes(file))).toString();
    }
}
