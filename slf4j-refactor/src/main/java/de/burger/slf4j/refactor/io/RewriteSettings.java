package de.burger.slf4j.refactor.io;

import java.util.List;
import java.util.Objects;

/**
 * Driver options.
 *
 * @param dryRun       report changes without writing files
 * @param extensions   file name suffixes to process
 * @param maxFileBytes files above this size are skipped; 0 disables the guard
 * @param threads      number of worker threads, at least 1
 * @param verifySyntax reject rewrites that break a file that parsed before
 */
public record RewriteSettings(boolean dryRun, List<String> extensions, long maxFileBytes, int threads, boolean verifySyntax) {
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".java");
    public static final long DEFAULT_MAX_FILE_BYTES = 2L * 1024 * 1024;

    public RewriteSettings {
        Objects.requireNonNull(extensions, "extensions");
        extensions = extensions.isEmpty() ? DEFAULT_EXTENSIONS : List.copyOf(extensions);
        maxFileBytes = Math.max(0L, maxFileBytes);
        threads = Math.max(1, threads);
    }

    public static RewriteSettings defaults() {
        return new RewriteSettings(false, DEFAULT_EXTENSIONS, DEFAULT_MAX_FILE_BYTES, 1, true);
    }

    public RewriteSettings withDryRun(boolean newDryRun) {
        return new RewriteSettings(newDryRun, extensions, maxFileBytes, threads, verifySyntax);
    }

    public RewriteSettings withThreads(int newThreads) {
        return new RewriteSettings(dryRun, extensions, maxFileBytes, newThreads, verifySyntax);
    }

    public RewriteSettings withMaxFileBytes(long newMaxFileBytes) {
        return new RewriteSettings(dryRun, extensions, newMaxFileBytes, threads, verifySyntax);
    }

    public RewriteSettings withVerifySyntax(boolean newVerifySyntax) {
        return new RewriteSettings(dryRun, extensions, maxFileBytes, threads, newVerifySyntax);
    }

    public RewriteSettings withExtensions(List<String> newExtensions) {
        return new RewriteSettings(dryRun, newExtensions, maxFileBytes, threads, verifySyntax);
    }
}
