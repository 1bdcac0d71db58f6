package de.burger.slf4j.refactor.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

public final class SourceFileGuards {
    private SourceFileGuards() {}

    public static boolean shouldSkipLargeFile(Path file, long maxBytes, Consumer<String> debug) throws IOException {
        if (maxBytes <= 0) return false;
        long length = Files.size(file);
        if (length > maxBytes) {
            if (debug != null) {
                debug.accept("Skipping large file (" + length + " bytes > limit " + maxBytes + "): " + file.toAbsolutePath());
            }
            return true;
        }
        return false;
    }

    public static boolean hasExtension(Path file, List<String> extensions) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        return extensions.stream().anyMatch(name::endsWith);
    }
}
