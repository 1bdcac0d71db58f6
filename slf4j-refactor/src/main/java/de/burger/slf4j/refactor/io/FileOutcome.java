package de.burger.slf4j.refactor.io;

import java.nio.file.Path;

/** What happened to one file during a run. */
public record FileOutcome(Path path, Status status, int chainsRewritten, String detail) {

    public enum Status {
        UNCHANGED,
        REWRITTEN,
        WOULD_REWRITE,
        SKIPPED_LARGE,
        REJECTED,
        FAILED;

        public boolean isChange() {
            return this == REWRITTEN || this == WOULD_REWRITE;
        }
    }

    static FileOutcome of(Path path, Status status) {
        return new FileOutcome(path, status, 0, null);
    }
}
