package de.burger.slf4j.refactor.io;

import java.util.Comparator;
import java.util.List;

/** Per-file outcomes of a run, ordered by path. */
public record RunSummary(List<FileOutcome> outcomes) {
    public RunSummary {
        outcomes = outcomes.stream().sorted(Comparator.comparing(FileOutcome::path)).toList();
    }

    public int filesScanned() {
        return outcomes.size();
    }

    public long filesChanged() {
        return outcomes.stream().filter(o -> o.status().isChange()).count();
    }

    public long count(FileOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public boolean hasFailures() {
        return count(FileOutcome.Status.FAILED) > 0;
    }
}
