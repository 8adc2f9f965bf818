package com.github.trex_paxos.mcatrim;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/// Which containers of a batch succeeded, changed or failed.
public final class BatchReport {

    private final List<FileResult> results;

    BatchReport(List<FileResult> results) {
        List<FileResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparing(FileResult::file));
        this.results = Collections.unmodifiableList(sorted);
    }

    public List<FileResult> getResults() {
        return results;
    }

    public List<Path> succeeded() {
        return select(r -> r.outcome().isSuccess());
    }

    public List<Path> changed() {
        return select(r -> r.outcome().isChanged());
    }

    public List<Path> failed() {
        return select(r -> !r.outcome().isSuccess());
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> !r.outcome().isSuccess());
    }

    public FileOutcome outcomeOf(Path file) {
        return results.stream()
                .filter(r -> r.file().equals(file))
                .map(FileResult::outcome)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("not part of this batch: " + file));
    }

    public Map<FileOutcome, Integer> counts() {
        Map<FileOutcome, Integer> counts = new EnumMap<>(FileOutcome.class);
        for (FileResult r : results) {
            counts.merge(r.outcome(), 1, Integer::sum);
        }
        return counts;
    }

    public int chunksTrimmed() {
        return results.stream().mapToInt(FileResult::chunksTrimmed).sum();
    }

    private List<Path> select(Predicate<FileResult> filter) {
        return results.stream().filter(filter).map(FileResult::file).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.format("BatchReport[files=%d, chunksTrimmed=%d, %s]", results.size(), chunksTrimmed(), counts());
    }
}
