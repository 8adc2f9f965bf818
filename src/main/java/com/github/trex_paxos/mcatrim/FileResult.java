package com.github.trex_paxos.mcatrim;

import java.nio.file.Path;

/// The outcome for one region container, with the failure message when there is one.
public record FileResult(Path file, FileOutcome outcome, int chunksTrimmed, String error) {

    static FileResult success(Path file, FileOutcome outcome, int chunksTrimmed) {
        return new FileResult(file, outcome, chunksTrimmed, null);
    }

    static FileResult failure(Path file, FileOutcome outcome, Throwable error) {
        return new FileResult(file, outcome, 0, error == null ? null : String.valueOf(error.getMessage()));
    }
}
