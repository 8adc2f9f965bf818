package com.github.trex_paxos.mcatrim;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Enumerates the containers in a directory.
public final class RegionFiles {

    public static final String EXTENSION = ".mca";

    private RegionFiles() {
    }

    /// The regular `.mca` files directly inside `dir`, sorted by name.
    ///
    /// @throws IllegalArgumentException if `dir` is missing or not a directory
    public static List<Path> list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Invalid input <" + dir + ">");
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
