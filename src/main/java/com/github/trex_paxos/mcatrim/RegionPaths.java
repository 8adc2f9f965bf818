package com.github.trex_paxos.mcatrim;

import lombok.val;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The input, output and optional backup world directories. Output may equal input for an
/// in-place rewrite; backup must differ from both.
public final class RegionPaths {

    private final static Logger logger = Logger.getLogger(RegionPaths.class.getName());

    private final Path input;
    private final Path output;
    private final Path backup;

    private RegionPaths(Path input, Path output, Path backup) {
        this.input = input;
        this.output = output;
        this.backup = backup;
    }

    /// Validates the directories and creates the container subdirectories under each.
    ///
    /// @param backup may be `null` for no backups
    /// @throws IllegalArgumentException if backup equals input or output, or input does not exist
    public static RegionPaths create(Path input, Path output, Path backup) throws IOException {
        final Path in = normalize(input);
        final Path out = output == null ? in : normalize(output);
        final Path bak = backup == null ? null : normalize(backup);
        if (in.equals(bak)) {
            throw new IllegalArgumentException("Input and backup directories cannot be the same: " + in);
        }
        if (out.equals(bak)) {
            throw new IllegalArgumentException("Output and backup directories cannot be the same: " + out);
        }
        if (!Files.isDirectory(in)) {
            throw new IllegalArgumentException("Input directory must exist: " + in);
        }
        val paths = new RegionPaths(in, out, bak);
        for (ContainerKind kind : ContainerKind.values()) {
            Files.createDirectories(paths.input(kind));
            Files.createDirectories(paths.output(kind));
            if (bak != null) Files.createDirectories(bak.resolve(kind.getDirectoryName()));
        }
        logger.log(Level.FINE, () -> String.format("input:%s output:%s backup:%s", in, out, bak));
        return paths;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    public Path input(ContainerKind kind) {
        return input.resolve(kind.getDirectoryName());
    }

    public Path output(ContainerKind kind) {
        return output.resolve(kind.getDirectoryName());
    }

    public Optional<Path> backup(ContainerKind kind) {
        return Optional.ofNullable(backup).map(b -> b.resolve(kind.getDirectoryName()));
    }

    public boolean isInPlace() {
        return input.equals(output);
    }

    @Override
    public String toString() {
        return String.format("RegionPaths[input=%s, output=%s, backup=%s]", input, output, backup);
    }
}
