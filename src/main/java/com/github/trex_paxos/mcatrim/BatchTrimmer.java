package com.github.trex_paxos.mcatrim;

import lombok.val;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Trims every region container of a world. Files are dealt round-robin to independent workers
/// that share nothing but the file system; each worker runs load, trim, backup and save for one
/// file at a time.
///
/// When a region container is trimmed, the same slot indices are removed from the same-named
/// entities and poi containers, since those records belong to the removed chunks.
public final class BatchTrimmer {

    private final static Logger logger = Logger.getLogger(BatchTrimmer.class.getName());

    public static String PARALLELISM_PROPERTY = "PARALLELISM";

    private static final ContainerKind[] COMPANIONS = {ContainerKind.ENTITIES, ContainerKind.POI};

    private final RegionPaths paths;
    private final TrimPredicate predicate;

    public BatchTrimmer(RegionPaths paths, TrimPredicate predicate) {
        this.paths = paths;
        this.predicate = predicate;
    }

    /// The worker count used when parallelism is requested without a number. Read from the system
    /// property or environment variable `com.github.trex_paxos.mcatrim.BatchTrimmer.PARALLELISM`,
    /// otherwise one less than the available processors.
    public static int getParallelismOrDefault() {
        final String key = String.format("%s.%s", BatchTrimmer.class.getName(), PARALLELISM_PROPERTY);
        String fallback = Integer.toString(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        String value = System.getenv(key) == null ? fallback : System.getenv(key);
        value = System.getProperty(key, value);
        int parallelism = Integer.parseInt(value.trim());
        if (parallelism < 1) {
            throw new IllegalArgumentException(String.format("%s must be at least 1 but was %d", key, parallelism));
        }
        return parallelism;
    }

    /// Processes every container in the input region directory.
    ///
    /// @param parallelism number of workers; 1 runs on the calling thread
    public BatchReport run(int parallelism) throws IOException, InterruptedException {
        return run(RegionFiles.list(paths.input(ContainerKind.REGION)), parallelism);
    }

    BatchReport run(List<Path> files, int parallelism) throws InterruptedException {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1 but was " + parallelism);
        }
        logger.info(() -> String.format("trimming %d region files with %d worker(s) using %s",
                files.size(), parallelism, predicate));
        final List<FileResult> results = new ArrayList<>(files.size());
        if (parallelism == 1) {
            processAll(files, results);
        } else {
            val work = partition(files, parallelism);
            final List<List<FileResult>> done = new ArrayList<>(work.size());
            ExecutorService executor = Executors.newFixedThreadPool(parallelism);
            try {
                final List<Future<?>> futures = new ArrayList<>(work.size());
                for (List<Path> list : work) {
                    final List<FileResult> into = new ArrayList<>(list.size());
                    done.add(into);
                    futures.add(executor.submit(() -> processAll(list, into)));
                }
                for (int w = 0; w < futures.size(); w++) {
                    try {
                        futures.get(w).get();
                    } catch (ExecutionException e) {
                        abandon(work.get(w), done.get(w), e.getCause());
                    }
                    results.addAll(done.get(w));
                }
            } finally {
                executor.shutdownNow();
            }
        }
        val report = new BatchReport(results);
        logger.info(report::toString);
        return report;
    }

    /// Records what is left of a worker that died outside the per-file error handling: the file it
    /// was on failed and the rest of its list was never attempted.
    private static void abandon(List<Path> files, List<FileResult> into, Throwable cause) {
        final int current = into.size();
        if (current == files.size()) {
            logger.log(Level.SEVERE, "worker died after its last file", cause);
            return;
        }
        logger.log(Level.SEVERE, String.format("worker died on %s, abandoning %d remaining file(s)",
                files.get(current), files.size() - current - 1), cause);
        into.add(FileResult.failure(files.get(current), FileOutcome.FAILED, cause));
        for (Path skipped : files.subList(current + 1, files.size())) {
            into.add(FileResult.failure(skipped, FileOutcome.SKIPPED, null));
        }
    }

    /// Deals `items[i]` to list `i mod workers`.
    static <T> List<List<T>> partition(List<T> items, int workers) {
        final List<List<T>> work = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            work.add(new ArrayList<>());
        }
        for (int i = 0; i < items.size(); i++) {
            work.get(i % workers).add(items.get(i));
        }
        return work;
    }

    List<FileResult> processAll(List<Path> files) {
        final List<FileResult> results = new ArrayList<>(files.size());
        processAll(files, results);
        return results;
    }

    /// One worker's list, appending one result per file as it goes. A format or I/O failure is
    /// recorded and the worker moves on; a runtime exception abandons the rest of the list.
    private void processAll(List<Path> files, List<FileResult> results) {
        for (int i = 0; i < files.size(); i++) {
            val file = files.get(i);
            try {
                results.add(process(file));
            } catch (IOException e) {
                logger.log(Level.WARNING, String.format("failed to trim %s", file), e);
                results.add(FileResult.failure(file, FileOutcome.FAILED, e));
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, String.format("unexpected failure on %s, abandoning %d remaining file(s)",
                        file, files.size() - i - 1), e);
                results.add(FileResult.failure(file, FileOutcome.FAILED, e));
                for (Path skipped : files.subList(i + 1, files.size())) {
                    results.add(FileResult.failure(skipped, FileOutcome.SKIPPED, null));
                }
                break;
            }
        }
    }

    /// Runs the pipeline for one region container in three phases: load, trim and compact every
    /// container in memory; back up every original that will change; then write. Entities and poi
    /// containers are written before the region, so a failed write leaves the region dirty and a
    /// rerun finishes the job.
    FileResult process(Path regionFile) throws IOException {
        val name = regionFile.getFileName();
        val region = RegionFile.load(regionFile);
        if (logger.isLoggable(Level.FINEST)) region.logAll(Level.FINEST);
        region.trim(predicate);

        if (!region.isDirty()) {
            for (ContainerKind kind : COMPANIONS) {
                val companion = paths.input(kind).resolve(name);
                if (Files.isRegularFile(companion)) passThrough(companion, paths.output(kind).resolve(name));
            }
            val copied = passThrough(regionFile, paths.output(ContainerKind.REGION).resolve(name));
            logger.log(Level.FINE, () -> String.format("%s unchanged", name));
            return FileResult.success(regionFile, copied ? FileOutcome.COPIED : FileOutcome.UNCHANGED, 0);
        }

        val cleared = region.clearedIndices();
        final List<ContainerKind> changed = new ArrayList<>(COMPANIONS.length);
        final List<ContainerKind> unchanged = new ArrayList<>(COMPANIONS.length);
        final Map<ContainerKind, byte[]> compacted = new EnumMap<>(ContainerKind.class);
        for (ContainerKind kind : COMPANIONS) {
            val companion = paths.input(kind).resolve(name);
            if (!Files.isRegularFile(companion)) continue;
            val entities = EntitiesFile.load(companion);
            for (int index : cleared) {
                entities.removeSlot(index);
            }
            if (entities.isDirty()) {
                compacted.put(kind, entities.toBytes());
                changed.add(kind);
            } else {
                unchanged.add(kind);
            }
        }
        val regionBytes = region.toBytes();

        backup(ContainerKind.REGION, regionFile);
        for (ContainerKind kind : changed) {
            backup(kind, paths.input(kind).resolve(name));
        }

        final SlotFile.SaveOutcome saved;
        try {
            for (ContainerKind kind : changed) {
                SlotFile.write(compacted.get(kind), paths.output(kind).resolve(name));
            }
            for (ContainerKind kind : unchanged) {
                passThrough(paths.input(kind).resolve(name), paths.output(kind).resolve(name));
            }
            saved = SlotFile.write(regionBytes, paths.output(ContainerKind.REGION).resolve(name));
        } catch (IOException e) {
            logger.log(Level.WARNING, String.format("%s partially written after trimming %d chunk(s)",
                    name, cleared.size()), e);
            return new FileResult(regionFile, FileOutcome.PARTIAL, cleared.size(), String.valueOf(e.getMessage()));
        }

        logger.log(Level.FINE, () -> String.format("%s trimmed %d chunk(s), %s", name, cleared.size(), saved));
        val outcome = saved == SlotFile.SaveOutcome.WRITTEN ? FileOutcome.TRIMMED : FileOutcome.DELETED;
        return FileResult.success(regionFile, outcome, cleared.size());
    }

    private void backup(ContainerKind kind, Path source) throws IOException {
        Optional<Path> dir = paths.backup(kind);
        if (dir.isEmpty()) return;
        val target = dir.get().resolve(source.getFileName());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        logger.log(Level.FINE, () -> String.format("backed up %s to %s", source, target));
    }

    /// Copies an unchanged container to its output path. Returns false when the two are the same
    /// file.
    private static boolean passThrough(Path source, Path target) throws IOException {
        if (source.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
            return false;
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return true;
    }
}
