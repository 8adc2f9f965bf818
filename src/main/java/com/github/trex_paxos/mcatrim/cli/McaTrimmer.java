package com.github.trex_paxos.mcatrim.cli;

import com.github.trex_paxos.mcatrim.BatchReport;
import com.github.trex_paxos.mcatrim.BatchTrimmer;
import com.github.trex_paxos.mcatrim.FileResult;
import com.github.trex_paxos.mcatrim.RegionPaths;
import com.github.trex_paxos.mcatrim.TrimCriteria;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Command line entry point: trims the region containers of one world directory.
@Command(
        name = "mca-trimmer",
        mixinStandardHelpOptions = true,
        version = "mca-trimmer 0.1",
        description = {
                "Deletes chunks matching a retention criterion from region files and rewrites them compactly.",
                "Entities and poi records of deleted chunks are removed as well."
        })
public class McaTrimmer implements Callable<Integer> {

    private final static Logger logger = Logger.getLogger(McaTrimmer.class.getName());

    static final int EXIT_FAILURES = 1;
    static final int EXIT_CONFIG = 2;

    @Option(names = {"-i", "--input"}, required = true, paramLabel = "DIR",
            description = "World directory to read the region, entities and poi files from. "
                    + "Without an output directory the files are rewritten in place.")
    Path input;

    @Option(names = {"-o", "--output"}, paramLabel = "DIR",
            description = "World directory to write to. Defaults to the input directory.")
    Path output;

    @Option(names = {"-b", "--backup"}, arity = "0..1", fallbackValue = "./backup", paramLabel = "DIR",
            description = "Copy the originals of changed files here first. Defaults to ./backup when given without a value.")
    Path backup;

    @Spec
    CommandSpec spec;

    // a bare -p leaves the value null, told apart from an absent -p by the parse result
    @Option(names = {"-p", "--parallel"}, arity = "0..1", fallbackValue = Option.NULL_VALUE, paramLabel = "N",
            description = "Number of worker threads. Without a value: the available processors minus one.")
    Integer parallel;

    @Option(names = {"-c", "--criteria"}, required = true, paramLabel = "CRITERIA",
            converter = CriteriaConverter.class,
            description = "One of: inhabited_time<15s, <30s, <1m, <2m, <3m, <5m, <10m "
                    + "(e.g. inhabited_time<5m).")
    TrimCriteria criteria;

    @Option(names = {"-v", "--verbose"}, description = "Log each file at FINE level.")
    boolean verbose;

    static final class CriteriaConverter implements ITypeConverter<TrimCriteria> {
        @Override
        public TrimCriteria convert(String value) {
            return TrimCriteria.fromLabel(value);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new McaTrimmer()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        configureLogging(verbose ? Level.FINE : Level.INFO);

        final RegionPaths paths;
        final int workers;
        try {
            workers = workerCount();
            paths = RegionPaths.create(input, output, backup);
        } catch (IllegalArgumentException e) {
            logger.severe(e.getMessage());
            return EXIT_CONFIG;
        }

        BatchReport report = new BatchTrimmer(paths, criteria).run(workers);
        for (FileResult failed : report.getResults()) {
            if (!failed.outcome().isSuccess()) {
                logger.warning(() -> String.format("%s %s %s", failed.outcome(), failed.file(),
                        failed.error() == null ? "" : failed.error()));
            }
        }
        return report.hasFailures() ? EXIT_FAILURES : 0;
    }

    /// One worker without `-p`, the configured default for a bare `-p`, otherwise the given count.
    ///
    /// @throws IllegalArgumentException if the count is less than one
    int workerCount() {
        if (parallel == null) {
            return spec.commandLine().getParseResult().hasMatchedOption("--parallel")
                    ? BatchTrimmer.getParallelismOrDefault() : 1;
        }
        if (parallel < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1 but was " + parallel);
        }
        return parallel;
    }

    static void configureLogging(Level level) {
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
