package com.samplesift.cli;

import com.samplesift.FilterEngine;
import com.samplesift.Version;
import com.samplesift.allocation.AllocationExhaustedException;
import com.samplesift.config.ConfigurationException;
import com.samplesift.config.FilterConfig;
import com.samplesift.config.FilterConfigProperties;
import com.samplesift.io.DelimitedRecordSource;
import com.samplesift.io.FilterLogWriter;
import com.samplesift.io.IdListReader;
import com.samplesift.io.KeptIdWriter;
import com.samplesift.io.MetadataWriter;
import com.samplesift.io.PriorityScoresReader;
import com.samplesift.io.SequenceIndex;
import com.samplesift.io.SequenceIndexReader;
import com.samplesift.outcome.EmptyOutputException;
import com.samplesift.outcome.Outcome;
import com.samplesift.outcome.OutcomeListener;
import com.samplesift.predicate.DropReason;
import com.samplesift.record.DuplicateIdException;
import com.samplesift.record.RecordSourceException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Command-line front end: reads a metadata table, filters and subsamples it, writes the requested
 * outputs and prints a summary.
 *
 * <p>Every option can also be given in a {@code --config} properties file under its snake_case
 * name ({@code --subsample-max-sequences} becomes {@code subsample_max_sequences}); command-line
 * values override the file.</p>
 *
 * <p>Exit status: 0 on success, 1 on configuration, allocation or I/O errors and on empty output
 * under the {@code error} policy, 2 on usage errors.</p>
 */
public final class SampleSiftCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    static final String METADATA = "metadata";
    static final String METADATA_ID_COLUMNS = "metadata_id_columns";
    static final String SEQUENCE_INDEX = "sequence_index";
    static final String PRIORITY = "priority";
    static final String EXCLUDE = "exclude";
    static final String INCLUDE = "include";
    static final String OUTPUT_STRAINS = "output_strains";
    static final String OUTPUT_METADATA = "output_metadata";
    static final String OUTPUT_LOG = "output_log";

    private static final Set<String> FILE_KEYS = Set.of(
            METADATA,
            METADATA_ID_COLUMNS,
            SEQUENCE_INDEX,
            PRIORITY,
            EXCLUDE,
            INCLUDE,
            OUTPUT_STRAINS,
            OUTPUT_METADATA,
            OUTPUT_LOG);

    /** Options that take no value. */
    private static final Set<String> FLAGS = Set.of("help", "version", "exclude-all", "no-probabilistic-sampling");

    /** Options that accept several values. */
    private static final Set<String> MULTI_VALUED = Set.of(
            "group-by",
            "exclude",
            "include",
            "exclude-where",
            "include-where",
            "exclude-ids",
            "include-ids",
            "force-include-ids",
            "metadata-id-columns");

    private SampleSiftCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, List<String>> options;
        try {
            options = parseArgs(args);
        } catch (UsageException ex) {
            err.println("ERROR: " + ex.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }
        if (options.containsKey("help")) {
            printUsage(out);
            return EXIT_OK;
        }
        if (options.containsKey("version")) {
            out.println("samplesift " + Version.FULL);
            return EXIT_OK;
        }
        try {
            Properties settings = loadSettings(options);
            if (settings.getProperty(METADATA) == null) {
                err.println("ERROR: --metadata is required");
                printUsage(err);
                return EXIT_USAGE;
            }
            return execute(settings, out, err);
        } catch (ConfigurationException
                | AllocationExhaustedException
                | RecordSourceException
                | DuplicateIdException ex) {
            err.println("ERROR: " + ex.getMessage());
            return EXIT_ERROR;
        } catch (IOException ex) {
            err.println("ERROR: " + ex.getMessage());
            return EXIT_ERROR;
        } catch (UncheckedIOException ex) {
            err.println("ERROR: " + ex.getMessage() + ": " + ex.getCause().getMessage());
            return EXIT_ERROR;
        }
    }

    private static int execute(Properties settings, PrintStream out, PrintStream err)
            throws ConfigurationException, AllocationExhaustedException, RecordSourceException,
                    DuplicateIdException, IOException {
        List<Path> excludeFiles = paths(settings.getProperty(EXCLUDE));
        List<Path> includeFiles = paths(settings.getProperty(INCLUDE));

        FilterConfig.Builder builder = FilterConfigProperties.apply(settings, FilterConfig.builder());
        builder.excludeIds(IdListReader.readAll(excludeFiles));
        builder.forceIncludeIds(IdListReader.readAll(includeFiles));
        FilterConfig config = builder.build();

        String idColumns = settings.getProperty(METADATA_ID_COLUMNS);
        DelimitedRecordSource source = new DelimitedRecordSource(
                Path.of(settings.getProperty(METADATA)),
                idColumns == null
                        ? DelimitedRecordSource.DEFAULT_ID_COLUMNS
                        : FilterConfigProperties.splitList(idColumns));

        FilterEngine.Builder engine = FilterEngine.builder(config);
        String sequenceIndexPath = settings.getProperty(SEQUENCE_INDEX);
        SequenceIndex sequenceIndex = null;
        if (sequenceIndexPath != null) {
            sequenceIndex = SequenceIndexReader.read(Path.of(sequenceIndexPath));
            engine.sequenceStatistics(sequenceIndex);
        }
        String priority = settings.getProperty(PRIORITY);
        if (priority != null) {
            engine.priorities(PriorityScoresReader.read(Path.of(priority)));
        }

        Outcome outcome;
        EmptyOutputException emptyOutput = null;
        String outputLog = settings.getProperty(OUTPUT_LOG);
        UnmatchedIndexIds unmatched = null;
        try {
            try (FilterLogWriter log = outputLog == null ? null : new FilterLogWriter(Path.of(outputLog))) {
                OutcomeListener listener = log == null ? OutcomeListener.NONE : log;
                if (sequenceIndex != null) {
                    unmatched = new UnmatchedIndexIds(sequenceIndex.getIds(), listener);
                    listener = unmatched;
                }
                engine.listener(listener);
                try {
                    outcome = engine.build().run(source);
                } catch (EmptyOutputException ex) {
                    outcome = ex.getOutcome();
                    emptyOutput = ex;
                }
            }
        } catch (DuplicateIdException ex) {
            if (outputLog != null) {
                Files.deleteIfExists(Path.of(outputLog));
            }
            throw ex;
        }
        long withoutMetadata = unmatched == null ? 0 : unmatched.remaining(outcome.getKeptIds());

        String outputStrains = settings.getProperty(OUTPUT_STRAINS);
        if (outputStrains != null) {
            KeptIdWriter.write(Path.of(outputStrains), outcome.getKeptIds());
        }
        String outputMetadata = settings.getProperty(OUTPUT_METADATA);
        if (outputMetadata != null) {
            MetadataWriter.write(source, outcome.getKeptIds(), Path.of(outputMetadata));
        }
        SummaryFormatter summary = new SummaryFormatter(
                config,
                excludeFiles,
                includeFiles,
                settings.getProperty(FilterConfigProperties.EXCLUDE_IDS) != null,
                settings.getProperty(FilterConfigProperties.FORCE_INCLUDE_IDS) != null);
        out.print(summary.format(outcome, withoutMetadata));
        if (emptyOutput != null) {
            err.println("ERROR: " + emptyOutput.getMessage());
            return EXIT_ERROR;
        }
        return EXIT_OK;
    }

    /** Merges the optional {@code --config} file with command-line options, the latter winning. */
    static Properties loadSettings(Map<String, List<String>> options)
            throws ConfigurationException, IOException {
        Properties settings = new Properties();
        List<String> config = options.get("config");
        if (config != null) {
            Path path = Path.of(config.get(0));
            try (InputStream in = Files.newInputStream(path)) {
                settings.load(in);
            }
            for (String key : settings.stringPropertyNames()) {
                if (!FILE_KEYS.contains(key) && !FilterConfigProperties.KEYS.contains(key)) {
                    throw new ConfigurationException("Unknown option '" + key + "' in " + path);
                }
            }
        }
        for (Map.Entry<String, List<String>> option : options.entrySet()) {
            String name = option.getKey();
            if (name.equals("config")) {
                continue;
            }
            if (name.equals("no-probabilistic-sampling")) {
                settings.setProperty(FilterConfigProperties.PROBABILISTIC_SAMPLING, "false");
                continue;
            }
            String key = name.replace('-', '_');
            String separator = name.endsWith("-where") ? ";" : ",";
            settings.setProperty(key, String.join(separator, option.getValue()));
        }
        return settings;
    }

    static Map<String, List<String>> parseArgs(String[] args) throws UsageException {
        Map<String, List<String>> options = new LinkedHashMap<>();
        Set<String> known = knownOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("-h")) {
                arg = "--help";
            }
            if (!arg.startsWith("--")) {
                throw new UsageException("Unexpected argument '" + arg + "'");
            }
            String name = arg.substring(2);
            if (!known.contains(name)) {
                throw new UsageException("Unknown option '" + arg + "'");
            }
            if (FLAGS.contains(name)) {
                options.put(name, List.of("true"));
                continue;
            }
            List<String> values = new ArrayList<>();
            while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                values.add(args[++i]);
                if (!MULTI_VALUED.contains(name)) {
                    break;
                }
            }
            if (values.isEmpty()) {
                throw new UsageException("Option '" + arg + "' requires a value");
            }
            List<String> previous = options.get(name);
            if (previous != null && MULTI_VALUED.contains(name)) {
                previous.addAll(values);
            } else {
                options.put(name, values);
            }
        }
        return options;
    }

    private static Set<String> knownOptions() {
        Set<String> known = new HashSet<>(FLAGS);
        known.add("config");
        for (String key : FILE_KEYS) {
            known.add(key.replace('_', '-'));
        }
        for (String key : FilterConfigProperties.KEYS) {
            if (!key.equals(FilterConfigProperties.PROBABILISTIC_SAMPLING)
                    && !key.equals(FilterConfigProperties.CACHE_DECISIONS)
                    && !key.equals(FilterConfigProperties.MAX_ALLOCATION_ATTEMPTS)) {
                known.add(key.replace('_', '-'));
            }
        }
        return known;
    }

    private static List<Path> paths(String value) {
        List<Path> paths = new ArrayList<>();
        if (value != null) {
            for (String part : FilterConfigProperties.splitList(value)) {
                paths.add(Path.of(part));
            }
        }
        return paths;
    }

    private static void printUsage(PrintStream out) {
        out.println("samplesift " + Version.FULL);
        out.println("Usage: samplesift --metadata <file> [options]");
        out.println("  Input:     --metadata-id-columns <col>... --date-column <col> --sequence-index <tsv>");
        out.println("             --priority <tsv> --config <file.properties>");
        out.println("  Subsample: --group-by <col|year|month|week>... --subsample-max-sequences <n>");
        out.println("             --sequences-per-group <n> --subsample-seed <n> --no-probabilistic-sampling");
        out.println("  Filter:    --min-date <date> --max-date <date> --exclude <file>... --include <file>...");
        out.println("             --exclude-ids <id>... --include-ids <id>... --force-include-ids <id>...");
        out.println("             --exclude-all --exclude-where <col=value>... --include-where <col=value>...");
        out.println("             --query <expr> --exclude-ambiguous-dates-by <any|year|month|day>");
        out.println("             --min-length <n> --max-invalid <n> --max-n <n>");
        out.println("             --empty-output-reporting <error|warn|silent>");
        out.println("  Output:    --output-strains <file> --output-metadata <file> --output-log <file>");
    }

    /**
     * Forwards events and strikes every reported identifier off a copy of the sequence index, so
     * that what is left at the end had no metadata row.
     */
    private static final class UnmatchedIndexIds implements OutcomeListener {
        private final Set<String> ids;
        private final OutcomeListener delegate;

        UnmatchedIndexIds(Set<String> indexIds, OutcomeListener delegate) {
            this.ids = new HashSet<>(indexIds);
            this.delegate = delegate;
        }

        @Override
        public void onDropped(String id, DropReason reason, String detail) {
            ids.remove(id);
            delegate.onDropped(id, reason, detail);
        }

        @Override
        public void onForceIncluded(String id, String detail) {
            ids.remove(id);
            delegate.onForceIncluded(id, detail);
        }

        long remaining(List<String> keptIds) {
            keptIds.forEach(ids::remove);
            return ids.size();
        }
    }

    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
