package com.samplesift.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class SampleSiftCliTest {

    private static final String METADATA = "strain\tdate\tcountry\n"
            + "A\t2021-01-05\tUSA\n"
            + "B\t2021-02-05\tPeru\n"
            + "C\t2021-03-05\tUSA\n"
            + "D\t2021-04-05\tPeru\n"
            + "E\t2021-05-05\tUSA\n"
            + "F\t2021-06-05\tPeru\n";

    private Path dir;
    private Path metadata;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("samplesift-cli");
        metadata = dir.resolve("metadata.tsv");
        Files.writeString(metadata, METADATA, StandardCharsets.UTF_8);
    }

    @Test
    void subsamplesAndWritesEveryOutput() throws Exception {
        Path strains = dir.resolve("strains.txt");
        Path filtered = dir.resolve("filtered.tsv");
        Path log = dir.resolve("log.tsv");

        int exit = run(
                "--metadata", metadata.toString(),
                "--group-by", "country",
                "--subsample-max-sequences", "2",
                "--subsample-seed", "1",
                "--output-strains", strains.toString(),
                "--output-metadata", filtered.toString(),
                "--output-log", log.toString());

        assertEquals(SampleSiftCli.EXIT_OK, exit, err.toString());
        List<String> kept = Files.readAllLines(strains);
        assertEquals(2, kept.size());
        assertEquals(3, Files.readAllLines(filtered).size());
        assertEquals(5, Files.readAllLines(log).size());
        assertEquals(
                "4 strains were dropped during filtering\n"
                        + "\t4 of these were dropped because of subsampling criteria, using seed 1\n"
                        + "2 strains passed all filters\n",
                out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void reportsEachFilterAndForceInclusion() throws Exception {
        Path include = dir.resolve("include.txt");
        Files.writeString(include, "B\n", StandardCharsets.UTF_8);

        int exit = run(
                "--metadata", metadata.toString(),
                "--min-date", "2021-03",
                "--exclude-where", "country=peru",
                "--include", include.toString());

        assertEquals(SampleSiftCli.EXIT_OK, exit, err.toString());
        String summary = out.toString(StandardCharsets.UTF_8);
        assertTrue(summary.startsWith("3 strains were dropped during filtering\n"), summary);
        assertTrue(summary.contains("\t2 of these were dropped because of 'country=peru'\n"), summary);
        assertTrue(
                summary.contains("\t1 of these were dropped because they were earlier than 2021-03-01 or missing a date\n"),
                summary);
        assertTrue(summary.contains("\t1 strains were added back because they were in " + include + "\n"), summary);
        assertTrue(summary.endsWith("3 strains passed all filters\n"), summary);
    }

    @Test
    void addedBackLineNamesFilesAndIdentifiers() throws Exception {
        Path include = dir.resolve("include.txt");
        Files.writeString(include, "B\n", StandardCharsets.UTF_8);

        int exit = run(
                "--metadata", metadata.toString(),
                "--exclude-all",
                "--include", include.toString(),
                "--force-include-ids", "D");

        assertEquals(SampleSiftCli.EXIT_OK, exit, err.toString());
        String summary = out.toString(StandardCharsets.UTF_8);
        assertTrue(
                summary.contains("\t2 strains were added back because they were in " + include
                        + " or because they were in the force-include list\n"),
                summary);
        assertTrue(summary.endsWith("2 strains passed all filters\n"), summary);
    }

    @Test
    void sequenceIndexEntriesWithoutMetadataCountAsDropped() throws Exception {
        Path index = dir.resolve("index.tsv");
        StringBuilder rows = new StringBuilder("strain\tlength\tA\tC\tG\tT\tN\tinvalid_nucleotides\n");
        for (String id : List.of("A", "B", "C", "D", "E", "X", "Y")) {
            rows.append(id).append("\t10\t3\t3\t2\t2\t0\t0\n");
        }
        Files.writeString(index, rows, StandardCharsets.UTF_8);

        int exit = run("--metadata", metadata.toString(), "--sequence-index", index.toString());

        assertEquals(SampleSiftCli.EXIT_OK, exit, err.toString());
        assertEquals(
                "3 strains were dropped during filtering\n"
                        + "\t2 had no metadata\n"
                        + "\t1 had no sequence data\n"
                        + "5 strains passed all filters\n",
                out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void unparseableRowsAreReportedAndSkipped() throws Exception {
        Files.writeString(
                metadata,
                METADATA + "\t2021-07-05\tUSA\nG\t2021-08-05\tPeru\textra\nH\t2021-09-05\tUSA\n",
                StandardCharsets.UTF_8);
        Path filtered = dir.resolve("filtered.tsv");
        Path log = dir.resolve("log.tsv");

        int exit = run(
                "--metadata", metadata.toString(),
                "--output-metadata", filtered.toString(),
                "--output-log", log.toString());

        assertEquals(SampleSiftCli.EXIT_OK, exit, err.toString());
        assertEquals(
                "2 strains were dropped during filtering\n"
                        + "\t2 of these were dropped because their metadata row could not be parsed\n"
                        + "7 strains passed all filters\n",
                out.toString(StandardCharsets.UTF_8));
        assertEquals(8, Files.readAllLines(filtered).size());
        String logged = Files.readString(log);
        assertTrue(logged.contains("<line 8>\tmalformed-record"), logged);
        assertTrue(logged.contains("G\tmalformed-record"), logged);
    }

    @Test
    void duplicateIdentifiersFailAndRemoveTheLog() throws Exception {
        Files.writeString(metadata, METADATA + "C\t2021-07-05\tUSA\nA\t2021-08-05\tPeru\n", StandardCharsets.UTF_8);
        Path log = dir.resolve("log.tsv");

        int exit = run("--metadata", metadata.toString(), "--output-log", log.toString());

        assertEquals(SampleSiftCli.EXIT_ERROR, exit);
        assertTrue(err.toString().contains("duplicated in the input:\nA\nC"), err.toString());
        assertFalse(Files.exists(log));
    }

    @Test
    void emptyOutputFailsAfterReporting() throws Exception {
        Path strains = dir.resolve("strains.txt");
        int exit = run("--metadata", metadata.toString(), "--exclude-all", "--output-strains", strains.toString());

        assertEquals(SampleSiftCli.EXIT_ERROR, exit);
        assertTrue(err.toString().contains("All samples have been dropped"));
        assertTrue(out.toString().contains("0 strains passed all filters"));
        assertTrue(Files.readAllLines(strains).isEmpty());
    }

    @Test
    void emptyOutputMayBeDowngradedToWarning() throws Exception {
        int exit = run("--metadata", metadata.toString(), "--exclude-all", "--empty-output-reporting", "warn");
        assertEquals(SampleSiftCli.EXIT_OK, exit);
    }

    @Test
    void configFileProvidesDefaultsAndCommandLineWins() throws Exception {
        Path config = dir.resolve("filter.properties");
        Files.writeString(
                config,
                "metadata=" + metadata.toString().replace("\\", "\\\\") + "\n"
                        + "exclude_ids=A,B\n"
                        + "query=country == 'Peru'\n",
                StandardCharsets.UTF_8);

        int exit = run("--config", config.toString(), "--query", "country == 'USA'");

        assertEquals(SampleSiftCli.EXIT_OK, exit, err.toString());
        assertTrue(out.toString().endsWith("2 strains passed all filters\n"), out.toString());
    }

    @Test
    void unknownConfigKeyIsAnError() throws Exception {
        Path config = dir.resolve("filter.properties");
        Files.writeString(config, "subsample_max=3\n", StandardCharsets.UTF_8);
        int exit = run("--metadata", metadata.toString(), "--config", config.toString());
        assertEquals(SampleSiftCli.EXIT_ERROR, exit);
        assertTrue(err.toString().contains("subsample_max"));
    }

    @Test
    void invalidOptionValuesAreErrors() throws Exception {
        assertEquals(
                SampleSiftCli.EXIT_ERROR,
                run("--metadata", metadata.toString(), "--group-by", "region", "--sequences-per-group", "1"));
        assertEquals(SampleSiftCli.EXIT_ERROR, run("--metadata", dir.resolve("missing.tsv").toString()));
        assertEquals(SampleSiftCli.EXIT_ERROR, run("--metadata", metadata.toString(), "--query", "country =="));
    }

    @Test
    void usageErrors() {
        assertEquals(SampleSiftCli.EXIT_USAGE, run());
        assertEquals(SampleSiftCli.EXIT_USAGE, run("--metadata", metadata.toString(), "--frobnicate"));
        assertEquals(SampleSiftCli.EXIT_USAGE, run("--metadata"));
        assertEquals(SampleSiftCli.EXIT_USAGE, run("stray"));
        assertTrue(err.toString().contains("Usage: samplesift"));
    }

    @Test
    void helpAndVersion() {
        assertEquals(SampleSiftCli.EXIT_OK, run("--help"));
        assertTrue(out.toString().contains("Usage: samplesift"));
        assertEquals(SampleSiftCli.EXIT_OK, run("--version"));
        assertTrue(out.toString().contains("samplesift 0.1.0"));
    }

    @Test
    void parsesMultiValuedOptions() throws Exception {
        Map<String, List<String>> options = SampleSiftCli.parseArgs(new String[] {
            "--group-by", "country", "year", "--exclude-where", "host=bat", "--exclude-where", "region=asia",
            "--subsample-max-sequences", "5"
        });
        assertEquals(List.of("country", "year"), options.get("group-by"));
        Properties settings = SampleSiftCli.loadSettings(options);
        assertEquals("country,year", settings.getProperty("group_by"));
        assertEquals("host=bat;region=asia", settings.getProperty("exclude_where"));
        assertEquals("5", settings.getProperty("subsample_max_sequences"));
        assertThrows(
                SampleSiftCli.UsageException.class,
                () -> SampleSiftCli.parseArgs(new String[] {"--subsample-seed", "1", "2"}));
    }

    private int run(String... args) {
        return SampleSiftCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }
}
