package org.ipod.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ipod.test.TestFixtures.member;
import static org.ipod.test.TestFixtures.orbit;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.ipod.cli.CommandLineInterface;
import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.FittedOrbitMember;
import org.ipod.datapipeline.api.model.Observation;
import org.ipod.datapipeline.api.model.PrecoveryCandidate;
import org.ipod.datapipeline.api.model.SearchSummary;
import org.ipod.datapipeline.api.model.Timestamp;
import org.ipod.datapipeline.utils.JsonLines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

/**
 * End-to-end tests for the refine command: index a few detections, refine three orbits and
 * check the written result tables.
 */
@Tag("integration")
class RefineCommandTest {

    private static final double T0 = 60000.0;

    @TempDir
    Path tempDir;

    private Path configFile;
    private Path indexDir;
    private Path orbitsFile;
    private Path membersFile;
    private Path observationsFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("ipod.conf");
        Files.writeString(configFile, "ipod.logging.default-level = \"WARN\"\n");
        out = new StringWriter();
        err = new StringWriter();

        // orbit-a has four observations on a straight track, the others have none
        List<Observation> own = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            own.add(onTrack("own-" + i, T0 + i));
        }
        orbitsFile = tempDir.resolve("in/orbits.jsonl");
        membersFile = tempDir.resolve("in/members.jsonl");
        observationsFile = tempDir.resolve("in/observations.jsonl");
        JsonLines.write(orbitsFile, List.of(orbit("orbit-a"), orbit("orbit-b"), orbit("orbit-c")));
        JsonLines.write(membersFile, own.stream().map(o -> member("orbit-a", o.id())).toList());
        JsonLines.write(observationsFile, own);

        Path indexed = tempDir.resolve("in/indexed.jsonl");
        JsonLines.write(indexed, List.of(onTrack("pre-1", T0 - 5), onTrack("pre-2", T0 - 40)));
        indexDir = tempDir.resolve("index");
        int indexExit = execute("--config", configFile.toString(), "index",
                "--observations", indexed.toString(), "--index", indexDir.toString());
        assertThat(indexExit).describedAs("stderr: %s", err).isEqualTo(0);
    }

    @Test
    void testHelpOutput() {
        execute("refine", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("refine").contains("--orbits").contains("--index").contains("--max-workers");
    }

    @Test
    void refinesOrbitsOnTwoWorkersAndWritesFourTables() throws Exception {
        Path outputDir = tempDir.resolve("out");

        int exitCode = execute("--config", configFile.toString(), "refine",
                "--orbits", orbitsFile.toString(),
                "--members", membersFile.toString(),
                "--observations", observationsFile.toString(),
                "--index", indexDir.toString(),
                "--output", outputDir.toString(),
                "--max-workers", "2");

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString()).contains("Refined 3 orbits, found 1 precovery candidates");

        List<FittedOrbit> orbits = JsonLines.read(outputDir.resolve(RefineCommand.ORBITS_FILE), FittedOrbit.class);
        assertThat(orbits).extracting(FittedOrbit::orbitId)
            .containsExactlyInAnyOrder("orbit-a", "orbit-b", "orbit-c");
        FittedOrbit refined = orbits.stream().filter(o -> o.orbitId().equals("orbit-a")).findFirst().orElseThrow();
        assertThat(refined.success()).isTrue();
        assertThat(refined.numObs()).isEqualTo(5);

        List<PrecoveryCandidate> candidates =
                JsonLines.read(outputDir.resolve(RefineCommand.CANDIDATES_FILE), PrecoveryCandidate.class);
        assertThat(candidates).singleElement()
            .satisfies(c -> assertThat(c.obsId()).isEqualTo("pre-1"));
        assertThat(JsonLines.read(outputDir.resolve(RefineCommand.MEMBERS_FILE), FittedOrbitMember.class)).hasSize(5);
        assertThat(JsonLines.read(outputDir.resolve(RefineCommand.SUMMARY_FILE), SearchSummary.class)).hasSize(3);
    }

    @Test
    void sequentialRunWritesTheSameOrbits() throws Exception {
        Path outputDir = tempDir.resolve("out-sequential");

        int exitCode = execute("--config", configFile.toString(), "refine",
                "--orbits", orbitsFile.toString(),
                "--members", membersFile.toString(),
                "--observations", observationsFile.toString(),
                "--index", indexDir.toString(),
                "-o", outputDir.toString(),
                "--chunk-size", "1");

        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        assertThat(JsonLines.read(outputDir.resolve(RefineCommand.ORBITS_FILE), FittedOrbit.class))
            .extracting(FittedOrbit::orbitId)
            .containsExactly("orbit-a", "orbit-b", "orbit-c");
    }

    @Test
    void configuredOrbitOutliersAreExcluded() throws Exception {
        // Given: three of orbit-a's four observations are excluded in the configuration
        Files.writeString(configFile, String.join("\n",
                "ipod.logging.default-level = \"WARN\"",
                "ipod.refinement.orbitOutliers { \"orbit-a\" = [\"own-0\", \"own-1\", \"own-2\"] }",
                ""));
        Path outputDir = tempDir.resolve("out-outliers");

        // When
        int exitCode = execute("--config", configFile.toString(), "refine",
                "--orbits", orbitsFile.toString(),
                "--members", membersFile.toString(),
                "--observations", observationsFile.toString(),
                "--index", indexDir.toString(),
                "-o", outputDir.toString());

        // Then: one observation is left, too few to refine
        assertThat(exitCode).describedAs("stderr: %s", err).isEqualTo(0);
        FittedOrbit orbitA = JsonLines.read(outputDir.resolve(RefineCommand.ORBITS_FILE), FittedOrbit.class).stream()
            .filter(o -> o.orbitId().equals("orbit-a"))
            .findFirst()
            .orElseThrow();
        assertThat(orbitA.numObs()).isEqualTo(1);
        assertThat(orbitA.success()).isFalse();
        assertThat(JsonLines.read(outputDir.resolve(RefineCommand.CANDIDATES_FILE), PrecoveryCandidate.class)).isEmpty();
    }

    @Test
    void missingIndexFailsWithExitCodeOne() {
        int exitCode = execute("--config", configFile.toString(), "refine",
                "--orbits", orbitsFile.toString(),
                "--index", tempDir.resolve("no-index").toString(),
                "-o", tempDir.resolve("out").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("does not exist");
        assertThat(tempDir.resolve("out").resolve(RefineCommand.ORBITS_FILE)).doesNotExist();
    }

    @Test
    void missingRequiredOptionIsAUsageError() {
        int exitCode = execute("refine", "--orbits", orbitsFile.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--index");
    }

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out, true));
        cmdLine.setErr(new PrintWriter(err, true));
        return cmdLine.execute(args);
    }

    private static Observation onTrack(String id, double mjd) {
        double dt = mjd - T0;
        return new Observation(id, "survey-a", Timestamp.fromMjd(mjd), "X05",
                10.0 + 0.1 * dt, 5.0 + 0.05 * dt, 0.5, 0.5);
    }
}
