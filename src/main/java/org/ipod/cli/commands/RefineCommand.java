package org.ipod.cli.commands;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.ipod.cli.CommandLineInterface;
import org.ipod.datapipeline.api.batch.ResultBatches;
import org.ipod.datapipeline.api.index.IndexOpenOptions;
import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.FittedOrbitMember;
import org.ipod.datapipeline.api.model.Observation;
import org.ipod.datapipeline.api.refinement.IRefinementRoutine;
import org.ipod.datapipeline.api.refinement.RefinementParameters;
import org.ipod.datapipeline.api.tables.FittedOrbitTable;
import org.ipod.datapipeline.api.tables.ObservationTable;
import org.ipod.datapipeline.api.tables.OrbitMemberTable;
import org.ipod.datapipeline.refinement.RefinementRoutineFactory;
import org.ipod.datapipeline.resources.index.H2PrecoveryIndexFactory;
import org.ipod.datapipeline.services.ChunkWorker;
import org.ipod.datapipeline.services.RefinementInputs;
import org.ipod.datapipeline.services.RefinementOrchestrator;
import org.ipod.datapipeline.utils.JsonLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that refines candidate orbits read from JSON-lines files and writes the four
 * result tables to an output directory.
 */
@Command(
    name = "refine",
    mixinStandardHelpOptions = true,
    description = "Refine candidate orbits by iterative precovery and differential correction"
)
public class RefineCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RefineCommand.class);

    static final String ORBITS_FILE = "orbits.jsonl";
    static final String MEMBERS_FILE = "members.jsonl";
    static final String CANDIDATES_FILE = "candidates.jsonl";
    static final String SUMMARY_FILE = "summary.jsonl";

    @Option(names = {"--orbits"}, required = true, description = "Candidate orbits (JSON lines)")
    private Path orbitsFile;

    @Option(names = {"--members"}, description = "Orbit members (JSON lines)")
    private Path membersFile;

    @Option(names = {"--observations"}, description = "Observations (JSON lines)")
    private Path observationsFile;

    @Option(names = {"--index"}, required = true, description = "Precovery index directory")
    private Path indexDirectory;

    @Option(names = {"-o", "--output"}, required = true, description = "Output directory")
    private Path outputDirectory;

    @Option(names = {"--chunk-size"}, description = "Orbits per chunk (default: ipod.orchestration.chunkSize)")
    private Integer chunkSize;

    @Option(names = {"--max-workers"}, description = "Number of workers, or 'all' for every available processor")
    private String maxWorkers;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config ipod = parent.getConfig().getConfig("ipod");

            FittedOrbitTable orbits = new FittedOrbitTable(JsonLines.read(orbitsFile, FittedOrbit.class));
            OrbitMemberTable members = membersFile != null
                    ? new OrbitMemberTable(JsonLines.read(membersFile, FittedOrbitMember.class))
                    : null;
            ObservationTable observations = observationsFile != null
                    ? new ObservationTable(JsonLines.read(observationsFile, Observation.class))
                    : null;

            RefinementOrchestrator orchestrator = new RefinementOrchestrator(createWorker(ipod), orchestrationOptions(ipod));
            ResultBatches results = orchestrator.run(RefinementInputs.of(orbits, members, observations));

            JsonLines.write(outputDirectory.resolve(ORBITS_FILE), results.orbits());
            JsonLines.write(outputDirectory.resolve(MEMBERS_FILE), results.members());
            JsonLines.write(outputDirectory.resolve(CANDIDATES_FILE), results.candidates());
            JsonLines.write(outputDirectory.resolve(SUMMARY_FILE), results.summaries());

            out.printf("Refined %d orbits, found %d precovery candidates. Results written to %s%n",
                    results.orbits().size(), results.candidates().size(), outputDirectory.toAbsolutePath());
            return 0;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: refinement interrupted");
            return 1;
        } catch (IOException e) {
            log.error("Refinement failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            log.error("Refinement failed: {}", e.getMessage());
            log.debug("Refinement failure details", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private ChunkWorker createWorker(Config ipod) {
        RefinementParameters parameters = RefinementParameters.fromConfig(ipod.getConfig("refinement"));
        IRefinementRoutine routine = RefinementRoutineFactory.create(ipod.getConfig("routine"));
        IndexOpenOptions indexOptions = new IndexOpenOptions(false, true,
                ipod.getBoolean("index.allowVersionMismatch"));
        return new ChunkWorker(routine, new H2PrecoveryIndexFactory(), indexDirectory, indexOptions, parameters);
    }

    private Config orchestrationOptions(Config ipod) {
        Map<String, Object> overrides = new HashMap<>();
        if (chunkSize != null) {
            overrides.put("chunkSize", chunkSize);
        }
        if (maxWorkers != null) {
            overrides.put("maxWorkers", maxWorkers);
        }
        return ConfigFactory.parseMap(overrides)
                .withFallback(ipod.getConfig("orchestration"))
                .withFallback(ipod.getConfig("runtime").atPath("runtime"));
    }
}
