package org.ipod.cli.commands;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.ipod.datapipeline.api.index.IndexOpenOptions;
import org.ipod.datapipeline.api.model.Observation;
import org.ipod.datapipeline.resources.index.H2PrecoveryIndex;
import org.ipod.datapipeline.utils.JsonLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CLI command that adds observations to a precovery index, creating the index if needed.
 */
@Command(
    name = "index",
    mixinStandardHelpOptions = true,
    description = "Add observations to a precovery index"
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    @Option(names = {"--observations"}, required = true, description = "Observations to index (JSON lines)")
    private Path observationsFile;

    @Option(names = {"--index"}, required = true, description = "Precovery index directory")
    private Path indexDirectory;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            List<Observation> observations = JsonLines.read(observationsFile, Observation.class);
            try (H2PrecoveryIndex index = new H2PrecoveryIndex(indexDirectory, new IndexOpenOptions(true, false, false))) {
                index.addObservations(observations);
                out.printf("Indexed %d observations; %s now holds %d%n",
                        observations.size(), indexDirectory.toAbsolutePath(), index.observationCount());
            }
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Indexing failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
