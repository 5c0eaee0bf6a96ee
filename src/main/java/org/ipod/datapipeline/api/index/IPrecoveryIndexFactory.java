package org.ipod.datapipeline.api.index;

import java.nio.file.Path;

/**
 * Opens precovery index handles. Implementations are stateless and may be shared by all
 * workers of a run.
 */
@FunctionalInterface
public interface IPrecoveryIndexFactory {

    /**
     * Opens an index.
     *
     * @param directory Directory holding the index files.
     * @param options   How to open it.
     * @return An open handle; the caller must close it.
     * @throws IndexOpenException if the index cannot be opened.
     */
    IPrecoveryIndex open(Path directory, IndexOpenOptions options);
}
