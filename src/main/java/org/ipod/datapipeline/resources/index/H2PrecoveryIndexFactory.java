package org.ipod.datapipeline.resources.index;

import java.nio.file.Path;

import org.ipod.datapipeline.api.index.IPrecoveryIndex;
import org.ipod.datapipeline.api.index.IPrecoveryIndexFactory;
import org.ipod.datapipeline.api.index.IndexOpenOptions;

/**
 * Opens {@link H2PrecoveryIndex} handles.
 */
public class H2PrecoveryIndexFactory implements IPrecoveryIndexFactory {

    @Override
    public IPrecoveryIndex open(Path directory, IndexOpenOptions options) {
        return new H2PrecoveryIndex(directory, options);
    }
}
