package org.ipod.datapipeline.api.index;

import java.util.List;
import java.util.Set;

import org.ipod.datapipeline.api.model.Observation;

/**
 * Read access to a precovery index: a store of past detections searchable by time and
 * position.
 * <p>
 * Each chunk worker holds exactly one handle and closes it when the chunk ends.
 * Handles are used by a single thread.
 */
public interface IPrecoveryIndex extends AutoCloseable {

    /**
     * @return The format version the index was written with.
     */
    String formatVersion();

    /**
     * Finds indexed observations inside a time window and a declination band.
     *
     * @param startMjd First MJD of the window (inclusive).
     * @param endMjd   Last MJD of the window (inclusive).
     * @param minDec   Lower declination bound (degrees, inclusive).
     * @param maxDec   Upper declination bound (degrees, inclusive).
     * @param datasets Datasets to search, empty for all.
     * @return Matching observations ordered by time.
     * @throws IndexOpenException if the index has been closed or cannot be read.
     */
    List<Observation> findObservations(double startMjd, double endMjd, double minDec, double maxDec,
                                       Set<String> datasets);

    /**
     * @return Total number of indexed observations.
     */
    long observationCount();

    /**
     * Releases the underlying file resources. Further calls are ignored.
     */
    @Override
    void close();
}
