package org.ipod.datapipeline.api.index;

/**
 * How a precovery index is opened.
 *
 * @param create               Create the index if it does not exist.
 * @param readOnly             Open without write access.
 * @param allowVersionMismatch Accept an index written with a different format version.
 */
public record IndexOpenOptions(boolean create, boolean readOnly, boolean allowVersionMismatch) {

    /**
     * Options used by chunk workers: never create, read-only, tolerate version skew.
     */
    public static IndexOpenOptions forWorker() {
        return new IndexOpenOptions(false, true, true);
    }

    public IndexOpenOptions {
        if (create && readOnly) {
            throw new IllegalArgumentException("An index cannot be created in read-only mode");
        }
    }
}
