package com.politest.domain;

/**
 * Synthetic Sids injected into statements so that the simulator echoes back something we can
 * map to a source file. Unique per merged document: the index is the statement's ordinal
 * within its own file and the namespace/basename separates files.
 */
public final class TrackingIds {

    public static final String SCP_NAMESPACE = "scp";
    public static final String IDENTITY_NAMESPACE = "identity";

    private static final String STATEMENT_SEPARATOR = "#stmt:";

    private TrackingIds() {
    }

    public static String forMergedFile(String namespace, String fileLabel, int index) {
        return namespace + ":" + fileLabel + STATEMENT_SEPARATOR + index;
    }

    public static String forIdentity(int index) {
        return IDENTITY_NAMESPACE + STATEMENT_SEPARATOR + index;
    }
}
