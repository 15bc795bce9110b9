package de.ovgu.commitminer.process;

/**
 * States of a commit while it is being processed.  {@link #RECORDED}, {@link #SKIPPED}, {@link #FAILED} and
 * {@link #ABANDONED} are terminal.
 */
public enum CommitState {
    PENDING,
    CHECKED_OUT,
    RESOLVED,
    ANALYZED,
    RECORDED,
    /**
     * A record already existed from an earlier run
     */
    SKIPPED,
    FAILED,
    /**
     * Failed after a stop was requested.  No record is written, so the next run processes the commit again.
     */
    ABANDONED;

    public boolean isTerminal() {
        return this == RECORDED || this == SKIPPED || this == FAILED || this == ABANDONED;
    }
}
