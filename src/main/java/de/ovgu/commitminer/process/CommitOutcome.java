package de.ovgu.commitminer.process;

import de.ovgu.commitminer.vcs.Commit;

import java.util.Optional;

/**
 * What happened to a commit, as reported back to the scheduler.
 */
public final class CommitOutcome {
    private final Commit commit;
    private final int slotIndex;
    private final CommitState state;
    private final FailureCause failureCause;
    private final String failureDetail;
    private final long durationMillis;

    private CommitOutcome(Commit commit, int slotIndex, CommitState state, FailureCause failureCause,
                          String failureDetail, long durationMillis) {
        this.commit = commit;
        this.slotIndex = slotIndex;
        this.state = state;
        this.failureCause = failureCause;
        this.failureDetail = failureDetail;
        this.durationMillis = durationMillis;
    }

    public static CommitOutcome recorded(Commit commit, int slotIndex, long durationMillis) {
        return new CommitOutcome(commit, slotIndex, CommitState.RECORDED, null, null, durationMillis);
    }

    public static CommitOutcome skipped(Commit commit, int slotIndex) {
        return new CommitOutcome(commit, slotIndex, CommitState.SKIPPED, null, null, 0);
    }

    public static CommitOutcome failed(Commit commit, int slotIndex, FailureCause cause, String detail, long durationMillis) {
        return new CommitOutcome(commit, slotIndex, CommitState.FAILED, cause, detail, durationMillis);
    }

    public static CommitOutcome abandoned(Commit commit, int slotIndex, long durationMillis) {
        return new CommitOutcome(commit, slotIndex, CommitState.ABANDONED, null, null, durationMillis);
    }

    public Commit getCommit() {
        return commit;
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    public CommitState getState() {
        return state;
    }

    public Optional<FailureCause> getFailureCause() {
        return Optional.ofNullable(failureCause);
    }

    public Optional<String> getFailureDetail() {
        return Optional.ofNullable(failureDetail);
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    /**
     * @return e.g. <code>ANALYSIS/TIMEOUT</code>, or <code>CHECKOUT</code>
     */
    public String describeFailure() {
        if (failureCause == null) return "";
        return failureDetail == null ? failureCause.name() : failureCause.name() + "/" + failureDetail;
    }

    @Override
    public String toString() {
        return commit + " on slot " + slotIndex + ": " + state + (failureCause == null ? "" : " (" + describeFailure() + ")");
    }
}
