package de.ovgu.commitminer.process;

import de.ovgu.commitminer.vcs.Commit;
import org.apache.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counts state transitions of all commits of a run.  Workers call {@link #enter} from their own threads; only the
 * counter update is synchronized.  Progress is logged about every percent of commits that reached a terminal state.
 */
public class CommitProgress {
    private static final Logger LOG = Logger.getLogger(CommitProgress.class);

    private final Map<CommitState, Integer> transitions = new EnumMap<>(CommitState.class);
    private final int totalCommits;
    private int finished = 0;
    private int lastReportedPercent = 0;

    public CommitProgress(int totalCommits) {
        this.totalCommits = totalCommits;
    }

    public void enter(Commit commit, CommitState state) {
        synchronized (transitions) {
            transitions.merge(state, 1, Integer::sum);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug(commit + " -> " + state);
        }
        if (state.isTerminal()) {
            commitFinished();
        }
    }

    private void commitFinished() {
        final int done;
        final int percent;
        synchronized (transitions) {
            done = ++finished;
            percent = 100 * done / Math.max(totalCommits, 1);
            if (done != totalCommits && percent <= lastReportedPercent) return;
            lastReportedPercent = percent;
        }
        if (done == totalCommits) {
            LOG.info("Done with all " + totalCommits + " commits. " + this);
        } else {
            LOG.info("Progress: " + done + "/" + totalCommits + " commits (" + percent + "%). " + this);
        }
    }

    /**
     * @return How many commits have entered the given state so far
     */
    public int count(CommitState state) {
        synchronized (transitions) {
            Integer n = transitions.get(state);
            return n == null ? 0 : n;
        }
    }

    /**
     * @return Number of commits that reached a terminal state
     */
    public int finished() {
        synchronized (transitions) {
            return finished;
        }
    }

    @Override
    public String toString() {
        return "recorded=" + count(CommitState.RECORDED) + ", skipped=" + count(CommitState.SKIPPED)
                + ", failed=" + count(CommitState.FAILED) + ", abandoned=" + count(CommitState.ABANDONED);
    }
}
