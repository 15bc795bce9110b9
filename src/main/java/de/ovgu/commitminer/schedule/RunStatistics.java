package de.ovgu.commitminer.schedule;

import de.ovgu.commitminer.process.CommitOutcome;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Counters of one run of the scheduler, fed with the outcomes as they arrive.  Unlike the summary, these only cover
 * the commits seen in this run.
 */
public class RunStatistics {
    private final int totalCommits;
    private int processed = 0;
    private int skipped = 0;
    private int failed = 0;
    private int abandoned = 0;
    private long processingMillis = 0;
    private final SortedMap<String, Integer> failureCauses = new TreeMap<>();

    public RunStatistics(int totalCommits) {
        this.totalCommits = totalCommits;
    }

    public synchronized void add(CommitOutcome outcome) {
        switch (outcome.getState()) {
            case RECORDED:
                processed++;
                processingMillis += outcome.getDurationMillis();
                break;
            case SKIPPED:
                skipped++;
                break;
            case FAILED:
                failed++;
                processingMillis += outcome.getDurationMillis();
                failureCauses.merge(outcome.describeFailure(), 1, Integer::sum);
                break;
            case ABANDONED:
                abandoned++;
                break;
            default:
                throw new IllegalArgumentException("Not a terminal outcome: " + outcome);
        }
    }

    public int getTotalCommits() {
        return totalCommits;
    }

    public synchronized int getProcessed() {
        return processed;
    }

    public synchronized int getSkipped() {
        return skipped;
    }

    public synchronized int getFailed() {
        return failed;
    }

    /**
     * @return Commits that failed while the run was being stopped and were left unrecorded
     */
    public synchronized int getAbandoned() {
        return abandoned;
    }

    /**
     * @return Commits that reached a terminal state
     */
    public synchronized int getCompleted() {
        return processed + skipped + failed + abandoned;
    }

    /**
     * @return Histogram of failure causes, e.g. <code>ANALYSIS/TIMEOUT</code> &rarr; 3
     */
    public synchronized SortedMap<String, Integer> getFailureCauses() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(failureCauses));
    }

    /**
     * @return Average wall-clock time of the commits that were checked out in this run, 0 if there were none
     */
    public synchronized long getAverageMillisPerCommit() {
        int n = processed + failed;
        return n == 0 ? 0 : processingMillis / n;
    }

    @Override
    public synchronized String toString() {
        return "processed=" + processed + ", skipped=" + skipped + ", failed=" + failed
                + (failureCauses.isEmpty() ? "" : " " + failureCauses)
                + (abandoned == 0 ? "" : ", abandoned=" + abandoned)
                + ", not reached=" + (totalCommits - getCompleted());
    }
}
