package de.ovgu.commitminer.summary;

import de.ovgu.commitminer.process.CommitErrorRecord;
import de.ovgu.commitminer.process.CommitResultRecord;
import de.ovgu.commitminer.process.ResultStore;
import de.ovgu.commitminer.util.FileUtils;
import de.ovgu.commitminer.util.Json;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.Precision;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes the {@link RunSummary} from the records on disk, never from in-memory state of a run, so that it can be
 * regenerated at any time.
 */
public class Aggregator {
    private static final Logger LOG = Logger.getLogger(Aggregator.class);

    public RunSummary summarize(File resultsDir, String location, OptionalInt totalCommits) {
        ResultStore store = new ResultStore(resultsDir);
        return summarize(store.readSuccessRecords(), store.readErrorRecords(), location, totalCommits);
    }

    /**
     * @param totalCommits Number of commits in the history; if unknown, the number of records is used
     */
    public RunSummary summarize(List<CommitResultRecord> successes, List<CommitErrorRecord> errors, String location,
                                OptionalInt totalCommits) {
        final int numRecords = successes.size() + errors.size();
        final int total = totalCommits.orElse(numRecords);

        double[] fileCounts = new double[successes.size()];
        double[] violationCounts = new double[successes.size()];
        SortedMap<String, Long> byRule = new TreeMap<>();
        for (int i = 0; i < successes.size(); i++) {
            CommitResultRecord r = successes.get(i);
            fileCounts[i] = r.getFileCount();
            violationCounts[i] = r.getViolationCount();
            for (Map.Entry<String, Integer> e : r.getViolationsByRule().entrySet()) {
                byRule.merge(e.getKey(), e.getValue().longValue(), Long::sum);
            }
        }

        SortedMap<String, Integer> failureCauses = new TreeMap<>();
        for (CommitErrorRecord r : errors) {
            failureCauses.merge(r.describeCause(), 1, Integer::sum);
        }

        RunSummary summary = new RunSummary();
        summary.setLocation(location);
        RunSummary.RepositoryStats stats = summary.getRepositoryStats();
        stats.setTotalCommits(total);
        stats.setSuccessfulCommits(successes.size());
        stats.setFailedCommits(errors.size());
        stats.setSkippedCommits(Math.max(0, total - numRecords));
        stats.setAverageFileCount(roundedMean(fileCounts));
        stats.setAverageViolationCount(roundedMean(violationCounts));
        summary.setViolationsByRule(byRule);
        summary.setFailureCauses(failureCauses);
        return summary;
    }

    private static double roundedMean(double[] values) {
        if (values.length == 0) return 0.0;
        return Precision.round(StatUtils.mean(values), 2);
    }

    public void write(RunSummary summary, File summaryFile) throws IOException {
        FileUtils.writeAtomically(summaryFile, Json.mapper().writeValueAsBytes(summary));
        RunSummary.RepositoryStats s = summary.getRepositoryStats();
        LOG.info("Summary written to " + summaryFile + ": " + s.getSuccessfulCommits() + " successful, "
                + s.getFailedCommits() + " failed, " + s.getSkippedCommits() + " without record, of "
                + s.getTotalCommits() + " commits.");
        if (!summary.getFailureCauses().isEmpty()) {
            LOG.info("Failure causes: " + summary.getFailureCauses());
        }
    }
}
