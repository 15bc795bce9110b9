package de.ovgu.commitminer.process;

import de.ovgu.commitminer.analysis.AnalysisException;
import de.ovgu.commitminer.analysis.AnalysisReport;
import de.ovgu.commitminer.analysis.AnalysisRequest;
import de.ovgu.commitminer.analysis.Analyzer;
import de.ovgu.commitminer.cache.CacheEntry;
import de.ovgu.commitminer.cache.ContentCache;
import de.ovgu.commitminer.cache.FileFingerprint;
import de.ovgu.commitminer.changes.ChangeResolver;
import de.ovgu.commitminer.changes.Resolution;
import de.ovgu.commitminer.pool.CheckoutException;
import de.ovgu.commitminer.pool.SlotLease;
import de.ovgu.commitminer.pool.WorkingTreePool;
import de.ovgu.commitminer.vcs.Commit;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Processes one commit in the working-tree slot of its lineage:
 * <ol>
 * <li>skip it if a record exists already,</li>
 * <li>check it out,</li>
 * <li>determine the files that changed since the commit the lineage processed before,</li>
 * <li>look up the findings of all files in the cache by fingerprint and analyze only the files whose fingerprint is
 * unknown,</li>
 * <li>write a record covering all eligible files of the tree.</li>
 * </ol>
 * Any failure is confined to the commit: it gets an error record, and the lineage starts over with a full scan.  A
 * failure after a stop was requested is not recorded, since an interrupt also kills the external programs of commits in
 * flight; those commits are processed again on the next run.
 */
public class CommitProcessor {
    private static final Logger LOG = Logger.getLogger(CommitProcessor.class);

    public static final long DEFAULT_SLOW_COMMIT_THRESHOLD_MILLIS = 10000L;

    private final WorkingTreePool pool;
    private final ChangeResolver changeResolver;
    private final ContentCache cache;
    private final Analyzer analyzer;
    private final ResultStore resultStore;
    private final CommitProgress progress;
    private final File ruleset;
    private final String auxClasspath;
    private final List<LineageState> lineages;
    private long slowCommitThresholdMillis = DEFAULT_SLOW_COMMIT_THRESHOLD_MILLIS;
    private BooleanSupplier stopRequested = () -> false;

    public CommitProcessor(WorkingTreePool pool, ChangeResolver changeResolver, ContentCache cache, Analyzer analyzer,
                           ResultStore resultStore, CommitProgress progress, File ruleset, String auxClasspath) {
        this.pool = pool;
        this.changeResolver = changeResolver;
        this.cache = cache;
        this.analyzer = analyzer;
        this.resultStore = resultStore;
        this.progress = progress;
        this.ruleset = ruleset;
        this.auxClasspath = auxClasspath;
        this.lineages = new ArrayList<>(pool.size());
        for (int i = 0; i < pool.size(); i++) {
            lineages.add(new LineageState());
        }
    }

    public void setSlowCommitThresholdMillis(long slowCommitThresholdMillis) {
        this.slowCommitThresholdMillis = slowCommitThresholdMillis;
    }

    /**
     * @param stopRequested Tells whether the run is being stopped
     */
    public void setStopRequested(BooleanSupplier stopRequested) {
        this.stopRequested = stopRequested;
    }

    /**
     * Must only be called by the worker bound to <code>slotIndex</code>, with the commits of its lineage in
     * chronological order.
     */
    public CommitOutcome process(int slotIndex, Commit commit) {
        final long start = System.currentTimeMillis();
        progress.enter(commit, CommitState.PENDING);

        if (resultStore.hasRecord(commit)) {
            LOG.debug("Skipping " + commit + ": already recorded.");
            progress.enter(commit, CommitState.SKIPPED);
            return CommitOutcome.skipped(commit, slotIndex);
        }

        final LineageState lineage = lineages.get(slotIndex);
        try (SlotLease lease = pool.acquire(slotIndex)) {
            try {
                pool.checkout(lease, commit);
            } catch (CheckoutException e) {
                LOG.error("Failed to check out " + commit + ": " + e.getMessage());
                return fail(commit, slotIndex, lineage, FailureCause.CHECKOUT, null, e, start);
            }
            progress.enter(commit, CommitState.CHECKED_OUT);

            try {
                return analyzeAndRecord(lease, commit, lineage, start);
            } catch (AnalysisException e) {
                LOG.error("Analysis of " + commit + " failed (" + e.getFailureCause() + "): " + e.getMessage());
                resetQuietly(lease);
                return fail(commit, slotIndex, lineage, FailureCause.ANALYSIS, e.getFailureCause().name(), e, start);
            } catch (ResultStoreException e) {
                LOG.error("Could not record " + commit + ". It will be processed again on the next run.", e);
                lineage.clear();
                progress.enter(commit, CommitState.FAILED);
                return CommitOutcome.failed(commit, slotIndex, FailureCause.INTERNAL, null, elapsedSince(start));
            } catch (RuntimeException e) {
                LOG.error("Unexpected error processing " + commit, e);
                return fail(commit, slotIndex, lineage, FailureCause.INTERNAL, null, e, start);
            }
        }
    }

    private CommitOutcome analyzeAndRecord(SlotLease lease, Commit commit, LineageState lineage, long start) {
        final File tree = lease.getDirectory();
        final Resolution resolution = changeResolver.resolve(lineage.getLastCommit(), commit, tree);
        progress.enter(commit, CommitState.RESOLVED);

        final SortedSet<String> changed = resolution.getChangedFiles();
        final Map<String, FileFingerprint> fingerprints = new LinkedHashMap<>();
        final Set<String> fingerprinted = new HashSet<>();
        for (String path : resolution.getEligibleFiles()) {
            Optional<FileFingerprint> known = changed.contains(path) ? Optional.<FileFingerprint>empty() : lineage.fingerprintOf(path);
            if (known.isPresent()) {
                fingerprints.put(path, known.get());
            } else {
                fingerprints.put(path, fingerprint(tree, path));
                fingerprinted.add(path);
            }
        }

        // Findings per file, and one representative path per unknown content
        final Map<String, CacheEntry> entries = new TreeMap<>();
        final Map<FileFingerprint, String> toAnalyze = new LinkedHashMap<>();
        int cachedFileCount = 0;
        for (Map.Entry<String, FileFingerprint> e : fingerprints.entrySet()) {
            Optional<CacheEntry> hit = cache.lookup(e.getValue());
            if (hit.isPresent()) {
                entries.put(e.getKey(), hit.get());
                if (fingerprinted.contains(e.getKey())) {
                    cachedFileCount++;
                }
            } else if (!toAnalyze.containsKey(e.getValue())) {
                toAnalyze.put(e.getValue(), e.getKey());
            }
        }

        if (!toAnalyze.isEmpty()) {
            List<String> files = new ArrayList<>(toAnalyze.values());
            LOG.debug("Analyzing " + files.size() + " files of " + commit);
            AnalysisReport report = analyzer.analyze(new AnalysisRequest(tree, ruleset, auxClasspath, files));
            Map<FileFingerprint, CacheEntry> fresh = new LinkedHashMap<>();
            for (Map.Entry<FileFingerprint, String> e : toAnalyze.entrySet()) {
                fresh.put(e.getKey(), cache.store(e.getKey(), new CacheEntry(report.countsByRule(e.getValue()))));
            }
            for (Map.Entry<String, FileFingerprint> e : fingerprints.entrySet()) {
                if (!entries.containsKey(e.getKey())) {
                    entries.put(e.getKey(), fresh.get(e.getValue()));
                }
            }
        }
        progress.enter(commit, CommitState.ANALYZED);

        CommitResultRecord record = merge(commit, lease.getSlotIndex(), entries);
        record.setChangedFileCount(fingerprinted.size());
        record.setAnalyzedFileCount(toAnalyze.size());
        record.setCachedFileCount(cachedFileCount);
        record.setFullScan(resolution.isFullScan());
        long duration = elapsedSince(start);
        record.setDurationMillis(duration);
        resultStore.writeSuccess(record);

        lineage.update(commit, fingerprints);
        progress.enter(commit, CommitState.RECORDED);

        if (duration > slowCommitThresholdMillis) {
            LOG.warn("Processing " + commit + " took " + duration + " ms (" + resolution + ", "
                    + toAnalyze.size() + " files analyzed).");
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("Recorded " + commit + " in " + duration + " ms: " + resolution + ", "
                    + toAnalyze.size() + " files analyzed, " + record.getViolationCount() + " violations.");
        }
        return CommitOutcome.recorded(commit, lease.getSlotIndex(), duration);
    }

    static CommitResultRecord merge(Commit commit, int slotIndex, Map<String, CacheEntry> entriesByPath) {
        SortedMap<String, Integer> byRule = new TreeMap<>();
        SortedMap<String, Integer> byFile = new TreeMap<>();
        int fileCount = 0;
        int violationCount = 0;
        for (Map.Entry<String, CacheEntry> e : entriesByPath.entrySet()) {
            CacheEntry entry = e.getValue();
            fileCount += entry.getFileCount();
            violationCount += entry.getViolationCount();
            if (entry.getViolationCount() > 0) {
                byFile.put(e.getKey(), entry.getViolationCount());
            }
            for (Map.Entry<String, Integer> r : entry.getViolationsByRule().entrySet()) {
                byRule.merge(r.getKey(), r.getValue(), Integer::sum);
            }
        }

        CommitResultRecord record = new CommitResultRecord();
        record.setCommit(commit.getId());
        record.setPosition(commit.getPosition());
        record.setSlot(slotIndex);
        record.setFileCount(fileCount);
        record.setViolationCount(violationCount);
        record.setViolationsByRule(byRule);
        record.setViolationsByFile(byFile);
        return record;
    }

    private static FileFingerprint fingerprint(File tree, String path) {
        try {
            return FileFingerprint.of(new File(tree, path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path + " in " + tree, e);
        }
    }

    private CommitOutcome fail(Commit commit, int slotIndex, LineageState lineage, FailureCause cause, String detail,
                               Exception e, long start) {
        lineage.clear();
        long duration = elapsedSince(start);

        if (stopRequested.getAsBoolean()) {
            LOG.warn("Not recording failure of " + commit + " since a stop was requested."
                    + " It will be processed again on the next run.");
            progress.enter(commit, CommitState.ABANDONED);
            return CommitOutcome.abandoned(commit, slotIndex, duration);
        }

        CommitErrorRecord record = new CommitErrorRecord();
        record.setCommit(commit.getId());
        record.setPosition(commit.getPosition());
        record.setSlot(slotIndex);
        record.setCause(cause);
        record.setDetail(detail);
        record.setMessage(String.valueOf(e.getMessage()));
        record.setDurationMillis(duration);
        try {
            resultStore.writeError(record);
        } catch (ResultStoreException rse) {
            LOG.error("Could not record failure of " + commit + ". It will be processed again on the next run.", rse);
        }

        progress.enter(commit, CommitState.FAILED);
        return CommitOutcome.failed(commit, slotIndex, cause, detail, duration);
    }

    private void resetQuietly(SlotLease lease) {
        try {
            pool.reset(lease);
        } catch (RuntimeException e) {
            LOG.warn("Failed to reset " + lease.getSlot() + " after failed analysis: " + e.getMessage());
        }
    }

    private static long elapsedSince(long start) {
        return System.currentTimeMillis() - start;
    }
}
