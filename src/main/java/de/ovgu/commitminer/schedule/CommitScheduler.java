package de.ovgu.commitminer.schedule;

import de.ovgu.commitminer.analysis.Analyzer;
import de.ovgu.commitminer.cache.CacheIOException;
import de.ovgu.commitminer.cache.CacheSnapshotFile;
import de.ovgu.commitminer.cache.ContentCache;
import de.ovgu.commitminer.changes.ChangeResolver;
import de.ovgu.commitminer.changes.EligibleFileFinder;
import de.ovgu.commitminer.pool.WorkingTreePool;
import de.ovgu.commitminer.process.CommitOutcome;
import de.ovgu.commitminer.process.CommitProcessor;
import de.ovgu.commitminer.process.CommitProgress;
import de.ovgu.commitminer.process.ResultStore;
import de.ovgu.commitminer.util.LineageWorkerPool;
import de.ovgu.commitminer.util.RetryPolicy;
import de.ovgu.commitminer.util.UncaughtWorkerThreadException;
import de.ovgu.commitminer.vcs.Commit;
import de.ovgu.commitminer.vcs.VersionControl;
import org.apache.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Distributes the commits of a history round-robin over N lineages, one per working-tree slot, and processes the
 * lineages in parallel.  The scheduler owns the lifecycle of the content cache (loaded at the start, saved
 * periodically and at the end) and of the working-tree pool (created at the start, torn down at the end, also when the
 * run is stopped or fails).
 */
public class CommitScheduler {
    private static final Logger LOG = Logger.getLogger(CommitScheduler.class);

    public static final int DEFAULT_CACHE_SAVE_INTERVAL = 50;

    private final VersionControl vcs;
    private final Analyzer analyzer;
    private final ContentCache cache;
    private final CacheSnapshotFile cacheSnapshotFile;
    private final ResultStore resultStore;
    private final EligibleFileFinder fileFinder;

    private File worktreesDir;
    private File ruleset;
    private String auxClasspath = "";
    private int numWorkers = Runtime.getRuntime().availableProcessors();
    private int cacheSaveInterval = DEFAULT_CACHE_SAVE_INTERVAL;
    private RetryPolicy checkoutRetryPolicy = RetryPolicy.noRetries();
    private long slowCommitThresholdMillis = CommitProcessor.DEFAULT_SLOW_COMMIT_THRESHOLD_MILLIS;

    private volatile boolean stopRequested = false;
    private volatile LineageWorkerPool<Commit, CommitOutcome> workerPool;
    private final CountDownLatch finished = new CountDownLatch(1);

    public CommitScheduler(VersionControl vcs, Analyzer analyzer, ContentCache cache,
                           CacheSnapshotFile cacheSnapshotFile, ResultStore resultStore, EligibleFileFinder fileFinder) {
        this.vcs = vcs;
        this.analyzer = analyzer;
        this.cache = cache;
        this.cacheSnapshotFile = cacheSnapshotFile;
        this.resultStore = resultStore;
        this.fileFinder = fileFinder;
    }

    /**
     * Split the commits into <code>n</code> lineages: lineage <code>i</code> receives the commits at positions
     * <code>i, i+n, i+2n, ...</code> of the list, in that order.
     */
    public static List<List<Commit>> partition(List<Commit> commits, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Number of lineages must be at least 1, got " + n);
        }
        List<List<Commit>> lineages = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            lineages.add(new ArrayList<>(commits.size() / n + 1));
        }
        for (int i = 0; i < commits.size(); i++) {
            lineages.get(i % n).add(commits.get(i));
        }
        return lineages;
    }

    /**
     * Process all commits.
     *
     * @param commits The history, oldest first
     * @return Statistics about the commits seen in this run
     * @throws UncaughtWorkerThreadException if a worker thread died
     */
    public RunStatistics run(List<Commit> commits) throws UncaughtWorkerThreadException {
        final RunStatistics stats = new RunStatistics(commits.size());
        try {
            if (commits.isEmpty()) {
                LOG.warn("No commits to process.");
                return stats;
            }
            final int poolSize = Math.min(numWorkers, commits.size());
            loadCache();

            try (WorkingTreePool pool = new WorkingTreePool(vcs, worktreesDir, poolSize, checkoutRetryPolicy)) {
                pool.initialize(commits.get(0));
                CommitProgress progress = new CommitProgress(commits.size());
                final CommitProcessor processor = new CommitProcessor(pool, new ChangeResolver(vcs, fileFinder),
                        cache, analyzer, resultStore, progress, ruleset, auxClasspath);
                processor.setSlowCommitThresholdMillis(slowCommitThresholdMillis);
                processor.setStopRequested(this::isStopRequested);

                LOG.info("Processing " + commits.size() + " commits with " + poolSize + " workers.");
                LineageWorkerPool<Commit, CommitOutcome> wp = new LineageWorkerPool<Commit, CommitOutcome>() {
                    @Override
                    protected CommitOutcome processItem(int lineageIndex, Commit commit) {
                        return processor.process(lineageIndex, commit);
                    }
                };
                this.workerPool = wp;
                if (stopRequested) {
                    wp.requestTermination();
                }

                wp.processLineages(partition(commits, poolSize), outcome -> {
                    stats.add(outcome);
                    if (stats.getCompleted() % cacheSaveInterval == 0) {
                        saveCache();
                    }
                });
            } finally {
                saveCache();
            }

            if (stopRequested) {
                LOG.warn("Run stopped before all commits were processed: " + stats);
            } else {
                LOG.info("Run finished: " + stats);
            }
            LOG.info("Cache: " + cache.size() + " entries, " + cache.getHits() + " hits, " + cache.getMisses() + " misses.");
            return stats;
        } finally {
            finished.countDown();
        }
    }

    private void loadCache() {
        try {
            cacheSnapshotFile.loadInto(cache);
        } catch (CacheIOException e) {
            LOG.warn(e.getMessage() + ". Starting with an empty cache.", e);
        }
    }

    private void saveCache() {
        try {
            cacheSnapshotFile.save(cache);
        } catch (CacheIOException e) {
            LOG.warn(e.getMessage(), e);
        }
    }

    /**
     * Stop dispatching commits.  Workers finish the commit they are working on; the cache is saved and the pool torn
     * down as usual.
     */
    public void requestStop() {
        if (!stopRequested) {
            LOG.info("Stop requested. Waiting for workers to finish their current commit.");
        }
        stopRequested = true;
        LineageWorkerPool<Commit, CommitOutcome> wp = this.workerPool;
        if (wp != null) {
            wp.requestTermination();
        }
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Wait for {@link #run} to return.
     *
     * @return <code>false</code> if the run did not end within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public void setWorktreesDir(File worktreesDir) {
        this.worktreesDir = worktreesDir;
    }

    public void setRuleset(File ruleset) {
        this.ruleset = ruleset;
    }

    public void setAuxClasspath(String auxClasspath) {
        this.auxClasspath = auxClasspath;
    }

    public void setNumWorkers(int numWorkers) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("Number of workers must be at least 1, got " + numWorkers);
        }
        this.numWorkers = numWorkers;
    }

    public void setCacheSaveInterval(int cacheSaveInterval) {
        if (cacheSaveInterval < 1) {
            throw new IllegalArgumentException("Cache save interval must be at least 1, got " + cacheSaveInterval);
        }
        this.cacheSaveInterval = cacheSaveInterval;
    }

    public void setCheckoutRetryPolicy(RetryPolicy checkoutRetryPolicy) {
        this.checkoutRetryPolicy = checkoutRetryPolicy;
    }

    public void setSlowCommitThresholdMillis(long slowCommitThresholdMillis) {
        this.slowCommitThresholdMillis = slowCommitThresholdMillis;
    }
}
