package de.ovgu.commitminer.schedule;

import de.ovgu.commitminer.analysis.AnalysisException;
import de.ovgu.commitminer.analysis.AnalysisReport;
import de.ovgu.commitminer.analysis.AnalysisRequest;
import de.ovgu.commitminer.analysis.RecordingAnalyzer;
import de.ovgu.commitminer.cache.CacheSnapshotFile;
import de.ovgu.commitminer.cache.ContentCache;
import de.ovgu.commitminer.changes.EligibleFileFinder;
import de.ovgu.commitminer.process.CommitErrorRecord;
import de.ovgu.commitminer.process.CommitResultRecord;
import de.ovgu.commitminer.process.ResultStore;
import de.ovgu.commitminer.summary.Aggregator;
import de.ovgu.commitminer.summary.RunSummary;
import de.ovgu.commitminer.util.UncaughtWorkerThreadException;
import de.ovgu.commitminer.vcs.Commit;
import de.ovgu.commitminer.vcs.InMemoryVersionControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link CommitScheduler}.
 */
class CommitSchedulerTest {
    @TempDir
    File tempDir;

    private InMemoryVersionControl vcs;
    private RecordingAnalyzer analyzer;
    private File resultsDir;
    private File cacheFile;

    @BeforeEach
    void setUp() {
        vcs = new InMemoryVersionControl();
        analyzer = new RecordingAnalyzer();
        resultsDir = new File(tempDir, "pmd_results");
        cacheFile = new File(tempDir, "cache.json");
    }

    private List<Commit> createHistory(int numCommits) {
        for (int i = 0; i < numCommits; i++) {
            vcs.commitChanges(Collections.singletonMap("src/C" + (i % 3) + ".java",
                    "class C {\n// TODO " + i + "\n}\n"));
        }
        return vcs.listCommits("HEAD");
    }

    private CommitScheduler createScheduler(int numWorkers) {
        CommitScheduler scheduler = new CommitScheduler(vcs, analyzer, new ContentCache(),
                new CacheSnapshotFile(cacheFile), new ResultStore(resultsDir), new EligibleFileFinder(".java"));
        scheduler.setWorktreesDir(new File(tempDir, "worktrees"));
        scheduler.setRuleset(new File("ruleset.xml"));
        scheduler.setNumWorkers(numWorkers);
        scheduler.setCacheSaveInterval(2);
        return scheduler;
    }

    @Test
    void shouldPartitionRoundRobin() {
        List<Commit> commits = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            commits.add(new Commit("c" + i, i));
        }

        List<List<Commit>> lineages = CommitScheduler.partition(commits, 3);

        assertThat(lineages).hasSize(3);
        assertThat(lineages.get(0)).extracting(Commit::getPosition).containsExactly(0, 3, 6);
        assertThat(lineages.get(1)).extracting(Commit::getPosition).containsExactly(1, 4);
        assertThat(lineages.get(2)).extracting(Commit::getPosition).containsExactly(2, 5);
    }

    @Test
    void shouldRejectPartitionIntoNoLineages() {
        assertThatIllegalArgumentException().isThrownBy(() -> CommitScheduler.partition(new ArrayList<>(), 0));
    }

    @Test
    void shouldProcessEachLineageInItsOwnSlot() throws UncaughtWorkerThreadException {
        List<Commit> commits = createHistory(7);

        RunStatistics stats = createScheduler(3).run(commits);

        assertThat(stats.getProcessed()).isEqualTo(7);
        List<String> checkouts = vcs.getCheckouts();
        assertThat(checkouts).hasSize(7);
        Set<String> slotNames = new HashSet<>();
        for (Commit c : commits) {
            String expectedSlot = "wt_" + (c.getPosition() % 3);
            assertThat(checkouts).contains(expectedSlot + ":" + c.getId());
            slotNames.add(expectedSlot);
        }
        assertThat(slotNames).hasSize(3);
        assertThat(new File(tempDir, "worktrees").list()).isEmpty();
    }

    @Test
    void shouldConfineCheckoutFailureToItsCommit() throws UncaughtWorkerThreadException {
        List<Commit> commits = createHistory(5);
        vcs.failCheckout(commits.get(2).getId(), Integer.MAX_VALUE);

        RunStatistics stats = createScheduler(2).run(commits);

        assertThat(stats.getProcessed()).isEqualTo(4);
        assertThat(stats.getFailed()).isEqualTo(1);
        assertThat(stats.getFailureCauses()).containsEntry("CHECKOUT", 1);

        ResultStore store = new ResultStore(resultsDir);
        assertThat(store.readSuccessRecords()).extracting(CommitResultRecord::getPosition).containsExactlyInAnyOrder(0, 1, 3, 4);
        assertThat(store.readErrorRecords()).extracting(CommitErrorRecord::getPosition).containsExactly(2);

        RunSummary summary = new Aggregator().summarize(resultsDir, "repo", OptionalInt.of(commits.size()));
        assertThat(summary.getRepositoryStats().getSuccessfulCommits()).isEqualTo(4);
        assertThat(summary.getRepositoryStats().getFailedCommits()).isEqualTo(1);
        assertThat(summary.getFailureCauses()).containsEntry("CHECKOUT", 1);
    }

    @Test
    void shouldSkipRecordedCommitsOnRerun() throws UncaughtWorkerThreadException {
        List<Commit> commits = createHistory(5);
        createScheduler(2).run(commits);
        int callsOfFirstRun = analyzer.getCallCount();

        RunStatistics stats = createScheduler(2).run(commits);

        assertThat(stats.getSkipped()).isEqualTo(5);
        assertThat(stats.getProcessed()).isZero();
        assertThat(analyzer.getCallCount()).isEqualTo(callsOfFirstRun);
    }

    @Test
    void shouldPersistCacheBetweenRuns() throws UncaughtWorkerThreadException {
        List<Commit> commits = createHistory(4);
        createScheduler(2).run(commits);
        assertThat(cacheFile).isFile();

        for (File f : resultsDir.listFiles()) {
            assertThat(f.delete()).isTrue();
        }
        int callsOfFirstRun = analyzer.getCallCount();

        RunStatistics stats = createScheduler(1).run(commits);

        assertThat(stats.getProcessed()).isEqualTo(4);
        assertThat(analyzer.getCallCount()).isEqualTo(callsOfFirstRun);
    }

    @Test
    void shouldNotDispatchCommitsAfterStopRequest() throws Exception {
        List<Commit> commits = createHistory(4);
        CommitScheduler scheduler = createScheduler(2);
        scheduler.requestStop();

        RunStatistics stats = scheduler.run(commits);

        assertThat(stats.getCompleted()).isZero();
        assertThat(scheduler.isStopRequested()).isTrue();
        assertThat(scheduler.awaitTermination(1, TimeUnit.SECONDS)).isTrue();
        assertThat(new ResultStore(resultsDir).readSuccessRecords()).isEmpty();
    }

    @Test
    void shouldFinishCommitInFlightWhenStoppedDuringRun() throws Exception {
        List<Commit> commits = createHistory(4);
        final AtomicReference<CommitScheduler> schedulerRef = new AtomicReference<>();
        analyzer = new RecordingAnalyzer() {
            @Override
            public AnalysisReport analyze(AnalysisRequest request) {
                schedulerRef.get().requestStop();
                return super.analyze(request);
            }
        };
        CommitScheduler scheduler = createScheduler(1);
        schedulerRef.set(scheduler);

        RunStatistics stats = scheduler.run(commits);

        assertThat(stats.getProcessed()).isEqualTo(1);
        assertThat(stats.getCompleted()).isEqualTo(1);
        assertThat(analyzer.getCallCount()).isEqualTo(1);
        assertThat(new ResultStore(resultsDir).readSuccessRecords()).extracting(CommitResultRecord::getPosition)
                .containsExactly(0);
        assertThat(scheduler.awaitTermination(1, TimeUnit.SECONDS)).isTrue();

        ContentCache saved = new ContentCache();
        new CacheSnapshotFile(cacheFile).loadInto(saved);
        assertThat(saved.size()).isEqualTo(1);
        assertThat(new File(tempDir, "worktrees").list()).isEmpty();
    }

    @Test
    void shouldLeaveCommitKilledByStopUnrecorded() throws Exception {
        List<Commit> commits = createHistory(3);
        final AtomicReference<CommitScheduler> schedulerRef = new AtomicReference<>();
        analyzer = new RecordingAnalyzer() {
            @Override
            public AnalysisReport analyze(AnalysisRequest request) {
                super.analyze(request);
                schedulerRef.get().requestStop();
                throw new AnalysisException(AnalysisException.Cause.EXIT_CODE, "PMD exited with code 130");
            }
        };
        CommitScheduler scheduler = createScheduler(1);
        schedulerRef.set(scheduler);

        RunStatistics stats = scheduler.run(commits);

        assertThat(stats.getAbandoned()).isEqualTo(1);
        assertThat(stats.getFailed()).isZero();
        ResultStore store = new ResultStore(resultsDir);
        assertThat(store.readErrorRecords()).isEmpty();
        assertThat(store.readSuccessRecords()).isEmpty();

        analyzer = new RecordingAnalyzer();
        RunStatistics rerun = createScheduler(1).run(commits);

        assertThat(rerun.getProcessed()).isEqualTo(3);
        assertThat(rerun.getSkipped()).isZero();
    }

    @Test
    void shouldReturnEmptyStatisticsForEmptyHistory() throws UncaughtWorkerThreadException {
        RunStatistics stats = createScheduler(2).run(new ArrayList<>());

        assertThat(stats.getCompleted()).isZero();
        assertThat(stats.getTotalCommits()).isZero();
    }
}
