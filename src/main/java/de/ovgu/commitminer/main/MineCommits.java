package de.ovgu.commitminer.main;

import de.ovgu.commitminer.analysis.Analyzer;
import de.ovgu.commitminer.analysis.PmdCommandLineAnalyzer;
import de.ovgu.commitminer.analysis.PmdDaemonAnalyzer;
import de.ovgu.commitminer.analysis.RetryingAnalyzer;
import de.ovgu.commitminer.cache.CacheSnapshotFile;
import de.ovgu.commitminer.cache.ContentCache;
import de.ovgu.commitminer.changes.EligibleFileFinder;
import de.ovgu.commitminer.process.ResultStore;
import de.ovgu.commitminer.schedule.CommitScheduler;
import de.ovgu.commitminer.schedule.RunStatistics;
import de.ovgu.commitminer.summary.Aggregator;
import de.ovgu.commitminer.summary.CommitsCsvWriter;
import de.ovgu.commitminer.summary.RunSummary;
import de.ovgu.commitminer.util.RetryPolicy;
import de.ovgu.commitminer.util.UncaughtWorkerThreadException;
import de.ovgu.commitminer.vcs.Commit;
import de.ovgu.commitminer.vcs.GitVersionControl;
import de.ovgu.commitminer.vcs.VersionControlException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs PMD on every commit of a git repository and summarizes the findings.
 */
public class MineCommits {
    private static final Logger LOG = Logger.getLogger(MineCommits.class);

    static final RetryPolicy CHECKOUT_RETRY_POLICY = new RetryPolicy(3, 500, 2.0);
    static final RetryPolicy ANALYZER_RETRY_POLICY = new RetryPolicy(2, 1000, 2.0);

    /**
     * How long the shutdown hook waits for workers to finish their current commit
     */
    private static final long SHUTDOWN_WAIT_MINUTES = 30;

    private volatile CommitScheduler scheduler = null;
    private final CountDownLatch finished = new CountDownLatch(1);

    public static void main(String[] args) {
        int status;
        try {
            MineCommits miner = new MineCommits();
            MineCommitsConfig conf = miner.parseCommandLineArgsOrExit(args);
            status = miner.run(conf);
        } catch (SetupException e) {
            LOG.error("Setup failed: " + e.getMessage(), e);
            status = 1;
        } catch (Exception e) {
            System.err.flush();
            System.out.flush();
            System.err.println("Error: " + e);
            e.printStackTrace();
            System.err.flush();
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return The exit status: 0 if the run completed, 1 if it was aborted
     * @throws SetupException if the run cannot start
     */
    int run(MineCommitsConfig conf) {
        if (conf.isVerbose()) {
            Logger.getRootLogger().setLevel(Level.DEBUG);
        }
        installShutdownHook();
        try {
            ensureDirectory(conf.getOutputDir());
            if (conf.isSummarizeOnly()) {
                summarize(conf, countCommitsIfRepositoryExists(conf));
                return 0;
            }
            return mine(conf);
        } finally {
            finished.countDown();
        }
    }

    private int mine(MineCommitsConfig conf) {
        final long startTime = System.currentTimeMillis();
        File ruleset = conf.getRuleset();
        if (ruleset == null || !ruleset.isFile()) {
            throw new SetupException("Ruleset does not exist or is not a file: " + ruleset);
        }

        try {
            GitVersionControl.cloneOrFetch(conf.getRepositoryLocation(), conf.baseRepoDir());
        } catch (VersionControlException e) {
            throw new SetupException("Failed to clone or fetch " + conf.getRepositoryLocation() + ": " + e.getMessage(), e);
        }

        final List<Commit> commits;
        final RunStatistics stats;
        boolean workersDied = false;
        try (GitVersionControl vcs = openRepository(conf)) {
            try {
                commits = vcs.listCommits(conf.getRef());
            } catch (VersionControlException e) {
                throw new SetupException("Failed to list commits of " + conf.getRef() + ": " + e.getMessage(), e);
            }
            if (commits.isEmpty()) {
                throw new SetupException("No commits found for " + conf.getRef() + " in " + conf.getRepositoryLocation());
            }
            LOG.info("Found " + commits.size() + " commits in " + conf.getRef() + ".");

            ResultStore resultStore = new ResultStore(conf.resultsDir());
            ensureDirectory(resultStore.getDirectory());
            if (conf.isRetryFailed()) {
                int deleted = resultStore.deleteErrorRecords();
                LOG.info("Deleted " + deleted + " error records. Failed commits will be processed again.");
            }

            CommitScheduler s = new CommitScheduler(vcs, createAnalyzer(conf), new ContentCache(),
                    new CacheSnapshotFile(conf.cacheFile()), resultStore, new EligibleFileFinder(conf.getExtension()));
            s.setWorktreesDir(conf.worktreesDir());
            s.setRuleset(ruleset);
            s.setAuxClasspath(conf.auxClasspathString());
            s.setNumWorkers(conf.getNumberOfWorkers());
            s.setCacheSaveInterval(conf.getCacheSaveInterval());
            s.setCheckoutRetryPolicy(CHECKOUT_RETRY_POLICY);
            this.scheduler = s;

            RunStatistics runStats;
            try {
                runStats = s.run(commits);
            } catch (UncaughtWorkerThreadException e) {
                LOG.error("A worker thread died. Results are incomplete.", e);
                workersDied = true;
                runStats = null;
            } catch (VersionControlException | IllegalStateException e) {
                throw new SetupException("Failed to set up working trees: " + e.getMessage(), e);
            }
            stats = runStats;
        }

        summarize(conf, OptionalInt.of(commits.size()));
        logTiming(startTime, stats);
        return workersDied ? 1 : 0;
    }

    private static GitVersionControl openRepository(MineCommitsConfig conf) {
        try {
            return new GitVersionControl(conf.baseRepoDir());
        } catch (VersionControlException e) {
            throw new SetupException(e.getMessage(), e);
        }
    }

    static Analyzer createAnalyzer(MineCommitsConfig conf) {
        final Analyzer analyzer;
        if (conf.getDaemonUrl().isPresent()) {
            LOG.info("Using PMD daemon at " + conf.getDaemonUrl().get());
            analyzer = new PmdDaemonAnalyzer(conf.getDaemonUrl().get(), conf.timeoutMillis());
        } else {
            LOG.info("Using PMD executable `" + conf.getPmdProg() + "'");
            analyzer = new PmdCommandLineAnalyzer(conf.getPmdProg(), conf.timeoutMillis());
        }
        return new RetryingAnalyzer(analyzer, ANALYZER_RETRY_POLICY);
    }

    private OptionalInt countCommitsIfRepositoryExists(MineCommitsConfig conf) {
        if (!new File(conf.baseRepoDir(), ".git").isDirectory()) {
            return OptionalInt.empty();
        }
        try (GitVersionControl vcs = new GitVersionControl(conf.baseRepoDir())) {
            return OptionalInt.of(vcs.listCommits(conf.getRef()).size());
        } catch (VersionControlException e) {
            LOG.warn("Could not count commits of " + conf.getRef() + ": " + e.getMessage());
            return OptionalInt.empty();
        }
    }

    private void summarize(MineCommitsConfig conf, OptionalInt totalCommits) {
        ResultStore store = new ResultStore(conf.resultsDir());
        Aggregator aggregator = new Aggregator();
        RunSummary summary = aggregator.summarize(store.readSuccessRecords(), store.readErrorRecords(),
                conf.getRepositoryLocation(), totalCommits);
        try {
            aggregator.write(summary, conf.summaryFile());
            new CommitsCsvWriter().write(conf.commitsCsvFile(), store.readSuccessRecords(), store.readErrorRecords());
        } catch (IOException e) {
            throw new RuntimeException("Failed to write summary to " + conf.getOutputDir(), e);
        }
    }

    private static void logTiming(long startTime, RunStatistics stats) {
        long totalMillis = System.currentTimeMillis() - startTime;
        LOG.info("Total time: " + formatDuration(totalMillis));
        if (stats != null && stats.getProcessed() + stats.getFailed() > 0) {
            LOG.info("Average time per analyzed commit: " + stats.getAverageMillisPerCommit() + " ms");
        }
    }

    static String formatDuration(long millis) {
        long seconds = millis / 1000;
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds / 60) % 60, seconds % 60);
    }

    private void installShutdownHook() {
        Thread hook = new Thread(() -> {
            if (finished.getCount() == 0) return;
            LOG.warn("Interrupted. Stopping after the current commits.");
            CommitScheduler s = scheduler;
            if (s != null) {
                s.requestStop();
            }
            try {
                if (!finished.await(SHUTDOWN_WAIT_MINUTES, TimeUnit.MINUTES)) {
                    LOG.error("Giving up waiting for workers. Working trees may need manual cleanup.");
                }
            } catch (InterruptedException e) {
                LOG.warn("Interrupted while waiting for workers to stop.");
            }
        }, "shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
    }

    private static void ensureDirectory(File dir) {
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new SetupException("Failed to create directory " + dir);
        }
    }

    MineCommitsConfig parseCommandLineArgsOrExit(String[] args) {
        CommandLineParser parser = new DefaultParser();
        Options actualOptions = makeOptions();
        try {
            CommandLine line = parser.parse(actualOptions, args);
            if (line.hasOption(MineCommitsConfig.OPT_HELP)) {
                HelpFormatter formatter = new HelpFormatter();
                System.err.flush();
                formatter.printHelp(progName() + " [OPTIONS]... REPOSITORY",
                        "Run PMD on every commit of a GIT repository and summarize the warnings.\n\t"
                                + "REPOSITORY is a URL or a local path.  It is cloned into the output directory on the"
                                + " first run and fetched on later runs.  Commits that already have a result in the"
                                + " output directory are skipped, so an interrupted run can simply be restarted."
                                + "\n\nOptions:\n",
                        actualOptions, null, false);
                System.out.flush();
                System.exit(0);
                // We never actually get here due to the preceding System.exit(int) call.
                return null;
            }
            return parseCommandLineArgs(line);
        } catch (ParseException e) {
            System.err.println("Error in command line: " + e.getMessage());
            HelpFormatter formatter = new HelpFormatter();
            formatter.printUsage(new PrintWriter(System.err, true), 80, progName(), actualOptions);
            System.exit(1);
            // We never actually get here due to the preceding System.exit(int) call.
            return null;
        }
    }

    MineCommitsConfig parseCommandLineArgs(String[] args) throws ParseException {
        return parseCommandLineArgs(new DefaultParser().parse(makeOptions(), args));
    }

    private MineCommitsConfig parseCommandLineArgs(CommandLine line) throws ParseException {
        MineCommitsConfig res = new MineCommitsConfig();
        res.setSummarizeOnly(line.hasOption(MineCommitsConfig.OPT_SUMMARIZE_ONLY_L));
        res.setRetryFailed(line.hasOption(MineCommitsConfig.OPT_RETRY_FAILED_L));
        res.setVerbose(line.hasOption(MineCommitsConfig.OPT_VERBOSE));

        List<String> positional = line.getArgList();
        if (positional.size() != 1) {
            throw new ParseException("Expected exactly one REPOSITORY argument, got " + positional.size());
        }
        String location = positional.get(0);
        File localRepo = new File(location);
        res.setRepositoryLocation(localRepo.isDirectory() ? localRepo.getAbsolutePath() : location);

        res.setOutputDir(new File(line.getOptionValue(MineCommitsConfig.OPT_OUTPUT_DIR,
                MineCommitsConfig.DEFAULT_OUTPUT_DIR_NAME)));

        if (line.hasOption(MineCommitsConfig.OPT_RULESET)) {
            res.setRuleset(new File(line.getOptionValue(MineCommitsConfig.OPT_RULESET)));
        } else if (!res.isSummarizeOnly()) {
            throw new ParseException("Missing required option: --" + MineCommitsConfig.OPT_RULESET_L);
        }

        if (line.hasOption(MineCommitsConfig.OPT_WORKERS)) {
            res.setNumberOfWorkers(parsePositiveIntOrDie(line, MineCommitsConfig.OPT_WORKERS_L));
        }
        String[] auxClasspath = line.getOptionValues(MineCommitsConfig.OPT_AUX_CLASSPATH);
        if (auxClasspath != null) {
            for (String cp : auxClasspath) {
                res.addAuxClasspath(cp);
            }
        }
        res.setPmdProg(line.getOptionValue(MineCommitsConfig.OPT_PMD_L, MineCommitsConfig.DEFAULT_PMD_PROG));
        res.setDaemonUrl(line.getOptionValue(MineCommitsConfig.OPT_DAEMON_L));
        res.setRef(line.getOptionValue(MineCommitsConfig.OPT_REF_L, MineCommitsConfig.DEFAULT_REF));

        String extension = line.getOptionValue(MineCommitsConfig.OPT_EXTENSION_L, MineCommitsConfig.DEFAULT_EXTENSION);
        if (!extension.startsWith(".")) {
            extension = "." + extension;
        }
        res.setExtension(extension);

        if (line.hasOption(MineCommitsConfig.OPT_TIMEOUT_L)) {
            res.setTimeoutSeconds(parsePositiveIntOrDie(line, MineCommitsConfig.OPT_TIMEOUT_L));
        }
        if (line.hasOption(MineCommitsConfig.OPT_CACHE_SAVE_INTERVAL_L)) {
            res.setCacheSaveInterval(parsePositiveIntOrDie(line, MineCommitsConfig.OPT_CACHE_SAVE_INTERVAL_L));
        }
        return res;
    }

    private static int parsePositiveIntOrDie(CommandLine line, String longOpt) {
        final String value = line.getOptionValue(longOpt);
        final int num;
        try {
            num = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new RuntimeException("Invalid value for option `--" + longOpt + "': Not a valid integer: " + value);
        }
        if (num < 1) {
            throw new RuntimeException("Invalid value for option `--" + longOpt + "': Must be an integer >= 1, got " + num);
        }
        return num;
    }

    private Options makeOptions() {
        Options options = new Options();
        // @formatter:off
        options.addOption(Option.builder(String.valueOf(MineCommitsConfig.OPT_HELP))
                .longOpt(MineCommitsConfig.OPT_HELP_L)
                .desc("print this help screen and exit")
                .build());
        options.addOption(Option.builder(String.valueOf(MineCommitsConfig.OPT_OUTPUT_DIR))
                .longOpt(MineCommitsConfig.OPT_OUTPUT_DIR_L)
                .desc("directory for the clone, the working trees and all results."
                        + " [Default=" + MineCommitsConfig.DEFAULT_OUTPUT_DIR_NAME + "]")
                .hasArg().argName("DIR").build());
        options.addOption(Option.builder(String.valueOf(MineCommitsConfig.OPT_RULESET))
                .longOpt(MineCommitsConfig.OPT_RULESET_L)
                .desc("PMD ruleset file. Required unless `--" + MineCommitsConfig.OPT_SUMMARIZE_ONLY_L + "' is given.")
                .hasArg().argName("FILE").build());
        options.addOption(Option.builder(String.valueOf(MineCommitsConfig.OPT_WORKERS))
                .longOpt(MineCommitsConfig.OPT_WORKERS_L)
                .desc("number of commits to process in parallel, each in its own working tree."
                        + " [Default=number of available processors]")
                .hasArg().argName("NUM").build());
        options.addOption(Option.builder(String.valueOf(MineCommitsConfig.OPT_AUX_CLASSPATH))
                .longOpt(MineCommitsConfig.OPT_AUX_CLASSPATH_L)
                .desc("auxiliary classpath for PMD's type resolution. May be given several times.")
                .hasArg().argName("CP").build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_PMD_L)
                .desc("name or path of the PMD executable. [Default=" + MineCommitsConfig.DEFAULT_PMD_PROG + "]")
                .hasArg().argName("PROG").build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_DAEMON_L)
                .desc("send analysis requests to the PMD daemon at this URL instead of running the PMD executable")
                .hasArg().argName("URL").build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_REF_L)
                .desc("branch, tag or commit whose history to mine. [Default=" + MineCommitsConfig.DEFAULT_REF + "]")
                .hasArg().argName("REF").build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_EXTENSION_L)
                .desc("extension of the files to analyze. [Default=" + MineCommitsConfig.DEFAULT_EXTENSION + "]")
                .hasArg().argName("EXT").build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_TIMEOUT_L)
                .desc("maximum time for analyzing one commit. [Default=" + MineCommitsConfig.DEFAULT_TIMEOUT_SECONDS + "]")
                .hasArg().argName("SECONDS").build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_CACHE_SAVE_INTERVAL_L)
                .desc("save the analysis cache after every NUM commits. [Default="
                        + MineCommitsConfig.DEFAULT_CACHE_SAVE_INTERVAL + "]")
                .hasArg().argName("NUM").build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_RETRY_FAILED_L)
                .desc("process commits that failed in an earlier run again")
                .build());
        options.addOption(Option.builder().longOpt(MineCommitsConfig.OPT_SUMMARIZE_ONLY_L)
                .desc("do not analyze anything, only regenerate `" + MineCommitsConfig.SUMMARY_FILE_NAME + "' and `"
                        + MineCommitsConfig.COMMITS_CSV_FILE_NAME + "' from the results in the output directory")
                .build());
        options.addOption(Option.builder(String.valueOf(MineCommitsConfig.OPT_VERBOSE))
                .longOpt(MineCommitsConfig.OPT_VERBOSE_L)
                .desc("log debug messages")
                .build());
        // @formatter:on
        return options;
    }

    private String progName() {
        return this.getClass().getSimpleName();
    }
}
