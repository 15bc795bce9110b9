package de.ovgu.commitminer.main;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Settings of a {@link MineCommits} run, and the locations of everything it reads and writes below the output
 * directory.
 */
public class MineCommitsConfig {
    public static final char OPT_HELP = 'h';
    public static final String OPT_HELP_L = "help";
    public static final char OPT_OUTPUT_DIR = 'o';
    public static final String OPT_OUTPUT_DIR_L = "output-dir";
    public static final char OPT_RULESET = 'r';
    public static final String OPT_RULESET_L = "ruleset";
    public static final char OPT_WORKERS = 'w';
    public static final String OPT_WORKERS_L = "workers";
    public static final char OPT_AUX_CLASSPATH = 'a';
    public static final String OPT_AUX_CLASSPATH_L = "aux-classpath";
    public static final String OPT_PMD_L = "pmd";
    public static final String OPT_DAEMON_L = "daemon";
    public static final String OPT_REF_L = "ref";
    public static final String OPT_EXTENSION_L = "extension";
    public static final String OPT_TIMEOUT_L = "timeout";
    public static final String OPT_CACHE_SAVE_INTERVAL_L = "cache-save-interval";
    public static final String OPT_RETRY_FAILED_L = "retry-failed";
    public static final String OPT_SUMMARIZE_ONLY_L = "summarize-only";
    public static final char OPT_VERBOSE = 'v';
    public static final String OPT_VERBOSE_L = "verbose";

    public static final String DEFAULT_OUTPUT_DIR_NAME = "analysis_results";
    public static final String DEFAULT_PMD_PROG = "pmd";
    public static final String DEFAULT_REF = "HEAD";
    public static final String DEFAULT_EXTENSION = ".java";
    public static final int DEFAULT_TIMEOUT_SECONDS = 600;
    public static final int DEFAULT_CACHE_SAVE_INTERVAL = 50;

    public static final String BASE_REPO_DIR_NAME = "repo_base";
    public static final String WORKTREES_DIR_NAME = "worktrees";
    public static final String RESULTS_DIR_NAME = "pmd_results";
    public static final String CACHE_FILE_NAME = "cache.json";
    public static final String SUMMARY_FILE_NAME = "summary.json";
    public static final String COMMITS_CSV_FILE_NAME = "commits.csv";

    private String repositoryLocation;
    private File outputDir = new File(DEFAULT_OUTPUT_DIR_NAME);
    private File ruleset = null;
    private int numberOfWorkers = Runtime.getRuntime().availableProcessors();
    private final List<String> auxClasspath = new ArrayList<>();
    private String pmdProg = DEFAULT_PMD_PROG;
    private Optional<String> daemonUrl = Optional.empty();
    private String ref = DEFAULT_REF;
    private String extension = DEFAULT_EXTENSION;
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    private int cacheSaveInterval = DEFAULT_CACHE_SAVE_INTERVAL;
    private boolean retryFailed = false;
    private boolean summarizeOnly = false;
    private boolean verbose = false;

    /**
     * @return URL or local path of the repository to mine, as given on the command line
     */
    public String getRepositoryLocation() {
        return repositoryLocation;
    }

    public void setRepositoryLocation(String repositoryLocation) {
        this.repositoryLocation = repositoryLocation;
    }

    public File getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(File outputDir) {
        this.outputDir = outputDir.getAbsoluteFile();
    }

    public File getRuleset() {
        return ruleset;
    }

    public void setRuleset(File ruleset) {
        this.ruleset = ruleset.getAbsoluteFile();
    }

    public int getNumberOfWorkers() {
        return numberOfWorkers;
    }

    public void setNumberOfWorkers(int numberOfWorkers) {
        this.numberOfWorkers = numberOfWorkers;
    }

    public List<String> getAuxClasspath() {
        return Collections.unmodifiableList(auxClasspath);
    }

    public void addAuxClasspath(String entry) {
        this.auxClasspath.add(entry);
    }

    /**
     * @return All auxiliary classpath entries joined with the platform's path separator
     */
    public String auxClasspathString() {
        return String.join(File.pathSeparator, auxClasspath);
    }

    public String getPmdProg() {
        return pmdProg;
    }

    public void setPmdProg(String pmdProg) {
        this.pmdProg = pmdProg;
    }

    public Optional<String> getDaemonUrl() {
        return daemonUrl;
    }

    public void setDaemonUrl(String daemonUrl) {
        this.daemonUrl = Optional.ofNullable(daemonUrl);
    }

    public String getRef() {
        return ref;
    }

    public void setRef(String ref) {
        this.ref = ref;
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        this.extension = extension;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long timeoutMillis() {
        return timeoutSeconds * 1000L;
    }

    public int getCacheSaveInterval() {
        return cacheSaveInterval;
    }

    public void setCacheSaveInterval(int cacheSaveInterval) {
        this.cacheSaveInterval = cacheSaveInterval;
    }

    public boolean isRetryFailed() {
        return retryFailed;
    }

    public void setRetryFailed(boolean retryFailed) {
        this.retryFailed = retryFailed;
    }

    public boolean isSummarizeOnly() {
        return summarizeOnly;
    }

    public void setSummarizeOnly(boolean summarizeOnly) {
        this.summarizeOnly = summarizeOnly;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public File baseRepoDir() {
        return new File(outputDir, BASE_REPO_DIR_NAME);
    }

    public File worktreesDir() {
        return new File(outputDir, WORKTREES_DIR_NAME);
    }

    public File resultsDir() {
        return new File(outputDir, RESULTS_DIR_NAME);
    }

    public File cacheFile() {
        return new File(outputDir, CACHE_FILE_NAME);
    }

    public File summaryFile() {
        return new File(outputDir, SUMMARY_FILE_NAME);
    }

    public File commitsCsvFile() {
        return new File(outputDir, COMMITS_CSV_FILE_NAME);
    }
}
