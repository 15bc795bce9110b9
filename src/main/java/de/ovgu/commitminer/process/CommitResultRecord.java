package de.ovgu.commitminer.process;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Persisted result of a successfully analyzed commit.  The findings cover every eligible file of the commit's tree,
 * whether it was analyzed for this commit or its findings came from the cache.
 */
@JsonPropertyOrder({"commit", "position", "slot", "status", "fileCount", "changedFileCount", "analyzedFileCount",
        "cachedFileCount", "violationCount", "violationsByRule", "violationsByFile", "fullScan", "durationMillis"})
public class CommitResultRecord {
    public static final String STATUS = "success";

    private String commit;
    private int position;
    private int slot;
    private String status = STATUS;
    private int fileCount;
    private int changedFileCount;
    private int analyzedFileCount;
    private int cachedFileCount;
    private int violationCount;
    private SortedMap<String, Integer> violationsByRule = new TreeMap<>();
    private SortedMap<String, Integer> violationsByFile = new TreeMap<>();
    private boolean fullScan;
    private long durationMillis;

    public String getCommit() {
        return commit;
    }

    public void setCommit(String commit) {
        this.commit = commit;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public int getSlot() {
        return slot;
    }

    public void setSlot(int slot) {
        this.slot = slot;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    /**
     * @return Number of eligible source files in the commit's tree
     */
    public int getFileCount() {
        return fileCount;
    }

    public void setFileCount(int fileCount) {
        this.fileCount = fileCount;
    }

    /**
     * @return Number of files whose content differed from the previous commit of the lineage (all files on a full
     * scan)
     */
    public int getChangedFileCount() {
        return changedFileCount;
    }

    public void setChangedFileCount(int changedFileCount) {
        this.changedFileCount = changedFileCount;
    }

    /**
     * @return Number of files passed to the analyzer
     */
    public int getAnalyzedFileCount() {
        return analyzedFileCount;
    }

    public void setAnalyzedFileCount(int analyzedFileCount) {
        this.analyzedFileCount = analyzedFileCount;
    }

    /**
     * @return Number of changed files whose findings were found in the cache
     */
    public int getCachedFileCount() {
        return cachedFileCount;
    }

    public void setCachedFileCount(int cachedFileCount) {
        this.cachedFileCount = cachedFileCount;
    }

    public int getViolationCount() {
        return violationCount;
    }

    public void setViolationCount(int violationCount) {
        this.violationCount = violationCount;
    }

    public SortedMap<String, Integer> getViolationsByRule() {
        return violationsByRule;
    }

    public void setViolationsByRule(SortedMap<String, Integer> violationsByRule) {
        this.violationsByRule = violationsByRule;
    }

    /**
     * @return Number of violations per file, for files with at least one violation
     */
    public SortedMap<String, Integer> getViolationsByFile() {
        return violationsByFile;
    }

    public void setViolationsByFile(SortedMap<String, Integer> violationsByFile) {
        this.violationsByFile = violationsByFile;
    }

    public boolean isFullScan() {
        return fullScan;
    }

    public void setFullScan(boolean fullScan) {
        this.fullScan = fullScan;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public void setDurationMillis(long durationMillis) {
        this.durationMillis = durationMillis;
    }
}
