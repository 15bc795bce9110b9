package de.ovgu.commitminer.summary;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Statistics over all records of a result directory, as written to <code>summary.json</code>.
 */
@JsonPropertyOrder({"location", "stat_of_repository", "stat_of_warnings", "failure_causes"})
public class RunSummary {
    @JsonPropertyOrder({"total_commits_in_repo", "number_of_commits_analyzed_successfully", "number_of_commits_failed",
            "number_of_commits_skipped", "avg_of_num_java_files", "avg_of_num_warnings"})
    public static class RepositoryStats {
        @JsonProperty("total_commits_in_repo")
        private int totalCommits;
        @JsonProperty("number_of_commits_analyzed_successfully")
        private int successfulCommits;
        @JsonProperty("number_of_commits_failed")
        private int failedCommits;
        @JsonProperty("number_of_commits_skipped")
        private int skippedCommits;
        @JsonProperty("avg_of_num_java_files")
        private double averageFileCount;
        @JsonProperty("avg_of_num_warnings")
        private double averageViolationCount;

        public int getTotalCommits() {
            return totalCommits;
        }

        public void setTotalCommits(int totalCommits) {
            this.totalCommits = totalCommits;
        }

        public int getSuccessfulCommits() {
            return successfulCommits;
        }

        public void setSuccessfulCommits(int successfulCommits) {
            this.successfulCommits = successfulCommits;
        }

        public int getFailedCommits() {
            return failedCommits;
        }

        public void setFailedCommits(int failedCommits) {
            this.failedCommits = failedCommits;
        }

        /**
         * @return Commits of the history without any record, e.g., because the run was interrupted
         */
        public int getSkippedCommits() {
            return skippedCommits;
        }

        public void setSkippedCommits(int skippedCommits) {
            this.skippedCommits = skippedCommits;
        }

        public double getAverageFileCount() {
            return averageFileCount;
        }

        public void setAverageFileCount(double averageFileCount) {
            this.averageFileCount = averageFileCount;
        }

        public double getAverageViolationCount() {
            return averageViolationCount;
        }

        public void setAverageViolationCount(double averageViolationCount) {
            this.averageViolationCount = averageViolationCount;
        }
    }

    @JsonProperty("location")
    private String location;
    @JsonProperty("stat_of_repository")
    private RepositoryStats repositoryStats = new RepositoryStats();
    @JsonProperty("stat_of_warnings")
    private SortedMap<String, Long> violationsByRule = new TreeMap<>();
    @JsonProperty("failure_causes")
    private SortedMap<String, Integer> failureCauses = new TreeMap<>();

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public RepositoryStats getRepositoryStats() {
        return repositoryStats;
    }

    public void setRepositoryStats(RepositoryStats repositoryStats) {
        this.repositoryStats = repositoryStats;
    }

    /**
     * @return Total violations per rule, summed over all successfully analyzed commits
     */
    public SortedMap<String, Long> getViolationsByRule() {
        return violationsByRule;
    }

    public void setViolationsByRule(SortedMap<String, Long> violationsByRule) {
        this.violationsByRule = violationsByRule;
    }

    public SortedMap<String, Integer> getFailureCauses() {
        return failureCauses;
    }

    public void setFailureCauses(SortedMap<String, Integer> failureCauses) {
        this.failureCauses = failureCauses;
    }
}
