package de.ovgu.commitminer.changes;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of change resolution for one commit in its working tree.
 */
public class Resolution {
    private final List<String> eligibleFiles;
    private final SortedSet<String> changedFiles;
    private final boolean fullScan;

    Resolution(List<String> eligibleFiles, SortedSet<String> changedFiles, boolean fullScan) {
        this.eligibleFiles = Collections.unmodifiableList(eligibleFiles);
        this.changedFiles = Collections.unmodifiableSortedSet(changedFiles);
        this.fullScan = fullScan;
    }

    /**
     * @return All eligible files of the tree, sorted
     */
    public List<String> getEligibleFiles() {
        return eligibleFiles;
    }

    /**
     * @return The eligible files whose content may differ from the previous commit of the lineage.  On a full scan,
     * this equals {@link #getEligibleFiles()}.
     */
    public SortedSet<String> getChangedFiles() {
        return changedFiles;
    }

    public boolean isFullScan() {
        return fullScan;
    }

    @Override
    public String toString() {
        return (fullScan ? "full scan" : "incremental") + ", " + changedFiles.size() + "/" + eligibleFiles.size()
                + " files changed";
    }
}
