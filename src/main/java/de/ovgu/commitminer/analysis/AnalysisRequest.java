package de.ovgu.commitminer.analysis;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * What to analyze: a subset of the files of a working tree, under a ruleset.
 */
public final class AnalysisRequest {
    private final File root;
    private final File ruleset;
    private final String auxClasspath;
    private final List<String> files;

    /**
     * @param root         Root of the working tree
     * @param ruleset      The ruleset file
     * @param auxClasspath Auxiliary classpath for type resolution, may be empty
     * @param files        Paths relative to <code>root</code>, separated by <code>/</code>
     */
    public AnalysisRequest(File root, File ruleset, String auxClasspath, Collection<String> files) {
        this.root = root.getAbsoluteFile();
        this.ruleset = ruleset.getAbsoluteFile();
        this.auxClasspath = auxClasspath == null ? "" : auxClasspath;
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
    }

    public File getRoot() {
        return root;
    }

    public File getRuleset() {
        return ruleset;
    }

    public String getAuxClasspath() {
        return auxClasspath;
    }

    public List<String> getFiles() {
        return files;
    }

    @Override
    public String toString() {
        return files.size() + " files in " + root;
    }
}
