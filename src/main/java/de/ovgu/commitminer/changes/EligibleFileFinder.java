package de.ovgu.commitminer.changes;

import de.ovgu.commitminer.util.FileUtils;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;

/**
 * Finds the source files of a working tree that are subject to analysis: regular files whose names end in the
 * configured extension and that are not located below a hidden directory (<code>.git</code>, <code>.idea</code>, ...).
 */
public class EligibleFileFinder {
    private final String extension;

    public EligibleFileFinder(String extension) {
        if (extension == null || extension.isEmpty()) {
            throw new IllegalArgumentException("File extension must not be empty");
        }
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * @param relativePath A path relative to the root of a working tree, separated by <code>/</code>
     * @return <code>true</code> if a file at this path would be analyzed
     */
    public boolean isEligible(String relativePath) {
        if (!relativePath.endsWith(extension)) {
            return false;
        }
        String[] segments = relativePath.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (segments[i].startsWith(".")) {
                return false;
            }
        }
        return true;
    }

    /**
     * Return the eligible files below a starting directory.
     *
     * @param root The root of a working tree
     * @return Paths relative to <code>root</code>, separated by <code>/</code>, in lexicographic order
     */
    public List<String> find(File root) {
        if (!root.isDirectory())
            throw new IllegalArgumentException("Not a directory: " + root.getAbsolutePath());

        List<String> files = new ArrayList<>(1024);
        Stack<File> dirs = new Stack<>();
        dirs.push(root);

        while (!dirs.isEmpty()) {
            File[] entries = dirs.pop().listFiles();
            if (entries == null) continue;
            for (File file : entries) {
                if (file.isDirectory()) {
                    if (!file.getName().startsWith(".")) dirs.push(file);
                } else if (file.isFile() && file.getName().endsWith(extension)) {
                    files.add(FileUtils.pathRelativeTo(file, root));
                }
            }
        }

        Collections.sort(files);
        return files;
    }
}
