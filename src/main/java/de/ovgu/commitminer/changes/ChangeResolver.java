package de.ovgu.commitminer.changes;

import de.ovgu.commitminer.vcs.ChangedPath;
import de.ovgu.commitminer.vcs.Commit;
import de.ovgu.commitminer.vcs.VersionControl;
import org.apache.log4j.Logger;

import java.io.File;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Determines which source files have to be looked at for a commit, given the commit processed before it in the same
 * working tree.  Without a predecessor, every eligible file of the tree is a candidate.
 */
public class ChangeResolver {
    private static final Logger LOG = Logger.getLogger(ChangeResolver.class);

    private final VersionControl vcs;
    private final EligibleFileFinder fileFinder;

    public ChangeResolver(VersionControl vcs, EligibleFileFinder fileFinder) {
        this.vcs = vcs;
        this.fileFinder = fileFinder;
    }

    public SortedSet<String> changedFiles(Optional<Commit> previous, Commit current, File workTree) {
        return resolve(previous, current, workTree).getChangedFiles();
    }

    /**
     * @param previous The commit last processed in <code>workTree</code>, if any
     * @param current  The commit currently checked out in <code>workTree</code>
     * @param workTree Root of the working tree
     * @throws de.ovgu.commitminer.vcs.VersionControlException if the diff cannot be computed
     */
    public Resolution resolve(Optional<Commit> previous, Commit current, File workTree) {
        List<String> eligibleFiles = fileFinder.find(workTree);
        if (!previous.isPresent()) {
            return new Resolution(eligibleFiles, new TreeSet<>(eligibleFiles), true);
        }

        Commit prev = previous.get();
        Set<String> eligibleFileSet = new HashSet<>(eligibleFiles);
        SortedSet<String> changed = new TreeSet<>();
        for (ChangedPath change : vcs.diff(prev.getId(), current.getId())) {
            if (!change.getChangeType().producesNewContent()) continue;
            String path = change.getNewPath();
            if (!path.endsWith(fileFinder.getExtension())) continue;
            if (!new File(workTree, path).isFile()) {
                LOG.warn("File " + path + " changed between " + prev.shortId() + " and " + current.shortId()
                        + " but is missing from " + workTree + ". Ignoring it.");
                continue;
            }
            if (!eligibleFileSet.contains(path)) {
                LOG.debug("Ignoring changed file " + path + " in hidden directory.");
                continue;
            }
            changed.add(path);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Changes " + prev.shortId() + " ... " + current.shortId() + ": " + changed);
        }
        return new Resolution(eligibleFiles, changed, false);
    }
}
