package de.ovgu.commitminer.vcs;

import java.io.File;
import java.util.List;

/**
 * The operations the miner needs from the version-control system.  Read-only operations ({@link #listCommits},
 * {@link #diff}) may be called from several threads at once.  Operations on a working tree are only ever called by the
 * thread that owns that tree.
 */
public interface VersionControl {
    /**
     * @param ref Branch, tag or commit whose history to list
     * @return All commits reachable from <code>ref</code>, oldest first, numbered by their position in that order
     * @throws VersionControlException if the ref cannot be resolved or the history cannot be read
     */
    List<Commit> listCommits(String ref);

    /**
     * Changes between two commits, from <code>fromCommitId</code> to <code>toCommitId</code>.
     *
     * @throws VersionControlException if a commit cannot be resolved or its tree cannot be read
     */
    List<ChangedPath> diff(String fromCommitId, String toCommitId);

    /**
     * Overwrite the given working tree with the contents of the given commit, discarding local modifications.
     *
     * @throws VersionControlException on failure
     */
    void checkout(File workTree, String commitId);

    /**
     * Discard every modification and every untracked file in the given working tree.
     *
     * @throws VersionControlException on failure
     */
    void resetWorkTree(File workTree);

    /**
     * Create an additional working tree of the repository at <code>path</code> with a detached HEAD at
     * <code>commitId</code>.
     */
    void addWorktree(File path, String commitId);

    /**
     * Deregister the working tree at <code>path</code> and remove it, even if it is dirty or locked.
     */
    void removeWorktree(File path);

    /**
     * Forget working trees whose directories no longer exist.
     */
    void pruneWorktrees();
}
