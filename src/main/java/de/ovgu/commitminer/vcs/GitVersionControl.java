package de.ovgu.commitminer.vcs;

import de.ovgu.commitminer.util.ExternalCommand;
import de.ovgu.commitminer.util.ExternalCommandException;
import org.apache.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.RawTextComparator;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevSort;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.util.io.DisabledOutputStream;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link VersionControl} for git.  History and diffs are read through JGit from the base repository, which is never
 * modified after it has been cloned or fetched.  Everything that writes to a working tree runs the <code>git</code>
 * executable, since JGit has no support for linked worktrees.
 */
public class GitVersionControl implements VersionControl, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(GitVersionControl.class);

    public static final String GIT_PROG = "git";
    static final String ORIGIN = "origin";
    public static final long DEFAULT_GIT_TIMEOUT_MILLIS = 30L * 60L * 1000L;

    private final File baseRepoDir;
    private final Git git;
    private final Repository repo;
    private final long gitTimeoutMillis;

    public GitVersionControl(File baseRepoDir) {
        this(baseRepoDir, DEFAULT_GIT_TIMEOUT_MILLIS);
    }

    public GitVersionControl(File baseRepoDir, long gitTimeoutMillis) {
        this.baseRepoDir = baseRepoDir.getAbsoluteFile();
        this.gitTimeoutMillis = gitTimeoutMillis;
        try {
            this.git = Git.open(this.baseRepoDir);
        } catch (IOException ioe) {
            throw new VersionControlException("Failed to open repository " + this.baseRepoDir, ioe);
        }
        this.repo = git.getRepository();
    }

    /**
     * Clone the repository at <code>location</code> (URL or local path) into <code>baseRepoDir</code>, or, if a
     * clone already exists there, fetch all updates into it.  Fetching also resets the local branches to their
     * counterparts in <code>origin</code>, so that refs such as <code>HEAD</code> name the current history.
     *
     * @throws VersionControlException if cloning or fetching fails
     */
    public static void cloneOrFetch(String location, File baseRepoDir) {
        File absBaseDir = baseRepoDir.getAbsoluteFile();
        try {
            if (new File(absBaseDir, ".git").isDirectory()) {
                LOG.info("Base repository exists at " + absBaseDir + ". Fetching updates...");
                ExternalCommand.of(GIT_PROG, "fetch", "--all", "--prune").in(absBaseDir).runOrFail();
                // Moves the local branches, HEAD's included, to the fetched state
                ExternalCommand.of(GIT_PROG, "fetch", "--update-head-ok", ORIGIN, "+refs/heads/*:refs/heads/*")
                        .in(absBaseDir).runOrFail();
                LOG.info("Fetch complete.");
            } else {
                LOG.info("Cloning repository from " + location + " to " + absBaseDir + " ...");
                File parent = absBaseDir.getParentFile();
                if (!parent.isDirectory() && !parent.mkdirs()) {
                    throw new VersionControlException("Failed to create directory " + parent);
                }
                ExternalCommand.of(GIT_PROG, "clone", "--no-checkout", location, absBaseDir.getPath()).in(parent).runOrFail();
                LOG.info("Base repository cloned successfully.");
            }
        } catch (ExternalCommandException e) {
            throw new VersionControlException("Failed to clone or fetch " + location + " into " + absBaseDir, e);
        }
    }

    @Override
    public List<Commit> listCommits(String ref) {
        try (RevWalk rw = new RevWalk(repo)) {
            rw.markStart(rw.parseCommit(resolveOrDie(ref)));
            rw.sort(RevSort.TOPO);
            rw.sort(RevSort.COMMIT_TIME_DESC, true);
            List<String> newestFirst = new ArrayList<>();
            for (RevCommit c : rw) {
                newestFirst.add(c.getName());
            }
            Collections.reverse(newestFirst);
            List<Commit> result = new ArrayList<>(newestFirst.size());
            for (int i = 0; i < newestFirst.size(); i++) {
                result.add(new Commit(newestFirst.get(i), i));
            }
            return result;
        } catch (IOException ioe) {
            throw new VersionControlException("Error listing commits of " + ref + " in " + baseRepoDir, ioe);
        }
    }

    @Override
    public List<ChangedPath> diff(String fromCommitId, String toCommitId) {
        try (RevWalk rw = new RevWalk(repo);
             DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            RevCommit from = rw.parseCommit(resolveOrDie(fromCommitId));
            RevCommit to = rw.parseCommit(resolveOrDie(toCommitId));
            formatter.setRepository(repo);
            formatter.setDiffComparator(RawTextComparator.DEFAULT);
            formatter.setDetectRenames(true);
            List<DiffEntry> entries = formatter.scan(from.getTree(), to.getTree());
            List<ChangedPath> result = new ArrayList<>(entries.size());
            for (DiffEntry e : entries) {
                result.add(new ChangedPath(toChangeType(e.getChangeType()), e.getOldPath(), e.getNewPath()));
            }
            return result;
        } catch (IOException ioe) {
            throw new VersionControlException("I/O exception computing diff " + fromCommitId + " ... " + toCommitId, ioe);
        }
    }

    private static ChangedPath.ChangeType toChangeType(DiffEntry.ChangeType changeType) {
        switch (changeType) {
            case ADD:
                return ChangedPath.ChangeType.ADD;
            case MODIFY:
                return ChangedPath.ChangeType.MODIFY;
            case DELETE:
                return ChangedPath.ChangeType.DELETE;
            case RENAME:
                return ChangedPath.ChangeType.RENAME;
            case COPY:
                return ChangedPath.ChangeType.COPY;
            default:
                throw new IllegalArgumentException("Unknown change type: " + changeType);
        }
    }

    private ObjectId resolveOrDie(String revision) throws IOException {
        final ObjectId id;
        try {
            id = repo.resolve(revision + "^{commit}");
        } catch (RevisionSyntaxException e) {
            throw new VersionControlException("Invalid revision " + revision, e);
        }
        if (id == null) {
            throw new VersionControlException("Unknown revision " + revision + " in " + baseRepoDir);
        }
        return id;
    }

    @Override
    public void checkout(File workTree, String commitId) {
        runGit(workTree, "checkout", "--force", "--quiet", "--detach", commitId);
    }

    @Override
    public void resetWorkTree(File workTree) {
        runGit(workTree, "reset", "--hard", "--quiet", "HEAD");
        runGit(workTree, "clean", "-f", "-d", "-x", "-q");
    }

    @Override
    public void addWorktree(File path, String commitId) {
        runGit(baseRepoDir, "worktree", "add", "--detach", "--force", path.getAbsolutePath(), commitId);
    }

    @Override
    public void removeWorktree(File path) {
        // Double force also removes locked worktrees
        runGit(baseRepoDir, "worktree", "remove", "--force", "--force", path.getAbsolutePath());
    }

    @Override
    public void pruneWorktrees() {
        runGit(baseRepoDir, "worktree", "prune");
    }

    private void runGit(File wd, String... args) {
        try {
            ExternalCommand.of(GIT_PROG, args).in(wd).withTimeout(gitTimeoutMillis).runOrFail();
        } catch (ExternalCommandException e) {
            throw new VersionControlException(e.getMessage(), e);
        }
    }

    public File getBaseRepoDir() {
        return baseRepoDir;
    }

    @Override
    public void close() {
        try {
            repo.close();
        } finally {
            git.close();
        }
    }
}
