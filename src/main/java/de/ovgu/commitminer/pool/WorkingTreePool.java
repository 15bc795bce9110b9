package de.ovgu.commitminer.pool;

import de.ovgu.commitminer.util.RetryPolicy;
import de.ovgu.commitminer.vcs.Commit;
import de.ovgu.commitminer.vcs.VersionControl;
import de.ovgu.commitminer.vcs.VersionControlException;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.FilenameFilter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * <p>A fixed number of independent working trees of the same repository, <code>wt_0</code> ...
 * <code>wt_(N-1)</code> below a common directory.</p> <ol> <li>{@link #initialize(Commit)} clears slot directories
 * left over by a previous, interrupted run and creates one linked worktree per slot,</li> <li>workers
 * {@link #acquire(int) acquire} a slot, {@link #checkout(SlotLease, Commit) check out} their commit into it and hand
 * it back by closing the lease,</li> <li>{@link #close()} deregisters and deletes all slots.</li> </ol>
 */
public class WorkingTreePool implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(WorkingTreePool.class);

    public static final String SLOT_DIR_PREFIX = "wt_";

    static final List<String> LOCK_FILE_NAMES = Collections.unmodifiableList(Arrays.asList("index.lock", "HEAD.lock"));

    private static final FilenameFilter SLOT_DIR_NAME_FILTER = new FilenameFilter() {
        private final Pattern SLOT_DIR_NAME_PATTERN = Pattern.compile(Pattern.quote(SLOT_DIR_PREFIX) + "\\d+");

        @Override
        public boolean accept(File dir, String name) {
            return SLOT_DIR_NAME_PATTERN.matcher(name).matches();
        }
    };

    private final VersionControl vcs;
    private final File worktreesDir;
    private final int size;
    private final RetryPolicy checkoutRetryPolicy;
    private final List<WorkingTreeSlot> slots = new ArrayList<>();

    public WorkingTreePool(VersionControl vcs, File worktreesDir, int size, RetryPolicy checkoutRetryPolicy) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + size);
        }
        this.vcs = vcs;
        this.worktreesDir = worktreesDir.getAbsoluteFile();
        this.size = size;
        this.checkoutRetryPolicy = checkoutRetryPolicy;
    }

    /**
     * Remove stale slot directories and create all slots, each checked out at <code>initialCommit</code>.
     *
     * @throws VersionControlException if a worktree cannot be created
     * @throws IllegalStateException   if a stale slot directory cannot be removed
     */
    public synchronized void initialize(Commit initialCommit) {
        if (!slots.isEmpty()) {
            throw new IllegalStateException("Pool already initialized");
        }
        if (!worktreesDir.isDirectory() && !worktreesDir.mkdirs()) {
            throw new IllegalStateException("Failed to create worktree directory " + worktreesDir);
        }
        removeStaleSlotDirectories();

        for (int i = 0; i < size; i++) {
            File slotDir = new File(worktreesDir, SLOT_DIR_PREFIX + i);
            LOG.info("Creating worktree " + i + " at " + slotDir + " linked to " + initialCommit.shortId());
            vcs.addWorktree(slotDir, initialCommit.getId());
            WorkingTreeSlot slot = new WorkingTreeSlot(i, slotDir);
            slot.setCurrentCommit(initialCommit);
            slots.add(slot);
        }
    }

    private void removeStaleSlotDirectories() {
        String[] names = worktreesDir.list(SLOT_DIR_NAME_FILTER);
        if (names == null || names.length == 0) return;

        List<File> dirsThatCouldNotBeDeleted = new ArrayList<>();
        for (String name : new TreeSet<>(Arrays.asList(names))) {
            File staleDir = new File(worktreesDir, name);
            LOG.warn("Worktree directory " + staleDir + " already exists. Removing it.");
            if (!deleteSlotDirectory(staleDir)) {
                dirsThatCouldNotBeDeleted.add(staleDir);
            }
        }
        pruneQuietly();

        if (!dirsThatCouldNotBeDeleted.isEmpty()) {
            throw new IllegalStateException("Some stale worktree directories could not be deleted: " + dirsThatCouldNotBeDeleted);
        }
    }

    /**
     * @return <code>true</code> if the directory is gone afterwards
     */
    private boolean deleteSlotDirectory(File slotDir) {
        try {
            vcs.removeWorktree(slotDir);
        } catch (VersionControlException e) {
            LOG.debug("Could not deregister worktree " + slotDir + ": " + e.getMessage());
        }
        if (slotDir.exists()) {
            try {
                org.apache.commons.io.FileUtils.deleteDirectory(slotDir);
            } catch (IOException e) {
                LOG.error("Failed to delete worktree directory " + slotDir, e);
            }
        }
        return !slotDir.exists();
    }

    private void pruneQuietly() {
        try {
            vcs.pruneWorktrees();
        } catch (VersionControlException e) {
            LOG.warn("Pruning worktree registrations failed: " + e.getMessage());
        }
    }

    public int size() {
        return size;
    }

    /**
     * @return A snapshot of the slots created so far
     */
    public synchronized List<WorkingTreeSlot> getSlots() {
        return new ArrayList<>(slots);
    }

    private synchronized WorkingTreeSlot slot(int slotIndex) {
        if (slotIndex < 0 || slotIndex >= slots.size()) {
            throw new IllegalArgumentException("No such slot: " + slotIndex + " (pool has " + slots.size() + " slots)");
        }
        return slots.get(slotIndex);
    }

    /**
     * Block until the slot is free and take exclusive use of it.
     */
    public SlotLease acquire(int slotIndex) {
        WorkingTreeSlot slot = slot(slotIndex);
        slot.lock().lock();
        return new SlotLease(slot);
    }

    public void checkout(int slotIndex, Commit commit) {
        WorkingTreeSlot slot = slot(slotIndex);
        if (!slot.isHeldByCurrentThread()) {
            throw new IllegalStateException("Checkout into " + slot + " without holding it");
        }
        doCheckout(slot, commit);
    }

    /**
     * Overwrite the tree of the leased slot with <code>commit</code>.  Failed attempts are retried after removing
     * lock files a crashed git process may have left behind.  If all attempts fail, the slot is reset to the commit it
     * held before and a {@link CheckoutException} is thrown.
     */
    public void checkout(SlotLease lease, Commit commit) {
        checkout(lease.getSlotIndex(), commit);
    }

    private void doCheckout(WorkingTreeSlot slot, Commit commit) {
        final File dir = slot.getDirectory();
        try {
            checkoutRetryPolicy.run("checkout of " + commit.shortId() + " into " + slot,
                    () -> vcs.checkout(dir, commit.getId()),
                    e -> e instanceof VersionControlException,
                    e -> removeStaleLockFiles(slot));
        } catch (RuntimeException e) {
            restoreAfterFailedCheckout(slot);
            throw new CheckoutException("Git checkout failed for " + commit.shortId() + " in " + slot + ": " + e.getMessage(), e);
        }
        slot.setCurrentCommit(commit);
        LOG.debug("Checked out " + commit.shortId() + " in " + dir.getName());
    }

    private void restoreAfterFailedCheckout(WorkingTreeSlot slot) {
        try {
            vcs.resetWorkTree(slot.getDirectory());
        } catch (VersionControlException e) {
            LOG.warn("Could not restore " + slot + " after failed checkout: " + e.getMessage());
            slot.setCurrentCommit(null);
        }
    }

    /**
     * Discard all modifications and untracked files in the leased slot, e.g., artifacts of a failed analysis.
     *
     * @throws VersionControlException if resetting fails
     */
    public void reset(SlotLease lease) {
        WorkingTreeSlot slot = lease.getSlot();
        if (!slot.isHeldByCurrentThread()) {
            throw new IllegalStateException("Reset of " + slot + " without holding it");
        }
        LOG.debug("Resetting " + slot);
        vcs.resetWorkTree(slot.getDirectory());
    }

    void removeStaleLockFiles(WorkingTreeSlot slot) {
        File gitDir = gitDirOf(slot.getDirectory());
        if (gitDir == null) return;
        for (String lockFileName : LOCK_FILE_NAMES) {
            File lockFile = new File(gitDir, lockFileName);
            if (lockFile.exists()) {
                LOG.warn("Removing stale lock file " + lockFile);
                if (!lockFile.delete()) {
                    LOG.warn("Failed to delete lock file " + lockFile);
                }
            }
        }
    }

    /**
     * The git directory of a working tree: <code>.git</code> itself for a main working tree, or the directory named
     * in the <code>.git</code> file of a linked worktree.
     */
    static File gitDirOf(File workTree) {
        File dotGit = new File(workTree, ".git");
        if (dotGit.isDirectory()) {
            return dotGit;
        }
        if (!dotGit.isFile()) {
            return null;
        }
        try {
            String content = new String(Files.readAllBytes(dotGit.toPath()), StandardCharsets.UTF_8).trim();
            if (!content.startsWith("gitdir:")) {
                return null;
            }
            File gitDir = new File(content.substring("gitdir:".length()).trim());
            return gitDir.isAbsolute() ? gitDir : new File(workTree, gitDir.getPath());
        } catch (IOException e) {
            LOG.warn("Could not read " + dotGit, e);
            return null;
        }
    }

    /**
     * Deregister and delete all slots.  Problems are logged; teardown continues with the remaining slots.
     */
    @Override
    public synchronized void close() {
        if (slots.isEmpty()) return;
        LOG.info("Cleaning up worktrees...");
        for (WorkingTreeSlot slot : slots) {
            if (slot.lock().isLocked() && !slot.isHeldByCurrentThread()) {
                LOG.warn(slot + " is still in use. Removing it anyway.");
            }
            LOG.debug("Removing worktree " + slot.getDirectory().getName());
            if (!deleteSlotDirectory(slot.getDirectory())) {
                LOG.warn("Could not remove worktree " + slot.getDirectory() + ". Manual cleanup might be required.");
            }
        }
        slots.clear();
        pruneQuietly();
        LOG.info("Worktree cleanup finished.");
    }
}
