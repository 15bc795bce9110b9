package de.ovgu.commitminer.pool;

import de.ovgu.commitminer.vcs.Commit;

import java.io.File;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A numbered working tree of the pool.  The lock is held for the whole time a worker checks out a commit into the
 * tree and reads it back, since the checkout is not atomic with respect to a directory walk.
 */
public class WorkingTreeSlot {
    private final int index;
    private final File directory;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Commit currentCommit;

    WorkingTreeSlot(int index, File directory) {
        this.index = index;
        this.directory = directory;
    }

    public int getIndex() {
        return index;
    }

    public File getDirectory() {
        return directory;
    }

    /**
     * @return The commit whose tree was last checked out completely into this slot
     */
    public Optional<Commit> getCurrentCommit() {
        return Optional.ofNullable(currentCommit);
    }

    void setCurrentCommit(Commit currentCommit) {
        this.currentCommit = currentCommit;
    }

    ReentrantLock lock() {
        return lock;
    }

    boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    @Override
    public String toString() {
        return "slot " + index + " (" + directory.getName() + ")";
    }
}
