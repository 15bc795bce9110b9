package de.ovgu.commitminer.pool;

import java.io.File;

/**
 * Exclusive use of one {@link WorkingTreeSlot}.  Closing the lease hands the slot back.
 */
public final class SlotLease implements AutoCloseable {
    private final WorkingTreeSlot slot;
    private boolean released = false;

    SlotLease(WorkingTreeSlot slot) {
        this.slot = slot;
    }

    public WorkingTreeSlot getSlot() {
        return slot;
    }

    public File getDirectory() {
        return slot.getDirectory();
    }

    public int getSlotIndex() {
        return slot.getIndex();
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            slot.lock().unlock();
        }
    }
}
