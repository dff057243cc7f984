package com.ownedset;

import java.lang.ref.Cleaner;

/**
 * Common state of the owner handles: the set, the entry, and the release gate.
 *
 * When the set has leak detection enabled, the release action is registered
 * with a shared {@link Cleaner}; closing the handle runs the action through
 * {@link Cleaner.Cleanable#clean()}, which also deregisters it.
 */
abstract class AbstractOwner<T> implements ItemOwner<T> {

    private static final class CleanerHolder {
        static final Cleaner CLEANER = Cleaner.create();
    }

    final OwnedSet<T> set;
    final OwnedSet.Entry<T> entry;
    final OwnerRelease<T> release;
    private final Cleaner.Cleanable cleanable;

    AbstractOwner(OwnedSet<T> set, OwnedSet.Entry<T> entry) {
        this.set = set;
        this.entry = entry;
        this.release = new OwnerRelease<>(set, entry);
        this.cleanable = set.getConfig().isLeakDetection()
            ? CleanerHolder.CLEANER.register(this, release)
            : null;
    }

    @Override
    public EntryId id() {
        return entry.id;
    }

    @Override
    public T value() {
        ensureOpen("read the value of");
        return entry.value;
    }

    @Override
    public boolean isReleased() {
        return release.isReleased();
    }

    @Override
    public void close() {
        releaseByOwner();
    }

    /**
     * Releases this handle on behalf of its holder.
     *
     * @return true if this call performed the release
     */
    boolean releaseByOwner() {
        release.markClosedByOwner();
        boolean performed = release.release();
        if (cleanable != null) {
            cleanable.clean();
        }
        return performed;
    }

    void ensureOpen(String operation) {
        if (release.isReleased()) {
            throw new ReleasedOwnerException(
                "Cannot " + operation + " a released owner of " + entry.id, entry.id);
        }
    }

    boolean belongsTo(OwnedSet<?> other) {
        return set == other;
    }

    /**
     * @return the lifecycle state of the owned entry
     */
    public EntryState entryState() {
        return entry.state();
    }
}
