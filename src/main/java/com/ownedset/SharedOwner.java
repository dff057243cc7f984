package com.ownedset;

/**
 * One of possibly many owners of an entry in an {@link OwnedSet}.
 *
 * <p>{@link #share()} creates another owner for the same entry. The entry is
 * removed when every owner created this way has been closed. Owners are
 * counted per entry with an atomic counter; closing one handle twice still
 * counts once.</p>
 *
 * @param <T> the type of the owned value
 */
public final class SharedOwner<T> extends AbstractOwner<T> {

    SharedOwner(OwnedSet<T> set, OwnedSet.Entry<T> entry) {
        super(set, entry);
    }

    /**
     * Creates another owner of the same entry.
     *
     * @return a new, independently closeable owner
     * @throws ReleasedOwnerException if this owner has been released, or the
     *         entry lost its last owner concurrently
     */
    public SharedOwner<T> share() {
        ensureOpen("share");
        // The count can reach zero between the check above and here if another
        // thread closes this very handle; tryAcquire refuses to revive it.
        if (!entry.tryAcquire()) {
            throw new ReleasedOwnerException("Cannot share " + entry.id + ": its last owner was released", entry.id);
        }
        return new SharedOwner<>(set, entry);
    }

    /**
     * Returns the number of open owners of this entry. Informational only:
     * the value may change as soon as it is returned.
     *
     * @return the current number of owners
     */
    public int ownerCount() {
        return entry.ownerCount();
    }

    @Override
    public String toString() {
        return "SharedOwner[" + entry.id + ", owners=" + ownerCount() + (isReleased() ? ", released]" : "]");
    }
}
