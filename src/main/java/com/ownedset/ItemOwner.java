package com.ownedset;

/**
 * A handle whose lifetime controls membership of one entry in an {@link OwnedSet}.
 *
 * <p>The entry stays in the set while the handle is open. Closing the last
 * open handle of an entry removes it from the set. Handles are meant to be
 * used with try-with-resources or closed when the participant they stand for
 * goes away.</p>
 *
 * <p>Closing is idempotent: each handle counts as released once, no matter how
 * often or from how many threads {@link #close()} is called. Reading the value
 * through a released handle throws {@link ReleasedOwnerException}.</p>
 *
 * @param <T> the type of the owned value
 */
public interface ItemOwner<T> extends AutoCloseable {

    /**
     * @return the id of the owned entry; remains available after release
     */
    EntryId id();

    /**
     * Returns the owned value. The set keeps the value; the owner only
     * gives access to it.
     *
     * @return the owned value
     * @throws ReleasedOwnerException if this handle has been released
     */
    T value();

    /**
     * @return true once this handle has been closed or reclaimed
     */
    boolean isReleased();

    /**
     * Releases this handle. Removes the entry if this was its last owner.
     */
    @Override
    void close();
}
