package com.ownedset;

/**
 * The only owner of an entry in an {@link OwnedSet}.
 *
 * <p>A unique owner cannot be duplicated. It may be handed to another thread;
 * whichever thread closes it removes the entry.</p>
 *
 * @param <T> the type of the owned value
 */
public final class UniqueOwner<T> extends AbstractOwner<T> {

    UniqueOwner(OwnedSet<T> set, OwnedSet.Entry<T> entry) {
        super(set, entry);
    }

    /**
     * Removes the entry from the set and returns its value.
     * The owner is released afterwards.
     *
     * @return the value that was owned
     * @throws ReleasedOwnerException if this owner has already been released
     */
    public T take() {
        if (!releaseByOwner()) {
            throw new ReleasedOwnerException("Cannot take the value of a released owner of " + entry.id, entry.id);
        }
        return entry.value;
    }

    @Override
    public String toString() {
        return "UniqueOwner[" + entry.id + (isReleased() ? ", released]" : "]");
    }
}
