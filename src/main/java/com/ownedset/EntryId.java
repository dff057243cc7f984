package com.ownedset;

/**
 * Opaque identity of an entry in an {@link OwnedSet}.
 *
 * Ids are taken from a per-set monotonic 64-bit counter, so no two entries
 * of the same set ever share an id, live or removed. Ids carry no meaning
 * beyond equality; they say nothing about the value they address.
 */
public final class EntryId {

    private final long sequence;

    EntryId(long sequence) {
        this.sequence = sequence;
    }

    long sequence() {
        return sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryId)) return false;
        return sequence == ((EntryId) o).sequence;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(sequence);
    }

    @Override
    public String toString() {
        return "EntryId[" + sequence + "]";
    }
}
