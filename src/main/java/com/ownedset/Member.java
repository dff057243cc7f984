package com.ownedset;

import java.util.Objects;

/**
 * One element of an {@link OwnedSet#snapshot()}: a live entry's id paired
 * with its value, as seen when the snapshot was taken.
 *
 * @param <T> the type of the value
 */
public final class Member<T> {

    private final EntryId id;
    private final T value;

    Member(EntryId id, T value) {
        this.id = id;
        this.value = value;
    }

    public EntryId getId() {
        return id;
    }

    public T getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Member)) return false;
        Member<?> other = (Member<?>) o;
        return id.equals(other.id) && value == other.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, System.identityHashCode(value));
    }

    @Override
    public String toString() {
        return "Member[id=" + id + ", value=" + value + "]";
    }
}
