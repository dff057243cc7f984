package com.ownedset;

/**
 * Lifecycle of an entry held by an {@link OwnedSet}.
 *
 * State transitions:
 * - INSERTED -> REMOVED: when the last owner of the entry is released
 *
 * There is no way back: a removed entry's id is never reused.
 */
public enum EntryState {
    /**
     * The entry is a member of the set. At least one owner is alive.
     */
    INSERTED,

    /**
     * The entry has left the set. Its id is permanently inert.
     */
    REMOVED
}
