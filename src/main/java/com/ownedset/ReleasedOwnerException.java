package com.ownedset;

/**
 * Thrown when a handle is used after it has been released.
 *
 * This covers reading the value through a closed owner, taking the value
 * twice, and sharing an entry whose last owner is already gone. It is an
 * unchecked exception because it always signals a bug in the caller's
 * ownership discipline, not a condition to recover from.
 */
public class ReleasedOwnerException extends IllegalStateException {

    /** Id of the entry the released handle pointed at */
    private final EntryId entryId;

    /**
     * Creates a new ReleasedOwnerException.
     *
     * @param message description of the rejected operation
     * @param entryId id of the entry the handle referred to
     */
    public ReleasedOwnerException(String message, EntryId entryId) {
        super(message);
        this.entryId = entryId;
    }

    /**
     * @return the id of the entry the released handle referred to
     */
    public EntryId getEntryId() {
        return entryId;
    }
}
