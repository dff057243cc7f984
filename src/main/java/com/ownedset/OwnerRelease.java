package com.ownedset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Release action of a single owner handle.
 *
 * Runs at most once, either from {@link ItemOwner#close()} or from the cleaner
 * when the handle was dropped without being closed. It must not reference the
 * handle itself, otherwise the handle could never become unreachable.
 */
final class OwnerRelease<T> implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(OwnerRelease.class);

    private final OwnedSet<T> set;
    private final OwnedSet.Entry<T> entry;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean closedByOwner;

    OwnerRelease(OwnedSet<T> set, OwnedSet.Entry<T> entry) {
        this.set = set;
        this.entry = entry;
    }

    /**
     * Marks the release as requested by the handle, so the cleaner does not
     * report it as a leak.
     */
    void markClosedByOwner() {
        closedByOwner = true;
    }

    /**
     * Releases the owner if nobody did so before.
     *
     * @return true if this call performed the release
     */
    boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        if (!closedByOwner) {
            LOG.warn("{}: owner of {} was reclaimed without being closed", set.getName(), entry.id);
        }
        set.releaseOwner(entry);
        return true;
    }

    boolean isReleased() {
        return released.get();
    }

    @Override
    public void run() {
        release();
    }
}
