package com.ownedset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A thread-safe set whose members are owned by handles.
 *
 * <h2>Overview</h2>
 * {@link #insert(Object)} stores a value and returns an {@link ItemOwner}.
 * The value stays in the set for exactly as long as its owner is open; closing
 * the owner removes the value. There is no public remove operation. This makes
 * the set a natural registry for subscribers, connected clients or listeners:
 * whoever registered holds the handle, and membership ends when the handle does.
 *
 * <h2>Ownership modes</h2>
 * <ul>
 *   <li><b>Unique:</b> {@link #insert(Object)} returns a {@link UniqueOwner}.
 *       It can be handed to another thread but not duplicated.</li>
 *   <li><b>Shared:</b> {@link #insertShared(Object)} returns a {@link SharedOwner}.
 *       {@link SharedOwner#share()} creates further handles for the same entry;
 *       the entry is removed when the last of them is closed.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * The map of live entries is guarded by a {@link ReentrantReadWriteLock}. The
 * lock is held only while the map itself is read or mutated, never while user
 * code runs: iteration works on a copy taken under the read lock. Owner counts
 * live in each entry as an {@link AtomicInteger}, so sharing and releasing a
 * handle touch the lock only when the count drops to zero.
 *
 * <h2>Usage Example</h2>
 * <pre>
 * OwnedSet&lt;Subscriber&gt; subscribers = new OwnedSet&lt;&gt;();
 *
 * try (UniqueOwner&lt;Subscriber&gt; registration = subscribers.insert(subscriber)) {
 *     // subscriber receives broadcasts while this block runs
 *     for (Subscriber s : subscribers) {
 *         s.deliver(message);
 *     }
 * }
 * // subscriber is no longer a member
 * </pre>
 *
 * @param <T> the type of values held by the set
 */
public class OwnedSet<T> implements Iterable<T> {

    private static final Logger LOG = LoggerFactory.getLogger(OwnedSet.class);

    /**
     * Storage cell for one inserted value. The set owns the value for the
     * entry's whole life; owners only point at it.
     */
    static final class Entry<T> {
        final EntryId id;
        final T value;

        /** Number of open owners. Starts at one and never moves off zero. */
        private final AtomicInteger owners = new AtomicInteger(1);

        /** Written under the set's write lock */
        private volatile EntryState state = EntryState.INSERTED;

        Entry(EntryId id, T value) {
            this.id = id;
            this.value = value;
        }

        /**
         * Registers one more owner, unless the count has already reached zero.
         *
         * @return false if the entry has no owners left
         */
        boolean tryAcquire() {
            while (true) {
                int current = owners.get();
                if (current == 0) {
                    return false;
                }
                if (owners.compareAndSet(current, current + 1)) {
                    return true;
                }
                // CAS failed - another owner was shared or released, retry
            }
        }

        /**
         * Drops one owner.
         *
         * @return the number of owners left
         */
        int releaseOne() {
            int remaining = owners.decrementAndGet();
            if (remaining < 0) {
                throw new IllegalStateException("Owner count of " + id + " dropped below zero");
            }
            return remaining;
        }

        int ownerCount() {
            return owners.get();
        }

        EntryState state() {
            return state;
        }
    }

    private final OwnedSetConfig config;
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<EntryId, Entry<T>> entries;

    /**
     * Creates an empty set with default configuration.
     */
    public OwnedSet() {
        this(OwnedSetConfig.defaults());
    }

    /**
     * Creates an empty set with the given configuration.
     *
     * @param config the set configuration
     * @throws NullPointerException if config is null
     */
    public OwnedSet(OwnedSetConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.entries = new LinkedHashMap<>(config.getInitialCapacity());
    }

    /**
     * Adds a value to the set and returns its only owner.
     * Closing the owner removes the value.
     *
     * @param value the value to add
     * @return the owner of the new entry
     * @throws NullPointerException if value is null
     */
    public UniqueOwner<T> insert(T value) {
        return new UniqueOwner<>(this, add(value));
    }

    /**
     * Adds a value to the set and returns a shareable owner.
     * The value is removed once the returned owner and every owner
     * obtained from it through {@link SharedOwner#share()} are closed.
     *
     * @param value the value to add
     * @return the first owner of the new entry
     * @throws NullPointerException if value is null
     */
    public SharedOwner<T> insertShared(T value) {
        return new SharedOwner<>(this, add(value));
    }

    private Entry<T> add(T value) {
        Objects.requireNonNull(value, "Null values are not supported");

        Entry<T> entry = new Entry<>(new EntryId(sequence.incrementAndGet()), value);
        lock.writeLock().lock();
        try {
            entries.put(entry.id, entry);
        } finally {
            lock.writeLock().unlock();
        }

        LOG.debug("{}: inserted {}", config.getName(), entry.id);
        return entry;
    }

    /**
     * Called by an owner when it is released. Removes the entry when
     * no owners remain.
     */
    void releaseOwner(Entry<T> entry) {
        if (entry.releaseOne() == 0) {
            remove(entry.id);
        }
    }

    /**
     * Removes the entry with the given id. Safe to call for an id that is
     * already gone; the second call simply reports that nothing was removed.
     *
     * @param id the id of the entry to remove
     * @return true if an entry was removed
     */
    boolean remove(EntryId id) {
        Entry<T> removed;
        lock.writeLock().lock();
        try {
            removed = entries.remove(id);
            if (removed != null) {
                removed.state = EntryState.REMOVED;
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (removed == null) {
            LOG.debug("{}: {} already removed", config.getName(), id);
            return false;
        }
        LOG.debug("{}: removed {}", config.getName(), id);
        return true;
    }

    /**
     * Returns a point-in-time copy of the live entries.
     *
     * <p>The copy is taken under the read lock and does not change afterwards.
     * Entries removed while the caller walks it are still present in the copy;
     * entries removed before it was taken are not. Each id appears at most once.
     * Order is unspecified.</p>
     *
     * @return an unmodifiable list of the members live at the time of the call
     */
    public List<Member<T>> snapshot() {
        lock.readLock().lock();
        try {
            List<Member<T>> members = new ArrayList<>(entries.size());
            for (Entry<T> entry : entries.values()) {
                members.add(new Member<>(entry.id, entry.value));
            }
            return Collections.unmodifiableList(members);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a point-in-time copy of the live values, leaving out the value
     * owned by {@code except}. Useful to broadcast to every member but the sender.
     *
     * <p>If {@code except} belongs to another set or has been released, all
     * live values are returned.</p>
     *
     * @param except the owner whose value to leave out
     * @return an unmodifiable list of the other live values
     * @throws NullPointerException if except is null
     */
    public List<T> others(ItemOwner<?> except) {
        Objects.requireNonNull(except, "except must not be null");
        EntryId skip = ownsEntry(except) ? except.id() : null;

        lock.readLock().lock();
        try {
            List<T> values = new ArrayList<>(entries.size());
            for (Entry<T> entry : entries.values()) {
                if (!entry.id.equals(skip)) {
                    values.add(entry.value);
                }
            }
            return Collections.unmodifiableList(values);
        } finally {
            lock.readLock().unlock();
        }
    }

    private boolean ownsEntry(ItemOwner<?> owner) {
        return owner instanceof AbstractOwner
            && ((AbstractOwner<?>) owner).belongsTo(this)
            && !owner.isReleased();
    }

    /**
     * Returns an iterator over a snapshot of the live values.
     * The iterator does not support {@code remove()}; membership is
     * controlled by owners only.
     *
     * @return an iterator over the values live at the time of the call
     */
    @Override
    public Iterator<T> iterator() {
        List<Member<T>> members = snapshot();
        return new Iterator<T>() {
            private final Iterator<Member<T>> delegate = members.iterator();

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public T next() {
                return delegate.next().getValue();
            }
        };
    }

    /**
     * Checks whether the entry with the given id is still a member.
     *
     * @param id the entry id
     * @return true if the entry is live
     * @throws NullPointerException if id is null
     */
    public boolean contains(EntryId id) {
        Objects.requireNonNull(id, "id must not be null");
        lock.readLock().lock();
        try {
            return entries.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of live entries. Under concurrent inserts and
     * releases the result is only accurate at the moment of the call.
     *
     * @return the number of live entries
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return true if the set has no live entries at the moment of the call
     */
    public boolean isEmpty() {
        return size() == 0;
    }

    public String getName() {
        return config.getName();
    }

    public OwnedSetConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "OwnedSet[name=" + config.getName() + ", size=" + size() + "]";
    }
}
