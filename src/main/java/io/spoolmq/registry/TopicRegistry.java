package io.spoolmq.registry;

import io.spoolmq.broker.topic.Topic;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Registry of open topics.
 * <p>
 * Lookups take the read lock; creation and removal take the write lock, so a topic is created exactly once even
 * when many callers race on a new name.
 */
public final class TopicRegistry {
    private final ConcurrentMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Optional<Topic> get(final String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(topics.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the topic named {@code name}, running {@code creator} under the write lock if it does not exist.
     * {@code onExisting} sees an already registered topic inside the same critical section.
     */
    public Topic getOrCreate(final String name,
                             final Supplier<Topic> creator,
                             final Function<Topic, Topic> onExisting) {
        final Optional<Topic> fast = get(name);
        if (fast.isPresent()) return onExisting.apply(fast.get());

        lock.writeLock().lock();
        try {
            final Topic existing = topics.get(name);
            if (existing != null) return onExisting.apply(existing);
            final Topic created = creator.get();
            topics.put(name, created);
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void register(final Topic topic) {
        lock.writeLock().lock();
        try {
            if (topics.putIfAbsent(topic.getName(), topic) != null) {
                throw new IllegalStateException("Topic already registered: " + topic.getName());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Topic> remove(final String name) {
        lock.writeLock().lock();
        try {
            return Optional.ofNullable(topics.remove(name));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(final String name) {
        return get(name).isPresent();
    }

    public Set<String> listTopics() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(topics.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Collection<Topic> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(topics.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Empties the registry and returns what it held.
     */
    public List<Topic> clear() {
        lock.writeLock().lock();
        try {
            final List<Topic> all = List.copyOf(topics.values());
            topics.clear();
            return all;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
