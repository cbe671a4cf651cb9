package com.bbthechange.carshare.repository.impl;

import com.bbthechange.carshare.exception.VersionConflictException;
import com.bbthechange.carshare.model.BaseItem;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Keyed item storage shared by the in-memory repositories.
 *
 * Items go in and come out as copies, so the only way to change stored state is
 * {@link #update(BaseItem)}, which is a compare-and-set on the item's version executed
 * atomically for its key. Contention is therefore scoped to a single key.
 */
class InMemoryItemStore<T extends BaseItem> {

    private final ConcurrentMap<String, T> items = new ConcurrentHashMap<>();
    private final String itemType;
    private final UnaryOperator<T> copier;

    InMemoryItemStore(String itemType, UnaryOperator<T> copier) {
        this.itemType = itemType;
        this.copier = copier;
    }

    /**
     * Store a new item. Fails if the key is taken.
     */
    T insert(T item) {
        T stored = copier.apply(item);
        stored.setVersion(0);
        stored.touch();
        T previous = items.putIfAbsent(stored.getKey(), stored);
        if (previous != null) {
            throw new VersionConflictException(itemType + " already exists: " + stored.getKey());
        }
        return copier.apply(stored);
    }

    /**
     * Replace the stored item if its version still equals {@code item.getVersion()}.
     * The stored copy gets the next version.
     */
    T update(T item) {
        String key = item.getKey();
        long expectedVersion = item.getVersion();
        T stored = items.compute(key, (k, current) -> {
            if (current == null) {
                throw new VersionConflictException(itemType + " no longer exists: " + k);
            }
            if (current.getVersion() != expectedVersion) {
                throw new VersionConflictException(String.format("%s %s was modified concurrently (expected version %d, found %d)",
                        itemType, k, expectedVersion, current.getVersion()));
            }
            T next = copier.apply(item);
            next.setVersion(expectedVersion + 1);
            next.touch();
            return next;
        });
        return copier.apply(stored);
    }

    Optional<T> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(items.get(key)).map(copier);
    }

    List<T> findAll(Predicate<T> filter) {
        return items.values().stream()
                .filter(filter)
                .map(copier)
                .collect(Collectors.toList());
    }

    long count() {
        return items.size();
    }
}
