package com.foodintel.catalog.ingest;

import java.util.Collection;
import java.util.Set;

/**
 * Immutable set of product codes known from earlier runs.
 * An empty set means the run is not incremental and nothing is skipped.
 */
public final class IdentitySet {

    private static final IdentitySet EMPTY = new IdentitySet(Set.of());

    private final Set<String> ids;

    private IdentitySet(Set<String> ids) {
        this.ids = ids;
    }

    public static IdentitySet empty() {
        return EMPTY;
    }

    public static IdentitySet of(Collection<String> ids) {
        return ids.isEmpty() ? EMPTY : new IdentitySet(Set.copyOf(ids));
    }

    public static IdentitySet load(IdentityStore store, String category) {
        return of(store.loadKnownIds(category));
    }

    public boolean contains(String id) {
        return id != null && ids.contains(id);
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public int size() {
        return ids.size();
    }
}
