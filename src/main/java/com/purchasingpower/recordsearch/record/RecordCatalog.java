package com.purchasingpower.recordsearch.record;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Tracks which sources define each record id and resolves records lazily.
 *
 * <p>A record id stays in the catalog while at least one source defines it. Record
 * details (icon, color) come from the resolver; the catalog fills in the sources.
 * Entries are resolved on first read and again after they are invalidated.
 *
 * <p>Usage:
 * <pre>{@code
 * RecordCatalog catalog = new RecordCatalog(id -> lookupDetails(id));
 * catalog.invalidateSource(RecordSource.snippet("my-snippet"), List.of("note", "tip"), List.of(), List.of());
 *
 * BooleanSupplier changed = catalog.hasChanged();
 * catalog.removeSource(RecordSource.snippet("my-snippet"), "tip");
 * changed.getAsBoolean(); // true
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Not thread safe.
 *
 * @since 1.0.0
 */
@Slf4j
public class RecordCatalog implements RecordSupplier {

    private final Function<String, SearchableRecord> resolver;
    private final Map<String, CatalogEntry> entries = new LinkedHashMap<>();
    private final Set<String> invalidated = new LinkedHashSet<>();
    private int modificationCount;

    /**
     * @param resolver Looks up a record's details by id. Sources on the returned record are ignored.
     */
    public RecordCatalog(Function<String, SearchableRecord> resolver) {
        this.resolver = Preconditions.checkNotNull(resolver, "Resolver cannot be null");
    }

    /**
     * Records that {@code source} defines {@code id}.
     */
    public void addSource(RecordSource source, String id) {
        doAddSource(source, id);
        modificationCount++;
    }

    /**
     * Records that {@code source} no longer defines {@code id}. The id is dropped
     * once no source defines it.
     */
    public void removeSource(RecordSource source, String id) {
        doRemoveSource(source, id);
        modificationCount++;
    }

    /**
     * Applies a diff of the ids defined by one source.
     *
     * @param source The source that changed
     * @param added Ids the source now defines
     * @param removed Ids the source no longer defines
     * @param changed Ids the source still defines but whose details changed
     */
    public void invalidateSource(RecordSource source,
                                 Collection<String> added,
                                 Collection<String> removed,
                                 Collection<String> changed) {
        for (String id : removed) {
            doRemoveSource(source, id);
        }

        for (String id : added) {
            doAddSource(source, id);
        }

        for (String id : changed) {
            if (entries.containsKey(id)) {
                invalidated.add(id);
            }
        }

        modificationCount++;
        log.debug("Source {} changed: {} added, {} removed, {} changed",
                source, added.size(), removed.size(), changed.size());
    }

    /**
     * Forces a record to be resolved again on its next read.
     */
    public void invalidate(String id) {
        if (entries.containsKey(id)) {
            invalidated.add(id);
            modificationCount++;
        }
    }

    public Optional<SearchableRecord> get(String id) {
        CatalogEntry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }

        if (invalidated.remove(id)) {
            resolve(entry);
        }
        return Optional.of(entry.record);
    }

    /**
     * Every known record id, in the order first added.
     */
    public List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    /**
     * Every known record, resolving any that are stale.
     */
    public List<SearchableRecord> values() {
        for (String id : invalidated) {
            resolve(entries.get(id));
        }
        invalidated.clear();

        List<SearchableRecord> records = new ArrayList<>(entries.size());
        for (CatalogEntry entry : entries.values()) {
            records.add(entry.record);
        }
        return Collections.unmodifiableList(records);
    }

    @Override
    public List<SearchableRecord> get() {
        return values();
    }

    @Override
    public BooleanSupplier hasChanged() {
        int snapshot = modificationCount;
        return () -> modificationCount != snapshot;
    }

    public int size() {
        return entries.size();
    }

    private void doAddSource(RecordSource source, String id) {
        Preconditions.checkNotNull(source, "Source cannot be null");
        Preconditions.checkNotNull(id, "Record id cannot be null");

        entries.computeIfAbsent(id, CatalogEntry::new).sources.add(source);
        invalidated.add(id);
    }

    private void doRemoveSource(RecordSource source, String id) {
        CatalogEntry entry = entries.get(id);
        if (entry == null) {
            return;
        }

        entry.sources.remove(source);
        if (entry.sources.isEmpty()) {
            entries.remove(id);
            invalidated.remove(id);
        } else {
            invalidated.add(id);
        }
    }

    private void resolve(CatalogEntry entry) {
        SearchableRecord details = resolver.apply(entry.id);
        Preconditions.checkState(details != null, "Resolver returned no record for id '%s'", entry.id);

        entry.record = details.toBuilder()
                .id(entry.id)
                .clearSources()
                .sources(entry.sources)
                .build();
    }

    private static final class CatalogEntry {
        private final String id;
        private final Set<RecordSource> sources = new LinkedHashSet<>();
        private SearchableRecord record;

        private CatalogEntry(String id) {
            this.id = id;
        }
    }
}
