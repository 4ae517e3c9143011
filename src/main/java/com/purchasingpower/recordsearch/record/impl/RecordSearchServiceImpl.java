package com.purchasingpower.recordsearch.record.impl;

import com.purchasingpower.recordsearch.config.RecordSearchProperties;
import com.purchasingpower.recordsearch.exception.QuerySyntaxException;
import com.purchasingpower.recordsearch.normalize.Normalizer;
import com.purchasingpower.recordsearch.normalize.Normalizers;
import com.purchasingpower.recordsearch.query.QueryOperation;
import com.purchasingpower.recordsearch.query.QueryParser;
import com.purchasingpower.recordsearch.record.RecordComparators;
import com.purchasingpower.recordsearch.record.RecordSearchService;
import com.purchasingpower.recordsearch.record.RecordSource;
import com.purchasingpower.recordsearch.record.RecordSupplier;
import com.purchasingpower.recordsearch.record.SearchableRecord;
import com.purchasingpower.recordsearch.search.FuzzyMatcher;
import com.purchasingpower.recordsearch.search.SealedSearch;
import com.purchasingpower.recordsearch.search.SearchCondition;
import com.purchasingpower.recordsearch.search.SearchEffect;
import com.purchasingpower.recordsearch.search.SearchFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Implementation of RecordSearchService.
 *
 * Keeps one search session over the supplier's records and rebuilds it whenever
 * the supplier reports a change. Queries are serialized on that session.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordSearchServiceImpl implements RecordSearchService {

    static final String COLUMN_ID = "id";
    static final String COLUMN_ICON = "icon";
    static final String COLUMN_SOURCE = "source";
    static final String COLUMN_SNIPPET = "snippet";

    private final RecordSupplier supplier;
    private final RecordSearchProperties properties;
    private final FuzzyMatcher fuzzyMatcher;

    private SealedSearch<SearchableRecord> search;
    private BooleanSupplier stale;

    @Override
    public synchronized List<SearchableRecord> search(String query) {
        if (search == null || stale.getAsBoolean()) {
            refresh();
        }

        List<QueryOperation> operations = parse(query, search.getIndex().columnNames());

        search.reset();
        for (QueryOperation operation : operations) {
            if (operation.text() == null || operation.text().isEmpty()) {
                continue;
            }

            String field = operation.field() == null || operation.field().isEmpty()
                    ? properties.getDefaultField()
                    : operation.field();
            SearchCondition condition = operation.condition() == null
                    ? properties.getDefaultCondition()
                    : operation.condition();
            SearchEffect effect = operation.effect() == null ? SearchEffect.FILTER : operation.effect();

            search.search(field, condition, operation.text(), effect);
        }

        List<SearchableRecord> results = search.getResults();
        log.debug("🔍 Query '{}' ({} operations) returned {} records", query, operations.size(), results.size());
        return results;
    }

    @Override
    public List<QueryOperation> parse(String query) {
        return parse(query, null);
    }

    private List<QueryOperation> parse(String query, Set<String> fields) {
        try {
            return QueryParser.parseQuery(query == null ? "" : query, fields);
        } catch (QuerySyntaxException e) {
            log.debug("Rejected query '{}': {}", query, e.getMessage());
            throw e;
        }
    }

    @Override
    public synchronized void refresh() {
        BooleanSupplier changed = supplier.hasChanged();
        List<SearchableRecord> records = supplier.get();

        Normalizer standard = Normalizers.standard();
        search = new SearchFactory<SearchableRecord>(records)
                .withColumn(COLUMN_ID, SearchableRecord::getId, standard)
                .withColumn(COLUMN_ICON, SearchableRecord::getIcon, standard)
                .withMultiValueColumn(COLUMN_SOURCE, this::sourceValues, standard)
                .withMultiValueColumn(COLUMN_SNIPPET, RecordSearchServiceImpl::snippetValues, standard)
                .withSorting(RecordComparators.standard())
                .withInclusiveDefaults(properties.isInclusiveDefaults())
                .withResultRanking(properties.isResultRanking())
                .withFuzzyMatcher(fuzzyMatcher)
                .build();
        stale = changed;

        log.info("📚 Indexed {} records into {} positions", records.size(), search.getIndex().size());
    }

    private List<String> sourceValues(SearchableRecord record) {
        List<String> values = new ArrayList<>();

        for (RecordSource source : record.getSources()) {
            String type = source.getType().name().toLowerCase(Locale.ROOT);
            List<String> aliases = properties.getSourceAliases().get(type);

            if (aliases == null || aliases.isEmpty()) {
                values.add(type);
            } else {
                values.addAll(aliases);
            }
        }

        return values;
    }

    private static List<String> snippetValues(SearchableRecord record) {
        List<String> values = new ArrayList<>();

        for (RecordSource source : record.getSources()) {
            if (source.getType() == RecordSource.Type.SNIPPET) {
                values.add(source.getName());
            }
        }

        return values;
    }
}
