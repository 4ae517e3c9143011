package com.purchasingpower.recordsearch.config;

import com.purchasingpower.recordsearch.record.RecordCatalog;
import com.purchasingpower.recordsearch.record.RecordSupplier;
import com.purchasingpower.recordsearch.record.SearchableRecord;
import com.purchasingpower.recordsearch.search.FuzzyMatcher;
import com.purchasingpower.recordsearch.search.impl.SubsequenceFuzzyMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans for the record search engine.
 *
 * <p>Both beans back off when the application defines its own, so hosts can plug in
 * a different fuzzy matcher or their own record source.
 */
@Slf4j
@Configuration
public class SearchConfig {

    @Bean
    @ConditionalOnMissingBean
    public FuzzyMatcher fuzzyMatcher() {
        return new SubsequenceFuzzyMatcher();
    }

    /**
     * An empty catalog whose records carry only their id.
     */
    @Bean
    @ConditionalOnMissingBean
    public RecordSupplier recordSupplier() {
        log.info("📚 No RecordSupplier defined, using an empty RecordCatalog");
        return new RecordCatalog(id -> SearchableRecord.builder().id(id).build());
    }
}
