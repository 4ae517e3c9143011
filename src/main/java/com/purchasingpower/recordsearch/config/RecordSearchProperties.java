package com.purchasingpower.recordsearch.config;

import com.purchasingpower.recordsearch.search.SearchCondition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Record search configuration.
 *
 * <p>Properties are loaded from the {@code app.search} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   search:
 *     default-field: id
 *     default-condition: matches
 *     inclusive-defaults: true
 *     result-ranking: true
 *     source-aliases:
 *       builtin: [obsidian, builtin, built-in]
 *       custom: [custom, user, callout-manager]
 * </pre>
 *
 * <p><b>Source aliases:</b> the {@code source} column indexes every alias listed for a
 * record's source type, so {@code source:obsidian} and {@code source:builtin} find the
 * same records. Types without aliases are indexed under their lower-case name.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.search")
public class RecordSearchProperties {

    /**
     * Column searched by operations that do not name one.
     * Default: id
     */
    @NotBlank
    private String defaultField = "id";

    /**
     * Condition used by operations that do not name one.
     * Default: matches
     */
    @NotNull
    private SearchCondition defaultCondition = SearchCondition.MATCHES;

    /**
     * If true, a query with no operations returns every record.
     * Default: true
     */
    private boolean inclusiveDefaults = true;

    /**
     * If false, results keep the tie-break order regardless of score.
     * Default: true
     */
    private boolean resultRanking = true;

    /**
     * Values indexed in the {@code source} column, keyed by lower-case source type.
     */
    private Map<String, List<String>> sourceAliases = new LinkedHashMap<>();
}
