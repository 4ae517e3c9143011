package com.purchasingpower.recordsearch.record;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RecordCatalog Tests")
class RecordCatalogTest {

    private final Map<String, String> icons = new HashMap<>();
    private final Map<String, Integer> resolveCounts = new HashMap<>();
    private RecordCatalog catalog;

    @BeforeEach
    void setUp() {
        icons.put("note", "lucide-pencil");
        icons.put("tip", "lucide-flame");
        icons.put("warning", "lucide-alert-triangle");

        catalog = new RecordCatalog(id -> {
            resolveCounts.merge(id, 1, Integer::sum);
            return SearchableRecord.builder()
                    .id(id)
                    .icon(icons.get(id))
                    .source(RecordSource.custom())
                    .build();
        });
    }

    @Test
    @DisplayName("Records carry every source that defines them")
    void addSource_ShouldCollectSources() {
        // Given
        catalog.addSource(RecordSource.builtin(), "tip");
        catalog.addSource(RecordSource.snippet("my-snippet"), "tip");

        // When
        SearchableRecord tip = catalog.get("tip").orElseThrow();

        // Then: resolver sources are replaced by the tracked ones
        assertThat(tip.getIcon()).isEqualTo("lucide-flame");
        assertThat(tip.getSources()).containsExactly(RecordSource.builtin(), RecordSource.snippet("my-snippet"));
    }

    @Test
    @DisplayName("A record disappears once its last source is removed")
    void removeSource_ShouldDropOrphans() {
        catalog.addSource(RecordSource.builtin(), "note");
        catalog.addSource(RecordSource.theme("minimal"), "note");

        catalog.removeSource(RecordSource.builtin(), "note");
        assertThat(catalog.get("note")).hasValueSatisfying(
                note -> assertThat(note.getSources()).containsExactly(RecordSource.theme("minimal")));

        catalog.removeSource(RecordSource.theme("minimal"), "note");
        assertThat(catalog.get("note")).isEmpty();
        assertThat(catalog.keys()).isEmpty();
    }

    @Test
    @DisplayName("invalidateSource applies a diff")
    void invalidateSource_ShouldApplyDiff() {
        RecordSource snippet = RecordSource.snippet("colors");
        catalog.invalidateSource(snippet, List.of("note", "tip"), List.of(), List.of());

        catalog.invalidateSource(snippet, List.of("warning"), List.of("note"), List.of("tip"));

        assertThat(catalog.keys()).containsExactly("tip", "warning");
        assertThat(catalog.values()).extracting(SearchableRecord::getId).containsExactly("tip", "warning");
    }

    @Test
    @DisplayName("Records resolve lazily and again after invalidation")
    void resolution_ShouldBeLazy() {
        catalog.addSource(RecordSource.builtin(), "note");
        assertThat(resolveCounts).isEmpty();

        catalog.get("note");
        catalog.get("note");
        assertThat(resolveCounts).containsEntry("note", 1);

        icons.put("note", "lucide-file");
        catalog.invalidate("note");

        assertThat(catalog.get("note").orElseThrow().getIcon()).isEqualTo("lucide-file");
        assertThat(resolveCounts).containsEntry("note", 2);
    }

    @Test
    @DisplayName("hasChanged turns true after a mutation")
    void hasChanged_ShouldTrackMutations() {
        catalog.addSource(RecordSource.builtin(), "note");
        BooleanSupplier changed = catalog.hasChanged();

        catalog.values();
        assertThat(changed.getAsBoolean()).isFalse();

        catalog.addSource(RecordSource.builtin(), "tip");
        assertThat(changed.getAsBoolean()).isTrue();
        assertThat(catalog.hasChanged().getAsBoolean()).isFalse();
    }

    @Test
    @DisplayName("Invalidating an unknown id is ignored")
    void invalidate_Unknown_ShouldBeIgnored() {
        BooleanSupplier changed = catalog.hasChanged();

        catalog.invalidate("missing");

        assertThat(changed.getAsBoolean()).isFalse();
    }

    @Test
    @DisplayName("A resolver that returns nothing fails loudly")
    void resolver_ReturningNull_ShouldThrow() {
        RecordCatalog broken = new RecordCatalog(id -> null);
        broken.addSource(RecordSource.builtin(), "note");

        assertThatThrownBy(broken::values).isInstanceOf(IllegalStateException.class);
    }
}
