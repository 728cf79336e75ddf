package tech.agencydesk.platform.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.agencydesk.platform.testing.TestPlatformConfig;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ScopeFieldMappingTest {

    private final ScopeFieldMapping mapping = ScopeFieldMapping.standard();

    @Test
    @DisplayName("fieldFor should use agency_id for regular collections")
    void fieldFor_shouldReturnDefaultField_whenCollectionIsRegular() {
        assertThat(mapping.fieldFor("projects")).isEqualTo("agency_id");
        assertThat(mapping.fieldFor("finance_invoices")).isEqualTo("agency_id");
        assertThat(mapping.fieldFor("sequence_counters")).isEqualTo("agency_id");
    }

    @Test
    @DisplayName("fieldFor should use studio_id for legacy task collections")
    void fieldFor_shouldReturnLegacyField_whenCollectionIsLegacy() {
        assertThat(mapping.fieldFor("tasks")).isEqualTo("studio_id");
        assertThat(mapping.fieldFor("task_history")).isEqualTo("studio_id");
    }

    @Test
    @DisplayName("fieldFor should resolve unknown collection names to the default field")
    void fieldFor_shouldBeTotal() {
        assertThat(mapping.fieldFor("")).isEqualTo("agency_id");
        assertThat(mapping.fieldFor("Tasks")).isEqualTo("agency_id");
    }

    @Test
    @DisplayName("from should build the mapping from configuration")
    void from_shouldUseConfiguredNames() {
        ScopeFieldMapping configured = ScopeFieldMapping.from(new TestPlatformConfig().scope());

        assertThat(configured.defaultField()).isEqualTo("agency_id");
        assertThat(configured.legacyField()).isEqualTo("studio_id");
        assertThat(configured.fieldFor("task_history")).isEqualTo("studio_id");
    }

    @Test
    @DisplayName("constructor should reject field names that are not top-level attributes")
    void constructor_shouldRejectInvalidFieldNames() {
        assertThatThrownBy(() -> new ScopeFieldMapping("", "studio_id", Set.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScopeFieldMapping("meta.agency", "studio_id", Set.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScopeFieldMapping("agency_id", "$studio", Set.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
