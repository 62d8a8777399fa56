package com.axiom.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FlywayConfigProperties")
class FlywayConfigPropertiesTest {

    @Test
    @DisplayName("applies defaults for unset values")
    void appliesDefaults() {
        var props = new FlywayConfigProperties(null, null, null, null);

        assertThat(props.enabled()).isTrue();
        assertThat(props.locations()).isEqualTo(FlywayConfigProperties.DEFAULT_LOCATIONS);
        assertThat(props.baselineOnMigrate()).isTrue();
        assertThat(props.database()).isEqualTo("axiom");
    }

    @Test
    @DisplayName("keeps explicit values")
    void keepsExplicitValues() {
        var props = new FlywayConfigProperties(false, "classpath:db/custom", false, "axiom_test");

        assertThat(props.enabled()).isFalse();
        assertThat(props.locations()).isEqualTo("classpath:db/custom");
        assertThat(props.baselineOnMigrate()).isFalse();
        assertThat(props.database()).isEqualTo("axiom_test");
    }
}
