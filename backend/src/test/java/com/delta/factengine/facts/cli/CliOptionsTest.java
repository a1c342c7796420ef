package com.delta.factengine.facts.cli;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliOptionsTest {

    @Test
    void noArgumentsMeansFullUnforcedRun() {
        CliOptions options = CliOptions.parse(new DefaultApplicationArguments());

        assertThat(options.force()).isFalse();
        assertThat(options.companyId()).isNull();
        assertThat(options.offset()).isNull();
        assertThat(options.limit()).isNull();
        assertThat(options.inspect()).isFalse();
        assertThat(options.hasImport()).isFalse();
    }

    @Test
    void parsesFlagsAndValues() {
        CliOptions options = CliOptions.parse(new DefaultApplicationArguments(
            "--force", "--id=42", "--offset=10", "--limit=5", "--refresh-rates=true"
        ));

        assertThat(options.force()).isTrue();
        assertThat(options.companyId()).isEqualTo(42L);
        assertThat(options.offset()).isEqualTo(10);
        assertThat(options.limit()).isEqualTo(5);
        assertThat(options.refreshRates()).isTrue();
    }

    @Test
    void explicitFalseDisablesFlag() {
        CliOptions options = CliOptions.parse(new DefaultApplicationArguments("--force=false", "--inspect"));

        assertThat(options.force()).isFalse();
        assertThat(options.inspect()).isTrue();
    }

    @Test
    void importTakesPath() {
        CliOptions options = CliOptions.parse(new DefaultApplicationArguments("--import=data/companies.csv"));

        assertThat(options.hasImport()).isTrue();
        assertThat(options.importPath()).isEqualTo("data/companies.csv");
    }

    @Test
    void rejectsBadValues() {
        assertThatThrownBy(() -> CliOptions.parse(new DefaultApplicationArguments("--id=abc")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("--id");
        assertThatThrownBy(() -> CliOptions.parse(new DefaultApplicationArguments("--offset=-1")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CliOptions.parse(new DefaultApplicationArguments("--limit=0")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CliOptions.parse(new DefaultApplicationArguments("--import")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
