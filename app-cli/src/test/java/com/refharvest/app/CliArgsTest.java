package com.refharvest.app;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliArgsTest {

    @Test
    void parsesEveryOption() {
        CliArgs a = CliArgs.parse(new String[]{
                "--config", "my.yml", "--profile", "loinc", "--seed", "https://a.org/",
                "--depth", "2", "--out", "dl", "--user", "alice", "--password", "pw",
                "--no-report", "-v"});

        assertThat(a.config).isEqualTo(Path.of("my.yml"));
        assertThat(a.profile).isEqualTo("loinc");
        assertThat(a.seed).isEqualTo("https://a.org/");
        assertThat(a.depth).isEqualTo(2);
        assertThat(a.out).isEqualTo(Path.of("dl"));
        assertThat(a.user).isEqualTo("alice");
        assertThat(a.password).isEqualTo("pw");
        assertThat(a.noReport).isTrue();
        assertThat(a.verbose).isTrue();
        assertThat(a.help).isFalse();
    }

    @Test
    void emptyArgsAreAllDefaults() {
        CliArgs a = CliArgs.parse(new String[0]);

        assertThat(a.config).isNull();
        assertThat(a.depth).isNull();
        assertThat(a.noReport).isFalse();
    }

    @Test
    void rejectsBadInput() {
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--bogus"}))
                .hasMessageContaining("Unknown option: --bogus");
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--seed"}))
                .hasMessageContaining("Missing value for --seed");
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--out", "--no-report"}))
                .hasMessageContaining("Missing value for --out");
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--depth", "two"}))
                .hasMessageContaining("expects a number");
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--depth", "-1"}))
                .hasMessageContaining(">= 0");
    }
}
