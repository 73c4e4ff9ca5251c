package com.hartwig.wdlc.frontend;

import static org.assertj.core.api.Assertions.assertThat;

import com.hartwig.wdlc.wdl.Dialect;

import org.junit.jupiter.api.Test;

class VersionHeaderMatcherTest {

    @Test
    void versionMustBeTheFirstStatement() {
        assertThat(VersionHeaderMatcher.looksLike(Dialect.V1_0, "task A {\n}\nversion 1.0\n")).isFalse();
        assertThat(VersionHeaderMatcher.looksLike(Dialect.DRAFT_2, "task A {\n}\nversion 1.0\n")).isTrue();
    }

    @Test
    void toleratesWhitespaceAroundVersion() {
        assertThat(VersionHeaderMatcher.looksLike(Dialect.V1_0, "\n   version   1.0  \n")).isTrue();
        assertThat(VersionHeaderMatcher.looksLike(Dialect.DEVELOPMENT, "\n   version   1.0  \n")).isFalse();
    }

    @Test
    void versionLineMayEndWithComment() {
        assertThat(VersionHeaderMatcher.looksLike(Dialect.V1_0, "version 1.0 # comment\n")).isTrue();
        assertThat(VersionHeaderMatcher.looksLike(Dialect.V1_0, "version 1.0#comment\n")).isTrue();
        assertThat(VersionHeaderMatcher.looksLike(Dialect.DRAFT_2, "version 1.0 # comment\n")).isFalse();
    }

    @Test
    void cwlIsNotDraftTwo() {
        var cwl = "#!/usr/bin/env cwl-runner\ncwlVersion: \"v1.0\"\nclass: Workflow\n";
        assertThat(VersionHeaderMatcher.looksLike(Dialect.CWL_1_0, cwl)).isTrue();
        assertThat(VersionHeaderMatcher.looksLike(Dialect.DRAFT_2, cwl)).isFalse();
    }
}
