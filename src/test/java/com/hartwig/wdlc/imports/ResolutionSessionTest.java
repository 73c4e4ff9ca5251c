package com.hartwig.wdlc.imports;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.error.ImportConsistencyException;

import org.junit.jupiter.api.Test;

class ResolutionSessionTest {
    private final ResolutionSession session = new ResolutionSession();

    @Test
    void identicalContentIsRecordedOnce() throws ImportConsistencyException {
        assertThat(session.record("/a.wdl", "task A {}")).isTrue();
        assertThat(session.record("/a.wdl", "task A {}")).isTrue();

        session.throwIfInconsistent();
        assertThat(session.paths()).containsExactly("/a.wdl");
    }

    @Test
    void pathIsNeverRebound() {
        session.record("/a.wdl", "task A {}");

        assertThat(session.record("/a.wdl", "task B {}")).isFalse();
        assertThat(session.source("/a.wdl")).isEqualTo("task A {}");
        assertThrows(ImportConsistencyException.class, session::throwIfInconsistent);
    }

    @Test
    void snapshotsAreDetached() {
        session.record("/a.wdl", "task A {}");
        var paths = session.paths();
        var sources = session.sources();
        session.record("/b.wdl", "task B {}");
        session.addAdjuncts(Map.of("/b.wdl", List.of(AdjunctFile.readme("B", "b"))));

        assertThat(paths).containsExactly("/a.wdl");
        assertThat(sources).containsOnlyKeys("/a.wdl");
        assertThat(session.contains("/b.wdl")).isTrue();
        assertThat(session.adjuncts()).containsOnlyKeys("/b.wdl");
    }
}
