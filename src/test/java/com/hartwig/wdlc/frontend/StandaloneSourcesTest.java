package com.hartwig.wdlc.frontend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.error.FrontEndRejectionException;
import com.hartwig.wdlc.error.MissingElementException;
import com.hartwig.wdlc.wdl.Dialect;

import org.junit.jupiter.api.Test;

class StandaloneSourcesTest {
    private final StandaloneSources sources =
            new StandaloneSources(new LanguageFrontEnds(List.of(new FakeFrontEnd(Dialect.DRAFT_2), new FakeFrontEnd(Dialect.V1_0))));

    @Test
    void parsesWorkflow() throws Exception {
        var workflow = sources.parseWorkflow("version 1.0\n\nworkflow w {\n  call A\n}\n");
        assertThat(workflow.name()).isEqualTo("w");
        assertThat(workflow.graph().nodes()).hasSize(1);
    }

    @Test
    void taskIsNotAWorkflow() {
        var exception = assertThrows(MissingElementException.class, () -> sources.parseWorkflow("version 1.0\ntask A {\n}\n"));
        assertThat(exception.getMessage()).contains("'A' is not a workflow");
    }

    @Test
    void parsesSingleTask() throws Exception {
        var task = sources.parseTask("task A {\n  command {}\n}\n");
        assertThat(task.name()).isEqualTo("A");
    }

    @Test
    void rejectedSourceThrows() {
        var exception = assertThrows(FrontEndRejectionException.class, () -> sources.analyze("version 1.0\n#reject\n"));
        assertThat(exception.getErrors()).containsExactly("rejected on request");
    }

    @Test
    void mainTaskNeedsExactlyOneTask() {
        var a = TaskDefinition.builder().name("A").sourceCode("").build();
        var b = TaskDefinition.builder().name("B").sourceCode("").build();
        var bundle = SourceBundle.builder().allCallables(Map.of("A", a, "B", b)).build();
        assertThrows(MissingElementException.class, () -> StandaloneSources.mainTask(bundle));
    }

    @Test
    void mainTaskPrefersPrimaryCallable() throws Exception {
        var a = TaskDefinition.builder().name("A").sourceCode("").build();
        var b = TaskDefinition.builder().name("B").sourceCode("").build();
        var bundle = SourceBundle.builder().primaryCallable(b).allCallables(Map.of("A", a, "B", b)).build();
        assertThat(StandaloneSources.mainTask(bundle)).isEqualTo(b);
    }
}
