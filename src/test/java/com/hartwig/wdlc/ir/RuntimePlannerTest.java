package com.hartwig.wdlc.ir;

import static com.hartwig.wdlc.ir.IrFixtures.task;
import static com.hartwig.wdlc.ir.IrFixtures.taskApplet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.hartwig.wdlc.error.MissingElementException;

import org.junit.jupiter.api.Test;

class RuntimePlannerTest {
    private final RuntimePlanner planner = new RuntimePlanner();

    @Test
    void defaultInstanceRunsOneStage() throws MissingElementException {
        var stages = planner.plan(taskApplet("Add").build());
        assertThat(stages).containsExactly(ExecutionStage.builder()
                .name("Add")
                .instanceType(DefaultInstanceType.instance())
                .runsCommand(true)
                .build());
    }

    @Test
    void runtimeInstanceEvaluatesFirst() throws MissingElementException {
        var stages = planner.plan(taskApplet("Add").instanceType(RuntimeInstanceType.instance()).build());
        assertThat(stages).hasSize(2);
        assertThat(stages.get(0).name()).isEqualTo("Add-instance");
        assertThat(stages.get(0).instanceType()).isEqualTo(DefaultInstanceType.instance());
        assertThat(stages.get(0).runsCommand()).isFalse();
        assertThat(stages.get(1).name()).isEqualTo("Add");
        assertThat(stages.get(1).instanceFrom()).isEqualTo(Optional.of("Add-instance"));
        assertThat(stages.get(1).runsCommand()).isTrue();
    }

    @Test
    void networkImageIsPulledAndRun() throws MissingElementException {
        var applet = taskApplet("Align").docker(DockerImageNetwork.instance())
                .task(task("Align", Map.of("docker", "\"ubuntu:20.04\"")))
                .build();
        assertThat(planner.plan(applet).get(0).setupCommands()).containsExactly("docker pull ubuntu:20.04",
                "docker run --rm -v \"$HOME:$HOME\" -w \"$HOME\" ubuntu:20.04 /bin/bash command.sh");
    }

    @Test
    void networkImageWithoutDockerAttributeThrows() {
        var applet = taskApplet("Align").docker(DockerImageNetwork.instance()).build();
        assertThrows(MissingElementException.class, () -> planner.plan(applet));
    }

    @Test
    void platformAssetIsLoaded() throws MissingElementException {
        var applet = taskApplet("Align").docker(DockerImagePlatformAsset.of("record-123")).build();
        assertThat(planner.plan(applet).get(0).setupCommands()).containsExactly("dx cat record-123 | docker load");
    }

    @Test
    void nativeAppletsNeedNoStages() throws MissingElementException {
        var applet = Applet.builder()
                .name("bwa")
                .instanceType(DefaultInstanceType.instance())
                .docker(DockerImageNone.instance())
                .kind(AppletKindNative.of("applet-xyz"))
                .build();
        assertThat(planner.plan(applet)).isEmpty();
    }

    @Test
    void fragmentsDoNotRunACommand() throws MissingElementException {
        var stages = planner.plan(IrFixtures.fragment("frag", Map.of("c1", "Add")));
        assertThat(stages).hasSize(1);
        assertThat(stages.get(0).runsCommand()).isFalse();
        assertThat(stages.get(0).setupCommands()).isEqualTo(List.of());
    }

    @Test
    void taskAppletNeedsTask() {
        assertThrows(IllegalArgumentException.class,
                () -> Applet.builder()
                        .name("Add")
                        .instanceType(DefaultInstanceType.instance())
                        .docker(DockerImageNone.instance())
                        .kind(AppletKindTask.instance())
                        .build());
    }
}
