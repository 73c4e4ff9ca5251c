package com.hartwig.wdlc.ir;

import java.util.List;
import java.util.Optional;

import com.hartwig.wdlc.error.MissingElementException;

/**
 * Turns the instance type and docker strategies of an applet into the jobs that run it.
 * <ul>
 *     <li>Default and Const instance types need a single job.</li>
 *     <li>A Runtime instance type first runs a job on the default instance that evaluates the instance expressions,
 *     then a second job pinned to the instance it selected.</li>
 *     <li>Native applets already exist on the platform, nothing is planned for them.</li>
 * </ul>
 */
public class RuntimePlanner {
    static final String COMMAND_SCRIPT = "command.sh";
    static final String INSTANCE_STAGE_SUFFIX = "-instance";

    private enum Role {
        NATIVE,
        FRAGMENT,
        TASK
    }

    public List<ExecutionStage> plan(Applet applet) throws MissingElementException {
        var role = applet.kind().accept(new AppletKind.Visitor<Role>() {
            @Override
            public Role visitNative(final AppletKindNative kind) {
                return Role.NATIVE;
            }

            @Override
            public Role visitWfFragment(final AppletKindWfFragment kind) {
                return Role.FRAGMENT;
            }

            @Override
            public Role visitTask(final AppletKindTask kind) {
                return Role.TASK;
            }
        });
        if (role == Role.NATIVE) {
            return List.of();
        }
        var setupCommands = role == Role.TASK ? dockerSetup(applet) : List.<String>of();
        var runsCommand = role == Role.TASK;
        return applet.instanceType().accept(new InstanceType.Visitor<List<ExecutionStage>>() {
            @Override
            public List<ExecutionStage> visitDefault(final DefaultInstanceType instanceType) {
                return List.of(stage(applet.name(), instanceType, setupCommands, runsCommand).build());
            }

            @Override
            public List<ExecutionStage> visitConst(final ConstInstanceType instanceType) {
                return List.of(stage(applet.name(), instanceType, setupCommands, runsCommand).build());
            }

            @Override
            public List<ExecutionStage> visitRuntime(final RuntimeInstanceType instanceType) {
                var evaluate = stage(applet.name() + INSTANCE_STAGE_SUFFIX, DefaultInstanceType.instance(), List.of(), false).build();
                var run = stage(applet.name(), instanceType, setupCommands, runsCommand).instanceFrom(evaluate.name()).build();
                return List.of(evaluate, run);
            }
        });
    }

    private static ImmutableExecutionStage.Builder stage(String name, InstanceType instanceType, List<String> setupCommands,
            boolean runsCommand) {
        return ExecutionStage.builder().name(name).instanceType(instanceType).setupCommands(setupCommands).runsCommand(runsCommand);
    }

    private static List<String> dockerSetup(Applet applet) throws MissingElementException {
        var image = applet.task().map(task -> task.runtimeAttributes().get("docker")).map(RuntimePlanner::unquote);
        var commands = applet.docker().accept(new DockerImage.Visitor<Optional<List<String>>>() {
            @Override
            public Optional<List<String>> visitNone(final DockerImageNone none) {
                return Optional.of(List.of());
            }

            @Override
            public Optional<List<String>> visitNetwork(final DockerImageNetwork network) {
                return image.map(name -> List.of("docker pull " + name,
                        "docker run --rm -v \"$HOME:$HOME\" -w \"$HOME\" " + name + " /bin/bash " + COMMAND_SCRIPT));
            }

            @Override
            public Optional<List<String>> visitPlatformAsset(final DockerImagePlatformAsset asset) {
                return Optional.of(List.of("dx cat " + asset.asset() + " | docker load"));
            }
        });
        return commands.orElseThrow(() -> new MissingElementException(String.format(
                "Applet '%s' pulls its docker image from the network, but its task has no docker runtime attribute",
                applet.name())));
    }

    private static String unquote(String expression) {
        var trimmed = expression.trim();
        if (trimmed.length() < 2) {
            return trimmed;
        }
        var first = trimmed.charAt(0);
        var last = trimmed.charAt(trimmed.length() - 1);
        if ((first == '"' || first == '\'') && first == last) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
