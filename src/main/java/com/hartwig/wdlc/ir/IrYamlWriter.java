package com.hartwig.wdlc.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Human readable YAML rendering of the IR, for debugging the compiler.
 */
public class IrYamlWriter {
    private final ObjectMapper objectMapper;

    public IrYamlWriter() {
        objectMapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
    }

    public String write(Bundle bundle) throws JsonProcessingException {
        Map<String, Object> root = new LinkedHashMap<>();
        bundle.primaryCallable().ifPresent(primary -> root.put("primary", primary.name()));
        Map<String, Object> callables = new TreeMap<>();
        bundle.allCallables().forEach((name, callable) -> callables.put(name, callable.accept(new CallableToMap())));
        root.put("callables", callables);
        return objectMapper.writeValueAsString(root);
    }

    private static List<Map<String, Object>> variables(List<CVar> variables) {
        var result = new ArrayList<Map<String, Object>>();
        for (CVar variable : variables) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", variable.name());
            if (!variable.safeName().equals(variable.name())) {
                map.put("safeName", variable.safeName());
            }
            map.put("type", variable.type().typeName());
            variable.defaultValue().ifPresent(value -> map.put("default", value.toWdlString()));
            if (!variable.attributes().isEmpty()) {
                map.put("attributes", new TreeMap<>(variable.attributes()));
            }
            result.add(map);
        }
        return result;
    }

    private static class CallableToMap implements Callable.Visitor<Map<String, Object>> {
        @Override
        public Map<String, Object> visitApplet(final Applet applet) {
            var map = header("applet", applet);
            map.put("instanceType", applet.instanceType().accept(new InstanceType.Visitor<Object>() {
                @Override
                public Object visitDefault(final DefaultInstanceType instanceType) {
                    return "default";
                }

                @Override
                public Object visitConst(final ConstInstanceType instanceType) {
                    Map<String, Object> resources = new LinkedHashMap<>();
                    instanceType.instanceClass().ifPresent(value -> resources.put("instanceClass", value));
                    instanceType.memoryMB().ifPresent(value -> resources.put("memoryMB", value));
                    instanceType.diskGB().ifPresent(value -> resources.put("diskGB", value));
                    instanceType.cpu().ifPresent(value -> resources.put("cpu", value));
                    return resources;
                }

                @Override
                public Object visitRuntime(final RuntimeInstanceType instanceType) {
                    return "runtime";
                }
            }));
            map.put("docker", applet.docker().accept(new DockerImage.Visitor<Object>() {
                @Override
                public Object visitNone(final DockerImageNone image) {
                    return "none";
                }

                @Override
                public Object visitNetwork(final DockerImageNetwork image) {
                    return "network";
                }

                @Override
                public Object visitPlatformAsset(final DockerImagePlatformAsset image) {
                    return Map.of("asset", image.asset());
                }
            }));
            map.put("kind", applet.kind().accept(new AppletKind.Visitor<Object>() {
                @Override
                public Object visitNative(final AppletKindNative kind) {
                    return Map.of("native", kind.id());
                }

                @Override
                public Object visitWfFragment(final AppletKindWfFragment kind) {
                    return Map.of("fragment", new TreeMap<>(kind.calls()));
                }

                @Override
                public Object visitTask(final AppletKindTask kind) {
                    return "task";
                }
            }));
            return map;
        }

        @Override
        public Map<String, Object> visitWorkflow(final Workflow workflow) {
            var map = header("workflow", workflow);
            map.put("stages", workflow.stages());
            return map;
        }

        private static Map<String, Object> header(String type, Callable callable) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", type);
            map.put("inputs", variables(callable.inputs()));
            map.put("outputs", variables(callable.outputs()));
            return map;
        }
    }
}
