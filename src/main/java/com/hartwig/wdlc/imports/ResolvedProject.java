package com.hartwig.wdlc.imports;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.frontend.SourceBundle;
import com.hartwig.wdlc.wdl.Dialect;
import com.hartwig.wdlc.wdl.StructType;

import org.immutables.value.Value;

/**
 * Everything found while resolving a main file: its dialect and bundle, the source of every file that was read
 * (main file included), their adjuncts, and one bundle per imported file.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
public interface ResolvedProject {
    /**
     * Absolute path of the main file, also a key of {@link #sources()}.
     */
    String mainFile();

    Dialect dialect();

    SourceBundle primaryBundle();

    Map<String, String> sources();

    Map<String, List<AdjunctFile>> adjuncts();

    List<SourceBundle> subBundles();

    /**
     * Struct definitions of the main file and all imports. The main file wins when a name is defined twice.
     */
    default String mainSource() {
        return sources().get(mainFile());
    }

    default Map<String, StructType> allTypeAliases() {
        var aliases = new LinkedHashMap<String, StructType>();
        for (SourceBundle subBundle : subBundles()) {
            aliases.putAll(subBundle.typeAliases());
        }
        aliases.putAll(primaryBundle().typeAliases());
        return aliases;
    }

    static ImmutableResolvedProject.Builder builder() {
        return ImmutableResolvedProject.builder();
    }
}
