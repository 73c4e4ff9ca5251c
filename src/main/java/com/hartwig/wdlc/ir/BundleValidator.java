package com.hartwig.wdlc.ir;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.error.MissingElementException;

public final class BundleValidator {

    private BundleValidator() {
    }

    /**
     * Checks that every callable a workflow fragment calls is defined in the bundle or one of its sub-bundles.
     */
    public static void checkCallTargets(Bundle bundle, List<Bundle> subBundles) throws MissingElementException {
        var known = new HashSet<>(bundle.allCallables().keySet());
        subBundles.forEach(subBundle -> known.addAll(subBundle.allCallables().keySet()));
        for (Bundle current : CallGraph.withSubBundles(bundle, subBundles)) {
            for (Callable callable : current.allCallables().values()) {
                for (Map.Entry<String, String> call : CallGraph.fragmentCalls(callable).entrySet()) {
                    if (!known.contains(call.getValue())) {
                        throw new MissingElementException(String.format("Call '%s' in '%s' refers to unknown callable '%s'",
                                call.getKey(),
                                callable.name(),
                                call.getValue()));
                    }
                }
            }
        }
    }
}
