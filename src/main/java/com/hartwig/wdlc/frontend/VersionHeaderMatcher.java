package com.hartwig.wdlc.frontend;

import java.util.regex.Pattern;

import com.hartwig.wdlc.wdl.Dialect;

/**
 * Recognizes a dialect from the version statement at the top of a file. Front-ends can delegate
 * {@link LanguageFrontEnd#looksParsable(String)} to it.
 */
public final class VersionHeaderMatcher {
    private static final Pattern WDL_VERSION = Pattern.compile("^\\s*version\\s+([^\\s#]+)\\s*(#.*)?$");
    private static final Pattern CWL_VERSION = Pattern.compile("^\\s*cwlVersion\\s*:\\s*[\"']?v1\\.0[\"']?\\s*$");

    private VersionHeaderMatcher() {
    }

    public static boolean looksLike(Dialect dialect, String source) {
        switch (dialect) {
            case CWL_1_0:
                return source.lines().anyMatch(line -> CWL_VERSION.matcher(line).matches());
            case DRAFT_2:
                return !source.lines().anyMatch(line -> CWL_VERSION.matcher(line).matches()) && firstVersion(source) == null;
            default:
                return dialect.version().equals(firstVersion(source));
        }
    }

    /**
     * The version named by the first statement of a WDL file, skipping blank and comment lines. Null when the file
     * does not start with a version statement.
     */
    private static String firstVersion(String source) {
        for (String line : source.split("\n")) {
            var trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            var matcher = WDL_VERSION.matcher(trimmed);
            return matcher.matches() ? matcher.group(1) : null;
        }
        return null;
    }
}
