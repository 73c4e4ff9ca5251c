package com.hartwig.wdlc.scan;

import java.util.List;

import org.immutables.value.Value;

/**
 * A block found by the scanner: its name, its verbatim text including the opening and closing lines, and the lines
 * that follow it.
 */
@Value.Immutable
@Value.Style(jdkOnly = true)
interface ScannedElement {
    String name();

    String text();

    List<String> remainingLines();
}
