package com.hartwig.wdlc.error;

import java.util.List;
import java.util.Optional;

/**
 * The front-end did not accept a source. Either a user supplied file, or text generated by the compiler itself, in
 * which case the offending text is carried along.
 */
public class FrontEndRejectionException extends WdlcException {
    private final List<String> errors;
    private final String generatedSource;

    public FrontEndRejectionException(final String message, final List<String> errors) {
        this(message, errors, null);
    }

    public FrontEndRejectionException(final String message, final List<String> errors, final String generatedSource) {
        super(format(message, errors, generatedSource));
        this.errors = List.copyOf(errors);
        this.generatedSource = generatedSource;
    }

    public List<String> getErrors() {
        return errors;
    }

    public Optional<String> getGeneratedSource() {
        return Optional.ofNullable(generatedSource);
    }

    private static String format(String message, List<String> errors, String generatedSource) {
        var builder = new StringBuilder(message).append("\nValidation errors:");
        for (String error : errors) {
            builder.append("\n  ").append(error);
        }
        if (generatedSource != null) {
            builder.append("\nGenerated source:\n").append(generatedSource);
        }
        return builder.toString();
    }
}
