package com.hartwig.wdlc.codegen;

import java.util.List;

import com.hartwig.wdlc.error.FrontEndRejectionException;
import com.hartwig.wdlc.error.UnsupportedDialectException;
import com.hartwig.wdlc.frontend.LanguageFrontEnds;
import com.hartwig.wdlc.wdl.Dialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds generated source back into the front-end. Generated text that does not pass is unusable.
 */
public class SourceValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceValidator.class);

    private final LanguageFrontEnds frontEnds;

    public SourceValidator(final LanguageFrontEnds frontEnds) {
        this.frontEnds = frontEnds;
    }

    public void validate(String source, Dialect dialect) throws FrontEndRejectionException, UnsupportedDialectException {
        var result = frontEnds.forDialect(dialect).analyze(source, List.of());
        if (!result.isValid()) {
            LOGGER.error("Found errors in generated {} source:\n{}", dialect, source);
            throw new FrontEndRejectionException("Generated source is not valid " + dialect, result.errors(), source);
        }
        LOGGER.debug("Generated source of {} characters passed validation", source.length());
    }
}
