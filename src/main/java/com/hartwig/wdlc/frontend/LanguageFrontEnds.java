package com.hartwig.wdlc.frontend;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.hartwig.wdlc.error.UnsupportedDialectException;
import com.hartwig.wdlc.wdl.Dialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The front-ends available to the compiler, one per dialect.
 */
public class LanguageFrontEnds {
    private static final Logger LOGGER = LoggerFactory.getLogger(LanguageFrontEnds.class);

    private static final List<Dialect> DETECTION_ORDER = List.of(Dialect.V1_0, Dialect.DEVELOPMENT, Dialect.CWL_1_0);
    private static final Dialect FALLBACK = Dialect.DRAFT_2;

    private final Map<Dialect, LanguageFrontEnd> frontEndByDialect = new EnumMap<>(Dialect.class);

    public LanguageFrontEnds(final List<LanguageFrontEnd> frontEnds) {
        for (LanguageFrontEnd frontEnd : frontEnds) {
            if (frontEndByDialect.put(frontEnd.dialect(), frontEnd) != null) {
                throw new IllegalArgumentException(String.format("Front-end for dialect '%s' registered twice", frontEnd.dialect()));
            }
        }
    }

    /**
     * Figures out which dialect a source is written in. Draft-2 has no version statement, so it is assumed when no
     * other front-end recognizes the source.
     */
    public Dialect detect(String source) {
        for (Dialect dialect : DETECTION_ORDER) {
            var frontEnd = frontEndByDialect.get(dialect);
            if (frontEnd != null && frontEnd.looksParsable(source)) {
                LOGGER.debug("Detected dialect {}", dialect);
                return dialect;
            }
        }
        LOGGER.debug("No dialect matched, falling back to {}", FALLBACK);
        return FALLBACK;
    }

    public LanguageFrontEnd forDialect(Dialect dialect) throws UnsupportedDialectException {
        var frontEnd = frontEndByDialect.get(dialect);
        if (frontEnd == null) {
            throw new UnsupportedDialectException(String.format("No front-end available for %s", dialect));
        }
        return frontEnd;
    }
}
