package com.ryuqq.factory.core.spi;

import java.util.List;

/**
 * Related prior-work snippets returned by a {@link ContextRetriever}.
 *
 * @param patterns related patterns (may be empty)
 * @param relevance relevance score of the lookup
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record RetrievedContext(List<String> patterns, double relevance) {

    public static final RetrievedContext EMPTY = new RetrievedContext(List.of(), 0.0);

    public RetrievedContext {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }
}
