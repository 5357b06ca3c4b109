package com.ryuqq.factory.core.spi;

/**
 * Context/knowledge retrieval SPI, consulted once per Run during Foster.
 *
 * @author Factory Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContextRetriever {

    /**
     * Looks up prior work related to the scope.
     *
     * @param scope non-blank scope description
     * @return retrieved context (never null, {@link RetrievedContext#EMPTY} when nothing matches)
     */
    RetrievedContext retrieve(String scope);
}
