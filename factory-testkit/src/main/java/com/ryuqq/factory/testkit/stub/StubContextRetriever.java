package com.ryuqq.factory.testkit.stub;

import com.ryuqq.factory.core.spi.ContextRetriever;
import com.ryuqq.factory.core.spi.RetrievedContext;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ContextRetriever stub returning fixed patterns and counting calls.
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class StubContextRetriever implements ContextRetriever {

    private final RetrievedContext context;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile RuntimeException failure;

    public StubContextRetriever(List<String> patterns, double relevance) {
        this.context = new RetrievedContext(patterns, relevance);
    }

    public static StubContextRetriever empty() {
        return new StubContextRetriever(List.of(), 0.0);
    }

    /**
     * 다음 호출부터 예외를 던지도록 설정.
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public RetrievedContext retrieve(String scope) {
        calls.incrementAndGet();
        RuntimeException toThrow = failure;
        if (toThrow != null) {
            throw toThrow;
        }
        return context;
    }

    public int getCalls() {
        return calls.get();
    }
}
