package com.ryuqq.factory.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 정책상 허용된 Event 소스 집합 ("all" 또는 명시 집합).
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class AllowedSources {

    private static final AllowedSources ALL = new AllowedSources(true, EnumSet.allOf(EventSource.class));

    private final boolean all;
    private final Set<EventSource> sources;

    private AllowedSources(boolean all, Set<EventSource> sources) {
        this.all = all;
        this.sources = Collections.unmodifiableSet(sources);
    }

    /**
     * 모든 소스 허용.
     */
    public static AllowedSources all() {
        return ALL;
    }

    /**
     * 명시한 소스만 허용.
     *
     * @param sources 허용 소스 (빈 집합이면 모든 Event 거부)
     * @return AllowedSources
     * @throws IllegalArgumentException sources가 null인 경우
     */
    public static AllowedSources of(Set<EventSource> sources) {
        if (sources == null) {
            throw new IllegalArgumentException("sources cannot be null");
        }
        EnumSet<EventSource> copy = EnumSet.noneOf(EventSource.class);
        copy.addAll(sources);
        return new AllowedSources(false, copy);
    }

    public static AllowedSources of(EventSource first, EventSource... rest) {
        return of(EnumSet.of(first, rest));
    }

    public boolean permits(EventSource source) {
        return all || sources.contains(source);
    }

    public boolean isAll() {
        return all;
    }

    public Set<EventSource> getSources() {
        return sources;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AllowedSources that = (AllowedSources) o;
        return all == that.all && sources.equals(that.sources);
    }

    @Override
    public int hashCode() {
        return 31 * Boolean.hashCode(all) + sources.hashCode();
    }

    @Override
    public String toString() {
        return all ? "AllowedSources{all}" : "AllowedSources{" + sources + '}';
    }
}
