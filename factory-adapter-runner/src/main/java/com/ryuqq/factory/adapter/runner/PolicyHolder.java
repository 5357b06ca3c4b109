package com.ryuqq.factory.adapter.runner;

import com.ryuqq.factory.core.model.Policy;
import com.ryuqq.factory.core.model.PolicyPatch;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 현재 Policy의 단일 쓰기 보관소.
 *
 * <p>읽기는 항상 완전한 스냅샷을 돌려주며, 부분 갱신은 직렬화되어 서로의 변경을 덮어쓰지 않습니다.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
public final class PolicyHolder {

    private final AtomicReference<Policy> current;

    public PolicyHolder() {
        this(Policy.defaults());
    }

    public PolicyHolder(Policy initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial policy cannot be null");
        }
        this.current = new AtomicReference<>(initial);
    }

    public Policy get() {
        return current.get();
    }

    public Policy replace(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        current.set(policy);
        return policy;
    }

    /**
     * 부분 갱신 (null 필드는 현재 값 유지).
     *
     * @return 갱신된 Policy
     */
    public Policy update(PolicyPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        return current.updateAndGet(policy -> policy.merge(patch));
    }
}
