package com.ryuqq.factory.core.model;

/**
 * Develop 단계에서 스텝 하나가 만든 산출물.
 *
 * @param type 산출물 종류
 * @param step 산출물을 만든 스텝
 * @param path 산출물 경로
 * @param hash 내용 해시 (SHA-256 hex)
 *
 * @author Factory Team
 * @since 1.0.0
 */
public record Artifact(ArtifactType type, String step, String path, String hash) {

    public Artifact {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash cannot be null or blank");
        }
    }
}
