package com.ryuqq.stageledger.application.config;

import java.util.Locale;

/**
 * 상태 문서 저장 매체 종류.
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public enum BackendKind {

    /**
     * 로컬 파일시스템.
     */
    LOCAL,

    /**
     * Amazon S3 버킷.
     */
    S3;

    /**
     * 설정 문자열로부터 BackendKind 조회 (대소문자 무시).
     *
     * @param value "local" 또는 "s3"
     * @return BackendKind
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static BackendKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("backend cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown backend: " + value + " (expected local or s3)", e);
        }
    }
}
