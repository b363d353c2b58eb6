package com.ryuqq.stageledger.application.config;

import com.ryuqq.stageledger.core.model.StateLocation;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * StageLedger 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>backend: 저장 매체 (기본 LOCAL)</li>
 *   <li>stateFile: 로컬 경로 또는 S3 객체 키 (필수)</li>
 *   <li>bucketName: S3 버킷 (기본 {@value #DEFAULT_BUCKET_NAME}, LOCAL에서는 무시)</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong></p>
 * <pre>
 * stageledger.backend=s3
 * stageledger.state-file=path/to/state.json
 * stageledger.bucket-name=ca-state-bucket
 * </pre>
 *
 * @author StageLedger Team
 * @since 1.0.0
 * @param backend 저장 매체
 * @param stateFile 로컬 경로 또는 S3 객체 키
 * @param bucketName S3 버킷 이름
 */
public record LedgerConfig(BackendKind backend, String stateFile, String bucketName) {

    public static final String DEFAULT_BUCKET_NAME = "ca-state-bucket";

    public static final String BACKEND_PROPERTY = "stageledger.backend";
    public static final String STATE_FILE_PROPERTY = "stageledger.state-file";
    public static final String BUCKET_NAME_PROPERTY = "stageledger.bucket-name";

    /**
     * 로컬 파일 설정 생성자.
     *
     * @param stateFile 상태 파일 경로
     */
    public LedgerConfig(String stateFile) {
        this(BackendKind.LOCAL, stateFile, DEFAULT_BUCKET_NAME);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LedgerConfig {
        if (backend == null) {
            throw new IllegalArgumentException("backend cannot be null");
        }
        if (stateFile == null || stateFile.isBlank()) {
            throw new IllegalArgumentException("Path for state file can not be null or blank");
        }
        if (bucketName == null || bucketName.isBlank()) {
            bucketName = DEFAULT_BUCKET_NAME;
        }
    }

    /**
     * Properties로부터 설정 생성.
     *
     * @param properties 설정 값
     * @return LedgerConfig
     * @throws IllegalArgumentException state-file이 없거나 backend 값이 잘못된 경우
     */
    public static LedgerConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        String backend = properties.getProperty(BACKEND_PROPERTY, BackendKind.LOCAL.name());
        return new LedgerConfig(
            BackendKind.fromValue(backend),
            properties.getProperty(STATE_FILE_PROPERTY),
            properties.getProperty(BUCKET_NAME_PROPERTY, DEFAULT_BUCKET_NAME)
        );
    }

    /**
     * 클래스패스 properties 파일로부터 설정 생성.
     *
     * @param resource 리소스 이름 (예: "stageledger.properties")
     * @return LedgerConfig
     * @throws IllegalStateException 리소스가 없거나 읽을 수 없는 경우
     */
    public static LedgerConfig load(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = LedgerConfig.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration resource: " + resource, e);
        }
    }

    /**
     * 설정된 상태 문서 위치.
     *
     * @return LOCAL이면 경로, S3이면 버킷 + 키
     */
    public StateLocation location() {
        return backend == BackendKind.S3
            ? StateLocation.inBucket(bucketName, stateFile)
            : StateLocation.ofPath(stateFile);
    }

    /**
     * backend만 변경한 새 인스턴스 생성.
     *
     * @param backend 새 저장 매체
     * @return 새 LedgerConfig 인스턴스
     */
    public LedgerConfig withBackend(BackendKind backend) {
        return new LedgerConfig(backend, this.stateFile, this.bucketName);
    }

    /**
     * bucketName만 변경한 새 인스턴스 생성.
     *
     * @param bucketName 새 버킷 이름
     * @return 새 LedgerConfig 인스턴스
     */
    public LedgerConfig withBucketName(String bucketName) {
        return new LedgerConfig(this.backend, this.stateFile, bucketName);
    }
}
