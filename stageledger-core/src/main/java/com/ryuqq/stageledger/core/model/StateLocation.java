package com.ryuqq.stageledger.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * 상태 문서가 저장되는 위치.
 *
 * <p>두 가지 형태가 있습니다:</p>
 * <ul>
 *   <li>로컬 경로: {@code StateLocation.ofPath("state.json")}</li>
 *   <li>버킷 + 키: {@code StateLocation.inBucket("ca-state-bucket", "path/to/state.json")}</li>
 * </ul>
 *
 * <p>각 Backend는 자신이 처리할 수 없는 형태의 위치를 거부합니다.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public final class StateLocation {

    private final String bucket;
    private final String key;

    private StateLocation(String bucket, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (bucket != null && bucket.isBlank()) {
            throw new IllegalArgumentException("bucket cannot be blank");
        }
        this.bucket = bucket;
        this.key = key;
    }

    /**
     * 로컬 경로 위치 생성.
     *
     * @param path 파일 경로
     * @return StateLocation
     * @throws IllegalArgumentException path가 비어있는 경우
     */
    public static StateLocation ofPath(String path) {
        return new StateLocation(null, path);
    }

    /**
     * 버킷 내 객체 위치 생성.
     *
     * @param bucket 버킷 이름
     * @param key 객체 키
     * @return StateLocation
     * @throws IllegalArgumentException bucket 또는 key가 비어있는 경우
     */
    public static StateLocation inBucket(String bucket, String key) {
        if (bucket == null) {
            throw new IllegalArgumentException("bucket cannot be null");
        }
        return new StateLocation(bucket, key);
    }

    /**
     * 버킷 이름 조회.
     *
     * @return 버킷 이름 (로컬 경로인 경우 empty)
     */
    public Optional<String> bucket() {
        return Optional.ofNullable(bucket);
    }

    /**
     * 경로 또는 객체 키 조회.
     *
     * @return 경로 (로컬) 또는 객체 키 (버킷)
     */
    public String key() {
        return key;
    }

    /**
     * 버킷 위치인지 확인.
     *
     * @return 버킷이 지정된 경우 true
     */
    public boolean isBucketLocation() {
        return bucket != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateLocation that = (StateLocation) o;
        return Objects.equals(bucket, that.bucket) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, key);
    }

    @Override
    public String toString() {
        return bucket == null ? key : "s3://" + bucket + "/" + key;
    }
}
