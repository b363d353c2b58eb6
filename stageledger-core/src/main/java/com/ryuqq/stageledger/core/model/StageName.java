package com.ryuqq.stageledger.core.model;

/**
 * 워크플로 Stage의 이름.
 *
 * <p>StageName은 상태 문서의 {@code stages} 맵에서 키로 사용되며,
 * 재실행 시 완료 여부를 판단하는 기준이 됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public final class StageName implements Comparable<StageName> {

    private final String value;

    private StageName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StageName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("StageName length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * StageName 생성.
     *
     * @param value Stage 이름
     * @return StageName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static StageName of(String value) {
        return new StageName(value);
    }

    /**
     * StageName 값 조회.
     *
     * @return Stage 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(StageName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageName stageName = (StageName) o;
        return value.equals(stageName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "StageName{" + value + '}';
    }
}
