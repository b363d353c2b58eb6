package com.ryuqq.stageledger.application.ledger;

import com.ryuqq.stageledger.core.model.StageName;
import com.ryuqq.stageledger.core.model.StageStatus;

/**
 * Stage 상태 요청.
 *
 * <p><strong>모드:</strong></p>
 * <ul>
 *   <li>기본: 요청 상태를 기록 (COMPLETED 규칙 적용)</li>
 *   <li>readOnly: 현재 상태만 조회, 기록하지 않음</li>
 *   <li>checkMode: 기록했을 때의 결과만 계산, 문서 생성/기록 없음</li>
 * </ul>
 *
 * @param name Stage 이름
 * @param desiredStatus 요청 상태
 * @param readOnly 조회 전용 여부
 * @param checkMode dry-run 여부
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public record StageRequest(
    StageName name,
    StageStatus desiredStatus,
    boolean readOnly,
    boolean checkMode
) {

    /**
     * 이름을 지정하지 않은 요청에 사용되는 Stage 이름.
     */
    public static final String DEFAULT_NAME = "keyname";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 desiredStatus가 null인 경우
     */
    public StageRequest {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (desiredStatus == null) {
            throw new IllegalArgumentException("desiredStatus cannot be null");
        }
    }

    /**
     * 상태 기록 요청 생성.
     *
     * @param name Stage 이름
     * @param desiredStatus 요청 상태
     * @return StageRequest
     */
    public static StageRequest of(String name, StageStatus desiredStatus) {
        return new StageRequest(StageName.of(name), desiredStatus, false, false);
    }

    /**
     * "started" 기록 요청 생성.
     *
     * @param name Stage 이름
     * @return StageRequest
     */
    public static StageRequest started(String name) {
        return of(name, StageStatus.STARTED);
    }

    /**
     * "completed" 기록 요청 생성.
     *
     * @param name Stage 이름
     * @return StageRequest
     */
    public static StageRequest completed(String name) {
        return of(name, StageStatus.COMPLETED);
    }

    /**
     * 기본값 요청 생성 (name={@value #DEFAULT_NAME}, status=STARTED).
     *
     * @return StageRequest
     */
    public static StageRequest defaults() {
        return started(DEFAULT_NAME);
    }

    /**
     * 조회 전용 요청으로 변경한 새 인스턴스 생성.
     *
     * @return readOnly=true인 StageRequest
     */
    public StageRequest asReadOnly() {
        return new StageRequest(name, desiredStatus, true, checkMode);
    }

    /**
     * check mode 요청으로 변경한 새 인스턴스 생성.
     *
     * @return checkMode=true인 StageRequest
     */
    public StageRequest inCheckMode() {
        return new StageRequest(name, desiredStatus, readOnly, true);
    }
}
