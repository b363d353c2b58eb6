package com.ryuqq.stageledger.core.model;

/**
 * Stage 상태 변경 요청의 결과.
 *
 * @param state 요청 처리 후 최종 상태
 * @param changed 문서가 실제로 변경되었는지 (또는 check mode에서 변경될 것인지)
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public record StageResult(
    StageState state,
    boolean changed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException state가 null인 경우
     */
    public StageResult {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * 변경 없음 결과 생성.
     *
     * @param state 현재 상태
     * @return changed=false인 결과
     */
    public static StageResult unchanged(StageState state) {
        return new StageResult(state, false);
    }

    /**
     * 변경됨 결과 생성.
     *
     * @param status 새로 기록된 상태
     * @return changed=true인 결과
     */
    public static StageResult changedTo(StageStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        return new StageResult(status.toState(), true);
    }
}
