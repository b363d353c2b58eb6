package com.ryuqq.stageledger.core.model;

import java.util.Locale;

/**
 * 조회 시점의 Stage 상태.
 *
 * <p>{@link StageStatus}와 달리 "기록 없음"을 나타내는 {@link #UNSET}을 포함합니다.
 * UNSET은 조회 결과로만 사용되며 문서에 저장되지 않습니다.</p>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNSET
 *    │
 *    ├─► STARTED ─► COMPLETED
 *    │
 *    └─► COMPLETED
 *
 * COMPLETED는 종료 상태: 이후 요청은 모두 무시됨
 * </pre>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public enum StageState {

    /**
     * 기록 없음.
     */
    UNSET,

    /**
     * 시작됨.
     */
    STARTED,

    /**
     * 완료됨 (종료 상태).
     */
    COMPLETED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /**
     * 요청된 상태와 같은지 확인.
     *
     * @param status 비교할 상태
     * @return 같은 상태면 true
     */
    public boolean matches(StageStatus status) {
        return status != null && this == status.toState();
    }

    /**
     * 보고용 문자열 ("unset", "started", "completed").
     *
     * @return 소문자 상태명
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
