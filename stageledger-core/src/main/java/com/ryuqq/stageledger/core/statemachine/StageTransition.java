package com.ryuqq.stageledger.core.statemachine;

import com.ryuqq.stageledger.core.model.StageResult;
import com.ryuqq.stageledger.core.model.StageState;
import com.ryuqq.stageledger.core.model.StageStatus;

/**
 * Stage 상태 전이 규칙.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>UNSET → STARTED</li>
 *   <li>UNSET → COMPLETED</li>
 *   <li>STARTED → COMPLETED</li>
 * </ul>
 *
 * <p><strong>변경 없음 (no-op):</strong></p>
 * <ul>
 *   <li>STARTED → STARTED</li>
 *   <li>COMPLETED → COMPLETED</li>
 *   <li>COMPLETED → STARTED: 요청 무시, COMPLETED 유지</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> COMPLETED는 종료 상태이며 어떤 요청으로도 다시 열리지 않습니다.
 * 역방향 요청은 예외 없이 정규화되어 {@code (COMPLETED, changed=false)}가 됩니다.</p>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public final class StageTransition {

    // Utility class - prevent instantiation
    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 현재 상태와 요청 상태로부터 결과 계산.
     *
     * @param current 현재 상태
     * @param desired 요청 상태
     * @return 최종 상태와 변경 여부
     * @throws IllegalArgumentException current 또는 desired가 null인 경우
     */
    public static StageResult resolve(StageState current, StageStatus desired) {
        if (current == null || desired == null) {
            throw new IllegalArgumentException(
                "States cannot be null (current: " + current + ", desired: " + desired + ")");
        }

        // 종료 상태: 요청 무시
        if (current.isTerminal()) {
            return StageResult.unchanged(current);
        }
        if (current.matches(desired)) {
            return StageResult.unchanged(current);
        }
        return StageResult.changedTo(desired);
    }

    /**
     * 요청이 거부(정규화)되는 역방향 전이인지 확인.
     *
     * @param current 현재 상태
     * @param desired 요청 상태
     * @return COMPLETED에서 다른 상태를 요청한 경우 true
     * @throws IllegalArgumentException current 또는 desired가 null인 경우
     */
    public static boolean isBackward(StageState current, StageStatus desired) {
        if (current == null || desired == null) {
            throw new IllegalArgumentException(
                "States cannot be null (current: " + current + ", desired: " + desired + ")");
        }
        return current.isTerminal() && !current.matches(desired);
    }
}
