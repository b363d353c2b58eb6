package com.ryuqq.stageledger.core.model;

/**
 * 상태 문서에 기록되는 Stage 상태.
 *
 * <p>문서에는 이 두 값만 저장됩니다. 키가 없으면 "한 번도 기록되지 않음"을 의미하며,
 * 이는 {@link StageState#UNSET}으로 표현됩니다.</p>
 *
 * <p><strong>Wire 표현:</strong></p>
 * <ul>
 *   <li>STARTED → "started"</li>
 *   <li>COMPLETED → "completed"</li>
 * </ul>
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public enum StageStatus {

    /**
     * 시작됨 (아직 완료되지 않음).
     */
    STARTED("started"),

    /**
     * 완료됨 (재실행 시 건너뜀).
     */
    COMPLETED("completed");

    private final String wireValue;

    StageStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 문서에 저장되는 문자열 값.
     *
     * @return "started" 또는 "completed"
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 대응하는 {@link StageState}로 변환.
     *
     * @return StageState
     */
    public StageState toState() {
        return this == STARTED ? StageState.STARTED : StageState.COMPLETED;
    }

    /**
     * 문자열 값으로부터 StageStatus 조회.
     *
     * @param wireValue "started" 또는 "completed"
     * @return StageStatus
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static StageStatus fromWireValue(String wireValue) {
        for (StageStatus status : values()) {
            if (status.wireValue.equals(wireValue)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown stage status: " + wireValue);
    }
}
