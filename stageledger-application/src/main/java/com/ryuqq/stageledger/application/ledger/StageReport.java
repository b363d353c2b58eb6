package com.ryuqq.stageledger.application.ledger;

import com.ryuqq.stageledger.core.model.StageName;
import com.ryuqq.stageledger.core.model.StageState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage 요청 처리 결과.
 *
 * @param name Stage 이름
 * @param state 최종 상태
 * @param changed 문서 변경 여부 (check mode에서는 변경될 것인지)
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public record StageReport(
    StageName name,
    StageState state,
    boolean changed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 state가 null인 경우
     */
    public StageReport {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    /**
     * 워크플로 엔진에 전달할 결과 맵.
     *
     * @return {name, state, changed} (state는 "unset", "started", "completed")
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name.getValue());
        result.put("state", state.wireValue());
        result.put("changed", changed);
        return result;
    }
}
