package com.ryuqq.stageledger.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 영속화되는 상태 문서.
 *
 * <p>스키마 버전과 Stage 이름 → 상태 맵으로 구성되며,
 * 저장의 단위는 항상 문서 전체입니다 (부분 갱신 없음).</p>
 *
 * <p><strong>Wire 형식:</strong></p>
 * <pre>
 * {"version":"v1","stages":{"step1":"started","step2":"completed"}}
 * </pre>
 *
 * <p><strong>불변성:</strong> {@link #withStage(StageName, StageStatus)}는 새 문서를 반환합니다.</p>
 *
 * @param version 스키마 버전 (항상 {@value #SCHEMA_VERSION})
 * @param stages Stage 이름 → 상태 (수정 불가 맵)
 *
 * @author StageLedger Team
 * @since 1.0.0
 */
public record StateDocument(
    String version,
    Map<StageName, StageStatus> stages
) {

    /**
     * 현재 지원하는 스키마 버전.
     */
    public static final String SCHEMA_VERSION = "v1";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException version이 지원되지 않거나 stages에 null이 포함된 경우
     */
    public StateDocument {
        if (!SCHEMA_VERSION.equals(version)) {
            throw new IllegalArgumentException("Unsupported schema version: " + version);
        }
        if (stages == null) {
            throw new IllegalArgumentException("stages cannot be null");
        }
        TreeMap<StageName, StageStatus> copy = new TreeMap<>();
        stages.forEach((name, status) -> {
            if (name == null || status == null) {
                throw new IllegalArgumentException("stages cannot contain null names or statuses");
            }
            copy.put(name, status);
        });
        stages = Collections.unmodifiableMap(copy);
    }

    /**
     * 빈 문서 생성.
     *
     * @return {"version":"v1","stages":{}}
     */
    public static StateDocument empty() {
        return new StateDocument(SCHEMA_VERSION, Map.of());
    }

    /**
     * Stage 상태 조회.
     *
     * @param name Stage 이름
     * @return 기록된 상태, 없으면 {@link StageState#UNSET}
     */
    public StageState stateOf(StageName name) {
        return Optional.ofNullable(stages.get(name))
                .map(StageStatus::toState)
                .orElse(StageState.UNSET);
    }

    /**
     * 하나의 Stage만 변경한 새 문서 생성.
     *
     * <p>다른 Stage의 상태는 그대로 유지됩니다.</p>
     *
     * @param name Stage 이름
     * @param status 새 상태
     * @return 새 StateDocument
     * @throws IllegalArgumentException name 또는 status가 null인 경우
     */
    public StateDocument withStage(StageName name, StageStatus status) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        TreeMap<StageName, StageStatus> updated = new TreeMap<>(stages);
        updated.put(name, status);
        return new StateDocument(version, updated);
    }
}
