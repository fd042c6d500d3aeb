package com.ryuqq.evolution.application.applier;

import com.ryuqq.evolution.core.model.EvolutionOperation;

import java.util.List;

/**
 * 배치 적용 결과 (불변 record).
 *
 * @param success 거부되지 않았고 실패한 작업이 없으면 true
 * @param applied APPLIED로 전이된 작업 (적용 순서)
 * @param failed FAILED로 전이된 작업 (적용 순서)
 * @param errors 오류 메시지 (실패 작업당 하나, 거부 시 하나)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record BatchApplyResult(
    boolean success,
    List<EvolutionOperation> applied,
    List<EvolutionOperation> failed,
    List<String> errors
) {

    public BatchApplyResult {
        applied = applied == null ? List.of() : List.copyOf(applied);
        failed = failed == null ? List.of() : List.copyOf(failed);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * 거부된 배치 결과 생성 (아무 작업도 시도하지 않음).
     *
     * @param error 거부 사유
     * @return success=false, 오류 하나인 결과
     */
    public static BatchApplyResult refused(String error) {
        return new BatchApplyResult(false, List.of(), List.of(), List.of(error));
    }
}
