package com.ryuqq.evolution.application.report;

import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.model.EvolutionOperation;
import com.ryuqq.evolution.core.outcome.FailureCode;
import com.ryuqq.evolution.core.statemachine.LifecycleState;

/**
 * 보고서용 작업 요약 (불변 스냅샷).
 *
 * @param operationId 작업 ID 값
 * @param changeType 변경 종류 원문
 * @param elementKind 요소 종류 원문
 * @param details 세부 정보 원문
 * @param state 생명주기 상태
 * @param ambiguityReason 모호성 사유 (AMBIGUOUS일 때만)
 * @param failureCode 실패 분류 (FAILED일 때만)
 * @param failureDetail 실패 상세 (FAILED일 때만)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record OperationSummary(
    String operationId,
    String changeType,
    String elementKind,
    Details details,
    LifecycleState state,
    String ambiguityReason,
    FailureCode failureCode,
    String failureDetail
) {

    /**
     * 작업으로부터 요약 생성.
     *
     * @param operation 작업
     * @return OperationSummary
     */
    public static OperationSummary from(EvolutionOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return new OperationSummary(
            operation.getId().getValue(),
            operation.getChangeType(),
            operation.getElementKind(),
            operation.getDetails(),
            operation.getState(),
            operation.getAmbiguityReason(),
            operation.getFailureCode(),
            operation.getFailureDetail()
        );
    }
}
