package com.ryuqq.evolution.application.report;

import com.ryuqq.evolution.core.statemachine.LifecycleState;

import java.util.List;

/**
 * 원장 보고서 (불변 record).
 *
 * @param totalOperations 기록된 전체 작업 수
 * @param pendingCount pending queue 크기
 * @param ambiguousCount ambiguity set 크기
 * @param operations 전체 작업 요약 (기록 순서)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record EvolutionReport(
    int totalOperations,
    int pendingCount,
    int ambiguousCount,
    List<OperationSummary> operations
) {

    public EvolutionReport {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    /**
     * 상태별 작업 수.
     *
     * @param state 생명주기 상태
     * @return 해당 상태의 작업 수
     */
    public long countByState(LifecycleState state) {
        return operations.stream()
            .filter(summary -> summary.state() == state)
            .count();
    }
}
