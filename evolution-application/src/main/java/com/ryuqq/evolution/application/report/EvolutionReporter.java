package com.ryuqq.evolution.application.report;

import com.ryuqq.evolution.application.ledger.EvolutionLedger;
import com.ryuqq.evolution.core.model.EvolutionOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * Evolution Reporter.
 *
 * <p>원장의 읽기 전용 투영입니다. 부수 효과가 없습니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class EvolutionReporter {

    private final EvolutionLedger ledger;

    public EvolutionReporter(EvolutionLedger ledger) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.ledger = ledger;
    }

    /**
     * 현재 원장 보고서 생성.
     *
     * @return EvolutionReport
     */
    public EvolutionReport report() {
        List<EvolutionOperation> history = ledger.history();
        List<OperationSummary> summaries = new ArrayList<>(history.size());
        for (EvolutionOperation operation : history) {
            summaries.add(OperationSummary.from(operation));
        }
        return new EvolutionReport(history.size(), ledger.pendingCount(), ledger.ambiguousCount(), summaries);
    }
}
