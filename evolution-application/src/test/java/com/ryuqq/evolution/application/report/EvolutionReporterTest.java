package com.ryuqq.evolution.application.report;

import com.ryuqq.evolution.application.ledger.EvolutionLedger;
import com.ryuqq.evolution.core.contract.ChangeDescriptor;
import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.intent.RemoveClassIntent;
import com.ryuqq.evolution.core.model.EvolutionOperation;
import com.ryuqq.evolution.core.model.OperationId;
import com.ryuqq.evolution.core.outcome.FailureCode;
import com.ryuqq.evolution.core.statemachine.LifecycleState;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * EvolutionReporter 테스트.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
class EvolutionReporterTest {

    @Test
    void report_원장_상태를_그대로_투영() {
        // given
        EvolutionLedger ledger = new EvolutionLedger();
        ChangeDescriptor descriptor = ChangeDescriptor.of("remove", "class", Details.of(Map.of("name", "Customer")));
        EvolutionOperation failed = EvolutionOperation.pending(OperationId.of("op-1"), descriptor, new RemoveClassIntent("Customer"));
        EvolutionOperation pending = EvolutionOperation.pending(OperationId.of("op-2"), descriptor, new RemoveClassIntent("Customer"));
        EvolutionOperation ambiguous = EvolutionOperation.ambiguous(OperationId.of("op-3"),
            ChangeDescriptor.of("rename", "class", Details.empty()), null, "Unknown change type or element");
        ledger.record(failed);
        ledger.drainPending();
        failed.markFailed(FailureCode.ELEMENT_NOT_FOUND, "Class Customer not found");
        ledger.record(pending);
        ledger.record(ambiguous);

        // when
        EvolutionReport report = new EvolutionReporter(ledger).report();

        // then
        assertThat(report.totalOperations()).isEqualTo(3);
        assertThat(report.pendingCount()).isEqualTo(1);
        assertThat(report.ambiguousCount()).isEqualTo(1);
        assertThat(report.countByState(LifecycleState.FAILED)).isEqualTo(1);
        assertThat(report.countByState(LifecycleState.APPLIED)).isZero();
        assertThat(report.operations())
            .extracting(OperationSummary::operationId, OperationSummary::state)
            .containsExactly(
                tuple("op-1", LifecycleState.FAILED),
                tuple("op-2", LifecycleState.PENDING),
                tuple("op-3", LifecycleState.AMBIGUOUS));

        OperationSummary first = report.operations().get(0);
        assertThat(first.changeType()).isEqualTo("remove");
        assertThat(first.details().getString("name")).isEqualTo("Customer");
        assertThat(first.failureCode()).isEqualTo(FailureCode.ELEMENT_NOT_FOUND);
        assertThat(first.failureDetail()).isEqualTo("Class Customer not found");
        assertThat(report.operations().get(1).failureCode()).isNull();
        assertThat(report.operations().get(2).ambiguityReason()).isEqualTo("Unknown change type or element");
    }

    @Test
    void report_부수효과_없음() {
        EvolutionLedger ledger = new EvolutionLedger();
        ledger.record(EvolutionOperation.pending(OperationId.of("op-1"),
            ChangeDescriptor.of("remove", "class", Details.empty()), new RemoveClassIntent("Customer")));
        EvolutionReporter reporter = new EvolutionReporter(ledger);

        EvolutionReport first = reporter.report();
        EvolutionReport second = reporter.report();

        assertThat(second).isEqualTo(first);
        assertThat(ledger.pendingCount()).isEqualTo(1);
    }
}
