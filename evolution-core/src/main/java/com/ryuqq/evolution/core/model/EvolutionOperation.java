package com.ryuqq.evolution.core.model;

import com.ryuqq.evolution.core.contract.ChangeDescriptor;
import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.intent.MutationIntent;
import com.ryuqq.evolution.core.outcome.FailureCode;
import com.ryuqq.evolution.core.statemachine.LifecycleState;
import com.ryuqq.evolution.core.statemachine.StateTransition;

/**
 * Evolution Ledger의 기록 단위.
 *
 * <p>해석된 변경 하나를 나타내며, 원본 변경 내용(감사/표시용)과 변경 의도,
 * 그리고 생명주기 상태를 함께 보관합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>ambiguityReason은 AMBIGUOUS 상태에서만 존재</li>
 *   <li>failureCode와 failureDetail은 FAILED 상태에서만 존재</li>
 *   <li>intent가 null이면 AMBIGUOUS 상태 (해석 자체가 실패한 경우)</li>
 *   <li>모든 상태 변경은 {@link StateTransition} 규칙을 따름</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * 생성(Interpreter) → PENDING | AMBIGUOUS
 * AMBIGUOUS → resolve() → PENDING
 * PENDING → markApplied() → APPLIED
 * PENDING → markFailed()  → FAILED
 * </pre>
 *
 * <p>단일 스레드 사용을 전제로 하며, 동기화하지 않습니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class EvolutionOperation {

    private final OperationId id;
    private final String changeType;
    private final String elementKind;
    private final Details details;

    private LifecycleState state;
    private String ambiguityReason;
    private MutationIntent intent;
    private FailureCode failureCode;
    private String failureDetail;

    private EvolutionOperation(OperationId id, ChangeDescriptor descriptor, MutationIntent intent,
                               LifecycleState state, String ambiguityReason) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        this.id = id;
        this.changeType = descriptor.changeType();
        this.elementKind = descriptor.elementKind();
        this.details = descriptor.details();
        this.intent = intent;
        this.state = state;
        this.ambiguityReason = ambiguityReason;
    }

    /**
     * 적용 대기 Operation 생성.
     *
     * @param id Operation ID
     * @param descriptor 원본 변경
     * @param intent 변경 의도
     * @return PENDING 상태의 Operation
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static EvolutionOperation pending(OperationId id, ChangeDescriptor descriptor, MutationIntent intent) {
        if (intent == null) {
            throw new IllegalArgumentException("intent cannot be null for a pending operation");
        }
        return new EvolutionOperation(id, descriptor, intent, LifecycleState.PENDING, null);
    }

    /**
     * 모호한 Operation 생성.
     *
     * @param id Operation ID
     * @param descriptor 원본 변경
     * @param intent 변경 의도 (해석 실패 시 null)
     * @param reason 모호성 사유
     * @return AMBIGUOUS 상태의 Operation
     * @throws IllegalArgumentException id, descriptor가 null이거나 reason이 비어있는 경우
     */
    public static EvolutionOperation ambiguous(OperationId id, ChangeDescriptor descriptor,
                                               MutationIntent intent, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank for an ambiguous operation");
        }
        return new EvolutionOperation(id, descriptor, intent, LifecycleState.AMBIGUOUS, reason);
    }

    /**
     * 모호성 해소: 병합된 의도로 교체하고 PENDING으로 전이.
     *
     * @param resolvedIntent 병합된 변경 의도
     * @throws IllegalArgumentException resolvedIntent가 null인 경우
     * @throws IllegalStateException AMBIGUOUS 상태가 아닌 경우
     */
    public void resolve(MutationIntent resolvedIntent) {
        if (resolvedIntent == null) {
            throw new IllegalArgumentException("resolvedIntent cannot be null");
        }
        this.state = StateTransition.transition(state, LifecycleState.PENDING);
        this.intent = resolvedIntent;
        this.ambiguityReason = null;
    }

    /**
     * 적용 성공 처리.
     *
     * @throws IllegalStateException PENDING 상태가 아닌 경우
     */
    public void markApplied() {
        this.state = StateTransition.transition(state, LifecycleState.APPLIED);
    }

    /**
     * 적용 실패 처리.
     *
     * @param code 실패 분류
     * @param detail 실패 상세
     * @throws IllegalArgumentException code가 null이거나 detail이 비어있는 경우
     * @throws IllegalStateException PENDING 상태가 아닌 경우
     */
    public void markFailed(FailureCode code, String detail) {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (detail == null || detail.isBlank()) {
            throw new IllegalArgumentException("detail cannot be null or blank");
        }
        this.state = StateTransition.transition(state, LifecycleState.FAILED);
        this.failureCode = code;
        this.failureDetail = detail;
    }

    public OperationId getId() {
        return id;
    }

    /**
     * @return 원본 변경 종류 문자열 (해석 전 값 그대로)
     */
    public String getChangeType() {
        return changeType;
    }

    /**
     * @return 원본 요소 종류 문자열 (해석 전 값 그대로)
     */
    public String getElementKind() {
        return elementKind;
    }

    public Details getDetails() {
        return details;
    }

    public LifecycleState getState() {
        return state;
    }

    /**
     * @return 모호성 사유, AMBIGUOUS가 아니면 null
     */
    public String getAmbiguityReason() {
        return ambiguityReason;
    }

    /**
     * @return 변경 의도, 해석이 실패한 경우 null
     */
    public MutationIntent getIntent() {
        return intent;
    }

    /**
     * @return 실패 분류, FAILED가 아니면 null
     */
    public FailureCode getFailureCode() {
        return failureCode;
    }

    /**
     * @return 실패 상세, FAILED가 아니면 null
     */
    public String getFailureDetail() {
        return failureDetail;
    }

    public boolean isAmbiguous() {
        return state == LifecycleState.AMBIGUOUS;
    }

    public boolean hasIntent() {
        return intent != null;
    }

    @Override
    public String toString() {
        return "EvolutionOperation{id=" + id.getValue()
            + ", change=" + changeType + "_" + elementKind
            + ", state=" + state
            + (ambiguityReason != null ? ", ambiguityReason='" + ambiguityReason + '\'' : "")
            + (failureCode != null ? ", failure=" + failureCode + " '" + failureDetail + '\'' : "")
            + '}';
    }
}
