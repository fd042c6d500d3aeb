package com.ryuqq.evolution.application.interpreter;

import com.ryuqq.evolution.application.ledger.EvolutionLedger;
import com.ryuqq.evolution.core.contract.ChangeDescriptor;
import com.ryuqq.evolution.core.intent.IntentAction;
import com.ryuqq.evolution.core.intent.MutationIntent;
import com.ryuqq.evolution.core.model.EvolutionOperation;
import com.ryuqq.evolution.core.model.OperationId;
import com.ryuqq.evolution.core.spi.MetamodelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Operation Interpreter.
 *
 * <p>Change Descriptor를 Evolution Operation으로 해석하고 원장에 기록합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. (changeType, elementKind) → IntentAction
 *    - 인식 불가 조합 → 의도 없음, AMBIGUOUS ("Unknown change type or element")
 * 2. IntentFactory로 의도 생성 (기본값 적용)
 *    - 형태가 잘못된 값 → 의도 없음, AMBIGUOUS (사유에 키 이름 포함)
 * 3. IntentValidator로 현재 Store 상태 검증
 *    - 첫 번째 위반 → AMBIGUOUS (의도 유지, 해소 가능)
 *    - 위반 없음 → PENDING
 * 4. EvolutionLedger.record()
 * </pre>
 *
 * <p>검증은 원장이 아니라 Store만 봅니다. 아직 적용되지 않은 PENDING 작업과의 충돌은
 * 해석 시점에 드러나지 않습니다.</p>
 *
 * <p>모호성은 예외가 아니라 상태로 표현되며, 이 메서드에서 검증 문제가 예외로 빠져나가지 않습니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class OperationInterpreter {

    static final String UNKNOWN_CHANGE = "Unknown change type or element";

    private static final Logger log = LoggerFactory.getLogger(OperationInterpreter.class);

    private final EvolutionLedger ledger;
    private final IntentFactory intentFactory;
    private final IntentValidator validator;

    /**
     * 기본 설정 생성자.
     *
     * @param store 검증 기준 Store
     * @param ledger 기록 대상 원장
     */
    public OperationInterpreter(MetamodelStore store, EvolutionLedger ledger) {
        this(store, ledger, new InterpreterConfig());
    }

    /**
     * 생성자.
     *
     * @param store 검증 기준 Store
     * @param ledger 기록 대상 원장
     * @param config 기본값 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OperationInterpreter(MetamodelStore store, EvolutionLedger ledger, InterpreterConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.ledger = ledger;
        this.intentFactory = new IntentFactory(config);
        this.validator = new IntentValidator(store);
    }

    /**
     * Change Descriptor 해석.
     *
     * @param descriptor 변경 기술
     * @return 원장에 기록된 작업 (PENDING 또는 AMBIGUOUS)
     * @throws IllegalArgumentException descriptor가 null인 경우
     */
    public EvolutionOperation interpret(ChangeDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }

        EvolutionOperation operation = toOperation(OperationId.generate(), descriptor);
        ledger.record(operation);

        if (operation.isAmbiguous()) {
            log.info("Operation {} ({} {}) is ambiguous: {}", operation.getId().getValue(),
                descriptor.changeType(), descriptor.elementKind(), operation.getAmbiguityReason());
        } else {
            log.debug("Operation {} ({} {}) queued as pending", operation.getId().getValue(),
                descriptor.changeType(), descriptor.elementKind());
        }
        return operation;
    }

    private EvolutionOperation toOperation(OperationId id, ChangeDescriptor descriptor) {
        Optional<IntentAction> action = IntentAction.parse(descriptor.changeType(), descriptor.elementKind());
        if (action.isEmpty()) {
            return EvolutionOperation.ambiguous(id, descriptor, null, UNKNOWN_CHANGE);
        }

        MutationIntent intent;
        try {
            intent = intentFactory.create(action.get(), descriptor.details());
        } catch (IllegalArgumentException e) {
            return EvolutionOperation.ambiguous(id, descriptor, null, e.getMessage());
        }

        Optional<String> violation = validator.validate(intent);
        if (violation.isPresent()) {
            return EvolutionOperation.ambiguous(id, descriptor, intent, violation.get());
        }
        return EvolutionOperation.pending(id, descriptor, intent);
    }
}
