package com.ryuqq.evolution.application.resolver;

import com.ryuqq.evolution.application.ledger.EvolutionLedger;
import com.ryuqq.evolution.application.ledger.OperationNotFoundException;
import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.intent.IntentAction;
import com.ryuqq.evolution.core.intent.MutationIntent;
import com.ryuqq.evolution.core.model.EvolutionOperation;
import com.ryuqq.evolution.core.model.OperationId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ambiguity Resolver.
 *
 * <p>도메인 전문가가 제공한 resolution 데이터로 AMBIGUOUS 작업을 PENDING으로 되돌립니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>알 수 없는 OperationId: {@link OperationNotFoundException}</li>
 *   <li>AMBIGUOUS가 아닌 작업: 변경 없이 그대로 반환 (no-op)</li>
 *   <li>의도가 없는 작업 (인식 불가 조합, 형태 오류): 해소 불가, AMBIGUOUS 유지</li>
 *   <li>의도가 받지 않는 키 (예: 속성 의도에 {@code name}): {@link IllegalArgumentException}, 상태 변경 없음</li>
 *   <li>그 외: 값이 주어진 필드만 의도에 병합 → PENDING → pending queue 끝으로 이동</li>
 * </ul>
 *
 * <p><strong>재검증 없음:</strong> 해소 결과는 신뢰되며 Store 기준 검증을 다시 하지 않습니다.
 * 따라서 해소로 새로운 충돌(예: 이미 존재하는 이름)이 생길 수 있고, 이는 적용 시점에
 * FAILED로 드러납니다. 적용 전에 재검증하려면 {@code BatchApplier.applyPendingValidated()}를
 * 사용합니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class AmbiguityResolver {

    private static final Logger log = LoggerFactory.getLogger(AmbiguityResolver.class);

    private final EvolutionLedger ledger;

    /**
     * 생성자.
     *
     * @param ledger 원장
     * @throws IllegalArgumentException ledger가 null인 경우
     */
    public AmbiguityResolver(EvolutionLedger ledger) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.ledger = ledger;
    }

    /**
     * 모호성 해소.
     *
     * @param operationId 대상 작업 ID
     * @param resolution 병합할 값 ({@link com.ryuqq.evolution.core.intent.IntentFields} 키)
     * @return 대상 작업 (해소된 경우 PENDING)
     * @throws OperationNotFoundException 원장에 없는 ID인 경우
     * @throws IllegalArgumentException 인자가 null이거나, 의도가 받지 않는 키가 있거나,
     *         resolution 값의 형태가 잘못된 경우 (상태 변경 없음)
     */
    public EvolutionOperation resolve(OperationId operationId, Details resolution) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (resolution == null) {
            throw new IllegalArgumentException("resolution cannot be null");
        }

        EvolutionOperation operation = ledger.find(operationId)
            .orElseThrow(() -> new OperationNotFoundException(operationId));

        if (!operation.isAmbiguous()) {
            log.warn("Operation {} is {}, nothing to resolve", operationId.getValue(), operation.getState());
            return operation;
        }
        if (!operation.hasIntent()) {
            log.warn("Operation {} has no mutation intent and cannot be resolved: {}",
                operationId.getValue(), operation.getAmbiguityReason());
            return operation;
        }

        IntentAction action = operation.getIntent().action();
        List<String> unknownKeys = unknownKeys(action, resolution);
        if (!unknownKeys.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                "Unknown resolution keys %s for %s, expected any of %s",
                unknownKeys, action, action.resolutionKeys()));
        }

        String previousReason = operation.getAmbiguityReason();
        MutationIntent resolved = operation.getIntent().withResolution(resolution);
        operation.resolve(resolved);
        ledger.moveToResolved(operation);

        log.info("Operation {} resolved (was: {})", operationId.getValue(), previousReason);
        return operation;
    }

    private static List<String> unknownKeys(IntentAction action, Details resolution) {
        List<String> unknown = new ArrayList<>();
        for (String key : resolution.asMap().keySet()) {
            if (!action.resolutionKeys().contains(key)) {
                unknown.add(key);
            }
        }
        return unknown;
    }
}
