package com.ryuqq.evolution.application.applier;

import com.ryuqq.evolution.application.interpreter.IntentValidator;
import com.ryuqq.evolution.application.ledger.EvolutionLedger;
import com.ryuqq.evolution.core.intent.MutationIntent;
import com.ryuqq.evolution.core.model.EvolutionOperation;
import com.ryuqq.evolution.core.outcome.Fail;
import com.ryuqq.evolution.core.outcome.FailureCode;
import com.ryuqq.evolution.core.outcome.Ok;
import com.ryuqq.evolution.core.outcome.Outcome;
import com.ryuqq.evolution.core.spi.ElementNotFoundException;
import com.ryuqq.evolution.core.spi.MetamodelStore;
import com.ryuqq.evolution.core.spi.SchemaConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Batch Applier.
 *
 * <p>pending queue의 작업을 Store에 하나씩 독립적으로 적용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. ambiguity set이 비어있지 않으면 거부 (Store 변경 없음, pending queue 유지)
 * 2. pending queue를 꺼냄 (결과와 관계없이 비워짐, 자동 재시도 없음)
 * 3. 각 작업:
 *    a. [검증 모드] IntentValidator로 현재 Store 기준 재검증
 *    b. 의도를 Store 변경으로 적용 → Outcome (Ok / Fail)
 *    c. Ok → APPLIED, Fail → FAILED (다음 작업 계속, 롤백 없음)
 * 4. 결과 집계 및 로깅
 * </pre>
 *
 * <p><strong>실패 분류 ({@link FailureCode}):</strong></p>
 * <ul>
 *   <li>ELEMENT_NOT_FOUND: Store의 {@link ElementNotFoundException}</li>
 *   <li>CONSTRAINT_VIOLATION: Store의 {@link SchemaConstraintViolationException}</li>
 *   <li>MISSING_INTENT: 의도가 없는 작업</li>
 *   <li>REVALIDATION_FAILED: 검증 모드에서 재검증 실패</li>
 * </ul>
 *
 * <p>분류와 상세는 {@link EvolutionOperation#getFailureCode()}와
 * {@link EvolutionOperation#getFailureDetail()}로 조회합니다.</p>
 *
 * <p>그 외 예외는 예기치 않은 오류로 호출자에게 전파되며, 처리하지 못한 작업은
 * pending queue로 되돌아갑니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class BatchApplier {

    private static final Logger log = LoggerFactory.getLogger(BatchApplier.class);

    private final EvolutionLedger ledger;
    private final IntentValidator validator;
    private final IntentApplication application;

    /**
     * 생성자.
     *
     * @param store 적용 대상 Store
     * @param ledger 원장
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchApplier(MetamodelStore store, EvolutionLedger ledger) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.ledger = ledger;
        this.validator = new IntentValidator(store);
        this.application = new IntentApplication(store);
    }

    /**
     * pending 작업 적용 (해소 결과를 신뢰, 재검증 없음).
     *
     * @return 배치 적용 결과
     */
    public BatchApplyResult applyPending() {
        return sweep(false);
    }

    /**
     * pending 작업을 현재 Store 기준으로 재검증한 뒤 적용.
     *
     * <p>재검증에 실패한 작업은 Store를 건드리지 않고 {@link FailureCode#REVALIDATION_FAILED}로 FAILED 처리됩니다.</p>
     *
     * @return 배치 적용 결과
     */
    public BatchApplyResult applyPendingValidated() {
        return sweep(true);
    }

    private BatchApplyResult sweep(boolean revalidate) {
        int unresolved = ledger.ambiguousCount();
        if (unresolved > 0) {
            String error = String.format(
                "There are %d unresolved ambiguities. Please resolve them before applying changes.", unresolved);
            log.warn("Batch apply refused: {}", error);
            return BatchApplyResult.refused(error);
        }

        List<EvolutionOperation> batch = ledger.drainPending();
        log.info("Batch apply started: {} pending operations (revalidate={})", batch.size(), revalidate);

        List<EvolutionOperation> applied = new ArrayList<>();
        List<EvolutionOperation> failed = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < batch.size(); i++) {
            EvolutionOperation operation = batch.get(i);
            Outcome outcome;
            try {
                outcome = applyOne(operation, revalidate);
            } catch (RuntimeException e) {
                ledger.restorePending(batch.subList(i, batch.size()));
                log.error("Unexpected failure applying operation {}, batch aborted", operation.getId().getValue(), e);
                throw e;
            }

            if (outcome instanceof Ok) {
                operation.markApplied();
                applied.add(operation);
                log.debug("Operation {} applied", operation.getId().getValue());
            } else if (outcome instanceof Fail fail) {
                operation.markFailed(fail.code(), fail.message());
                failed.add(operation);
                errors.add("Failed to apply operation " + operation.getId().getValue() + ": " + fail.message());
                log.warn("Operation {} failed [{}]: {}", operation.getId().getValue(), fail.code(), fail.message());
            }
        }

        log.info("Batch apply completed: {} applied, {} failed", applied.size(), failed.size());
        return new BatchApplyResult(failed.isEmpty(), applied, failed, errors);
    }

    private Outcome applyOne(EvolutionOperation operation, boolean revalidate) {
        if (!operation.hasIntent()) {
            return Fail.of(FailureCode.MISSING_INTENT, "Operation has no mutation intent");
        }
        MutationIntent intent = operation.getIntent();

        if (revalidate) {
            Optional<String> conflict = validator.validate(intent);
            if (conflict.isPresent()) {
                return Fail.of(FailureCode.REVALIDATION_FAILED, conflict.get());
            }
        }

        try {
            intent.accept(application);
            return Ok.of(operation.getId());
        } catch (ElementNotFoundException e) {
            return Fail.of(FailureCode.ELEMENT_NOT_FOUND, messageOf(e));
        } catch (SchemaConstraintViolationException e) {
            return Fail.of(FailureCode.CONSTRAINT_VIOLATION, messageOf(e));
        }
    }

    private static String messageOf(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
