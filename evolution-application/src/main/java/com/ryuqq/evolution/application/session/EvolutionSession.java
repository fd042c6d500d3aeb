package com.ryuqq.evolution.application.session;

import com.ryuqq.evolution.application.applier.BatchApplier;
import com.ryuqq.evolution.application.applier.BatchApplyResult;
import com.ryuqq.evolution.application.coevolution.CoEvolutionResult;
import com.ryuqq.evolution.application.coevolution.CoEvolutionService;
import com.ryuqq.evolution.application.coevolution.UnsupportedCoEvolutionService;
import com.ryuqq.evolution.application.interpreter.InterpreterConfig;
import com.ryuqq.evolution.application.interpreter.OperationInterpreter;
import com.ryuqq.evolution.application.ledger.EvolutionLedger;
import com.ryuqq.evolution.application.ledger.OperationNotFoundException;
import com.ryuqq.evolution.application.report.EvolutionReport;
import com.ryuqq.evolution.application.report.EvolutionReporter;
import com.ryuqq.evolution.application.resolver.AmbiguityResolver;
import com.ryuqq.evolution.core.contract.ChangeDescriptor;
import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.model.EvolutionOperation;
import com.ryuqq.evolution.core.model.OperationId;
import com.ryuqq.evolution.core.spi.MetamodelStore;

import java.util.List;

/**
 * 스키마 편집 세션 Facade.
 *
 * <p>하나의 {@link MetamodelStore}를 주입받아 해석 → 해소 → 적용 주기를 구동합니다.
 * 세션마다 독립적인 원장을 가지며, 한 호출자가 단일 스레드로 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EvolutionSession session = new EvolutionSession(store);
 *
 * EvolutionOperation op = session.interpret(ChangeDescriptor.of("add", "attribute", details));
 * if (op.isAmbiguous()) {
 *     session.resolve(op.getId(), Details.of(Map.of("attributeName", "email")));
 * }
 *
 * BatchApplyResult result = session.applyPending();
 * </pre>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class EvolutionSession {

    private final EvolutionLedger ledger;
    private final OperationInterpreter interpreter;
    private final AmbiguityResolver resolver;
    private final BatchApplier applier;
    private final EvolutionReporter reporter;
    private final CoEvolutionService coEvolutionService;

    /**
     * 기본 설정 생성자.
     *
     * @param store 편집 대상 Store
     */
    public EvolutionSession(MetamodelStore store) {
        this(store, new InterpreterConfig(), new UnsupportedCoEvolutionService());
    }

    /**
     * 생성자.
     *
     * @param store 편집 대상 Store
     * @param config Interpreter 설정
     * @param coEvolutionService 모델 공진화 서비스
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EvolutionSession(MetamodelStore store, InterpreterConfig config, CoEvolutionService coEvolutionService) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (coEvolutionService == null) {
            throw new IllegalArgumentException("coEvolutionService cannot be null");
        }
        this.ledger = new EvolutionLedger();
        this.interpreter = new OperationInterpreter(store, ledger, config);
        this.resolver = new AmbiguityResolver(ledger);
        this.applier = new BatchApplier(store, ledger);
        this.reporter = new EvolutionReporter(ledger);
        this.coEvolutionService = coEvolutionService;
    }

    public EvolutionOperation interpret(ChangeDescriptor descriptor) {
        return interpreter.interpret(descriptor);
    }

    /**
     * 모호성 해소.
     *
     * @param operationId 대상 작업 ID
     * @param resolution 병합할 값
     * @return 대상 작업
     * @throws OperationNotFoundException 알 수 없는 ID인 경우
     */
    public EvolutionOperation resolve(OperationId operationId, Details resolution) {
        return resolver.resolve(operationId, resolution);
    }

    public BatchApplyResult applyPending() {
        return applier.applyPending();
    }

    public BatchApplyResult applyPendingValidated() {
        return applier.applyPendingValidated();
    }

    public EvolutionReport report() {
        return reporter.report();
    }

    /**
     * 해소 대기 중인 작업.
     *
     * @return 불변 작업 목록
     */
    public List<EvolutionOperation> ambiguities() {
        return ledger.ambiguousOperations();
    }

    /**
     * 적용 대기 중인 작업 (적용 순서).
     *
     * @return 불변 작업 목록
     */
    public List<EvolutionOperation> pending() {
        return ledger.pendingOperations();
    }

    public CoEvolutionResult coEvolveModel(String modelPath, String outputPath) {
        return coEvolutionService.coEvolveModel(modelPath, outputPath);
    }
}
