package com.ryuqq.evolution.application.coevolution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Co-evolution NoOp 구현.
 *
 * <p>모델 변환을 수행하지 않고 항상 실패 결과를 반환합니다.
 * 파일을 읽거나 쓰지 않습니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class UnsupportedCoEvolutionService implements CoEvolutionService {

    static final String NOT_SUPPORTED = "Model co-evolution is not supported";

    private static final Logger log = LoggerFactory.getLogger(UnsupportedCoEvolutionService.class);

    @Override
    public CoEvolutionResult coEvolveModel(String modelPath, String outputPath) {
        log.warn("Model co-evolution requested for {} -> {} but is not supported", modelPath, outputPath);
        return new CoEvolutionResult(false, NOT_SUPPORTED, modelPath, outputPath);
    }
}
