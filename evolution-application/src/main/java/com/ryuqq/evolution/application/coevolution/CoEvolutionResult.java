package com.ryuqq.evolution.application.coevolution;

/**
 * 모델 공진화(co-evolution) 결과.
 *
 * @param success 성공 여부
 * @param message 결과 메시지
 * @param modelPath 입력 모델 경로
 * @param outputPath 출력 경로
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record CoEvolutionResult(
    boolean success,
    String message,
    String modelPath,
    String outputPath
) {
}
