package com.ryuqq.evolution.application.coevolution;

/**
 * 모델 공진화 경계.
 *
 * <p>메타모델 변경에 맞춰 기존 모델 인스턴스를 변환하는 기능의 확장 지점입니다.
 * 현재 버전은 변환 로직을 제공하지 않습니다 ({@link UnsupportedCoEvolutionService}).</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public interface CoEvolutionService {

    /**
     * 모델을 현재 메타모델에 맞게 변환.
     *
     * @param modelPath 입력 모델 경로
     * @param outputPath 출력 경로
     * @return 변환 결과
     */
    CoEvolutionResult coEvolveModel(String modelPath, String outputPath);
}
