package com.ryuqq.evolution.core.contract;

import com.ryuqq.evolution.core.model.ChangeType;
import com.ryuqq.evolution.core.model.ElementKind;

import java.util.Locale;

/**
 * 도메인 전문가가 기술한 모델 수준 변경.
 *
 * <p>Interpreter가 한 번 소비하는 일회성 입력입니다. 입력 형식이 느슨하므로
 * {@code changeType}과 {@code elementKind}는 원본 문자열 그대로 보관하고,
 * 해석은 Interpreter가 담당합니다 (인식 불가 조합도 기록 대상).</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ChangeDescriptor change = ChangeDescriptor.of(
 *     "add",
 *     "attribute",
 *     Details.of(Map.of("className", "Customer", "name", "firstName", "type", "EString"))
 * );
 * </pre>
 *
 * @param changeType 변경 종류 원문 (예: "add", null 허용)
 * @param elementKind 요소 종류 원문 (예: "attribute", null 허용)
 * @param details 세부 정보 (null이면 빈 Details)
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record ChangeDescriptor(
    String changeType,
    String elementKind,
    Details details
) {

    /**
     * Compact Constructor.
     *
     * <p>details가 null이면 빈 Details로 대체합니다.</p>
     */
    public ChangeDescriptor {
        if (details == null) {
            details = Details.empty();
        }
    }

    /**
     * ChangeDescriptor 생성.
     *
     * @param changeType 변경 종류 원문
     * @param elementKind 요소 종류 원문
     * @param details 세부 정보
     * @return ChangeDescriptor 인스턴스
     */
    public static ChangeDescriptor of(String changeType, String elementKind, Details details) {
        return new ChangeDescriptor(changeType, elementKind, details);
    }

    /**
     * 타입 안전한 ChangeDescriptor 생성.
     *
     * @param changeType 변경 종류
     * @param elementKind 요소 종류
     * @param details 세부 정보
     * @return ChangeDescriptor 인스턴스
     * @throws IllegalArgumentException changeType 또는 elementKind가 null인 경우
     */
    public static ChangeDescriptor of(ChangeType changeType, ElementKind elementKind, Details details) {
        if (changeType == null) {
            throw new IllegalArgumentException("changeType cannot be null");
        }
        if (elementKind == null) {
            throw new IllegalArgumentException("elementKind cannot be null");
        }
        return new ChangeDescriptor(changeType.name().toLowerCase(Locale.ROOT), elementKind.name().toLowerCase(Locale.ROOT), details);
    }
}
