package com.ryuqq.evolution.core.schema;

import java.util.List;

/**
 * 스키마 클래스의 읽기 전용 스냅샷.
 *
 * <p>Store가 조회 시점의 상태를 복사해 반환합니다. 적용 시점에는 이름으로 다시 조회하므로
 * 이 객체를 살아있는 핸들로 취급하지 않습니다.</p>
 *
 * @param name 클래스 이름
 * @param superTypes 상위 타입 이름 목록 (불변)
 * @param abstractClass 추상 클래스 여부
 * @param interfaceClass 인터페이스 여부
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record ClassInfo(
    String name,
    List<String> superTypes,
    boolean abstractClass,
    boolean interfaceClass
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public ClassInfo {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        superTypes = superTypes == null ? List.of() : List.copyOf(superTypes);
    }

    /**
     * 상위 타입 없는 구체 클래스 스냅샷 생성.
     *
     * @param name 클래스 이름
     * @return ClassInfo 인스턴스
     */
    public static ClassInfo of(String name) {
        return new ClassInfo(name, List.of(), false, false);
    }
}
