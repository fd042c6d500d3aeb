package com.ryuqq.evolution.application.interpreter;

import com.ryuqq.evolution.core.contract.DetailKeys;
import com.ryuqq.evolution.core.contract.Details;
import com.ryuqq.evolution.core.intent.AddAttributeIntent;
import com.ryuqq.evolution.core.intent.AddClassIntent;
import com.ryuqq.evolution.core.intent.AddReferenceIntent;
import com.ryuqq.evolution.core.intent.IntentAction;
import com.ryuqq.evolution.core.intent.ModifyAttributeIntent;
import com.ryuqq.evolution.core.intent.ModifyClassIntent;
import com.ryuqq.evolution.core.intent.ModifyReferenceIntent;
import com.ryuqq.evolution.core.intent.MutationIntent;
import com.ryuqq.evolution.core.intent.RemoveAttributeIntent;
import com.ryuqq.evolution.core.intent.RemoveClassIntent;
import com.ryuqq.evolution.core.intent.RemoveReferenceIntent;

import java.util.List;

/**
 * Change Descriptor 세부 정보로부터 MutationIntent를 만드는 빌더.
 *
 * <p>키가 없거나 값이 null인 경우에만 {@link InterpreterConfig} 기본값을 적용합니다.
 * 명시적으로 주어진 {@code 0}, {@code false}, 빈 문자열은 그대로 보존됩니다.
 * 상한 {@code -1} (many)도 변환 없이 전달됩니다.</p>
 *
 * <p>Store를 조회하지 않는 순수 변환이며, 참조 검증은 {@link IntentValidator}가 담당합니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class IntentFactory {

    private final InterpreterConfig config;

    /**
     * 생성자.
     *
     * @param config 기본값 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public IntentFactory(InterpreterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * MutationIntent 생성.
     *
     * @param action 인식된 (변경 종류, 요소 종류) 조합
     * @param details 세부 정보
     * @return 생성된 의도 (필수 이름이 비어 있을 수 있음)
     * @throws IllegalArgumentException 세부 정보 값의 형태가 잘못된 경우
     */
    public MutationIntent create(IntentAction action, Details details) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (details == null) {
            throw new IllegalArgumentException("details cannot be null");
        }
        return switch (action) {
            case ADD_CLASS -> new AddClassIntent(
                details.getString(DetailKeys.NAME),
                names(details, DetailKeys.SUPER_TYPES),
                flag(details, DetailKeys.ABSTRACT, false),
                flag(details, DetailKeys.INTERFACE, false)
            );
            case ADD_ATTRIBUTE -> new AddAttributeIntent(
                details.getString(DetailKeys.CLASS_NAME),
                details.getString(DetailKeys.NAME),
                text(details, DetailKeys.TYPE, config.defaultAttributeType()),
                bound(details, DetailKeys.LOWER_BOUND, config.defaultLowerBound()),
                bound(details, DetailKeys.UPPER_BOUND, config.defaultUpperBound())
            );
            case ADD_REFERENCE -> new AddReferenceIntent(
                details.getString(DetailKeys.SOURCE_CLASS_NAME),
                details.getString(DetailKeys.TARGET_CLASS_NAME),
                details.getString(DetailKeys.NAME),
                flag(details, DetailKeys.CONTAINMENT, config.defaultContainment()),
                bound(details, DetailKeys.LOWER_BOUND, config.defaultLowerBound()),
                bound(details, DetailKeys.UPPER_BOUND, config.defaultUpperBound())
            );
            case REMOVE_CLASS -> new RemoveClassIntent(details.getString(DetailKeys.NAME));
            case REMOVE_ATTRIBUTE -> new RemoveAttributeIntent(
                details.getString(DetailKeys.CLASS_NAME),
                details.getString(DetailKeys.NAME)
            );
            case REMOVE_REFERENCE -> new RemoveReferenceIntent(
                details.getString(DetailKeys.CLASS_NAME),
                details.getString(DetailKeys.NAME)
            );
            case MODIFY_CLASS -> new ModifyClassIntent(
                details.getString(DetailKeys.NAME),
                details.getString(DetailKeys.NEW_NAME),
                details.getStringList(DetailKeys.NEW_SUPER_TYPES),
                details.getBoolean(DetailKeys.NEW_ABSTRACT),
                details.getBoolean(DetailKeys.NEW_INTERFACE)
            );
            case MODIFY_ATTRIBUTE -> new ModifyAttributeIntent(
                details.getString(DetailKeys.CLASS_NAME),
                details.getString(DetailKeys.NAME),
                details.getString(DetailKeys.NEW_NAME),
                details.getString(DetailKeys.NEW_TYPE),
                details.getInteger(DetailKeys.NEW_LOWER_BOUND),
                details.getInteger(DetailKeys.NEW_UPPER_BOUND)
            );
            case MODIFY_REFERENCE -> new ModifyReferenceIntent(
                details.getString(DetailKeys.CLASS_NAME),
                details.getString(DetailKeys.NAME),
                details.getString(DetailKeys.NEW_NAME),
                details.getString(DetailKeys.NEW_TARGET_CLASS_NAME),
                details.getBoolean(DetailKeys.NEW_CONTAINMENT),
                details.getInteger(DetailKeys.NEW_LOWER_BOUND),
                details.getInteger(DetailKeys.NEW_UPPER_BOUND)
            );
        };
    }

    private static String text(Details details, String key, String defaultValue) {
        return details.hasValue(key) ? details.getString(key) : defaultValue;
    }

    private static int bound(Details details, String key, int defaultValue) {
        return details.hasValue(key) ? details.getInteger(key) : defaultValue;
    }

    private static boolean flag(Details details, String key, boolean defaultValue) {
        return details.hasValue(key) ? details.getBoolean(key) : defaultValue;
    }

    private static List<String> names(Details details, String key) {
        return details.hasValue(key) ? details.getStringList(key) : List.of();
    }
}
