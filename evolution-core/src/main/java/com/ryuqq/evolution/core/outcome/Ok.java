package com.ryuqq.evolution.core.outcome;

import com.ryuqq.evolution.core.model.OperationId;

/**
 * 성공 결과.
 *
 * <p>Operation의 변경 의도가 Store에 반영되었음을 나타냅니다.</p>
 *
 * @param operationId 반영된 Operation ID
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public record Ok(OperationId operationId) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException operationId가 null인 경우
     */
    public Ok {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
    }

    public static Ok of(OperationId operationId) {
        return new Ok(operationId);
    }
}
