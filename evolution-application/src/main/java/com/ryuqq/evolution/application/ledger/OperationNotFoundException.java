package com.ryuqq.evolution.application.ledger;

import com.ryuqq.evolution.core.model.OperationId;

/**
 * 알 수 없는 OperationId로 작업을 조회했을 때 발생하는 예외.
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public class OperationNotFoundException extends RuntimeException {

    private final OperationId operationId;

    /**
     * 생성자.
     *
     * @param operationId 찾지 못한 OperationId
     */
    public OperationNotFoundException(OperationId operationId) {
        super("Operation not found: " + (operationId == null ? null : operationId.getValue()));
        this.operationId = operationId;
    }

    /**
     * 찾지 못한 OperationId.
     *
     * @return OperationId
     */
    public OperationId getOperationId() {
        return operationId;
    }
}
