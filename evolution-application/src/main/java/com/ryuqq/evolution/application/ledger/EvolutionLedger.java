package com.ryuqq.evolution.application.ledger;

import com.ryuqq.evolution.core.model.EvolutionOperation;
import com.ryuqq.evolution.core.model.OperationId;
import com.ryuqq.evolution.core.statemachine.LifecycleState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evolution Operation 원장.
 *
 * <p>모든 작업을 기록 순서대로 보관하는 append-only 이력과, OperationId만 보관하는
 * 두 개의 파생 인덱스로 구성됩니다.</p>
 *
 * <p><strong>인덱스:</strong></p>
 * <ul>
 *   <li>pending queue: 해석 순서 (해소된 작업은 뒤에 추가)</li>
 *   <li>ambiguity set: 해소 대기 중인 작업</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> AMBIGUOUS 작업은 ambiguity set에만, pending queue에 있는 작업은
 * 모두 PENDING. 이력에서는 어떤 작업도 제거되지 않습니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 단일 세션, 단일 스레드 사용을 전제로 하며 동기화하지 않습니다.</p>
 *
 * @author Evolution Team
 * @since 1.0.0
 */
public final class EvolutionLedger {

    private final Map<OperationId, EvolutionOperation> history = new LinkedHashMap<>();
    private final List<OperationId> pendingQueue = new ArrayList<>();
    private final Set<OperationId> ambiguitySet = new LinkedHashSet<>();

    /**
     * 작업 기록.
     *
     * <p>이력에 추가하고 상태에 따라 정확히 하나의 인덱스에 넣습니다.</p>
     *
     * @param operation PENDING 또는 AMBIGUOUS 상태의 작업
     * @throws IllegalArgumentException operation이 null이거나, 이미 기록되었거나, 종료 상태인 경우
     */
    public void record(EvolutionOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (history.containsKey(operation.getId())) {
            throw new IllegalArgumentException("Operation already recorded: " + operation.getId().getValue());
        }
        if (operation.getState().isTerminal()) {
            throw new IllegalArgumentException(
                "Cannot record operation in terminal state " + operation.getState() + ": " + operation.getId().getValue());
        }

        history.put(operation.getId(), operation);
        if (operation.isAmbiguous()) {
            ambiguitySet.add(operation.getId());
        } else {
            pendingQueue.add(operation.getId());
        }
    }

    /**
     * 해소된 작업을 ambiguity set에서 pending queue 끝으로 이동.
     *
     * @param operation 해소되어 PENDING 상태가 된 작업
     * @throws IllegalArgumentException operation이 null인 경우
     * @throws IllegalStateException 작업이 ambiguity set에 없거나 PENDING이 아닌 경우
     */
    public void moveToResolved(EvolutionOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        OperationId id = operation.getId();
        if (!ambiguitySet.contains(id)) {
            throw new IllegalStateException("Operation is not awaiting resolution: " + id.getValue());
        }
        if (operation.getState() != LifecycleState.PENDING) {
            throw new IllegalStateException(
                "Resolved operation must be PENDING but was " + operation.getState() + ": " + id.getValue());
        }
        ambiguitySet.remove(id);
        pendingQueue.add(id);
    }

    /**
     * pending queue의 작업을 순서대로 꺼내고 queue를 비움.
     *
     * @return 꺼낸 작업 목록 (해석 순서)
     */
    public List<EvolutionOperation> drainPending() {
        List<EvolutionOperation> drained = pendingOperations();
        pendingQueue.clear();
        return drained;
    }

    /**
     * 처리하지 못한 PENDING 작업을 pending queue 앞쪽에 원래 순서대로 되돌림.
     *
     * <p>적용 중 예기치 않은 예외로 배치가 중단되었을 때 사용합니다.</p>
     *
     * @param operations 되돌릴 작업 목록
     * @throws IllegalStateException PENDING이 아니거나 기록되지 않은 작업이 있는 경우
     */
    public void restorePending(List<EvolutionOperation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        List<OperationId> restored = new ArrayList<>(operations.size());
        for (EvolutionOperation operation : operations) {
            if (!history.containsKey(operation.getId()) || operation.getState() != LifecycleState.PENDING) {
                throw new IllegalStateException("Cannot restore operation to pending queue: " + operation);
            }
            if (!pendingQueue.contains(operation.getId())) {
                restored.add(operation.getId());
            }
        }
        pendingQueue.addAll(0, restored);
    }

    /**
     * 작업 조회.
     *
     * @param id OperationId
     * @return 작업, 없으면 empty
     */
    public Optional<EvolutionOperation> find(OperationId id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(history.get(id));
    }

    /**
     * 전체 이력 (기록 순서).
     *
     * @return 불변 작업 목록
     */
    public List<EvolutionOperation> history() {
        return List.copyOf(history.values());
    }

    /**
     * pending queue의 작업 (queue 순서).
     *
     * @return 불변 작업 목록
     */
    public List<EvolutionOperation> pendingOperations() {
        return lookup(pendingQueue);
    }

    /**
     * 해소 대기 중인 작업.
     *
     * @return 불변 작업 목록
     */
    public List<EvolutionOperation> ambiguousOperations() {
        return lookup(ambiguitySet);
    }

    public int pendingCount() {
        return pendingQueue.size();
    }

    public int ambiguousCount() {
        return ambiguitySet.size();
    }

    public int size() {
        return history.size();
    }

    private List<EvolutionOperation> lookup(Iterable<OperationId> ids) {
        List<EvolutionOperation> operations = new ArrayList<>();
        for (OperationId id : ids) {
            operations.add(history.get(id));
        }
        return Collections.unmodifiableList(operations);
    }
}
