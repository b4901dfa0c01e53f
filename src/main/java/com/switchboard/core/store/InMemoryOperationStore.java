package com.switchboard.core.store;

import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ClassificationLogEntry;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.CorrectionExemplar;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.UserFeedback;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * {@link OperationStore} kept in process memory.
 * <p>
 * Status changes and corrections run inside {@link ConcurrentHashMap#compute}
 * so validation and update are one atomic step per operation. Feedback and the classification log
 * are copy-on-write lists, so readers never block writers.
 */
public class InMemoryOperationStore implements OperationStore {

    private record StoredOperation(long seq, AtomicOperation operation) {}

    private final ConcurrentHashMap<String, StoredOperation> operations = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<UserFeedback> feedback = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ClassificationLogEntry> classificationLog = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryOperationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AtomicOperation createOperation(String userRequest, String userId) {
        Objects.requireNonNull(userRequest, "userRequest");
        Instant now = now();
        var operation = new AtomicOperation(UUID.randomUUID().toString(), userRequest, userId,
                null, OperationStatus.CREATED, now, now, null);
        operations.put(operation.id(), new StoredOperation(sequence.incrementAndGet(), operation));
        return operation;
    }

    @Override
    public Optional<AtomicOperation> findOperation(String operationId) {
        if (operationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(operations.get(operationId)).map(StoredOperation::operation);
    }

    @Override
    public List<AtomicOperation> listOperations(int limit) {
        requireLimit(limit);
        return operations.values().stream()
                .sorted(Comparator.comparingLong(StoredOperation::seq).reversed())
                .limit(limit)
                .map(StoredOperation::operation)
                .toList();
    }

    @Override
    public int countClassifiedOperations(String userId) {
        return (int) operations.values().stream()
                .map(StoredOperation::operation)
                .filter(AtomicOperation::isClassified)
                .filter(op -> userId == null || userId.equals(op.userId()))
                .count();
    }

    @Override
    public AtomicOperation updateClassification(String operationId, Classification classification) {
        Objects.requireNonNull(classification, "classification");
        return update(operationId, OperationStatus.CLASSIFIED, op -> op.withClassification(classification, now()));
    }

    @Override
    public AtomicOperation assignAgent(String operationId, String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        return update(operationId, OperationStatus.ROUTED, op -> op.withAgent(agentId, now()));
    }

    @Override
    public AtomicOperation transition(String operationId, OperationStatus target) {
        return update(operationId, target, op -> op.withStatus(target, now()));
    }

    @Override
    public UserFeedback appendFeedback(UserFeedback entry) {
        if (!operations.containsKey(entry.operationId())) {
            throw new OperationNotFoundException(entry.operationId());
        }
        feedback.add(entry);
        return entry;
    }

    @Override
    public AtomicOperation applyCorrection(UserFeedback correction) {
        requireCorrection(correction);
        StoredOperation updated = operations.compute(correction.operationId(), (id, current) -> {
            if (current == null) {
                throw new OperationNotFoundException(id);
            }
            feedback.add(correction);
            AtomicOperation operation = current.operation();
            if (operation.status().isTerminal()) {
                return current;
            }
            OperationStateMachine.requireTransition(id, operation.status(), OperationStatus.CLASSIFIED);
            return new StoredOperation(current.seq(),
                    operation.withClassification(correction.correctedClassification(), now()));
        });
        return updated.operation();
    }

    @Override
    public List<UserFeedback> listFeedback(String operationId) {
        return feedback.stream().filter(f -> f.operationId().equals(operationId)).toList();
    }

    @Override
    public List<UserFeedback> listAllFeedback(String userId) {
        return feedback.stream().filter(f -> userId == null || userId.equals(f.userId())).toList();
    }

    @Override
    public List<CorrectionExemplar> findCorrections(int limit) {
        requireLimit(limit);
        List<UserFeedback> snapshot = List.copyOf(feedback);
        List<CorrectionExemplar> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = snapshot.size() - 1; i >= 0 && result.size() < limit; i--) {
            UserFeedback entry = snapshot.get(i);
            if (entry.isCorrection() && seen.add(entry.operationId())) {
                String request = operations.get(entry.operationId()).operation().userRequest();
                result.add(CorrectionExemplar.from(request, entry));
            }
        }
        return result;
    }

    @Override
    public boolean hasCorrections() {
        return feedback.stream().anyMatch(UserFeedback::isCorrection);
    }

    @Override
    public void logClassification(String operationId, ClassificationResult result) {
        classificationLog.add(new ClassificationLogEntry(operationId, result.classification(),
                result.rationale(), result.model(), now()));
    }

    @Override
    public List<ClassificationLogEntry> listClassificationLog(String operationId) {
        return classificationLog.stream().filter(e -> e.operationId().equals(operationId)).toList();
    }

    private AtomicOperation update(String operationId, OperationStatus target, UnaryOperator<AtomicOperation> change) {
        if (operationId == null) {
            throw new OperationNotFoundException(null);
        }
        StoredOperation updated = operations.compute(operationId, (id, current) -> {
            if (current == null) {
                throw new OperationNotFoundException(id);
            }
            OperationStateMachine.requireTransition(id, current.operation().status(), target);
            return new StoredOperation(current.seq(), change.apply(current.operation()));
        });
        return updated.operation();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    static void requireCorrection(UserFeedback correction) {
        Objects.requireNonNull(correction, "correction");
        if (!correction.isCorrection()) {
            throw new IllegalArgumentException("Feedback " + correction.id() + " is not a correction");
        }
        if (correction.operationId() == null) {
            throw new OperationNotFoundException(null);
        }
    }

    static void requireLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
    }
}
