package com.switchboard.core.store;

import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ClassificationLogEntry;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.CorrectionExemplar;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.UserFeedback;

import java.util.List;
import java.util.Optional;

/**
 * Owns every {@link AtomicOperation} and its feedback history.
 * <p>
 * Status changes are validated against {@link OperationStateMachine} and applied
 * atomically: two concurrent writers can never both move an operation out of
 * the same state. Feedback is append-only.
 */
public interface OperationStore {

    AtomicOperation createOperation(String userRequest, String userId);

    Optional<AtomicOperation> findOperation(String operationId);

    /**
     * @throws OperationNotFoundException when no such operation exists
     */
    default AtomicOperation getOperation(String operationId) {
        return findOperation(operationId).orElseThrow(() -> new OperationNotFoundException(operationId));
    }

    /** Most recently created first. */
    List<AtomicOperation> listOperations(int limit);

    /** Number of operations that carry a classification, for one user or all users when null. */
    int countClassifiedOperations(String userId);

    /**
     * Replaces the classification and moves the operation to CLASSIFIED.
     */
    AtomicOperation updateClassification(String operationId, Classification classification);

    /** Records the agent and moves the operation to ROUTED. */
    AtomicOperation assignAgent(String operationId, String agentId);

    AtomicOperation transition(String operationId, OperationStatus target);

    /**
     * @throws OperationNotFoundException when the feedback references an unknown operation
     */
    UserFeedback appendFeedback(UserFeedback feedback);

    /**
     * Appends a correction and, unless the operation is APPROVED or REJECTED,
     * makes the corrected classification current and moves it to CLASSIFIED.
     * Both happen in one step per operation, so the current classification is
     * always the one from the latest stored correction.
     *
     * @return the operation after the correction
     * @throws OperationNotFoundException when the correction references an unknown operation
     * @throws IllegalArgumentException when the feedback is not a correction
     */
    AtomicOperation applyCorrection(UserFeedback correction);

    /** Oldest first. */
    List<UserFeedback> listFeedback(String operationId);

    /** Oldest first, for one user or all users when null. */
    List<UserFeedback> listAllFeedback(String userId);

    /**
     * Latest correction of each operation, most recent first.
     */
    List<CorrectionExemplar> findCorrections(int limit);

    boolean hasCorrections();

    void logClassification(String operationId, ClassificationResult result);

    /** Oldest first. */
    List<ClassificationLogEntry> listClassificationLog(String operationId);
}
