package com.switchboard.core.feedback;

import com.switchboard.core.model.Classification;
import com.switchboard.core.model.FeedbackType;
import com.switchboard.core.model.LearningMetrics;
import com.switchboard.core.model.TrainingPair;
import com.switchboard.core.model.UserFeedback;
import com.switchboard.core.store.OperationStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * How well the classifier agrees with its users, computed from stored feedback.
 */
@Service
public class LearningMetricsService {

    public static final int DEFAULT_TRAINING_PAIR_LIMIT = 1000;

    private final OperationStore store;

    public LearningMetricsService(OperationStore store) {
        this.store = store;
    }

    /**
     * @param userId restrict to one user's feedback and operations, or null for everyone
     */
    public LearningMetrics compute(String userId) {
        List<UserFeedback> feedback = store.listAllFeedback(userId);
        List<UserFeedback> corrections = feedback.stream().filter(UserFeedback::isCorrection).toList();
        int confirmations = feedback.size() - corrections.size();
        int operations = store.countClassifiedOperations(userId);

        double accuracy = feedback.isEmpty() ? 0.0 : (double) confirmations / feedback.size();
        long correctedOperations = corrections.stream().map(UserFeedback::operationId).distinct().count();
        double correctionRate = operations == 0 ? 0.0 : Math.min(1.0, (double) correctedOperations / operations);

        return new LearningMetrics(userId, operations, corrections.size(), confirmations,
                accuracy, correctionRate,
                countBy(corrections, f -> f.correctedDestination().value()),
                countBy(corrections, f -> f.correctedConsumer().value()),
                countBy(corrections, f -> f.correctedSemantics().value()));
    }

    /**
     * Labelled requests built from confirmations and corrections, newest first.
     * Only the latest feedback on each operation counts; a confirmation of an
     * unclassified operation carries no label and is skipped.
     *
     * @param userId restrict to one user's feedback, or null for everyone
     * @throws IllegalArgumentException when limit is not positive
     */
    public List<TrainingPair> trainingPairs(String userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        List<UserFeedback> feedback = store.listAllFeedback(userId);
        List<TrainingPair> pairs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = feedback.size() - 1; i >= 0 && pairs.size() < limit; i--) {
            UserFeedback entry = feedback.get(i);
            if (!seen.add(entry.operationId())) {
                continue;
            }
            Classification system = entry.systemClassification();
            Classification label = entry.isCorrection() ? entry.correctedClassification() : system;
            if (label == null) {
                continue;
            }
            String request = store.getOperation(entry.operationId()).userRequest();
            pairs.add(new TrainingPair(entry.operationId(), request, system, label, entry.feedbackType(),
                    entry.feedbackType() == FeedbackType.CORRECTION
                            ? TrainingPair.CORRECTION_CONFIDENCE : TrainingPair.CONFIRMATION_CONFIDENCE,
                    entry.createdAt()));
        }
        return pairs;
    }

    private static Map<String, Long> countBy(List<UserFeedback> corrections, Function<UserFeedback, String> axis) {
        return corrections.stream().collect(Collectors.groupingBy(axis, TreeMap::new, Collectors.counting()));
    }
}
