package com.switchboard.core.engine;

import com.switchboard.core.classifier.RequestClassifier;
import com.switchboard.core.context.ClassificationContext;
import com.switchboard.core.events.EventBus;
import com.switchboard.core.events.OperationEventType;
import com.switchboard.core.events.SwitchboardEvent;
import com.switchboard.core.feedback.FeedbackLoop;
import com.switchboard.core.feedback.FeedbackRequest;
import com.switchboard.core.feedback.LearningMetricsService;
import com.switchboard.core.graph.OperationGraph;
import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.AgentRoute;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.Classification;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.CorrectionExemplar;
import com.switchboard.core.model.LearningMetrics;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.PipelineResult;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.TrainingPair;
import com.switchboard.core.model.UserFeedback;
import com.switchboard.core.model.VerificationContext;
import com.switchboard.core.model.VerificationMode;
import com.switchboard.core.routing.RequestRouter;
import com.switchboard.core.state.OperationState;
import com.switchboard.core.store.IllegalStateTransitionException;
import com.switchboard.core.store.OperationStore;
import com.switchboard.core.verification.EnvironmentInspector;
import com.switchboard.core.verification.VerificationPipeline;
import com.switchboard.core.verification.VerificationProperties;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for every core operation.
 * <p>
 * {@link #process} creates an operation and drives it through the
 * {@link OperationGraph}; the other methods expose each step on its own for
 * callers that orchestrate themselves.
 */
@Service
public class OperationEngine {

    private static final Logger log = LoggerFactory.getLogger(OperationEngine.class);

    private final OperationGraph operationGraph;
    private final OperationStore store;
    private final RequestClassifier classifier;
    private final RequestRouter router;
    private final VerificationPipeline pipeline;
    private final EnvironmentInspector inspector;
    private final FeedbackLoop feedbackLoop;
    private final ClassificationContext context;
    private final LearningMetricsService learningMetrics;
    private final VerificationProperties verificationProperties;
    private final EventBus eventBus;
    private final SwitchboardMetrics metrics;
    private final Clock clock;

    public OperationEngine(OperationGraph operationGraph, OperationStore store, RequestClassifier classifier,
                           RequestRouter router, VerificationPipeline pipeline, EnvironmentInspector inspector,
                           FeedbackLoop feedbackLoop, ClassificationContext context,
                           LearningMetricsService learningMetrics, VerificationProperties verificationProperties,
                           EventBus eventBus, SwitchboardMetrics metrics, Clock clock) {
        this.operationGraph = operationGraph;
        this.store = store;
        this.classifier = classifier;
        this.router = router;
        this.pipeline = pipeline;
        this.inspector = inspector;
        this.feedbackLoop = feedbackLoop;
        this.context = context;
        this.learningMetrics = learningMetrics;
        this.verificationProperties = verificationProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ClassificationResult classify(String request, String userId) {
        return classifier.classify(request, userId);
    }

    public AgentRoute route(Classification classification) {
        AgentRoute route = router.route(classification);
        metrics.recordRoute(route.agentId(), route.fallback());
        return route;
    }

    /**
     * Verifies an action without touching the operation's status.
     */
    public PipelineResult runVerification(AtomicOperation operation, ProposedAction action, VerificationMode mode) {
        VerificationMode effective = mode != null ? mode : verificationProperties.getMode();
        MdcContext.setOperation(operation.id(), operation.userId());
        try {
            return pipeline.run(new VerificationContext(operation, action, inspector.inspect(operation, action)), effective);
        } finally {
            MdcContext.clear();
        }
    }

    public UserFeedback recordFeedback(String operationId, FeedbackRequest feedback) {
        MdcContext.setOperation(operationId, feedback != null ? feedback.userId() : null);
        try {
            return feedbackLoop.recordFeedback(operationId, feedback);
        } finally {
            MdcContext.clear();
        }
    }

    public List<CorrectionExemplar> getCorrections(int limit) {
        return context.getCorrections(limit);
    }

    public List<CorrectionExemplar> getCorrections() {
        return context.getCorrections();
    }

    public LearningMetrics learningMetrics(String userId) {
        return learningMetrics.compute(userId);
    }

    public List<TrainingPair> trainingPairs(String userId, int limit) {
        return learningMetrics.trainingPairs(userId, limit);
    }

    public List<AtomicOperation> history(int limit) {
        return store.listOperations(limit);
    }

    public AtomicOperation getOperation(String operationId) {
        return store.getOperation(operationId);
    }

    public ProcessResult process(String request, String userId) {
        return process(request, userId, verificationProperties.getMode());
    }

    /**
     * Creates an operation for the request and runs classify, route, propose and verify.
     * <p>
     * When a step fails its exception is rethrown; the operation keeps the
     * status it had reached.
     */
    public ProcessResult process(String request, String userId, VerificationMode mode) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("request must not be blank");
        }
        VerificationMode effective = mode != null ? mode : verificationProperties.getMode();
        AtomicOperation operation = store.createOperation(request, userId);
        MdcContext.setOperation(operation.id(), userId);
        try {
            log.info("Processing operation {} in {} mode", operation.id(), effective);
            eventBus.publish(new SwitchboardEvent(OperationEventType.CREATED, operation.id(),
                    Map.of("request", request, "mode", effective.name()), clock.instant()));
            return run(operation, effective);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Carries a corrected operation forward: routes its current classification,
     * lets the agent propose and verifies, without classifying again.
     *
     * @throws IllegalStateTransitionException when the operation is not CLASSIFIED
     */
    public ProcessResult resume(String operationId, VerificationMode mode) {
        AtomicOperation operation = store.getOperation(operationId);
        if (operation.status() != OperationStatus.CLASSIFIED || operation.classification() == null) {
            throw new IllegalStateTransitionException(operationId, operation.status(), OperationStatus.ROUTED);
        }
        VerificationMode effective = mode != null ? mode : verificationProperties.getMode();
        MdcContext.setOperation(operationId, operation.userId());
        try {
            log.info("Resuming operation {} as {} in {} mode", operationId, operation.classification().key(), effective);
            eventBus.publish(new SwitchboardEvent(OperationEventType.RESUMED, operationId,
                    Map.of("classification", operation.classification().key(), "mode", effective.name()),
                    clock.instant()));
            return run(operation, effective);
        } finally {
            MdcContext.clear();
        }
    }

    private ProcessResult run(AtomicOperation operation, VerificationMode mode) {
        var stateMap = new HashMap<String, Object>();
        stateMap.put("operationId", operation.id());
        stateMap.put("request", operation.userRequest());
        if (operation.userId() != null) {
            stateMap.put("userId", operation.userId());
        }
        stateMap.put("mode", mode.name());
        stateMap.put("status", operation.status().name());

        var config = RunnableConfig.builder()
                .threadId(operation.id())
                .build();

        OperationState state = operationGraph.getCompiledGraph()
                .invoke(Map.copyOf(stateMap), config)
                .orElseThrow(() -> new IllegalStateException(
                        "Graph execution returned empty state for operation " + operation.id()));

        AtomicOperation finalOperation = store.getOperation(operation.id());
        if (state.error().isPresent()) {
            RuntimeException error = state.error().get();
            log.error("Operation {} stopped at {}: {}", operation.id(), finalOperation.status(), error.getMessage());
            metrics.recordOperationResult("failed");
            throw error;
        }
        metrics.recordOperationResult(finalOperation.status().name());
        return new ProcessResult(finalOperation,
                state.classificationResult().orElse(null),
                state.route().orElse(null),
                state.action().orElse(null),
                state.pipelineResult().orElse(null));
    }

    /**
     * Manual decision on an escalated operation.
     *
     * @throws IllegalStateTransitionException when the operation is not ESCALATED
     */
    public AtomicOperation resolveEscalation(String operationId, boolean approve) {
        OperationStatus target = approve ? OperationStatus.APPROVED : OperationStatus.REJECTED;
        AtomicOperation operation = store.getOperation(operationId);
        MdcContext.setOperation(operationId, operation.userId());
        try {
            if (operation.status() != OperationStatus.ESCALATED) {
                throw new IllegalStateTransitionException(operationId, operation.status(), target);
            }
            AtomicOperation resolved = store.transition(operationId, target);
            log.info("Escalated operation {} resolved as {}", operationId, target);
            metrics.recordOperationResult(target.name());
            eventBus.publish(new SwitchboardEvent(OperationEventType.RESOLVED, operationId,
                    Map.of("status", target.name()), clock.instant()));
            return resolved;
        } finally {
            MdcContext.clear();
        }
    }
}
