package com.switchboard.core.engine;

import com.switchboard.core.model.AgentRoute;
import com.switchboard.core.model.AtomicOperation;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.PipelineResult;
import com.switchboard.core.model.ProposedAction;

/**
 * Everything one pass of {@link OperationEngine#process} produced.
 *
 * @param operation the operation as stored after the pass
 */
public record ProcessResult(
        AtomicOperation operation,
        ClassificationResult classificationResult,
        AgentRoute route,
        ProposedAction action,
        PipelineResult pipelineResult
) {}
