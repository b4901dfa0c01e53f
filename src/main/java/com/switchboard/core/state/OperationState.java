package com.switchboard.core.state;

import com.switchboard.core.model.AgentRoute;
import com.switchboard.core.model.ClassificationResult;
import com.switchboard.core.model.OperationStatus;
import com.switchboard.core.model.PipelineResult;
import com.switchboard.core.model.ProposedAction;
import com.switchboard.core.model.VerificationMode;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.Map;
import java.util.Optional;

/**
 * Graph state for one pass of an operation through classify, route, propose and verify.
 * <p>
 * The operation store stays the source of truth for the operation itself;
 * this state only carries what the nodes hand to each other.
 */
public class OperationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("operationId",          Channels.base(() -> "")),
        Map.entry("request",              Channels.base(() -> "")),
        Map.entry("userId",               Channels.base(() -> "")),
        Map.entry("mode",                 Channels.base(() -> VerificationMode.STRICT.name())),
        Map.entry("status",               Channels.base(() -> OperationStatus.CREATED.name())),
        Map.entry("classificationResult", Channels.base((Reducer<ClassificationResult>) null)),
        Map.entry("route",                Channels.base((Reducer<AgentRoute>) null)),
        Map.entry("action",               Channels.base((Reducer<ProposedAction>) null)),
        Map.entry("pipelineResult",       Channels.base((Reducer<PipelineResult>) null)),
        Map.entry("error",                Channels.base((Reducer<RuntimeException>) null))
    );

    public OperationState(Map<String, Object> initData) {
        super(initData);
    }

    public String operationId() {
        return this.<String>value("operationId").orElse("");
    }

    public String request() {
        return this.<String>value("request").orElse("");
    }

    /** Null for anonymous callers. */
    public String userId() {
        return this.<String>value("userId").orElse(null);
    }

    public VerificationMode mode() {
        return VerificationMode.valueOf(this.<String>value("mode").orElse(VerificationMode.STRICT.name()));
    }

    public OperationStatus status() {
        return OperationStatus.valueOf(this.<String>value("status").orElse(OperationStatus.CREATED.name()));
    }

    public Optional<ClassificationResult> classificationResult() {
        return this.value("classificationResult");
    }

    public Optional<AgentRoute> route() {
        return this.value("route");
    }

    public Optional<ProposedAction> action() {
        return this.value("action");
    }

    public Optional<PipelineResult> pipelineResult() {
        return this.value("pipelineResult");
    }

    public Optional<RuntimeException> error() {
        return this.value("error");
    }
}
