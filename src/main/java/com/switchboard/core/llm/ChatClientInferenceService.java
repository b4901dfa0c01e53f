package com.switchboard.core.llm;

import com.switchboard.core.metrics.SwitchboardMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link InferenceService} backed by Spring AI's {@link ChatClient}.
 * <p>
 * Calls run on a bounded pool so that the caller can give up after the
 * per-call timeout; the abandoned request is cancelled.
 */
@Service
public class ChatClientInferenceService implements InferenceService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientInferenceService.class);

    private static final String JSON_INSTRUCTION =
            "\n\nRespond with a single JSON object and nothing else.";

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final SwitchboardMetrics metrics;
    private final String configuredModel;
    private final ExecutorService executor;

    public ChatClientInferenceService(ChatClient.Builder builder,
                                      LlmProperties properties,
                                      SwitchboardMetrics metrics,
                                      @Value("${spring.ai.openai.chat.options.model:unknown}") String configuredModel) {
        this.chatClient = builder.build();
        this.properties = properties;
        this.metrics = metrics;
        this.configuredModel = configuredModel;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrency()), new InferenceThreadFactory());
        log.info("Inference service initialized: model={}, timeout={}, maxConcurrency={}",
                modelName(), properties.getTimeout(), properties.getMaxConcurrency());
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, InferenceOptions options) {
        long start = System.currentTimeMillis();
        Future<String> future = executor.submit(() -> call(systemPrompt, userPrompt, options));
        try {
            String response = future.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordInferenceCall("success", elapsed);
            log.debug("Inference call complete ({}ms, {} chars)", elapsed, response.length());
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordInferenceCall("timeout", System.currentTimeMillis() - start);
            throw new InferenceTimeoutException(options.timeout(), e);
        } catch (ExecutionException e) {
            metrics.recordInferenceCall("failure", System.currentTimeMillis() - start);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof InferenceFailureException failure) {
                throw failure;
            }
            throw new InferenceFailureException("Inference backend error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new InferenceFailureException("Interrupted while waiting for inference", e);
        }
    }

    @Override
    public String modelName() {
        return properties.hasModel() ? properties.getModel() : configuredModel;
    }

    private String call(String systemPrompt, String userPrompt, InferenceOptions options) {
        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(options.jsonOutput() ? userPrompt + JSON_INSTRUCTION : userPrompt);
        Double temperature = options.temperature() != null ? options.temperature() : properties.getTemperature();
        if (properties.hasModel() || temperature != null) {
            var chatOptions = ChatOptions.builder();
            if (properties.hasModel()) {
                chatOptions.model(properties.getModel());
            }
            if (temperature != null) {
                chatOptions.temperature(temperature);
            }
            request = request.options(chatOptions.build());
        }
        String content = request.call().content();
        if (content == null || content.isBlank()) {
            throw new InferenceFailureException("Model returned empty content");
        }
        return content;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static final class InferenceThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "inference-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
