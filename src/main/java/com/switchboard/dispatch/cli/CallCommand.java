package com.switchboard.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.dispatch.method.CoreMethodRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: switchboard call &lt;method&gt; '&lt;json params&gt;'
 * <p>
 * Invokes a registry method and prints the JSON result.
 */
@Command(name = "call", mixinStandardHelpOptions = true, description = "Invoke a core method with JSON params")
@Component
public class CallCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CallCommand.class);

    @Parameters(index = "0", arity = "0..1", description = "Method name, e.g. classify or feedback/record")
    private String method;

    @Parameters(index = "1", arity = "0..1", description = "Params as a JSON object", defaultValue = "{}")
    private String params;

    @Option(names = {"--list", "-l"}, description = "List available methods")
    private boolean list;

    private final CoreMethodRegistry registry;
    private final ObjectMapper objectMapper;

    public CallCommand(CoreMethodRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (list || method == null) {
            registry.methodNames().stream().sorted().forEach(name ->
                    System.out.println("  " + name + (registry.spec(name).requiresStore() ? " (store)" : "")));
            return 0;
        }
        try {
            JsonNode result = registry.dispatch(method, objectMapper.readTree(params));
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            return 0;
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Invalid JSON: " + e.getOriginalMessage());
            return 1;
        } catch (RuntimeException e) {
            log.debug("Call to {} failed", method, e);
            ConsoleOutput.error(method + " failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }
    }
}
