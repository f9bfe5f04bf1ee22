package com.pandora.orchestrator.function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to function table for COMPUTE steps.
 *
 * Every {@link StepFunction} bean is collected here at startup. Two functions
 * with the same name fail startup.
 */
@Component
public class StepFunctionTable {

    private static final Logger log = LoggerFactory.getLogger(StepFunctionTable.class);

    private final Map<String, StepFunction> functions = new ConcurrentHashMap<>();

    public StepFunctionTable(List<StepFunction> allFunctions) {
        for (StepFunction fn : allFunctions) {
            StepFunction previous = functions.putIfAbsent(fn.name(), fn);
            if (previous != null) {
                throw new IllegalStateException("Step function '" + fn.name() + "' is declared by both "
                        + previous.getClass().getSimpleName() + " and " + fn.getClass().getSimpleName());
            }
            log.info("Registered step function '{}'", fn.name());
        }
    }

    /**
     * @throws UnknownFunctionException if no function has that name
     */
    public StepFunction resolve(String name) {
        StepFunction fn = name == null ? null : functions.get(name);
        if (fn == null) {
            throw new UnknownFunctionException(name);
        }
        return fn;
    }

    public Optional<StepFunction> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(functions.get(name));
    }

    /** Registered names, sorted. */
    public List<String> names() {
        return functions.keySet().stream().sorted().toList();
    }
}
