package com.pandora.orchestrator.function;

/**
 * A step references a compute function that is not in the table. Fails that step only.
 */
public class UnknownFunctionException extends RuntimeException {

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("No step function registered with name: '" + functionName + "'");
        this.functionName = functionName;
    }

    public String getFunctionName() { return functionName; }
}
