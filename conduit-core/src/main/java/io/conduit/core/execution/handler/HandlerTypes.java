package io.conduit.core.execution.handler;

/// Type strings of the built-in handlers.
public final class HandlerTypes {

    public static final String START = "start";
    public static final String EXIT = "exit";
    public static final String CODERGEN = "codergen";
    public static final String WAIT_HUMAN = "wait.human";
    public static final String CONDITIONAL = "conditional";
    public static final String PARALLEL = "parallel";
    public static final String FAN_IN = "parallel.fan_in";
    public static final String TOOL = "tool";
    public static final String STACK_MANAGER_LOOP = "stack.manager_loop";

    private HandlerTypes() {}
}
