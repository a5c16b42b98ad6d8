package com.componenttrace.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

/**
 * ByteBuddy advice installed on host component classes.
 *
 * Advice code is inlined into the component, so it may only call public static methods of
 * {@link AgentHooks}.
 */
public final class ComponentAdvice {

    private ComponentAdvice() {}

    /** Constructors: the component exists but has no id yet. */
    public static class Created {
        @Advice.OnMethodExit
        public static void exit(@Advice.This Object component) {
            AgentHooks.componentCreated(component);
        }
    }

    /** Initialize, parameters, render, post-render and callback methods. */
    public static class TimedPhase {
        @Advice.OnMethodEnter
        public static long enter() {
            return System.nanoTime();
        }

        @Advice.OnMethodExit(onThrowable = Throwable.class)
        public static void exit(
                @Advice.This Object component,
                @Advice.Origin("#m") String methodName,
                @Advice.Enter long startNanos,
                @Advice.AllArguments(readOnly = true) Object[] args,
                @Advice.Return(typing = Assigner.Typing.DYNAMIC, readOnly = true) Object returned) {
            AgentHooks.phaseExited(component, methodName, startNanos, args, returned);
        }
    }

    /** State invalidation; the boolean result tells whether the host accepted it. */
    public static class Invalidate {
        @Advice.OnMethodExit
        public static void exit(@Advice.This Object component, @Advice.Return boolean accepted) {
            AgentHooks.invalidated(component, accepted);
        }
    }

    public static class RenderGate {
        @Advice.OnMethodExit
        public static void exit(@Advice.This Object component, @Advice.Return boolean result) {
            AgentHooks.renderGate(component, result);
        }
    }

    public static class Disposed {
        @Advice.OnMethodEnter
        public static void enter(@Advice.This Object component) {
            AgentHooks.componentDisposed(component);
        }
    }
}
