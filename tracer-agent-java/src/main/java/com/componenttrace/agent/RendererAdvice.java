package com.componenttrace.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

/**
 * ByteBuddy advice installed on the host renderer. Each renderer instance owns one tracer session.
 */
public final class RendererAdvice {

    private RendererAdvice() {}

    public static class Created {
        @Advice.OnMethodExit
        public static void exit(@Advice.This Object renderer) {
            AgentHooks.rendererCreated(renderer);
        }
    }

    /** Component factory method: components constructed inside belong to this renderer's session. */
    public static class Scope {
        @Advice.OnMethodEnter
        public static void enter(@Advice.This Object renderer) {
            AgentHooks.enterRenderer(renderer);
        }

        @Advice.OnMethodExit(onThrowable = Throwable.class)
        public static void exit() {
            AgentHooks.exitRenderer();
        }
    }

    /** Id assignment: first argument is the component, an optional Integer second argument its parent id. */
    public static class Attach {
        @Advice.OnMethodEnter
        public static void enter(@Advice.This Object renderer) {
            AgentHooks.enterRenderer(renderer);
        }

        @Advice.OnMethodExit(onThrowable = Throwable.class)
        public static void exit(
                @Advice.This Object renderer,
                @Advice.AllArguments(readOnly = true) Object[] args,
                @Advice.Return(typing = Assigner.Typing.DYNAMIC, readOnly = true) Object returned) {
            try {
                AgentHooks.attached(renderer, args, returned);
            } finally {
                AgentHooks.exitRenderer();
            }
        }
    }

    public static class Batch {
        @Advice.OnMethodEnter
        public static void enter(@Advice.This Object renderer, @Advice.Origin("#m") String methodName) {
            AgentHooks.batchStarted(renderer, methodName);
        }

        @Advice.OnMethodExit(onThrowable = Throwable.class)
        public static void exit() {
            AgentHooks.batchCompleted();
        }
    }

    public static class Disposed {
        @Advice.OnMethodEnter
        public static void enter(@Advice.This Object renderer) {
            AgentHooks.rendererDisposed(renderer);
        }
    }
}
