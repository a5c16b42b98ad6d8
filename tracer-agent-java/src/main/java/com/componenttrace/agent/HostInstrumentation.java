package com.componenttrace.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.matcher.ElementMatcher;

import java.util.Arrays;
import java.util.Objects;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Applies the component and renderer advice to a type being built.
 * Shared by the agent transformer and by tests that redefine host classes directly.
 */
public final class HostInstrumentation {

    private HostInstrumentation() {}

    public static DynamicType.Builder<?> component(DynamicType.Builder<?> builder, HostBinding binding) {
        String[] phaseMethods = Arrays.stream(binding.phaseMethods()).filter(Objects::nonNull).toArray(String[]::new);
        return builder
            .visit(Advice.to(ComponentAdvice.Created.class).on(isConstructor()))
            .visit(Advice.to(ComponentAdvice.TimedPhase.class).on(instanceMethod().and(namedOneOf(phaseMethods))))
            .visit(Advice.to(ComponentAdvice.Invalidate.class)
                .on(instanceMethod().and(named(binding.invalidateMethod())).and(returns(boolean.class))))
            .visit(Advice.to(ComponentAdvice.RenderGate.class)
                .on(instanceMethod().and(named(binding.renderGateMethod())).and(returns(boolean.class))))
            .visit(Advice.to(ComponentAdvice.Disposed.class)
                .on(instanceMethod().and(named(binding.disposeMethod())).and(takesArguments(0))));
    }

    public static DynamicType.Builder<?> renderer(DynamicType.Builder<?> builder, HostBinding binding) {
        return builder
            .visit(Advice.to(RendererAdvice.Created.class).on(isConstructor()))
            .visit(Advice.to(RendererAdvice.Scope.class).on(instanceMethod().and(named(binding.instantiateMethod()))))
            .visit(Advice.to(RendererAdvice.Attach.class).on(instanceMethod().and(named(binding.attachMethod()))))
            .visit(Advice.to(RendererAdvice.Batch.class).on(instanceMethod().and(named(binding.batchMethod()))))
            .visit(Advice.to(RendererAdvice.Disposed.class)
                .on(instanceMethod().and(named(binding.disposeMethod())).and(takesArguments(0))));
    }

    private static ElementMatcher.Junction<MethodDescription> instanceMethod() {
        return isMethod()
            .and(not(isAbstract()))
            .and(not(isStatic()))
            .and(not(isNative()))
            .and(not(isSynthetic()));
    }
}
