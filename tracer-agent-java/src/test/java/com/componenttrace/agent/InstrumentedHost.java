package com.componenttrace.agent;

import com.componenttrace.agent.toyhost.AsyncButton;
import com.componenttrace.agent.toyhost.ComponentState;
import com.componenttrace.agent.toyhost.Counter;
import com.componenttrace.agent.toyhost.HostDriver;
import com.componenttrace.agent.toyhost.Label;
import com.componenttrace.agent.toyhost.ToyComponent;
import com.componenttrace.agent.toyhost.ToyRenderer;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;

/**
 * Loads the toy host again in a child-first class loader with the agent's advice applied,
 * the way the agent transformer would at class-load time.
 */
final class InstrumentedHost {

    static final HostBinding BINDING =
        HostBinding.defaults(ToyComponent.class.getName(), ToyRenderer.class.getName());

    private InstrumentedHost() {}

    static ClassLoader load() {
        DynamicType.Unloaded<?> renderer =
            HostInstrumentation.renderer(new ByteBuddy().redefine(ToyRenderer.class), BINDING).make();
        return renderer
            .include(
                component(ToyComponent.class),
                component(Counter.class),
                component(Label.class),
                component(AsyncButton.class),
                new ByteBuddy().redefine(ComponentState.class).make())
            .load(ToyRenderer.class.getClassLoader(), ClassLoadingStrategy.Default.CHILD_FIRST)
            .getLoaded()
            .getClassLoader();
    }

    /** A new renderer; constructing it opens its session. */
    static HostDriver newRenderer(ClassLoader loader) throws ReflectiveOperationException {
        return (HostDriver) loader.loadClass(ToyRenderer.class.getName()).getConstructor().newInstance();
    }

    private static DynamicType.Unloaded<?> component(Class<?> type) {
        return HostInstrumentation.component(new ByteBuddy().redefine(type), BINDING).make();
    }
}
