package com.componenttrace.agent;

import com.componenttrace.core.inspector.ParameterReader;
import com.componenttrace.core.metrics.LifecyclePhase;

import java.util.List;

/**
 * Names of the host runtime's types, lifecycle methods and renderer internals the agent binds to.
 *
 * Component and renderer types are matched by supertype, so concrete components need no
 * configuration. Field-name lists are tried in order by {@link ReflectiveTreeIntrospector}.
 * Parameter annotations are matched by simple or qualified name.
 */
public record HostBinding(
    String componentType,
    String rendererType,
    String initMethod,
    String parametersMethod,
    String renderMethod,
    String postRenderMethod,
    String callbackMethod,
    String invalidateMethod,
    String renderGateMethod,
    String disposeMethod,
    String instantiateMethod,
    String attachMethod,
    String batchMethod,
    List<String> stateMapFields,
    List<String> stateComponentFields,
    List<String> stateIdFields,
    List<String> stateParentFields,
    List<String> parameterAnnotations,
    List<String> cascadingParameterAnnotations
) {

    public static HostBinding defaults(String componentType, String rendererType) {
        return new HostBinding(
            componentType,
            rendererType,
            "onInitialized",
            "setParameters",
            "render",
            "onAfterRender",
            "handleEvent",
            "stateHasChanged",
            "shouldRender",
            "dispose",
            "instantiateComponent",
            "attachComponent",
            "renderBatch",
            List.of("componentStateById", "componentStateByComponentId", "componentStates", "components"),
            List.of("component", "instance"),
            List.of("componentId", "id"),
            List.of("parentComponentState", "parentState", "parent"),
            List.of("Parameter"),
            List.of("CascadingParameter"));
    }

    /** Reads component fields carrying the host's parameter annotations. */
    public ParameterReader parameterReader() {
        return new ParameterReader(parameterAnnotations, cascadingParameterAnnotations);
    }

    public boolean isBound() {
        return componentType != null && !componentType.isBlank();
    }

    /** Lifecycle phase a component method reports, or null for unrelated methods. */
    public LifecyclePhase phaseOf(String methodName) {
        if (methodName == null) return null;
        if (methodName.equals(renderMethod)) return LifecyclePhase.RENDER;
        if (methodName.equals(parametersMethod)) return LifecyclePhase.PARAMETERS_SET;
        if (methodName.equals(initMethod)) return LifecyclePhase.INITIALIZE;
        if (methodName.equals(postRenderMethod)) return LifecyclePhase.POST_RENDER;
        if (methodName.equals(callbackMethod)) return LifecyclePhase.EVENT_CALLBACK;
        return null;
    }

    public String[] phaseMethods() {
        return new String[] { initMethod, parametersMethod, renderMethod, postRenderMethod, callbackMethod };
    }
}
