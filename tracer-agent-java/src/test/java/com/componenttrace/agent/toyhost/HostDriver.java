package com.componenttrace.agent.toyhost;

import java.util.List;

/**
 * Parent-loaded view of {@link ToyRenderer}, so tests can drive a renderer that was loaded
 * again in an instrumenting class loader.
 */
public interface HostDriver {

    int mount(String componentClass, Integer parentId);

    void renderBatch(List<Integer> componentIds);

    boolean invalidate(int componentId);

    Object fire(int componentId, String eventName);

    void unmount(int componentId);

    Object component(int componentId);

    void dispose();
}
