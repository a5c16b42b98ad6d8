package com.componenttrace.agent.toyhost;

import com.componenttrace.core.inspector.TrackState;

public class Counter extends ToyComponent {

    @TrackState
    int count;

    @Parameter
    String title = "Clicks";

    @CascadingParameter
    String theme;

    @Override
    public void render() {
        // draws the count
    }

    @Override
    public Object handleEvent(String eventName) {
        count++;
        stateHasChanged();
        return null;
    }
}
