package com.componenttrace.agent.toyhost;

public class Label extends ToyComponent {

    @Override
    public void render() {
    }

    @Override
    public boolean shouldRender() {
        return false;
    }
}
