package io.agentgovernor.events;

@FunctionalInterface
public interface EventHandler {
    void handle(Event event) throws Exception;
}
