package com.warden.controlplane.infrastructure.events;

import com.warden.eventmodel.EventDispatcher;
import org.springframework.context.SmartLifecycle;

/** Runs the event dispatcher for the lifetime of the application context. */
public class EventDispatcherLifecycle implements SmartLifecycle {

    private final EventDispatcher dispatcher;

    public EventDispatcherLifecycle(EventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void start() {
        dispatcher.start();
    }

    // the gRPC server stops first, so nothing publishes once the channel is flushed
    @Override
    public void stop() {
        dispatcher.close();
    }

    @Override
    public boolean isRunning() {
        return dispatcher.isRunning();
    }

    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE - 1;
    }
}
