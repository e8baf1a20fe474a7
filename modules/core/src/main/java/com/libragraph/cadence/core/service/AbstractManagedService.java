package com.libragraph.cadence.core.service;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

/**
 * Base class for {@link ManagedService} implementations. Provides:
 * <ul>
 *   <li>Thread-safe state machine via {@link AtomicReference}</li>
 *   <li>Logging of every state transition</li>
 *   <li>Dependency validation before start</li>
 * </ul>
 * Dependencies are the service instances handed to the subclass at construction;
 * {@link #start()} refuses to run while any of them is not RUNNING.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    protected final Logger log = Logger.getLogger(getClass());

    // -- template methods for subclasses --

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    /** Services that must be RUNNING before this one starts. */
    protected List<ManagedService> dependencies() {
        return List.of();
    }

    // -- ManagedService contract --

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return; // idempotent
        }

        verifyDependencies();

        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return; // idempotent
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return; // already failed
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED);
    }

    // -- internals --

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
    }

    private void verifyDependencies() {
        for (ManagedService dep : dependencies()) {
            if (!dep.isRunning()) {
                throw new IllegalStateException(
                        "Cannot start '" + serviceId() + "': dependency '"
                                + dep.serviceId() + "' is " + dep.state());
            }
        }
    }
}
