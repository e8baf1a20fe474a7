package com.libragraph.cadence.core.oauth;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

@ApplicationScoped
public class OAuthStateSweeper {

    @Inject
    OAuthStateStore stateStore;

    @Scheduled(every = "5m", concurrentExecution = SKIP)
    public void sweep() {
        stateStore.sweepExpired();
    }
}
