package com.libragraph.cadence.core.scheduler;

public class UnknownWorkFunctionException extends RuntimeException {

    public UnknownWorkFunctionException(String workRef) {
        super("No work function registered as '" + workRef + "'");
    }
}
