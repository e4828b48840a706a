package com.motionbake.codegen.exception;

import lombok.Getter;

/**
 * Internal consistency fault raised while compiling a scene graph. A faulted run
 * produces no output; whatever was written so far must be discarded.
 */
@Getter
public class CodegenFaultException extends RuntimeException {

    public enum Fault {
        /** A variant or geometry kind with no matching emitter. */
        UNSUPPORTED_VARIANT,
        /** A cached-field read of a node that has no storage. */
        MISSING_STORAGE,
        /** The same caller asked twice for an uncached factory. */
        DUPLICATE_FACTORY_CALL,
        /** A reference to a node that was never given a factory or inline form. */
        UNRETAINED_NODE
    }

    private final Fault fault;

    public CodegenFaultException(Fault fault, String message) {
        super(fault + ": " + message);
        this.fault = fault;
    }
}
