package com.motionbake.codegen.service.codegen;

/**
 * How a reference from one generated factory to another object compiles.
 */
public record ReferenceExpr(Kind kind, String text) {

    public enum Kind {
        /** The callee's construction expression substituted in place. */
        INLINE,
        /** A read of the callee's cache field. */
        CACHED_FIELD,
        /** A direct call of the callee's factory method. */
        FACTORY_CALL
    }

    @Override
    public String toString() {
        return text;
    }
}
