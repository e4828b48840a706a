package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.exception.CodegenFaultException;
import com.motionbake.codegen.exception.CodegenFaultException.Fault;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.service.graph.GraphNode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Set;

/**
 * Decides how a reference from one factory to another object compiles.
 *
 * Factory methods are written in name order, but they run in construction order:
 * a callee whose construction index is not after the caller's has already been
 * built when the caller runs, so it is read from its field. Otherwise the first
 * request from a caller calls the factory, and later requests from the same
 * caller read the field the factory filled in.
 */
@Slf4j
public final class ReferenceResolver {

    private record Call(GraphNode caller, GraphNode callee) {
    }

    private final CompilationContext context;
    private final Set<Call> factoriesAlreadyCalled = new HashSet<>();

    ReferenceResolver(CompilationContext context) {
        this.context = context;
    }

    /**
     * Resolves a reference from {@code caller} to an object of the graph. A property
     * set is obtained through its owner.
     */
    public ReferenceExpr resolve(GraphNode caller, Object callee) {
        if (callee instanceof CompositionPropertySet propertySet) {
            ReferenceExpr owner = resolve(caller, propertySet.getOwner());
            return new ReferenceExpr(owner.kind(), owner.text() + context.getStringifier().getDeref() + "Properties");
        }
        return resolve(caller, context.compiledNodeFor(callee));
    }

    public ReferenceExpr resolve(GraphNode caller, CompiledNode callee) {
        if (callee.isInlined()) {
            return new ReferenceExpr(ReferenceExpr.Kind.INLINE, callee.getInlineExpression());
        }

        if (caller.getPosition() >= callee.getConstructionOrderIndex()) {
            if (!callee.isRequiresStorage()) {
                throw new CodegenFaultException(Fault.MISSING_STORAGE,
                        callee.getName() + " is read from its field by " + caller + " but has no storage");
            }
            return cachedField(caller, callee);
        }

        Call call = new Call(caller, callee.getGraphNode());
        if (callee.isRequiresStorage() && factoriesAlreadyCalled.contains(call)) {
            return cachedField(caller, callee);
        }

        if (!factoriesAlreadyCalled.add(call)) {
            throw new CodegenFaultException(Fault.DUPLICATE_FACTORY_CALL,
                    caller + " calls the uncached factory " + callee.getName() + " more than once");
        }
        log.debug("{} -> {}: factory call", caller, callee.getName());
        return new ReferenceExpr(ReferenceExpr.Kind.FACTORY_CALL, callee.factoryCall());
    }

    private ReferenceExpr cachedField(GraphNode caller, CompiledNode callee) {
        log.debug("{} -> {}: cached field", caller, callee.getName());
        return new ReferenceExpr(ReferenceExpr.Kind.CACHED_FIELD, callee.getFieldName());
    }
}
