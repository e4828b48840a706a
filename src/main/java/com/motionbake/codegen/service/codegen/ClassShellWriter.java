package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.composition.CompositionPropertySet;

import java.time.Duration;

/**
 * Writes the parts of a generated unit around the factory methods. One instance
 * serves a single compilation, so implementations may carry state from the
 * class start to the class end.
 */
public interface ClassShellWriter {

    /**
     * Writes imports or includes.
     *
     * @param requiresWin2d whether any canvas geometry factory is generated
     */
    void writePreamble(CodeBuilder builder, boolean requiresWin2d);

    void writeClassStart(CodeBuilder builder, String className, Vector2 size,
                         CompositionPropertySet progressPropertySet, Duration duration);

    /**
     * Writes the end of the class, including the code that builds the root.
     */
    void writeClassEnd(CodeBuilder builder, CompiledNode root, String reusableExpressionAnimationField);
}
