package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.CanvasFigureLoop;
import com.motionbake.codegen.model.CanvasFilledRegionDetermination;
import com.motionbake.codegen.model.CanvasGeometryCombine;
import com.motionbake.codegen.model.Color;
import com.motionbake.codegen.model.Matrix3x2;
import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.Vector3;

import java.time.Duration;

/**
 * Renders literals and fixed tokens of a target language.
 */
public interface Stringifier {

    /** Member access on an object reference. */
    String getDeref();

    /** Member access on a value. */
    String getMemberSelect();

    /** Access to a static member or enum constant. */
    String getScopeResolve();

    String getNew();

    String getNull();

    /** Keyword that declares a local with an inferred type. */
    String getVar();

    /** Qualifier for fields assigned once, or blank when the language has none. */
    String getReadonly();

    /** Method that appends to a list. */
    String getIListAdd();

    String getInt64TypeName();

    String bool(boolean value);

    String int32(int value);

    String int64(long value);

    String float32(float value);

    String string(String value);

    String color(Color value);

    String vector2(Vector2 value);

    String vector3(Vector3 value);

    String matrix3x2(Matrix3x2 value);

    String timeSpan(Duration value);

    /** A time span built from an expression that evaluates to a tick count. */
    String timeSpan(String ticks);

    String canvasFigureLoop(CanvasFigureLoop value);

    String canvasGeometryCombine(CanvasGeometryCombine value);

    String filledRegionDetermination(CanvasFilledRegionDetermination value);

    /** Name of a reference type as used in declarations. */
    String referenceTypeName(String value);

    /** Wraps the result of a canvas geometry factory so it can be used as a path source. */
    String factoryCall(String value);
}
