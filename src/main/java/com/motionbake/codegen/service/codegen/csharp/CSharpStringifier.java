package com.motionbake.codegen.service.codegen.csharp;

import com.motionbake.codegen.model.CanvasFigureLoop;
import com.motionbake.codegen.model.CanvasFilledRegionDetermination;
import com.motionbake.codegen.model.CanvasGeometryCombine;
import com.motionbake.codegen.model.Color;
import com.motionbake.codegen.model.Matrix3x2;
import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.Vector3;
import com.motionbake.codegen.service.codegen.StringifierBase;

/**
 * C# literals and tokens for the Windows composition API.
 */
public class CSharpStringifier extends StringifierBase {

    @Override
    public String getDeref() {
        return ".";
    }

    @Override
    public String getScopeResolve() {
        return ".";
    }

    @Override
    public String getNew() {
        return "new";
    }

    @Override
    public String getNull() {
        return "null";
    }

    @Override
    public String getVar() {
        return "var";
    }

    @Override
    public String getReadonly() {
        return "readonly";
    }

    @Override
    public String getIListAdd() {
        return "Add";
    }

    @Override
    public String getInt64TypeName() {
        return "long";
    }

    @Override
    public String int64(long value) {
        return value + "L";
    }

    @Override
    public String color(Color value) {
        return "Color.FromArgb(" + hex(value.a()) + ", " + hex(value.r()) + ", " + hex(value.g()) + ", " + hex(value.b()) + ")";
    }

    @Override
    public String vector2(Vector2 value) {
        return "new Vector2(" + float32(value.x()) + ", " + float32(value.y()) + ")";
    }

    @Override
    public String vector3(Vector3 value) {
        return "new Vector3(" + float32(value.x()) + ", " + float32(value.y()) + ", " + float32(value.z()) + ")";
    }

    @Override
    public String matrix3x2(Matrix3x2 value) {
        return "new Matrix3x2(" + float32(value.m11()) + ", " + float32(value.m12()) + ", "
                + float32(value.m21()) + ", " + float32(value.m22()) + ", "
                + float32(value.m31()) + ", " + float32(value.m32()) + ")";
    }

    @Override
    public String timeSpan(String ticks) {
        return "TimeSpan.FromTicks(" + ticks + ")";
    }

    @Override
    public String canvasFigureLoop(CanvasFigureLoop value) {
        return "CanvasFigureLoop." + value.getDisplayName();
    }

    @Override
    public String canvasGeometryCombine(CanvasGeometryCombine value) {
        return "CanvasGeometryCombine." + value.getDisplayName();
    }

    @Override
    public String filledRegionDetermination(CanvasFilledRegionDetermination value) {
        return "CanvasFilledRegionDetermination." + value.getDisplayName();
    }

    @Override
    public String referenceTypeName(String value) {
        return value;
    }

    @Override
    public String factoryCall(String value) {
        return "CanvasGeometryToIGeometrySource2D(" + value + ")";
    }
}
