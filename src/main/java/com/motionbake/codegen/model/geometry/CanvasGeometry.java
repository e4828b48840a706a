package com.motionbake.codegen.model.geometry;

import com.motionbake.codegen.model.CanvasFilledRegionDetermination;
import com.motionbake.codegen.model.CanvasGeometryCombine;
import com.motionbake.codegen.model.Describable;
import com.motionbake.codegen.model.Matrix3x2;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Geometry drawn through the 2D geometry library of the target platform.
 * Its factory bodies are written by the target language.
 */
@Getter
@Setter
public abstract class CanvasGeometry implements Describable {

    public enum GeometryType {
        COMBINATION,
        ELLIPSE,
        PATH,
        ROUNDED_RECTANGLE
    }

    private String shortDescription;
    private String longDescription;

    public abstract GeometryType getGeometryType();

    @Override
    public String toString() {
        return "CanvasGeometry." + getGeometryType();
    }

    /**
     * Two geometries combined with a boolean operation, the second one
     * transformed by {@code matrix}.
     */
    @Getter
    public static final class Combination extends CanvasGeometry {
        private final CanvasGeometry a;
        private final CanvasGeometry b;
        private final Matrix3x2 matrix;
        private final CanvasGeometryCombine combineMode;

        public Combination(CanvasGeometry a, CanvasGeometry b, Matrix3x2 matrix, CanvasGeometryCombine combineMode) {
            this.a = a;
            this.b = b;
            this.matrix = matrix;
            this.combineMode = combineMode;
        }

        @Override
        public GeometryType getGeometryType() {
            return GeometryType.COMBINATION;
        }
    }

    @Getter
    public static final class Ellipse extends CanvasGeometry {
        private final float x;
        private final float y;
        private final float radiusX;
        private final float radiusY;

        public Ellipse(float x, float y, float radiusX, float radiusY) {
            this.x = x;
            this.y = y;
            this.radiusX = radiusX;
            this.radiusY = radiusY;
        }

        @Override
        public GeometryType getGeometryType() {
            return GeometryType.ELLIPSE;
        }
    }

    @Getter
    public static final class RoundedRectangle extends CanvasGeometry {
        private final float x;
        private final float y;
        private final float w;
        private final float h;
        private final float radiusX;
        private final float radiusY;

        public RoundedRectangle(float x, float y, float w, float h, float radiusX, float radiusY) {
            this.x = x;
            this.y = y;
            this.w = w;
            this.h = h;
            this.radiusX = radiusX;
            this.radiusY = radiusY;
        }

        @Override
        public GeometryType getGeometryType() {
            return GeometryType.ROUNDED_RECTANGLE;
        }
    }

    /**
     * Geometry built from a sequence of path commands.
     */
    public static final class Path extends CanvasGeometry {
        @Getter
        private final CanvasFilledRegionDetermination filledRegionDetermination;
        private final List<PathCommand> commands;

        public Path(CanvasFilledRegionDetermination filledRegionDetermination, List<PathCommand> commands) {
            this.filledRegionDetermination = filledRegionDetermination;
            this.commands = new ArrayList<>(commands);
        }

        public List<PathCommand> getCommands() {
            return Collections.unmodifiableList(commands);
        }

        @Override
        public GeometryType getGeometryType() {
            return GeometryType.PATH;
        }
    }
}
