package com.motionbake.codegen.model.geometry;

import com.motionbake.codegen.model.CanvasFigureLoop;
import com.motionbake.codegen.model.Vector2;

/**
 * One step of a {@link CanvasGeometry.Path}.
 */
public sealed interface PathCommand {

    record BeginFigure(Vector2 startPoint) implements PathCommand {
    }

    record AddLine(Vector2 endPoint) implements PathCommand {
    }

    record AddCubicBezier(Vector2 controlPoint1, Vector2 controlPoint2, Vector2 endPoint) implements PathCommand {
    }

    record EndFigure(CanvasFigureLoop figureLoop) implements PathCommand {
    }
}
