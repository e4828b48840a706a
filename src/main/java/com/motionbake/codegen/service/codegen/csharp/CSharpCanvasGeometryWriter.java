package com.motionbake.codegen.service.codegen.csharp;

import com.motionbake.codegen.exception.CodegenFaultException;
import com.motionbake.codegen.exception.CodegenFaultException.Fault;
import com.motionbake.codegen.model.CanvasFilledRegionDetermination;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.model.geometry.PathCommand;
import com.motionbake.codegen.service.codegen.CanvasGeometryWriter;
import com.motionbake.codegen.service.codegen.CodeBuilder;
import com.motionbake.codegen.service.codegen.Stringifier;

/**
 * Win2D geometry factory bodies.
 */
public class CSharpCanvasGeometryWriter implements CanvasGeometryWriter {

    private final Stringifier s;

    public CSharpCanvasGeometryWriter(Stringifier stringifier) {
        this.s = stringifier;
    }

    @Override
    public void writeCombination(CodeBuilder builder, CanvasGeometry.Combination geometry, String typeName,
                                 String fieldName, GeometryReferences references) {
        String a = references.referenceTo(geometry.getA());
        String b = references.referenceTo(geometry.getB());
        builder.writeLine(s.getVar() + " result = " + fieldAssignment(fieldName) + a + ".");
        builder.indent();
        builder.writeLine("CombineWith(" + b + ",");
        builder.writeLine(s.matrix3x2(geometry.getMatrix()) + ",");
        builder.writeLine(s.canvasGeometryCombine(geometry.getCombineMode()) + ");");
        builder.unIndent();
    }

    @Override
    public void writeEllipse(CodeBuilder builder, CanvasGeometry.Ellipse geometry, String typeName, String fieldName) {
        builder.writeLine(s.getVar() + " result = " + fieldAssignment(fieldName) + "CanvasGeometry.CreateEllipse(");
        builder.indent();
        builder.writeLine("null,");
        builder.writeLine(s.float32(geometry.getX()) + ", " + s.float32(geometry.getY()) + ", "
                + s.float32(geometry.getRadiusX()) + ", " + s.float32(geometry.getRadiusY()) + ");");
        builder.unIndent();
    }

    @Override
    public void writePath(CodeBuilder builder, CanvasGeometry.Path geometry, String typeName, String fieldName) {
        builder.writeLine(typeName + " result;");
        builder.writeLine("using (var builder = new CanvasPathBuilder(null))");
        builder.openScope();
        if (geometry.getFilledRegionDetermination() != CanvasFilledRegionDetermination.ALTERNATE) {
            builder.writeLine("builder.SetFilledRegionDetermination("
                    + s.filledRegionDetermination(geometry.getFilledRegionDetermination()) + ");");
        }
        for (PathCommand command : geometry.getCommands()) {
            builder.writeLine("builder." + pathCommand(command) + ";");
        }
        builder.writeLine("result = " + fieldAssignment(fieldName) + "CanvasGeometry.CreatePath(builder);");
        builder.closeScope();
    }

    @Override
    public void writeRoundedRectangle(CodeBuilder builder, CanvasGeometry.RoundedRectangle geometry, String typeName,
                                      String fieldName) {
        builder.writeLine(s.getVar() + " result = " + fieldAssignment(fieldName) + "CanvasGeometry.CreateRoundedRectangle(");
        builder.indent();
        builder.writeLine("null,");
        builder.writeLine(s.float32(geometry.getX()) + ",");
        builder.writeLine(s.float32(geometry.getY()) + ",");
        builder.writeLine(s.float32(geometry.getW()) + ",");
        builder.writeLine(s.float32(geometry.getH()) + ",");
        builder.writeLine(s.float32(geometry.getRadiusX()) + ",");
        builder.writeLine(s.float32(geometry.getRadiusY()) + ");");
        builder.unIndent();
    }

    private String pathCommand(PathCommand command) {
        if (command instanceof PathCommand.BeginFigure beginFigure) {
            return "BeginFigure(" + s.vector2(beginFigure.startPoint()) + ")";
        } else if (command instanceof PathCommand.AddLine addLine) {
            return "AddLine(" + s.vector2(addLine.endPoint()) + ")";
        } else if (command instanceof PathCommand.AddCubicBezier cubic) {
            return "AddCubicBezier(" + s.vector2(cubic.controlPoint1()) + ", " + s.vector2(cubic.controlPoint2())
                    + ", " + s.vector2(cubic.endPoint()) + ")";
        } else if (command instanceof PathCommand.EndFigure endFigure) {
            return "EndFigure(" + s.canvasFigureLoop(endFigure.figureLoop()) + ")";
        }
        throw new CodegenFaultException(Fault.UNSUPPORTED_VARIANT, "Unknown path command " + command);
    }

    private static String fieldAssignment(String fieldName) {
        return fieldName == null ? "" : fieldName + " = ";
    }
}
