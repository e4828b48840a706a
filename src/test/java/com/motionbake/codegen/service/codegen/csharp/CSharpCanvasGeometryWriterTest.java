package com.motionbake.codegen.service.codegen.csharp;

import com.motionbake.codegen.model.CanvasFigureLoop;
import com.motionbake.codegen.model.CanvasFilledRegionDetermination;
import com.motionbake.codegen.model.CanvasGeometryCombine;
import com.motionbake.codegen.model.Matrix3x2;
import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.model.geometry.PathCommand;
import com.motionbake.codegen.service.codegen.CodeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CSharpCanvasGeometryWriterTest {

    private final CSharpCanvasGeometryWriter writer = new CSharpCanvasGeometryWriter(new CSharpStringifier());
    private final CodeBuilder builder = new CodeBuilder();

    @Test
    void writesPathThroughPathBuilder() {
        CanvasGeometry.Path path = new CanvasGeometry.Path(CanvasFilledRegionDetermination.WINDING, List.of(
                new PathCommand.BeginFigure(new Vector2(0, 0)),
                new PathCommand.AddLine(new Vector2(10, 0)),
                new PathCommand.AddCubicBezier(new Vector2(10, 5), new Vector2(5, 10), new Vector2(0, 10)),
                new PathCommand.EndFigure(CanvasFigureLoop.CLOSED)));

        writer.writePath(builder, path, "CanvasGeometry", null);

        assertThat(builder.toString()).isEqualTo(String.join("\n",
                "CanvasGeometry result;",
                "using (var builder = new CanvasPathBuilder(null))",
                "{",
                "    builder.SetFilledRegionDetermination(CanvasFilledRegionDetermination.Winding);",
                "    builder.BeginFigure(new Vector2(0, 0));",
                "    builder.AddLine(new Vector2(10, 0));",
                "    builder.AddCubicBezier(new Vector2(10, 5), new Vector2(5, 10), new Vector2(0, 10));",
                "    builder.EndFigure(CanvasFigureLoop.Closed);",
                "    result = CanvasGeometry.CreatePath(builder);",
                "}",
                ""));
    }

    @Test
    void leavesDefaultFillRuleUnset_andAssignsField() {
        CanvasGeometry.Path path = new CanvasGeometry.Path(CanvasFilledRegionDetermination.ALTERNATE, List.of(
                new PathCommand.BeginFigure(new Vector2(0, 0)),
                new PathCommand.EndFigure(CanvasFigureLoop.OPEN)));

        writer.writePath(builder, path, "CanvasGeometry", "_geometry");

        assertThat(builder.toString()).doesNotContain("SetFilledRegionDetermination");
        assertThat(builder.toString()).contains("result = _geometry = CanvasGeometry.CreatePath(builder);");
    }

    @Test
    void writesEllipse() {
        writer.writeEllipse(builder, new CanvasGeometry.Ellipse(1, 2, 3.5f, 4), "CanvasGeometry", null);

        assertThat(builder.toString()).isEqualTo(String.join("\n",
                "var result = CanvasGeometry.CreateEllipse(",
                "    null,",
                "    1, 2, 3.5F, 4);",
                ""));
    }

    @Test
    void writesRoundedRectangleIntoField() {
        writer.writeRoundedRectangle(builder, new CanvasGeometry.RoundedRectangle(0, 0, 20, 10, 2, 2),
                "CanvasGeometry", "_geometry");

        assertThat(builder.toString()).startsWith("var result = _geometry = CanvasGeometry.CreateRoundedRectangle(\n");
    }

    @Test
    void combinesOperandsResolvedByTheCaller() {
        CanvasGeometry.Ellipse a = new CanvasGeometry.Ellipse(0, 0, 1, 1);
        CanvasGeometry.Ellipse b = new CanvasGeometry.Ellipse(0, 0, 2, 2);
        CanvasGeometry.Combination combination = new CanvasGeometry.Combination(a, b,
                Matrix3x2.IDENTITY, CanvasGeometryCombine.UNION);

        writer.writeCombination(builder, combination, "CanvasGeometry", null,
                geometry -> geometry == a ? "Geometry_000()" : "_geometry_001");

        assertThat(builder.toString()).isEqualTo(String.join("\n",
                "var result = Geometry_000().",
                "    CombineWith(_geometry_001,",
                "    new Matrix3x2(1, 0, 0, 1, 0, 0),",
                "    CanvasGeometryCombine.Union);",
                ""));
    }
}
