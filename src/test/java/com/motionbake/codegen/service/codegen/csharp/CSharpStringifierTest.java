package com.motionbake.codegen.service.codegen.csharp;

import com.motionbake.codegen.model.CanvasFilledRegionDetermination;
import com.motionbake.codegen.model.CanvasGeometryCombine;
import com.motionbake.codegen.model.Color;
import com.motionbake.codegen.model.Matrix3x2;
import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.Vector3;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CSharpStringifierTest {

    private final CSharpStringifier stringifier = new CSharpStringifier();

    @Test
    void writesIntegralFloatsWithoutSuffix() {
        assertThat(stringifier.float32(2f)).isEqualTo("2");
        assertThat(stringifier.float32(-100f)).isEqualTo("-100");
        assertThat(stringifier.float32(0f)).isEqualTo("0");
    }

    @Test
    void writesFractionalFloatsWithSuffix() {
        assertThat(stringifier.float32(1.5f)).isEqualTo("1.5F");
        assertThat(stringifier.float32(-0.25f)).isEqualTo("-0.25F");
        assertThat(stringifier.float32(0.1f)).isEqualTo("0.100000001F");
    }

    @Test
    void rejectsNonFiniteFloats() {
        assertThatThrownBy(() -> stringifier.float32(Float.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> stringifier.float32(Float.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void writesCompositeValues() {
        assertThat(stringifier.color(Color.fromArgb(0x80, 0x12, 0xAB, 0x00)))
                .isEqualTo("Color.FromArgb(0x80, 0x12, 0xAB, 0x00)");
        assertThat(stringifier.vector2(new Vector2(1, 0.5f))).isEqualTo("new Vector2(1, 0.5F)");
        assertThat(stringifier.vector3(new Vector3(1, 2, 3))).isEqualTo("new Vector3(1, 2, 3)");
        assertThat(stringifier.matrix3x2(new Matrix3x2(1, 0, 0, 1, 10, 20)))
                .isEqualTo("new Matrix3x2(1, 0, 0, 1, 10, 20)");
    }

    @Test
    void writesTimeSpansInTicks() {
        assertThat(stringifier.timeSpan(Duration.ofSeconds(2))).isEqualTo("TimeSpan.FromTicks(20000000L)");
        assertThat(stringifier.timeSpan("c_durationTicks")).isEqualTo("TimeSpan.FromTicks(c_durationTicks)");
        assertThat(stringifier.int64(42)).isEqualTo("42L");
    }

    @Test
    void escapesStrings() {
        assertThat(stringifier.string("a\"b\\c\nd")).isEqualTo("\"a\\\"b\\\\c\\nd\"");
    }

    @Test
    void writesEnumsAndGeometrySourceWrapper() {
        assertThat(stringifier.canvasGeometryCombine(CanvasGeometryCombine.XOR)).isEqualTo("CanvasGeometryCombine.Xor");
        assertThat(stringifier.filledRegionDetermination(CanvasFilledRegionDetermination.WINDING))
                .isEqualTo("CanvasFilledRegionDetermination.Winding");
        assertThat(stringifier.factoryCall("Geometry()")).isEqualTo("CanvasGeometryToIGeometrySource2D(Geometry())");
        assertThat(stringifier.referenceTypeName("CompositionPath")).isEqualTo("CompositionPath");
    }
}
