package com.motionbake.codegen.service;

import com.motionbake.codegen.dto.CodegenOptions;
import com.motionbake.codegen.dto.CodegenRequest;
import com.motionbake.codegen.dto.CodegenResult;
import com.motionbake.codegen.exception.UnknownTargetLanguageException;
import com.motionbake.codegen.model.composition.CompositionSpriteShape;
import com.motionbake.codegen.model.composition.ShapeVisual;
import com.motionbake.codegen.service.codegen.AnimationBinder;
import com.motionbake.codegen.service.codegen.ClassShellWriter;
import com.motionbake.codegen.service.codegen.CodeBuilder;
import com.motionbake.codegen.service.codegen.csharp.CSharpTargetLanguage;
import com.motionbake.codegen.service.codegen.TargetLanguage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static com.motionbake.codegen.SceneFixtures.ONE_SECOND;
import static com.motionbake.codegen.SceneFixtures.shapeVisual;
import static com.motionbake.codegen.SceneFixtures.sprite;
import static com.motionbake.codegen.SceneFixtures.twoRedSprites;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class InstantiatorCodegenServiceTest {

    @Mock
    private TargetLanguage targetLanguage;

    @Mock
    private ClassShellWriter classShellWriter;

    private final CSharpTargetLanguage csharp = new CSharpTargetLanguage();

    private InstantiatorCodegenService service;

    @BeforeEach
    void setUp() {
        lenient().when(targetLanguage.getName()).thenReturn("mock");
        lenient().when(targetLanguage.getStringifier()).thenReturn(csharp.getStringifier());
        lenient().when(targetLanguage.getCanvasGeometryWriter()).thenReturn(csharp.getCanvasGeometryWriter());
        lenient().when(targetLanguage.newClassShellWriter()).thenReturn(classShellWriter);

        CodegenOptions options = CodegenOptions.builder()
                .defaultTarget("mock")
                .defaultClassName("DefaultVisual")
                .setCommentProperties(false)
                .build();
        service = new InstantiatorCodegenService(List.of(targetLanguage, csharp), options);
    }

    @Test
    void passesRootAndReusableExpressionField_toTheClassEnd() {
        ShapeVisual root = twoRedSprites();

        CodegenResult result = service.generate(CodegenRequest.builder()
                .rootVisual(root)
                .width(100)
                .height(50)
                .duration(ONE_SECOND)
                .build());

        verify(classShellWriter).writePreamble(any(CodeBuilder.class), eq(false));
        verify(classShellWriter).writeClassStart(any(CodeBuilder.class), eq("DefaultVisual"), any(),
                eq(root.getProperties()), eq(ONE_SECOND));
        verify(classShellWriter).writeClassEnd(any(CodeBuilder.class), argThat(node -> "Root".equals(node.getName())),
                eq(AnimationBinder.REUSABLE_EXPRESSION_ANIMATION_FIELD));
        assertThat(result.getClassName()).isEqualTo("DefaultVisual");
        assertThat(result.getTargetLanguage()).isEqualTo("mock");
        assertThat(result.getFactoryMethodCount()).isEqualTo(4);
        assertThat(result.getFieldCount()).isEqualTo(1);
    }

    @Test
    void usesRequestedTargetAndClassName() {
        CodegenResult result = service.generate(CodegenRequest.builder()
                .targetLanguage("csharp")
                .className("Spinner")
                .rootVisual(twoRedSprites())
                .width(100)
                .height(100)
                .duration(ONE_SECOND)
                .build());

        assertThat(result.getTargetLanguage()).isEqualTo("csharp");
        assertThat(result.getCode()).contains("sealed class Spinner : IAnimatedVisualSource");
        assertThat(result.getCode()).contains("public Vector2 Size => new Vector2(100, 100);");
    }

    @Test
    void rejectsUnknownTarget() {
        CodegenRequest request = CodegenRequest.builder()
                .targetLanguage("cobol")
                .rootVisual(twoRedSprites())
                .duration(ONE_SECOND)
                .build();

        assertThatThrownBy(() -> service.generate(request))
                .isInstanceOf(UnknownTargetLanguageException.class)
                .hasMessageContaining("cobol");
    }

    @Test
    void rejectsRequestWithoutRootOrDuration() {
        assertThatThrownBy(() -> service.generate(CodegenRequest.builder().duration(ONE_SECOND).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.generate(CodegenRequest.builder().rootVisual(twoRedSprites()).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsClassNameOfTheNestedCSharpClass(CapturedOutput output) {
        CodegenRequest request = CodegenRequest.builder()
                .targetLanguage("csharp")
                .className("AnimatedVisual")
                .rootVisual(twoRedSprites())
                .duration(ONE_SECOND)
                .build();

        assertThatThrownBy(() -> service.generate(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("AnimatedVisual");
        assertThat(output).contains("Code generation failed for class AnimatedVisual");
    }

    @Test
    void logsAndRethrows_whenSceneHoldsNonFiniteValue(CapturedOutput output) {
        CompositionSpriteShape shape = sprite(null, null);
        shape.setStrokeThickness(Float.NaN);
        CodegenRequest request = CodegenRequest.builder()
                .targetLanguage("csharp")
                .className("Broken")
                .rootVisual(shapeVisual(shape))
                .duration(ONE_SECOND)
                .build();

        assertThatThrownBy(() -> service.generate(request))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(output).contains("Code generation failed for class Broken");
    }

    @Test
    void listsRegisteredTargets() {
        assertThat(service.availableTargets()).containsExactly("csharp", "mock");
    }
}
