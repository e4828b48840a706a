package com.motionbake.codegen;

import com.motionbake.codegen.dto.CodegenOptions;
import com.motionbake.codegen.dto.CodegenRequest;
import com.motionbake.codegen.dto.CodegenResult;
import com.motionbake.codegen.service.InstantiatorCodegenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AnimationCodegenApplicationTest {

    @Autowired
    private InstantiatorCodegenService codegenService;

    @Autowired
    private CodegenOptions codegenOptions;

    @Test
    void loadsDefaultsFromConfiguration() {
        assertThat(codegenOptions.getDefaultTarget()).isEqualTo("csharp");
        assertThat(codegenOptions.getDefaultClassName()).isEqualTo("AnimatedVisualSource");
        assertThat(codegenOptions.isSetCommentProperties()).isFalse();
        assertThat(codegenService.availableTargets()).contains("csharp");
    }

    @Test
    void generatesCSharpWithConfiguredDefaults() {
        CodegenResult result = codegenService.generate(CodegenRequest.builder()
                .rootVisual(SceneFixtures.twoRedSprites())
                .width(100)
                .height(100)
                .duration(SceneFixtures.ONE_SECOND)
                .build());

        assertThat(result.getClassName()).isEqualTo("AnimatedVisualSource");
        assertThat(result.getCode()).contains("namespace AnimatedVisuals");
        assertThat(result.getCode()).containsOnlyOnce("sealed class AnimatedVisualSource : IAnimatedVisualSource");
        assertThat(result.getCode()).containsOnlyOnce("sealed class AnimatedVisual : IAnimatedVisual");
        assertThat(result.getCode()).doesNotContain("Progress property");
        assertThat(result.getCode()).contains("RootVisual = Root();");
    }
}
