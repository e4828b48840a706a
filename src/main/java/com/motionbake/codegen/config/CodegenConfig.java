package com.motionbake.codegen.config;

import com.motionbake.codegen.dto.CodegenOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Request defaults for the code generator.
 * Reads them from the codegen properties in application.yml.
 */
@Configuration
@Slf4j
public class CodegenConfig {

    @Value("${codegen.default-target:csharp}")
    private String defaultTarget;

    @Value("${codegen.default-class-name:AnimatedVisualSource}")
    private String defaultClassName;

    @Value("${codegen.set-comment-properties:false}")
    private boolean setCommentProperties;

    @Bean
    public CodegenOptions codegenOptions() {
        log.info("[Codegen Config] Initializing CodegenOptions with target: {}, class name: {}, comment properties: {}",
                defaultTarget, defaultClassName, setCommentProperties);

        return CodegenOptions.builder()
                .defaultTarget(defaultTarget)
                .defaultClassName(defaultClassName)
                .setCommentProperties(setCommentProperties)
                .build();
    }
}
