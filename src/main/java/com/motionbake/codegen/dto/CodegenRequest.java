package com.motionbake.codegen.dto;

import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.model.composition.Visual;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodegenRequest {
    // Null fields fall back to the configured defaults
    private String targetLanguage;
    private String className;
    private Boolean setCommentProperties;

    private Visual rootVisual;
    private float width;
    private float height;
    private Duration duration;

    // Defaults to the root visual's own property set
    private CompositionPropertySet progressPropertySet;
}
