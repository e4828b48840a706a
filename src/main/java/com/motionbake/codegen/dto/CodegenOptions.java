package com.motionbake.codegen.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Defaults applied to requests that leave a setting out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodegenOptions {
    private String defaultTarget;
    private String defaultClassName;
    private boolean setCommentProperties;
}
