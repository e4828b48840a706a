package com.motionbake.codegen.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodegenResult {
    private String className;
    private String targetLanguage;
    private String code;
    private long factoryMethodCount;
    private long fieldCount;
}
