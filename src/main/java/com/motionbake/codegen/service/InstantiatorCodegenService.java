package com.motionbake.codegen.service;

import com.motionbake.codegen.dto.CodegenOptions;
import com.motionbake.codegen.dto.CodegenRequest;
import com.motionbake.codegen.dto.CodegenResult;
import com.motionbake.codegen.exception.UnknownTargetLanguageException;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.service.codegen.InstantiatorGenerator;
import com.motionbake.codegen.service.codegen.TargetLanguage;
import com.motionbake.codegen.service.graph.Canonicalizer;
import com.motionbake.codegen.service.graph.ObjectGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for generating instantiator code from a composition tree.
 * Every request gets its own graph, generator and output buffer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstantiatorCodegenService {

    private final List<TargetLanguage> targetLanguages;
    private final CodegenOptions codegenOptions;

    public CodegenResult generate(CodegenRequest request) {
        if (request.getRootVisual() == null) {
            throw new IllegalArgumentException("Root visual is required");
        }
        if (request.getDuration() == null) {
            throw new IllegalArgumentException("Duration is required");
        }

        String targetName = request.getTargetLanguage() != null
                ? request.getTargetLanguage()
                : codegenOptions.getDefaultTarget();
        String className = request.getClassName() != null
                ? request.getClassName()
                : codegenOptions.getDefaultClassName();
        boolean setCommentProperties = request.getSetCommentProperties() != null
                ? request.getSetCommentProperties()
                : codegenOptions.isSetCommentProperties();
        CompositionPropertySet progressPropertySet = request.getProgressPropertySet() != null
                ? request.getProgressPropertySet()
                : request.getRootVisual().getProperties();

        TargetLanguage targetLanguage = findTargetLanguage(targetName);

        log.info("Generating {} code for class {} ({}x{}, duration {})",
                targetName, className, request.getWidth(), request.getHeight(), request.getDuration());

        try {
            ObjectGraph graph = ObjectGraph.fromCompositionObject(request.getRootVisual());
            // Comments only matter for equivalence when they are written out.
            Canonicalizer.canonicalize(graph, !setCommentProperties);

            InstantiatorGenerator generator = new InstantiatorGenerator(graph, targetLanguage,
                    request.getDuration(), setCommentProperties);
            String code = generator.generateCode(className, request.getWidth(), request.getHeight(),
                    progressPropertySet);

            log.info("Generated class {}: {} factory methods, {} fields",
                    className, generator.getFactoryMethodCount(), generator.getFieldCount());

            return CodegenResult.builder()
                    .className(className)
                    .targetLanguage(targetLanguage.getName())
                    .code(code)
                    .factoryMethodCount(generator.getFactoryMethodCount())
                    .fieldCount(generator.getFieldCount())
                    .build();
        } catch (RuntimeException e) {
            // Engine faults and unwritable values alike abort the run with no output.
            log.error("Code generation failed for class {}: {}", className, e.getMessage());
            throw e;
        }
    }

    public List<String> availableTargets() {
        return targetLanguages.stream()
                .map(TargetLanguage::getName)
                .sorted()
                .toList();
    }

    private TargetLanguage findTargetLanguage(String name) {
        return targetLanguages.stream()
                .filter(language -> language.getName().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new UnknownTargetLanguageException(
                        "Unknown target language: " + name + ". Available: " + availableTargets()));
    }
}
