package com.motionbake.codegen.service.codegen.csharp;

import com.motionbake.codegen.service.codegen.CanvasGeometryWriter;
import com.motionbake.codegen.service.codegen.ClassShellWriter;
import com.motionbake.codegen.service.codegen.Stringifier;
import com.motionbake.codegen.service.codegen.TargetLanguage;
import org.springframework.stereotype.Component;

/**
 * C# against the Windows composition API, with Win2D for canvas geometries.
 */
@Component
public class CSharpTargetLanguage implements TargetLanguage {

    public static final String NAME = "csharp";

    private final CSharpStringifier stringifier = new CSharpStringifier();
    private final CSharpCanvasGeometryWriter canvasGeometryWriter = new CSharpCanvasGeometryWriter(stringifier);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Stringifier getStringifier() {
        return stringifier;
    }

    @Override
    public CanvasGeometryWriter getCanvasGeometryWriter() {
        return canvasGeometryWriter;
    }

    @Override
    public ClassShellWriter newClassShellWriter() {
        return new CSharpClassShellWriter(stringifier);
    }
}
