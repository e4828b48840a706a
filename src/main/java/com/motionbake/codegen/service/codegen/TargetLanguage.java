package com.motionbake.codegen.service.codegen;

/**
 * A language the instantiator generator can emit, registered as a Spring bean.
 */
public interface TargetLanguage {

    /** Name requests select the language by, e.g. {@code csharp}. */
    String getName();

    Stringifier getStringifier();

    CanvasGeometryWriter getCanvasGeometryWriter();

    /** A fresh class shell writer for one compilation. */
    ClassShellWriter newClassShellWriter();
}
