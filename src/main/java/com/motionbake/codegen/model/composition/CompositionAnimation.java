package com.motionbake.codegen.model.composition;

import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
public abstract class CompositionAnimation extends CompositionObject {

    private String target;

    private final Map<String, CompositionObject> referenceParameters = new LinkedHashMap<>();

    public void setReferenceParameter(String key, CompositionObject value) {
        referenceParameters.put(key, value);
    }

    public Map<String, CompositionObject> getReferenceParameters() {
        return Collections.unmodifiableMap(referenceParameters);
    }
}
