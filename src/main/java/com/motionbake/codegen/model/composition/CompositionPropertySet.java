package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named values attached to a composition object. Created implicitly with its
 * owner; generated code reads it from the owner's {@code Properties}.
 */
public final class CompositionPropertySet extends CompositionObject {

    @Getter
    private final CompositionObject owner;

    private final Map<String, Float> scalarProperties = new LinkedHashMap<>();
    private final Map<String, Vector2> vector2Properties = new LinkedHashMap<>();

    CompositionPropertySet(CompositionObject owner) {
        super(false);
        this.owner = owner;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_PROPERTY_SET;
    }

    @Override
    public CompositionPropertySet getProperties() {
        return this;
    }

    public void insertScalar(String name, float value) {
        scalarProperties.put(name, value);
    }

    public void insertVector2(String name, Vector2 value) {
        vector2Properties.put(name, value);
    }

    public Map<String, Float> getScalarProperties() {
        return Collections.unmodifiableMap(scalarProperties);
    }

    public Map<String, Vector2> getVector2Properties() {
        return Collections.unmodifiableMap(vector2Properties);
    }

    public boolean hasPropertyValues() {
        return !scalarProperties.isEmpty() || !vector2Properties.isEmpty();
    }
}
