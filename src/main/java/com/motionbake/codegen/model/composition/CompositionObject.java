package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Describable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of every composition object in a scene graph.
 *
 * Scene graphs may contain cycles (an expression animation can reference the
 * object it animates), so objects use identity equality.
 */
@Getter
@Setter
public abstract class CompositionObject implements Describable {

    private String comment;
    private String shortDescription;
    private String longDescription;

    private final List<Animator> animators = new ArrayList<>();

    @Setter(AccessLevel.NONE)
    private CompositionPropertySet properties;

    protected CompositionObject() {
        this.properties = new CompositionPropertySet(this);
    }

    // Used by CompositionPropertySet, which is its own property set.
    CompositionObject(boolean ownsPropertySet) {
        this.properties = ownsPropertySet ? new CompositionPropertySet(this) : null;
    }

    public abstract CompositionObjectType getType();

    public CompositionPropertySet getProperties() {
        return properties;
    }

    public List<Animator> getAnimators() {
        return Collections.unmodifiableList(animators);
    }

    /**
     * Binds an animation to one of this object's properties.
     */
    public Animator startAnimation(String animatedProperty, CompositionAnimation animation) {
        Animator animator = new Animator(animatedProperty, animation, null);
        animators.add(animator);
        return animator;
    }

    /**
     * Binds an animation and creates a paused controller for it.
     */
    public Animator startControlledAnimation(String animatedProperty, CompositionAnimation animation) {
        Animator animator = new Animator(animatedProperty, animation, new AnimationController(this));
        animators.add(animator);
        return animator;
    }

    /**
     * Animators of the property set followed by this object's own animators,
     * which is the order their animations are started in.
     */
    public List<Animator> getAllAnimators() {
        List<Animator> all = new ArrayList<>();
        if (properties != null && properties != this) {
            all.addAll(properties.getAnimators());
        }
        all.addAll(animators);
        return all;
    }

    @Override
    public String toString() {
        return getType().getTypeName();
    }
}
