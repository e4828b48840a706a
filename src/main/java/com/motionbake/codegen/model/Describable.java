package com.motionbake.codegen.model;

/**
 * Objects that carry human readable descriptions. Descriptions only feed
 * comments in generated code and never affect its behavior.
 */
public interface Describable {

    String getShortDescription();

    String getLongDescription();
}
