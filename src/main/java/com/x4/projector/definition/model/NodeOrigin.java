package com.x4.projector.definition.model;

/**
 * Which kind of document a definition node was read from. Each origin is its own
 * identifier namespace.
 */
public enum NodeOrigin {
    MACRO,
    COMPONENT,
    WARE
}
