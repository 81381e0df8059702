package com.x4.projector.resolver.model;

/**
 * Kinds of problems reported next to the exported records.
 */
public enum DiagnosticType {
    /** A referenced macro or component is not in the session graph. */
    UNRESOLVED_REFERENCE,
    /** A requested category or a macro class the resolver has no profile for. */
    UNKNOWN_KIND,
    /** An {@code extends} chain loops back on itself. */
    INHERITANCE_CYCLE,
    /** A declared value does not coerce to the attribute's type. */
    INVALID_VALUE,
    /** A connection leads back to a macro already on the traversal path. */
    CONNECTION_CYCLE,
    /** A skipped document whose payload failed its checksum. */
    CORRUPT_PAYLOAD,
    /** A skipped document that could not be parsed. */
    MALFORMED_DEFINITION
}
