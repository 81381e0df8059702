package com.x4.projector.resolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One non-fatal problem found while loading or resolving definitions.
 */
@Value
@Builder
public class Diagnostic {

    @NonNull
    Severity severity;

    @NonNull
    DiagnosticType type;

    /**
     * Macro id or document path the problem belongs to.
     */
    @NonNull
    String subject;

    @NonNull
    String message;

    public static Diagnostic warning(DiagnosticType type, String subject, String message) {
        return Diagnostic.builder()
                .severity(Severity.WARNING)
                .type(type)
                .subject(subject)
                .message(message)
                .build();
    }

    public static Diagnostic error(DiagnosticType type, String subject, String message) {
        return Diagnostic.builder()
                .severity(Severity.ERROR)
                .type(type)
                .subject(subject)
                .message(message)
                .build();
    }

    /**
     * Single line form used in reports: {@code [WARNING] UNRESOLVED_REFERENCE ship_x: ...}.
     */
    public String format() {
        return "[" + severity + "] " + type + " " + subject + ": " + message;
    }
}
