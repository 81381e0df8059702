package com.x4.projector.resolver.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Session-wide diagnostics of one export run, in reporting order. Filled by the
 * thread that merges resolution results, never by resolver workers.
 */
public class ResolutionDiagnostics {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void addAll(List<Diagnostic> more) {
        diagnostics.addAll(more);
    }

    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(diagnostics);
    }
}
