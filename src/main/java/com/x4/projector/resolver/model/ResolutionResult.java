package com.x4.projector.resolver.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.x4.projector.definition.ObjectKind;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Records per requested category plus the session diagnostics of one run.
 */
@Value
@Builder
public class ResolutionResult {

    /**
     * Records per category, each list sorted by id.
     */
    @Singular
    Map<ObjectKind, List<ResolvedRecord>> records;

    /**
     * Diagnostics not tied to one exported record (skipped documents, unknown
     * categories, macros that failed entirely).
     */
    @Singular
    List<Diagnostic> sessionDiagnostics;

    /**
     * Session diagnostics followed by every record's diagnostics, records in
     * category then id order.
     */
    public List<Diagnostic> allDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(sessionDiagnostics);
        records.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.comparing(ObjectKind::ordinal)))
                .flatMap(e -> e.getValue().stream())
                .forEach(record -> all.addAll(record.getDiagnostics()));
        return all;
    }

    public int recordCount() {
        return records.values().stream().mapToInt(List::size).sum();
    }
}
