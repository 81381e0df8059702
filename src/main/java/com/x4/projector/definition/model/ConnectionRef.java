package com.x4.projector.definition.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A connection entry of a definition node.
 *
 * For macros the role is the connection point the target macro is attached to
 * (e.g. an engine mount) and {@code targetId} names the attached macro. For
 * components the entry is a connection point only: {@code targetId} is null and
 * {@code tags} describes what can attach there.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionRef {

    @NonNull
    String role;

    String targetId;

    @Builder.Default
    String tags = "";

    public Optional<String> getTargetId() {
        return Optional.ofNullable(targetId);
    }

    /**
     * True when the whitespace separated tags contain {@code tag} as a whole word.
     */
    public boolean hasTag(String tag) {
        String wanted = tag.toLowerCase(Locale.ROOT);
        return Arrays.stream(tags.toLowerCase(Locale.ROOT).split("[\\s,]+"))
                .anyMatch(wanted::equals);
    }
}
