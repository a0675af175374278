package com.example.honeypot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A normalized piece of extracted intelligence. Identity is {@code (kind, value)};
 * the context snippet is informational and ignored by equality, so sets of
 * findings deduplicate across turns.
 */
@Value
@Builder
@Jacksonized
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IntelligenceFinding {

    @EqualsAndHashCode.Include
    FindingKind kind;

    @EqualsAndHashCode.Include
    String value;

    String contextSnippet;

    public static IntelligenceFinding of(FindingKind kind, String value) {
        return new IntelligenceFinding(kind, value, null);
    }

    @JsonIgnore
    public boolean isActionable() {
        return kind != null && kind.isActionable();
    }
}
