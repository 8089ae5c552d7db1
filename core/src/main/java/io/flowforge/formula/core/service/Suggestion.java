package io.flowforge.formula.core.service;

/**
 * An autocomplete candidate.
 *
 * @param kind         what the candidate names
 * @param label        display text
 * @param description  short help text, or {@code null} for fields
 * @param category     function category label, or {@code null}
 * @param insertText   text to insert; functions include the opening parenthesis
 * @param cursorOffset characters to move the cursor back after inserting
 */
public record Suggestion(Kind kind, String label, String description, String category, String insertText,
        int cursorOffset) {

    /** Candidate kinds. */
    public enum Kind {
        FUNCTION,
        FIELD,
        VARIABLE
    }
}
