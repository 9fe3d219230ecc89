package io.lintsignal.diagnostic;

import io.lintsignal.syntax.TextRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Diagnostic produced by a rule: a message anchored to a source range, with optional notes
 * and secondary details pointing at other ranges.
 * <p>
 * Instances are immutable; {@link #note(String)} and {@link #detail(TextRange, String)} return copies.
 */
public final class RuleDiagnostic implements DiagnosticError {

    private final String category;
    private final TextRange span;
    private final String message;
    private final List<String> notes;
    private final List<Detail> details;
    private final Severity severity;

    /**
     * Secondary location attached to a diagnostic.
     *
     * @param range   Range the detail points at
     * @param message Explanation for that range
     */
    public record Detail(TextRange range, String message) {}

    private RuleDiagnostic(String category,
                           TextRange span,
                           String message,
                           List<String> notes,
                           List<Detail> details,
                           Severity severity) {
        this.category = category;
        this.span = span;
        this.message = message;
        this.notes = List.copyOf(notes);
        this.details = List.copyOf(details);
        this.severity = severity;
    }

    /**
     * Creates an error diagnostic.
     *
     * @param category Diagnostic category, e.g. {@code lint/a11y/noAriaHiddenOnFocusable}
     * @param span     Range the diagnostic points at
     * @param message  Primary message
     */
    public static RuleDiagnostic create(String category, TextRange span, String message) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        if (span == null) {
            throw new IllegalArgumentException("span cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        return new RuleDiagnostic(category, span, message, List.of(), List.of(), Severity.ERROR);
    }

    public RuleDiagnostic note(String note) {
        List<String> newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new RuleDiagnostic(category, span, message, newNotes, details, severity);
    }

    public RuleDiagnostic detail(TextRange range, String detailMessage) {
        List<Detail> newDetails = new ArrayList<>(details);
        newDetails.add(new Detail(range, detailMessage));
        return new RuleDiagnostic(category, span, message, notes, newDetails, severity);
    }

    public RuleDiagnostic withSeverity(Severity newSeverity) {
        return new RuleDiagnostic(category, span, message, notes, details, newSeverity);
    }

    public String ruleCategory() {
        return category;
    }

    public TextRange span() {
        return span;
    }

    @Override
    public String message() {
        return message;
    }

    public List<String> notes() {
        return notes;
    }

    public List<Detail> details() {
        return details;
    }

    @Override
    public Optional<String> category() {
        return Optional.of(category);
    }

    @Override
    public Optional<TextRange> range() {
        return Optional.of(span);
    }

    @Override
    public Severity severity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleDiagnostic other)) return false;
        return category.equals(other.category)
                && span.equals(other.span)
                && message.equals(other.message)
                && notes.equals(other.notes)
                && details.equals(other.details)
                && severity == other.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, span, message, notes, details, severity);
    }

    @Override
    public String toString() {
        return severity.display() + "[" + category + "] " + span + ": " + message;
    }
}
