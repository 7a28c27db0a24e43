package io.weft.core.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/// Ordered collector of diagnostics produced by one validation rule.
///
/// Each rule fills its own collector and returns it; the pipeline concatenates
/// the results in rule order. A collector is never shared between rules.
///
/// @implNote Not thread-safe. Confined to the rule invocation that created it.
public final class Diagnostics {

    private final List<Diagnostic> entries = new ArrayList<>();

    /// Creates an empty collector.
    ///
    /// @return new collector, never null
    public static Diagnostics empty() {
        return new Diagnostics();
    }

    /// Appends a diagnostic.
    ///
    /// @param diagnostic diagnostic to add, not null
    /// @return this collector for chaining
    public Diagnostics add(Diagnostic diagnostic) {
        entries.add(diagnostic);
        return this;
    }

    /// Appends every diagnostic of another collector, preserving order.
    ///
    /// @param other collector to append, not null
    /// @return this collector for chaining
    public Diagnostics addAll(Diagnostics other) {
        entries.addAll(other.entries);
        return this;
    }

    /// @return unmodifiable view in insertion order, never null
    public List<Diagnostic> asList() {
        return Collections.unmodifiableList(entries);
    }

    /// @return diagnostics with {@link Severity#ERROR}, in insertion order
    public List<Diagnostic> errors() {
        return select(Diagnostic::isError);
    }

    /// @return diagnostics with {@link Severity#WARNING}, in insertion order
    public List<Diagnostic> warnings() {
        return select(d -> !d.isError());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    private List<Diagnostic> select(Predicate<Diagnostic> filter) {
        return entries.stream().filter(filter).toList();
    }
}
