package com.marker.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reporter that keeps every warning in order of arrival.
 * Not thread-safe; use one instance per evaluation.
 */
public final class CollectingReporter implements Reporter {

    private final List<MarkerWarning> warnings = new ArrayList<>();

    @Override
    public void report(MarkerWarningKind kind, String message) {
        warnings.add(new MarkerWarning(kind, message));
    }

    public List<MarkerWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public long count(MarkerWarningKind kind) {
        return warnings.stream().filter(w -> w.kind() == kind).count();
    }
}
