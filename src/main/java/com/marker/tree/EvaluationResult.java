package com.marker.tree;

import com.marker.report.MarkerWarning;

import java.util.List;

/**
 * Outcome of {@link MarkerTree#evaluateCollectWarnings}.
 *
 * @param result   Whether the marker applies
 * @param warnings Warnings raised during evaluation, in order
 */
public record EvaluationResult(boolean result, List<MarkerWarning> warnings) {

    public EvaluationResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
