package com.marker.expression;

import com.marker.report.Reporter;
import com.marker.tree.MarkerTree;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * A single comparison, the leaf of a {@link MarkerTree}.
 * <p>
 * Implementations live in {@code com.marker.expression.impl}:
 * <ul>
 *   <li>VersionExpression - {@code python_version >= '3.8'}</li>
 *   <li>StringExpression - {@code sys_platform == 'linux'}</li>
 *   <li>ExtraExpression - {@code extra == 'dev'}</li>
 *   <li>ArbitraryExpression - anything else; never applies</li>
 * </ul>
 */
public interface MarkerExpression extends MarkerTree {

    /**
     * Only {@code extra} clauses can be simplified away.
     */
    @Override
    default Optional<MarkerTree> simplifyExtrasWith(Predicate<ExtraName> isExtra) {
        return Optional.of(this);
    }

    @Override
    default void reportDeprecatedOptions(Reporter reporter) {
    }
}
