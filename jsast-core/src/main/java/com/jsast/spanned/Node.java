package com.jsast.spanned;

/**
 * A node of the spanned tree. Every node knows the exact source range it covers.
 *
 * <p>Locations are computed on demand from direct children; see {@link LocationRules}
 * for the per-production rules.</p>
 */
public interface Node {

    default SourceLocation loc() {
        return LocationRules.of(this);
    }

    default SourceLocation.Position start() {
        return loc().start();
    }

    default SourceLocation.Position end() {
        return loc().end();
    }
}
