package org.regram.compiler.frontend.dependency;

/**
 * A reference from one macro body to another macro. Derived from body scans, never stored separately
 * from the {@link DependencyGraph}.
 *
 * @param fromName The referencing macro.
 * @param toName   The referenced macro.
 */
public record DependencyEdge(String fromName, String toName) {
}
