package org.machlink.compiler.diagnostics;

/**
 * Severity of a reported diagnostic.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
