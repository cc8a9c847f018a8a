package org.neuralchilli.irflow.domain;

/**
 * Where a workflow step was declared.
 */
public record SourceLocation(String file, int line, int column, int length) {
}
