package org.rapt.dsl;

/**
 * Parse result of one {@code ;}-terminated statement.
 */
public sealed interface Statement
        permits ExpressionStatement, AssignmentStatement, DefinitionStatement, DependencyStatement {
}
