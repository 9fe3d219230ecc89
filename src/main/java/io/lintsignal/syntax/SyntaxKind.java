package io.lintsignal.syntax;

/**
 * Kind of a syntax node or token.
 * Each language declares its kinds as an enum implementing this interface.
 */
public interface SyntaxKind {

    String name();
}
