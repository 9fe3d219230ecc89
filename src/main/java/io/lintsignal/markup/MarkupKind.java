package io.lintsignal.markup;

import io.lintsignal.syntax.SyntaxKind;

/**
 * Node and token kinds of the markup language.
 */
public enum MarkupKind implements SyntaxKind {
    // nodes
    ROOT,
    ELEMENT_LIST,
    ELEMENT,
    SELF_CLOSING_ELEMENT,
    OPENING_ELEMENT,
    CLOSING_ELEMENT,
    ATTRIBUTE_LIST,
    ATTRIBUTE,
    STRING_VALUE,
    EXPRESSION_VALUE,
    EXPRESSION,

    // tokens
    L_ANGLE,
    R_ANGLE,
    SLASH,
    EQ,
    L_CURLY,
    R_CURLY,
    NAME,
    STRING,
    NUMBER,
    IDENT,
    PLUS,
    MINUS,
    PUNCT,
    EOF;

    public boolean isElement() {
        return this == ELEMENT || this == SELF_CLOSING_ELEMENT;
    }
}
