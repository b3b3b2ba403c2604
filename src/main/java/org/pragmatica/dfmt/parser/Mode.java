package org.pragmatica.dfmt.parser;

/**
 * Syntactic context of the structural element being recognized.
 *
 * <p>In {@link #DECLARATION} and {@link #STATEMENT} position a trailing separator ends the line.
 * In {@link #PARAMETER} position (parenthesized lists, loop headers) the separator is syntax
 * and stays inline.
 */
public enum Mode {
    DECLARATION,
    STATEMENT,
    PARAMETER
}
