package org.lokray.quasar.semantic;

import org.antlr.v4.runtime.Token;

/**
 * A type error: the token of the offending node and a description.
 */
public record SemanticError(Token token, String message)
{
}
