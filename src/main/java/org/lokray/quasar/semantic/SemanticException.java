package org.lokray.quasar.semantic;

import org.antlr.v4.runtime.Token;

/**
 * Raised by the type checker at the first rule violation. Caught at the scope
 * boundary, see {@link TypeChecker#check(org.lokray.quasar.ast.ScopeNode)}.
 */
public class SemanticException extends RuntimeException
{
	private final SemanticError error;

	public SemanticException(Token token, String message)
	{
		super(message);
		this.error = new SemanticError(token, message);
	}

	public SemanticError getError()
	{
		return error;
	}

	public Token getToken()
	{
		return error.token();
	}
}
