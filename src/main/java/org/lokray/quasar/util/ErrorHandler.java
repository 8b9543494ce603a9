// File: src/main/java/org/lokray/quasar/util/ErrorHandler.java
package org.lokray.quasar.util;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.SemanticError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class ErrorHandler
{
	private final List<SemanticError> errors = new ArrayList<>();

	public void logError(Token token, String msg, String scopeName)
	{
		String scope = scopeName != null ? scopeName : "";
		String position = token != null
				? token.getLine() + ":" + (token.getCharPositionInLine() + 1)
				: "?:?";
		String err = String.format("[Semantic Error] %s - line %s - %s", scope, position, msg);
		Debug.logError(err);
		errors.add(new SemanticError(token, msg));
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<SemanticError> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public Optional<SemanticError> getFirstError()
	{
		return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0));
	}
}
