// File: src/main/java/org/lokray/quasar/ast/AstNode.java
package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.type.NullType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.tac.TacAddress;

import java.util.Objects;
import java.util.Optional;

/**
 * Base class of all syntax tree nodes.
 * <p>
 * Every node receives a unique id from its {@link CompilationContext} when it
 * is constructed, and remembers the token it was parsed from for diagnostics.
 */
public abstract class AstNode
{
	private final int id;
	private final Token token;
	// Filled in by the TAC generator
	private TacAddress tacAddress;

	protected AstNode(CompilationContext context, Token token)
	{
		this.id = Objects.requireNonNull(context, "context").nextNodeId();
		this.token = token;
	}

	public int getId()
	{
		return id;
	}

	public Token getToken()
	{
		return token;
	}

	public Type getType()
	{
		return NullType.INSTANCE;
	}

	public Optional<TacAddress> getTacAddress()
	{
		return Optional.ofNullable(tacAddress);
	}

	public void setTacAddress(TacAddress tacAddress)
	{
		this.tacAddress = tacAddress;
	}
}
