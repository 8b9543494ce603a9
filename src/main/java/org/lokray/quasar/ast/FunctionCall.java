package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.symbol.ProcedureSymbol;
import org.lokray.quasar.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class FunctionCall extends Expression
{
	private final ProcedureSymbol symbol;
	private final List<Expression> arguments = new ArrayList<>();

	public FunctionCall(CompilationContext context, Token token, ProcedureSymbol symbol)
	{
		super(context, token);
		this.symbol = Objects.requireNonNull(symbol, "symbol");
	}

	public ProcedureSymbol getSymbol()
	{
		return symbol;
	}

	/**
	 * Arguments are added in parameter order.
	 */
	public void addArgument(Expression argument)
	{
		arguments.add(Objects.requireNonNull(argument, "argument"));
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public int getArgumentCount()
	{
		return arguments.size();
	}

	public Expression getArgument(int index)
	{
		return arguments.get(index);
	}

	@Override
	public Type getType()
	{
		return symbol.getType();
	}

	@Override
	public <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg)
	{
		return visitor.visitFunctionCall(this, arg);
	}
}
