// File: src/main/java/org/lokray/quasar/util/AstPrinter.java
package org.lokray.quasar.util;

import org.lokray.quasar.ast.*;
import org.lokray.quasar.semantic.type.Type;

import java.util.List;

/**
 * Renders a scope tree as indented text, one node per line. Expressions are
 * followed by their type.
 */
public class AstPrinter implements StatementVisitor<Void, Integer>, ExpressionVisitor<Void, Integer>
{
	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();

	public static String print(ScopeNode scope)
	{
		AstPrinter printer = new AstPrinter();
		printer.printScope(scope, 0);
		return printer.out.toString();
	}

	private void printScope(ScopeNode scope, int depth)
	{
		String kind = scope instanceof ModuleNode ? "module" : "procedure";
		line(depth, kind + " " + scope.getName() + " : " + typeName(scope.getType()));
		scope.getSymbolTable().forEachSymbol((name, symbol) ->
				line(depth + 1, "[" + symbol.getKind().name().toLowerCase() + "] " + name + " : " + typeName(symbol.getType())));
		printStatements("body", scope.getStatements(), depth + 1);
		for (ScopeNode child : scope.getChildren())
		{
			printScope(child, depth + 1);
		}
	}

	private void printStatements(String title, List<Statement> statements, int depth)
	{
		line(depth, title);
		for (Statement statement : statements)
		{
			statement.accept(this, depth + 1);
		}
	}

	private void line(int depth, String text)
	{
		out.append(INDENT.repeat(depth)).append(text).append('\n');
	}

	private static String typeName(Type type)
	{
		return type == null || !type.isValid() ? "<INVALID>" : type.getName();
	}

	private void expression(Expression expression, String text, int depth)
	{
		line(depth, text + " : " + typeName(expression.getType()));
	}

	// --- Statements ---

	@Override
	public Void visitAssign(AssignStatement statement, Integer depth)
	{
		line(depth, ":=");
		statement.getLhs().accept(this, depth + 1);
		statement.getRhs().accept(this, depth + 1);
		return null;
	}

	@Override
	public Void visitCall(CallStatement statement, Integer depth)
	{
		line(depth, "call");
		statement.getCall().accept(this, depth + 1);
		return null;
	}

	@Override
	public Void visitReturn(ReturnStatement statement, Integer depth)
	{
		line(depth, "return");
		statement.getExpression().ifPresent(e -> e.accept(this, depth + 1));
		return null;
	}

	@Override
	public Void visitIf(IfStatement statement, Integer depth)
	{
		line(depth, "if cond");
		statement.getCondition().accept(this, depth + 1);
		printStatements("if-body", statement.getIfBody(), depth);
		printStatements("else-body", statement.getElseBody(), depth);
		return null;
	}

	@Override
	public Void visitWhile(WhileStatement statement, Integer depth)
	{
		line(depth, "while cond");
		statement.getCondition().accept(this, depth + 1);
		printStatements("while-body", statement.getBody(), depth);
		return null;
	}

	@Override
	public Void visitBreak(BreakStatement statement, Integer depth)
	{
		line(depth, "break");
		return null;
	}

	// --- Expressions ---

	@Override
	public Void visitBinary(BinaryExpression expression, Integer depth)
	{
		expression(expression, expression.getOperation().toString(), depth);
		expression.getLeft().accept(this, depth + 1);
		expression.getRight().accept(this, depth + 1);
		return null;
	}

	@Override
	public Void visitUnary(UnaryExpression expression, Integer depth)
	{
		expression(expression, expression.getOperation().toString(), depth);
		expression.getOperand().accept(this, depth + 1);
		return null;
	}

	@Override
	public Void visitSpecial(SpecialExpression expression, Integer depth)
	{
		expression(expression, expression.getOperation().toString(), depth);
		expression.getOperand().accept(this, depth + 1);
		return null;
	}

	@Override
	public Void visitFunctionCall(FunctionCall expression, Integer depth)
	{
		expression(expression, "call " + expression.getSymbol().getName(), depth);
		for (Expression argument : expression.getArguments())
		{
			argument.accept(this, depth + 1);
		}
		return null;
	}

	@Override
	public Void visitDesignator(Designator expression, Integer depth)
	{
		expression(expression, expression.getSymbol().getName(), depth);
		return null;
	}

	@Override
	public Void visitArrayDesignator(ArrayDesignator expression, Integer depth)
	{
		expression(expression, expression.getSymbol().getName() + "[]", depth);
		for (Expression index : expression.getIndices())
		{
			index.accept(this, depth + 1);
		}
		return null;
	}

	@Override
	public Void visitConstant(Constant expression, Integer depth)
	{
		expression(expression, expression.getValueString(), depth);
		return null;
	}

	@Override
	public Void visitStringConstant(StringConstant expression, Integer depth)
	{
		expression(expression, "\"" + expression.getValue() + "\"", depth);
		return null;
	}
}
