// File: src/main/java/org/lokray/quasar/semantic/TypeChecker.java
package org.lokray.quasar.semantic;

import org.lokray.quasar.ast.*;
import org.lokray.quasar.semantic.symbol.ProcedureSymbol;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.tac.Operation;
import org.lokray.quasar.util.Debug;
import org.lokray.quasar.util.ErrorHandler;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Checks a scope tree depth-first, left to right, and stops at the first
 * error. The error is reported to the {@link ErrorHandler} with the token of the
 * offending node.
 */
public class TypeChecker implements StatementVisitor<Void, Void>, ExpressionVisitor<Void, Void>
{
	private final ErrorHandler errorHandler;

	public TypeChecker(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * Checks the statements of the scope, then its nested scopes in
	 * declaration order.
	 *
	 * @return true if the whole tree is well typed.
	 */
	public boolean check(ScopeNode scope)
	{
		Debug.logDebug("Type checking scope '" + scope.getName() + "'...");
		try
		{
			checkStatements(scope.getStatements());
		}
		catch (SemanticException e)
		{
			errorHandler.logError(e.getToken(), e.getMessage(), scope.getName());
			return false;
		}
		catch (RuntimeException e)
		{
			// a malformed tree is reported against the scope itself
			errorHandler.logError(scope.getToken(), "Internal error during type checking: " + e.getMessage(), scope.getName());
			return false;
		}

		for (ScopeNode child : scope.getChildren())
		{
			if (!check(child))
			{
				return false;
			}
		}
		return true;
	}

	public void checkStatement(Statement statement)
	{
		statement.accept(this, null);
	}

	public void checkExpression(Expression expression)
	{
		expression.accept(this, null);
	}

	private void checkStatements(List<Statement> statements)
	{
		for (Statement statement : statements)
		{
			checkStatement(statement);
		}
	}

	private static SemanticException error(AstNode node, String message)
	{
		return new SemanticException(node.getToken(), message);
	}

	// --- Statements ---

	@Override
	public Void visitAssign(AssignStatement statement, Void arg)
	{
		checkExpression(statement.getLhs());
		checkExpression(statement.getRhs());

		Type lhsType = statement.getLhs().getType();
		if (!lhsType.isScalar())
		{
			throw error(statement.getLhs(), "Left-hand side of an assignment must be of scalar type, found '" + lhsType.getName() + "'.");
		}
		if (!statement.getRhs().getType().match(lhsType))
		{
			throw error(statement.getRhs(), "Cannot assign '" + statement.getRhs().getType().getName() + "' to '" + lhsType.getName() + "'.");
		}
		return null;
	}

	@Override
	public Void visitCall(CallStatement statement, Void arg)
	{
		checkExpression(statement.getCall());
		return null;
	}

	@Override
	public Void visitReturn(ReturnStatement statement, Void arg)
	{
		Type declared = statement.getScope().getType();
		Optional<Expression> expression = statement.getExpression();

		if (declared.isNull())
		{
			if (expression.isPresent())
			{
				throw error(expression.get(), "Superfluous expression after return.");
			}
			return null;
		}

		if (expression.isEmpty())
		{
			throw error(statement, "Expression of type '" + declared.getName() + "' expected after return.");
		}
		checkExpression(expression.get());
		if (!declared.match(expression.get().getType()))
		{
			throw error(expression.get(), "Return type mismatch: expected '" + declared.getName() + "', found '" + expression.get().getType().getName() + "'.");
		}
		return null;
	}

	@Override
	public Void visitIf(IfStatement statement, Void arg)
	{
		checkCondition(statement.getCondition());
		checkStatements(statement.getIfBody());
		checkStatements(statement.getElseBody());
		return null;
	}

	@Override
	public Void visitWhile(WhileStatement statement, Void arg)
	{
		checkCondition(statement.getCondition());
		checkStatements(statement.getBody());
		return null;
	}

	@Override
	public Void visitBreak(BreakStatement statement, Void arg)
	{
		return null;
	}

	private void checkCondition(Expression condition)
	{
		checkExpression(condition);
		if (!condition.getType().match(PrimitiveType.BOOLEAN))
		{
			throw error(condition, "Condition must be of type boolean, found '" + condition.getType().getName() + "'.");
		}
	}

	// --- Expressions ---

	@Override
	public Void visitBinary(BinaryExpression expression, Void arg)
	{
		Expression left = expression.getLeft();
		Expression right = expression.getRight();
		checkExpression(left);
		checkExpression(right);

		Type leftType = left.getType();
		Type rightType = right.getType();
		Operation op = expression.getOperation();

		if (op.isArithmetic())
		{
			requireType(left, PrimitiveType.INT, "left");
			requireType(right, PrimitiveType.INT, "right");
		}
		else if (op.isLogical())
		{
			requireType(left, PrimitiveType.BOOLEAN, "left");
			requireType(right, PrimitiveType.BOOLEAN, "right");
		}
		else if (op.isEquality())
		{
			if (!(leftType.match(PrimitiveType.BOOLEAN) || leftType.match(PrimitiveType.CHAR) || leftType.match(PrimitiveType.INT)))
			{
				throw error(left, "Operator '" + op + "' expects a boolean, char or integer left operand, found '" + leftType.getName() + "'.");
			}
			if (!rightType.match(leftType))
			{
				throw error(right, "Operands of '" + op + "' differ in type: '" + leftType.getName() + "' and '" + rightType.getName() + "'.");
			}
		}
		else
		{
			if (!(leftType.match(PrimitiveType.CHAR) || leftType.match(PrimitiveType.INT)))
			{
				throw error(left, "Operator '" + op + "' expects a char or integer left operand, found '" + leftType.getName() + "'.");
			}
			if (!rightType.match(leftType))
			{
				throw error(right, "Operands of '" + op + "' differ in type: '" + leftType.getName() + "' and '" + rightType.getName() + "'.");
			}
		}
		return null;
	}

	private static void requireType(Expression operand, Type expected, String side)
	{
		if (!operand.getType().match(expected))
		{
			throw error(operand, "Expected " + expected.getName() + " " + side + " operand, found '" + operand.getType().getName() + "'.");
		}
	}

	@Override
	public Void visitUnary(UnaryExpression expression, Void arg)
	{
		Expression operand = expression.getOperand();
		checkExpression(operand);

		Type expected = expression.getOperation() == Operation.NOT ? PrimitiveType.BOOLEAN : PrimitiveType.INT;
		if (!operand.getType().match(expected))
		{
			throw error(operand, "Operator '" + expression.getOperation() + "' expects an operand of type " + expected.getName()
					+ ", found '" + operand.getType().getName() + "'.");
		}
		return null;
	}

	@Override
	public Void visitSpecial(SpecialExpression expression, Void arg)
	{
		checkExpression(expression.getOperand());
		Type operandType = expression.getOperand().getType();

		switch (expression.getOperation())
		{
			case ADDRESS:
				if (!operandType.isArray())
				{
					throw error(expression, "Address-of is only applicable to arrays, found '" + operandType.getName() + "'.");
				}
				return null;
			case DEREF:
				if (!operandType.isPointer())
				{
					throw error(expression, "Only pointers can be dereferenced, found '" + operandType.getName() + "'.");
				}
				return null;
			default:
				throw error(expression, "Type casts are not supported.");
		}
	}

	@Override
	public Void visitFunctionCall(FunctionCall expression, Void arg)
	{
		ProcedureSymbol procedure = expression.getSymbol();
		if (procedure.getParameterCount() != expression.getArgumentCount())
		{
			throw error(expression, "'" + procedure.getName() + "' expects " + procedure.getParameterCount()
					+ " argument(s), but " + expression.getArgumentCount() + " were given.");
		}

		for (Expression argument : expression.getArguments())
		{
			checkExpression(argument);
		}

		for (int i = 0; i < procedure.getParameterCount(); i++)
		{
			Type paramType = procedure.getParameter(i).getType();
			Expression argument = expression.getArgument(i);
			if (paramType == null || !paramType.match(argument.getType()))
			{
				throw error(argument, "Argument " + (i + 1) + " of '" + procedure.getName() + "' must be of type '"
						+ (paramType == null ? "<INVALID>" : paramType.getName()) + "', found '" + argument.getType().getName() + "'.");
			}
		}
		return null;
	}

	@Override
	public Void visitDesignator(Designator expression, Void arg)
	{
		if (!expression.getType().isValid())
		{
			throw error(expression, "Invalid type for symbol '" + expression.getSymbol().getName() + "'.");
		}
		return null;
	}

	@Override
	public Void visitArrayDesignator(ArrayDesignator expression, Void arg)
	{
		if (!expression.isComplete())
		{
			throw new IllegalStateException("Indices of '" + expression.getSymbol().getName() + "' were never completed.");
		}
		if (expression.getArrayType() == null)
		{
			throw error(expression, "'" + expression.getSymbol().getName() + "' is neither an array nor a pointer to an array.");
		}

		for (Expression index : expression.getIndices())
		{
			checkExpression(index);
			if (!index.getType().match(PrimitiveType.INT))
			{
				throw error(index, "Array index must be of type integer, found '" + index.getType().getName() + "'.");
			}
		}

		Type type = expression.getType();
		if (!type.isValid())
		{
			throw error(expression, "Too many indices for '" + expression.getSymbol().getName() + "'.");
		}
		if (type.isArray())
		{
			throw error(expression, "Not enough indices for '" + expression.getSymbol().getName() + "'.");
		}
		return null;
	}

	@Override
	public Void visitConstant(Constant expression, Void arg)
	{
		if (!(expression.getType() instanceof PrimitiveType primitive))
		{
			throw error(expression, "Invalid type for constant: '" + expression.getType().getName() + "'.");
		}

		BigInteger value = BigInteger.valueOf(expression.getValue());
		BigInteger min = primitive.getMinValue().orElseThrow();
		BigInteger max = primitive.getMaxValue().orElseThrow();
		if (value.compareTo(min) < 0 || value.compareTo(max) > 0)
		{
			throw error(expression, "Value " + expression.getValue() + " out of range for " + primitive.getName() + " constant.");
		}
		return null;
	}

	@Override
	public Void visitStringConstant(StringConstant expression, Void arg)
	{
		return null;
	}
}
