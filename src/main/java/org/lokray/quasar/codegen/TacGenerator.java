// File: src/main/java/org/lokray/quasar/codegen/TacGenerator.java
package org.lokray.quasar.codegen;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.ast.*;
import org.lokray.quasar.semantic.symbol.ProcedureSymbol;
import org.lokray.quasar.semantic.symbol.RuntimeProcedures;
import org.lokray.quasar.semantic.symbol.Symbol;
import org.lokray.quasar.semantic.type.ArrayType;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.tac.*;
import org.lokray.quasar.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers the statements of one scope into the scope's {@link CodeBlock}.
 * <p>
 * Statements are lowered with two labels: {@code next}, the label control
 * continues at, and {@code end}, the exit of the innermost enclosing loop.
 * Every lowered statement ends with an explicit jump.
 * <p>
 * Expressions are lowered either to a value (an operand holding the result)
 * or, for boolean expressions, to branches towards a true and a false label.
 * The tree must have passed type checking.
 */
public class TacGenerator
{
	private final CodeBlock codeBlock;
	private final ScopeNode scope;
	private final CompilationContext context;

	private final StatementLowering statementLowering = new StatementLowering();
	private final ValueLowering valueLowering = new ValueLowering();
	private final BranchLowering branchLowering = new BranchLowering();

	private record LabelTargets(TacLabel next, TacLabel end)
	{
	}

	private record BranchTargets(TacLabel ifTrue, TacLabel ifFalse)
	{
	}

	public TacGenerator(CodeBlock codeBlock)
	{
		this.codeBlock = codeBlock;
		this.scope = codeBlock.getOwner();
		this.context = scope.getContext();
	}

	/**
	 * Lowers the statements of the owning scope and attaches the code block to
	 * it. Nested scopes are not visited.
	 */
	public CodeBlock generate(boolean cleanup)
	{
		Debug.logDebug("Generating three-address code for '" + scope.getName() + "'...");
		lowerSequence(scope.getStatements(), null);

		if (cleanup)
		{
			codeBlock.cleanupControlFlow();
		}
		scope.setCodeBlock(codeBlock);
		return codeBlock;
	}

	public void lower(Statement statement, TacLabel next, TacLabel end)
	{
		statement.accept(statementLowering, new LabelTargets(next, end));
	}

	/**
	 * Lowers an expression in value mode and records the result on the node.
	 *
	 * @return the operand holding the result, or null for a call without result.
	 */
	public TacAddress toValue(Expression expression)
	{
		if (!expression.getType().isValid())
		{
			throw new IllegalStateException("Cannot generate code for an ill-typed expression (node " + expression.getId() + ").");
		}
		TacAddress address = expression.accept(valueLowering, null);
		expression.setTacAddress(address);
		return address;
	}

	/**
	 * Lowers a boolean expression so that control reaches {@code ifTrue} if it
	 * holds and {@code ifFalse} otherwise. Never falls through.
	 */
	public void toBranch(Expression expression, TacLabel ifTrue, TacLabel ifFalse)
	{
		if (!expression.getType().isBoolean())
		{
			throw new IllegalStateException("Branch lowering needs a boolean expression, found '"
					+ expression.getType().getName() + "' (node " + expression.getId() + ").");
		}
		expression.accept(branchLowering, new BranchTargets(ifTrue, ifFalse));
	}

	private void lowerSequence(List<Statement> statements, TacLabel end)
	{
		for (Statement statement : statements)
		{
			TacLabel next = codeBlock.createLabel();
			lower(statement, next, end);
			codeBlock.addInstruction(next);
		}
	}

	private ProcedureSymbol resolveRuntimeProcedure(String name)
	{
		Symbol symbol = scope.getSymbolTable().resolve(name).orElse(null);
		if (!(symbol instanceof ProcedureSymbol procedure))
		{
			throw new IllegalStateException("Runtime procedure '" + name + "' is not visible from '" + scope.getName() + "'.");
		}
		return procedure;
	}

	// --- Statements ---

	private class StatementLowering implements StatementVisitor<Void, LabelTargets>
	{
		@Override
		public Void visitAssign(AssignStatement statement, LabelTargets labels)
		{
			TacAddress source = toValue(statement.getRhs());
			TacAddress destination = toValue(statement.getLhs());
			codeBlock.addInstruction(Operation.ASSIGN, destination, source, null);
			codeBlock.addJump(labels.next());
			return null;
		}

		@Override
		public Void visitCall(CallStatement statement, LabelTargets labels)
		{
			toValue(statement.getCall());
			codeBlock.addJump(labels.next());
			return null;
		}

		@Override
		public Void visitReturn(ReturnStatement statement, LabelTargets labels)
		{
			TacAddress value = statement.getExpression().map(TacGenerator.this::toValue).orElse(null);
			codeBlock.addInstruction(Operation.RETURN, null, value, null);
			codeBlock.addJump(labels.next());
			return null;
		}

		@Override
		public Void visitIf(IfStatement statement, LabelTargets labels)
		{
			TacLabel ifLabel = codeBlock.createLabel();
			TacLabel elseLabel = codeBlock.createLabel();
			TacLabel endLabel = codeBlock.createLabel();

			toBranch(statement.getCondition(), ifLabel, elseLabel);

			codeBlock.addInstruction(ifLabel);
			lowerSequence(statement.getIfBody(), labels.end());
			codeBlock.addJump(endLabel);

			codeBlock.addInstruction(elseLabel);
			lowerSequence(statement.getElseBody(), labels.end());

			codeBlock.addInstruction(endLabel);
			codeBlock.addJump(labels.next());
			return null;
		}

		@Override
		public Void visitWhile(WhileStatement statement, LabelTargets labels)
		{
			TacLabel restart = codeBlock.createLabel();
			TacLabel body = codeBlock.createLabel();
			TacLabel loopEnd = codeBlock.createLabel();

			codeBlock.addInstruction(restart);
			toBranch(statement.getCondition(), body, loopEnd);

			codeBlock.addInstruction(body);
			lowerSequence(statement.getBody(), loopEnd);
			codeBlock.addJump(restart);

			codeBlock.addInstruction(loopEnd);
			codeBlock.addJump(labels.next());
			return null;
		}

		@Override
		public Void visitBreak(BreakStatement statement, LabelTargets labels)
		{
			if (labels.end() == null)
			{
				throw new IllegalStateException("'break' outside of a loop (node " + statement.getId() + ").");
			}
			codeBlock.addJump(labels.end());
			return null;
		}
	}

	// --- Expressions, value mode ---

	private class ValueLowering implements ExpressionVisitor<TacAddress, Void>
	{
		@Override
		public TacAddress visitBinary(BinaryExpression expression, Void arg)
		{
			if (!expression.getOperation().isArithmetic())
			{
				return materializeBoolean(expression);
			}
			TacAddress left = toValue(expression.getLeft());
			TacAddress right = toValue(expression.getRight());
			TacTemporary result = codeBlock.createTemporary(expression.getType());
			codeBlock.addInstruction(expression.getOperation(), result, left, right);
			return result;
		}

		@Override
		public TacAddress visitUnary(UnaryExpression expression, Void arg)
		{
			if (expression.getOperation() == Operation.NOT)
			{
				return materializeBoolean(expression);
			}
			TacAddress operand = toValue(expression.getOperand());
			TacTemporary result = codeBlock.createTemporary(expression.getType());
			codeBlock.addInstruction(expression.getOperation(), result, operand, null);
			return result;
		}

		@Override
		public TacAddress visitSpecial(SpecialExpression expression, Void arg)
		{
			TacAddress operand = toValue(expression.getOperand());
			TacTemporary result = codeBlock.createTemporary(expression.getType());
			codeBlock.addInstruction(expression.getOperation(), result, operand, null);
			return result;
		}

		@Override
		public TacAddress visitFunctionCall(FunctionCall expression, Void arg)
		{
			TacTemporary result = null;
			if (!expression.getType().isNull())
			{
				result = codeBlock.createTemporary(expression.getType());
			}

			for (int i = expression.getArgumentCount() - 1; i >= 0; i--)
			{
				TacAddress argument = toValue(expression.getArgument(i));
				codeBlock.addInstruction(Operation.PARAM, new TacConstant(i), argument, null);
			}
			codeBlock.addInstruction(Operation.CALL, result, new TacName(expression.getSymbol()), null);
			return result;
		}

		@Override
		public TacAddress visitDesignator(Designator expression, Void arg)
		{
			return new TacName(expression.getSymbol());
		}

		@Override
		public TacAddress visitArrayDesignator(ArrayDesignator expression, Void arg)
		{
			return lowerArrayElement(expression);
		}

		@Override
		public TacAddress visitConstant(Constant expression, Void arg)
		{
			return new TacConstant(expression.getValue());
		}

		@Override
		public TacAddress visitStringConstant(StringConstant expression, Void arg)
		{
			return new TacName(expression.getSymbol());
		}
	}

	private TacAddress materializeBoolean(Expression expression)
	{
		TacLabel trueLabel = codeBlock.createLabel();
		TacLabel falseLabel = codeBlock.createLabel();
		TacLabel joinLabel = codeBlock.createLabel();

		toBranch(expression, trueLabel, falseLabel);
		TacTemporary result = codeBlock.createTemporary(PrimitiveType.BOOLEAN);

		codeBlock.addInstruction(trueLabel);
		codeBlock.addInstruction(Operation.ASSIGN, result, new TacConstant(1), null);
		codeBlock.addJump(joinLabel);
		codeBlock.addInstruction(falseLabel);
		codeBlock.addInstruction(Operation.ASSIGN, result, new TacConstant(0), null);
		codeBlock.addInstruction(joinLabel);
		return result;
	}

	/**
	 * Computes the address of an array element:
	 * {@code array + (((i0 * DIM(array, 2) + i1) * DIM(array, 3) + ...) * elementSize + DOFS(array))}.
	 * Missing trailing indices count as zero.
	 */
	private TacAddress lowerArrayElement(ArrayDesignator designator)
	{
		ArrayType arrayType = designator.getArrayType();
		if (arrayType == null)
		{
			throw new IllegalStateException("'" + designator.getSymbol().getName() + "' is not an array.");
		}

		Token token = designator.getToken();
		Symbol symbol = designator.getSymbol();
		ProcedureSymbol dim = resolveRuntimeProcedure(RuntimeProcedures.DIM);
		ProcedureSymbol dofs = resolveRuntimeProcedure(RuntimeProcedures.DOFS);

		int nDim = arrayType.getNDim();
		List<Expression> indices = new ArrayList<>(designator.getIndices());
		while (indices.size() < nDim)
		{
			indices.add(intConstant(token, 0));
		}

		Expression offset = indices.get(0);
		for (int i = 0; i < nDim; i++)
		{
			if (i > 0)
			{
				offset = new BinaryExpression(context, token, Operation.ADD, offset, indices.get(i));
			}

			if (i < nDim - 1)
			{
				FunctionCall dimSize = new FunctionCall(context, token, dim);
				dimSize.addArgument(arrayBase(token, symbol));
				dimSize.addArgument(intConstant(token, i + 2));
				offset = new BinaryExpression(context, token, Operation.MUL, offset, dimSize);
			}
			else
			{
				Type elementType = arrayType.getBaseType();
				offset = new BinaryExpression(context, token, Operation.MUL, offset, intConstant(token, elementType.getSize()));
			}
		}

		FunctionCall dataOffset = new FunctionCall(context, token, dofs);
		dataOffset.addArgument(arrayBase(token, symbol));
		Expression address = new BinaryExpression(context, token, Operation.ADD, arrayBase(token, symbol),
				new BinaryExpression(context, token, Operation.ADD, offset, dataOffset));

		TacAddress value = toValue(address);
		TacName name;
		if (value instanceof TacName named)
		{
			name = named;
		}
		else
		{
			name = codeBlock.createTemporary(PrimitiveType.INT);
			codeBlock.addInstruction(Operation.ASSIGN, name, value, null);
		}
		return new TacReference(name.getSymbol(), symbol, arrayType.getBaseType());
	}

	/**
	 * A fresh expression for the address of the array. Arrays received by
	 * reference already hold it.
	 */
	private Expression arrayBase(Token token, Symbol symbol)
	{
		Expression array = new Designator(context, token, symbol);
		if (!symbol.getType().isPointer())
		{
			array = new SpecialExpression(context, token, Operation.ADDRESS, array);
		}
		return array;
	}

	private Constant intConstant(Token token, long value)
	{
		return new Constant(context, token, PrimitiveType.INT, value);
	}

	// --- Expressions, branch mode ---

	private class BranchLowering implements ExpressionVisitor<Void, BranchTargets>
	{
		@Override
		public Void visitBinary(BinaryExpression expression, BranchTargets targets)
		{
			Operation op = expression.getOperation();
			if (op == Operation.AND)
			{
				TacLabel mid = codeBlock.createLabel();
				toBranch(expression.getLeft(), mid, targets.ifFalse());
				codeBlock.addInstruction(mid);
				toBranch(expression.getRight(), targets.ifTrue(), targets.ifFalse());
			}
			else if (op == Operation.OR)
			{
				TacLabel mid = codeBlock.createLabel();
				toBranch(expression.getLeft(), targets.ifTrue(), mid);
				codeBlock.addInstruction(mid);
				toBranch(expression.getRight(), targets.ifTrue(), targets.ifFalse());
			}
			else if (op.isRelational())
			{
				TacAddress left = toValue(expression.getLeft());
				TacAddress right = toValue(expression.getRight());
				codeBlock.addBranch(op, targets.ifTrue(), left, right);
				codeBlock.addJump(targets.ifFalse());
			}
			else
			{
				throw new IllegalStateException("Operator '" + op + "' has no branch form.");
			}
			return null;
		}

		@Override
		public Void visitUnary(UnaryExpression expression, BranchTargets targets)
		{
			if (expression.getOperation() != Operation.NOT)
			{
				throw new IllegalStateException("Operator '" + expression.getOperation() + "' has no branch form.");
			}
			toBranch(expression.getOperand(), targets.ifFalse(), targets.ifTrue());
			return null;
		}

		@Override
		public Void visitSpecial(SpecialExpression expression, BranchTargets targets)
		{
			return branchOnValue(expression, targets);
		}

		@Override
		public Void visitFunctionCall(FunctionCall expression, BranchTargets targets)
		{
			return branchOnValue(expression, targets);
		}

		@Override
		public Void visitDesignator(Designator expression, BranchTargets targets)
		{
			return branchOnValue(expression, targets);
		}

		@Override
		public Void visitArrayDesignator(ArrayDesignator expression, BranchTargets targets)
		{
			return branchOnValue(expression, targets);
		}

		@Override
		public Void visitConstant(Constant expression, BranchTargets targets)
		{
			return branchOnValue(expression, targets);
		}

		@Override
		public Void visitStringConstant(StringConstant expression, BranchTargets targets)
		{
			// unreachable through toBranch, which only accepts boolean expressions
			throw new IllegalStateException("String constants are character arrays and have no branch form.");
		}

		private Void branchOnValue(Expression expression, BranchTargets targets)
		{
			TacAddress value = toValue(expression);
			codeBlock.addBranch(Operation.EQUAL, targets.ifTrue(), value, new TacConstant(1));
			codeBlock.addJump(targets.ifFalse());
			return null;
		}
	}
}
