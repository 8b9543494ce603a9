package org.lokray.quasar.semantic;

import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.quasar.ast.*;
import org.lokray.quasar.semantic.symbol.ProcedureSymbol;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.semantic.type.TypeManager;
import org.lokray.quasar.tac.Operation;
import org.lokray.quasar.util.ErrorHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.lokray.quasar.AstFixtures.*;

class TypeCheckerTest
{
	private CompilationContext context;
	private ModuleNode module;
	private ErrorHandler errorHandler;
	private TypeChecker checker;
	private ProcedureSymbol foo;
	private ProcedureSymbol bar;

	@BeforeEach
	void setUp()
	{
		context = new CompilationContext();
		module = new ModuleNode(context, token("module"), "test");
		module.declareVariable("x", PrimitiveType.INT);
		module.declareVariable("y", PrimitiveType.INT);
		module.declareVariable("i", PrimitiveType.INT);
		module.declareVariable("c", PrimitiveType.CHAR);
		module.declareVariable("flag", PrimitiveType.BOOLEAN);
		module.declareVariable("a", TypeManager.getArray(PrimitiveType.INT, 3, 4));
		module.declareVariable("b", TypeManager.getArray(PrimitiveType.INT, 3, 4));

		foo = new ProcedureSymbol("foo", null);
		foo.addParameter("n", PrimitiveType.INT);
		module.getSymbolTable().define(foo);

		bar = new ProcedureSymbol("bar", PrimitiveType.INT);
		bar.addParameter("first", PrimitiveType.INT);
		bar.addParameter("second", PrimitiveType.CHAR);
		module.getSymbolTable().define(bar);

		errorHandler = new ErrorHandler();
		checker = new TypeChecker(errorHandler);
	}

	private BinaryExpression binary(Operation op, Expression left, Expression right)
	{
		return new BinaryExpression(context, token(op.getSymbol()), op, left, right);
	}

	private AssignStatement assign(String name, Expression rhs)
	{
		return new AssignStatement(context, token(":="), ref(module, name), rhs);
	}

	private ArrayDesignator element(String name, Expression... indices)
	{
		ArrayDesignator designator = new ArrayDesignator(context, token(name), module.getSymbolTable().resolve(name).orElseThrow());
		for (Expression index : indices)
		{
			designator.addIndex(index);
		}
		designator.indicesComplete();
		return designator;
	}

	private Token rejectedAt()
	{
		assertFalse(checker.check(module));
		assertEquals(1, errorHandler.getErrors().size());
		return errorHandler.getFirstError().orElseThrow().token();
	}

	// --- Rejections ---

	@Test
	void rejectsAssigningWholeArray()
	{
		Designator lhs = ref(module, "a");
		module.addStatement(new AssignStatement(context, token(":="), lhs, ref(module, "b")));

		assertSame(lhs.getToken(), rejectedAt());
	}

	@Test
	void rejectsValueReturnedFromVoidProcedure()
	{
		ProcedureNode procedure = new ProcedureNode(context, token("foo"), module, foo);
		Constant value = intConstant(context, 1);
		procedure.addStatement(new ReturnStatement(context, token("return"), procedure, value));

		assertSame(value.getToken(), rejectedAt());
	}

	@Test
	void rejectsMissingReturnValue()
	{
		ProcedureNode procedure = new ProcedureNode(context, token("bar"), module, bar);
		ReturnStatement statement = new ReturnStatement(context, token("return"), procedure, null);
		procedure.addStatement(statement);

		assertSame(statement.getToken(), rejectedAt());
	}

	@Test
	void rejectsComparingBooleanToInteger()
	{
		Constant ten = intConstant(context, 10);
		module.addStatement(new IfStatement(context, token("if"),
				binary(Operation.EQUAL, ref(module, "flag"), ten), List.of(assign("y", intConstant(context, 1))), null));

		assertSame(ten.getToken(), rejectedAt());
	}

	@Test
	void rejectsCallWithTooFewArguments()
	{
		FunctionCall call = new FunctionCall(context, token("bar"), bar);
		call.addArgument(intConstant(context, 1));
		module.addStatement(new CallStatement(context, token("bar"), call));

		assertSame(call.getToken(), rejectedAt());
	}

	@Test
	void rejectsTwoDimensionalArrayWithOneIndex()
	{
		ArrayDesignator row = element("a", intConstant(context, 1));
		module.addStatement(assign("x", row));

		assertSame(row.getToken(), rejectedAt());
		assertTrue(errorHandler.getFirstError().orElseThrow().message().contains("Not enough indices"));
	}

	@Test
	void rejectsTooManyIndices()
	{
		ArrayDesignator element = element("a", intConstant(context, 1), intConstant(context, 2), intConstant(context, 3));
		module.addStatement(assign("x", element));

		assertSame(element.getToken(), rejectedAt());
		assertTrue(errorHandler.getFirstError().orElseThrow().message().contains("Too many indices"));
	}

	@Test
	void rejectsNonIntegerIndex()
	{
		Constant index = charConstant(context, 65);
		module.addStatement(assign("x", element("a", intConstant(context, 1), index)));

		assertSame(index.getToken(), rejectedAt());
	}

	@Test
	void rejectsMismatchingArgumentType()
	{
		Constant second = intConstant(context, 2);
		FunctionCall call = new FunctionCall(context, token("bar"), bar);
		call.addArgument(intConstant(context, 1));
		call.addArgument(second);
		module.addStatement(assign("x", call));

		assertSame(second.getToken(), rejectedAt());
	}

	@Test
	void rejectsEveryCast()
	{
		SpecialExpression cast = new SpecialExpression(context, token("cast"), Operation.CAST, ref(module, "c"), PrimitiveType.INT);
		module.addStatement(assign("x", cast));

		assertSame(cast.getToken(), rejectedAt());
	}

	@Test
	void rejectsAddressOfScalar()
	{
		SpecialExpression address = new SpecialExpression(context, token("&"), Operation.ADDRESS, ref(module, "x"));
		module.addStatement(assign("x",
				binary(Operation.ADD, intConstant(context, 1), new SpecialExpression(context, token("*"), Operation.DEREF, address))));

		assertSame(address.getToken(), rejectedAt());
	}

	@Test
	void rejectsOutOfRangeConstants()
	{
		Constant tooBig = charConstant(context, 256);
		module.addStatement(new AssignStatement(context, token(":="), ref(module, "c"), tooBig));

		assertSame(tooBig.getToken(), rejectedAt());
	}

	@Test
	void rejectsIntegerConstantsOutsideThirtyTwoBits()
	{
		Constant above = intConstant(context, (long) Integer.MAX_VALUE + 1);
		module.addStatement(assign("x", above));

		assertSame(above.getToken(), rejectedAt());
	}

	@Test
	void rejectsIntegerConstantBelowRange()
	{
		Constant below = intConstant(context, (long) Integer.MIN_VALUE - 1);
		module.addStatement(assign("x", below));

		assertSame(below.getToken(), rejectedAt());
	}

	@Test
	void rejectsBooleanConstantTwo()
	{
		Constant two = new Constant(context, token("2"), PrimitiveType.BOOLEAN, 2);
		module.addStatement(assign("flag", two));

		assertSame(two.getToken(), rejectedAt());
	}

	@Test
	void rejectsConstantOfArrayType()
	{
		Constant constant = new Constant(context, token("0"), TypeManager.getArray(3, PrimitiveType.INT), 0);
		module.addStatement(assign("x", constant));

		assertSame(constant.getToken(), rejectedAt());
		assertTrue(errorHandler.getFirstError().orElseThrow().message().contains("Invalid type for constant"));
	}

	@Test
	void rejectsNegatedBoolean()
	{
		Designator operand = ref(module, "flag");
		module.addStatement(assign("x", new UnaryExpression(context, token("-"), Operation.NEG, operand)));

		assertSame(operand.getToken(), rejectedAt());
	}

	@Test
	void rejectsUnaryPlusOnBoolean()
	{
		Constant operand = boolConstant(context, true);
		module.addStatement(assign("x", new UnaryExpression(context, token("+"), Operation.POS, operand)));

		assertSame(operand.getToken(), rejectedAt());
	}

	@Test
	void rejectsNotOnInteger()
	{
		Designator operand = ref(module, "x");
		module.addStatement(assign("flag", new UnaryExpression(context, token("!"), Operation.NOT, operand)));

		assertSame(operand.getToken(), rejectedAt());
	}

	@Test
	void rejectsDereferenceOfNonPointer()
	{
		SpecialExpression deref = new SpecialExpression(context, token("*"), Operation.DEREF, ref(module, "x"));
		module.addStatement(assign("y", deref));

		assertSame(deref.getToken(), rejectedAt());
	}

	@Test
	void rejectsArithmeticWithBooleanOperand()
	{
		Designator right = ref(module, "flag");
		module.addStatement(assign("x", binary(Operation.MUL, ref(module, "y"), right)));

		assertSame(right.getToken(), rejectedAt());
	}

	@Test
	void rejectsConjunctionWithIntegerOperand()
	{
		Designator left = ref(module, "x");
		module.addStatement(assign("flag", binary(Operation.AND, left, ref(module, "flag"))));

		assertSame(left.getToken(), rejectedAt());
	}

	@Test
	void rejectsDisjunctionWithIntegerOperand()
	{
		Constant right = intConstant(context, 1);
		module.addStatement(assign("flag", binary(Operation.OR, ref(module, "flag"), right)));

		assertSame(right.getToken(), rejectedAt());
	}

	@Test
	void rejectsOrderingOnBooleans()
	{
		Designator left = ref(module, "flag");
		module.addStatement(assign("flag", binary(Operation.LESS_THAN, left, boolConstant(context, false))));

		assertSame(left.getToken(), rejectedAt());
	}

	@Test
	void rejectsOrderingBetweenCharAndInteger()
	{
		Designator right = ref(module, "x");
		module.addStatement(assign("flag", binary(Operation.BIGGER_EQUAL, ref(module, "c"), right)));

		assertSame(right.getToken(), rejectedAt());
	}

	@Test
	void rejectsNonBooleanCondition()
	{
		Designator condition = ref(module, "x");
		module.addStatement(new WhileStatement(context, token("while"), condition, List.of()));

		assertSame(condition.getToken(), rejectedAt());
	}

	@Test
	void stopsAtFirstError()
	{
		Designator first = ref(module, "a");
		module.addStatement(new AssignStatement(context, token(":="), first, ref(module, "b")));
		module.addStatement(assign("x", ref(module, "flag")));

		assertSame(first.getToken(), rejectedAt());
	}

	@Test
	void checksNestedProceduresAfterTheModuleBody()
	{
		ProcedureNode procedure = new ProcedureNode(context, token("bar"), module, bar);
		ReturnStatement missing = new ReturnStatement(context, token("return"), procedure, null);
		procedure.addStatement(missing);
		module.addStatement(assign("x", intConstant(context, 1)));

		assertSame(missing.getToken(), rejectedAt());
	}

	@Test
	void malformedTreeIsReportedAgainstTheScope()
	{
		ArrayDesignator unsealed = new ArrayDesignator(context, token("a"), module.getSymbolTable().resolve("a").orElseThrow());
		unsealed.addIndex(intConstant(context, 0));
		module.addStatement(assign("x", unsealed));

		assertSame(module.getToken(), rejectedAt());
	}

	// --- Acceptance ---

	@Test
	void acceptsIfWithComparison()
	{
		module.addStatement(new IfStatement(context, token("if"),
				binary(Operation.LESS_THAN, ref(module, "x"), intConstant(context, 10)),
				List.of(assign("y", intConstant(context, 1))),
				List.of(assign("y", intConstant(context, 0)))));

		assertTrue(checker.check(module));
		assertFalse(errorHandler.hasErrors());
	}

	@Test
	void acceptsIntegerBounds()
	{
		module.addStatement(assign("x", intConstant(context, Integer.MIN_VALUE)));
		module.addStatement(assign("y", intConstant(context, Integer.MAX_VALUE)));
		module.addStatement(assign("x", new UnaryExpression(context, token("-"), Operation.NEG, ref(module, "y"))));

		assertTrue(checker.check(module));
	}

	@Test
	void acceptsCountdownLoop()
	{
		module.addStatement(new WhileStatement(context, token("while"),
				binary(Operation.NOT_EQUAL, ref(module, "i"), intConstant(context, 0)),
				List.of(assign("i", binary(Operation.SUB, ref(module, "i"), intConstant(context, 1))),
						new BreakStatement(context, token("break")))));

		assertTrue(checker.check(module));
	}

	@Test
	void acceptsCallWithMatchingArguments()
	{
		FunctionCall call = new FunctionCall(context, token("bar"), bar);
		call.addArgument(ref(module, "x"));
		call.addArgument(ref(module, "c"));
		module.addStatement(assign("y", call));

		FunctionCall write = new FunctionCall(context, token("foo"), foo);
		write.addArgument(binary(Operation.MUL, ref(module, "x"), intConstant(context, 2)));
		module.addStatement(new CallStatement(context, token("foo"), write));

		assertTrue(checker.check(module));
	}

	@Test
	void acceptsArrayPassedByAddressAndFullyIndexedElements()
	{
		ProcedureSymbol writeStr = (ProcedureSymbol) module.getSymbolTable().resolve("WriteStr").orElseThrow();
		FunctionCall call = new FunctionCall(context, token("WriteStr"), writeStr);
		call.addArgument(new SpecialExpression(context, token("&"), Operation.ADDRESS,
				new StringConstant(context, token("\"hello\""), "hello", module)));
		module.addStatement(new CallStatement(context, token("WriteStr"), call));
		module.addStatement(assign("x", element("a", intConstant(context, 2), ref(module, "i"))));

		assertTrue(checker.check(module));
	}

	@Test
	void acceptsBooleanReturnAndCharComparison()
	{
		ProcedureSymbol isUpper = new ProcedureSymbol("isUpper", PrimitiveType.BOOLEAN);
		isUpper.addParameter("ch", PrimitiveType.CHAR);
		ProcedureNode procedure = new ProcedureNode(context, token("isUpper"), module, isUpper);
		Expression range = binary(Operation.AND,
				binary(Operation.BIGGER_EQUAL, ref(procedure, "ch"), charConstant(context, 'A')),
				new UnaryExpression(context, token("!"), Operation.NOT,
						binary(Operation.BIGGER_THAN, ref(procedure, "ch"), charConstant(context, 'Z'))));
		procedure.addStatement(new ReturnStatement(context, token("return"), procedure, range));

		assertTrue(checker.check(module));
	}
}
