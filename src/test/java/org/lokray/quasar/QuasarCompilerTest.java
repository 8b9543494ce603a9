package org.lokray.quasar;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.quasar.ast.*;
import org.lokray.quasar.semantic.symbol.ProcedureSymbol;
import org.lokray.quasar.semantic.type.PrimitiveType;
import org.lokray.quasar.tac.Operation;
import org.lokray.quasar.tac.TacProgram;
import org.lokray.quasar.util.CompilerOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.lokray.quasar.AstFixtures.*;

class QuasarCompilerTest
{
	private CompilationContext context;
	private ModuleNode module;
	private ProcedureNode inc;

	@BeforeEach
	void setUp()
	{
		context = new CompilationContext();
		module = new ModuleNode(context, token("module"), "counter");
		module.declareVariable("x", PrimitiveType.INT);

		// function inc(n: integer): integer; begin return n + 1 end
		ProcedureSymbol incSymbol = new ProcedureSymbol("inc", PrimitiveType.INT);
		incSymbol.addParameter("n", PrimitiveType.INT);
		inc = new ProcedureNode(context, token("inc"), module, incSymbol);
		inc.addStatement(new ReturnStatement(context, token("return"), inc,
				new BinaryExpression(context, token("+"), Operation.ADD, ref(inc, "n"), intConstant(context, 1))));

		// x := inc(41)
		FunctionCall call = new FunctionCall(context, token("inc"), incSymbol);
		call.addArgument(intConstant(context, 41));
		module.addStatement(new AssignStatement(context, token(":="), ref(module, "x"), call));
	}

	@Test
	void generatesEveryScopeModuleFirst() throws IOException
	{
		ProcedureNode helper = new ProcedureNode(context, token("helper"), inc, new ProcedureSymbol("helper", null));
		ProcedureNode other = new ProcedureNode(context, token("other"), module, new ProcedureSymbol("other", null));

		Optional<TacProgram> program = new QuasarCompiler().compile(module);

		assertTrue(program.isPresent());
		List<ScopeNode> order = new ArrayList<>(program.get().getCodeBlocks().keySet());
		assertEquals(List.of(module, inc, helper, other), order);
		assertTrue(inc.getCodeBlock().isPresent());
		assertEquals(List.of("t0 := n add 1", "return t0"), program.get().getCodeBlock("inc").orElseThrow()
				.getInstructions().stream().map(Object::toString).toList());
	}

	@Test
	void refusesToGenerateUncheckedModules()
	{
		QuasarCompiler compiler = new QuasarCompiler();

		assertThrows(IllegalStateException.class, () -> compiler.generate(module));
	}

	@Test
	void failedCheckStopsCompilation() throws IOException
	{
		Constant superfluous = intConstant(context, 0);
		module.addStatement(new ReturnStatement(context, token("return"), module, superfluous));
		QuasarCompiler compiler = new QuasarCompiler();

		assertTrue(compiler.compile(module).isEmpty());
		assertSame(superfluous.getToken(), compiler.getError().orElseThrow().token());
		assertThrows(IllegalStateException.class, () -> compiler.generate(module));
		assertTrue(module.getCodeBlock().isEmpty());
	}

	@Test
	void checkOnlySkipsCodeGeneration() throws IOException
	{
		QuasarCompiler compiler = new QuasarCompiler(new CompilerOptions().setCheckOnly(true));

		assertTrue(compiler.compile(module).isEmpty());
		assertTrue(compiler.getError().isEmpty());
		assertTrue(module.getCodeBlock().isEmpty());
	}

	@Test
	void writesJsonListing(@TempDir Path tempDir) throws IOException
	{
		Path out = tempDir.resolve("build").resolve("counter.json");
		QuasarCompiler compiler = new QuasarCompiler(new CompilerOptions().setOutputPath(out));

		compiler.compile(module);

		assertTrue(Files.exists(out));
		JsonObject listing = JsonParser.parseString(Files.readString(out)).getAsJsonObject();
		assertEquals("counter", listing.get("module").getAsString());

		JsonArray scopes = listing.getAsJsonArray("scopes");
		assertEquals(2, scopes.size());
		JsonObject moduleScope = scopes.get(0).getAsJsonObject();
		assertEquals("counter", moduleScope.get("name").getAsString());

		JsonArray instructions = moduleScope.getAsJsonArray("instructions");
		JsonObject last = instructions.get(instructions.size() - 1).getAsJsonObject();
		assertEquals("ASSIGN", last.get("op").getAsString());
		assertEquals("x", last.get("dest").getAsString());

		JsonObject first = instructions.get(0).getAsJsonObject();
		assertEquals("PARAM", first.get("op").getAsString());
		assertEquals("param 0 <- 41", first.get("text").getAsString());

		JsonObject incScope = scopes.get(1).getAsJsonObject();
		assertEquals("inc", incScope.get("name").getAsString());
		assertEquals("integer", incScope.get("returnType").getAsString());
		assertEquals("n", incScope.getAsJsonArray("symbols").get(0).getAsJsonObject().get("name").getAsString());
	}

	@Test
	void keepsLabelsWithoutCleanup() throws IOException
	{
		QuasarCompiler compiler = new QuasarCompiler(new CompilerOptions().setCleanupControlFlow(false));

		TacProgram program = compiler.compile(module).orElseThrow();

		assertTrue(program.getCodeBlock("counter").orElseThrow().getInstructions().stream().anyMatch(i -> i.isLabel()));
	}
}
