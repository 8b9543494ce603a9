// File: src/main/java/org/lokray/quasar/QuasarCompiler.java
package org.lokray.quasar;

import org.lokray.quasar.ast.ModuleNode;
import org.lokray.quasar.ast.ScopeNode;
import org.lokray.quasar.codegen.TacGenerator;
import org.lokray.quasar.semantic.SemanticError;
import org.lokray.quasar.semantic.TypeChecker;
import org.lokray.quasar.tac.CodeBlock;
import org.lokray.quasar.tac.TacProgram;
import org.lokray.quasar.util.AstPrinter;
import org.lokray.quasar.util.CompilerOptions;
import org.lokray.quasar.util.Debug;
import org.lokray.quasar.util.ErrorHandler;
import org.lokray.quasar.util.TacListingWriter;

import java.io.IOException;
import java.util.Optional;

/**
 * Runs the back end over a parsed module: type checking, then three-address
 * code generation for every scope.
 */
public class QuasarCompiler
{
	private final CompilerOptions options;
	private final ErrorHandler errorHandler = new ErrorHandler();
	private ModuleNode checkedModule;

	public QuasarCompiler(CompilerOptions options)
	{
		this.options = options;
	}

	public QuasarCompiler()
	{
		this(new CompilerOptions());
	}

	/**
	 * Type checks the module and everything nested in it. Stops at the first
	 * error, which is then available from {@link #getError()}.
	 */
	public boolean check(ModuleNode module)
	{
		if (Debug.ENABLE_DEBUG)
		{
			Debug.logDebug(AstPrinter.print(module));
		}
		Debug.logInfo("Type checking module '" + module.getName() + "'...");

		boolean ok = new TypeChecker(errorHandler).check(module);
		if (ok)
		{
			checkedModule = module;
			Debug.logInfo("Type checking completed successfully.");
		}
		else
		{
			checkedModule = null;
			Debug.logError("Type checking failed. Aborting.");
		}
		return ok;
	}

	/**
	 * @throws IllegalStateException if the module has not been checked successfully.
	 */
	public TacProgram generate(ModuleNode module)
	{
		if (checkedModule != module)
		{
			throw new IllegalStateException("Module '" + module.getName() + "' must pass type checking before code generation.");
		}

		TacProgram program = new TacProgram(module);
		generateScope(module, program);
		Debug.logDebug(program.toString());
		return program;
	}

	private void generateScope(ScopeNode scope, TacProgram program)
	{
		CodeBlock codeBlock = new CodeBlock(scope);
		new TacGenerator(codeBlock).generate(options.isCleanupControlFlow());
		program.add(codeBlock);

		for (ScopeNode child : scope.getChildren())
		{
			generateScope(child, program);
		}
	}

	/**
	 * Checks the module and, unless only checking was requested, generates its
	 * code and writes the listing if an output path is set.
	 *
	 * @return the generated program, or empty if checking failed or only checking was requested.
	 */
	public Optional<TacProgram> compile(ModuleNode module) throws IOException
	{
		if (!check(module))
		{
			return Optional.empty();
		}
		if (options.isCheckOnly())
		{
			Debug.logInfo("Check only: skipping code generation.");
			return Optional.empty();
		}

		TacProgram program = generate(module);
		if (options.getOutputPath() != null)
		{
			new TacListingWriter().write(program, options.getOutputPath());
		}
		return Optional.of(program);
	}

	public Optional<SemanticError> getError()
	{
		return errorHandler.getFirstError();
	}

	public ErrorHandler getErrorHandler()
	{
		return errorHandler;
	}

	public CompilerOptions getOptions()
	{
		return options;
	}
}
