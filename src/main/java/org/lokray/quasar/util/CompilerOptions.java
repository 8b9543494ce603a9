package org.lokray.quasar.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options of a {@link org.lokray.quasar.QuasarCompiler} run. Built from
 * command-line style arguments, see {@link #parse(String[])}.
 */
public class CompilerOptions
{
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private boolean cleanupControlFlow = true;
	private Path outputPath = null;

	public CompilerOptions()
	{
	}

	/**
	 * @throws IllegalArgumentException on an unknown option or a missing option value.
	 */
	public static CompilerOptions parse(String[] args)
	{
		CompilerOptions options = new CompilerOptions();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				options.verboseFlag = true;
				Debug.ENABLE_DEBUG = true;
				continue;
			}
			if (arg.equals("-k") || arg.equals("--check"))
			{
				options.checkOnly = true;
				continue;
			}
			if (arg.equals("--no-cleanup"))
			{
				options.cleanupControlFlow = false;
				continue;
			}
			if (arg.equals("-o") || arg.equals("--output"))
			{
				options.outputPath = Paths.get(getNextArg(args, ++i, arg));
				continue;
			}

			throw new IllegalArgumentException("Unknown option: " + arg);
		}

		return options;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	// --- Getters and setters ---

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public CompilerOptions setCheckOnly(boolean checkOnly)
	{
		this.checkOnly = checkOnly;
		return this;
	}

	public boolean isCleanupControlFlow()
	{
		return cleanupControlFlow;
	}

	public CompilerOptions setCleanupControlFlow(boolean cleanupControlFlow)
	{
		this.cleanupControlFlow = cleanupControlFlow;
		return this;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public CompilerOptions setOutputPath(Path outputPath)
	{
		this.outputPath = outputPath;
		return this;
	}
}
