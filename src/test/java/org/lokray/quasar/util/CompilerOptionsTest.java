package org.lokray.quasar.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class CompilerOptionsTest
{
	@AfterEach
	void resetLogging()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void defaults()
	{
		CompilerOptions options = CompilerOptions.parse(new String[0]);

		assertFalse(options.isVerboseFlag());
		assertFalse(options.isCheckOnly());
		assertTrue(options.isCleanupControlFlow());
		assertNull(options.getOutputPath());
	}

	@Test
	void parsesAllFlags()
	{
		CompilerOptions options = CompilerOptions.parse(new String[]{"--verbose", "-k", "--no-cleanup", "-o", "build/out.json"});

		assertTrue(options.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
		assertTrue(options.isCheckOnly());
		assertFalse(options.isCleanupControlFlow());
		assertEquals(Paths.get("build/out.json"), options.getOutputPath());
	}

	@Test
	void rejectsUnknownOptions()
	{
		assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse(new String[]{"--optimize"}));
		assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse(new String[]{"listing.json"}));
	}

	@Test
	void outputNeedsAValue()
	{
		assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse(new String[]{"-o"}));
		assertThrows(IllegalArgumentException.class, () -> CompilerOptions.parse(new String[]{"--output", "-v"}));
	}
}
