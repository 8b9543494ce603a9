// File: src/main/java/org/lokray/quasar/ast/CompilationContext.java
package org.lokray.quasar.ast;

/**
 * State shared by all nodes of one compilation: the node id counter and the
 * counter used to name the globals that hold string literals.
 * <p>
 * Not thread-safe; a tree is built and compiled by a single thread.
 */
public class CompilationContext
{
	public static final String STRING_CONSTANT_PREFIX = "_str_";

	private int nextNodeId = 0;
	private int stringConstantCount = 0;

	public int nextNodeId()
	{
		return nextNodeId++;
	}

	public String nextStringConstantName()
	{
		return STRING_CONSTANT_PREFIX + (++stringConstantCount);
	}

	public int getNodeCount()
	{
		return nextNodeId;
	}
}
