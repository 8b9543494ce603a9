// File: src/main/java/org/lokray/quasar/tac/TacProgram.java
package org.lokray.quasar.tac;

import org.lokray.quasar.ast.ModuleNode;
import org.lokray.quasar.ast.ScopeNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The code blocks of a module and its nested scopes, in generation order
 * (module first, then nested procedures depth-first).
 */
public class TacProgram
{
	private final ModuleNode module;
	private final Map<ScopeNode, CodeBlock> codeBlocks = new LinkedHashMap<>();

	public TacProgram(ModuleNode module)
	{
		this.module = module;
	}

	public void add(CodeBlock codeBlock)
	{
		codeBlocks.put(codeBlock.getOwner(), codeBlock);
	}

	public ModuleNode getModule()
	{
		return module;
	}

	public Map<ScopeNode, CodeBlock> getCodeBlocks()
	{
		return Collections.unmodifiableMap(codeBlocks);
	}

	public Optional<CodeBlock> getCodeBlock(String scopeName)
	{
		return codeBlocks.entrySet().stream()
				.filter(e -> e.getKey().getName().equals(scopeName))
				.map(Map.Entry::getValue)
				.findFirst();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		codeBlocks.forEach((scope, block) ->
		{
			sb.append(scope.getName()).append(":\n");
			sb.append(block);
		});
		return sb.toString();
	}
}
