// File: src/main/java/org/lokray/quasar/ast/ScopeNode.java
package org.lokray.quasar.ast;

import org.antlr.v4.runtime.Token;
import org.lokray.quasar.semantic.symbol.SymbolTable;
import org.lokray.quasar.semantic.symbol.VariableSymbol;
import org.lokray.quasar.semantic.type.Type;
import org.lokray.quasar.tac.CodeBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A module or procedure: a symbol table, the statements of its body and the
 * procedures nested inside it. After code generation the scope also owns its
 * instruction stream.
 */
public abstract class ScopeNode extends AstNode
{
	private final CompilationContext context;
	private final String name;
	private final ScopeNode parent;
	private final SymbolTable symbolTable;
	private final List<ScopeNode> children = new ArrayList<>();
	private final List<Statement> statements = new ArrayList<>();
	private CodeBlock codeBlock;

	protected ScopeNode(CompilationContext context, Token token, String name, ScopeNode parent, SymbolTable symbolTable)
	{
		super(context, token);
		this.context = context;
		this.name = name;
		this.parent = parent;
		this.symbolTable = Objects.requireNonNull(symbolTable, "symbolTable");
		if (parent != null)
		{
			parent.children.add(this);
		}
	}

	/**
	 * Creates a variable of the kind that is declared in this scope.
	 */
	public abstract VariableSymbol createVariable(String name, Type type);

	/**
	 * Creates a variable and defines it in this scope's symbol table.
	 */
	public VariableSymbol declareVariable(String name, Type type)
	{
		VariableSymbol symbol = createVariable(name, type);
		symbolTable.define(symbol);
		return symbol;
	}

	public CompilationContext getContext()
	{
		return context;
	}

	public String getName()
	{
		return name;
	}

	public ScopeNode getParent()
	{
		return parent;
	}

	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}

	public List<ScopeNode> getChildren()
	{
		return Collections.unmodifiableList(children);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public void addStatement(Statement statement)
	{
		statements.add(Objects.requireNonNull(statement, "statement"));
	}

	public void setStatements(List<Statement> statements)
	{
		this.statements.clear();
		statements.forEach(this::addStatement);
	}

	public Optional<CodeBlock> getCodeBlock()
	{
		return Optional.ofNullable(codeBlock);
	}

	public void setCodeBlock(CodeBlock codeBlock)
	{
		this.codeBlock = codeBlock;
	}
}
