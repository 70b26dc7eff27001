package org.lokray.kernelc.semantic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Declared names, one set per open block. Lookup is flat: a name is defined if any open
 * block declares it.
 */
public class ScopeStack
{
	private final Deque<Set<String>> scopes = new ArrayDeque<>();

	public void push()
	{
		scopes.push(new HashSet<>());
	}

	public void pop()
	{
		if (scopes.isEmpty())
		{
			throw new IllegalStateException("No scope to pop");
		}
		scopes.pop();
	}

	/**
	 * Declares a name in the innermost scope.
	 */
	public void declare(String name)
	{
		if (scopes.isEmpty())
		{
			throw new IllegalStateException("Cannot declare '" + name + "' outside of a scope");
		}
		scopes.peek().add(name);
	}

	public boolean isDefined(String name)
	{
		for (Set<String> scope : scopes)
		{
			if (scope.contains(name))
			{
				return true;
			}
		}
		return false;
	}

	int depth()
	{
		return scopes.size();
	}
}
