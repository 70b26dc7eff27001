package org.lokray.kernelc.semantic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeStackTest
{
	@Test
	void namesVanishWithTheirScope()
	{
		ScopeStack scopes = new ScopeStack();
		scopes.push();
		scopes.declare("a");
		scopes.push();
		scopes.declare("b");

		assertTrue(scopes.isDefined("a"));
		assertTrue(scopes.isDefined("b"));
		assertEquals(2, scopes.depth());

		scopes.pop();

		assertTrue(scopes.isDefined("a"));
		assertFalse(scopes.isDefined("b"));
	}

	@Test
	void declaringOutsideAScopeFails()
	{
		ScopeStack scopes = new ScopeStack();

		assertThrows(IllegalStateException.class, () -> scopes.declare("a"));
		assertThrows(IllegalStateException.class, scopes::pop);
	}
}
