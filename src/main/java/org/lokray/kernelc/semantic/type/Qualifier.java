package org.lokray.kernelc.semantic.type;

import java.util.Optional;

/**
 * Annotation wrappers that prepend a kernel keyword to the wrapped declaration.
 */
public enum Qualifier
{
	CONST("Const", "const"),
	EXCLUSIVE("Exclusive", "@exclusive"),
	SHARED("Shared", "@shared");

	private final String genericName;
	private final String keyword;

	Qualifier(String genericName, String keyword)
	{
		this.genericName = genericName;
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	public static Optional<Qualifier> forGenericName(String name)
	{
		for (Qualifier qualifier : values())
		{
			if (qualifier.genericName.equals(name))
			{
				return Optional.of(qualifier);
			}
		}
		return Optional.empty();
	}
}
