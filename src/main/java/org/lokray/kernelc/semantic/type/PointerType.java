package org.lokray.kernelc.semantic.type;

/**
 * {@code List[T]}: a pointer to {@code T}.
 */
public record PointerType(TypeAnnotation pointee) implements TypeAnnotation
{
	@Override
	public String declare(String variableName)
	{
		String base = pointee.declare("");
		// Stacked pointers read "T **x", not "T * *x"
		if (!base.endsWith("*"))
		{
			base += " ";
		}
		return base + "*" + variableName;
	}
}
