package org.lokray.kernelc.semantic.type;

/**
 * A plain named type, either a kernel primitive or a name passed through as written.
 */
public record BasicType(String name) implements TypeAnnotation
{
	public static final BasicType VOID = PrimitiveType.VOID.toAnnotation();

	@Override
	public String declare(String variableName)
	{
		return variableName.isEmpty() ? name : name + " " + variableName;
	}
}
