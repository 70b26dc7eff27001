package org.lokray.kernelc.semantic.type;

import java.util.List;

/**
 * {@code List[T, d1, d2, ...]}: a fixed-size array. Dimensions are already rendered kernel expressions.
 */
public record ArrayType(TypeAnnotation elementType, List<String> dimensions) implements TypeAnnotation
{
	public ArrayType
	{
		dimensions = List.copyOf(dimensions);
	}

	@Override
	public String declare(String variableName)
	{
		StringBuilder declaration = new StringBuilder(elementType.declare(""))
				.append(' ')
				.append(variableName);
		for (String dimension : dimensions)
		{
			declaration.append('[').append(dimension).append(']');
		}
		return declaration.toString();
	}
}
