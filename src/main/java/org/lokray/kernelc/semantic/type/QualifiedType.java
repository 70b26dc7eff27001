package org.lokray.kernelc.semantic.type;

public record QualifiedType(Qualifier qualifier, TypeAnnotation inner) implements TypeAnnotation
{
	@Override
	public String declare(String variableName)
	{
		return qualifier.getKeyword() + " " + inner.declare(variableName);
	}
}
