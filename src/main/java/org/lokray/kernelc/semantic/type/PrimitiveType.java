package org.lokray.kernelc.semantic.type;

/**
 * The scalar types of the kernel language.
 */
public enum PrimitiveType
{
	VOID("void"),
	BOOL("bool"),
	CHAR("char"),
	SHORT("short"),
	INT("int"),
	LONG("long"),
	FLOAT("float"),
	DOUBLE("double");

	private final String kernelName;

	PrimitiveType(String kernelName)
	{
		this.kernelName = kernelName;
	}

	public String getKernelName()
	{
		return kernelName;
	}

	public BasicType toAnnotation()
	{
		return new BasicType(kernelName);
	}
}
