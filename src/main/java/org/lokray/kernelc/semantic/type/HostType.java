package org.lokray.kernelc.semantic.type;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scalar types on the host side and the kernel primitive each one maps to. Signed and
 * unsigned types of one width share a kernel type.
 */
public enum HostType
{
	BOOL("bool", PrimitiveType.BOOL),
	INT8("int8", PrimitiveType.CHAR),
	UINT8("uint8", PrimitiveType.CHAR),
	INT16("int16", PrimitiveType.SHORT),
	UINT16("uint16", PrimitiveType.SHORT),
	INT32("int32", PrimitiveType.INT),
	UINT32("uint32", PrimitiveType.INT),
	INT64("int64", PrimitiveType.LONG),
	UINT64("uint64", PrimitiveType.LONG),
	FLOAT32("float32", PrimitiveType.FLOAT),
	FLOAT64("float64", PrimitiveType.DOUBLE),
	// Width-less host numbers
	INT("int", PrimitiveType.INT),
	FLOAT("float", PrimitiveType.DOUBLE),
	NONE("None", PrimitiveType.VOID);

	private static final Map<String, HostType> BY_NAME;

	static
	{
		Map<String, HostType> map = new HashMap<>();
		for (HostType type : values())
		{
			map.put(type.hostName, type);
		}
		BY_NAME = Collections.unmodifiableMap(map);
	}

	private final String hostName;
	private final PrimitiveType kernelType;

	HostType(String hostName, PrimitiveType kernelType)
	{
		this.hostName = hostName;
		this.kernelType = kernelType;
	}

	public PrimitiveType getKernelType()
	{
		return kernelType;
	}

	private static Optional<HostType> forName(String hostName)
	{
		return Optional.ofNullable(BY_NAME.get(hostName));
	}

	/**
	 * Looks up a type written in an annotation. The width-less {@code int} and {@code float}
	 * are kernel type names already and are left to pass through as written.
	 */
	public static Optional<HostType> forAnnotationName(String name)
	{
		return forName(name).filter(type -> type != INT && type != FLOAT);
	}

	/**
	 * Classifies a boxed Java value by its width.
	 */
	public static Optional<HostType> forJavaValue(Object value)
	{
		if (value instanceof Boolean)
		{
			return Optional.of(BOOL);
		}
		if (value instanceof Byte)
		{
			return Optional.of(INT8);
		}
		if (value instanceof Short)
		{
			return Optional.of(INT16);
		}
		if (value instanceof Integer)
		{
			return Optional.of(INT32);
		}
		if (value instanceof Long)
		{
			return Optional.of(INT64);
		}
		if (value instanceof Float)
		{
			return Optional.of(FLOAT32);
		}
		if (value instanceof Double)
		{
			return Optional.of(FLOAT64);
		}
		if (value instanceof BigInteger)
		{
			return Optional.of(INT);
		}
		if (value instanceof BigDecimal)
		{
			return Optional.of(FLOAT);
		}
		return Optional.empty();
	}
}
