package org.lokray.kernelc;

import org.lokray.kernelc.semantic.type.HostType;

/**
 * A closure value with an explicit host type, for widths and signedness a boxed Java
 * value cannot express (unsigned integers, the absence value).
 *
 * @param type  The host type the value is declared with.
 * @param value The value itself; null for {@link #NONE}.
 */
public record KernelScalar(HostType type, Number value)
{
	public static final KernelScalar NONE = new KernelScalar(HostType.NONE, null);

	public static KernelScalar int8(byte value)
	{
		return new KernelScalar(HostType.INT8, value);
	}

	public static KernelScalar uint8(int value)
	{
		return new KernelScalar(HostType.UINT8, value);
	}

	public static KernelScalar int16(short value)
	{
		return new KernelScalar(HostType.INT16, value);
	}

	public static KernelScalar uint16(int value)
	{
		return new KernelScalar(HostType.UINT16, value);
	}

	public static KernelScalar int32(int value)
	{
		return new KernelScalar(HostType.INT32, value);
	}

	public static KernelScalar uint32(long value)
	{
		return new KernelScalar(HostType.UINT32, value);
	}

	public static KernelScalar int64(long value)
	{
		return new KernelScalar(HostType.INT64, value);
	}

	public static KernelScalar uint64(long value)
	{
		return new KernelScalar(HostType.UINT64, value);
	}

	public static KernelScalar float32(float value)
	{
		return new KernelScalar(HostType.FLOAT32, value);
	}

	public static KernelScalar float64(double value)
	{
		return new KernelScalar(HostType.FLOAT64, value);
	}
}
