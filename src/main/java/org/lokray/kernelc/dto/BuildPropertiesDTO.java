package org.lokray.kernelc.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The kernel properties document handed to the native build service.
 */
public class BuildPropertiesDTO
{
	// Preprocessor defines, e.g. "TILE_SIZE" -> "16"
	public Map<String, String> defines = new LinkedHashMap<>();

	// Compiler flags, e.g. "-O3" -> ""
	public Map<String, String> flags = new LinkedHashMap<>();
}
