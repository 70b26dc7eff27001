package org.lokray.kernelc.ndk;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.lokray.kernelc.dto.BuildPropertiesDTO;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Preprocessor defines and compiler flags for one kernel build, kept in insertion order.
 */
public class BuildOptions
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	private final Map<String, String> defines = new LinkedHashMap<>();
	private final Map<String, String> flags = new LinkedHashMap<>();

	public static BuildOptions none()
	{
		return new BuildOptions();
	}

	public BuildOptions define(String name, Object value)
	{
		defines.put(name, String.valueOf(value));
		return this;
	}

	/**
	 * Adds a flag that takes no value.
	 */
	public BuildOptions flag(String flag)
	{
		return flag(flag, "");
	}

	public BuildOptions flag(String flag, String value)
	{
		flags.put(flag, value);
		return this;
	}

	public Map<String, String> getDefines()
	{
		return Collections.unmodifiableMap(defines);
	}

	public Map<String, String> getFlags()
	{
		return Collections.unmodifiableMap(flags);
	}

	public String toJson()
	{
		BuildPropertiesDTO properties = new BuildPropertiesDTO();
		properties.defines.putAll(defines);
		properties.flags.putAll(flags);
		return GSON.toJson(properties);
	}

	/**
	 * @throws JsonParseException if {@code json} is not a properties document.
	 */
	public static BuildOptions fromJson(String json)
	{
		BuildPropertiesDTO properties = GSON.fromJson(json, BuildPropertiesDTO.class);
		BuildOptions options = new BuildOptions();
		if (properties == null)
		{
			return options;
		}
		if (properties.defines != null)
		{
			properties.defines.forEach(options::define);
		}
		if (properties.flags != null)
		{
			properties.flags.forEach(options::flag);
		}
		return options;
	}
}
