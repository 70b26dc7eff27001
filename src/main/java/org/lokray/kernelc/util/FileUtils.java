package org.lokray.kernelc.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils
{
	public static String load(Path filePath) throws IOException
	{
		return Files.readString(filePath, StandardCharsets.UTF_8);
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * Replaces the extension of {@code path}, or appends one if it has none.
	 */
	public static Path withExtension(Path path, String newExtension)
	{
		String baseName = path.getFileName().toString().replaceFirst("(?<=.)[.][^.]+$", "");
		return path.resolveSibling(baseName + newExtension);
	}
}
