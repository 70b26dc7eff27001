package org.lokray.kernelc.dto;

/**
 * One entry of the JSON report written by {@code --json}.
 */
public class TranslationDTO
{
	public String file;
	public boolean success;

	// Null when the file failed
	public String output;

	public String error;
	public Integer line;
	public Integer column;
}
