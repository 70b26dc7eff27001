package org.lokray.kernelc.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;

public class ProcessUtils
{
	public static void executeCommand(ProcessBuilder pb) throws IOException, InterruptedException
	{
		Debug.logDebug("Executing: " + String.join(" ", pb.command()));
		// Merged so a chatty stderr cannot block the process on a full pipe
		pb.redirectErrorStream(true);
		Process process = pb.start();

		try (BufferedReader output = new BufferedReader(new InputStreamReader(process.getInputStream())))
		{
			String s;
			while ((s = output.readLine()) != null)
			{
				Debug.logDebug(s);
			}
		}

		int exitCode = process.waitFor();
		if (exitCode != 0)
		{
			throw new RuntimeException("Command failed with exit code " + exitCode + " for: " + String.join(" ", pb.command()));
		}
	}
}
