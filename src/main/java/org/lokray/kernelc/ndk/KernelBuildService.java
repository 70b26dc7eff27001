package org.lokray.kernelc.ndk;

import java.io.IOException;

/**
 * The native service that compiles translated kernel source. Its failures are its own and
 * never {@link org.lokray.kernelc.util.KernelcException}s.
 */
public interface KernelBuildService
{
	/**
	 * @param source     Kernel source as produced by the translator.
	 * @param entryPoint Name of the kernel function to launch.
	 * @param options    Defines and flags for this build.
	 * @return A handle to the built kernel.
	 */
	KernelHandle build(String source, String entryPoint, BuildOptions options) throws IOException, InterruptedException;
}
