package org.lokray.kernelc.ndk;

import java.nio.file.Path;

/**
 * A kernel built by a {@link KernelBuildService}. Opaque to the translator.
 *
 * @param entryPoint     The kernel function the runtime launches.
 * @param kernelFile     The kernel source that was built.
 * @param propertiesFile The build properties the service was given.
 * @param binary         What the service produced, or null if it keeps the result to itself.
 */
public record KernelHandle(String entryPoint, Path kernelFile, Path propertiesFile, Path binary)
{
}
