package org.lokray.kernelc.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class FileUtilsTest
{
	@Test
	void replacesOrAppendsExtension()
	{
		assertEquals(Path.of("dir", "add.okl"), FileUtils.withExtension(Path.of("dir", "add.py"), ".okl"));
		assertEquals(Path.of("add.okl"), FileUtils.withExtension(Path.of("add"), ".okl"));
		assertEquals(Path.of("my.add.okl"), FileUtils.withExtension(Path.of("my.add.py"), ".okl"));
		assertEquals(Path.of(".kernel.okl"), FileUtils.withExtension(Path.of(".kernel"), ".okl"));
	}

	@Test
	void readsExtension()
	{
		assertEquals(".py", FileUtils.getFileExtension(Path.of("add.py")));
		assertNull(FileUtils.getFileExtension(Path.of("Makefile")));
	}
}
