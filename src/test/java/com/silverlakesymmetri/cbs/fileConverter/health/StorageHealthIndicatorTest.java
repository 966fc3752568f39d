package com.silverlakesymmetri.cbs.fileConverter.health;

import com.silverlakesymmetri.cbs.fileConverter.config.ConversionProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class StorageHealthIndicatorTest {

	@TempDir
	Path tempDir;

	private static StorageHealthIndicator indicatorFor(Path storagePath) {
		ConversionProperties properties = new ConversionProperties();
		properties.setStoragePath(storagePath.toString());
		return new StorageHealthIndicator(properties);
	}

	@Test
	void missingStorageRootIsDown() {
		Health health = indicatorFor(tempDir.resolve("missing")).health();

		assertEquals(Status.DOWN, health.getStatus());
		assertEquals("Storage root does not exist", health.getDetails().get("error"));
	}

	@Test
	void writableStorageRootIsNotDown() {
		Health health = indicatorFor(tempDir).health();

		assertNotEquals(Status.DOWN, health.getStatus());
		assertEquals(tempDir.toAbsolutePath().toString(), health.getDetails().get("storagePath"));
	}
}
