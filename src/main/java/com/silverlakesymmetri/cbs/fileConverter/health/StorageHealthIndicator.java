package com.silverlakesymmetri.cbs.fileConverter.health;

import com.silverlakesymmetri.cbs.fileConverter.config.ConversionProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reports whether the storage root, where request directories are created, is writable.
 */
@Component
public class StorageHealthIndicator implements HealthIndicator {

	static final long LOW_SPACE_THRESHOLD_BYTES = 1024L * 1024L * 1024L;

	private final ConversionProperties properties;

	public StorageHealthIndicator(ConversionProperties properties) {
		this.properties = properties;
	}

	@Override
	public Health health() {
		try {
			Path root = Paths.get(properties.getStoragePath()).toAbsolutePath();
			if (!Files.isDirectory(root)) {
				return Health.down()
						.withDetail("storagePath", root.toString())
						.withDetail("error", "Storage root does not exist")
						.build();
			}
			if (!Files.isWritable(root)) {
				return Health.down()
						.withDetail("storagePath", root.toString())
						.withDetail("error", "Storage root is not writable")
						.build();
			}

			long usable = Files.getFileStore(root).getUsableSpace();
			Health.Builder builder = Health.up();
			if (usable < LOW_SPACE_THRESHOLD_BYTES) {
				builder.status("DEGRADED")
						.withDetail("warning", "Less than 1 GiB free in storage root");
			}
			return builder
					.withDetail("storagePath", root.toString())
					.withDetail("usableBytes", usable)
					.build();
		} catch (Exception e) {
			return Health.down(e).build();
		}
	}
}
