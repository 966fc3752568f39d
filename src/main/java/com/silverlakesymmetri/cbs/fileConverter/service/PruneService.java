package com.silverlakesymmetri.cbs.fileConverter.service;

import com.silverlakesymmetri.cbs.fileConverter.config.ConversionProperties;
import com.silverlakesymmetri.cbs.fileConverter.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

/**
 * Deletes conversion output (a file, or a directory with its contents) once the caller has
 * collected it. Only paths inside the storage root may be removed.
 */
@Service
public class PruneService {
	private static final Logger logger = LoggerFactory.getLogger(PruneService.class);

	private final ConversionProperties properties;

	public PruneService(ConversionProperties properties) {
		this.properties = properties;
	}

	public void prune(String path) throws IOException {
		if (path == null || path.trim().isEmpty()) {
			throw new ValidationException("Path is required",
					Collections.singletonList("Input 'path' of dir/file to delete required!"));
		}

		Path storageRoot = Paths.get(properties.getStoragePath()).toAbsolutePath().normalize();
		Path target;
		try {
			target = Paths.get(path).toAbsolutePath().normalize();
		} catch (InvalidPathException e) {
			throw new ValidationException("Invalid path: " + path);
		}
		if (!target.startsWith(storageRoot) || target.equals(storageRoot)) {
			throw new ValidationException("Path is outside the storage root",
					Collections.singletonList("This action is meant for deleting folders in " + storageRoot));
		}
		if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
			throw new ValidationException("Nothing to prune",
					Collections.singletonList(target + " does not exist"));
		}

		if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
			FileSystemUtils.deleteRecursively(target);
		} else {
			Files.delete(target);
		}
		logger.info("Pruned {}", target);
	}
}
