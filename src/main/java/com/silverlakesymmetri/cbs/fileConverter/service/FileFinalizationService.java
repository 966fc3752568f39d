package com.silverlakesymmetri.cbs.fileConverter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.PART_FILE_SUFFIX;

@Service
public class FileFinalizationService {

	private static final Logger logger = LoggerFactory.getLogger(FileFinalizationService.class);

	public static Path partPathFor(Path outputPath) {
		return outputPath.resolveSibling(outputPath.getFileName().toString() + PART_FILE_SUFFIX);
	}

	/**
	 * Moves a completed {@code .part} file onto its final name, atomically where the file
	 * system allows it.
	 *
	 * @return the final path
	 */
	public Path finalizeFile(Path partPath) throws IOException {
		if (!Files.exists(partPath)) {
			throw new IOException("Finalization failed: part file missing at " + partPath);
		}
		String partName = partPath.getFileName().toString();
		if (!partName.endsWith(PART_FILE_SUFFIX)) {
			throw new IOException("Finalization failed: " + partPath + " does not have " + PART_FILE_SUFFIX + " extension");
		}
		Path finalPath = partPath.resolveSibling(partName.substring(0, partName.length() - PART_FILE_SUFFIX.length()));

		try {
			Files.move(partPath, finalPath, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			logger.warn("Atomic move failed, falling back to REPLACE_EXISTING for {}", finalPath);
			Files.move(partPath, finalPath, StandardCopyOption.REPLACE_EXISTING);
		}

		applyPosixPermissions(finalPath, "rw-r--r--");
		logger.debug("Finalized {}", finalPath);
		return finalPath;
	}

	/**
	 * Removes a part file left behind by a failed writer. Failures are logged, not thrown,
	 * so the original error reaches the caller.
	 */
	public void cleanupPartFile(Path partPath) {
		try {
			if (Files.deleteIfExists(partPath)) {
				logger.info("Part file cleaned up: {}", partPath);
			}
		} catch (IOException e) {
			logger.error("Failed to cleanup part file: {}", partPath, e);
		}
	}

	private void applyPosixPermissions(Path path, String permsStr) {
		try {
			if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
				Set<PosixFilePermission> perms = PosixFilePermissions.fromString(permsStr);
				Files.setPosixFilePermissions(path, perms);
			}
		} catch (IOException | UnsupportedOperationException e) {
			logger.warn("Failed to set POSIX permissions for {}: {}", path, e.getMessage());
		}
	}
}
