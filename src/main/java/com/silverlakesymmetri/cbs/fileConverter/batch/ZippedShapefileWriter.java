package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.service.FileFinalizationService;
import com.silverlakesymmetri.cbs.fileConverter.spatial.ColumnNameMapper;
import com.silverlakesymmetri.cbs.fileConverter.spatial.FeatureSchema;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialDriver;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialFeatureWriter;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialWriterFactory;
import org.beanio.stream.RecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.GEOMETRY_FIELD;

/**
 * Writes a shapefile into a scratch directory named after the output, adds a
 * {@code "<dataset> fields.csv"} mapping truncated attribute names back to field ids, and packs
 * everything into a zip next to the scratch directory. The scratch directory must not exist
 * beforehand and is always removed.
 */
public class ZippedShapefileWriter implements OutputFormatWriter {
	private static final Logger logger = LoggerFactory.getLogger(ZippedShapefileWriter.class);

	static final Set<String> SHAPEFILE_EXTENSIONS =
			Collections.unmodifiableSet(new HashSet<>(Arrays.asList(".shp", ".cpg", ".dbf", ".prj", ".shx")));

	private final Path scratchDir;
	private final Path zipPath;
	private final Path zipPartPath;
	private final String datasetName;
	private final List<String> fieldIds;
	private final FeatureSchema schema;
	private final Map<String, String> columnMap;
	private final int epsg;
	private final SpatialWriterFactory writerFactory;
	private final FileFinalizationService fileFinalizationService;

	private SpatialFeatureWriter featureWriter;
	private long recordCount;
	private boolean scratchCreated;
	private boolean completed;

	/**
	 * @param shapefilePath nominal {@code .shp} output path; the artifact is the sibling {@code .zip}
	 */
	public ZippedShapefileWriter(Path shapefilePath, String datasetName, List<String> fieldIds,
								 FeatureSchema schema, Map<String, String> columnMap, int epsg,
								 SpatialWriterFactory writerFactory, FileFinalizationService fileFinalizationService) {
		String baseName = stripExtension(shapefilePath.getFileName().toString());
		this.scratchDir = shapefilePath.resolveSibling(baseName);
		this.zipPath = shapefilePath.resolveSibling(baseName + ".zip");
		this.zipPartPath = FileFinalizationService.partPathFor(zipPath);
		this.datasetName = datasetName;
		this.fieldIds = new ArrayList<>(fieldIds);
		this.schema = schema;
		this.columnMap = columnMap;
		this.epsg = epsg;
		this.writerFactory = writerFactory;
		this.fileFinalizationService = fileFinalizationService;
	}

	private static String stripExtension(String fileName) {
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}

	@Override
	public void open(ExecutionContext executionContext) throws ItemStreamException {
		try {
			// fails when the directory is already there
			Files.createDirectory(scratchDir);
			scratchCreated = true;
		} catch (IOException e) {
			throw new ItemStreamException("Cannot create shapefile scratch directory " + scratchDir, e);
		}
		try {
			Path shpPath = scratchDir.resolve(scratchDir.getFileName().toString() + ".shp");
			featureWriter = writerFactory.open(shpPath, SpatialDriver.ESRI_SHAPEFILE, schema, epsg,
					scratchDir.getFileName().toString());
			recordCount = 0;
		} catch (IOException | RuntimeException e) {
			deleteScratch();
			throw new ItemStreamException("Failed to open shapefile writer in " + scratchDir, e);
		}
	}

	@Override
	public void write(List<? extends DynamicRecord> items) throws Exception {
		for (DynamicRecord record : items) {
			featureWriter.write(SpatialFeatureOutputWriter.toFeature(record, columnMap));
			recordCount++;
		}
	}

	@Override
	public void update(ExecutionContext executionContext) {
		// shapefile headers are completed on complete()
	}

	@Override
	public Path complete() throws Exception {
		try {
			featureWriter.close();
			featureWriter = null;

			List<Path> members = collectShapefileMembers();
			members.add(writeFieldsFile());
			zip(members, zipPartPath);

			Path finalPath = fileFinalizationService.finalizeFile(zipPartPath);
			completed = true;
			logger.info("Wrote {} features to {}", recordCount, finalPath);
			return finalPath;
		} finally {
			deleteScratch();
		}
	}

	private List<Path> collectShapefileMembers() throws IOException {
		List<Path> members = new ArrayList<>();
		try (DirectoryStream<Path> files = Files.newDirectoryStream(scratchDir)) {
			for (Path file : files) {
				String name = file.getFileName().toString();
				int dot = name.lastIndexOf('.');
				if (dot >= 0 && SHAPEFILE_EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT))) {
					members.add(file);
				}
			}
		}
		Collections.sort(members);
		return members;
	}

	/**
	 * One row per non-geometry field: the attribute name used in the shapefile and the
	 * original field id.
	 */
	private Path writeFieldsFile() throws IOException {
		Path fieldsPath = scratchDir.resolve(datasetName + " fields.csv");
		try (Writer out = Files.newBufferedWriter(fieldsPath, StandardCharsets.UTF_8)) {
			RecordWriter csv = GenericCSVWriter.createCsvWriter(out);
			csv.write(new String[]{"field", "name"});
			for (String fieldId : fieldIds) {
				if (!GEOMETRY_FIELD.equals(fieldId)) {
					csv.write(new String[]{ColumnNameMapper.mapped(columnMap, fieldId), fieldId});
				}
			}
			csv.flush();
		}
		return fieldsPath;
	}

	private static void zip(List<Path> members, Path target) throws IOException {
		try (OutputStream os = Files.newOutputStream(target);
			 ZipOutputStream zip = new ZipOutputStream(os)) {
			for (Path member : members) {
				zip.putNextEntry(new ZipEntry(member.getFileName().toString()));
				Files.copy(member, zip);
				zip.closeEntry();
			}
		}
	}

	@Override
	public void close() throws ItemStreamException {
		if (completed) {
			return;
		}
		if (featureWriter != null) {
			try {
				featureWriter.close();
			} catch (IOException | RuntimeException e) {
				logger.debug("Ignoring error while discarding shapefile in {}: {}", scratchDir, e.getMessage());
			}
			featureWriter = null;
		}
		deleteScratch();
		fileFinalizationService.cleanupPartFile(zipPartPath);
	}

	private void deleteScratch() {
		if (!scratchCreated) {
			return;
		}
		try {
			FileSystemUtils.deleteRecursively(scratchDir);
		} catch (IOException e) {
			logger.warn("Failed to remove shapefile scratch directory {}", scratchDir, e);
		}
	}

	@Override
	public long getRecordCount() {
		return recordCount;
	}

	@Override
	public Path getOutputPath() {
		return zipPath;
	}
}
