package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.silverlakesymmetri.cbs.fileConverter.config.model.ProjectionDefinition;
import com.silverlakesymmetri.cbs.fileConverter.geometry.JtsGeometryConverter;
import com.silverlakesymmetri.cbs.fileConverter.geometry.MultiGeometryTypes;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ByteOrderValues;
import org.locationtech.jts.io.WKBWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes a single feature table into a new GeoPackage (SQLite) file. Rows are inserted in one
 * transaction that is committed on {@link #close()}.
 */
public class GeoPackageFeatureWriter implements SpatialFeatureWriter {

	private static final Logger logger = LoggerFactory.getLogger(GeoPackageFeatureWriter.class);

	static final int APPLICATION_ID = 0x47504B47; // "GPKG"
	static final int USER_VERSION = 10300;
	static final String FID_COLUMN = "fid";
	static final String GEOMETRY_COLUMN = "geom";
	private static final int BATCH_SIZE = 1000;

	private final FeatureSchema schema;
	private final int epsg;
	private final String tableName;
	private final String fidColumn;
	private final String geometryColumn;
	private final SingleConnectionDataSource dataSource;
	private final JdbcTemplate jdbcTemplate;
	private final JtsGeometryConverter converter;
	private final WKBWriter wkbWriter;
	private final String insertSql;
	private final List<Object[]> pending = new ArrayList<>();
	private final Envelope extent = new Envelope();
	private long featureCount;

	public GeoPackageFeatureWriter(Path path, FeatureSchema schema, int epsg, String layerName,
								   ProjectionDefinition projection) throws IOException {
		this.schema = schema;
		this.epsg = epsg;
		this.tableName = layerName;
		this.fidColumn = uniqueColumnName(FID_COLUMN, schema.getProperties().keySet(), null);
		this.geometryColumn = uniqueColumnName(GEOMETRY_COLUMN, schema.getProperties().keySet(), fidColumn);
		this.converter = new JtsGeometryConverter(epsg);
		this.wkbWriter = new WKBWriter(schema.is3D() ? 3 : 2, ByteOrderValues.LITTLE_ENDIAN);
		this.dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + path.toAbsolutePath(), true);
		this.dataSource.setAutoCommit(false);
		this.jdbcTemplate = new JdbcTemplate(dataSource);
		this.insertSql = buildInsertSql();
		try {
			createSchema(projection);
		} catch (DataAccessException e) {
			dataSource.destroy();
			throw new IOException("Failed to initialise GeoPackage " + path, e);
		}
	}

	/* ================= Schema ================= */

	private void createSchema(ProjectionDefinition projection) {
		jdbcTemplate.execute("PRAGMA application_id = " + APPLICATION_ID);
		jdbcTemplate.execute("PRAGMA user_version = " + USER_VERSION);

		jdbcTemplate.execute("CREATE TABLE gpkg_spatial_ref_sys ("
				+ "srs_name TEXT NOT NULL, srs_id INTEGER NOT NULL PRIMARY KEY, organization TEXT NOT NULL, "
				+ "organization_coordsys_id INTEGER NOT NULL, definition TEXT NOT NULL, description TEXT)");
		jdbcTemplate.execute("CREATE TABLE gpkg_contents ("
				+ "table_name TEXT NOT NULL PRIMARY KEY, data_type TEXT NOT NULL, identifier TEXT UNIQUE, "
				+ "description TEXT DEFAULT '', "
				+ "last_change DATETIME NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ','now')), "
				+ "min_x DOUBLE, min_y DOUBLE, max_x DOUBLE, max_y DOUBLE, srs_id INTEGER, "
				+ "CONSTRAINT fk_gc_r_srs_id FOREIGN KEY (srs_id) REFERENCES gpkg_spatial_ref_sys(srs_id))");
		jdbcTemplate.execute("CREATE TABLE gpkg_geometry_columns ("
				+ "table_name TEXT NOT NULL, column_name TEXT NOT NULL, geometry_type_name TEXT NOT NULL, "
				+ "srs_id INTEGER NOT NULL, z TINYINT NOT NULL, m TINYINT NOT NULL, "
				+ "CONSTRAINT pk_geom_cols PRIMARY KEY (table_name, column_name), "
				+ "CONSTRAINT fk_gc_tn FOREIGN KEY (table_name) REFERENCES gpkg_contents(table_name), "
				+ "CONSTRAINT fk_gc_srs FOREIGN KEY (srs_id) REFERENCES gpkg_spatial_ref_sys(srs_id))");

		String srsSql = "INSERT INTO gpkg_spatial_ref_sys "
				+ "(srs_name, srs_id, organization, organization_coordsys_id, definition, description) "
				+ "VALUES (?, ?, ?, ?, ?, ?)";
		jdbcTemplate.update(srsSql, "Undefined cartesian SRS", -1, "NONE", -1, "undefined", "undefined cartesian coordinate reference system");
		jdbcTemplate.update(srsSql, "Undefined geographic SRS", 0, "NONE", 0, "undefined", "undefined geographic coordinate reference system");
		if (epsg != 4326) {
			jdbcTemplate.update(srsSql, "WGS 84 geodetic", 4326, "EPSG", 4326,
					WGS84_WKT, "longitude/latitude coordinates in decimal degrees on the WGS 84 spheroid");
		}
		jdbcTemplate.update(srsSql, projection.getSrsName(), epsg, "EPSG", epsg, projection.getOgcWkt(), null);

		StringBuilder ddl = new StringBuilder("CREATE TABLE ").append(quote(tableName))
				.append(" (").append(quote(fidColumn)).append(" INTEGER PRIMARY KEY AUTOINCREMENT NOT NULL, ")
				.append(quote(geometryColumn)).append(' ').append(geometryTypeName());
		for (Map.Entry<String, PropertyType> property : schema.getProperties().entrySet()) {
			ddl.append(", ").append(quote(property.getKey())).append(' ').append(property.getValue().getSqlType());
		}
		ddl.append(')');
		jdbcTemplate.execute(ddl.toString());

		jdbcTemplate.update("INSERT INTO gpkg_contents (table_name, data_type, identifier, srs_id) VALUES (?, 'features', ?, ?)",
				tableName, tableName, epsg);
		jdbcTemplate.update("INSERT INTO gpkg_geometry_columns (table_name, column_name, geometry_type_name, srs_id, z, m) "
				+ "VALUES (?, ?, ?, ?, ?, 0)", tableName, geometryColumn, geometryTypeName(), epsg, schema.is3D() ? 1 : 0);
	}

	private String geometryTypeName() {
		if (schema.getGeometryType() == null) {
			return "GEOMETRY";
		}
		return MultiGeometryTypes.baseType(schema.getGeometryType()).toUpperCase(Locale.ROOT);
	}

	private String buildInsertSql() {
		StringBuilder columns = new StringBuilder(quote(geometryColumn));
		StringBuilder values = new StringBuilder("?");
		for (String property : schema.getProperties().keySet()) {
			columns.append(", ").append(quote(property));
			values.append(", ?");
		}
		return "INSERT INTO " + quote(tableName) + " (" + columns + ") VALUES (" + values + ")";
	}

	/**
	 * Returns {@code base}, or {@code base_1}, {@code base_2} and so on when a property or the other
	 * reserved column already uses the name. SQLite compares identifiers without regard to case.
	 */
	static String uniqueColumnName(String base, Set<String> properties, String reserved) {
		Set<String> taken = new HashSet<>();
		for (String property : properties) {
			taken.add(property.toLowerCase(Locale.ROOT));
		}
		if (reserved != null) {
			taken.add(reserved.toLowerCase(Locale.ROOT));
		}
		String candidate = base;
		int suffix = 0;
		while (taken.contains(candidate.toLowerCase(Locale.ROOT))) {
			candidate = base + "_" + (++suffix);
		}
		return candidate;
	}

	private static String quote(String identifier) {
		return '"' + identifier.replace("\"", "\"\"") + '"';
	}

	/* ================= Features ================= */

	@Override
	public void write(Feature feature) throws IOException {
		Object[] row = new Object[schema.getProperties().size() + 1];
		row[0] = encode(converter.toJts(feature.getGeometry()));
		int i = 1;
		for (Map.Entry<String, PropertyType> property : schema.getProperties().entrySet()) {
			row[i++] = property.getValue().coerce(feature.getProperties().get(property.getKey()));
		}
		pending.add(row);
		featureCount++;
		if (pending.size() >= BATCH_SIZE) {
			flushPending();
		}
	}

	private void flushPending() throws IOException {
		if (pending.isEmpty()) {
			return;
		}
		try {
			jdbcTemplate.batchUpdate(insertSql, pending);
		} catch (DataAccessException e) {
			throw new IOException("Failed to insert features into " + tableName, e);
		}
		pending.clear();
	}

	/**
	 * GeoPackage binary: {@code GP} header with srs id and xy envelope, followed by WKB.
	 */
	byte[] encode(Geometry geometry) {
		if (geometry == null) {
			return null;
		}
		boolean empty = geometry.isEmpty();
		byte[] wkb = wkbWriter.write(geometry);
		int envelopeBytes = empty ? 0 : 32;
		ByteBuffer buffer = ByteBuffer.allocate(8 + envelopeBytes + wkb.length);
		buffer.put((byte) 'G').put((byte) 'P').put((byte) 0);
		byte flags = (byte) (empty ? 0x11 : 0x03);
		buffer.put(flags);
		buffer.order(ByteOrder.LITTLE_ENDIAN);
		buffer.putInt(epsg);
		if (!empty) {
			Envelope envelope = geometry.getEnvelopeInternal();
			buffer.putDouble(envelope.getMinX()).putDouble(envelope.getMaxX())
					.putDouble(envelope.getMinY()).putDouble(envelope.getMaxY());
			extent.expandToInclude(envelope);
		}
		buffer.put(wkb);
		return buffer.array();
	}

	@Override
	public long getFeatureCount() {
		return featureCount;
	}

	@Override
	public void close() throws IOException {
		try {
			flushPending();
			if (!extent.isNull()) {
				jdbcTemplate.update("UPDATE gpkg_contents SET min_x = ?, min_y = ?, max_x = ?, max_y = ? WHERE table_name = ?",
						extent.getMinX(), extent.getMinY(), extent.getMaxX(), extent.getMaxY(), tableName);
			}
			jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
				connection.commit();
				return null;
			});
			logger.debug("Committed {} features to GeoPackage layer {}", featureCount, tableName);
		} catch (DataAccessException e) {
			throw new IOException("Failed to complete GeoPackage layer " + tableName, e);
		} finally {
			dataSource.destroy();
		}
	}

	private static final String WGS84_WKT = "GEOGCS[\"WGS 84\",DATUM[\"WGS_1984\",SPHEROID[\"WGS 84\",6378137,298.257223563,"
			+ "AUTHORITY[\"EPSG\",\"7030\"]],AUTHORITY[\"EPSG\",\"6326\"]],PRIMEM[\"Greenwich\",0,AUTHORITY[\"EPSG\",\"8901\"]],"
			+ "UNIT[\"degree\",0.0174532925199433,AUTHORITY[\"EPSG\",\"9122\"]],AUTHORITY[\"EPSG\",\"4326\"]]";
}
