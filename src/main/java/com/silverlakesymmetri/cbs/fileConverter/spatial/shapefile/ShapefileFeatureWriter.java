package com.silverlakesymmetri.cbs.fileConverter.spatial.shapefile;

import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import com.silverlakesymmetri.cbs.fileConverter.geometry.JtsGeometryConverter;
import com.silverlakesymmetri.cbs.fileConverter.geometry.MultiGeometryTypes;
import com.silverlakesymmetri.cbs.fileConverter.spatial.Feature;
import com.silverlakesymmetri.cbs.fileConverter.spatial.FeatureSchema;
import com.silverlakesymmetri.cbs.fileConverter.spatial.PropertyType;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialFeatureWriter;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the {@code .shp}, {@code .shx}, {@code .dbf}, {@code .prj} and {@code .cpg} members
 * of an ESRI shapefile. Only 2D shapes are written; Z values are dropped.
 * <p>
 * Main file and index headers carry totals, so they are written as placeholders first and
 * rewritten on {@link #close()}.
 */
public class ShapefileFeatureWriter implements SpatialFeatureWriter {

	static final int FILE_CODE = 9994;
	static final int VERSION = 1000;
	static final int HEADER_BYTES = 100;

	static final int SHAPE_NULL = 0;
	static final int SHAPE_POLYLINE = 3;
	static final int SHAPE_POLYGON = 5;
	static final int SHAPE_MULTIPOINT = 8;

	private final FeatureSchema schema;
	private final int shapeType;
	private final JtsGeometryConverter converter = new JtsGeometryConverter(0);
	private final FileChannel shpChannel;
	private final FileChannel shxChannel;
	private final DbfWriter dbfWriter;
	private final Envelope extent = new Envelope();

	private long shpBytes = HEADER_BYTES;
	private long shxBytes = HEADER_BYTES;
	private int recordNumber;

	public ShapefileFeatureWriter(Path shpPath, FeatureSchema schema, String esriWkt) throws IOException {
		this.schema = schema;
		this.shapeType = shapeTypeFor(schema.getGeometryType());

		Path dir = shpPath.toAbsolutePath().getParent();
		String baseName = stripExtension(shpPath.getFileName().toString());

		FileChannel shp = FileChannel.open(shpPath, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
		FileChannel shx = null;
		DbfWriter dbf = null;
		try {
			shx = FileChannel.open(dir.resolve(baseName + ".shx"), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
			dbf = new DbfWriter(dir.resolve(baseName + ".dbf"), schema.getProperties());

			writeFully(shp, ByteBuffer.allocate(HEADER_BYTES));
			writeFully(shx, ByteBuffer.allocate(HEADER_BYTES));

			Files.write(dir.resolve(baseName + ".prj"), esriWkt.getBytes(StandardCharsets.UTF_8));
			Files.write(dir.resolve(baseName + ".cpg"), "UTF-8".getBytes(StandardCharsets.US_ASCII));
		} catch (IOException | RuntimeException e) {
			closeAfterFailure(e, dbf, shx, shp);
			throw e;
		}
		this.shpChannel = shp;
		this.shxChannel = shx;
		this.dbfWriter = dbf;
	}

	private static void closeAfterFailure(Exception failure, AutoCloseable... resources) {
		for (AutoCloseable resource : resources) {
			if (resource == null) {
				continue;
			}
			try {
				resource.close();
			} catch (Exception e) {
				failure.addSuppressed(e);
			}
		}
	}

	static int shapeTypeFor(String geometryType) {
		if (geometryType == null) {
			throw new SchemaException("Shapefile output needs a geometry type");
		}
		switch (MultiGeometryTypes.baseType(geometryType)) {
			case "Point":
			case "MultiPoint":
				return SHAPE_MULTIPOINT;
			case "LineString":
			case "MultiLineString":
				return SHAPE_POLYLINE;
			case "Polygon":
			case "MultiPolygon":
				return SHAPE_POLYGON;
			default:
				throw new SchemaException("Shapefile cannot store geometry type " + geometryType);
		}
	}

	private static String stripExtension(String fileName) {
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}

	@Override
	public void write(Feature feature) throws IOException {
		Geometry geometry = converter.toJts(feature.getGeometry());
		ByteBuffer content = (geometry == null || geometry.isEmpty()) ? nullShape() : encode(geometry);

		recordNumber++;
		int contentBytes = content.remaining();

		ByteBuffer recordHeader = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
		recordHeader.putInt(recordNumber).putInt(contentBytes / 2).flip();

		ByteBuffer index = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
		index.putInt((int) (shpBytes / 2)).putInt(contentBytes / 2).flip();

		writeFully(shpChannel, recordHeader);
		writeFully(shpChannel, content);
		writeFully(shxChannel, index);
		shpBytes += 8 + contentBytes;
		shxBytes += 8;

		Map<String, Object> attributes = new LinkedHashMap<>();
		for (Map.Entry<String, PropertyType> property : schema.getProperties().entrySet()) {
			attributes.put(property.getKey(), property.getValue().coerce(feature.getProperties().get(property.getKey())));
		}
		dbfWriter.write(attributes);
	}

	private static ByteBuffer nullShape() {
		ByteBuffer buffer = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
		buffer.putInt(SHAPE_NULL).flip();
		return buffer;
	}

	private ByteBuffer encode(Geometry geometry) {
		Envelope envelope = geometry.getEnvelopeInternal();
		extent.expandToInclude(envelope);

		if (shapeType == SHAPE_MULTIPOINT) {
			Coordinate[] points = geometry.getCoordinates();
			ByteBuffer buffer = ByteBuffer.allocate(4 + 32 + 4 + 16 * points.length).order(ByteOrder.LITTLE_ENDIAN);
			buffer.putInt(shapeType);
			putBox(buffer, envelope);
			buffer.putInt(points.length);
			for (Coordinate c : points) {
				buffer.putDouble(c.x).putDouble(c.y);
			}
			buffer.flip();
			return buffer;
		}

		List<Coordinate[]> parts = shapeType == SHAPE_POLYGON ? ringsOf(geometry) : linesOf(geometry);
		int pointCount = 0;
		for (Coordinate[] part : parts) {
			pointCount += part.length;
		}
		ByteBuffer buffer = ByteBuffer.allocate(4 + 32 + 4 + 4 + 4 * parts.size() + 16 * pointCount)
				.order(ByteOrder.LITTLE_ENDIAN);
		buffer.putInt(shapeType);
		putBox(buffer, envelope);
		buffer.putInt(parts.size());
		buffer.putInt(pointCount);
		int start = 0;
		for (Coordinate[] part : parts) {
			buffer.putInt(start);
			start += part.length;
		}
		for (Coordinate[] part : parts) {
			for (Coordinate c : part) {
				buffer.putDouble(c.x).putDouble(c.y);
			}
		}
		buffer.flip();
		return buffer;
	}

	private static List<Coordinate[]> linesOf(Geometry geometry) {
		List<Coordinate[]> parts = new ArrayList<>();
		for (int i = 0; i < geometry.getNumGeometries(); i++) {
			Geometry line = geometry.getGeometryN(i);
			if (!line.isEmpty()) {
				parts.add(line.getCoordinates());
			}
		}
		return parts;
	}

	/**
	 * Outer rings clockwise, holes counter-clockwise.
	 */
	private static List<Coordinate[]> ringsOf(Geometry geometry) {
		List<Coordinate[]> parts = new ArrayList<>();
		for (int i = 0; i < geometry.getNumGeometries(); i++) {
			Geometry member = geometry.getGeometryN(i);
			if (!(member instanceof Polygon)) {
				throw new SchemaException("Expected polygon geometry but found " + member.getGeometryType());
			}
			Polygon polygon = (Polygon) member;
			if (polygon.isEmpty()) {
				continue;
			}
			parts.add(oriented(polygon.getExteriorRing().getCoordinates(), false));
			for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
				parts.add(oriented(polygon.getInteriorRingN(h).getCoordinates(), true));
			}
		}
		return parts;
	}

	private static Coordinate[] oriented(Coordinate[] ring, boolean counterClockwise) {
		Coordinate[] copy = ring.clone();
		if (copy.length >= 4 && Orientation.isCCW(copy) != counterClockwise) {
			CoordinateArrays.reverse(copy);
		}
		return copy;
	}

	private static void putBox(ByteBuffer buffer, Envelope envelope) {
		buffer.putDouble(envelope.getMinX()).putDouble(envelope.getMinY())
				.putDouble(envelope.getMaxX()).putDouble(envelope.getMaxY());
	}

	@Override
	public long getFeatureCount() {
		return recordNumber;
	}

	@Override
	public void close() throws IOException {
		try {
			writeFully(shpChannel, header(shpBytes), 0);
			writeFully(shxChannel, header(shxBytes), 0);
		} finally {
			try {
				shpChannel.close();
			} finally {
				try {
					shxChannel.close();
				} finally {
					dbfWriter.close();
				}
			}
		}
	}

	private ByteBuffer header(long fileBytes) {
		ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES);
		header.order(ByteOrder.BIG_ENDIAN);
		header.putInt(FILE_CODE);
		header.put(new byte[20]);
		header.putInt((int) (fileBytes / 2));
		header.order(ByteOrder.LITTLE_ENDIAN);
		header.putInt(VERSION);
		header.putInt(shapeType);
		if (extent.isNull()) {
			header.put(new byte[32]);
		} else {
			putBox(header, extent);
		}
		header.put(new byte[32]); // z and m ranges
		header.flip();
		return header;
	}

	private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
		while (buffer.hasRemaining()) {
			channel.write(buffer);
		}
	}

	private static void writeFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
		long offset = position;
		while (buffer.hasRemaining()) {
			offset += channel.write(buffer, offset);
		}
	}
}
