package com.silverlakesymmetri.cbs.fileConverter.spatial.shapefile;

import com.silverlakesymmetri.cbs.fileConverter.spatial.PropertyType;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * dBase III attribute table of a shapefile. Text is stored as UTF-8 (declared in the
 * {@code .cpg} sidecar). The record count in the header is filled in on {@link #close()}.
 */
class DbfWriter implements AutoCloseable {

	private static final byte VERSION = 0x03;
	private static final byte HEADER_TERMINATOR = 0x0D;
	private static final byte END_OF_FILE = 0x1A;
	private static final int FIELD_NAME_BYTES = 11;

	static final int STRING_LENGTH = 254;
	static final int FLOAT_LENGTH = 24;
	static final int FLOAT_DECIMALS = 15;
	static final int INT_LENGTH = 18;

	private final FileChannel channel;
	private final List<DbfField> fields = new ArrayList<>();
	private final int recordLength;
	private int recordCount;

	DbfWriter(Path path, Map<String, PropertyType> properties) throws IOException {
		int length = 1;
		for (Map.Entry<String, PropertyType> property : properties.entrySet()) {
			DbfField field = new DbfField(property.getKey(), property.getValue());
			fields.add(field);
			length += field.length;
		}
		this.recordLength = length;
		this.channel = FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
		try {
			writeHeader();
		} catch (IOException | RuntimeException e) {
			try {
				channel.close();
			} catch (IOException closeFailure) {
				e.addSuppressed(closeFailure);
			}
			throw e;
		}
	}

	private void writeHeader() throws IOException {
		int headerLength = 32 + 32 * fields.size() + 1;
		ByteBuffer header = ByteBuffer.allocate(headerLength).order(ByteOrder.LITTLE_ENDIAN);
		LocalDate today = LocalDate.now();
		header.put(VERSION);
		header.put((byte) (today.getYear() - 1900));
		header.put((byte) today.getMonthValue());
		header.put((byte) today.getDayOfMonth());
		header.putInt(recordCount);
		header.putShort((short) headerLength);
		header.putShort((short) recordLength);
		header.put(new byte[20]);

		for (DbfField field : fields) {
			byte[] name = Arrays.copyOf(field.name.getBytes(StandardCharsets.US_ASCII), FIELD_NAME_BYTES);
			name[FIELD_NAME_BYTES - 1] = 0;
			header.put(name);
			header.put((byte) field.type);
			header.put(new byte[4]);
			header.put((byte) field.length);
			header.put((byte) field.decimals);
			header.put(new byte[14]);
		}
		header.put(HEADER_TERMINATOR);
		header.flip();
		channel.write(header, 0);
		channel.position(headerLength);
	}

	void write(Map<String, Object> values) throws IOException {
		ByteBuffer record = ByteBuffer.allocate(recordLength);
		record.put((byte) ' ');
		for (DbfField field : fields) {
			record.put(field.encode(values.get(field.name)));
		}
		record.flip();
		while (record.hasRemaining()) {
			channel.write(record);
		}
		recordCount++;
	}

	int getRecordCount() {
		return recordCount;
	}

	@Override
	public void close() throws IOException {
		try {
			channel.write(ByteBuffer.wrap(new byte[]{END_OF_FILE}));
			ByteBuffer count = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
			count.putInt(recordCount).flip();
			channel.write(count, 4);
		} finally {
			channel.close();
		}
	}

	private static final class DbfField {
		final String name;
		final char type;
		final int length;
		final int decimals;

		DbfField(String name, PropertyType propertyType) {
			this.name = name;
			switch (propertyType) {
				case FLOAT:
					type = 'N';
					length = FLOAT_LENGTH;
					decimals = FLOAT_DECIMALS;
					break;
				case INT:
					type = 'N';
					length = INT_LENGTH;
					decimals = 0;
					break;
				default:
					type = 'C';
					length = STRING_LENGTH;
					decimals = 0;
			}
		}

		byte[] encode(Object raw) {
			byte[] cell = new byte[length];
			Arrays.fill(cell, (byte) ' ');
			if (raw == null) {
				return cell;
			}
			if (type == 'C') {
				byte[] text = truncateUtf8(raw.toString(), length);
				System.arraycopy(text, 0, cell, 0, text.length);
			} else {
				byte[] number = formatNumber(raw).getBytes(StandardCharsets.US_ASCII);
				System.arraycopy(number, 0, cell, length - number.length, number.length);
			}
			return cell;
		}

		private String formatNumber(Object raw) {
			if (decimals == 0) {
				return Long.toString(((Number) raw).longValue());
			}
			BigDecimal value = BigDecimal.valueOf(((Number) raw).doubleValue());
			for (int scale = decimals; scale >= 0; scale--) {
				String text = value.setScale(scale, RoundingMode.HALF_UP).toPlainString();
				if (text.length() <= length) {
					return text;
				}
			}
			String scientific = String.format(Locale.ROOT, "%." + (length - 8) + "E", value.doubleValue());
			return scientific.length() <= length ? scientific : scientific.substring(0, length);
		}

		private static byte[] truncateUtf8(String text, int maxBytes) {
			byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
			if (bytes.length <= maxBytes) {
				return bytes;
			}
			int end = maxBytes;
			// back off to a character boundary
			while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
				end--;
			}
			return Arrays.copyOf(bytes, end);
		}
	}
}
