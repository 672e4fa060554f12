/*-
 * #%L
 * This file is part of TemView.
 * %%
 * Copyright (C) 2023 - 2024 TemView developers
 * %%
 * TemView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TemView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TemView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package temview.lib.tia;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writer for small TIA series files used in tests.
 */
class SerTestFiles {
	
	private static class Dimension {
		
		private final int size;
		private final double offset;
		private final double delta;
		private final String description;
		private final String units;
		
		private Dimension(int size, double offset, double delta, String description, String units) {
			this.size = size;
			this.offset = offset;
			this.delta = delta;
			this.description = description;
			this.units = units;
		}
		
	}
	
	private static class Image {
		
		private final int width;
		private final int height;
		private final int dataType;
		private final double[] calibrationX;
		private final double[] calibrationY;
		private final double[] values;
		
		private Image(int width, int height, int dataType, double[] calibrationX, double[] calibrationY, double[] values) {
			this.width = width;
			this.height = height;
			this.dataType = dataType;
			this.calibrationX = calibrationX;
			this.calibrationY = calibrationY;
			this.values = values;
		}
		
	}
	
	private int version = 0x0210;
	private int dataTypeId = SeriesFile.DATA_TYPE_2D;
	private final List<Dimension> dimensions = new ArrayList<>();
	private final List<Image> images = new ArrayList<>();
	private final Map<Integer, Integer> headerOverrides = new LinkedHashMap<>();
	
	SerTestFiles largeOffsets() {
		this.version = SeriesFile.VERSION_LARGE_OFFSETS;
		return this;
	}
	
	SerTestFiles dataTypeId(int id) {
		this.dataTypeId = id;
		return this;
	}
	
	SerTestFiles dimension(int size, double offset, double delta, String description, String units) {
		dimensions.add(new Dimension(size, offset, delta, description, units));
		return this;
	}
	
	/**
	 * Replace a 32-bit value in the header after it has been written, e.g. to declare more images than the file has.
	 */
	SerTestFiles headerInt(int offset, int value) {
		headerOverrides.put(offset, value);
		return this;
	}
	
	/**
	 * Add an image with calibration {offset, delta} along each axis.
	 */
	SerTestFiles image(int width, int height, int dataType, double[] calibrationX, double[] calibrationY, double... values) {
		images.add(new Image(width, height, dataType, calibrationX, calibrationY, values));
		return this;
	}
	
	/**
	 * Add a float image with pixel values 0, 1, 2...
	 */
	SerTestFiles image(int width, int height, double pixelSize) {
		double[] values = new double[width * height];
		for (int i = 0; i < values.length; i++)
			values[i] = i + images.size() * 100;
		return image(width, height, 7, new double[] {0, pixelSize}, new double[] {0, pixelSize}, values);
	}
	
	byte[] toBytes() {
		boolean large = version >= SeriesFile.VERSION_LARGE_OFFSETS;
		int offsetLength = large ? 8 : 4;
		
		var out = new ByteArrayOutputStream();
		var header = allocate(22);
		header.putShort((short)SeriesFile.BYTE_ORDER);
		header.putShort((short)SeriesFile.SERIES_ID);
		header.putShort((short)version);
		header.putInt(dataTypeId);
		header.putInt(0x4152);
		header.putInt(images.size());
		header.putInt(images.size());
		out.writeBytes(header.array());
		
		var dims = new ByteArrayOutputStream();
		dims.writeBytes(allocate(4).putInt(dimensions.size()).array());
		for (var dim : dimensions) {
			byte[] description = dim.description.getBytes(StandardCharsets.ISO_8859_1);
			byte[] units = dim.units.getBytes(StandardCharsets.ISO_8859_1);
			var buffer = allocate(28);
			buffer.putInt(dim.size);
			buffer.putDouble(dim.offset);
			buffer.putDouble(dim.delta);
			buffer.putInt(0);
			buffer.putInt(description.length);
			dims.writeBytes(buffer.array());
			dims.writeBytes(description);
			dims.writeBytes(allocate(4).putInt(units.length).array());
			dims.writeBytes(units);
		}
		
		long offsetArrayOffset = 22 + offsetLength + dims.size();
		long dataStart = offsetArrayOffset + 2L * images.size() * offsetLength;
		out.writeBytes(writeOffset(offsetArrayOffset, large));
		out.writeBytes(dims.toByteArray());
		
		var data = new ByteArrayOutputStream();
		var offsets = new ByteArrayOutputStream();
		for (var image : images) {
			offsets.writeBytes(writeOffset(dataStart + data.size(), large));
			var buffer = allocate(50 + image.values.length * bytesPerValue(image.dataType));
			buffer.putDouble(image.calibrationX[0]);
			buffer.putDouble(image.calibrationX[1]);
			buffer.putInt(0);
			buffer.putDouble(image.calibrationY[0]);
			buffer.putDouble(image.calibrationY[1]);
			buffer.putInt(0);
			buffer.putShort((short)image.dataType);
			buffer.putInt(image.width);
			buffer.putInt(image.height);
			for (double v : image.values)
				putValue(buffer, image.dataType, v);
			data.writeBytes(buffer.array());
		}
		// Tag offsets are not read
		for (int i = 0; i < images.size(); i++)
			offsets.writeBytes(writeOffset(0, large));
		
		out.writeBytes(offsets.toByteArray());
		out.writeBytes(data.toByteArray());
		var bytes = ByteBuffer.wrap(out.toByteArray()).order(ByteOrder.LITTLE_ENDIAN);
		for (var entry : headerOverrides.entrySet())
			bytes.putInt(entry.getKey(), entry.getValue());
		return bytes.array();
	}
	
	Path write(Path path) throws IOException {
		return Files.write(path, toBytes());
	}
	
	/**
	 * Write a minimal EMI file, with the XML enclosed in binary padding.
	 */
	static Path writeEmi(Path path, String objectInfoContent) throws IOException {
		var out = new ByteArrayOutputStream();
		out.writeBytes(new byte[] {0x4A, 0x00, 0x01, (byte)0xFF, 0x10});
		out.writeBytes(("<ObjectInfo>" + objectInfoContent + "</ObjectInfo>").getBytes(StandardCharsets.ISO_8859_1));
		out.writeBytes(new byte[] {0x00, 0x00, 0x7F});
		return Files.write(path, out.toByteArray());
	}
	
	private static int bytesPerValue(int dataType) {
		switch (dataType) {
		case 1:
		case 4:
			return 1;
		case 2:
		case 5:
			return 2;
		case 8:
			return 8;
		default:
			return 4;
		}
	}
	
	private static void putValue(ByteBuffer buffer, int dataType, double v) {
		switch (dataType) {
		case 1:
		case 4:
			buffer.put((byte)(int)v);
			break;
		case 2:
		case 5:
			buffer.putShort((short)(int)v);
			break;
		case 3:
		case 6:
			buffer.putInt((int)(long)v);
			break;
		case 8:
			buffer.putDouble(v);
			break;
		default:
			buffer.putFloat((float)v);
		}
	}
	
	private static byte[] writeOffset(long offset, boolean large) {
		if (large)
			return allocate(8).putLong(offset).array();
		return allocate(4).putInt((int)offset).array();
	}
	
	private static ByteBuffer allocate(int n) {
		return ByteBuffer.allocate(n).order(ByteOrder.LITTLE_ENDIAN);
	}

}
