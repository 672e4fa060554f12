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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import temview.lib.io.formats.SerFile;

/**
 * An open TIA series file.
 * <p>
 * The header and the offset arrays are read when the file is opened; datasets are read on request.
 * All values are little-endian.
 */
class SeriesFile implements SerFile {
	
	static final int BYTE_ORDER = 0x4949;
	static final int SERIES_ID = 0x0197;
	static final int VERSION_LARGE_OFFSETS = 0x0220;
	static final int DATA_TYPE_1D = 0x4120;
	static final int DATA_TYPE_2D = 0x4122;
	
	private final Path path;
	private final FileChannel channel;
	private final Map<String, Object> header;
	private final int dataTypeId;
	private final int nValid;
	private final long[] dataOffsets;
	private final Map<String, Object> emi;
	
	SeriesFile(Path path, Map<String, Object> emi) throws IOException {
		this.path = path;
		this.emi = emi;
		this.channel = FileChannel.open(path, StandardOpenOption.READ);
		try {
			var headerMap = new LinkedHashMap<String, Object>();
			var buffer = read(0, 30);
			int byteOrder = buffer.getShort() & 0xFFFF;
			int seriesId = buffer.getShort() & 0xFFFF;
			int version = buffer.getShort() & 0xFFFF;
			if (byteOrder != BYTE_ORDER)
				throw new IOException(String.format("Invalid SER byte order 0x%04X", byteOrder));
			if (seriesId != SERIES_ID)
				throw new IOException(String.format("Not a TIA series file (series ID 0x%04X)", seriesId));
			boolean largeOffsets = version >= VERSION_LARGE_OFFSETS;
			
			dataTypeId = buffer.getInt();
			int tagTypeId = buffer.getInt();
			int nTotal = buffer.getInt();
			nValid = buffer.getInt();
			if (nTotal < 0 || nValid < 0 || nValid > nTotal)
				throw new IOException(String.format("Invalid number of SER elements (%d valid, %d total)", nValid, nTotal));
			
			long pos = 22;
			long offsetArrayOffset;
			if (largeOffsets) {
				offsetArrayOffset = read(pos, 8).getLong();
				pos += 8;
			} else {
				offsetArrayOffset = read(pos, 4).getInt() & 0xFFFFFFFFL;
				pos += 4;
			}
			int nDims = read(pos, 4).getInt();
			pos += 4;
			if (nDims < 0)
				throw new IOException("Invalid number of SER dimensions " + nDims);
			
			headerMap.put("ByteOrder", byteOrder);
			headerMap.put("SeriesID", seriesId);
			headerMap.put("SeriesVersion", version);
			headerMap.put("DataTypeID", dataTypeId);
			headerMap.put("TagTypeID", tagTypeId);
			headerMap.put("TotalNumberElements", nTotal);
			headerMap.put("ValidNumberElements", nValid);
			headerMap.put("OffsetArrayOffset", offsetArrayOffset);
			headerMap.put("NumberDimensions", nDims);
			
			List<Map<String, Object>> dims = new ArrayList<>();
			for (int d = 0; d < nDims; d++) {
				var dimBuffer = read(pos, 28);
				var dim = new LinkedHashMap<String, Object>();
				dim.put("DimensionSize", dimBuffer.getInt());
				dim.put("CalibrationOffset", dimBuffer.getDouble());
				dim.put("CalibrationDelta", dimBuffer.getDouble());
				dim.put("CalibrationElement", dimBuffer.getInt());
				int descriptionLength = dimBuffer.getInt();
				pos += 28;
				dim.put("Description", readString(pos, descriptionLength));
				pos += descriptionLength;
				int unitsLength = read(pos, 4).getInt();
				pos += 4;
				dim.put("Units", readString(pos, unitsLength));
				pos += unitsLength;
				dims.add(dim);
			}
			headerMap.put("Dimensions", dims);
			header = Collections.unmodifiableMap(headerMap);
			
			int offsetLength = largeOffsets ? 8 : 4;
			var offsets = read(offsetArrayOffset, (long)nTotal * offsetLength);
			dataOffsets = new long[nTotal];
			for (int i = 0; i < nTotal; i++)
				dataOffsets[i] = largeOffsets ? offsets.getLong() : offsets.getInt() & 0xFFFFFFFFL;
		} catch (IOException | RuntimeException e) {
			channel.close();
			throw e;
		}
	}
	
	@Override
	public Map<String, Object> getHeader() {
		return header;
	}

	@Override
	public int getNumberOfDatasets() {
		return nValid;
	}
	
	@SuppressWarnings("unchecked")
	List<Map<String, Object>> getDimensions() {
		return (List<Map<String, Object>>)header.get("Dimensions");
	}

	@Override
	public Map<String, Object> getDatasetMetadata(int index) throws IOException {
		var info = readDatasetInfo(index);
		var map = new LinkedHashMap<String, Object>();
		map.put("Calibration", List.of(info.calibrationX, info.calibrationY));
		map.put("DataType", info.dataType);
		map.put("ArraySize", List.of(info.width, info.height));
		return map;
	}
	
	/**
	 * Read the pixels of a 2D dataset, in row-major order.
	 * @param index
	 * @return
	 * @throws IOException
	 */
	double[] readDatasetPixels(int index) throws IOException {
		var info = readDatasetInfo(index);
		return readPixels(info);
	}
	
	DatasetInfo readDatasetInfo(int index) throws IOException {
		if (dataTypeId != DATA_TYPE_2D)
			throw new IOException(String.format("Only 2-D SER data is supported (data type ID 0x%04X)", dataTypeId));
		if (index < 0 || index >= nValid)
			throw new IOException("SER dataset " + index + " does not exist (" + nValid + " valid datasets)");
		
		long offset = dataOffsets[index];
		var buffer = read(offset, 50);
		var calX = new LinkedHashMap<String, Object>();
		calX.put("CalibrationOffset", buffer.getDouble());
		calX.put("CalibrationDelta", buffer.getDouble());
		calX.put("CalibrationElement", buffer.getInt());
		var calY = new LinkedHashMap<String, Object>();
		calY.put("CalibrationOffset", buffer.getDouble());
		calY.put("CalibrationDelta", buffer.getDouble());
		calY.put("CalibrationElement", buffer.getInt());
		int dataType = buffer.getShort();
		int width = buffer.getInt();
		int height = buffer.getInt();
		if (width < 0 || height < 0)
			throw new IOException(String.format("Invalid SER image size %d x %d", width, height));
		var info = new DatasetInfo(calX, calY, dataType, width, height, offset + 50);
		long available = channel.size() - info.dataOffset;
		if (info.getByteCount() > available)
			throw new IOException(String.format("SER image %d (%d x %d) needs %d bytes, but only %d are available",
					index, width, height, info.getByteCount(), Math.max(0, available)));
		return info;
	}
	
	private double[] readPixels(DatasetInfo info) throws IOException {
		var buffer = read(info.dataOffset, info.getByteCount());
		int n = info.width * info.height;
		double[] data = new double[n];
		for (int i = 0; i < n; i++) {
			switch (info.dataType) {
			case 1:
				data[i] = buffer.get() & 0xFF;
				break;
			case 2:
				data[i] = buffer.getShort() & 0xFFFF;
				break;
			case 3:
				data[i] = buffer.getInt() & 0xFFFFFFFFL;
				break;
			case 4:
				data[i] = buffer.get();
				break;
			case 5:
				data[i] = buffer.getShort();
				break;
			case 6:
				data[i] = buffer.getInt();
				break;
			case 7:
				data[i] = buffer.getFloat();
				break;
			case 8:
				data[i] = buffer.getDouble();
				break;
			default:
				throw new IOException("Unsupported SER data type " + info.dataType);
			}
		}
		return data;
	}
	
	static int bytesPerValue(int dataType) throws IOException {
		switch (dataType) {
		case 1:
		case 4:
			return 1;
		case 2:
		case 5:
			return 2;
		case 3:
		case 6:
		case 7:
			return 4;
		case 8:
			return 8;
		default:
			throw new IOException("Unsupported SER data type " + dataType);
		}
	}

	@Override
	public Optional<Map<String, Object>> getEmi() {
		return Optional.ofNullable(emi);
	}
	
	Path getPath() {
		return path;
	}
	
	private String readString(long position, int length) throws IOException {
		if (length < 0)
			throw new IOException("Invalid SER string length " + length);
		var buffer = read(position, length);
		return new String(buffer.array(), 0, length, StandardCharsets.ISO_8859_1);
	}
	
	/**
	 * Read bytes at a position given by the file. The length is checked against the file size before allocating.
	 */
	private ByteBuffer read(long position, long length) throws IOException {
		long fileSize = channel.size();
		if (position < 0 || length > fileSize - position || length > Integer.MAX_VALUE)
			throw new IOException(String.format("SER file requests %d bytes at offset %d, which exceeds the file size (%d bytes)",
					length, position, fileSize));
		var buffer = ByteBuffer.allocate((int)length);
		long pos = position;
		while (buffer.hasRemaining()) {
			int n = channel.read(buffer, pos);
			if (n < 0)
				throw new IOException(String.format("Unexpected end of SER file: expected %d bytes at offset %d", length, position));
			pos += n;
		}
		buffer.flip();
		return buffer.order(ByteOrder.LITTLE_ENDIAN);
	}

	@Override
	public void close() throws IOException {
		channel.close();
	}
	
	static class DatasetInfo {
		
		final Map<String, Object> calibrationX;
		final Map<String, Object> calibrationY;
		final int dataType;
		final int width;
		final int height;
		final long dataOffset;
		
		private DatasetInfo(Map<String, Object> calibrationX, Map<String, Object> calibrationY, int dataType, int width, int height, long dataOffset) {
			this.calibrationX = calibrationX;
			this.calibrationY = calibrationY;
			this.dataType = dataType;
			this.width = width;
			this.height = height;
			this.dataOffset = dataOffset;
		}
		
		long getByteCount() throws IOException {
			return (long)width * height * bytesPerValue(dataType);
		}
		
	}

}
