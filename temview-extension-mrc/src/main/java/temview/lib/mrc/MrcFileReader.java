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

package temview.lib.mrc;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.images.arrays.NDArray;
import temview.lib.images.arrays.RawArray;
import temview.lib.io.formats.MrcFormatReader;
import temview.lib.io.formats.MrcHeader;

/**
 * Reader for MRC files (including the ALI and REC files written by tomography software).
 * <p>
 * This supports the MRC2014 header, with byte order given by the machine stamp, and data modes 
 * 0 (8-bit signed), 1 (16-bit signed), 2 (32-bit float) and 6 (16-bit unsigned).
 * Voxel sizes are returned in Ångström, or as unitless pixels where the header gives no size.
 */
public class MrcFileReader implements MrcFormatReader {
	
	private static final Logger logger = LoggerFactory.getLogger(MrcFileReader.class);
	
	/**
	 * Length of the fixed header, in bytes.
	 */
	public static final int HEADER_LENGTH = 1024;
	
	static final int OFFSET_EXTTYP = 104;
	static final int OFFSET_MACHINE_STAMP = 212;
	
	private static final List<String> EXTENSIONS = List.of(".mrc", ".ali", ".rec");
	
	private static final String ANGSTROM = "A";

	@Override
	public String getName() {
		return "MRC reader";
	}

	@Override
	public Collection<String> getExtensions() {
		return EXTENSIONS;
	}

	@Override
	public MrcHeader readHeader(Path path) throws IOException {
		try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
			return readHeader(channel).header;
		}
	}

	@Override
	public RawArray readArray(Path path) throws IOException {
		try (var channel = FileChannel.open(path, StandardOpenOption.READ)) {
			var parsed = readHeader(channel);
			var header = parsed.header;
			int[] dims = header.getDimensions();
			long nValues = (long)dims[0] * dims[1] * dims[2];
			int bytesPerValue = bytesPerValue(header.getMode());
			long nBytes = Math.multiplyExact(nValues, bytesPerValue);
			
			long offset = HEADER_LENGTH + (long)parsed.extendedHeaderLength;
			var buffer = readFully(channel, offset, nBytes).order(parsed.order);
			double[] data = new double[(int)nValues];
			readData(buffer, header.getMode(), data);
			
			var array = new NDArray(new int[] {dims[2], dims[1], dims[0]}, data);
			double[] voxelSizes = {header.getVoxelSizeZ(), header.getVoxelSizeY(), header.getVoxelSizeX()};
			String[] units = new String[3];
			for (int i = 0; i < 3; i++) {
				// Non-positive sizes mean the axis is not calibrated
				if (voxelSizes[i] > 0)
					units[i] = ANGSTROM;
				else {
					voxelSizes[i] = 1.0;
					units[i] = "";
				}
			}
			return new RawArray(array, voxelSizes, units);
		}
	}
	
	private static ParsedHeader readHeader(FileChannel channel) throws IOException {
		var buffer = readFully(channel, 0, HEADER_LENGTH);
		var order = getByteOrder(buffer);
		buffer.order(order);
		
		int nx = buffer.getInt(0);
		int ny = buffer.getInt(4);
		int nz = buffer.getInt(8);
		int mode = buffer.getInt(12);
		if (nx < 0 || ny < 0 || nz < 0)
			throw new IOException(String.format("Invalid MRC dimensions %d x %d x %d", nx, ny, nz));
		
		int mx = buffer.getInt(28);
		int my = buffer.getInt(32);
		int mz = buffer.getInt(36);
		float xlen = buffer.getFloat(40);
		float ylen = buffer.getFloat(44);
		float zlen = buffer.getFloat(48);
		
		int nsymbt = buffer.getInt(92);
		if (nsymbt < 0)
			throw new IOException("Invalid MRC extended header length " + nsymbt);
		String exttyp = readString(buffer, OFFSET_EXTTYP, 4);
		
		var builder = new MrcHeader.Builder()
				.dimensions(nx, ny, nz)
				.mode(mode)
				.voxelSize(voxelSize(xlen, mx), voxelSize(ylen, my), voxelSize(zlen, mz))
				.cellAngles(buffer.getFloat(52), buffer.getFloat(56), buffer.getFloat(60))
				.axisOrientations(buffer.getInt(64), buffer.getInt(68), buffer.getInt(72))
				.extendedHeaderType(exttyp);
		
		if (nsymbt > 0 && FeiExtendedHeader.isFeiType(exttyp)) {
			var extended = readFully(channel, HEADER_LENGTH, nsymbt).order(order);
			builder.vendorInfo(FeiExtendedHeader.parse(extended, exttyp));
		} else if (nsymbt > 0)
			logger.debug("Skipping extended header of type '{}' ({} bytes)", exttyp, nsymbt);
		
		return new ParsedHeader(builder.build(), order, nsymbt);
	}
	
	static ByteOrder getByteOrder(ByteBuffer header) {
		byte stamp = header.get(OFFSET_MACHINE_STAMP);
		if (stamp == 0x11)
			return ByteOrder.BIG_ENDIAN;
		if (stamp != 0x44 && stamp != 0x41)
			logger.debug("Unknown machine stamp {}, assuming little-endian", stamp);
		return ByteOrder.LITTLE_ENDIAN;
	}
	
	private static double voxelSize(float length, int sampling) {
		if (sampling <= 0 || !Float.isFinite(length))
			return 0;
		return length / (double)sampling;
	}
	
	static int bytesPerValue(int mode) throws IOException {
		switch (mode) {
		case 0:
			return 1;
		case 1:
		case 6:
			return 2;
		case 2:
			return 4;
		default:
			throw new IOException("Unsupported MRC mode " + mode);
		}
	}
	
	private static void readData(ByteBuffer buffer, int mode, double[] data) {
		int n = data.length;
		switch (mode) {
		case 0:
			for (int i = 0; i < n; i++)
				data[i] = buffer.get();
			break;
		case 1:
			for (int i = 0; i < n; i++)
				data[i] = buffer.getShort();
			break;
		case 6:
			for (int i = 0; i < n; i++)
				data[i] = buffer.getShort() & 0xFFFF;
			break;
		case 2:
			for (int i = 0; i < n; i++)
				data[i] = buffer.getFloat();
			break;
		default:
			throw new IllegalArgumentException("Unsupported MRC mode " + mode);
		}
	}
	
	/**
	 * Read bytes at a position given by the header. The length is checked against the file size first, 
	 * so that a corrupt header cannot request a buffer larger than the file.
	 */
	private static ByteBuffer readFully(FileChannel channel, long position, long length) throws IOException {
		long fileSize = channel.size();
		if (length > fileSize - position || length > Integer.MAX_VALUE)
			throw new IOException(String.format("MRC header requests %d bytes at offset %d, which exceeds the file size (%d bytes)",
					length, position, fileSize));
		var buffer = ByteBuffer.allocate((int)length);
		long pos = position;
		while (buffer.hasRemaining()) {
			int n = channel.read(buffer, pos);
			if (n < 0)
				throw new IOException(String.format("Unexpected end of file: expected %d bytes at offset %d, but only %d available",
						length, position, buffer.position()));
			pos += n;
		}
		buffer.flip();
		return buffer;
	}
	
	static String readString(ByteBuffer buffer, int offset, int length) {
		byte[] bytes = new byte[length];
		buffer.get(offset, bytes);
		int n = length;
		while (n > 0 && (bytes[n-1] == 0 || bytes[n-1] == ' '))
			n--;
		return new String(bytes, 0, n, StandardCharsets.US_ASCII);
	}
	
	private static class ParsedHeader {
		
		private final MrcHeader header;
		private final ByteOrder order;
		private final int extendedHeaderLength;
		
		private ParsedHeader(MrcHeader header, ByteOrder order, int extendedHeaderLength) {
			this.header = header;
			this.order = order;
			this.extendedHeaderLength = extendedHeaderLength;
		}
		
	}

}
