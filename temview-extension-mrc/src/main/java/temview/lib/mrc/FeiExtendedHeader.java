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

import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for the FEI1 and FEI2 extended headers written by Thermo Fisher acquisition software.
 * <p>
 * The extended header contains one block per section. Only the first block is read, since the values 
 * that vary between sections (e.g. the tilt angle) are of little use when summarizing a file.
 */
class FeiExtendedHeader {
	
	private static final Logger logger = LoggerFactory.getLogger(FeiExtendedHeader.class);
	
	private enum FieldType { INT, DOUBLE, TEXT }
	
	private static class Field {
		
		private final String name;
		private final int offset;
		private final FieldType type;
		
		private Field(String name, int offset, FieldType type) {
			this.name = name;
			this.offset = offset;
			this.type = type;
		}
		
		private int length() {
			switch (type) {
			case INT:
				return 4;
			case DOUBLE:
				return 8;
			case TEXT:
			default:
				return 16;
			}
		}
		
	}
	
	private static final Field[] FIELDS = {
			new Field("Metadata size", 0, FieldType.INT),
			new Field("Metadata version", 4, FieldType.INT),
			new Field("Timestamp", 12, FieldType.DOUBLE),
			new Field("Microscope type", 20, FieldType.TEXT),
			new Field("D-Number", 36, FieldType.TEXT),
			new Field("Application", 52, FieldType.TEXT),
			new Field("Application version", 68, FieldType.TEXT),
			new Field("HT", 84, FieldType.DOUBLE),
			new Field("Dose", 92, FieldType.DOUBLE),
			new Field("Alpha tilt", 100, FieldType.DOUBLE),
			new Field("Beta tilt", 108, FieldType.DOUBLE),
			new Field("X-Stage", 116, FieldType.DOUBLE),
			new Field("Y-Stage", 124, FieldType.DOUBLE),
			new Field("Z-Stage", 132, FieldType.DOUBLE),
			new Field("Tilt axis angle", 140, FieldType.DOUBLE),
			new Field("Dual axis rotation", 148, FieldType.DOUBLE),
			new Field("Pixel size X", 156, FieldType.DOUBLE),
			new Field("Pixel size Y", 164, FieldType.DOUBLE)
	};
	
	static boolean isFeiType(String exttyp) {
		return "FEI1".equals(exttyp) || "FEI2".equals(exttyp);
	}
	
	/**
	 * Parse the first block of an extended header.
	 * Fields beyond the end of the buffer are omitted.
	 * @param buffer buffer containing the extended header, with the byte order of the file
	 * @param exttyp the extended header type
	 * @return map of field names to values
	 */
	static Map<String, Object> parse(ByteBuffer buffer, String exttyp) {
		Map<String, Object> info = new LinkedHashMap<>();
		info.put("Extended header type", exttyp);
		for (var field : FIELDS) {
			if (field.offset + field.length() > buffer.limit()) {
				logger.debug("{} extended header ends before field '{}'", exttyp, field.name);
				break;
			}
			switch (field.type) {
			case INT:
				info.put(field.name, buffer.getInt(field.offset));
				break;
			case DOUBLE:
				info.put(field.name, buffer.getDouble(field.offset));
				break;
			case TEXT:
				info.put(field.name, MrcFileReader.readString(buffer, field.offset, field.length()));
				break;
			}
		}
		return info;
	}

}
