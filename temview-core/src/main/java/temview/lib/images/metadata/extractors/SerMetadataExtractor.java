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

package temview.lib.images.metadata.extractors;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.images.calibration.PhysicalUnits;
import temview.lib.images.metadata.MetadataExtractor;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.images.metadata.MetadataValues;
import temview.lib.io.formats.FormatReaders;
import temview.lib.io.formats.SerFile;
import temview.lib.io.formats.SerFormatReader;

/**
 * Metadata extractor for TIA series (SER) files.
 * <p>
 * The record merges the metadata of the first dataset, the companion EMI file (if any) and the file header, in that order.
 * SER calibrations are always in metres.
 */
public class SerMetadataExtractor implements MetadataExtractor {
	
	private static final Logger logger = LoggerFactory.getLogger(SerMetadataExtractor.class);
	
	/**
	 * Identifier of this extractor.
	 */
	public static final String ID = "ser";
	
	private static final List<String> EXTENSIONS = List.of(".ser");
	
	private final FormatReaders readers;
	
	/**
	 * Create an extractor using the specified readers to decode files.
	 * @param readers
	 */
	public SerMetadataExtractor(FormatReaders readers) {
		this.readers = readers;
	}

	@Override
	public String getId() {
		return ID;
	}

	@Override
	public Collection<String> getExtensions() {
		return EXTENSIONS;
	}

	@Override
	public MetadataRecord extract(Path path) throws IOException {
		Map<String, Object> merged = new LinkedHashMap<>();
		try (SerFile ser = readers.getReader(SerFormatReader.class, path).open(path)) {
			merged.putAll(ser.getDatasetMetadata(0));
			ser.getEmi().ifPresent(merged::putAll);
			merged.putAll(ser.getHeader());
		}
		return createRecord(merged);
	}
	
	static MetadataRecord createRecord(Map<String, Object> merged) {
		var builder = MetadataRecord.builder().putAll(merged);
		try {
			var calibration = MetadataValues.requireList(merged.get("Calibration"));
			if (calibration.size() < 2)
				throw new IllegalArgumentException("Expected 2 calibration entries, but found " + calibration.size());
			var calX = MetadataValues.requireMap(calibration.get(0));
			var calY = MetadataValues.requireMap(calibration.get(1));
			builder.physicalSizeX(
						MetadataValues.requireDouble(calX, "CalibrationDelta"),
						MetadataValues.requireDouble(calX, "CalibrationOffset"),
						PhysicalUnits.METER)
				.physicalSizeY(
						MetadataValues.requireDouble(calY, "CalibrationDelta"),
						MetadataValues.requireDouble(calY, "CalibrationOffset"),
						PhysicalUnits.METER);
		} catch (IllegalArgumentException e) {
			logger.debug("No usable SER calibration: {}", e.getLocalizedMessage());
		}
		return builder.build();
	}

}
