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

import temview.lib.images.metadata.MetadataExtractor;
import temview.lib.images.metadata.MetadataFilters;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.images.metadata.MetadataValues;
import temview.lib.io.formats.DmFormatReader;
import temview.lib.io.formats.DmTags;
import temview.lib.io.formats.FormatReaders;

/**
 * Metadata extractor for Gatan Digital Micrograph files.
 * <p>
 * Only the tags of the active image are kept (i.e. the last entry of the image list), with the 
 * {@code ImageList.<n>.ImageTags.} and {@code ImageList.<n>.ImageData.} prefixes removed.
 * The calibration is read from {@code Calibrations.Dimension.1} (X) and {@code Calibrations.Dimension.2} (Y).
 */
public class DmMetadataExtractor implements MetadataExtractor {
	
	private static final Logger logger = LoggerFactory.getLogger(DmMetadataExtractor.class);
	
	/**
	 * Identifier of this extractor.
	 */
	public static final String ID = "dm";
	
	private static final List<String> EXTENSIONS = List.of(".dm3", ".dm4");
	
	private static final String CALIBRATION_X = "Calibrations.Dimension.1.";
	private static final String CALIBRATION_Y = "Calibrations.Dimension.2.";
	
	private final FormatReaders readers;
	
	/**
	 * Create an extractor using the specified readers to decode files.
	 * @param readers
	 */
	public DmMetadataExtractor(FormatReaders readers) {
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
		var tags = readers.getReader(DmFormatReader.class, path).readTags(path);
		return createRecord(tags);
	}
	
	static MetadataRecord createRecord(DmTags tags) {
		String prefixTags = "ImageList." + tags.getNumObjects() + ".ImageTags.";
		String prefixData = "ImageList." + tags.getNumObjects() + ".ImageData.";
		
		Map<String, Object> kept = new LinkedHashMap<>();
		for (var entry : tags.getTags().entrySet()) {
			String key = entry.getKey();
			String sub = stripPrefix(key, prefixTags);
			if (sub == null)
				sub = stripPrefix(key, prefixData);
			if (sub != null && !MetadataFilters.isNoise(sub))
				kept.put(sub, entry.getValue());
		}
		
		var builder = MetadataRecord.builder().putAll(kept);
		try {
			double scaleX = MetadataValues.requireDouble(kept, CALIBRATION_X + "Scale");
			double originX = MetadataValues.requireDouble(kept, CALIBRATION_X + "Origin");
			String unitX = MetadataValues.requireString(kept, CALIBRATION_X + "Units");
			double scaleY = MetadataValues.requireDouble(kept, CALIBRATION_Y + "Scale");
			double originY = MetadataValues.requireDouble(kept, CALIBRATION_Y + "Origin");
			String unitY = MetadataValues.requireString(kept, CALIBRATION_Y + "Units");
			builder.physicalSizeX(scaleX, originX, unitX)
				.physicalSizeY(scaleY, originY, unitY);
		} catch (IllegalArgumentException e) {
			logger.debug("No usable DM calibration: {}", e.getLocalizedMessage());
		}
		return builder.build();
	}
	
	private static String stripPrefix(String key, String prefix) {
		int pos = key.indexOf(prefix);
		return pos < 0 ? null : key.substring(pos + prefix.length());
	}

}
