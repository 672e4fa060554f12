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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import temview.lib.images.metadata.MetadataExtractor;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.images.metadata.MetadataValues;
import temview.lib.io.formats.EmdDimension;
import temview.lib.io.formats.EmdFile;
import temview.lib.io.formats.EmdFormatReader;
import temview.lib.io.formats.FormatReaders;

/**
 * Metadata extractor for EMD files.
 * <p>
 * Two variants share the extension:
 * <ul>
 * <li><b>Berkeley EMD</b> files list named datasets, with a numeric dimension vector per axis. 
 * The calibration is derived from the first dataset: the spacing of the first two values is the scale, 
 * the first value is the origin.</li>
 * <li><b>Velox EMD</b> files embed a JSON document as bytes alongside each dataset. 
 * The calibration is read from its {@code BinaryResult} object.</li>
 * </ul>
 */
public class EmdMetadataExtractor implements MetadataExtractor {
	
	private static final Logger logger = LoggerFactory.getLogger(EmdMetadataExtractor.class);
	
	/**
	 * Identifier of this extractor.
	 */
	public static final String ID = "emd";
	
	private static final List<String> EXTENSIONS = List.of(".emd");
	
	private final FormatReaders readers;
	
	/**
	 * Create an extractor using the specified readers to decode files.
	 * @param readers
	 */
	public EmdMetadataExtractor(FormatReaders readers) {
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
		try (EmdFile file = readers.getReader(EmdFormatReader.class, path).open(path)) {
			if (!file.getDatasetNames().isEmpty())
				return createBerkeleyRecord(file);
			return createVeloxRecord(file);
		}
	}
	
	static MetadataRecord createBerkeleyRecord(EmdFile file) throws IOException {
		var builder = MetadataRecord.builder()
				.putAll(file.getUserAttributes())
				.putAll(file.getMicroscopeAttributes())
				.putAll(file.getSampleAttributes());
		
		var dims = file.getDimensions(file.getDatasetNames().get(0));
		int n = dims.size();
		if (n >= 2) {
			setCalibration(builder, dims.get(n-1), true);
			setCalibration(builder, dims.get(n-2), false);
		} else
			logger.debug("Expected at least 2 dimensions, but found {}", n);
		return builder.build();
	}
	
	private static void setCalibration(MetadataRecord.Builder builder, EmdDimension dim, boolean isX) {
		if (dim.size() < 2) {
			logger.debug("Dimension {} has too few values to determine a pixel size", dim.getName());
			return;
		}
		double origin = dim.getValue(0);
		double scale = dim.getValue(1) - origin;
		String unit = dim.getUnits().replace("_", "");
		if (isX)
			builder.physicalSizeX(scale, origin, unit);
		else
			builder.physicalSizeY(scale, origin, unit);
	}
	
	static MetadataRecord createVeloxRecord(EmdFile file) throws IOException {
		var data = file.getVeloxData();
		if (data.isEmpty())
			throw new IOException("EMD file contains no datasets");
		var first = data.get(0);
		
		Map<String, Object> flat = new LinkedHashMap<>();
		try {
			var json = decodeJson(first.getMetadata());
			for (var entry : json.entrySet())
				MetadataValues.flatten(entry.getKey(), toJava(entry.getValue()), flat);
		} catch (JsonParseException | IllegalStateException e) {
			logger.warn("Unable to parse Velox metadata: {}", e.getLocalizedMessage());
		}
		
		var builder = MetadataRecord.builder().putAll(flat);
		try {
			double scaleX = MetadataValues.requireDouble(flat, "BinaryResult.PixelSize.width");
			double originX = MetadataValues.requireDouble(flat, "BinaryResult.Offset.x");
			String unitX = MetadataValues.requireString(flat, "BinaryResult.PixelUnitX");
			double scaleY = MetadataValues.requireDouble(flat, "BinaryResult.PixelSize.height");
			double originY = MetadataValues.requireDouble(flat, "BinaryResult.Offset.y");
			String unitY = MetadataValues.requireString(flat, "BinaryResult.PixelUnitY");
			builder.physicalSizeX(scaleX, originX, unitX)
				.physicalSizeY(scaleY, originY, unitY);
		} catch (IllegalArgumentException e) {
			logger.debug("No usable Velox calibration: {}", e.getLocalizedMessage());
		}
		builder.put("shape", first.getShape());
		return builder.build();
	}
	
	/**
	 * Decode the JSON object stored in Velox metadata, ignoring the zero bytes used for padding.
	 * @param bytes
	 * @return
	 * @throws JsonParseException if the text is not valid JSON
	 * @throws IllegalStateException if the JSON is not an object
	 */
	static JsonObject decodeJson(byte[] bytes) throws JsonParseException, IllegalStateException {
		var stream = new ByteArrayOutputStream(bytes.length);
		for (byte b : bytes) {
			if (b != 0)
				stream.write(b);
		}
		String text = new String(stream.toByteArray(), StandardCharsets.UTF_8);
		return JsonParser.parseString(text).getAsJsonObject();
	}
	
	private static Object toJava(JsonElement element) {
		if (element == null || element.isJsonNull())
			return null;
		if (element.isJsonObject()) {
			Map<String, Object> map = new LinkedHashMap<>();
			for (var entry : ((JsonObject)element).entrySet())
				map.put(entry.getKey(), toJava(entry.getValue()));
			return map;
		}
		if (element.isJsonArray()) {
			List<Object> list = new ArrayList<>();
			for (var item : (JsonArray)element)
				list.add(toJava(item));
			return list;
		}
		JsonPrimitive primitive = element.getAsJsonPrimitive();
		if (primitive.isBoolean())
			return primitive.getAsBoolean();
		if (primitive.isNumber())
			return primitive.getAsDouble();
		return primitive.getAsString();
	}

}
