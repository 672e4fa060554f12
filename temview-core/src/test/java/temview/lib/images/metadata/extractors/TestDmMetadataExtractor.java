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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import temview.lib.images.calibration.AxisCalibration;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.io.formats.DmTags;
import temview.lib.io.formats.FakeFormatReaders.FakeDmReader;
import temview.lib.io.formats.FormatReaders;

@SuppressWarnings("javadoc")
public class TestDmMetadataExtractor {
	
	private static Map<String, Object> createTags() {
		Map<String, Object> tags = new LinkedHashMap<>();
		// Thumbnail entry, which should be ignored
		tags.put("ImageList.1.ImageTags.Microscope Info.Voltage", 80000.0);
		tags.put("ImageList.2.ImageTags.Microscope Info.Voltage", 300000.0);
		tags.put("ImageList.2.ImageTags.Microscope Info.Private.Serial", "ABC");
		tags.put("ImageList.2.ImageTags.Acquisition.Frame.Intensity.Range", 12.0);
		tags.put("ImageList.2.ImageTags.DataBar.Device.Parameters.Gain", 4.0);
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.1.Scale", 0.25);
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.1.Origin", 8.0);
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.1.Units", "nm");
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.2.Scale", 0.5);
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.2.Origin", -4.0);
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.2.Units", "µm");
		tags.put("DocumentObjectList.0.AnnotationType", 20);
		return tags;
	}
	
	@Test
	public void test_activeImageTags() {
		var record = DmMetadataExtractor.createRecord(new DmTags(createTags(), 2));
		assertEquals(300000.0, record.get("Microscope Info.Voltage"));
		assertEquals(0.25, record.get("Calibrations.Dimension.1.Scale"));
		assertFalse(record.containsKey("AnnotationType"));
		assertFalse(record.keySet().stream().anyMatch(k -> k.startsWith("ImageList")));
		assertFalse(record.keySet().stream().anyMatch(k -> k.startsWith("DocumentObjectList")));
	}
	
	@Test
	public void test_noiseRemoved() {
		var record = DmMetadataExtractor.createRecord(new DmTags(createTags(), 2));
		for (var key : record.keySet()) {
			assertFalse(key.contains("Private"), key);
			assertFalse(key.contains("Frame.Intensity"), key);
			assertFalse(key.contains("Device.Parameters"), key);
		}
	}
	
	@Test
	public void test_calibration() {
		var record = DmMetadataExtractor.createRecord(new DmTags(createTags(), 2));
		assertEquals(0.25e-9, record.getPhysicalSizeX(), 1e-21);
		assertEquals(8.0e-9, record.getPhysicalSizeXOrigin(), 1e-21);
		assertEquals("m", record.getPhysicalSizeXUnit());
		assertEquals(0.5e-6, record.getPhysicalSizeY(), 1e-18);
		assertEquals(-4.0e-6, record.getPhysicalSizeYOrigin(), 1e-18);
		assertEquals("m", record.getPhysicalSizeYUnit());
	}
	
	@Test
	public void test_zeroOrigin() {
		var tags = createTags();
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.1.Origin", 0.0);
		var record = DmMetadataExtractor.createRecord(new DmTags(tags, 2));
		assertEquals(0.0, record.getPhysicalSizeXOrigin());
		assertEquals(0.0, record.getCalibrationX().getOrigin());
		assertEquals(AxisCalibration.createMeters(0.25e-9, 0.0), record.getCalibrationX());
	}
	
	@Test
	public void test_missingCalibration() {
		var tags = createTags();
		tags.remove("ImageList.2.ImageData.Calibrations.Dimension.2.Units");
		var record = DmMetadataExtractor.createRecord(new DmTags(tags, 2));
		assertEquals(AxisCalibration.PIXELS, record.getCalibrationX());
		assertEquals(AxisCalibration.PIXELS, record.getCalibrationY());
		for (var key : MetadataRecord.CANONICAL_KEYS)
			assertTrue(record.containsKey(key));
	}
	
	@Test
	public void test_unrecognizedUnits() {
		var tags = createTags();
		tags.put("ImageList.2.ImageData.Calibrations.Dimension.1.Units", "1/nm");
		var record = DmMetadataExtractor.createRecord(new DmTags(tags, 2));
		assertEquals(AxisCalibration.PIXELS, record.getCalibrationX());
		assertTrue(record.getCalibrationY().isCalibrated());
	}
	
	@Test
	public void test_extract() throws IOException {
		var reader = new FakeDmReader().putTags("image.dm4", new DmTags(createTags(), 2));
		var extractor = new DmMetadataExtractor(new FormatReaders(List.of(reader)));
		assertTrue(extractor.supportsFile(Path.of("image.DM3")));
		assertFalse(extractor.supportsFile(Path.of("image.mrc")));
		
		var first = extractor.extract(Path.of("image.dm4"));
		var second = extractor.extract(Path.of("image.dm4"));
		assertEquals(first, second);
		assertThrows(IOException.class, () -> extractor.extract(Path.of("missing.dm4")));
	}
	
	@Test
	public void test_noReaderInstalled() {
		var extractor = new DmMetadataExtractor(new FormatReaders(List.of()));
		var e = assertThrows(IOException.class, () -> extractor.extract(Path.of("image.dm3")));
		assertTrue(e.getMessage().contains(".dm3"));
	}

}
