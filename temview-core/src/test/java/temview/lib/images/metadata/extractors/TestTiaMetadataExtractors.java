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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import temview.lib.images.calibration.AxisCalibration;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.io.formats.FakeFormatReaders.FakeSerFile;
import temview.lib.io.formats.FakeFormatReaders.FakeSerReader;
import temview.lib.io.formats.FormatReaders;

@SuppressWarnings("javadoc")
public class TestTiaMetadataExtractors {
	
	private static Map<String, Object> createDataset(double deltaX, double deltaY) {
		Map<String, Object> dataset = new LinkedHashMap<>();
		dataset.put("Calibration", List.of(
				Map.of("CalibrationOffset", -1e-9, "CalibrationDelta", deltaX, "CalibrationElement", 0),
				Map.of("CalibrationOffset", 2e-9, "CalibrationDelta", deltaY, "CalibrationElement", 0)));
		dataset.put("DataType", 7);
		dataset.put("ArraySize", List.of(256, 128));
		return dataset;
	}
	
	@Test
	public void test_ser() throws IOException {
		var header = Map.<String, Object>of("SeriesVersion", 0x0220, "ValidNumberElements", 1);
		var emi = Map.<String, Object>of("ObjectInfo.ExperimentalConditions.MicroscopeConditions.AcceleratingVoltage", 200000L);
		var file = new FakeSerFile(header, List.of(createDataset(1e-10, 2e-10)), emi);
		var reader = new FakeSerReader().putFile("image_1.ser", file);
		var record = new SerMetadataExtractor(new FormatReaders(List.of(reader))).extract(Path.of("image_1.ser"));
		
		assertEquals(0x0220, record.get("SeriesVersion"));
		assertEquals(200000L, record.get("ObjectInfo.ExperimentalConditions.MicroscopeConditions.AcceleratingVoltage"));
		assertEquals(1e-10, record.get("Calibration.0.CalibrationDelta"));
		assertEquals(List.of(256, 128), record.get("ArraySize"));
		
		assertEquals(1e-10, record.getPhysicalSizeX());
		assertEquals(-1e-9, record.getPhysicalSizeXOrigin());
		assertEquals("m", record.getPhysicalSizeXUnit());
		assertEquals(2e-10, record.getPhysicalSizeY());
		assertEquals(2e-9, record.getPhysicalSizeYOrigin());
	}
	
	@Test
	public void test_serWithoutCalibration() throws IOException {
		var dataset = createDataset(1, 1);
		dataset.put("Calibration", List.of(Map.of("CalibrationDelta", 1.0)));
		var file = new FakeSerFile(Map.of(), List.of(dataset), null);
		var reader = new FakeSerReader().putFile("image.ser", file);
		var record = new SerMetadataExtractor(new FormatReaders(List.of(reader))).extract(Path.of("image.ser"));
		assertEquals(AxisCalibration.PIXELS, record.getCalibrationX());
		assertEquals(AxisCalibration.PIXELS, record.getCalibrationY());
	}
	
	@Test
	public void test_emi() throws IOException {
		var emi = Map.<String, Object>of("ExperimentalDescription", Map.of("Mode", "STEM"));
		var reader = new FakeSerReader().putEmi("image.emi", emi);
		var extractor = new EmiMetadataExtractor(new FormatReaders(List.of(reader)));
		assertTrue(extractor.supportsFile(Path.of("IMAGE.EMI")));
		var record = extractor.extract(Path.of("image.emi"));
		assertEquals("STEM", record.get("ExperimentalDescription.Mode"));
		for (var key : MetadataRecord.CANONICAL_KEYS)
			assertTrue(record.containsKey(key));
		assertEquals(AxisCalibration.PIXELS, record.getCalibrationX());
	}

}
