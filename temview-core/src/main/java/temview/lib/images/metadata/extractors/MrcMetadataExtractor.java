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
import java.util.List;

import temview.lib.common.GeneralTools;
import temview.lib.images.calibration.AxisCalibration;
import temview.lib.images.calibration.PhysicalUnits;
import temview.lib.images.metadata.MetadataExtractor;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.io.formats.FormatReaders;
import temview.lib.io.formats.MrcFormatReader;
import temview.lib.io.formats.MrcHeader;

/**
 * Metadata extractor for MRC files and the related ALI and REC tomography files.
 * <p>
 * Voxel sizes that are not positive are common, and mean that the axis is not calibrated. 
 * X and Y are considered independently, so one axis may be calibrated while the other is not.
 * <p>
 * If present, two companion files are merged into the record: a tilt angle list ({@code <name>.rawtlt}) 
 * and an FEI parameter listing ({@code <name>.txt}).
 */
public class MrcMetadataExtractor implements MetadataExtractor {
	
	/**
	 * Identifier of this extractor.
	 */
	public static final String ID = "mrc";
	
	private static final List<String> EXTENSIONS = List.of(".mrc", ".ali", ".rec");
	
	private static final String ANGSTROM = "A";
	
	private final FormatReaders readers;
	
	/**
	 * Create an extractor using the specified readers to decode files.
	 * @param readers
	 */
	public MrcMetadataExtractor(FormatReaders readers) {
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
		var header = readers.getReader(MrcFormatReader.class, path).readHeader(path);
		var builder = createBuilder(header);
		builder.put("FileName", path.toString());
		
		MrcSidecarFiles.readTiltAngles(GeneralTools.replaceExtension(path, ".rawtlt"))
			.ifPresent(angles -> builder.put("tilt angles", angles));
		builder.putAll(MrcSidecarFiles.readParameters(GeneralTools.replaceExtension(path, ".txt")));
		return builder.build();
	}
	
	static MetadataRecord.Builder createBuilder(MrcHeader header) {
		var builder = MetadataRecord.builder()
				.put("axisOrientations", header.getAxisOrientations())
				.put("cellAngles", header.getCellAngles());
		header.getVendorInfo().ifPresent(builder::putAll);
		return builder
				.calibrationX(voxelCalibration(header.getVoxelSizeX()))
				.calibrationY(voxelCalibration(header.getVoxelSizeY()));
	}
	
	static AxisCalibration voxelCalibration(double voxelSizeAngstrom) {
		if (voxelSizeAngstrom > 0)
			return PhysicalUnits.calibrate(voxelSizeAngstrom, 0, ANGSTROM);
		return AxisCalibration.PIXELS;
	}

}
