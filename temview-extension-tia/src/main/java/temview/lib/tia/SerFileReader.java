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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.common.GeneralTools;
import temview.lib.images.arrays.NDArray;
import temview.lib.images.arrays.RawArray;
import temview.lib.io.formats.SerFile;
import temview.lib.io.formats.SerFormatReader;

/**
 * Reader for files written by FEI's TIA software: series (SER) files containing 2D images, 
 * and the EMI files that store their acquisition parameters.
 * <p>
 * TIA writes {@code name.emi} alongside {@code name_1.ser}, {@code name_2.ser} etc., so the suffix 
 * is removed when looking for the EMI file of a series.
 */
public class SerFileReader implements SerFormatReader {
	
	private static final Logger logger = LoggerFactory.getLogger(SerFileReader.class);
	
	private static final List<String> EXTENSIONS = List.of(".ser", ".emi");
	
	private static final Pattern PATTERN_SERIES_SUFFIX = Pattern.compile("_\\d+$");
	
	private static final String METER = "m";

	@Override
	public String getName() {
		return "TIA reader";
	}

	@Override
	public Collection<String> getExtensions() {
		return EXTENSIONS;
	}

	@Override
	public SerFile open(Path path) throws IOException {
		return openSeries(path);
	}
	
	private SeriesFile openSeries(Path path) throws IOException {
		Map<String, Object> emi = null;
		var emiPath = findEmi(path);
		if (emiPath != null) {
			try {
				emi = EmiReader.read(emiPath);
			} catch (IOException e) {
				logger.warn("Unable to read {}: {}", emiPath, e.getLocalizedMessage());
			}
		}
		return new SeriesFile(path, emi);
	}

	@Override
	public Map<String, Object> readEmi(Path path) throws IOException {
		return EmiReader.read(path);
	}

	/**
	 * Read the images of a series. A single image has shape (height, width), more than one 
	 * have shape (n, height, width).
	 */
	@Override
	public RawArray readArray(Path path) throws IOException {
		if (GeneralTools.checkExtensions(path, List.of(".emi")))
			throw new IOException("EMI files contain no image data, open the SER file instead");
		
		try (var file = openSeries(path)) {
			int n = file.getNumberOfDatasets();
			if (n == 0)
				throw new IOException("SER file contains no images");
			var first = file.readDatasetInfo(0);
			int width = first.width;
			int height = first.height;
			// Images are stored separately, so a valid series cannot be larger than the file
			long imageBytes = first.getByteCount();
			if (imageBytes > 0 && n > Files.size(path) / imageBytes)
				throw new IOException(String.format("SER file declares %d images of %d x %d, which exceeds the file size", n, width, height));
			if ((long)n * width * height > Integer.MAX_VALUE)
				throw new IOException(String.format("SER series of %d images of %d x %d is too large to read", n, width, height));
			int nPixels = width * height;
			double[] data = new double[n * nPixels];
			for (int i = 0; i < n; i++) {
				var info = file.readDatasetInfo(i);
				if (info.width != width || info.height != height)
					throw new IOException(String.format("SER image %d has size %d x %d, expected %d x %d", 
							i, info.width, info.height, width, height));
				double[] pixels = file.readDatasetPixels(i);
				System.arraycopy(pixels, 0, data, i * nPixels, nPixels);
			}
			
			double sizeX = ((Number)first.calibrationX.get("CalibrationDelta")).doubleValue();
			double sizeY = ((Number)first.calibrationY.get("CalibrationDelta")).doubleValue();
			if (n == 1)
				return new RawArray(new NDArray(new int[] {height, width}, data), 
						new double[] {sizeY, sizeX}, 
						new String[] {METER, METER});
			
			double sizeSeries = 1;
			String unitSeries = "";
			var dims = file.getDimensions();
			if (!dims.isEmpty()) {
				sizeSeries = ((Number)dims.get(0).get("CalibrationDelta")).doubleValue();
				unitSeries = (String)dims.get(0).get("Units");
			}
			return new RawArray(new NDArray(new int[] {n, height, width}, data),
					new double[] {sizeSeries, sizeY, sizeX},
					new String[] {unitSeries, METER, METER});
		}
	}
	
	/**
	 * Find the EMI file for a series.
	 * @param serPath
	 * @return the path of the EMI file, or null if none exists
	 */
	static Path findEmi(Path serPath) {
		var fileName = serPath.getFileName();
		if (fileName == null)
			return null;
		String stem = GeneralTools.getNameWithoutExtension(fileName.toString());
		String baseStem = PATTERN_SERIES_SUFFIX.matcher(stem).replaceFirst("");
		for (String candidate : List.of(baseStem, stem)) {
			var emi = serPath.resolveSibling(candidate + ".emi");
			if (Files.isRegularFile(emi))
				return emi;
		}
		return null;
	}

}
