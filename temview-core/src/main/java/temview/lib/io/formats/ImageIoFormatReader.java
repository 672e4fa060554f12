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

package temview.lib.io.formats;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import javax.imageio.ImageIO;

import temview.lib.images.arrays.NDArray;
import temview.lib.images.arrays.RawArray;

/**
 * Reader for ordinary raster images using Java's ImageIO.
 * <p>
 * Single-band images are returned with shape (height, width), multi-band images with shape (height, width, bands).
 * Raster images carry no physical calibration.
 */
public class ImageIoFormatReader implements FormatReader {
	
	private static final List<String> EXTENSIONS = List.of(".png", ".tif", ".tiff", ".jpg");

	@Override
	public String getName() {
		return "ImageIO reader";
	}

	@Override
	public Collection<String> getExtensions() {
		return EXTENSIONS;
	}

	@Override
	public RawArray readArray(Path path) throws IOException {
		BufferedImage img = ImageIO.read(path.toFile());
		if (img == null)
			throw new IOException("No ImageIO reader could decode " + path);
		return new RawArray(toArray(img));
	}
	
	static NDArray toArray(BufferedImage img) {
		var raster = img.getRaster();
		int width = raster.getWidth();
		int height = raster.getHeight();
		int nBands = raster.getNumBands();
		if (nBands == 1) {
			double[] data = raster.getSamples(0, 0, width, height, 0, (double[])null);
			return new NDArray(new int[] {height, width}, data);
		}
		double[] data = new double[width * height * nBands];
		double[] band = null;
		for (int b = 0; b < nBands; b++) {
			band = raster.getSamples(0, 0, width, height, b, band);
			for (int i = 0; i < band.length; i++)
				data[i * nBands + b] = band[i];
		}
		return new NDArray(new int[] {height, width, nBands}, data);
	}

}
