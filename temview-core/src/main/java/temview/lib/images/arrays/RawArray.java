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

package temview.lib.images.arrays;

import java.util.Arrays;
import java.util.Objects;

/**
 * An N-dimensional array as produced by a format reader, together with the pixel size 
 * and pixel unit of every dimension.
 * <p>
 * Units are reported exactly as the format stores them; they are normalized only when the array is displayed.
 */
public final class RawArray {
	
	private final NDArray array;
	private final double[] pixelSize;
	private final String[] pixelUnit;
	
	/**
	 * Create a raw array.
	 * @param array the values
	 * @param pixelSize the pixel size for each dimension; if null, every dimension has size 1
	 * @param pixelUnit the unit for each dimension; if null, every dimension is in pixels
	 */
	public RawArray(NDArray array, double[] pixelSize, String[] pixelUnit) {
		this.array = Objects.requireNonNull(array);
		int n = array.rank();
		if (pixelSize == null) {
			pixelSize = new double[n];
			Arrays.fill(pixelSize, 1.0);
		}
		if (pixelUnit == null) {
			pixelUnit = new String[n];
			Arrays.fill(pixelUnit, "");
		}
		if (pixelSize.length != n || pixelUnit.length != n)
			throw new IllegalArgumentException("Pixel sizes and units must be provided for all " + n + " dimensions");
		this.pixelSize = pixelSize.clone();
		this.pixelUnit = pixelUnit.clone();
	}
	
	/**
	 * Create a raw array without any calibration.
	 * @param array
	 */
	public RawArray(NDArray array) {
		this(array, null, null);
	}
	
	/**
	 * Get the values.
	 * @return
	 */
	public NDArray getArray() {
		return array;
	}
	
	/**
	 * Number of dimensions.
	 * @return
	 */
	public int rank() {
		return array.rank();
	}
	
	/**
	 * Get the pixel size of one dimension.
	 * @param dim
	 * @return
	 */
	public double getPixelSize(int dim) {
		return pixelSize[dim];
	}
	
	/**
	 * Get the unit of one dimension, as stored in the file.
	 * @param dim
	 * @return
	 */
	public String getPixelUnit(int dim) {
		return pixelUnit[dim];
	}
	
	@Override
	public String toString() {
		return "RawArray[shape=" + Arrays.toString(array.getShape()) + ", pixelSize=" + Arrays.toString(pixelSize) + ", pixelUnit=" + Arrays.toString(pixelUnit) + "]";
	}

}
