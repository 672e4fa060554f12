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
 * An array that can be shown by an image view: at most three dimensions, 
 * with an optional physical calibration of the in-plane axes.
 */
public final class DisplayArray {
	
	/**
	 * Maximum number of dimensions that can be displayed.
	 */
	public static final int MAX_RANK = 3;
	
	private final NDArray array;
	private final DisplayCalibration calibration;
	
	/**
	 * Create a display array.
	 * @param array
	 * @param calibration
	 * @throws IllegalArgumentException if the array has more than {@link #MAX_RANK} dimensions
	 */
	public DisplayArray(NDArray array, DisplayCalibration calibration) {
		Objects.requireNonNull(array);
		if (array.rank() > MAX_RANK)
			throw new IllegalArgumentException("Cannot display " + array.rank() + "-D array");
		this.array = array;
		this.calibration = Objects.requireNonNull(calibration);
	}
	
	/**
	 * Create an uncalibrated display array.
	 * @param array
	 */
	public DisplayArray(NDArray array) {
		this(array, DisplayCalibration.PIXELS);
	}
	
	/**
	 * Create a blank (zero-filled) 2D array, used as a placeholder whenever a file cannot be shown.
	 * @param height
	 * @param width
	 * @return
	 */
	public static DisplayArray blank(int height, int width) {
		return new DisplayArray(NDArray.zeros(height, width));
	}
	
	/**
	 * Create a copy of this array with a different calibration.
	 * @param calibration
	 * @return
	 */
	public DisplayArray withCalibration(DisplayCalibration calibration) {
		return new DisplayArray(array, calibration);
	}
	
	/**
	 * Get the values.
	 * @return
	 */
	public NDArray getArray() {
		return array;
	}
	
	/**
	 * Get a copy of the shape.
	 * @return
	 */
	public int[] getShape() {
		return array.getShape();
	}
	
	/**
	 * Number of dimensions.
	 * @return
	 */
	public int rank() {
		return array.rank();
	}
	
	/**
	 * Get the calibration of the in-plane axes.
	 * @return
	 */
	public DisplayCalibration getCalibration() {
		return calibration;
	}
	
	@Override
	public String toString() {
		return "DisplayArray[shape=" + Arrays.toString(array.getShape()) + ", " + calibration + "]";
	}

}
