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

import java.util.Objects;

import temview.lib.images.calibration.AxisCalibration;

/**
 * Calibration of the two in-plane axes of a displayed image.
 * X refers to the last axis of the array, Y to the axis before it.
 */
public final class DisplayCalibration {
	
	/**
	 * Calibration for an image measured in pixels.
	 */
	public static final DisplayCalibration PIXELS = new DisplayCalibration(AxisCalibration.PIXELS, AxisCalibration.PIXELS);
	
	private final AxisCalibration x;
	private final AxisCalibration y;
	
	/**
	 * Create a calibration from the calibration of each axis.
	 * @param x
	 * @param y
	 */
	public DisplayCalibration(AxisCalibration x, AxisCalibration y) {
		this.x = Objects.requireNonNull(x);
		this.y = Objects.requireNonNull(y);
	}
	
	/**
	 * Calibration of the horizontal axis.
	 * @return
	 */
	public AxisCalibration getX() {
		return x;
	}
	
	/**
	 * Calibration of the vertical axis.
	 * @return
	 */
	public AxisCalibration getY() {
		return y;
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DisplayCalibration))
			return false;
		DisplayCalibration other = (DisplayCalibration) obj;
		return x.equals(other.x) && y.equals(other.y);
	}
	
	@Override
	public String toString() {
		return "DisplayCalibration[x=" + x + ", y=" + y + "]";
	}

}
