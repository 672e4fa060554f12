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

package temview.lib.images.calibration;

import java.util.Objects;

/**
 * Scale, origin and unit for a single image axis, expressed in canonical units.
 * <p>
 * An uncalibrated axis has scale 1, origin 0 and an empty unit, meaning that coordinates are in pixels.
 */
public final class AxisCalibration {
	
	/**
	 * Calibration of an axis measured in pixels.
	 */
	public static final AxisCalibration PIXELS = new AxisCalibration(1.0, 0.0, PhysicalUnits.PIXEL);
	
	private final double scale;
	private final double origin;
	private final String unit;
	
	private AxisCalibration(double scale, double origin, String unit) {
		this.scale = scale;
		this.origin = origin;
		this.unit = unit;
	}
	
	/**
	 * Create an axis calibration in metres.
	 * @param scale pixel size in metres
	 * @param origin position of the first pixel in metres
	 * @return
	 */
	public static AxisCalibration createMeters(double scale, double origin) {
		return new AxisCalibration(scale, origin, PhysicalUnits.METER);
	}
	
	/**
	 * Size of one pixel along the axis.
	 * @return
	 */
	public double getScale() {
		return scale;
	}
	
	/**
	 * Coordinate of the first pixel along the axis.
	 * @return
	 */
	public double getOrigin() {
		return origin;
	}
	
	/**
	 * Canonical unit, or an empty string for pixels.
	 * @return
	 */
	public String getUnit() {
		return unit;
	}
	
	/**
	 * Returns true if the axis has a physical calibration.
	 * @return
	 */
	public boolean isCalibrated() {
		return !unit.isEmpty();
	}

	@Override
	public int hashCode() {
		return Objects.hash(origin, scale, unit);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof AxisCalibration))
			return false;
		AxisCalibration other = (AxisCalibration) obj;
		return Double.doubleToLongBits(origin) == Double.doubleToLongBits(other.origin)
				&& Double.doubleToLongBits(scale) == Double.doubleToLongBits(other.scale)
				&& unit.equals(other.unit);
	}
	
	@Override
	public String toString() {
		return isCalibrated() ? "AxisCalibration[scale=" + scale + " " + unit + ", origin=" + origin + "]" : "AxisCalibration[pixels]";
	}

}
