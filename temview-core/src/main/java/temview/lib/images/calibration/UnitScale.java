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

/**
 * Result of normalizing a unit token: the factor needed to convert a value into SI units, 
 * together with the canonical unit.
 * <p>
 * Instances that are not calibrated represent 'unitless pixels'.
 */
public final class UnitScale {
	
	/**
	 * Scale used when a unit is not recognized. The value is not calibrated, and should be 
	 * reported in pixel units.
	 */
	public static final UnitScale PIXELS = new UnitScale(1.0, PhysicalUnits.PIXEL, false);
	
	private final double scaleToMeters;
	private final String canonicalUnit;
	private final boolean calibrated;
	
	UnitScale(double scaleToMeters, String canonicalUnit, boolean calibrated) {
		this.scaleToMeters = scaleToMeters;
		this.canonicalUnit = canonicalUnit;
		this.calibrated = calibrated;
	}
	
	/**
	 * Multiplier that converts a value in the original unit into the canonical unit.
	 * @return
	 */
	public double getScaleToMeters() {
		return scaleToMeters;
	}
	
	/**
	 * The canonical unit: {@link PhysicalUnits#METER}, or {@link PhysicalUnits#PIXEL} if not calibrated.
	 * @return
	 */
	public String getCanonicalUnit() {
		return canonicalUnit;
	}
	
	/**
	 * Returns true if the unit was recognized as a physical length.
	 * @return
	 */
	public boolean isCalibrated() {
		return calibrated;
	}
	
	@Override
	public String toString() {
		return calibrated ? "UnitScale[" + scaleToMeters + " " + canonicalUnit + "]" : "UnitScale[pixels]";
	}

}
