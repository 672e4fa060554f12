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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes the length units found in electron microscopy metadata into SI metres.
 * <p>
 * Formats spell units in many different ways (including mis-decoded micro signs), and many files 
 * contain units that are not lengths at all (e.g. reciprocal space or energy). 
 * Unrecognized units are a normal case, and are reported as unitless pixels rather than raising an exception.
 */
public final class PhysicalUnits {
	
	/**
	 * Canonical unit for all physical lengths.
	 */
	public static final String METER = "m";
	
	/**
	 * Canonical unit meaning 'pixels', i.e. no physical calibration.
	 */
	public static final String PIXEL = "";
	
	private static final Map<String, UnitScale> UNITS = new HashMap<>();
	
	static {
		register(1e-6, "um", "µm", "μm", "âµm", "u_m", "[u_m]", "[um]",
				"micron", "microns", "micrometer", "micrometers", "micrometre", "micrometres");
		register(1.0, "m", "[m]", "meter", "meters", "metre", "metres");
		register(1e-9, "nm", "n_m", "[n_m]", "[nm]", "nanometer", "nanometers", "nanometre", "nanometres");
		register(1e-10, "a", "ang", "å", "[a]", "angstrom", "angstroms", "ångström", "ångstrom");
	}
	
	private static void register(double scale, String... tokens) {
		var unitScale = new UnitScale(scale, METER, true);
		for (String token : Set.of(tokens))
			UNITS.put(token, unitScale);
	}
	
	// Suppress default constructor for non-instantiability
	private PhysicalUnits() {
		throw new AssertionError();
	}
	
	/**
	 * Convert a unit token into a scale factor to metres.
	 * Comparison ignores case and surrounding whitespace; both the Latin-1 and the Ångström sign forms of 'Å' are accepted.
	 * @param token the unit as found in the file, may be null
	 * @return the scale, or {@link UnitScale#PIXELS} if the unit is missing or not a recognized length
	 */
	public static UnitScale normalize(String token) {
		if (token == null)
			return UnitScale.PIXELS;
		String key = token.strip().toLowerCase(Locale.ROOT);
		if (key.isEmpty())
			return UnitScale.PIXELS;
		return UNITS.getOrDefault(key, UnitScale.PIXELS);
	}
	
	/**
	 * Apply the unit policy to one axis.
	 * If the unit is recognized (and the values are finite), scale and origin are converted to metres; 
	 * otherwise the axis is reported in pixels with scale 1 and origin 0, whatever the values were.
	 * @param scale pixel size in the original unit
	 * @param origin origin in the original unit
	 * @param token the original unit
	 * @return
	 */
	public static AxisCalibration calibrate(double scale, double origin, String token) {
		var unitScale = normalize(token);
		if (!unitScale.isCalibrated() || !Double.isFinite(scale) || !Double.isFinite(origin))
			return AxisCalibration.PIXELS;
		double factor = unitScale.getScaleToMeters();
		return AxisCalibration.createMeters(scale * factor, origin * factor);
	}

}
