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

package temview.lib.images.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import temview.lib.images.calibration.AxisCalibration;
import temview.lib.images.calibration.PhysicalUnits;

/**
 * Canonical metadata for an image file, independent of the format that produced it.
 * <p>
 * A record is an ordered mapping from keys to values (numbers, strings, booleans or lists of these), 
 * which always contains six canonical fields describing the calibration of the X and Y axes:
 * {@value #PHYSICAL_SIZE_X}, {@value #PHYSICAL_SIZE_X_ORIGIN}, {@value #PHYSICAL_SIZE_X_UNIT}, 
 * {@value #PHYSICAL_SIZE_Y}, {@value #PHYSICAL_SIZE_Y_ORIGIN} and {@value #PHYSICAL_SIZE_Y_UNIT}.
 * If a calibration is not known, the axis is reported in pixels (scale 1, origin 0, unit "").
 * <p>
 * Records are immutable, and so can be shared by a cache.
 */
public final class MetadataRecord {
	
	/**
	 * Key for the pixel width.
	 */
	public static final String PHYSICAL_SIZE_X = "PhysicalSizeX";
	
	/**
	 * Key for the coordinate of the first column.
	 */
	public static final String PHYSICAL_SIZE_X_ORIGIN = "PhysicalSizeXOrigin";
	
	/**
	 * Key for the unit of the pixel width; empty for pixels.
	 */
	public static final String PHYSICAL_SIZE_X_UNIT = "PhysicalSizeXUnit";
	
	/**
	 * Key for the pixel height.
	 */
	public static final String PHYSICAL_SIZE_Y = "PhysicalSizeY";
	
	/**
	 * Key for the coordinate of the first row.
	 */
	public static final String PHYSICAL_SIZE_Y_ORIGIN = "PhysicalSizeYOrigin";
	
	/**
	 * Key for the unit of the pixel height; empty for pixels.
	 */
	public static final String PHYSICAL_SIZE_Y_UNIT = "PhysicalSizeYUnit";
	
	/**
	 * All canonical keys, in the order they appear in a record.
	 */
	public static final List<String> CANONICAL_KEYS = List.of(
			PHYSICAL_SIZE_X, PHYSICAL_SIZE_X_ORIGIN, PHYSICAL_SIZE_X_UNIT,
			PHYSICAL_SIZE_Y, PHYSICAL_SIZE_Y_ORIGIN, PHYSICAL_SIZE_Y_UNIT);
	
	private final Map<String, Object> values;
	private final AxisCalibration calibrationX;
	private final AxisCalibration calibrationY;
	
	private MetadataRecord(Map<String, Object> values, AxisCalibration calibrationX, AxisCalibration calibrationY) {
		this.values = Collections.unmodifiableMap(values);
		this.calibrationX = calibrationX;
		this.calibrationY = calibrationY;
	}
	
	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Create a record that only contains the canonical fields, with both axes in pixels.
	 * @return
	 */
	public static MetadataRecord empty() {
		return builder().build();
	}
	
	/**
	 * Get a value.
	 * @param key
	 * @return the value, or null if the key is not present
	 */
	public Object get(String key) {
		return values.get(key);
	}
	
	/**
	 * Query whether a key is present.
	 * @param key
	 * @return
	 */
	public boolean containsKey(String key) {
		return values.containsKey(key);
	}
	
	/**
	 * Get all keys, in order.
	 * @return
	 */
	public Set<String> keySet() {
		return values.keySet();
	}
	
	/**
	 * Number of entries, including the canonical fields.
	 * @return
	 */
	public int size() {
		return values.size();
	}
	
	/**
	 * Get an unmodifiable view of all entries, in order.
	 * @return
	 */
	public Map<String, Object> asMap() {
		return values;
	}
	
	/**
	 * Calibration of the X axis.
	 * @return
	 */
	public AxisCalibration getCalibrationX() {
		return calibrationX;
	}
	
	/**
	 * Calibration of the Y axis.
	 * @return
	 */
	public AxisCalibration getCalibrationY() {
		return calibrationY;
	}
	
	/**
	 * Pixel width, in {@link #getPhysicalSizeXUnit()}.
	 * @return
	 */
	public double getPhysicalSizeX() {
		return calibrationX.getScale();
	}
	
	/**
	 * Coordinate of the first column, in {@link #getPhysicalSizeXUnit()}.
	 * @return
	 */
	public double getPhysicalSizeXOrigin() {
		return calibrationX.getOrigin();
	}
	
	/**
	 * Unit of the X axis, or an empty string for pixels.
	 * @return
	 */
	public String getPhysicalSizeXUnit() {
		return calibrationX.getUnit();
	}
	
	/**
	 * Pixel height, in {@link #getPhysicalSizeYUnit()}.
	 * @return
	 */
	public double getPhysicalSizeY() {
		return calibrationY.getScale();
	}
	
	/**
	 * Coordinate of the first row, in {@link #getPhysicalSizeYUnit()}.
	 * @return
	 */
	public double getPhysicalSizeYOrigin() {
		return calibrationY.getOrigin();
	}
	
	/**
	 * Unit of the Y axis, or an empty string for pixels.
	 * @return
	 */
	public String getPhysicalSizeYUnit() {
		return calibrationY.getUnit();
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof MetadataRecord))
			return false;
		return values.equals(((MetadataRecord)obj).values);
	}
	
	@Override
	public String toString() {
		return "MetadataRecord" + values;
	}
	
	
	/**
	 * Builder for a {@link MetadataRecord}.
	 * <p>
	 * Values are flattened as they are added (see {@link MetadataValues#flatten(String, Object, Map)}).
	 * Canonical fields are always written last, and default to pixels for any axis that has not been calibrated, 
	 * so that every extractor shares the same defaulting behavior.
	 */
	public static final class Builder {
		
		private Map<String, Object> values = new LinkedHashMap<>();
		private AxisCalibration calibrationX = AxisCalibration.PIXELS;
		private AxisCalibration calibrationY = AxisCalibration.PIXELS;
		
		private Builder() {}
		
		/**
		 * Add a value. Later values replace earlier values with the same key.
		 * @param key
		 * @param value
		 * @return this builder
		 */
		public Builder put(String key, Object value) {
			Objects.requireNonNull(key);
			MetadataValues.flatten(key, value, values);
			return this;
		}
		
		/**
		 * Add all the entries of a map, in iteration order.
		 * @param map
		 * @return this builder
		 */
		public Builder putAll(Map<String, ?> map) {
			for (var entry : map.entrySet())
				put(entry.getKey(), entry.getValue());
			return this;
		}
		
		/**
		 * Set the calibration of the X axis.
		 * @param calibration
		 * @return this builder
		 */
		public Builder calibrationX(AxisCalibration calibration) {
			this.calibrationX = Objects.requireNonNull(calibration);
			return this;
		}
		
		/**
		 * Set the calibration of the Y axis.
		 * @param calibration
		 * @return this builder
		 */
		public Builder calibrationY(AxisCalibration calibration) {
			this.calibrationY = Objects.requireNonNull(calibration);
			return this;
		}
		
		/**
		 * Set the calibration of the X axis from values in their original unit.
		 * Unrecognized units result in pixels.
		 * @param scale
		 * @param origin
		 * @param unit
		 * @return this builder
		 * @see PhysicalUnits#calibrate(double, double, String)
		 */
		public Builder physicalSizeX(double scale, double origin, String unit) {
			return calibrationX(PhysicalUnits.calibrate(scale, origin, unit));
		}
		
		/**
		 * Set the calibration of the Y axis from values in their original unit.
		 * Unrecognized units result in pixels.
		 * @param scale
		 * @param origin
		 * @param unit
		 * @return this builder
		 * @see PhysicalUnits#calibrate(double, double, String)
		 */
		public Builder physicalSizeY(double scale, double origin, String unit) {
			return calibrationY(PhysicalUnits.calibrate(scale, origin, unit));
		}
		
		/**
		 * Build the record.
		 * @return
		 */
		public MetadataRecord build() {
			var map = new LinkedHashMap<String, Object>(values);
			map.keySet().removeAll(CANONICAL_KEYS);
			map.put(PHYSICAL_SIZE_X, calibrationX.getScale());
			map.put(PHYSICAL_SIZE_X_ORIGIN, calibrationX.getOrigin());
			map.put(PHYSICAL_SIZE_X_UNIT, calibrationX.getUnit());
			map.put(PHYSICAL_SIZE_Y, calibrationY.getScale());
			map.put(PHYSICAL_SIZE_Y_ORIGIN, calibrationY.getOrigin());
			map.put(PHYSICAL_SIZE_Y_UNIT, calibrationY.getUnit());
			return new MetadataRecord(map, calibrationX, calibrationY);
		}
		
	}

}
