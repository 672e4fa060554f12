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

import java.util.Objects;

/**
 * A dimension vector of a Berkeley EMD dataset: the coordinate of every index along one axis, with name and units.
 */
public final class EmdDimension {
	
	private final double[] values;
	private final String name;
	private final String units;
	
	/**
	 * Create a dimension.
	 * @param values coordinate values
	 * @param name
	 * @param units units as stored, e.g. "[n_m]"
	 */
	public EmdDimension(double[] values, String name, String units) {
		this.values = Objects.requireNonNull(values).clone();
		this.name = name == null ? "" : name;
		this.units = units == null ? "" : units;
	}
	
	/**
	 * Get the coordinate values.
	 * @return
	 */
	public double[] getValues() {
		return values.clone();
	}
	
	/**
	 * Number of coordinate values.
	 * @return
	 */
	public int size() {
		return values.length;
	}
	
	/**
	 * Get a single coordinate value.
	 * @param ind
	 * @return
	 */
	public double getValue(int ind) {
		return values[ind];
	}
	
	/**
	 * Name of the dimension.
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * Units of the dimension, as stored in the file.
	 * @return
	 */
	public String getUnits() {
		return units;
	}

}
