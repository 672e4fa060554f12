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
import java.util.Optional;

/**
 * Result of applying {@link DimensionReducer} to a raw array.
 * <p>
 * A reduction is either supported (with an array to display, and possibly a message that only part of the 
 * data is shown) or unsupported (with a message, but no array).
 */
public final class Reduction {
	
	private final DisplayArray array;
	private final String message;
	
	private Reduction(DisplayArray array, String message) {
		this.array = array;
		this.message = message;
	}
	
	static Reduction complete(DisplayArray array) {
		return new Reduction(Objects.requireNonNull(array), null);
	}
	
	static Reduction partial(DisplayArray array, String message) {
		return new Reduction(Objects.requireNonNull(array), Objects.requireNonNull(message));
	}
	
	static Reduction unsupported(String message) {
		return new Reduction(null, Objects.requireNonNull(message));
	}
	
	/**
	 * Returns true if an array was produced.
	 * @return
	 */
	public boolean isSupported() {
		return array != null;
	}
	
	/**
	 * Returns true if an array was produced, but it shows only part of the raw data.
	 * @return
	 */
	public boolean isPartial() {
		return array != null && message != null;
	}
	
	/**
	 * Get the array to display, if the dimensionality was supported.
	 * @return
	 */
	public Optional<DisplayArray> getArray() {
		return Optional.ofNullable(array);
	}
	
	/**
	 * Get a human-readable diagnostic, if there is one.
	 * @return
	 */
	public Optional<String> getMessage() {
		return Optional.ofNullable(message);
	}
	
	@Override
	public String toString() {
		if (array == null)
			return "Reduction[unsupported: " + message + "]";
		return "Reduction[" + array + (message == null ? "" : ", " + message) + "]";
	}

}
