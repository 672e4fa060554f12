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

import java.util.List;

/**
 * Filters to keep metadata human-scannable, by dropping entries that are only relevant to the acquisition software.
 */
public final class MetadataFilters {
	
	/**
	 * Keys containing any of these terms are considered noise: device-internal parameters, private fields, 
	 * per-frame sequence data, reference images, per-frame intensities and area transforms.
	 */
	public static final List<String> NOISE_TERMS = List.of(
			"frame sequence",
			"Private",
			"Reference Images",
			"Frame.Intensity",
			"Area.Transform",
			"Parameters.Objects",
			"Device.Parameters"
			);
	
	// Suppress default constructor for non-instantiability
	private MetadataFilters() {
		throw new AssertionError();
	}
	
	/**
	 * Returns true if the key should be excluded from a metadata record.
	 * @param key
	 * @return
	 */
	public static boolean isNoise(String key) {
		for (String term : NOISE_TERMS) {
			if (key.contains(term))
				return true;
		}
		return false;
	}

}
