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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic policy that reduces raw arrays to at most {@link DisplayArray#MAX_RANK} dimensions.
 * <ol>
 * <li>All axes of length 1 are removed.</li>
 * <li>Arrays with at most 3 remaining axes are returned unchanged.</li>
 * <li>4-D arrays are reduced to 3-D by selecting the first index along one axis: the second axis for a tilt series 
 * (keeping one image per tilt angle), otherwise the first axis.</li>
 * <li>Arrays with more than 4 remaining axes are not supported.</li>
 * </ol>
 */
public class DimensionReducer {
	
	private static final Logger logger = LoggerFactory.getLogger(DimensionReducer.class);
	
	/**
	 * Reduce the dimensionality of a raw array for display.
	 * The result is uncalibrated; calibration is the responsibility of the caller.
	 * @param raw
	 * @param hint
	 * @return
	 */
	public Reduction reduce(RawArray raw, FormatHint hint) {
		return reduce(raw.getArray(), hint);
	}
	
	/**
	 * Reduce the dimensionality of an array for display.
	 * @param array
	 * @param hint
	 * @return
	 * @see #reduce(RawArray, FormatHint)
	 */
	public Reduction reduce(NDArray array, FormatHint hint) {
		var squeezed = array.squeeze();
		int rank = squeezed.rank();
		if (rank <= DisplayArray.MAX_RANK)
			return Reduction.complete(new DisplayArray(squeezed));
		
		if (rank == 4) {
			String message;
			NDArray reduced;
			if (hint == FormatHint.TILT_SERIES) {
				message = "Only showing 1 image per tilt angle for tilt series data";
				reduced = squeezed.slice(1, 0);
			} else {
				message = "Reducing 4-D data to 3-D";
				reduced = squeezed.slice(0, 0);
			}
			logger.warn(message);
			return Reduction.partial(new DisplayArray(reduced), message);
		}
		
		String message = rank + "-D data files are not supported";
		logger.warn(message);
		return Reduction.unsupported(message);
	}

}
