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
 * A data group from a Thermo Fisher Velox EMD file, consisting of a dataset and the JSON metadata stored alongside it.
 */
public final class VeloxData {
	
	private final byte[] metadata;
	private final long[] shape;
	
	/**
	 * Create a data group.
	 * @param metadata the first column of the metadata array, i.e. UTF-8 encoded JSON padded with zero bytes
	 * @param shape shape of the dataset
	 */
	public VeloxData(byte[] metadata, long[] shape) {
		this.metadata = Objects.requireNonNull(metadata).clone();
		this.shape = Objects.requireNonNull(shape).clone();
	}
	
	/**
	 * Get the raw metadata bytes.
	 * @return
	 */
	public byte[] getMetadata() {
		return metadata.clone();
	}
	
	/**
	 * Get the shape of the dataset.
	 * @return
	 */
	public long[] getShape() {
		return shape.clone();
	}

}
