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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The tag tree of a Gatan Digital Micrograph (DM3/DM4) file, flattened to dotted tag paths 
 * (e.g. {@code ImageList.2.ImageData.Calibrations.Dimension.1.Scale}).
 */
public final class DmTags {
	
	private final Map<String, Object> tags;
	private final int numObjects;
	
	/**
	 * Create a tag tree.
	 * @param tags tag values keyed by dotted path, in file order
	 * @param numObjects number of entries in the image list; the last entry is the active image
	 */
	public DmTags(Map<String, ?> tags, int numObjects) {
		this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
		this.numObjects = numObjects;
	}
	
	/**
	 * Get all tags, in file order.
	 * @return
	 */
	public Map<String, Object> getTags() {
		return tags;
	}
	
	/**
	 * Number of entries in the image list. This is also the index of the active image, 
	 * since the first entry is usually the thumbnail.
	 * @return
	 */
	public int getNumObjects() {
		return numObjects;
	}

}
