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

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * An open EMD container. This may be either a Berkeley EMD file (with a list of named datasets and 
 * dimension vectors) or a Velox EMD file (with JSON metadata embedded as bytes).
 */
public interface EmdFile extends Closeable {
	
	/**
	 * Names of the Berkeley EMD datasets. This is empty for Velox files.
	 * @return
	 */
	List<String> getDatasetNames();
	
	/**
	 * Attributes of the 'user' group, or an empty map if there is no such group.
	 * @return
	 */
	Map<String, Object> getUserAttributes();
	
	/**
	 * Attributes of the 'microscope' group, or an empty map if there is no such group.
	 * @return
	 */
	Map<String, Object> getMicroscopeAttributes();
	
	/**
	 * Attributes of the 'sample' group, or an empty map if there is no such group.
	 * @return
	 */
	Map<String, Object> getSampleAttributes();
	
	/**
	 * Attributes of the top-level 'data' group, or an empty map if there is no such group.
	 * @return
	 */
	Map<String, Object> getDataAttributes();
	
	/**
	 * Get the dimension vectors of a Berkeley EMD dataset, in axis order.
	 * @param datasetName
	 * @return
	 * @throws IOException
	 */
	List<EmdDimension> getDimensions(String datasetName) throws IOException;
	
	/**
	 * Get the data groups of a Velox file. This is empty for Berkeley EMD files.
	 * @return
	 * @throws IOException
	 */
	List<VeloxData> getVeloxData() throws IOException;

}
