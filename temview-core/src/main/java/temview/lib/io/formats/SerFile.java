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
import java.util.Map;
import java.util.Optional;

/**
 * An open TIA series (SER) file.
 */
public interface SerFile extends Closeable {
	
	/**
	 * Values of the file header, e.g. {@code SeriesVersion} or {@code ValidNumberElements}.
	 * @return
	 */
	Map<String, Object> getHeader();
	
	/**
	 * Number of datasets (images) in the series.
	 * @return
	 */
	int getNumberOfDatasets();
	
	/**
	 * Metadata of one dataset. This includes a {@code Calibration} list, with one map per axis containing 
	 * {@code CalibrationOffset}, {@code CalibrationDelta} and {@code CalibrationElement}. Calibrations are in metres.
	 * @param index
	 * @return
	 * @throws IOException
	 */
	Map<String, Object> getDatasetMetadata(int index) throws IOException;
	
	/**
	 * Contents of the companion EMI file, if one was found next to the series.
	 * @return
	 */
	Optional<Map<String, Object>> getEmi();

}
