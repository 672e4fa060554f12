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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

import temview.lib.common.GeneralTools;
import temview.lib.images.arrays.RawArray;

/**
 * Service interface for a library that decodes one or more file formats.
 * <p>
 * Implementations are discovered using {@link java.util.ServiceLoader} by {@link FormatReaders}. 
 * Readers that also expose the native metadata of a format implement one of the sub-interfaces, 
 * e.g. {@link MrcFormatReader}.
 */
public interface FormatReader {
	
	/**
	 * Get a human-readable name for the reader.
	 * @return
	 */
	String getName();
	
	/**
	 * Lower case extensions (including the dot) of the files this reader can open.
	 * @return
	 */
	Collection<String> getExtensions();
	
	/**
	 * Returns true if the file has one of the extensions returned by {@link #getExtensions()}.
	 * This must be cheap, and must not open the file.
	 * @param path
	 * @return
	 */
	default boolean supportsFile(Path path) {
		return GeneralTools.checkExtensions(path, getExtensions());
	}
	
	/**
	 * Read all the pixels of a file, together with the pixel size and unit of each dimension.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read
	 */
	RawArray readArray(Path path) throws IOException;

}
