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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;

import temview.lib.common.GeneralTools;

/**
 * Extracts the canonical metadata for one family of file formats.
 * <p>
 * Implementations should be pure: extracting twice from an unchanged file must give an equal record, 
 * because results are cached by {@link MetadataCache}.
 * Missing or unparseable optional fields must not cause an exception; instead the affected values 
 * are omitted (or defaulted, in the case of the canonical fields).
 */
public interface MetadataExtractor {
	
	/**
	 * Identifier of the extractor, used to keep a separate cache for each extractor.
	 * @return
	 */
	String getId();
	
	/**
	 * Lower case extensions (including the dot) of the files this extractor can read.
	 * @return
	 */
	Collection<String> getExtensions();
	
	/**
	 * Returns true if the file has one of the extensions returned by {@link #getExtensions()}.
	 * The file is not opened.
	 * @param path
	 * @return
	 */
	default boolean supportsFile(Path path) {
		return GeneralTools.checkExtensions(path, getExtensions());
	}
	
	/**
	 * Extract the metadata.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read at all
	 */
	MetadataRecord extract(Path path) throws IOException;

}
