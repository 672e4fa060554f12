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

package temview.lib.images.metadata.extractors;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import temview.lib.images.metadata.MetadataExtractor;
import temview.lib.io.formats.FormatReaders;

/**
 * The set of metadata extractors known to a metadata handler, with lookup by file extension.
 */
public class MetadataExtractors {
	
	private final List<MetadataExtractor> extractors;
	
	/**
	 * Create a set from the specified extractors. If more than one supports a file, the first is used.
	 * @param extractors
	 */
	public MetadataExtractors(Collection<? extends MetadataExtractor> extractors) {
		this.extractors = Collections.unmodifiableList(new ArrayList<>(extractors));
	}
	
	/**
	 * Create the extractors for all electron microscopy formats, using the specified readers to decode files.
	 * @param readers
	 * @return
	 */
	public static MetadataExtractors createDefault(FormatReaders readers) {
		return new MetadataExtractors(List.of(
				new DmMetadataExtractor(readers),
				new MrcMetadataExtractor(readers),
				new EmdMetadataExtractor(readers),
				new SerMetadataExtractor(readers),
				new EmiMetadataExtractor(readers)
				));
	}
	
	/**
	 * Get all extractors.
	 * @return
	 */
	public List<MetadataExtractor> getExtractors() {
		return extractors;
	}
	
	/**
	 * Find the extractor for a file, based on its extension only.
	 * @param path
	 * @return
	 */
	public Optional<MetadataExtractor> getExtractor(Path path) {
		return extractors.stream().filter(e -> e.supportsFile(path)).findFirst();
	}

}
