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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import temview.lib.images.metadata.MetadataExtractor;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.io.formats.FormatReaders;
import temview.lib.io.formats.SerFormatReader;

/**
 * Metadata extractor for TIA EMI files, which store the acquisition parameters of one or more SER files.
 * EMI files contain no image, so both axes are reported in pixels.
 */
public class EmiMetadataExtractor implements MetadataExtractor {
	
	/**
	 * Identifier of this extractor.
	 */
	public static final String ID = "emi";
	
	private static final List<String> EXTENSIONS = List.of(".emi");
	
	private final FormatReaders readers;
	
	/**
	 * Create an extractor using the specified readers to decode files.
	 * @param readers
	 */
	public EmiMetadataExtractor(FormatReaders readers) {
		this.readers = readers;
	}

	@Override
	public String getId() {
		return ID;
	}

	@Override
	public Collection<String> getExtensions() {
		return EXTENSIONS;
	}

	@Override
	public MetadataRecord extract(Path path) throws IOException {
		var emi = readers.getReader(SerFormatReader.class, path).readEmi(path);
		return MetadataRecord.builder().putAll(emi).build();
	}

}
