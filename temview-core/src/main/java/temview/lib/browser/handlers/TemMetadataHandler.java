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

package temview.lib.browser.handlers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.browser.AbstractFileHandler;
import temview.lib.browser.StatusReporter;
import temview.lib.browser.views.TextView;
import temview.lib.images.metadata.MetadataCache;
import temview.lib.images.metadata.MetadataRecord;
import temview.lib.images.metadata.extractors.MetadataExtractors;

/**
 * Handler that shows the metadata of electron microscopy files as text.
 * <p>
 * Records are requested through a {@link MetadataCache}, so that revisiting a recent file does not parse it again.
 * Files without a matching extractor show only their name.
 */
public class TemMetadataHandler extends AbstractFileHandler<TextView> {
	
	private static final Logger logger = LoggerFactory.getLogger(TemMetadataHandler.class);
	
	/**
	 * Name of the handler.
	 */
	public static final String NAME = "TEM metadata viewer";
	
	private static final List<String> EXTENSIONS = List.of(".dm3", ".dm4", ".mrc", ".ali", ".rec", ".ser", ".emi");
	
	private final MetadataExtractors extractors;
	private final MetadataCache cache;
	
	/**
	 * Create a handler.
	 * @param extractors extractors for the supported formats
	 * @param cache cache for extracted records
	 * @param reporter receiver for load failures
	 */
	public TemMetadataHandler(MetadataExtractors extractors, MetadataCache cache, StatusReporter reporter) {
		super(NAME, EXTENSIONS, new TextView(), reporter);
		this.extractors = extractors;
		this.cache = cache;
	}

	@Override
	protected void loadFile(Path path) throws IOException {
		var extractor = extractors.getExtractor(path);
		MetadataRecord record;
		if (extractor.isPresent())
			record = cache.getOrCompute(extractor.get(), path);
		else {
			logger.debug("No metadata extractor for {}", path);
			record = null;
		}
		getView().setText(toText(path, record));
	}
	
	/**
	 * Format a record as text, with one {@code key = value} line per entry after the file name.
	 * @param path
	 * @param record the record, or null if no metadata is available
	 * @return
	 */
	static String toText(Path path, MetadataRecord record) {
		var sb = new StringBuilder();
		sb.append("file name = ").append(path).append("\n");
		if (record != null) {
			for (var entry : record.asMap().entrySet())
				sb.append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
		}
		return sb.toString();
	}

}
