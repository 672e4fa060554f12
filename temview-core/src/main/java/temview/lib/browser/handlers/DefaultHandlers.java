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

import temview.lib.browser.HandlerRegistry;
import temview.lib.browser.StatusReporter;
import temview.lib.images.metadata.MetadataCache;
import temview.lib.images.metadata.extractors.MetadataExtractors;
import temview.lib.io.formats.FormatReaders;

/**
 * Static methods to register the built-in handlers.
 */
public final class DefaultHandlers {
	
	private DefaultHandlers() {
		throw new AssertionError();
	}
	
	/**
	 * Register the built-in handlers, from the most generic to the most specific:
	 * metadata text, ImageIO raster images, then electron microscopy image data.
	 * @param registry
	 * @param readers readers used to decode files
	 * @param cache cache for metadata records
	 * @param reporter receiver for load failures
	 */
	public static void registerAll(HandlerRegistry registry, FormatReaders readers, MetadataCache cache, StatusReporter reporter) {
		registry.register(new TemMetadataHandler(MetadataExtractors.createDefault(readers), cache, reporter));
		registry.register(new RasterImageHandler(reporter));
		registry.register(new TemImageHandler(readers, reporter));
	}
	
	/**
	 * Create a registry containing the built-in handlers.
	 * @param readers readers used to decode files
	 * @param cache cache for metadata records
	 * @param reporter receiver for load failures
	 * @return
	 * @see #registerAll(HandlerRegistry, FormatReaders, MetadataCache, StatusReporter)
	 */
	public static HandlerRegistry createRegistry(FormatReaders readers, MetadataCache cache, StatusReporter reporter) {
		var registry = new HandlerRegistry();
		registerAll(registry, readers, cache, reporter);
		return registry;
	}

}
