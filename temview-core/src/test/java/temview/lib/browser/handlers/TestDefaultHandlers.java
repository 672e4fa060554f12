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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import temview.lib.browser.FileHandler;
import temview.lib.common.Prefs;
import temview.lib.images.metadata.MetadataCache;
import temview.lib.io.formats.FormatReaders;

@SuppressWarnings("javadoc")
public class TestDefaultHandlers {
	
	private static List<String> names(List<FileHandler> handlers) {
		return handlers.stream().map(FileHandler::getName).collect(Collectors.toList());
	}
	
	@Test
	public void test_registry() {
		var registry = DefaultHandlers.createRegistry(new FormatReaders(List.of()), new MetadataCache(), m -> {});
		assertEquals(List.of(TemMetadataHandler.NAME, RasterImageHandler.NAME, TemImageHandler.NAME), 
				names(registry.getHandlers()));
		assertEquals(Prefs.DEFAULT_HANDLER_NAME, TemMetadataHandler.NAME);
		assertSame(registry.getHandlers().get(0), registry.getDefaultHandler());
	}
	
	@Test
	public void test_autoSelect() {
		var registry = DefaultHandlers.createRegistry(new FormatReaders(List.of()), new MetadataCache(), m -> {});
		assertEquals(TemImageHandler.NAME, registry.autoSelect(Path.of("a.dm3")).getName());
		assertEquals(TemImageHandler.NAME, registry.autoSelect(Path.of("a.emd")).getName());
		assertEquals(RasterImageHandler.NAME, registry.autoSelect(Path.of("a.png")).getName());
		assertEquals(TemMetadataHandler.NAME, registry.autoSelect(Path.of("a.emi")).getName());
		assertEquals(TemMetadataHandler.NAME, registry.autoSelect(Path.of("a.txt")).getName());
	}

}
