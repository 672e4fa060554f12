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

package temview.lib.browser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestHandlerRegistry {
	
	private RecordingHandler generic = new RecordingHandler("Generic", ".dm3", ".tif");
	private RecordingHandler raster = new RecordingHandler("ImageRaster", ".png", ".tif");
	private RecordingHandler tagTree = new RecordingHandler("TagTree", ".dm3", ".dm4");
	
	private HandlerRegistry createRegistry() {
		var registry = new HandlerRegistry("Generic");
		registry.register(generic);
		registry.register(raster);
		registry.register(tagTree);
		return registry;
	}
	
	@Test
	public void test_autoSelectReverseOrder() {
		var registry = createRegistry();
		assertSame(raster, registry.autoSelect(Path.of("image.tif")));
		assertSame(tagTree, registry.autoSelect(Path.of("image.DM3")));
		assertSame(raster, registry.autoSelect(Path.of("image.png")));
	}
	
	@Test
	public void test_autoSelectFallback() {
		var registry = createRegistry();
		assertSame(generic, registry.autoSelect(Path.of("notes.xyz")));
		assertSame(generic, registry.autoSelect(Path.of("no_extension")));
	}
	
	@Test
	public void test_missingDefaultUsesFirst() {
		var registry = new HandlerRegistry("Not registered");
		registry.register(raster);
		registry.register(tagTree);
		assertSame(raster, registry.autoSelect(Path.of("notes.xyz")));
		
		var empty = new HandlerRegistry();
		assertThrows(IllegalStateException.class, () -> empty.autoSelect(Path.of("a.tif")));
	}
	
	@Test
	public void test_registration() {
		var registry = createRegistry();
		assertEquals(3, registry.getHandlers().size());
		assertSame(generic, registry.getHandlers().get(0));
		assertThrows(IllegalArgumentException.class, () -> registry.register(new RecordingHandler("Generic")));
		assertThrows(UnsupportedOperationException.class, () -> registry.getHandlers().clear());
		assertTrue(registry.getHandler("TagTree").isPresent());
		assertTrue(registry.getHandler("Unknown").isEmpty());
	}
	
	@Test
	public void test_activate() {
		var registry = createRegistry();
		assertTrue(registry.getActiveHandler().isEmpty());
		
		registry.activate("ImageRaster");
		assertSame(raster, registry.getActiveHandler().get());
		assertTrue(raster.isShowing());
		
		registry.activate("TagTree");
		assertSame(tagTree, registry.getActiveHandler().get());
		assertFalse(raster.isShowing());
		assertTrue(tagTree.isShowing());
		
		assertThrows(IllegalArgumentException.class, () -> registry.activate("Unknown"));
		assertSame(tagTree, registry.getActiveHandler().get());
	}
	
	@Test
	public void test_supportsDoesNotLoad() {
		var registry = createRegistry();
		registry.autoSelect(Path.of("does", "not", "exist.tif"));
		assertTrue(generic.loaded.isEmpty());
		assertTrue(raster.loaded.isEmpty());
		assertTrue(tagTree.loaded.isEmpty());
	}

}
