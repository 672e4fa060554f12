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
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestDataBrowser {
	
	private List<String> messages;
	private RecordingHandler generic;
	private RecordingHandler raster;
	private RecordingHandler tagTree;
	private HandlerRegistry registry;
	
	@BeforeEach
	public void createRegistry() {
		messages = new ArrayList<>();
		generic = new RecordingHandler("Generic", messages::add, ".dm3");
		raster = new RecordingHandler("ImageRaster", messages::add, ".png", ".tif");
		tagTree = new RecordingHandler("TagTree", messages::add, ".dm3", ".dm4");
		registry = new HandlerRegistry("Generic");
		registry.register(generic);
		registry.register(raster);
		registry.register(tagTree);
	}
	
	@Test
	public void test_defaultHandlerActivatedFirst() {
		var browser = new DataBrowser(registry, false);
		assertTrue(browser.selectFile(Path.of("a.png")));
		assertSame(generic, registry.getActiveHandler().get());
		assertEquals(List.of(Path.of("a.png")), generic.loaded);
		assertTrue(generic.isShowing());
	}
	
	@Test
	public void test_explicitSelectionAlwaysReloads() {
		var browser = new DataBrowser(registry, false);
		browser.setActiveHandler("TagTree");
		var path = Path.of("a.dm3");
		browser.selectFile(path);
		browser.selectFile(path);
		browser.selectFile(path);
		assertEquals(List.of(path, path, path), tagTree.loaded);
		assertTrue(generic.loaded.isEmpty());
	}
	
	@Test
	public void test_switchHandlerReloadsCurrentFile() {
		var browser = new DataBrowser(registry, false);
		browser.setActiveHandler("Generic");
		var path = Path.of("a.dm3");
		browser.selectFile(path);
		assertEquals(1, generic.loaded.size());
		
		assertTrue(browser.setActiveHandler("TagTree"));
		assertEquals(List.of(path), tagTree.loaded);
		assertFalse(generic.isShowing());
		assertTrue(tagTree.isShowing());
		assertEquals(1, generic.loaded.size());
	}
	
	@Test
	public void test_switchHandlerWithoutFile() {
		var browser = new DataBrowser(registry, false);
		assertTrue(browser.setActiveHandler("ImageRaster"));
		assertTrue(raster.loaded.isEmpty());
		assertTrue(browser.getCurrentFile().isEmpty());
		assertThrows(IllegalArgumentException.class, () -> browser.setActiveHandler("Unknown"));
	}
	
	@Test
	public void test_autoSelect() {
		var browser = new DataBrowser(registry, true);
		
		browser.selectFile(Path.of("a.tif"));
		assertSame(raster, registry.getActiveHandler().get());
		assertEquals(1, raster.loaded.size());
		
		// Same handler again, loaded once per selection
		browser.selectFile(Path.of("b.png"));
		assertSame(raster, registry.getActiveHandler().get());
		assertEquals(2, raster.loaded.size());
		
		browser.selectFile(Path.of("c.dm4"));
		assertSame(tagTree, registry.getActiveHandler().get());
		assertEquals(List.of(Path.of("c.dm4")), tagTree.loaded);
		assertFalse(raster.isShowing());
		
		browser.selectFile(Path.of("d.unknown"));
		assertSame(generic, registry.getActiveHandler().get());
		assertEquals(List.of(Path.of("d.unknown")), generic.loaded);
	}
	
	@Test
	public void test_failureContained() {
		var browser = new DataBrowser(registry, true);
		raster.fail = true;
		var path = Path.of("broken.tif");
		assertFalse(browser.selectFile(path));
		assertEquals(1, messages.size());
		assertTrue(messages.get(0).contains(path.toString()));
		assertEquals("", raster.getView().getText());
		assertEquals(path, browser.getCurrentFile().get());
		
		raster.fail = false;
		assertTrue(browser.selectFile(path));
		assertEquals(1, messages.size());
	}
	
	@Test
	public void test_directoriesIgnored(@TempDir Path dir) {
		var browser = new DataBrowser(registry, true);
		assertFalse(browser.selectFile(dir));
		assertTrue(browser.getCurrentFile().isEmpty());
		assertTrue(registry.getActiveHandler().isEmpty());
		assertTrue(messages.isEmpty());
	}

}
