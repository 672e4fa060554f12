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

package temview.lib.common;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_fileExtensions() {
		assertNull(GeneralTools.getExtension("My file").orElse(null));
		assertNull(GeneralTools.getExtension("archive.").orElse(null));
		assertNull(GeneralTools.getExtension("odd.name with space").orElse(null));
		assertEquals(".dm4", GeneralTools.getExtension("image.DM4").orElse(null));
		assertEquals(".gz", GeneralTools.getExtension("data.tar.gz").orElse(null));
		assertEquals(".mrc", GeneralTools.getExtension(Path.of("dir.x", "stack.Mrc")).orElse(null));
		assertEquals("stack", GeneralTools.getNameWithoutExtension("stack.MRC"));
		assertEquals("no extension", GeneralTools.getNameWithoutExtension("no extension"));
	}
	
	@Test
	public void test_replaceExtension() {
		var path = Path.of("data", "tilt_series.mrc");
		assertEquals(Path.of("data", "tilt_series.rawtlt"), GeneralTools.replaceExtension(path, ".rawtlt"));
		assertEquals(Path.of("data", "tilt_series.txt"), GeneralTools.replaceExtension(path, "txt"));
		assertEquals(Path.of("plain.txt"), GeneralTools.replaceExtension(Path.of("plain"), ".txt"));
	}
	
	@Test
	public void test_checkExtensions() {
		var extensions = List.of(".tif", "png");
		assertTrue(GeneralTools.checkExtensions(Path.of("a.TIF"), extensions));
		assertTrue(GeneralTools.checkExtensions(Path.of("a.png"), extensions));
		assertFalse(GeneralTools.checkExtensions(Path.of("a.tiff"), extensions));
		assertFalse(GeneralTools.checkExtensions(Path.of("tif"), extensions));
	}
	
	@Test
	public void test_splitLines() {
		assertArrayEquals(new String[] {"a", "b", "c", ""}, GeneralTools.splitLines("a\r\nb\rc\n"));
		assertArrayEquals(new String[] {""}, GeneralTools.splitLines(""));
	}
	
	@Test
	public void test_blankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("  ", true));
		assertFalse(GeneralTools.blankString("  ", false));
	}

}
