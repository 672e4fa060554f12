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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestImageIoFormatReader {
	
	@TempDir
	Path dir;
	
	@Test
	public void test_grayPng() throws IOException {
		var img = new BufferedImage(6, 4, BufferedImage.TYPE_BYTE_GRAY);
		img.getRaster().setSample(5, 3, 0, 200);
		var path = dir.resolve("gray.png");
		ImageIO.write(img, "png", path.toFile());
		
		var raw = new ImageIoFormatReader().readArray(path);
		assertArrayEquals(new int[] {4, 6}, raw.getArray().getShape());
		assertEquals(200, raw.getArray().get(3, 5));
		assertEquals(0, raw.getArray().get(0, 0));
		assertEquals("", raw.getPixelUnit(0));
	}
	
	@Test
	public void test_rgbPng() throws IOException {
		var img = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
		img.setRGB(2, 1, 0x102030);
		var path = dir.resolve("rgb.png");
		ImageIO.write(img, "png", path.toFile());
		
		var array = new ImageIoFormatReader().readArray(path).getArray();
		assertArrayEquals(new int[] {2, 3, 3}, array.getShape());
		assertEquals(0x10, array.get(1, 2, 0));
		assertEquals(0x20, array.get(1, 2, 1));
		assertEquals(0x30, array.get(1, 2, 2));
	}
	
	@Test
	public void test_notAnImage() throws IOException {
		var path = dir.resolve("broken.png");
		Files.write(path, new byte[] {1, 2, 3, 4});
		assertThrows(IOException.class, () -> new ImageIoFormatReader().readArray(path));
	}

}
