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

package temview.lib.tia;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestEmiReader {
	
	private static byte[] wrap(String xml) {
		return ("\u0001\u0002binary" + xml + "\u0000\u0000more").getBytes(StandardCharsets.ISO_8859_1);
	}
	
	@Test
	public void test_parse() throws IOException {
		var emi = EmiReader.parse(wrap("<ObjectInfo>"
				+ "<ExperimentalConditions>"
				+ "<MicroscopeConditions><AcceleratingVoltage>300000</AcceleratingVoltage>"
				+ "<Tilt1>-0.0125</Tilt1><Mode>STEM nP SA Zoom Diffraction</Mode></MicroscopeConditions>"
				+ "</ExperimentalConditions>"
				+ "<Uuid>8d91a4</Uuid>"
				+ "<Detector>HAADF</Detector><Detector>BF</Detector>"
				+ "<Empty></Empty>"
				+ "</ObjectInfo>"));
		var conditions = (Map<?, ?>)((Map<?, ?>)emi.get("ExperimentalConditions")).get("MicroscopeConditions");
		assertEquals(300000L, conditions.get("AcceleratingVoltage"));
		assertEquals(-0.0125, conditions.get("Tilt1"));
		assertEquals("STEM nP SA Zoom Diffraction", conditions.get("Mode"));
		assertEquals("8d91a4", emi.get("Uuid"));
		assertEquals(List.of("HAADF", "BF"), emi.get("Detector"));
		assertEquals("", emi.get("Empty"));
	}
	
	@Test
	public void test_parseText() {
		assertEquals(12L, EmiReader.parseText(" 12 "));
		assertEquals(-3L, EmiReader.parseText("-3"));
		assertEquals(1.5e-9, EmiReader.parseText("1.5e-9"));
		assertEquals(0.5, EmiReader.parseText(".5"));
		assertEquals(1e30, EmiReader.parseText("1000000000000000000000000000000"));
		assertEquals("1.2.3", EmiReader.parseText("1.2.3"));
		assertEquals("NaN", EmiReader.parseText("NaN"));
	}
	
	@Test
	public void test_invalid() {
		var e = assertThrows(IOException.class, () -> EmiReader.parse(wrap("<Other>1</Other>")));
		assertTrue(e.getMessage().contains("ObjectInfo"));
		assertThrows(IOException.class, () -> EmiReader.parse(wrap("<ObjectInfo><A></B></ObjectInfo>")));
		assertThrows(IOException.class, () -> EmiReader.parse(wrap("<ObjectInfo><A>1</A>")));
	}

}
