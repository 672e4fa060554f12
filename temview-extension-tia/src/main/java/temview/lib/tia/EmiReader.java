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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/**
 * Reader for TIA EMI files.
 * <p>
 * An EMI file is a binary container, but the acquisition parameters are stored as an XML document 
 * enclosed in an {@code <ObjectInfo>} element. Only that document is read.
 * Leaf elements become values (numbers where possible), nested elements become maps and 
 * repeated elements become lists.
 */
class EmiReader {
	
	private static final String START_TAG = "<ObjectInfo>";
	private static final String END_TAG = "</ObjectInfo>";
	
	private static final Pattern PATTERN_INTEGER = Pattern.compile("[+-]?\\d{1,18}");
	private static final Pattern PATTERN_DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
	
	static Map<String, Object> read(Path path) throws IOException {
		return parse(Files.readAllBytes(path));
	}
	
	static Map<String, Object> parse(byte[] bytes) throws IOException {
		// Single-byte decoding keeps offsets aligned with the bytes
		String text = new String(bytes, StandardCharsets.ISO_8859_1);
		int start = text.indexOf(START_TAG);
		int end = start < 0 ? -1 : text.indexOf(END_TAG, start);
		if (start < 0 || end < 0)
			throw new IOException("No " + START_TAG + " element found in EMI file");
		
		byte[] xml = text.substring(start, end + END_TAG.length()).getBytes(StandardCharsets.ISO_8859_1);
		try {
			var factory = DocumentBuilderFactory.newInstance();
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
			var doc = factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml));
			var root = doc.getDocumentElement();
			Object value = toValue(root);
			var map = new LinkedHashMap<String, Object>();
			if (value instanceof Map) {
				for (var entry : ((Map<?, ?>)value).entrySet())
					map.put(entry.getKey().toString(), entry.getValue());
			}
			return map;
		} catch (ParserConfigurationException | SAXException e) {
			throw new IOException("Unable to parse EMI metadata: " + e.getLocalizedMessage(), e);
		}
	}
	
	private static Object toValue(Element element) {
		var children = new ArrayList<Element>();
		for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
			if (node instanceof Element)
				children.add((Element)node);
		}
		if (children.isEmpty())
			return parseText(element.getTextContent());
		
		var map = new LinkedHashMap<String, Object>();
		for (var child : children) {
			String name = child.getTagName();
			Object value = toValue(child);
			if (!map.containsKey(name)) {
				map.put(name, value);
				continue;
			}
			var existing = map.get(name);
			if (existing instanceof RepeatedValues)
				((RepeatedValues)existing).add(value);
			else {
				var list = new RepeatedValues();
				list.add(existing);
				list.add(value);
				map.put(name, list);
			}
		}
		return map;
	}
	
	static Object parseText(String text) {
		String s = text == null ? "" : text.strip();
		if (PATTERN_INTEGER.matcher(s).matches())
			return Long.parseLong(s);
		if (PATTERN_DECIMAL.matcher(s).matches())
			return Double.parseDouble(s);
		return s;
	}
	
	/**
	 * List used to collect elements that occur more than once, so that it can be distinguished from 
	 * values that happen to be lists.
	 */
	private static class RepeatedValues extends ArrayList<Object> {
		private static final long serialVersionUID = 1L;
	}

}
