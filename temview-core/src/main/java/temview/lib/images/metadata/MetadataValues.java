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

package temview.lib.images.metadata;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Static helpers to convert the loosely-typed values found in native metadata trees 
 * into the values stored by a {@link MetadataRecord}.
 */
public final class MetadataValues {
	
	// Suppress default constructor for non-instantiability
	private MetadataValues() {
		throw new AssertionError();
	}
	
	/**
	 * Flatten a value into a map with dotted keys.
	 * <ul>
	 * <li>Nested maps become one entry per leaf, e.g. {@code BinaryResult.PixelSize.width}</li>
	 * <li>Lists and arrays that contain maps are flattened using the index as key, e.g. {@code Calibration.0.CalibrationDelta}</li>
	 * <li>Other lists and arrays become unmodifiable lists</li>
	 * <li>Byte arrays are decoded as UTF-8 text</li>
	 * <li>Null values are skipped</li>
	 * </ul>
	 * @param key
	 * @param value
	 * @param target map to receive the flattened values
	 */
	public static void flatten(String key, Object value, Map<String, Object> target) {
		if (value == null)
			return;
		if (value instanceof Map) {
			for (var entry : ((Map<?, ?>)value).entrySet())
				flatten(key + "." + entry.getKey(), entry.getValue(), target);
			return;
		}
		if (value instanceof byte[]) {
			target.put(key, toText((byte[])value));
			return;
		}
		List<Object> list = toList(value);
		if (list != null) {
			if (list.stream().anyMatch(v -> v instanceof Map)) {
				for (int i = 0; i < list.size(); i++)
					flatten(key + "." + i, list.get(i), target);
			} else
				target.put(key, list);
			return;
		}
		target.put(key, value);
	}
	
	/**
	 * Decode bytes as UTF-8 text, dropping any trailing zero bytes.
	 * Malformed input is replaced rather than causing an exception.
	 * @param bytes
	 * @return
	 */
	public static String toText(byte[] bytes) {
		int n = bytes.length;
		while (n > 0 && bytes[n-1] == 0)
			n--;
		return new String(bytes, 0, n, StandardCharsets.UTF_8);
	}
	
	private static List<Object> toList(Object value) {
		if (value instanceof Collection) {
			return Collections.unmodifiableList(new ArrayList<>((Collection<?>)value));
		}
		if (value.getClass().isArray()) {
			int n = Array.getLength(value);
			List<Object> list = new ArrayList<>(n);
			for (int i = 0; i < n; i++)
				list.add(Array.get(value, i));
			return Collections.unmodifiableList(list);
		}
		return null;
	}
	
	/**
	 * Get a value as a double.
	 * @param map
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if the value is missing or cannot be interpreted as a number
	 */
	public static double requireDouble(Map<String, ?> map, String key) throws IllegalArgumentException {
		Object value = map.get(key);
		if (value instanceof Number)
			return ((Number)value).doubleValue();
		if (value instanceof String)
			return Double.parseDouble(((String)value).strip());
		if (value == null)
			throw new IllegalArgumentException("No value found for " + key);
		throw new IllegalArgumentException("Value of " + key + " is not numeric: " + value);
	}
	
	/**
	 * Get a value as a String.
	 * @param map
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if the value is missing
	 */
	public static String requireString(Map<String, ?> map, String key) throws IllegalArgumentException {
		Object value = map.get(key);
		if (value == null)
			throw new IllegalArgumentException("No value found for " + key);
		if (value instanceof byte[])
			return toText((byte[])value);
		return value.toString();
	}
	
	/**
	 * Cast a value to a map.
	 * @param value
	 * @return
	 * @throws IllegalArgumentException if the value is not a map
	 */
	@SuppressWarnings("unchecked")
	public static Map<String, ?> requireMap(Object value) throws IllegalArgumentException {
		if (value instanceof Map)
			return (Map<String, ?>)value;
		throw new IllegalArgumentException("Expected a map, but got " + value);
	}
	
	/**
	 * Cast a value to a list, converting arrays if needed.
	 * @param value
	 * @return
	 * @throws IllegalArgumentException if the value is not a list or array
	 */
	public static List<?> requireList(Object value) throws IllegalArgumentException {
		if (value != null && (value instanceof Collection || value.getClass().isArray()))
			return toList(value);
		throw new IllegalArgumentException("Expected a list, but got " + value);
	}

}
