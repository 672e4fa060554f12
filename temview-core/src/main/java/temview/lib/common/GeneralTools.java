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

import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Collection of generally useful static methods for working with file names and strings.
 */
public final class GeneralTools {
	
	private static final Pattern PATTERN_EXTENSION = Pattern.compile("\\.\\w+");
	
	private static final Pattern PATTERN_NEWLINE = Pattern.compile("\\r\\n|\\n|\\r");
	
	// Suppress default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the extension of a file name. Some implementation notes:
	 * <ul>
	 * <li>This is 'the final dot and beyond', provided that what follows the dot contains only word characters.</li>
	 * <li>The dot is included as the first character.</li>
	 * <li>The extension is always returned in lower case, so that it can be compared directly 
	 * against the known extensions of a format.</li>
	 * </ul>
	 * @param name
	 * @return
	 * @see #getExtension(Path)
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		int ind = name.lastIndexOf('.');
		if (ind < 0)
			return Optional.empty();
		String ext = name.substring(ind);
		if (!PATTERN_EXTENSION.matcher(ext).matches())
			return Optional.empty();
		return Optional.of(ext.toLowerCase(Locale.ROOT));
	}
	
	/**
	 * Get the lower case extension of the file name of a path, including the dot.
	 * No check is performed to see if the path refers to a directory.
	 * @param path
	 * @return
	 */
	public static Optional<String> getExtension(Path path) {
		Objects.requireNonNull(path);
		Path name = path.getFileName();
		return name == null ? Optional.empty() : getExtension(name.toString());
	}
	
	/**
	 * Get the file name with extension removed.
	 * @param name
	 * @return
	 */
	public static String getNameWithoutExtension(String name) {
		var ext = getExtension(name).orElse(null);
		return ext == null ? name : name.substring(0, name.length() - ext.length());
	}
	
	/**
	 * Create a sibling path by replacing the extension of a file, or appending one if there is no extension.
	 * This is used to locate the companion files that some formats store next to the main file.
	 * @param path
	 * @param extension the new extension, with or without the leading dot
	 * @return
	 */
	public static Path replaceExtension(Path path, String extension) {
		Objects.requireNonNull(path);
		String ext = extension.startsWith(".") ? extension : "." + extension;
		String name = getNameWithoutExtension(path.getFileName().toString());
		return path.resolveSibling(name + ext);
	}
	
	/**
	 * Check whether a path ends with one of a number of specified extensions (case insensitive).
	 * Only the name is checked; the file is never opened.
	 * 
	 * @param path
	 * @param extensions extensions with or without leading dots
	 * @return
	 */
	public static boolean checkExtensions(final Path path, final Collection<String> extensions) {
		var ext = getExtension(path).orElse(null);
		if (ext == null)
			return false;
		for (String e : extensions) {
			String lower = e.toLowerCase(Locale.ROOT);
			if (!lower.startsWith("."))
				lower = "." + lower;
			if (ext.equals(lower))
				return true;
		}
		return false;
	}
	
	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}
	
	/**
	 * Split a String by lines, handling all common line endings.
	 * @param s
	 * @return
	 */
	public static String[] splitLines(final String s) {
		return PATTERN_NEWLINE.split(s, -1);
	}

}
