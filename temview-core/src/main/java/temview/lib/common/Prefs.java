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

/**
 * Core TemView preferences. These are not persistent; a host application may set them at startup.
 */
public class Prefs {
	
	/**
	 * Name of the handler used when no registered handler claims a file.
	 */
	public static final String DEFAULT_HANDLER_NAME = "TEM metadata viewer";
	
	/**
	 * Default number of metadata records retained per extractor.
	 */
	public static final int DEFAULT_METADATA_CACHE_SIZE = 10;
	
	private static boolean autoSelectHandler = false;
	
	private static String defaultHandlerName = DEFAULT_HANDLER_NAME;
	
	private static int metadataCacheSize = DEFAULT_METADATA_CACHE_SIZE;
	
	/**
	 * Query whether the handler should be chosen automatically for each selected file.
	 * @return
	 */
	public static boolean getAutoSelectHandler() {
		return autoSelectHandler;
	}

	/**
	 * Set whether the handler should be chosen automatically for each selected file.
	 * @param autoSelect
	 */
	public static void setAutoSelectHandler(boolean autoSelect) {
		autoSelectHandler = autoSelect;
	}
	
	/**
	 * Get the name of the fallback handler.
	 * @return
	 */
	public static String getDefaultHandlerName() {
		return defaultHandlerName;
	}
	
	/**
	 * Set the name of the fallback handler. A blank name restores {@link #DEFAULT_HANDLER_NAME}.
	 * @param name
	 */
	public static void setDefaultHandlerName(String name) {
		defaultHandlerName = GeneralTools.blankString(name, true) ? DEFAULT_HANDLER_NAME : name;
	}
	
	/**
	 * Get the number of metadata records retained per extractor.
	 * @return
	 */
	public static int getMetadataCacheSize() {
		return metadataCacheSize;
	}

	/**
	 * Set the number of metadata records retained per extractor. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setMetadataCacheSize(int n) {
		metadataCacheSize = Math.max(1, n);
	}

}
