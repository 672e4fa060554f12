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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.common.Prefs;

/**
 * Dispatches file selections to the handlers of a {@link HandlerRegistry}.
 * <p>
 * Selections are handled one at a time, and each load runs to completion before the next is accepted.
 * Load failures are contained by the handlers: the methods here return {@code false} rather than throwing.
 */
public class DataBrowser {
	
	private static final Logger logger = LoggerFactory.getLogger(DataBrowser.class);
	
	private final HandlerRegistry registry;
	private boolean autoSelect;
	private Path currentFile;
	
	/**
	 * Create a browser for the handlers of a registry, using the auto-select setting from {@link Prefs}.
	 * @param registry
	 */
	public DataBrowser(HandlerRegistry registry) {
		this(registry, Prefs.getAutoSelectHandler());
	}
	
	/**
	 * Create a browser for the handlers of a registry.
	 * @param registry
	 * @param autoSelect if true, choose the handler for each selected file automatically
	 */
	public DataBrowser(HandlerRegistry registry, boolean autoSelect) {
		this.registry = Objects.requireNonNull(registry);
		this.autoSelect = autoSelect;
	}
	
	/**
	 * Get the registry of handlers.
	 * @return
	 */
	public HandlerRegistry getRegistry() {
		return registry;
	}
	
	/**
	 * Query whether handlers are chosen automatically for each selected file.
	 * @return
	 */
	public boolean isAutoSelect() {
		return autoSelect;
	}
	
	/**
	 * Set whether handlers are chosen automatically for each selected file.
	 * This takes effect on the next selection.
	 * @param autoSelect
	 */
	public void setAutoSelect(boolean autoSelect) {
		this.autoSelect = autoSelect;
	}
	
	/**
	 * Get the most recently selected file.
	 * @return
	 */
	public Optional<Path> getCurrentFile() {
		return Optional.ofNullable(currentFile);
	}
	
	/**
	 * Select a file, and load it with the active handler (or an automatically chosen handler).
	 * Selecting the same file again reloads it.
	 * Directories are ignored.
	 * @param path
	 * @return true if the file was loaded, false if it could not be loaded or is a directory
	 */
	public boolean selectFile(Path path) {
		Objects.requireNonNull(path);
		if (Files.isDirectory(path)) {
			logger.debug("Ignoring directory {}", path);
			return false;
		}
		currentFile = path;
		var active = registry.getActiveHandler().orElse(null);
		if (autoSelect) {
			var handler = registry.autoSelect(path);
			if (handler != active)
				return setActiveHandler(handler.getName());
			return load(handler, path);
		}
		if (active == null)
			return setActiveHandler(registry.getDefaultHandler().getName());
		return load(active, path);
	}
	
	/**
	 * Make a handler active and, if a file has been selected, load it with the handler.
	 * @param name
	 * @return true if no file is selected or the file was loaded, false if the file could not be loaded
	 * @throws IllegalArgumentException if no handler with the name is registered
	 */
	public boolean setActiveHandler(String name) throws IllegalArgumentException {
		var handler = registry.activate(name);
		if (currentFile == null)
			return true;
		return load(handler, currentFile);
	}
	
	private static boolean load(FileHandler handler, Path path) {
		try {
			handler.onFileSelected(path);
			return true;
		} catch (FileLoadException e) {
			logger.debug("{} could not load {}", handler.getName(), e.getPath());
			return false;
		}
	}

}
