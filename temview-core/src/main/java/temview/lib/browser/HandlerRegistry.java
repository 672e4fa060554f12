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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import temview.lib.common.Prefs;

/**
 * Ordered collection of file handlers, with at most one active handler.
 * <p>
 * Handlers are registered once during startup, and the order matters: 
 * {@link #autoSelect(Path)} prefers the most recently registered handler that supports a file, 
 * so generic handlers should be registered first and specific handlers last.
 */
public class HandlerRegistry {
	
	private static final Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);
	
	private final List<FileHandler> handlers = new ArrayList<>();
	private String defaultHandlerName;
	private FileHandler activeHandler;
	
	/**
	 * Create an empty registry, using the default handler name from {@link Prefs}.
	 */
	public HandlerRegistry() {
		this(Prefs.getDefaultHandlerName());
	}
	
	/**
	 * Create an empty registry with the specified default handler name.
	 * @param defaultHandlerName name of the handler used when no other handler supports a file
	 */
	public HandlerRegistry(String defaultHandlerName) {
		this.defaultHandlerName = Objects.requireNonNull(defaultHandlerName);
	}
	
	/**
	 * Append a handler.
	 * @param handler
	 * @throws IllegalArgumentException if a handler with the same name is already registered
	 */
	public void register(FileHandler handler) throws IllegalArgumentException {
		Objects.requireNonNull(handler);
		if (getHandler(handler.getName()).isPresent())
			throw new IllegalArgumentException("A handler named '" + handler.getName() + "' is already registered");
		handlers.add(handler);
		logger.debug("Registered handler {}", handler.getName());
	}
	
	/**
	 * Get all handlers, in registration order.
	 * @return
	 */
	public List<FileHandler> getHandlers() {
		return Collections.unmodifiableList(handlers);
	}
	
	/**
	 * Get a handler by name.
	 * @param name
	 * @return
	 */
	public Optional<FileHandler> getHandler(String name) {
		return handlers.stream().filter(h -> h.getName().equals(name)).findFirst();
	}
	
	/**
	 * Get the name of the handler used when no other handler supports a file.
	 * @return
	 */
	public String getDefaultHandlerName() {
		return defaultHandlerName;
	}
	
	/**
	 * Set the name of the handler used when no other handler supports a file.
	 * @param name
	 */
	public void setDefaultHandlerName(String name) {
		this.defaultHandlerName = Objects.requireNonNull(name);
	}
	
	/**
	 * Get the default handler. If no handler with the default name is registered, the first handler is returned.
	 * @return
	 * @throws IllegalStateException if no handlers are registered
	 */
	public FileHandler getDefaultHandler() throws IllegalStateException {
		if (handlers.isEmpty())
			throw new IllegalStateException("No handlers are registered");
		var handler = getHandler(defaultHandlerName);
		if (handler.isPresent())
			return handler.get();
		logger.warn("Default handler '{}' is not registered, using '{}'", defaultHandlerName, handlers.get(0).getName());
		return handlers.get(0);
	}
	
	/**
	 * Choose a handler for a file.
	 * Handlers are checked in reverse registration order, and the first that supports the file is returned.
	 * If none does, the default handler is returned.
	 * @param path
	 * @return
	 * @throws IllegalStateException if no handlers are registered
	 */
	public FileHandler autoSelect(Path path) throws IllegalStateException {
		for (int i = handlers.size()-1; i >= 0; i--) {
			var handler = handlers.get(i);
			if (handler.supportsFile(path))
				return handler;
		}
		return getDefaultHandler();
	}
	
	/**
	 * Get the active handler.
	 * @return the active handler, or empty if none has been activated
	 */
	public Optional<FileHandler> getActiveHandler() {
		return Optional.ofNullable(activeHandler);
	}
	
	/**
	 * Make a handler active. The view of the previously active handler is hidden, and the view of 
	 * the new handler is shown.
	 * @param name
	 * @return the handler that is now active
	 * @throws IllegalArgumentException if no handler with the name is registered
	 */
	public FileHandler activate(String name) throws IllegalArgumentException {
		var handler = getHandler(name).orElseThrow(() -> new IllegalArgumentException("No handler named '" + name + "'"));
		var previous = activeHandler;
		if (previous != null && previous != handler)
			previous.hide();
		activeHandler = handler;
		handler.show();
		logger.debug("Active handler: {}", name);
		return handler;
	}

}
