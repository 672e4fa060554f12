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

import temview.lib.browser.views.HandlerView;

/**
 * A handler knows how to present one or more types of file, and owns the view it renders into.
 */
public interface FileHandler {
	
	/**
	 * Get the name of the handler, as shown to the user. Names are unique within a {@link HandlerRegistry}.
	 * @return
	 */
	String getName();
	
	/**
	 * Query whether the handler is likely able to read a file.
	 * This must only check the file name, and never open the file.
	 * @param path
	 * @return
	 */
	boolean supportsFile(Path path);
	
	/**
	 * Load a file and render it into the view.
	 * @param path
	 * @throws FileLoadException if the file could not be loaded; the view then shows a placeholder
	 */
	void onFileSelected(Path path) throws FileLoadException;
	
	/**
	 * Get the view that the handler renders into.
	 * @return
	 */
	HandlerView getView();
	
	/**
	 * Make the handler's view visible.
	 */
	default void show() {
		getView().setVisible(true);
	}
	
	/**
	 * Hide the handler's view.
	 */
	default void hide() {
		getView().setVisible(false);
	}
	
	/**
	 * Query whether the handler's view is visible.
	 * @return
	 */
	default boolean isShowing() {
		return getView().isVisible();
	}

}
