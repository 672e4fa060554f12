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

package temview.lib.browser.views;

/**
 * The state rendered by a file handler.
 * <p>
 * Views hold whatever a host needs to present a file, but are not tied to any particular user interface.
 */
public interface HandlerView {
	
	/**
	 * Set whether the view is visible.
	 * @param visible
	 */
	void setVisible(boolean visible);
	
	/**
	 * Query whether the view is visible.
	 * @return
	 */
	boolean isVisible();
	
	/**
	 * Replace the content with a placeholder, used after a file could not be loaded.
	 */
	void showPlaceholder();
	
	/**
	 * Get a short text summary of the current content, suitable for logging or a console.
	 * @return
	 */
	String getSummary();

}
