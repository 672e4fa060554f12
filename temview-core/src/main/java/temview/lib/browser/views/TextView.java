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

import java.util.Objects;

/**
 * A view that shows plain text.
 */
public class TextView implements HandlerView {
	
	private boolean visible = false;
	private String text = "";
	
	/**
	 * Get the text.
	 * @return
	 */
	public String getText() {
		return text;
	}
	
	/**
	 * Set the text.
	 * @param text
	 */
	public void setText(String text) {
		this.text = Objects.requireNonNull(text);
	}

	@Override
	public void setVisible(boolean visible) {
		this.visible = visible;
	}

	@Override
	public boolean isVisible() {
		return visible;
	}

	/**
	 * Clears the text.
	 */
	@Override
	public void showPlaceholder() {
		text = "";
	}

	@Override
	public String getSummary() {
		return text;
	}

}
