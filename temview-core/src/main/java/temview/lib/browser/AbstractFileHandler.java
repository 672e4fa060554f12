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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

import temview.lib.browser.views.HandlerView;
import temview.lib.common.GeneralTools;

/**
 * Abstract {@link FileHandler} that supports files by extension and wraps each load in a {@link LoadGuard}.
 *
 * @param <V> type of the view
 */
public abstract class AbstractFileHandler<V extends HandlerView> implements FileHandler {
	
	private final String name;
	private final List<String> extensions;
	private final V view;
	private final LoadGuard guard;
	
	protected AbstractFileHandler(String name, Collection<String> extensions, V view, StatusReporter reporter) {
		this.name = name;
		this.extensions = List.copyOf(extensions);
		this.view = view;
		this.guard = new LoadGuard(reporter);
	}

	@Override
	public String getName() {
		return name;
	}
	
	/**
	 * Get the lowercase file extensions supported by this handler, including the dot.
	 * @return
	 */
	public List<String> getExtensions() {
		return extensions;
	}

	@Override
	public boolean supportsFile(Path path) {
		return GeneralTools.checkExtensions(path, extensions);
	}

	@Override
	public V getView() {
		return view;
	}

	@Override
	public void onFileSelected(Path path) throws FileLoadException {
		guard.load(path, view, () -> loadFile(path));
	}
	
	/**
	 * Load a file and render it into the view.
	 * @param path
	 * @throws IOException
	 */
	protected abstract void loadFile(Path path) throws IOException;
	
	@Override
	public String toString() {
		return getClass().getSimpleName() + " [" + name + "]";
	}

}
