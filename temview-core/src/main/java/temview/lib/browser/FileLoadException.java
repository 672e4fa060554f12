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

/**
 * Exception thrown when a handler failed to load a file. 
 * By the time this is thrown, the failure has already been reported to the user and the handler's view 
 * shows a placeholder.
 */
public class FileLoadException extends IOException {

	private static final long serialVersionUID = 1L;
	
	private final transient Path path;
	
	/**
	 * Create an exception for a file that could not be loaded.
	 * @param path
	 * @param cause
	 */
	public FileLoadException(Path path, Throwable cause) {
		super("Failed to load " + path, cause);
		this.path = path;
	}
	
	/**
	 * Get the file that could not be loaded.
	 * @return
	 */
	public Path getPath() {
		return path;
	}

}
