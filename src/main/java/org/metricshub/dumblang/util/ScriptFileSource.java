package org.metricshub.dumblang.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DumbLang
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * DumbLang program stored in a UTF-8 file, as given to {@code run} or
 * {@code --emit-source} on the command line. The file is opened when the
 * parser first asks for it, so a missing file surfaces as a
 * {@link java.nio.file.NoSuchFileException} from {@link #getReader()}.
 */
public class ScriptFileSource extends ScriptSource {

	private final Path path;
	private Reader fileReader;

	public ScriptFileSource(String filePath) {
		this(Paths.get(filePath));
	}

	/**
	 * @param path the program file, which also describes the source in
	 *        syntax errors
	 */
	public ScriptFileSource(Path path) {
		super(path.toString(), null);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

	@Override
	public Reader getReader() throws IOException {
		if (fileReader == null) {
			fileReader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
		}
		return fileReader;
	}
}
