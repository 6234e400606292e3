package org.metricshub.dumblang.ext;

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

import java.util.Map;
import org.metricshub.dumblang.util.DslSettings;

/**
 * A set of builtins contributed by the host to DumbLang programs.
 * <p>
 * Extensions are initialized once, with the settings of the
 * {@link org.metricshub.dumblang.DumbLang} instance they are registered with,
 * before any of their functions is called.
 */
public interface DslExtension {

	/**
	 * @return a human readable name for this extension
	 */
	String getExtensionName();

	/**
	 * Prepares the extension for the runs of a
	 * {@link org.metricshub.dumblang.DumbLang} instance.
	 *
	 * @param settings input, output and prompt configuration
	 */
	void init(DslSettings settings);

	/**
	 * @return the functions this extension provides, keyed by DumbLang name
	 */
	Map<String, ExtensionFunction> getExtensionFunctions();
}
