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

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.dumblang.ext.annotations.DslFunction;
import org.metricshub.dumblang.util.DslSettings;

/**
 * Base class of extensions declaring their builtins as methods annotated with
 * {@link DslFunction}.
 */
public abstract class AbstractExtension implements DslExtension {

	private DslSettings settings;
	private Map<String, ExtensionFunction> functions;

	@Override
	public void init(DslSettings initSettings) {
		this.settings = initSettings;
	}

	/**
	 * @return the settings passed to {@link #init(DslSettings)}
	 * @throws IllegalStateException when the extension was not initialized
	 */
	protected final DslSettings getSettings() {
		if (settings == null) {
			throw new IllegalStateException("Extension " + getExtensionName() + " has not been initialized");
		}
		return settings;
	}

	@Override
	public synchronized Map<String, ExtensionFunction> getExtensionFunctions() {
		if (functions == null) {
			Map<String, ExtensionFunction> collected = new LinkedHashMap<String, ExtensionFunction>();
			for (Class<?> type = getClass(); type != null && type != Object.class; type = type.getSuperclass()) {
				for (Method method : type.getDeclaredMethods()) {
					DslFunction annotation = method.getAnnotation(DslFunction.class);
					if (annotation == null || collected.containsKey(annotation.value())) {
						continue;
					}
					collected.put(annotation.value(), new ExtensionFunction(annotation, method));
				}
			}
			functions = Collections.unmodifiableMap(collected);
		}
		return functions;
	}
}
