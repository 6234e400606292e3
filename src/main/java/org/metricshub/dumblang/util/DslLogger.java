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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the SLF4J loggers of DumbLang.
 * <p>
 * An embedded interpreter should not make SLF4J report which provider it
 * bound to, so the internal verbosity of SLF4J is lowered to {@code WARN},
 * unless the host application already chose a level.
 */
public final class DslLogger {

	/** System property read by SLF4J for its own diagnostics. */
	public static final String SLF4J_VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(SLF4J_VERBOSITY_PROPERTY) == null) {
			System.setProperty(SLF4J_VERBOSITY_PROPERTY, "WARN");
		}
	}

	private DslLogger() {}

	/**
	 * @param clazz class of the scanner, parser, evaluator or extension logging
	 * @return the SLF4J logger named after {@code clazz}
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
