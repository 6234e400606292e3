package org.metricshub.dumblang.backend;

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

/**
 * How a statement finished: normally, in which case execution continues with
 * the next statement, or through a {@code return}, carrying the returned
 * value up to the enclosing function call.
 */
final class Completion {

	static final Completion NORMAL = new Completion(false, null);

	private static final Completion RETURNED_NOTHING = new Completion(true, null);

	private final boolean returned;
	private final Object value;

	private Completion(boolean returned, Object value) {
		this.returned = returned;
		this.value = value;
	}

	static Completion returned(Object value) {
		return value == null ? RETURNED_NOTHING : new Completion(true, value);
	}

	boolean isReturn() {
		return returned;
	}

	/**
	 * @return the returned value, {@code null} for a normal completion or a
	 *         bare {@code return}
	 */
	Object getValue() {
		return value;
	}

	@Override
	public String toString() {
		return returned ? "RETURN(" + value + ")" : "NORMAL";
	}
}
