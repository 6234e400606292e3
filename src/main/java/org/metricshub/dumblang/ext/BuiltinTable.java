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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.metricshub.dumblang.util.DslLogger;
import org.slf4j.Logger;

/**
 * Immutable mapping of builtin names to host functions.
 * <p>
 * A table is assembled once with a {@link Builder} and then shared by every
 * run; later registrations of a name replace earlier ones.
 */
public final class BuiltinTable {

	private static final Logger LOG = DslLogger.getLogger(BuiltinTable.class);

	private static final BuiltinTable EMPTY = new BuiltinTable(Collections.<String, Builtin>emptyMap());

	private final Map<String, Builtin> builtins;

	private BuiltinTable(Map<String, Builtin> builtins) {
		this.builtins = Collections.unmodifiableMap(new LinkedHashMap<String, Builtin>(builtins));
	}

	/**
	 * @return a table without any builtin
	 */
	public static BuiltinTable empty() {
		return EMPTY;
	}

	/**
	 * @param builtins host functions keyed by name
	 * @return a table holding exactly these functions
	 */
	public static BuiltinTable of(Map<String, ? extends Builtin> builtins) {
		return builder().addAll(builtins).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @param name builtin name
	 * @return the builtin, or {@code null} when there is none of that name
	 */
	public Builtin get(String name) {
		return builtins.get(name);
	}

	public boolean contains(String name) {
		return builtins.containsKey(name);
	}

	/**
	 * @return the builtin names, in registration order
	 */
	public Set<String> names() {
		return builtins.keySet();
	}

	public int size() {
		return builtins.size();
	}

	/**
	 * Returns a builder initialized with the content of this table.
	 *
	 * @return a new builder
	 */
	public Builder toBuilder() {
		return builder().addAll(builtins);
	}

	/**
	 * Collects builtins before freezing them into a {@link BuiltinTable}.
	 */
	public static final class Builder {

		private final Map<String, Builtin> builtins = new LinkedHashMap<String, Builtin>();

		private Builder() {}

		/**
		 * @param name name DumbLang programs call the function by
		 * @param builtin the host function
		 * @return this builder
		 */
		public Builder add(String name, Builtin builtin) {
			if (name == null || name.isEmpty()) {
				throw new IllegalArgumentException("Builtin name must not be empty");
			}
			if (builtin == null) {
				throw new IllegalArgumentException("Builtin " + name + " must not be null");
			}
			if (builtins.put(name, builtin) != null) {
				LOG.debug("Builtin {} replaced", name);
			}
			return this;
		}

		public Builder addAll(Map<String, ? extends Builtin> other) {
			if (other != null) {
				for (Map.Entry<String, ? extends Builtin> entry : other.entrySet()) {
					add(entry.getKey(), entry.getValue());
				}
			}
			return this;
		}

		/**
		 * Adds every function of an annotated extension, bound to that
		 * extension instance.
		 *
		 * @param extension the extension, already initialized
		 * @return this builder
		 */
		public Builder addExtension(DslExtension extension) {
			for (ExtensionFunction function : extension.getExtensionFunctions().values()) {
				add(function.getKeyword(), function.bindTo(extension));
			}
			LOG.debug("Registered extension {}", extension.getExtensionName());
			return this;
		}

		public BuiltinTable build() {
			return new BuiltinTable(builtins);
		}
	}
}
