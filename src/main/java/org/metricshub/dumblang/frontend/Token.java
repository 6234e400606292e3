package org.metricshub.dumblang.frontend;

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

import java.util.Objects;

/**
 * A lexical token: its type, the text it was read from (if any) and the line
 * it started on.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final int line;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param type category of the token
	 * @param text text payload, {@code null} for punctuation and EOF
	 * @param line 1-based source line
	 */
	public Token(TokenType type, String text, int line) {
		if (type == null) {
			throw new IllegalArgumentException("Token type must not be null");
		}
		this.type = type;
		this.text = text;
		this.line = line;
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	/**
	 * @param expectedType type to compare with
	 * @param expectedText text to compare with
	 * @return whether this token has the given type and text
	 */
	public boolean is(TokenType expectedType, String expectedText) {
		return type == expectedType && expectedText.equals(text);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return type == other.type && line == other.line && Objects.equals(text, other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, text, line);
	}

	@Override
	public String toString() {
		if (text == null) {
			return type.name();
		}
		return type.name() + " (" + text + ")";
	}
}
