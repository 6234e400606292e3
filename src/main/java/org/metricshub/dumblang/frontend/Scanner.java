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

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.metricshub.dumblang.frontend.ast.ParserException;

/**
 * Lexical scanner for DumbLang programs.
 * <p>
 * Characters are pulled from the underlying {@link Reader} only as tokens are
 * requested, so the token sequence is lazy and forward-only. It always ends
 * with exactly one {@link TokenType#EOF} token, after which {@link #hasNext()}
 * returns {@code false}.
 * <p>
 * Whitespace separates tokens, {@code #} starts a comment that runs to the end
 * of the line, identifiers are runs of ASCII letters, numbers are runs of
 * digits with at most one decimal point, and strings are delimited by double
 * quotes without any escape sequence.
 */
public class Scanner implements Iterator<Token> {

	private static final int NOT_READ = -2;

	private final Reader reader;
	private final String sourceDescription;

	private int c = NOT_READ;
	private int line = 1;
	private boolean eofReturned;

	private final StringBuilder text = new StringBuilder();

	/**
	 * <p>
	 * Constructor for Scanner.
	 * </p>
	 *
	 * @param reader where the program text is read from
	 * @param sourceDescription description of the source, used in diagnostics
	 */
	public Scanner(Reader reader, String sourceDescription) {
		if (reader == null) {
			throw new IllegalArgumentException("Reader must not be null");
		}
		this.reader = reader;
		this.sourceDescription = sourceDescription;
	}

	@Override
	public boolean hasNext() {
		return !eofReturned;
	}

	/**
	 * Scans and returns the next token.
	 *
	 * @return the next token, {@link TokenType#EOF} once the input is exhausted
	 * @throws NoSuchElementException when called after EOF was returned
	 * @throws ParserException on an unterminated string literal
	 * @throws UncheckedIOException when the underlying reader fails
	 */
	@Override
	public Token next() {
		if (eofReturned) {
			throw new NoSuchElementException("EOF has already been returned");
		}
		if (c == NOT_READ) {
			read();
		}
		skipWhitespacesAndComments();

		if (c < 0) {
			eofReturned = true;
			return new Token(TokenType.EOF, null, line);
		}

		if (isLetter(c)) {
			return readIdentifier();
		}
		if (isDigit(c)) {
			return readNumber();
		}
		if (c == '"') {
			return readString();
		}

		int tokenLine = line;
		char ch = (char) c;
		read();
		switch (ch) {
		case ';':
			return new Token(TokenType.STATEMENT_END, ";", tokenLine);
		case '{':
			return new Token(TokenType.BLOCK_OPEN, "{", tokenLine);
		case '}':
			return new Token(TokenType.BLOCK_CLOSE, "}", tokenLine);
		case '(':
			return new Token(TokenType.PAREN_OPEN, "(", tokenLine);
		case ')':
			return new Token(TokenType.PAREN_CLOSE, ")", tokenLine);
		case '[':
			return new Token(TokenType.ARRAY_OPEN, "[", tokenLine);
		case ']':
			return new Token(TokenType.ARRAY_CLOSE, "]", tokenLine);
		case ',':
			return new Token(TokenType.ARRAY_SEPARATOR, ",", tokenLine);
		case '=':
			if (c == '=') {
				read();
				return new Token(TokenType.OPERATOR, "==", tokenLine);
			}
			return new Token(TokenType.ASSIGN, "=", tokenLine);
		default:
			// + - * / ^ < > and anything unknown, which the parser rejects
			return new Token(TokenType.OPERATOR, String.valueOf(ch), tokenLine);
		}
	}

	/**
	 * @return the line the scanner is currently positioned on
	 */
	public int getLine() {
		return line;
	}

	private void read() {
		try {
			c = reader.read();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + sourceDescription, e);
		}
	}

	private void skipWhitespacesAndComments() {
		while (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '#') {
			if (c == '#') {
				// kill comment, the newline is consumed on the next iteration
				while (c >= 0 && c != '\n') {
					read();
				}
				continue;
			}
			if (c == '\n') {
				line++;
			}
			read();
		}
	}

	private Token readIdentifier() {
		int tokenLine = line;
		text.setLength(0);
		while (isLetter(c)) {
			text.append((char) c);
			read();
		}
		return new Token(TokenType.IDENTIFIER, text.toString(), tokenLine);
	}

	private Token readNumber() {
		int tokenLine = line;
		text.setLength(0);
		boolean hasDecimalPoint = false;
		while (isDigit(c) || (c == '.' && !hasDecimalPoint)) {
			if (c == '.') {
				hasDecimalPoint = true;
			}
			text.append((char) c);
			read();
		}
		return new Token(TokenType.NUMBER_LITERAL, text.toString(), tokenLine);
	}

	private Token readString() {
		int tokenLine = line;
		text.setLength(0);
		// opening quote
		read();
		while (c != '"') {
			if (c < 0) {
				throw new ParserException("Unterminated string at end of input: \"" + text, sourceDescription, tokenLine);
			}
			if (c == '\n') {
				throw new ParserException("Unterminated string at end of line: \"" + text, sourceDescription, tokenLine);
			}
			text.append((char) c);
			read();
		}
		// closing quote
		read();
		return new Token(TokenType.STRING_LITERAL, text.toString(), tokenLine);
	}

	private static boolean isLetter(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}
}
