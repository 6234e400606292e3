package org.metricshub.dumblang.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.Test;
import org.metricshub.dumblang.frontend.ast.ParserException;

public class ScannerTest {

	private static List<Token> scan(String text) {
		Scanner scanner = new Scanner(new StringReader(text), "test");
		List<Token> tokens = new ArrayList<Token>();
		while (scanner.hasNext()) {
			tokens.add(scanner.next());
		}
		return tokens;
	}

	private static List<TokenType> types(String text) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : scan(text)) {
			types.add(token.getType());
		}
		return types;
	}

	@Test
	public void testEmptyInput() {
		List<Token> tokens = scan("");
		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).getType());
	}

	@Test
	public void testNoTokenAfterEof() {
		Scanner scanner = new Scanner(new StringReader("x"), "test");
		assertEquals(TokenType.IDENTIFIER, scanner.next().getType());
		assertTrue(scanner.hasNext());
		assertEquals(TokenType.EOF, scanner.next().getType());
		assertFalse(scanner.hasNext());
		assertThrows(NoSuchElementException.class, scanner::next);
	}

	@Test
	public void testPunctuation() {
		assertEquals(
				Arrays
						.asList(
								TokenType.BLOCK_OPEN,
								TokenType.BLOCK_CLOSE,
								TokenType.PAREN_OPEN,
								TokenType.PAREN_CLOSE,
								TokenType.ARRAY_OPEN,
								TokenType.ARRAY_CLOSE,
								TokenType.ARRAY_SEPARATOR,
								TokenType.STATEMENT_END,
								TokenType.EOF),
				types("{ } ( ) [ ] , ;"));
	}

	@Test
	public void testAssignmentAndEquality() {
		List<Token> tokens = scan("a = b == c");
		assertEquals(new Token(TokenType.ASSIGN, "=", 1), tokens.get(1));
		assertEquals(new Token(TokenType.OPERATOR, "==", 1), tokens.get(3));
		assertEquals(6, tokens.size());
	}

	@Test
	public void testOperators() {
		for (Token token : scan("+-*/^<>")) {
			if (token.getType() != TokenType.EOF) {
				assertEquals(TokenType.OPERATOR, token.getType());
				assertEquals(1, token.getText().length());
			}
		}
	}

	@Test
	public void testNumbers() {
		List<Token> tokens = scan("12 3.25 1.2.3");
		assertEquals(new Token(TokenType.NUMBER_LITERAL, "12", 1), tokens.get(0));
		assertEquals(new Token(TokenType.NUMBER_LITERAL, "3.25", 1), tokens.get(1));
		// a second decimal point ends the number
		assertEquals(new Token(TokenType.NUMBER_LITERAL, "1.2", 1), tokens.get(2));
		assertEquals(new Token(TokenType.OPERATOR, ".", 1), tokens.get(3));
		assertEquals(new Token(TokenType.NUMBER_LITERAL, "3", 1), tokens.get(4));
	}

	@Test
	public void testIdentifiersAreLettersOnly() {
		List<Token> tokens = scan("abc1 x_y");
		assertEquals(new Token(TokenType.IDENTIFIER, "abc", 1), tokens.get(0));
		assertEquals(new Token(TokenType.NUMBER_LITERAL, "1", 1), tokens.get(1));
		assertEquals(new Token(TokenType.IDENTIFIER, "x", 1), tokens.get(2));
		assertEquals(new Token(TokenType.OPERATOR, "_", 1), tokens.get(3));
		assertEquals(new Token(TokenType.IDENTIFIER, "y", 1), tokens.get(4));
	}

	@Test
	public void testStrings() {
		List<Token> tokens = scan("\"hello world\" \"a\\b\"");
		assertEquals(new Token(TokenType.STRING_LITERAL, "hello world", 1), tokens.get(0));
		// no escape sequences
		assertEquals(new Token(TokenType.STRING_LITERAL, "a\\b", 1), tokens.get(1));
	}

	@Test
	public void testUnterminatedString() {
		ParserException eol = assertThrows(ParserException.class, () -> scan("x = \"abc\n\";"));
		assertEquals(1, eol.getLineNumber());
		assertThrows(ParserException.class, () -> scan("\n\n\"abc"));
	}

	@Test
	public void testCommentsAndLines() {
		List<Token> tokens = scan("# heading\nx # trailing\n\n  y\n");
		assertEquals(new Token(TokenType.IDENTIFIER, "x", 2), tokens.get(0));
		assertEquals(new Token(TokenType.IDENTIFIER, "y", 4), tokens.get(1));
		assertEquals(TokenType.EOF, tokens.get(2).getType());
		assertEquals(3, tokens.size());
	}
}
