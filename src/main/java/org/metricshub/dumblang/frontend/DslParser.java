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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.dumblang.frontend.ast.ArrayLiteralAst;
import org.metricshub.dumblang.frontend.ast.ArrayReferenceAst;
import org.metricshub.dumblang.frontend.ast.BinaryExpressionAst;
import org.metricshub.dumblang.frontend.ast.BinaryOperator;
import org.metricshub.dumblang.frontend.ast.BlockAst;
import org.metricshub.dumblang.frontend.ast.ExpressionAst;
import org.metricshub.dumblang.frontend.ast.ExpressionStatementAst;
import org.metricshub.dumblang.frontend.ast.FunctionCallAst;
import org.metricshub.dumblang.frontend.ast.FunctionDefAst;
import org.metricshub.dumblang.frontend.ast.IdAst;
import org.metricshub.dumblang.frontend.ast.IfStatementAst;
import org.metricshub.dumblang.frontend.ast.NumberAst;
import org.metricshub.dumblang.frontend.ast.ParserException;
import org.metricshub.dumblang.frontend.ast.ProgramAst;
import org.metricshub.dumblang.frontend.ast.ReturnStatementAst;
import org.metricshub.dumblang.frontend.ast.StatementAst;
import org.metricshub.dumblang.frontend.ast.StringAst;
import org.metricshub.dumblang.frontend.ast.WhileStatementAst;
import org.metricshub.dumblang.util.DslLogger;
import org.metricshub.dumblang.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts a DumbLang program into an abstract syntax tree.
 * <p>
 * The parser is a recursive descent parser with two tokens of lookahead (the
 * current token and the one after it). Binary expressions are parsed by
 * precedence climbing over {@link BinaryOperator}, assignment included.
 * <p>
 * Keywords ({@code if}, {@code else}, {@code while}, {@code return}) are
 * scanned as plain identifiers; they are recognized by the parser at the start
 * of a statement only.
 * <p>
 * A parser instance is not thread-safe, but may be reused for several
 * sources one after the other.
 */
public class DslParser {

	private static final Logger LOG = DslLogger.getLogger(DslParser.class);

	static final String KW_IF = "if";
	static final String KW_ELSE = "else";
	static final String KW_WHILE = "while";
	static final String KW_RETURN = "return";

	private String sourceDescription;
	private Scanner scanner;
	private Token token;
	private Token lookahead;

	/**
	 * Parse the program read from the specified source. Build and return the
	 * root of the abstract syntax tree which represents the program.
	 *
	 * @param source where the program is read from
	 * @return the abstract syntax tree of this program
	 * @throws IOException when the source cannot be opened
	 * @throws ParserException when the program is not valid DumbLang
	 */
	public ProgramAst parse(ScriptSource source) throws IOException {
		if (source == null) {
			throw new IOException("No script source supplied");
		}
		init(source);
		ProgramAst program = PROGRAM();
		LOG.debug("Parsed {} function(s) from {}", program.getFunctions().size(), sourceDescription);
		return program;
	}

	/**
	 * Parse a single standalone expression, which must be followed by the end
	 * of the input.
	 *
	 * @param expressionSource The expression to parse (not a statement or function, just an expression)
	 * @return the abstract syntax tree of the expression
	 * @throws IOException when the source cannot be opened
	 * @throws ParserException when the text is not a single valid expression
	 */
	public ExpressionAst parseExpression(ScriptSource expressionSource) throws IOException {
		if (expressionSource == null) {
			throw new IOException("No source supplied");
		}
		init(expressionSource);
		ExpressionAst expression = EXPRESSION(1);
		expect(TokenType.EOF);
		return expression;
	}

	private void init(ScriptSource source) throws IOException {
		this.sourceDescription = source.getDescription();
		this.scanner = new Scanner(source.getReader(), sourceDescription);
		this.token = scanner.next();
		this.lookahead = scanner.hasNext() ? scanner.next() : token;
	}

	private void advance() {
		token = lookahead;
		if (scanner.hasNext()) {
			lookahead = scanner.next();
		}
	}

	private Token expect(TokenType expectedType) {
		if (token.getType() != expectedType) {
			throw parserException("Expecting " + expectedType.name() + ". Found: " + token);
		}
		Token consumed = token;
		if (expectedType != TokenType.EOF) {
			advance();
		}
		return consumed;
	}

	private boolean isKeyword(String keyword) {
		return token.is(TokenType.IDENTIFIER, keyword);
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : FUNCTION* EOF
	ProgramAst PROGRAM() {
		int line = token.getLine();
		List<FunctionDefAst> functions = new ArrayList<FunctionDefAst>();
		Set<String> names = new HashSet<String>();
		while (token.getType() != TokenType.EOF) {
			FunctionDefAst function = FUNCTION();
			if (!names.add(function.getName())) {
				throw new ParserException(
						"Function " + function.getName() + " is defined more than once",
						sourceDescription,
						function.getLineNo());
			}
			functions.add(function);
		}
		if (!names.contains(ProgramAst.MAIN)) {
			throw parserException("No '" + ProgramAst.MAIN + "' function defined");
		}
		return new ProgramAst(line, functions);
	}

	// FUNCTION : IDENTIFIER ( [IDENTIFIER] ) BLOCK
	FunctionDefAst FUNCTION() {
		Token name = expect(TokenType.IDENTIFIER);
		expect(TokenType.PAREN_OPEN);
		String param = null;
		if (token.getType() == TokenType.IDENTIFIER) {
			param = token.getText();
			advance();
		}
		expect(TokenType.PAREN_CLOSE);
		BlockAst body = BLOCK();
		return new FunctionDefAst(name.getLine(), name.getText(), param, body);
	}

	// BLOCK : { STATEMENT* }
	BlockAst BLOCK() {
		int line = expect(TokenType.BLOCK_OPEN).getLine();
		List<StatementAst> statements = new ArrayList<StatementAst>();
		while (token.getType() != TokenType.BLOCK_CLOSE) {
			if (token.getType() == TokenType.EOF) {
				throw parserException("Unexpected end of input, expecting BLOCK_CLOSE");
			}
			statements.add(STATEMENT());
		}
		expect(TokenType.BLOCK_CLOSE);
		return new BlockAst(line, statements);
	}

	// STATEMENT : while ( EXPRESSION ) BLOCK
	// | if ( EXPRESSION ) BLOCK else BLOCK
	// | return [EXPRESSION] ;
	// | EXPRESSION ;
	StatementAst STATEMENT() {
		int line = token.getLine();
		if (isKeyword(KW_WHILE) && lookahead.getType() == TokenType.PAREN_OPEN) {
			advance();
			expect(TokenType.PAREN_OPEN);
			ExpressionAst condition = EXPRESSION(1);
			expect(TokenType.PAREN_CLOSE);
			return new WhileStatementAst(line, condition, BLOCK());
		}
		if (isKeyword(KW_IF) && lookahead.getType() == TokenType.PAREN_OPEN) {
			advance();
			expect(TokenType.PAREN_OPEN);
			ExpressionAst condition = EXPRESSION(1);
			expect(TokenType.PAREN_CLOSE);
			BlockAst thenBlock = BLOCK();
			if (!isKeyword(KW_ELSE)) {
				throw parserException("Expecting 'else'. Found: " + token);
			}
			advance();
			BlockAst elseBlock = BLOCK();
			return new IfStatementAst(line, condition, thenBlock, elseBlock);
		}
		if (isKeyword(KW_RETURN)) {
			advance();
			ExpressionAst value = null;
			if (token.getType() != TokenType.STATEMENT_END) {
				value = EXPRESSION(1);
			}
			expect(TokenType.STATEMENT_END);
			return new ReturnStatementAst(line, value);
		}
		ExpressionAst expression = EXPRESSION(1);
		expect(TokenType.STATEMENT_END);
		return new ExpressionStatementAst(line, expression);
	}

	// EXPRESSION : ATOM ( BINARY_OPERATOR EXPRESSION )*
	// climbing while the operator binds at least as tightly as minPrecedence
	ExpressionAst EXPRESSION(int minPrecedence) {
		return CLIMB(ATOM(), minPrecedence);
	}

	private ExpressionAst CLIMB(ExpressionAst left, int minPrecedence) {
		ExpressionAst result = left;
		BinaryOperator op = binaryOperator(token);
		while (op != null && op.getPrecedence() >= minPrecedence) {
			int line = token.getLine();
			advance();
			int nextPrecedence = op.isRightAssociative() ? op.getPrecedence() : op.getPrecedence() + 1;
			ExpressionAst right = EXPRESSION(nextPrecedence);
			result = new BinaryExpressionAst(line, result, op, right);
			op = binaryOperator(token);
		}
		return result;
	}

	private static BinaryOperator binaryOperator(Token t) {
		if (t.getType() == TokenType.ASSIGN || t.getType() == TokenType.OPERATOR) {
			return BinaryOperator.fromSymbol(t.getText());
		}
		return null;
	}

	// ATOM : [ [EXPRESSION (, EXPRESSION)* [,]] ]
	// | IDENTIFIER [ ( [EXPRESSION] ) ] ( [ EXPRESSION ] )*
	// | NUMBER_LITERAL | STRING_LITERAL
	// | ( (+|-) EXPRESSION ) | ( EXPRESSION )
	ExpressionAst ATOM() {
		int line = token.getLine();
		switch (token.getType()) {
		case ARRAY_OPEN:
			return ARRAY_LITERAL();
		case IDENTIFIER:
			if (isKeyword(KW_RETURN)) {
				throw parserException("'return' is only allowed as a statement");
			}
			String name = token.getText();
			ExpressionAst primary;
			if (lookahead.getType() == TokenType.PAREN_OPEN) {
				advance();
				advance();
				ExpressionAst argument = null;
				if (token.getType() != TokenType.PAREN_CLOSE) {
					argument = EXPRESSION(1);
				}
				expect(TokenType.PAREN_CLOSE);
				primary = new FunctionCallAst(line, name, argument);
			} else {
				advance();
				primary = new IdAst(line, name);
			}
			return INDEXES(primary);
		case NUMBER_LITERAL:
			String number = token.getText();
			advance();
			return new NumberAst(line, Double.parseDouble(number));
		case STRING_LITERAL:
			String text = token.getText();
			advance();
			return new StringAst(line, text);
		case PAREN_OPEN:
			advance();
			ExpressionAst grouped;
			if (token.getType() == TokenType.OPERATOR) {
				grouped = SIGNED_EXPRESSION();
			} else {
				grouped = EXPRESSION(1);
			}
			expect(TokenType.PAREN_CLOSE);
			return grouped;
		default:
			throw parserException("Unexpected token: " + token);
		}
	}

	// ( [+|-] EXPRESSION ): rewritten as +/-1.0 * (EXPRESSION), the sign
	// applies to the whole parenthesized expression
	private ExpressionAst SIGNED_EXPRESSION() {
		int line = token.getLine();
		String sign = token.getText();
		double factor;
		if ("-".equals(sign)) {
			factor = -1.0;
		} else if ("+".equals(sign)) {
			factor = 1.0;
		} else {
			throw parserException("Unexpected operator '" + sign + "', only + or - may follow '('");
		}
		advance();
		return new BinaryExpressionAst(line, new NumberAst(line, factor), BinaryOperator.MULTIPLY, EXPRESSION(1));
	}

	private ExpressionAst ARRAY_LITERAL() {
		int line = expect(TokenType.ARRAY_OPEN).getLine();
		List<ExpressionAst> elements = new ArrayList<ExpressionAst>();
		while (token.getType() != TokenType.ARRAY_CLOSE) {
			elements.add(EXPRESSION(1));
			if (token.getType() != TokenType.ARRAY_SEPARATOR) {
				break;
			}
			advance();
		}
		expect(TokenType.ARRAY_CLOSE);
		return new ArrayLiteralAst(line, elements);
	}

	// [ EXPRESSION ] after a name or a call, possibly repeated
	private ExpressionAst INDEXES(ExpressionAst primary) {
		ExpressionAst result = primary;
		while (token.getType() == TokenType.ARRAY_OPEN) {
			int line = token.getLine();
			advance();
			ExpressionAst index = EXPRESSION(1);
			expect(TokenType.ARRAY_CLOSE);
			result = new ArrayReferenceAst(line, result, index);
		}
		return result;
	}

	// CHECKSTYLE.ON: MethodName

	private ParserException parserException(String msg) {
		return new ParserException(msg, sourceDescription, token.getLine());
	}
}
