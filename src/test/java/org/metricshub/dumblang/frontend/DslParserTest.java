package org.metricshub.dumblang.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.dumblang.frontend.ast.ArrayLiteralAst;
import org.metricshub.dumblang.frontend.ast.ArrayReferenceAst;
import org.metricshub.dumblang.frontend.ast.BinaryExpressionAst;
import org.metricshub.dumblang.frontend.ast.BinaryOperator;
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
import org.metricshub.dumblang.frontend.ast.StringAst;
import org.metricshub.dumblang.frontend.ast.WhileStatementAst;
import org.metricshub.dumblang.util.ScriptSource;

public class DslParserTest {

	private static ProgramAst parse(String program) throws IOException {
		return new DslParser().parse(new ScriptSource("test", new StringReader(program)));
	}

	private static ExpressionAst expression(String text) throws IOException {
		return new DslParser().parseExpression(new ScriptSource("test", new StringReader(text)));
	}

	private static BinaryExpressionAst binary(ExpressionAst ast, BinaryOperator expected) {
		assertTrue("Expected a binary expression, got " + ast, ast instanceof BinaryExpressionAst);
		BinaryExpressionAst binary = (BinaryExpressionAst) ast;
		assertEquals(expected, binary.getOperator());
		return binary;
	}

	@Test
	public void testFunctions() throws Exception {
		ProgramAst program = parse("helper(x) { }\nmain() { }");
		assertEquals(2, program.getFunctions().size());
		FunctionDefAst helper = program.getFunction("helper");
		assertEquals("x", helper.getParam());
		assertTrue(helper.getBody().isEmpty());
		FunctionDefAst main = program.getFunction(ProgramAst.MAIN);
		assertFalse(main.hasParam());
		assertEquals(2, main.getLineNo());
		assertNull(program.getFunction("other"));
	}

	@Test
	public void testStatements() throws Exception {
		ProgramAst program = parse(
				"main() {\n"
						+ "  while (x < 3) { x = x + 1; }\n"
						+ "  if (x) { return; } else { return x; }\n"
						+ "  print(x);\n"
						+ "}");
		FunctionDefAst main = program.getFunction("main");
		assertEquals(3, main.getBody().getStatements().size());

		WhileStatementAst loop = (WhileStatementAst) main.getBody().getStatements().get(0);
		binary(loop.getCondition(), BinaryOperator.LESS_THAN);
		assertEquals(1, loop.getBody().getStatements().size());

		IfStatementAst branch = (IfStatementAst) main.getBody().getStatements().get(1);
		assertEquals(3, branch.getLineNo());
		assertNull(((ReturnStatementAst) branch.getThenBlock().getStatements().get(0)).getValue());
		assertTrue(((ReturnStatementAst) branch.getElseBlock().getStatements().get(0)).getValue() instanceof IdAst);

		ExpressionStatementAst call = (ExpressionStatementAst) main.getBody().getStatements().get(2);
		FunctionCallAst print = (FunctionCallAst) call.getExpression();
		assertEquals("print", print.getName());
		assertTrue(print.hasArgument());
	}

	@Test
	public void testKeywordsOnlyAtStatementStart() throws Exception {
		// "if" without a parenthesis is a plain variable
		ProgramAst program = parse("main() { if = 1; return if; }");
		ExpressionStatementAst assignment = (ExpressionStatementAst) program.getFunction("main").getBody().getStatements().get(0);
		assertEquals("if", ((IdAst) ((BinaryExpressionAst) assignment.getExpression()).getLeft()).getName());
	}

	@Test
	public void testPrecedenceClimbing() throws Exception {
		BinaryExpressionAst sum = binary(expression("1 + 2 * 3"), BinaryOperator.ADD);
		binary(sum.getRight(), BinaryOperator.MULTIPLY);

		BinaryExpressionAst power = binary(expression("2 ^ 3 ^ 2"), BinaryOperator.POWER);
		assertTrue(power.getLeft() instanceof NumberAst);
		binary(power.getRight(), BinaryOperator.POWER);

		BinaryExpressionAst difference = binary(expression("10 - 4 - 3"), BinaryOperator.SUBTRACT);
		binary(difference.getLeft(), BinaryOperator.SUBTRACT);

		// comparisons bind tighter than addition
		BinaryExpressionAst comparison = binary(expression("a + b < c"), BinaryOperator.ADD);
		binary(comparison.getRight(), BinaryOperator.LESS_THAN);
	}

	@Test
	public void testAssignmentIsRightAssociative() throws Exception {
		BinaryExpressionAst outer = binary(expression("a = b = 3"), BinaryOperator.ASSIGN);
		assertTrue(outer.getLeft() instanceof IdAst);
		BinaryExpressionAst inner = binary(outer.getRight(), BinaryOperator.ASSIGN);
		assertEquals(3.0, ((NumberAst) inner.getRight()).getValue(), 0);

		BinaryExpressionAst decrement = binary(expression("y = y - 1"), BinaryOperator.ASSIGN);
		binary(decrement.getRight(), BinaryOperator.SUBTRACT);
	}

	@Test
	public void testSignedExpression() throws Exception {
		BinaryExpressionAst negated = binary(expression("(-x)"), BinaryOperator.MULTIPLY);
		assertEquals(-1.0, ((NumberAst) negated.getLeft()).getValue(), 0);
		assertTrue(negated.getRight() instanceof IdAst);

		BinaryExpressionAst signedSum = binary(expression("(-3 + 5)"), BinaryOperator.MULTIPLY);
		assertEquals(-1.0, ((NumberAst) signedSum.getLeft()).getValue(), 0);
		binary(signedSum.getRight(), BinaryOperator.ADD);

		assertThrows(ParserException.class, () -> expression("(* 3)"));
		assertThrows(ParserException.class, () -> expression("-3"));
	}

	@Test
	public void testAtoms() throws Exception {
		ArrayLiteralAst array = (ArrayLiteralAst) expression("[1, \"a\", [], x + 1,]");
		assertEquals(4, array.getElements().size());
		assertEquals("a", ((StringAst) array.getElements().get(1)).getValue());
		assertTrue(((ArrayLiteralAst) array.getElements().get(2)).getElements().isEmpty());

		ArrayReferenceAst chained = (ArrayReferenceAst) expression("f()[0][i]");
		assertTrue(chained.getIndex() instanceof IdAst);
		ArrayReferenceAst first = (ArrayReferenceAst) chained.getArray();
		FunctionCallAst call = (FunctionCallAst) first.getArray();
		assertFalse(call.hasArgument());
	}

	@Test
	public void testSyntaxErrors() {
		ParserException missingElse = assertThrows(ParserException.class, () -> parse("main() {\n if (1) { }\n}"));
		assertEquals(3, missingElse.getLineNumber());
		assertEquals("test", missingElse.getSourceDescription());
		assertTrue(missingElse.getMessage().contains("else"));

		ParserException missingEnd = assertThrows(ParserException.class, () -> parse("main() { x = 1 }"));
		assertTrue(missingEnd.getMessage(), missingEnd.getMessage().contains("STATEMENT_END"));
		assertTrue(missingEnd.getMessage(), missingEnd.getMessage().contains("BLOCK_CLOSE"));

		assertThrows(ParserException.class, () -> parse("main() { }\nmain() { }"));
		assertThrows(ParserException.class, () -> parse("helper() { }"));
		assertThrows(ParserException.class, () -> parse("main() { return return; }"));
		assertThrows(ParserException.class, () -> parse("main() { x = (1 + 2; }"));
		assertThrows(ParserException.class, () -> parse("main(a b) { }"));
		assertThrows(ParserException.class, () -> parse("main() {"));
		assertThrows(ParserException.class, () -> expression("1 2"));
	}

	@Test
	public void testDump() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		parse("main() { return 1 + x; }").dump(new PrintStream(out, true, StandardCharsets.UTF_8));
		assertEquals(
				"ProgramAst (line 1)\n"
						+ " FunctionDefAst main() (line 1)\n"
						+ "  BlockAst (line 1)\n"
						+ "   ReturnStatementAst (line 1)\n"
						+ "    BinaryExpressionAst + (line 1)\n"
						+ "     NumberAst 1.0 (line 1)\n"
						+ "     IdAst x (line 1)\n",
				out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
	}
}
