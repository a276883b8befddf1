package whilepp.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;

import whilepp.ast.Command;
import whilepp.ast.Expression;
import whilepp.ast.Program;

/**
 * Reads WHILE source text into syntax trees.
 */
public class WhileReader {

	/**
	 * @throws WhileSyntaxException if s is not a well-formed expression
	 */
	public static Expression parseExpression(String s) {
		return AstBuilder.expression(parseTree(CharStreams.fromString(s), WhileParser::expressionEOF).expr());
	}

	/**
	 * @throws WhileSyntaxException if s is not a well-formed command
	 */
	public static Command parseCommand(String s) {
		return AstBuilder.command(parseTree(CharStreams.fromString(s), WhileParser::commandEOF).command());
	}

	/**
	 * @throws WhileSyntaxException if s is not a well-formed program
	 */
	public static Program parseProgram(String s) {
		return AstBuilder.program(parseTree(CharStreams.fromString(s), WhileParser::programEOF));
	}

	/**
	 * @throws WhileSyntaxException if the file does not hold a well-formed program
	 */
	public static Program parseProgram(Path file) throws IOException {
		return AstBuilder.program(parseTree(CharStreams.fromPath(file), WhileParser::programEOF));
	}

	/**
	 * Parses input with the given start rule and fails on any diagnostic,
	 * so that AST construction never sees an incomplete parse tree.
	 */
	private static <C extends ParserRuleContext> C parseTree(CharStream input, Function<WhileParser, C> startRule) {
		ErrorListener errListener = new ErrorListener();

		WhileLexer lexer = new WhileLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(errListener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);

		WhileParser parser = new WhileParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(errListener);

		C tree = startRule.apply(parser);

		if (errListener.getErrCount() > 0) {
			throw new WhileSyntaxException(errListener.getErrors());
		}
		return tree;
	}
}
