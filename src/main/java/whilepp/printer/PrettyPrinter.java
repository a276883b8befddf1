package whilepp.printer;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import whilepp.ast.Command;
import whilepp.ast.Expression;
import whilepp.ast.Program;

/**
 * Pretty-printer for WHILE syntax trees with a fixed indentation spec.
 * Instances are immutable and can be shared.
 */
public class PrettyPrinter {

	private final IndentSpec indentSpec;
	private final ExpressionPrinter expressionPrinter;
	private final CommandPrinter commandPrinter;
	private final ProgramPrinter programPrinter;

	public PrettyPrinter(IndentSpec indentSpec) {
		this.indentSpec = Preconditions.checkNotNull(indentSpec);
		this.expressionPrinter = new ExpressionPrinter();
		this.commandPrinter = new CommandPrinter(indentSpec, expressionPrinter);
		this.programPrinter = new ProgramPrinter(indentSpec, commandPrinter);
	}

	public PrettyPrinter() {
		this(IndentSpec.empty());
	}

	public IndentSpec getIndentSpec() {
		return indentSpec;
	}

	public String prettyPrintExpr(Expression expression) {
		return expressionPrinter.render(expression);
	}

	public ImmutableList<String> prettyPrintCommand(Command command) {
		return commandPrinter.renderOne(command);
	}

	public ImmutableList<String> prettyPrintCommands(List<Command> commands) {
		return commandPrinter.renderSequence(commands);
	}

	public ImmutableList<String> prettyPrintProgram(Program program) {
		return programPrinter.renderProgram(program);
	}

	public String prettyPrint(Program program) {
		return programPrinter.renderToText(program);
	}
}
