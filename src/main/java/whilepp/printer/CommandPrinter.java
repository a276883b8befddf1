package whilepp.printer;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import whilepp.ListEmptyException;
import whilepp.ast.Assign;
import whilepp.ast.Command;
import whilepp.ast.Expression;
import whilepp.ast.For;
import whilepp.ast.If;
import whilepp.ast.NonEmptyList;
import whilepp.ast.Nop;
import whilepp.ast.While;

/**
 * Renders commands to lines. Nested bodies are indented by the width
 * the {@link IndentSpec} gives for the enclosing construct.
 * <p>
 * Rendering recurses once per nesting level and re-indents the lines of
 * every nested body, so very deep trees (a few thousand levels with the
 * default thread stack) end in {@link StackOverflowError}.
 */
public class CommandPrinter implements Command.Matcher<ImmutableList<String>> {

	static final String SEPARATOR = " ;";

	private final IndentSpec indentSpec;
	private final ExpressionPrinter expressionPrinter;

	public CommandPrinter(IndentSpec indentSpec, ExpressionPrinter expressionPrinter) {
		this.indentSpec = Preconditions.checkNotNull(indentSpec);
		this.expressionPrinter = Preconditions.checkNotNull(expressionPrinter);
	}

	public CommandPrinter(IndentSpec indentSpec) {
		this(indentSpec, new ExpressionPrinter());
	}

	public ImmutableList<String> renderOne(Command command) {
		return command.match(this);
	}

	public ImmutableList<String> renderSequence(NonEmptyList<Command> commands) {
		return renderSequence(commands.asList());
	}

	/**
	 * Renders commands in order, appending {@value #SEPARATOR} to the last
	 * line of every command block but the final one.
	 *
	 * @throws ListEmptyException if commands is empty
	 */
	public ImmutableList<String> renderSequence(List<Command> commands) {
		ListEmptyException.checkNotEmpty(commands, "commands");
		ImmutableList.Builder<String> result = ImmutableList.builder();
		int last = commands.size() - 1;
		for (int i = 0; i < last; i++) {
			result.addAll(Lines.suffixLast(SEPARATOR, renderOne(commands.get(i))));
		}
		result.addAll(renderOne(commands.get(last)));
		return result.build();
	}

	@Override
	public ImmutableList<String> case_Nop(Nop nop) {
		return ImmutableList.of("nop");
	}

	@Override
	public ImmutableList<String> case_Assign(Assign assign) {
		return ImmutableList.of(assign.getTarget().getName() + " := " + expressionPrinter.render(assign.getValue()));
	}

	@Override
	public ImmutableList<String> case_While(While whileLoop) {
		return loop("while", whileLoop.getCondition(), whileLoop.getBody(), IndentSpec.WHILE);
	}

	@Override
	public ImmutableList<String> case_For(For forLoop) {
		return loop("for", forLoop.getCount(), forLoop.getBody(), IndentSpec.FOR);
	}

	@Override
	public ImmutableList<String> case_If(If ifCommand) {
		String indent = indentSpec.indentFor(IndentSpec.IF);
		return ImmutableList.<String>builder()
				.add("if " + expressionPrinter.render(ifCommand.getCondition()) + " then")
				.addAll(Lines.prefixAll(indent, renderSequence(ifCommand.getThenBranch())))
				.add("else")
				.addAll(Lines.prefixAll(indent, renderSequence(ifCommand.getElseBranch())))
				.add("fi")
				.build();
	}

	private ImmutableList<String> loop(String keyword, Expression header, NonEmptyList<Command> body, String context) {
		String indent = indentSpec.indentFor(context);
		return ImmutableList.<String>builder()
				.add(keyword + " " + expressionPrinter.render(header) + " do")
				.addAll(Lines.prefixAll(indent, renderSequence(body)))
				.add("od")
				.build();
	}
}
