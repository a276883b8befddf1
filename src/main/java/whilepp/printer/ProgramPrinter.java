package whilepp.printer;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import whilepp.ListEmptyException;
import whilepp.ast.Program;
import whilepp.ast.Variable;

/**
 * Renders a whole program: the read header, the indented body between two
 * {@code %} lines, and the write footer.
 */
public class ProgramPrinter {

	static final String BODY_DELIMITER = "%";

	private final IndentSpec indentSpec;
	private final CommandPrinter commandPrinter;

	public ProgramPrinter(IndentSpec indentSpec, CommandPrinter commandPrinter) {
		this.indentSpec = Preconditions.checkNotNull(indentSpec);
		this.commandPrinter = Preconditions.checkNotNull(commandPrinter);
	}

	public ProgramPrinter(IndentSpec indentSpec) {
		this(indentSpec, new CommandPrinter(indentSpec));
	}

	public ImmutableList<String> renderProgram(Program program) {
		return ImmutableList.<String>builder()
				.add("read " + join(program.getInputs().asList()))
				.add(BODY_DELIMITER)
				.addAll(Lines.prefixAll(indentSpec.indentFor(IndentSpec.PROGR),
						commandPrinter.renderSequence(program.getBody())))
				.add(BODY_DELIMITER)
				.add("write " + join(program.getOutputs().asList()))
				.build();
	}

	/**
	 * @return the rendered lines separated by line breaks, without a trailing one
	 */
	public String renderToText(Program program) {
		return String.join("", Lines.suffixAllButLast("\n", renderProgram(program)));
	}

	/**
	 * @return the variable names separated by {@code ", "}
	 * @throws ListEmptyException if variables is empty
	 */
	public static String join(List<Variable> variables) {
		ListEmptyException.checkNotEmpty(variables, "variables");
		List<String> names = variables.stream().map(Variable::getName).collect(ImmutableList.toImmutableList());
		return Joiner.on(", ").join(names);
	}
}
