package whilepp.parser;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Malformed WHILE source text.
 */
public class WhileSyntaxException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ImmutableList<String> errors;

	public WhileSyntaxException(List<String> errors) {
		super("syntax error:\n  " + Joiner.on("\n  ").join(errors));
		this.errors = ImmutableList.copyOf(errors);
	}

	/** diagnostics in the form {@code line:column message} */
	public ImmutableList<String> getErrors() {
		return errors;
	}
}
