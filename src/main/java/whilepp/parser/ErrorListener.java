package whilepp.parser;

import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Collects lexer and parser diagnostics instead of printing them.
 */
public class ErrorListener extends BaseErrorListener {
	private final List<String> errors = Lists.newArrayList();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer,
			Object offendingSymbol, int line, int charPositionInLine,
			String msg, RecognitionException e) {
		errors.add(line + ":" + charPositionInLine + " " + msg);
	}

	public int getErrCount() {
		return errors.size();
	}

	public List<String> getErrors() {
		return ImmutableList.copyOf(errors);
	}

}
