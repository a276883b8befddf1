package whilepp;

import java.util.Collection;

/**
 * Thrown when an operation that requires a non-empty list (commands,
 * variables, output lines) receives an empty one.
 */
public class ListEmptyException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ListEmptyException(String what) {
		super("empty list of " + what);
	}

	public static <L extends Collection<?>> L checkNotEmpty(L list, String what) {
		if (list.isEmpty()) {
			throw new ListEmptyException(what);
		}
		return list;
	}
}
