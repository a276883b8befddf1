package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** Pair projection {@code (hd arg)}. */
public final class Head implements Expression {

	private final Expression arg;

	public Head(Expression arg) {
		this.arg = Preconditions.checkNotNull(arg);
	}

	public Expression getArg() {
		return arg;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Head(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Head(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Head) {
			return arg.equals(((Head) obj).arg);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("Hd", arg);
	}

	@Override
	public String toString() {
		return "Hd(" + arg + ")";
	}
}
