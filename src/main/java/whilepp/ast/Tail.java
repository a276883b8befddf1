package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** Pair projection {@code (tl arg)}. */
public final class Tail implements Expression {

	private final Expression arg;

	public Tail(Expression arg) {
		this.arg = Preconditions.checkNotNull(arg);
	}

	public Expression getArg() {
		return arg;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Tail(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Tail(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Tail) {
			return arg.equals(((Tail) obj).arg);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("Tl", arg);
	}

	@Override
	public String toString() {
		return "Tl(" + arg + ")";
	}
}
