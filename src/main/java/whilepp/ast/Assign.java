package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** {@code target := value} */
public final class Assign implements Command {

	private final Variable target;
	private final Expression value;

	public Assign(Variable target, Expression value) {
		this.target = Preconditions.checkNotNull(target);
		this.value = Preconditions.checkNotNull(value);
	}

	public Variable getTarget() {
		return target;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Assign(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Assign(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Assign) {
			Assign other = (Assign) obj;
			return target.equals(other.target) && value.equals(other.value);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("Set", target, value);
	}

	@Override
	public String toString() {
		return "Set(" + target + ", " + value + ")";
	}
}
