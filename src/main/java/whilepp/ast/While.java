package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** {@code while condition do body od} */
public final class While implements Command {

	private final Expression condition;
	private final NonEmptyList<Command> body;

	public While(Expression condition, NonEmptyList<Command> body) {
		this.condition = Preconditions.checkNotNull(condition);
		this.body = Preconditions.checkNotNull(body);
	}

	public Expression getCondition() {
		return condition;
	}

	public NonEmptyList<Command> getBody() {
		return body;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_While(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_While(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof While) {
			While other = (While) obj;
			return condition.equals(other.condition) && body.equals(other.body);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("While", condition, body);
	}

	@Override
	public String toString() {
		return "While(" + condition + ", " + body + ")";
	}
}
