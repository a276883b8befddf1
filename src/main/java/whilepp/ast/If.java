package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** {@code if condition then thenBranch else elseBranch fi} */
public final class If implements Command {

	private final Expression condition;
	private final NonEmptyList<Command> thenBranch;
	private final NonEmptyList<Command> elseBranch;

	public If(Expression condition, NonEmptyList<Command> thenBranch, NonEmptyList<Command> elseBranch) {
		this.condition = Preconditions.checkNotNull(condition);
		this.thenBranch = Preconditions.checkNotNull(thenBranch);
		this.elseBranch = Preconditions.checkNotNull(elseBranch);
	}

	public Expression getCondition() {
		return condition;
	}

	public NonEmptyList<Command> getThenBranch() {
		return thenBranch;
	}

	public NonEmptyList<Command> getElseBranch() {
		return elseBranch;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_If(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_If(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof If) {
			If other = (If) obj;
			return condition.equals(other.condition)
					&& thenBranch.equals(other.thenBranch)
					&& elseBranch.equals(other.elseBranch);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("If", condition, thenBranch, elseBranch);
	}

	@Override
	public String toString() {
		return "If(" + condition + ", " + thenBranch + ", " + elseBranch + ")";
	}
}
