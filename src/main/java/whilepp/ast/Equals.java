package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** Equality test {@code left =? right}. */
public final class Equals implements Expression {

	private final Expression left;
	private final Expression right;

	public Equals(Expression left, Expression right) {
		this.left = Preconditions.checkNotNull(left);
		this.right = Preconditions.checkNotNull(right);
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Equals(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Equals(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Equals) {
			Equals other = (Equals) obj;
			return left.equals(other.left) && right.equals(other.right);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("Eq", left, right);
	}

	@Override
	public String toString() {
		return "Eq(" + left + ", " + right + ")";
	}
}
