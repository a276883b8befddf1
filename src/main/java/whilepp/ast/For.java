package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** {@code for count do body od} */
public final class For implements Command {

	private final Expression count;
	private final NonEmptyList<Command> body;

	public For(Expression count, NonEmptyList<Command> body) {
		this.count = Preconditions.checkNotNull(count);
		this.body = Preconditions.checkNotNull(body);
	}

	public Expression getCount() {
		return count;
	}

	public NonEmptyList<Command> getBody() {
		return body;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_For(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_For(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof For) {
			For other = (For) obj;
			return count.equals(other.count) && body.equals(other.body);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("For", count, body);
	}

	@Override
	public String toString() {
		return "For(" + count + ", " + body + ")";
	}
}
