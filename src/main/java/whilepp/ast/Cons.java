package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** Pair constructor {@code (cons head tail)}. */
public final class Cons implements Expression {

	private final Expression head;
	private final Expression tail;

	public Cons(Expression head, Expression tail) {
		this.head = Preconditions.checkNotNull(head);
		this.tail = Preconditions.checkNotNull(tail);
	}

	public Expression getHead() {
		return head;
	}

	public Expression getTail() {
		return tail;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Cons(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Cons(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Cons) {
			Cons cons = (Cons) obj;
			return head.equals(cons.head) && tail.equals(cons.tail);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("Cons", head, tail);
	}

	@Override
	public String toString() {
		return "Cons(" + head + ", " + tail + ")";
	}
}
