package whilepp.ast;

/** The empty-list literal. */
public final class Nil implements Expression {

	static final Nil INSTANCE = new Nil();

	private Nil() {
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Nil(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Nil(this);
	}

	@Override
	public String toString() {
		return "Nl";
	}
}
