package whilepp.ast;

public final class Nop implements Command {

	static final Nop INSTANCE = new Nop();

	private Nop() {
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Nop(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Nop(this);
	}

	@Override
	public String toString() {
		return "Nop";
	}
}
