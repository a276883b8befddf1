package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/** An atomic symbol literal. */
public final class Constant implements Expression {

	private final String name;

	public Constant(String name) {
		this.name = Preconditions.checkNotNull(name);
	}

	public String getName() {
		return name;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Constant(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_Constant(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Constant) {
			return name.equals(((Constant) obj).name);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("Cst", name);
	}

	@Override
	public String toString() {
		return "Cst(" + name + ")";
	}
}
