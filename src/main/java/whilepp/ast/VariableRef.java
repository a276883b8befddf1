package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

public final class VariableRef implements Expression {

	private final String name;

	public VariableRef(String name) {
		this.name = Preconditions.checkNotNull(name);
	}

	public String getName() {
		return name;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_VariableRef(this);
	}

	@Override
	public void match(MatcherVoid matcher) {
		matcher.case_VariableRef(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof VariableRef) {
			return name.equals(((VariableRef) obj).name);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode("VarExp", name);
	}

	@Override
	public String toString() {
		return "VarExp(" + name + ")";
	}
}
