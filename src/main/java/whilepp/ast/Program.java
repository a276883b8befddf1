package whilepp.ast;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A WHILE program: {@code read inputs % body % write outputs}.
 */
public final class Program {

	private final NonEmptyList<Variable> inputs;
	private final NonEmptyList<Command> body;
	private final NonEmptyList<Variable> outputs;

	public Program(NonEmptyList<Variable> inputs, NonEmptyList<Command> body, NonEmptyList<Variable> outputs) {
		this.inputs = Preconditions.checkNotNull(inputs);
		this.body = Preconditions.checkNotNull(body);
		this.outputs = Preconditions.checkNotNull(outputs);
	}

	public NonEmptyList<Variable> getInputs() {
		return inputs;
	}

	public NonEmptyList<Command> getBody() {
		return body;
	}

	public NonEmptyList<Variable> getOutputs() {
		return outputs;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Program) {
			Program other = (Program) obj;
			return inputs.equals(other.inputs)
					&& body.equals(other.body)
					&& outputs.equals(other.outputs);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(inputs, body, outputs);
	}

	@Override
	public String toString() {
		return "Progr(" + inputs + ", " + body + ", " + outputs + ")";
	}
}
