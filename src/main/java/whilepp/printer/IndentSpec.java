package whilepp.printer;

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Ordered list of (context, width) indentation overrides.
 * The first entry for a context wins, unknown contexts get {@link #DEFAULT_WIDTH}.
 */
public final class IndentSpec {

	public static final String WHILE = "WHILE";
	public static final String FOR = "FOR";
	public static final String IF = "IF";
	public static final String PROGR = "PROGR";

	public static final int DEFAULT_WIDTH = 1;

	private static final IndentSpec EMPTY = new IndentSpec(ImmutableList.of());

	private final ImmutableList<Map.Entry<String, Integer>> entries;

	private IndentSpec(ImmutableList<Map.Entry<String, Integer>> entries) {
		this.entries = entries;
	}

	public static IndentSpec empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Reads the textual form {@code NAME=WIDTH[,NAME=WIDTH...]}.
	 * Blank text gives the empty spec.
	 */
	public static IndentSpec parse(String text) {
		Builder builder = builder();
		for (String entry : Splitter.on(',').trimResults().omitEmptyStrings().split(text)) {
			List<String> parts = Splitter.on('=').trimResults().splitToList(entry);
			Preconditions.checkArgument(parts.size() == 2 && !parts.get(0).isEmpty(),
					"invalid indentation entry '%s', expected NAME=WIDTH", entry);
			int width;
			try {
				width = Integer.parseInt(parts.get(1));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("invalid width in indentation entry '" + entry + "'", e);
			}
			builder.indent(parts.get(0), width);
		}
		return builder.build();
	}

	/**
	 * @return the width of the first entry named context, or {@link #DEFAULT_WIDTH}
	 */
	public int resolve(String context) {
		for (Map.Entry<String, Integer> e : entries) {
			if (e.getKey().equals(context)) {
				return e.getValue();
			}
		}
		return DEFAULT_WIDTH;
	}

	/** the indentation string for context */
	public String indentFor(String context) {
		return widthToIndent(resolve(context));
	}

	/**
	 * @return a string of exactly n spaces
	 */
	public static String widthToIndent(int n) {
		Preconditions.checkArgument(n >= 0, "negative indentation width %s", n);
		return Strings.repeat(" ", n);
	}

	public ImmutableList<Map.Entry<String, Integer>> getEntries() {
		return entries;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof IndentSpec) {
			return entries.equals(((IndentSpec) obj).entries);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder result = new StringBuilder("[");
		boolean first = true;
		for (Map.Entry<String, Integer> e : entries) {
			if (!first) {
				result.append(", ");
			}
			result.append("(").append(e.getKey()).append(",").append(e.getValue()).append(")");
			first = false;
		}
		result.append("]");
		return result.toString();
	}

	public static final class Builder {
		private final ImmutableList.Builder<Map.Entry<String, Integer>> entries = ImmutableList.builder();

		private Builder() {
		}

		/** Appends an entry. Earlier entries shadow later ones with the same name. */
		public Builder indent(String context, int width) {
			Preconditions.checkNotNull(context);
			Preconditions.checkArgument(width >= 0, "negative indentation width %s for %s", width, context);
			entries.add(Maps.immutableEntry(context, width));
			return this;
		}

		public IndentSpec build() {
			return new IndentSpec(entries.build());
		}
	}
}
