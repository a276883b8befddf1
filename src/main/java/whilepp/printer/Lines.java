package whilepp.printer;

import java.util.List;

import com.google.common.collect.ImmutableList;

import whilepp.ListEmptyException;

/**
 * Joining primitives on non-empty lists of output lines.
 * Every operation keeps the order and the number of lines.
 */
public final class Lines {

	private Lines() {
	}

	/**
	 * @return lines with pref in front of every element
	 * @throws ListEmptyException if lines is empty
	 */
	public static ImmutableList<String> prefixAll(String pref, List<String> lines) {
		ListEmptyException.checkNotEmpty(lines, "lines");
		ImmutableList.Builder<String> result = ImmutableList.builderWithExpectedSize(lines.size());
		for (String line : lines) {
			result.add(pref + line);
		}
		return result.build();
	}

	/**
	 * @return lines with suff after every element
	 * @throws ListEmptyException if lines is empty
	 */
	public static ImmutableList<String> suffixAll(String suff, List<String> lines) {
		ListEmptyException.checkNotEmpty(lines, "lines");
		ImmutableList.Builder<String> result = ImmutableList.builderWithExpectedSize(lines.size());
		for (String line : lines) {
			result.add(line + suff);
		}
		return result.build();
	}

	/**
	 * @return lines with suff after the last element only
	 * @throws ListEmptyException if lines is empty
	 */
	public static ImmutableList<String> suffixLast(String suff, List<String> lines) {
		ListEmptyException.checkNotEmpty(lines, "lines");
		int last = lines.size() - 1;
		ImmutableList.Builder<String> result = ImmutableList.builderWithExpectedSize(lines.size());
		result.addAll(lines.subList(0, last));
		result.add(lines.get(last) + suff);
		return result.build();
	}

	/**
	 * @return lines with suff after every element except the last
	 * @throws ListEmptyException if lines is empty
	 */
	public static ImmutableList<String> suffixAllButLast(String suff, List<String> lines) {
		ListEmptyException.checkNotEmpty(lines, "lines");
		int last = lines.size() - 1;
		ImmutableList.Builder<String> result = ImmutableList.builderWithExpectedSize(lines.size());
		for (String line : lines.subList(0, last)) {
			result.add(line + suff);
		}
		result.add(lines.get(last));
		return result.build();
	}
}
