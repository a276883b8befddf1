package whilepp.ast;

import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import whilepp.ListEmptyException;

/**
 * An immutable ordered list with at least one element.
 */
public final class NonEmptyList<T> implements Iterable<T> {

	private final ImmutableList<T> elements;

	private NonEmptyList(ImmutableList<T> elements) {
		this.elements = elements;
	}

	@SafeVarargs
	public static <T> NonEmptyList<T> of(T first, T... rest) {
		Preconditions.checkNotNull(first);
		return new NonEmptyList<>(ImmutableList.copyOf(Lists.asList(first, rest)));
	}

	/**
	 * @throws ListEmptyException if elements is empty
	 */
	public static <T> NonEmptyList<T> copyOf(Iterable<? extends T> elements) {
		ImmutableList<T> list = ImmutableList.copyOf(elements);
		ListEmptyException.checkNotEmpty(list, "elements");
		return new NonEmptyList<>(list);
	}

	public T first() {
		return elements.get(0);
	}

	public List<T> rest() {
		return elements.subList(1, elements.size());
	}

	public T last() {
		return elements.get(elements.size() - 1);
	}

	public T get(int index) {
		return elements.get(index);
	}

	public int size() {
		return elements.size();
	}

	public ImmutableList<T> asList() {
		return elements;
	}

	@Override
	public Iterator<T> iterator() {
		return elements.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof NonEmptyList) {
			return elements.equals(((NonEmptyList<?>) obj).elements);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		return elements.toString();
	}
}
