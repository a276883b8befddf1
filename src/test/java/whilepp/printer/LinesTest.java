package whilepp.printer;

import org.junit.jupiter.api.Test;
import whilepp.ListEmptyException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LinesTest {

    private static final List<String> LINES = List.of("while X do", " X := (tl X)", "od");

    @Test
    public void testPrefixAll() {
        var result = Lines.prefixAll("  ", LINES);

        assertEquals(LINES.size(), result.size());
        for (String line : result) {
            assertTrue(line.startsWith("  "));
        }
        assertEquals(List.of("  while X do", "   X := (tl X)", "  od"), result);
    }

    @Test
    public void testSuffixAll() {
        assertEquals(List.of("a;", "b;"), Lines.suffixAll(";", List.of("a", "b")));
    }

    @Test
    public void testSuffixLast() {
        var result = Lines.suffixLast(" ;", LINES);

        assertEquals(LINES.size(), result.size());
        assertEquals("od ;", result.get(2));
        assertEquals(LINES.subList(0, 2), result.subList(0, 2));
    }

    @Test
    public void testSuffixLastSingleLine() {
        assertEquals(List.of("nop ;"), Lines.suffixLast(" ;", List.of("nop")));
    }

    @Test
    public void testSuffixAllButLast() {
        assertEquals(List.of("a\n", "b\n", "c"), Lines.suffixAllButLast("\n", List.of("a", "b", "c")));
        assertEquals(List.of("a"), Lines.suffixAllButLast("\n", List.of("a")));
    }

    @Test
    public void testSuffixAllButLastThenLastEqualsSuffixAll() {
        var butLast = Lines.suffixAllButLast("!", LINES);
        var completed = Lines.suffixLast("!", butLast);

        assertEquals(Lines.suffixAll("!", LINES), completed);
    }

    @Test
    public void testEmptyListsAreRejected() {
        assertThrows(ListEmptyException.class, () -> Lines.prefixAll(" ", List.of()));
        assertThrows(ListEmptyException.class, () -> Lines.suffixAll(" ", List.of()));
        assertThrows(ListEmptyException.class, () -> Lines.suffixLast(" ", List.of()));
        assertThrows(ListEmptyException.class, () -> Lines.suffixAllButLast(" ", List.of()));
    }
}
