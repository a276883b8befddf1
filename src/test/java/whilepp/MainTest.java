package whilepp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testPrintsNormalisedProgram(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("reverse.while");
        Files.writeString(file, "read X % Y := nil ; while X do Y := (cons (hd X) Y) ; X := (tl X) od % write Y");

        assertEquals(0, run(file.toString(), "PROGR=2,WHILE=5"));
        assertEquals("read X\n"
                + "%\n"
                + "  Y := nil ;\n"
                + "  while X do\n"
                + "       Y := (cons (hd X) Y) ;\n"
                + "       X := (tl X)\n"
                + "  od\n"
                + "%\n"
                + "write Y", out().replace(System.lineSeparator(), "\n").stripTrailing());
        assertEquals("", err());
    }

    @Test
    public void testDefaultIndentation(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nop.while");
        Files.writeString(file, "read X % nop % write X");

        assertEquals(0, run(file.toString()));
        assertTrue(out().startsWith("read X\n%\n nop\n%\nwrite X"), out());
    }

    @Test
    public void testWrongArgumentCount() {
        assertEquals(2, run());
        assertTrue(out().contains("1 or 2 parameters required."));

        assertEquals(2, run("a", "b", "c"));
        assertEquals("", err());
    }

    @Test
    public void testSyntaxError(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.while");
        Files.writeString(file, "read X\n%\nY := \n%\nwrite Y");

        assertEquals(1, run(file.toString()));
        assertTrue(err().startsWith(file + ": syntax error"), err());
        assertTrue(err().contains("4:0"), err());
        assertEquals("", out());
    }

    @Test
    public void testMissingFile(@TempDir Path dir) {
        assertEquals(3, run(dir.resolve("missing.while").toString()));
        assertFalse(err().isEmpty());
        assertEquals("", out());
    }

    @Test
    public void testMalformedIndentation(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nop.while");
        Files.writeString(file, "read X % nop % write X");

        assertEquals(3, run(file.toString(), "WHILE"));
        assertTrue(err().contains("invalid indentation entry 'WHILE'"), err());
        assertEquals("", out());
    }
}
