package io.dictree.collections.test.dictionary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dictree.collections.bplustree.MemBPlusTree;
import io.dictree.collections.dictionary.DictionaryShell;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;

public class DictionaryShellTest {
    private MemBPlusTree<String> tree;

    @Before
    public void setUp() {
        tree = MemBPlusTree.naturalOrder(4);
        for (String word : Arrays.asList("apple", "banana", "cherry", "date", "elder")) {
            tree.insert(word);
        }
    }

    private String run(String input) {
        return run(new StringReader(input));
    }

    private String run(Reader input) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        new DictionaryShell(tree, new BufferedReader(input), out).run();
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testSearch() {
        final String out = run("1\nbanana\n1\n  fig  \n4\n");
        assertThat(out).contains("Word \"banana\" found.");
        assertThat(out).contains("Sorry, \"fig\" was not found.");
        assertThat(out).endsWith("Exiting. Goodbye!" + System.lineSeparator());
    }

    @Test
    public void testInsert() {
        final String out = run("2\nfig\n2\napple\n4\n");
        assertThat(out).contains("Inserted \"fig\" into the tree.");
        assertThat(out).contains("Word \"apple\" already exists.");
        assertThat(tree.keys()).containsExactly("apple", "banana", "cherry", "date", "elder", "fig");
    }

    @Test
    public void testDelete() {
        final String out = run("3\ncherry\n3\ncherry\n4\n");
        assertThat(out).contains("Deleted \"cherry\" from the B+ Tree.");
        assertThat(out).contains("Cannot delete \"cherry\" - not found.");
        assertThat(tree.contains("cherry")).isFalse();
    }

    @Test
    public void testMenuIsShownEveryRound() {
        final String out = run("9\n\n4\n");
        assertThat(out.split("B\\+ Tree Dictionary Menu", -1)).hasSize(4);
        assertThat(out.split("Invalid option. Try again.", -1)).hasSize(3);
        assertThat(out).contains("1. Search word", "2. Insert word", "3. Delete word", "4. Exit");
        assertThat(out).contains("Choose an option (1-4): ");
    }

    @Test
    public void testBlankWordIsRejected() {
        final String out = run("2\n   \n4\n");
        assertThat(out).contains("Please enter a non-empty word.");
        assertThat(tree.size()).isEqualTo(5);
    }

    @Test
    public void testExitLeavesTreeAlone() {
        final String before = tree.sketch();
        run("4\n1\napple\n");
        assertThat(tree.sketch()).isEqualTo(before);
    }

    @Test
    public void testEndOfInputEndsTheLoop() {
        assertThat(run("")).doesNotContain("Goodbye");
        // input runs out at the word prompt
        final String out = run("1\n");
        assertThat(out).endsWith("Enter word to search: ");
    }

    @Test
    public void testBrokenInputIsReported() {
        final Reader broken =
                new Reader() {
                    @Override
                    public int read(char[] cbuf, int off, int len) throws IOException {
                        throw new IOException("console gone");
                    }

                    @Override
                    public void close() {}
                };
        assertThatThrownBy(() -> run(broken))
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("console gone");
    }
}
