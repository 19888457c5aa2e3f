package io.dictree.collections.dictionary;

import io.dictree.collections.bplustree.MemBPlusTree;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented menu over a word tree. Each round prints the menu, reads one choice and, for the word
 * operations, one word. The loop ends on the exit option or when input runs out; the tree is left as is
 * either way.
 */
public class DictionaryShell {
    private static final Logger LOG = LoggerFactory.getLogger(DictionaryShell.class);

    private final MemBPlusTree<String> tree;
    private final BufferedReader in;
    private final PrintStream out;

    public DictionaryShell(MemBPlusTree<String> tree, BufferedReader in, PrintStream out) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    public void run() {
        while (step()) {
            // next round
        }
    }

    // false once the user exits or input is exhausted
    boolean step() {
        printMenu();
        final String choice = readLine("Choose an option (1-4): ");
        if (choice == null) {
            LOG.debug("input closed at the menu prompt");
            return false;
        }
        switch (choice.trim()) {
            case "1":
                return withWord("Enter word to search: ", this::search);
            case "2":
                return withWord("Enter word to insert: ", this::insert);
            case "3":
                return withWord("Enter word to delete: ", this::delete);
            case "4":
                out.println("Exiting. Goodbye!");
                return false;
            default:
                out.println("Invalid option. Try again.");
                return true;
        }
    }

    private void printMenu() {
        out.println();
        out.println("B+ Tree Dictionary Menu");
        out.println("1. Search word");
        out.println("2. Insert word");
        out.println("3. Delete word");
        out.println("4. Exit");
    }

    private boolean withWord(String prompt, Consumer<String> action) {
        final String line = readLine(prompt);
        if (line == null) {
            LOG.debug("input closed at the word prompt");
            return false;
        }
        final String word = line.trim();
        if (word.isEmpty()) {
            out.println("Please enter a non-empty word.");
        } else {
            action.accept(word);
        }
        return true;
    }

    private void search(String word) {
        if (tree.contains(word)) {
            out.printf("Word \"%s\" found.%n", word);
        } else {
            out.printf("Sorry, \"%s\" was not found.%n", word);
        }
    }

    private void insert(String word) {
        if (tree.contains(word)) {
            out.printf("Word \"%s\" already exists.%n", word);
            return;
        }
        tree.insert(word);
        LOG.debug("inserted {}, tree now holds {} words over {} levels", word, tree.size(), tree.height());
        out.printf("Inserted \"%s\" into the tree.%n", word);
    }

    private void delete(String word) {
        if (tree.remove(word)) {
            out.printf("Deleted \"%s\" from the B+ Tree.%n", word);
        } else {
            out.printf("Cannot delete \"%s\" - not found.%n", word);
        }
    }

    private String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read from the console", e);
        }
    }
}
