package io.dictree.collections.dictionary;

import io.dictree.collections.bplustree.MemBPlusTree;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Command(
        name = "dictree",
        description = "Loads a word list into an in-memory B+ tree and opens an interactive dictionary menu.",
        mixinStandardHelpOptions = true,
        version = "dictree 1.0.0",
        showDefaultValues = true)
public class DictionaryCommand implements Callable<Integer> {
    @Option(names = "--words", defaultValue = "words.txt", description = "Newline-delimited word list to load.")
    Path words;

    @Option(names = "--max-keys", defaultValue = "4", description = "Most keys a tree node holds before it splits.")
    int maxKeys;

    @Spec
    CommandSpec spec;

    private final InputStream in;
    private final PrintStream out;

    public DictionaryCommand() {
        this(System.in, System.out);
    }

    public DictionaryCommand(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new DictionaryCommand()).execute(args));
    }

    @Override
    public Integer call() {
        if (maxKeys < MemBPlusTree.MIN_MAX_KEYS) {
            throw new ParameterException(
                    spec.commandLine(),
                    String.format("--max-keys must be at least %d, got %d", MemBPlusTree.MIN_MAX_KEYS, maxKeys));
        }
        final MemBPlusTree<String> tree = MemBPlusTree.naturalOrder(maxKeys);
        final LoadResult result = new WordLoader(tree).load(words);
        if (result.isSuccess()) {
            out.printf("Loaded %d words into the B+ Tree.%n", result.getLoaded());
        } else {
            out.println(result.getError());
        }
        final BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        new DictionaryShell(tree, reader, out).run();
        return CommandLine.ExitCode.OK;
    }
}
