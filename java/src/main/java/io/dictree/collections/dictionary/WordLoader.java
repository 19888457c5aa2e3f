package io.dictree.collections.dictionary;

import io.dictree.collections.bplustree.MemBPlusTree;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills a tree from a newline-delimited word list: one word per line, surrounding whitespace trimmed, blank
 * lines skipped, words inserted in source order. A source that can't be read is reported in the
 * {@link LoadResult}, which is for the caller to print; whatever was inserted before the failure stays in
 * the tree.
 */
public class WordLoader {
    private static final Logger LOG = LoggerFactory.getLogger(WordLoader.class);

    private final MemBPlusTree<String> tree;

    public WordLoader(MemBPlusTree<String> tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    public LoadResult load(Path path) {
        final Counter counter = new Counter();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            readInto(reader, counter);
        } catch (NoSuchFileException e) {
            LOG.debug("no word list at {}", path);
            return LoadResult.failure(counter.n, "File not found: " + path);
        } catch (IOException e) {
            LOG.debug("reading {} stopped after {} words", path, counter.n, e);
            return LoadResult.failure(counter.n, "Failed to read " + path + ": " + e.getMessage());
        }
        LOG.debug("{} words read from {}", counter.n, path);
        return LoadResult.success(counter.n);
    }

    public LoadResult load(Reader source) {
        final Counter counter = new Counter();
        try {
            readInto(source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source), counter);
        } catch (IOException e) {
            LOG.debug("reading the word source stopped after {} words", counter.n, e);
            return LoadResult.failure(counter.n, "Failed to read word source: " + e.getMessage());
        }
        LOG.debug("{} words read from the word source", counter.n);
        return LoadResult.success(counter.n);
    }

    private void readInto(BufferedReader reader, Counter counter) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            final String word = line.trim();
            if (word.isEmpty()) {
                continue;
            }
            tree.insert(word);
            counter.n++;
        }
    }

    private static class Counter {
        int n;
    }
}
