package io.dictree.collections.dictionary;

/**
 * Outcome of a {@link WordLoader} run. A failed load still reports how many words made it into the tree
 * before the source gave out.
 */
public final class LoadResult {
    private final int loaded;
    private final String error;

    private LoadResult(int loaded, String error) {
        this.loaded = loaded;
        this.error = error;
    }

    static LoadResult success(int loaded) {
        return new LoadResult(loaded, null);
    }

    static LoadResult failure(int loaded, String error) {
        return new LoadResult(loaded, error);
    }

    public int getLoaded() {
        return loaded;
    }

    public boolean isSuccess() {
        return error == null;
    }

    // null on success
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("loaded %d words", loaded)
                : String.format("loaded %d words, then failed: %s", loaded, error);
    }
}
