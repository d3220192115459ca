package fbtrie;

import java.io.PrintStream;
import java.util.Iterator;

/**
 * A dictionary answering approximate-match queries.
 * <p>
 * Build it with {@link #insert} first, then query it. Queries must not run
 * while words are being inserted.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public interface FuzzyIndex {
    /**
     * @return false if the word was already present
     * @throws InvalidWordException if the word contains {@link CharTrie#TERMINATOR}
     */
    boolean insert( String word );

    /**
     * Every stored word within {@code k} edits of {@code query}, with its exact
     * Levenshtein distance. Produced lazily; a word may be reported more than once.
     */
    Iterator<Match> fuzzy( String query, int k );

    boolean contains( String word );

    int size();

    void print( PrintStream out );
}
