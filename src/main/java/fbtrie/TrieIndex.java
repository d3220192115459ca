package fbtrie;

import java.io.PrintStream;
import java.util.Iterator;

/**
 * Fuzzy dictionary over a single trie searched with a constant budget.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public class TrieIndex implements FuzzyIndex {
    private final CharTrie trie = new CharTrie();

    @Override
    public boolean insert( String word ) {
        return trie.insert( word );
    }

    @Override
    public Iterator<Match> fuzzy( String query, int k ) {
        return BoundedEditSearch.search( trie, query, SearchBudget.constant( k ), false );
    }

    /**
     * Completion search: words starting with something within {@code k} edits
     * of {@code query}. A word longer than the query is reported with the
     * distance of its first {@code query.length()} characters.
     */
    public Iterator<Match> complete( String query, int k ) {
        return BoundedEditSearch.search( trie, query, SearchBudget.constant( k ), true );
    }

    public Iterator<Match> search( String query, SearchBudget budget, boolean prefixMode ) {
        return BoundedEditSearch.search( trie, query, budget, prefixMode );
    }

    @Override
    public boolean contains( String word ) {
        return trie.contains( word );
    }

    @Override
    public int size() {
        return trie.size();
    }

    @Override
    public void print( PrintStream out ) {
        trie.print( out );
    }
}
