package fbtrie;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy fuzzy lookup in a {@link CharTrie}.
 * <p>
 * Walks the trie depth first with an explicit stack and keeps one row of the
 * Levenshtein table per depth: row i holds the distances between the current
 * path of length i and every prefix of the query. A path is abandoned as soon
 * as its {@link SearchBudget} rejects the latest row, and no node is visited
 * beyond what the caller pulls.
 * <p>
 * The table belongs to this iterator alone; run one iterator per thread.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public class BoundedEditSearch implements Iterator<Match> {
    private final CharTrie trie;
    private final char[] query;
    private final SearchBudget budget;
    private final boolean prefixMode;

    // min(query length + max distance, longest word) + 1 rows, query length + 1 columns
    private final int[][] table;
    private final char[] path;

    // Frame per depth, index 0 unused
    private final int[] nodes;
    private final int[] positions;
    private final int[] phases;
    private int depth;

    private Iterator<Match> completions;
    private Match next;

    private BoundedEditSearch( CharTrie trie, String query, SearchBudget budget, boolean prefixMode ) {
        this.trie = trie;
        this.query = query.toCharArray();
        this.budget = budget;
        this.prefixMode = prefixMode;

        int n = this.query.length;
        // Neither a word longer than n + k nor one longer than any stored word can match
        int rows = ( int ) Math.min( ( long ) n + budget.maxDistance(), trie.maxWordLength() ) + 1;
        this.table = new int[rows][n + 1];
        for ( int j = 0; j <= n; j++ ) {
            table[0][j] = j;
        }
        this.path = new char[table.length];
        this.nodes = new int[table.length + 1];
        this.positions = new int[table.length + 1];
        this.phases = new int[table.length + 1];

        int phase = budget.initialPhase( table[0] );
        if ( phase >= 0 ) {
            push( CharTrie.ROOT, phase );
        }
    }

    /**
     * Finds every word of {@code trie} within {@code k} edits of {@code query}.
     */
    public static Iterator<Match> search( CharTrie trie, String query, int k ) {
        return search( trie, query, SearchBudget.constant( k ), false );
    }

    /**
     * @param prefixMode if set, once the whole query is consumed within budget
     *                   every word below that point is reported with the
     *                   distance reached there
     */
    public static Iterator<Match> search( CharTrie trie, String query, SearchBudget budget, boolean prefixMode ) {
        if ( null == trie ) throw new IllegalArgumentException( "trie cannot be null" );
        if ( null == query ) throw new IllegalArgumentException( "query cannot be null" );
        if ( null == budget ) throw new IllegalArgumentException( "budget cannot be null" );
        return new BoundedEditSearch( trie, query, budget, prefixMode );
    }

    private void push( int node, int phase ) {
        depth++;
        nodes[depth] = node;
        positions[depth] = 0;
        phases[depth] = phase;

        int n = query.length;
        if ( prefixMode && depth > n ) {
            int distance = table[depth - 1][n];
            if ( distance <= budget.acceptLimit( phase ) ) {
                completions = trie.enumerate( node, new String( path, 0, depth - 1 ), distance );
            } else {
                depth--;
            }
        }
    }

    private Match advance() {
        int n = query.length;
        while ( depth > 0 ) {
            if ( completions != null ) {
                if ( completions.hasNext() ) return completions.next();
                completions = null;
                depth--;
                continue;
            }

            int node = nodes[depth];
            int pos = positions[depth]++;
            if ( pos >= trie.childCount( node ) ) {
                depth--;
                continue;
            }
            int phase = phases[depth];
            char c = trie.symbol( node, pos );

            if ( c == CharTrie.TERMINATOR ) {
                int distance = table[depth - 1][n];
                if ( distance <= budget.acceptLimit( phase ) ) {
                    return new Match( new String( path, 0, depth - 1 ), distance );
                }
                continue;
            }

            // Last row is taken, no longer word can match
            if ( depth == table.length ) continue;

            int[] previous = table[depth - 1];
            int[] row = table[depth];
            row[0] = depth;
            for ( int j = 1; j <= n; j++ ) {
                int substitution = previous[j - 1] + ( c == query[j - 1] ? 0 : 1 );
                int insertion = previous[j] + 1;
                int deletion = row[j - 1] + 1;
                row[j] = Math.min( substitution, Math.min( insertion, deletion ) );
            }

            int nextPhase = budget.nextPhase( row, phase );
            if ( nextPhase < 0 ) continue;

            path[depth - 1] = c;
            push( trie.child( node, pos ), nextPhase );
        }
        return null;
    }

    @Override
    public boolean hasNext() {
        if ( next == null ) next = advance();
        return next != null;
    }

    @Override
    public Match next() {
        if ( !hasNext() ) throw new NoSuchElementException();
        Match result = next;
        next = null;
        return result;
    }
}
