package fbtrie;

import java.io.PrintStream;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FB-trie: a forward trie of the words and a backward trie of the reversed
 * words.
 * <p>
 * A query is split in two halves. The forward trie is searched with a tight
 * budget until the first half is matched, then with the full budget; the
 * backward trie does the same for the reversed second half. Any word within
 * {@code k} edits matches at least one half within its tight budget, so one of
 * the two searches finds it, while the tight budget keeps the wide upper
 * levels of both tries from branching.
 * <p>
 * See L. Boytsov, Indexing methods for approximate dictionary searching, 2011.
 * Only one search per direction is run, with budgets {@code (k - 1) / 2}
 * forward and {@code k / 2} backward.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public class ForwardBackwardIndex implements FuzzyIndex {
    private static final Logger logger = LoggerFactory.getLogger( ForwardBackwardIndex.class );

    private final CharTrie forward = new CharTrie( true );
    private final CharTrie backward = new CharTrie( true );

    @Override
    public boolean insert( String word ) {
        boolean added = forward.insert( word );
        backward.insert( reverse( word ) );
        return added;
    }

    /**
     * Forward matches first, then backward ones. Words matching both halves
     * closely enough are reported twice.
     */
    @Override
    public Iterator<Match> fuzzy( String query, int k ) {
        if ( null == query ) throw new IllegalArgumentException( "query cannot be null" );
        if ( k < 0 ) throw new IllegalArgumentException( "distance cannot be negative: " + k );
        return new FuzzyIterator( query, k );
    }

    @Override
    public boolean contains( String word ) {
        return forward.contains( word );
    }

    @Override
    public int size() {
        return forward.size();
    }

    /**
     * Prints the forward trie, then the backward one.
     */
    @Override
    public void print( PrintStream out ) {
        forward.print( out );
        backward.print( out );
    }

    /**
     * Reverses char by char, so that distances are the same both ways.
     */
    static String reverse( String s ) {
        char[] chars = new char[s.length()];
        for ( int i = 0, len = s.length(); i < len; i++ ) {
            chars[len - 1 - i] = s.charAt( i );
        }
        return new String( chars );
    }

    private class FuzzyIterator implements Iterator<Match> {
        private final String query;
        private final int k;
        private Iterator<Match> current;
        private boolean backwardPhase;

        private FuzzyIterator( String query, int k ) {
            this.query = query;
            this.k = k;
            int head = query.length() / 2;
            int headBudget = ( k - 1 ) / 2;
            logger.debug( "Forward search for '{}' with first {} chars within {}, then {}", query, head, headBudget, k );
            this.current = BoundedEditSearch.search( forward, query, SearchBudget.twoPhase( head, headBudget, k ), false );
        }

        @Override
        public boolean hasNext() {
            if ( current.hasNext() ) return true;
            if ( backwardPhase ) return false;

            // Backward table is only allocated once the forward matches are used up
            backwardPhase = true;
            int head = query.length() - query.length() / 2;
            int headBudget = k / 2;
            logger.debug( "Backward search for '{}' with last {} chars within {}, then {}", query, head, headBudget, k );
            current = BoundedEditSearch.search( backward, reverse( query ), SearchBudget.twoPhase( head, headBudget, k ), false );
            return current.hasNext();
        }

        @Override
        public Match next() {
            if ( !hasNext() ) throw new NoSuchElementException();
            Match match = current.next();
            return backwardPhase ? new Match( reverse( match.word ), match.distance ) : match;
        }
    }
}
