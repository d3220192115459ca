package fbtrie;

/**
 * Decides how far a {@link BoundedEditSearch} may stray from the query.
 * <p>
 * A search carries a small integer phase along every trie path. After each
 * DP row the budget either names the phase to continue in or prunes the path,
 * and words are accepted against the limit of the phase they were reached in.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public abstract class SearchBudget {
    private final int maxDistance;

    private SearchBudget( int maxDistance ) {
        if ( maxDistance < 0 ) throw new IllegalArgumentException( "distance cannot be negative: " + maxDistance );
        this.maxDistance = maxDistance;
    }

    /**
     * Largest distance any accepted word may have. Sizes the DP table.
     */
    public int maxDistance() {
        return maxDistance;
    }

    /**
     * Phase of the root, given row 0 of the table.
     */
    abstract int initialPhase( int[] firstRow );

    abstract int acceptLimit( int phase );

    /**
     * Phase to descend with once {@code row} is computed, or -1 to prune.
     */
    abstract int nextPhase( int[] row, int phase );

    /**
     * The same limit at every depth.
     */
    public static SearchBudget constant( int k ) {
        return new Constant( k );
    }

    /**
     * Starts with {@code headBudget} and relaxes to {@code k} for good as soon
     * as the first {@code headLength} query characters are matched within
     * {@code headBudget}. Words are accepted against {@code k} in both phases.
     */
    public static SearchBudget twoPhase( int headLength, int headBudget, int k ) {
        return new TwoPhase( headLength, headBudget, k );
    }

    static int min( int[] row ) {
        int min = row[0];
        for ( int j = 1; j < row.length; j++ ) {
            if ( row[j] < min ) min = row[j];
        }
        return min;
    }

    private static final class Constant extends SearchBudget {
        private Constant( int k ) {
            super( k );
        }

        @Override
        int initialPhase( int[] firstRow ) {
            return 0;
        }

        @Override
        int acceptLimit( int phase ) {
            return maxDistance();
        }

        @Override
        int nextPhase( int[] row, int phase ) {
            return min( row ) <= maxDistance() ? phase : -1;
        }

        @Override
        public String toString() {
            return "constant(" + maxDistance() + ")";
        }
    }

    private static final class TwoPhase extends SearchBudget {
        static final int HEAD = 1;
        static final int TAIL = 2;

        private final int headLength;
        private final int headBudget;

        private TwoPhase( int headLength, int headBudget, int k ) {
            super( k );
            if ( headLength < 0 ) throw new IllegalArgumentException( "head length cannot be negative: " + headLength );
            if ( headBudget < 0 || headBudget > k ) {
                throw new IllegalArgumentException( String.format( "head budget %d is outside [0, %d]", headBudget, k ) );
            }
            this.headLength = headLength;
            this.headBudget = headBudget;
        }

        @Override
        int initialPhase( int[] firstRow ) {
            if ( headLength >= firstRow.length ) {
                throw new IllegalArgumentException( String.format( "head length %d exceeds query length %d",
                        headLength, firstRow.length - 1 ) );
            }
            // An empty or short enough head is satisfied before any character is read
            return firstRow[headLength] <= headBudget ? TAIL : HEAD;
        }

        @Override
        int acceptLimit( int phase ) {
            return maxDistance();
        }

        @Override
        int nextPhase( int[] row, int phase ) {
            if ( phase == HEAD && row[headLength] <= headBudget ) return TAIL;
            int limit = phase == HEAD ? headBudget : maxDistance();
            return min( row ) <= limit ? phase : -1;
        }

        @Override
        public String toString() {
            return String.format( "twoPhase(head=%d~%d, k=%d)", headLength, headBudget, maxDistance() );
        }
    }
}
