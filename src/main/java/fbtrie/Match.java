package fbtrie;

/**
 * A dictionary word together with its edit distance to the query that found it.
 * Ordered by distance, then by word.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public final class Match implements Comparable<Match> {
    public final String word;
    public final int distance;

    public Match( String word, int distance ) {
        if ( null == word ) throw new IllegalArgumentException( "word cannot be null" );
        this.word = word;
        this.distance = distance;
    }

    @Override
    public int compareTo( Match o ) {
        int result = Integer.compare( this.distance, o.distance );
        return result != 0 ? result : this.word.compareTo( o.word );
    }

    @Override
    public boolean equals( Object o ) {
        if ( this == o ) return true;
        if ( !( o instanceof Match ) ) return false;
        Match other = ( Match ) o;
        return distance == other.distance && word.equals( other.word );
    }

    @Override
    public int hashCode() {
        return 31 * word.hashCode() + distance;
    }

    @Override
    public String toString() {
        return String.format( "Match{'%s',distance=%d}", word, distance );
    }
}
