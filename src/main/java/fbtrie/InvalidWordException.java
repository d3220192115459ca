package fbtrie;

/**
 * Thrown when a word cannot be stored because it contains {@link CharTrie#TERMINATOR}.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public class InvalidWordException extends IllegalArgumentException {
    private final String word;

    public InvalidWordException( String word, int position ) {
        super( String.format( "word contains the reserved terminator character at position %d", position ) );
        this.word = word;
    }

    public String getWord() {
        return word;
    }
}
