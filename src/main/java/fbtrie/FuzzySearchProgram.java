package fbtrie;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import joptsimple.NonOptionArgumentSpec;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a dictionary from stdin, one word per line, and prints the words
 * within K edits of the query as {@code distance word}, closest first.
 * Lines are trimmed and blank ones are skipped, so the empty word is never
 * stored and an empty query matches only words of at most K characters.
 * <pre>
 * FuzzySearchProgram query K [trie|fbtrie] [--prefix]
 * </pre>
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public class FuzzySearchProgram {
    private static final Logger logger = LoggerFactory.getLogger( FuzzySearchProgram.class );

    static final int USAGE_ERROR = 1;
    static final String USAGE = "usage: FuzzySearchProgram query K [trie|fbtrie] [--prefix]";

    public static void main( String[] args ) throws IOException {
        int status = run( args, System.in, System.out, System.err );
        if ( status != 0 ) {
            System.exit( status );
        }
    }

    static int run( String[] args, InputStream in, PrintStream out, PrintStream err ) throws IOException {
        OptionParser parser = new OptionParser();
        OptionSpec<Void> prefixOption = parser.accepts( "prefix", "match the query against word prefixes (trie only)" );
        NonOptionArgumentSpec<String> positional = parser.nonOptions( "query K [trie|fbtrie]" );

        OptionSet options;
        try {
            options = parser.parse( args );
        } catch ( OptionException e ) {
            return usage( err, e.getMessage() );
        }

        List<String> values = positional.values( options );
        if ( values.size() < 2 || values.size() > 3 ) {
            return usage( err, null );
        }
        String query = values.get( 0 );
        int k;
        try {
            k = Integer.parseInt( values.get( 1 ) );
        } catch ( NumberFormatException e ) {
            return usage( err, "K is not a number: " + values.get( 1 ) );
        }
        if ( k < 0 ) {
            return usage( err, "K cannot be negative: " + k );
        }

        FuzzyIndex index = createIndex( values.size() == 3 ? values.get( 2 ) : "trie" );
        boolean prefix = options.has( prefixOption );
        if ( prefix && !( index instanceof TrieIndex ) ) {
            logger.warn( "Prefix search is only supported by 'trie', ignoring --prefix" );
            prefix = false;
        }

        logger.info( "Reading from stdin..." );
        int words = readDictionary( index, in );
        logger.info( "Processing query {} {} over {} words", query, k, words );

        long begin = System.nanoTime();
        Iterator<Match> matches = prefix ? ( ( TrieIndex ) index ).complete( query, k ) : index.fuzzy( query, k );
        Set<Match> result = closest( matches );
        long end = System.nanoTime();

        for ( Match match : result ) {
            out.println( match.distance + " " + match.word );
        }
        logger.info( String.format( Locale.ROOT, "RESULT: %s~%d: [%d found] in %.4fms using [%s]",
                query, k, result.size(), ( end - begin ) / 1e6, index.getClass().getSimpleName() ) );
        return 0;
    }

    static FuzzyIndex createIndex( String type ) {
        String name = type.toLowerCase( Locale.ROOT );
        if ( name.equals( "trie" ) ) {
            return new TrieIndex();
        }
        if ( name.equals( "fbtrie" ) ) {
            return new ForwardBackwardIndex();
        }
        logger.warn( "Unknown trie type '{}'. Using default 'trie'", type );
        return new TrieIndex();
    }

    /**
     * Inserts every non-blank trimmed line. Lines the index rejects are skipped.
     *
     * @return number of distinct words stored
     */
    static int readDictionary( FuzzyIndex index, InputStream in ) throws IOException {
        BufferedReader reader = new BufferedReader( new InputStreamReader( in, StandardCharsets.UTF_8 ) );
        String line;
        int lineNumber = 0;
        while ( ( line = reader.readLine() ) != null ) {
            lineNumber++;
            String word = line.trim();
            if ( word.isEmpty() ) continue;
            try {
                index.insert( word );
            } catch ( InvalidWordException e ) {
                logger.warn( "Skipping line {}: {}", lineNumber, e.getMessage() );
            }
        }
        return index.size();
    }

    /**
     * One match per word, the one with the smallest distance, sorted.
     */
    static Set<Match> closest( Iterator<Match> matches ) {
        Map<String, Integer> best = new HashMap<String, Integer>();
        while ( matches.hasNext() ) {
            Match match = matches.next();
            Integer known = best.get( match.word );
            if ( null == known || match.distance < known ) {
                best.put( match.word, match.distance );
            }
        }
        Set<Match> result = new TreeSet<Match>();
        for ( Map.Entry<String, Integer> entry : best.entrySet() ) {
            result.add( new Match( entry.getKey(), entry.getValue() ) );
        }
        return result;
    }

    private static int usage( PrintStream err, String error ) {
        err.println( USAGE );
        if ( error != null ) {
            err.println( "ERROR: " + error );
        }
        return USAGE_ERROR;
    }
}
