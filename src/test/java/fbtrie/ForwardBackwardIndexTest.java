package fbtrie;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

import static fbtrie.Dictionaries.bruteForce;
import static fbtrie.Dictionaries.collect;
import static fbtrie.Dictionaries.levenshtein;
import static fbtrie.Dictionaries.toList;

/**
 * @author fbtrie
 *         19.10.2026 12:00
 */
public class ForwardBackwardIndexTest {
    private static ForwardBackwardIndex index( String... words ) {
        ForwardBackwardIndex index = new ForwardBackwardIndex();
        for ( String word : words ) index.insert( word );
        return index;
    }

    @Test
    public void testOneEdit() {
        ForwardBackwardIndex index = index( "cat", "cats", "bat", "rat" );
        Map<String, Integer> expected = new HashMap<String, Integer>();
        expected.put( "cat", 0 );
        expected.put( "cats", 1 );
        expected.put( "bat", 1 );
        expected.put( "rat", 1 );
        Assert.assertEquals( expected, collect( index.fuzzy( "cat", 1 ) ) );
    }

    @Test
    public void testKittenSitting() {
        ForwardBackwardIndex index = index( "kitten" );
        List<Match> matches = toList( index.fuzzy( "sitting", 3 ) );
        Assert.assertFalse( matches.isEmpty() );
        for ( Match match : matches ) {
            Assert.assertEquals( new Match( "kitten", 3 ), match );
        }
        Assert.assertTrue( toList( index.fuzzy( "sitting", 2 ) ).isEmpty() );
    }

    @Test
    public void testExactMatch() {
        ForwardBackwardIndex index = index( "cat", "cats", "act" );
        for ( Match match : toList( index.fuzzy( "cat", 0 ) ) ) {
            Assert.assertEquals( new Match( "cat", 0 ), match );
        }
        Assert.assertEquals( 1, collect( index.fuzzy( "cat", 0 ) ).size() );
        Assert.assertFalse( index.fuzzy( "tac", 0 ).hasNext() );
    }

    @Test
    public void testBackwardWordsRestored() {
        // Only the backward pass can find a word whose first half is off by more than the forward budget
        ForwardBackwardIndex index = index( "xxcdef" );
        List<Match> matches = toList( index.fuzzy( "abcdef", 2 ) );
        Assert.assertEquals( 1, matches.size() );
        Assert.assertEquals( new Match( "xxcdef", 2 ), matches.get( 0 ) );
    }

    @Test
    public void testForwardWordsOnly() {
        ForwardBackwardIndex index = index( "abcdyy" );
        List<Match> matches = toList( index.fuzzy( "abcdef", 2 ) );
        Assert.assertEquals( 1, matches.size() );
        Assert.assertEquals( new Match( "abcdyy", 2 ), matches.get( 0 ) );
    }

    @Test
    public void testShortQueries() {
        ForwardBackwardIndex index = index( "", "a", "b", "ab", "ba", "abc" );
        Assert.assertEquals( bruteForce( Arrays.asList( "", "a", "b", "ab", "ba", "abc" ), "a", 1 ),
                collect( index.fuzzy( "a", 1 ) ) );
        Map<String, Integer> expected = new HashMap<String, Integer>();
        expected.put( "", 0 );
        expected.put( "a", 1 );
        expected.put( "b", 1 );
        Assert.assertEquals( expected, collect( index.fuzzy( "", 1 ) ) );
    }

    @Test
    public void testForwardThenBackwardOrder() {
        ForwardBackwardIndex index = index( "cbt", "cat", "bat" );
        // Both passes walk children in character order, "bat" only survives the backward one
        Assert.assertEquals( Arrays.asList( new Match( "cat", 0 ), new Match( "cbt", 1 ), new Match( "bat", 1 ), new Match( "cat", 0 ) ),
                toList( index.fuzzy( "cat", 1 ) ) );
    }

    @Test
    public void testHugeDistance() {
        Map<String, Integer> expected = new HashMap<String, Integer>();
        expected.put( "cat", 0 );
        Assert.assertEquals( expected, collect( index( "cat" ).fuzzy( "cat", Integer.MAX_VALUE ) ) );

        expected.put( "dog", 3 );
        expected.put( "category", 5 );
        Assert.assertEquals( expected, collect( index( "cat", "dog", "category" ).fuzzy( "cat", Integer.MAX_VALUE ) ) );
    }

    @Test
    public void testInsert() {
        ForwardBackwardIndex index = new ForwardBackwardIndex();
        Assert.assertTrue( index.insert( "abc" ) );
        Assert.assertFalse( index.insert( "abc" ) );
        Assert.assertTrue( index.contains( "abc" ) );
        Assert.assertFalse( index.contains( "cba" ) );
        Assert.assertEquals( 1, index.size() );
    }

    @Test( expected = InvalidWordException.class )
    public void testInvalidWord() {
        index( "a\0b" );
    }

    @Test( expected = IllegalArgumentException.class )
    public void testNegativeDistance() {
        index( "cat" ).fuzzy( "cat", -1 );
    }

    @Test
    public void testReverse() {
        Assert.assertEquals( "", ForwardBackwardIndex.reverse( "" ) );
        Assert.assertEquals( "cba", ForwardBackwardIndex.reverse( "abc" ) );
    }

    @Test
    public void testPrint() {
        ForwardBackwardIndex index = index( "ab", "b" );
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        index.print( new PrintStream( bytes, true ) );
        String printed = new String( bytes.toByteArray(), StandardCharsets.UTF_8 ).replace( "\r\n", "\n" );
        Assert.assertEquals( "/\n ab\n b\nb/\n b\n ba\n", printed );
    }

    @Test
    public void testSameAsTrie() {
        Random random = new Random( 2011 );
        for ( int round = 0; round < 5; round++ ) {
            List<String> words = Dictionaries.randomWords( random, "abcd", 250, 7 );
            ForwardBackwardIndex fbIndex = new ForwardBackwardIndex();
            TrieIndex trieIndex = new TrieIndex();
            for ( String word : words ) {
                fbIndex.insert( word );
                trieIndex.insert( word );
            }

            for ( int i = 0; i < 40; i++ ) {
                String query = Dictionaries.randomWord( random, "abcde", random.nextInt( 9 ) );
                for ( int k = 0; k <= 4; k++ ) {
                    Map<String, Integer> expected = bruteForce( words, query, k );
                    Assert.assertEquals( query + "~" + k, expected, collect( trieIndex.fuzzy( query, k ) ) );
                    Assert.assertEquals( query + "~" + k, expected, collect( fbIndex.fuzzy( query, k ) ) );
                }
            }
        }
    }

    @Test
    public void testDistancesExact() {
        Random random = new Random( 5 );
        List<String> words = Dictionaries.randomWords( random, "ab", 100, 6 );
        ForwardBackwardIndex index = new ForwardBackwardIndex();
        for ( String word : words ) index.insert( word );
        for ( int i = 0; i < 30; i++ ) {
            String query = Dictionaries.randomWord( random, "ab", random.nextInt( 7 ) );
            for ( Match match : toList( index.fuzzy( query, 3 ) ) ) {
                Assert.assertEquals( levenshtein( match.word, query ), match.distance );
                Assert.assertTrue( match.distance <= 3 );
            }
        }
    }

    @Test
    public void testInsertTwiceSameResults() {
        ForwardBackwardIndex once = index( "cat", "cats", "bat" );
        ForwardBackwardIndex twice = index( "cat", "cats", "bat", "cats", "cat" );
        Assert.assertEquals( toList( once.fuzzy( "cast", 2 ) ), toList( twice.fuzzy( "cast", 2 ) ) );
    }
}
