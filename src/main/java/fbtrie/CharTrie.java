package fbtrie;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Character trie kept in a node arena: every node is addressed by its index in
 * the arena, the root is {@link #ROOT}. A stored word is the path of its
 * characters followed by a {@link #TERMINATOR} edge, so words may not contain
 * the terminator themselves.
 * <p>
 * Children of a node are kept either in the order they were first added or,
 * for a sorted trie, ordered by character.
 * <p>
 * Not thread safe. Any number of readers may walk a trie that is no longer
 * modified.
 *
 * @author fbtrie
 *         19.10.2026 12:00
 */
public class CharTrie {
    public static final char TERMINATOR = '\0';
    public static final int ROOT = 0;

    private static final char[] NO_SYMBOLS = new char[0];
    private static final int[] NO_TARGETS = new int[0];

    // Below this many children a linear scan beats binary search
    private static final int LINEAR_SCAN_LIMIT = 25;

    private static class Node {
        char[] symbols = NO_SYMBOLS;
        int[] targets = NO_TARGETS;
        int count;

        private int indexOf( char c, boolean sorted ) {
            if ( sorted && count >= LINEAR_SCAN_LIMIT ) {
                int i = Arrays.binarySearch( symbols, 0, count, c );
                return i >= 0 ? i : -1;
            }
            for ( int i = 0; i < count; i++ ) {
                if ( symbols[i] == c ) return i;
            }
            return -1;
        }

        private void add( char c, int target, boolean sorted ) {
            if ( count == symbols.length ) {
                int capacity = count == 0 ? 1 : count * 2;
                symbols = Arrays.copyOf( symbols, capacity );
                targets = Arrays.copyOf( targets, capacity );
            }
            int i = count;
            if ( sorted ) {
                // Shift bigger symbols right, insertion sort style
                while ( i > 0 && symbols[i - 1] > c ) {
                    symbols[i] = symbols[i - 1];
                    targets[i] = targets[i - 1];
                    i--;
                }
            }
            symbols[i] = c;
            targets[i] = target;
            count++;
        }
    }

    private final List<Node> nodes = new ArrayList<Node>();
    private final boolean sortedChildren;
    private int size;
    private int maxWordLength;

    /**
     * Creates a trie that keeps children in insertion order.
     */
    public CharTrie() {
        this( false );
    }

    public CharTrie( boolean sortedChildren ) {
        this.sortedChildren = sortedChildren;
        nodes.add( new Node() );
    }

    /**
     * Stores the word.
     *
     * @return false if the word was already present
     * @throws InvalidWordException if the word contains {@link #TERMINATOR}
     */
    public boolean insert( String word ) {
        if ( null == word ) throw new IllegalArgumentException( "word cannot be null" );
        int terminatorAt = word.indexOf( TERMINATOR );
        if ( terminatorAt >= 0 ) throw new InvalidWordException( word, terminatorAt );

        int node = ROOT;
        boolean added = false;
        for ( int i = 0, len = word.length(); i <= len; i++ ) {
            char c = i < len ? word.charAt( i ) : TERMINATOR;
            Node current = nodes.get( node );
            int index = current.indexOf( c, sortedChildren );
            if ( index < 0 ) {
                int created = nodes.size();
                nodes.add( new Node() );
                current.add( c, created, sortedChildren );
                node = created;
                added = true;
            } else {
                node = current.targets[index];
            }
        }
        if ( added ) {
            size++;
            maxWordLength = Math.max( maxWordLength, word.length() );
        }
        return added;
    }

    public boolean contains( String word ) {
        if ( null == word ) throw new IllegalArgumentException( "word cannot be null" );
        int node = ROOT;
        for ( int i = 0, len = word.length(); i <= len; i++ ) {
            char c = i < len ? word.charAt( i ) : TERMINATOR;
            Node current = nodes.get( node );
            int index = current.indexOf( c, sortedChildren );
            if ( index < 0 ) return false;
            node = current.targets[index];
        }
        return true;
    }

    /**
     * Number of distinct words stored.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Number of nodes in the arena, root included.
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Length of the longest stored word, 0 for an empty trie.
     */
    public int maxWordLength() {
        return maxWordLength;
    }

    public int childCount( int node ) {
        return nodes.get( node ).count;
    }

    public char symbol( int node, int index ) {
        return nodes.get( node ).symbols[index];
    }

    public int child( int node, int index ) {
        return nodes.get( node ).targets[index];
    }

    /**
     * Lazily lists every word stored below {@code node}, depth first in child
     * order. Each word is {@code prefix} followed by the path from {@code node}
     * and is reported with the given distance.
     */
    public Iterator<Match> enumerate( int node, String prefix, int distance ) {
        return new WordIterator( node, prefix, distance );
    }

    /**
     * Prints the structure for debugging: a branching node as {@code prefix/},
     * a word as itself, each branching level indented by one more space.
     */
    public void print( PrintStream out ) {
        printNode( out, ROOT, "", "" );
    }

    private void printNode( PrintStream out, int node, String sofar, String before ) {
        Node current = nodes.get( node );
        if ( current.count > 1 ) {
            out.println( before + sofar + "/" );
            before += " ";
        }
        for ( int i = 0; i < current.count; i++ ) {
            char c = current.symbols[i];
            if ( c == TERMINATOR ) {
                out.println( before + sofar );
            } else {
                printNode( out, current.targets[i], sofar + c, before );
            }
        }
    }

    private class WordIterator implements Iterator<Match> {
        private final StringBuilder path;
        private final int base;
        private final int distance;
        private int[] stackNodes = new int[16];
        private int[] stackPositions = new int[16];
        private int top = -1;
        private Match next;

        private WordIterator( int node, String prefix, int distance ) {
            this.path = new StringBuilder( prefix );
            this.base = prefix.length();
            this.distance = distance;
            push( node );
        }

        private void push( int node ) {
            top++;
            if ( top == stackNodes.length ) {
                stackNodes = Arrays.copyOf( stackNodes, top * 2 );
                stackPositions = Arrays.copyOf( stackPositions, top * 2 );
            }
            stackNodes[top] = node;
            stackPositions[top] = 0;
        }

        private Match advance() {
            while ( top >= 0 ) {
                Node current = nodes.get( stackNodes[top] );
                int pos = stackPositions[top]++;
                if ( pos >= current.count ) {
                    top--;
                    continue;
                }
                path.setLength( base + top );
                char c = current.symbols[pos];
                if ( c == TERMINATOR ) {
                    return new Match( path.toString(), distance );
                }
                path.append( c );
                push( current.targets[pos] );
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
}
