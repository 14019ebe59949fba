/* @LICENSE@
 */

package org.xtgraph.automaton;

import static junit.framework.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Language checks by brute force over short words.
 */
public final class AutomatonAssert {

    private AutomatonAssert() {}   // not instantiable.

    /**
     * @return every word over <code>alphabet</code> of length at most
     *         <code>maxLength</code>, the empty word first
     */
    public static List<String> words(String alphabet, int maxLength) {
        List<String> ret = new ArrayList<String>();
        ret.add("");
        int from = 0;
        for (int len = 1; len <= maxLength; ++len) {
            int to = ret.size();
            for (int i = from; i < to; ++i) {
                for (int j = 0; j < alphabet.length(); ++j) ret.add(ret.get(i) + alphabet.charAt(j));
            }
            from = to;
        }
        return ret;
    }

    public static Set<String> set(String... words) {
        return new HashSet<String>(Arrays.asList(words));
    }

    /**
     * Asserts <code>dfa</code> accepts, among the words over
     * <code>alphabet</code> up to <code>maxLength</code>, exactly
     * <code>language</code>.
     */
    public static void assertLanguage(Automaton dfa, Collection<String> language,
                                      String alphabet, int maxLength) {
        for (String w : words(alphabet, maxLength)) {
            assertEquals("\"" + w + "\"" + dfa, language.contains(w), dfa.accepts(w));
        }
    }

    public static void assertLanguage(Nfa nfa, Collection<String> language,
                                      String alphabet, int maxLength) {
        for (String w : words(alphabet, maxLength)) {
            assertEquals("\"" + w + "\"" + nfa, language.contains(w), nfa.accepts(w));
        }
    }

    public static void assertDeterministic(Automaton dfa) {
        assertTrue(Nfa.from(dfa).isDeterministic());
    }
}
