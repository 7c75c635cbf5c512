package RegAlgebra;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LanguageAlgebraTest {
  /**
   * Accepts exactly the given words over {a, b}, as a trie.
   */
  static Automaton finiteLanguage(String... words) {
    Automaton a = new Automaton();
    a.addSymbol("a");
    a.addSymbol("b");
    a.addState("");
    for (String word : words) {
      for (int i = 1; i <= word.length(); i++) {
        String prefix = word.substring(0, i);
        a.addState(prefix);
        a.addTransition(word.substring(0, i - 1), word.substring(i - 1, i), prefix);
      }
      a.setFinal(word, true);
    }
    return a;
  }

  /**
   * Words over {a, b} with an even number of a's.
   */
  static Automaton evenAs() {
    Automaton a = new Automaton(List.of("e", "o"), List.of("a", "b"), "e", List.of("e"));
    a.setTransition("e", "a", Set.of("o"));
    a.setTransition("o", "a", Set.of("e"));
    a.setTransition("e", "b", Set.of("e"));
    a.setTransition("o", "b", Set.of("o"));
    return a;
  }

  @Test
  void testComplete() {
    Automaton a = AutomatonTest.endsWithAB();
    a.addState("qdead");
    String sink = a.complete();
    Assertions.assertEquals("qdead0", sink); // fresh label, never an existing state
    Assertions.assertTrue(LanguageAlgebra.isComplete(a));
    Assertions.assertEquals(Set.of(sink), a.getTransition(sink, "a"));
    Assertions.assertEquals(Set.of(sink), a.getTransition("q2", "b"));
    Assertions.assertNull(a.complete()); // already total

    Automaton empty = new Automaton();
    empty.addSymbol("a");
    String emptySink = empty.complete();
    Assertions.assertEquals(emptySink, empty.getInitialState());
  }

  @Test
  void testComplementLaw() {
    for (Automaton original : List.of(AutomatonTest.endsWithAB(), evenAs(), finiteLanguage("a", "ab"))) {
      Automaton complement = original.copy();
      complement.complement();
      Assertions.assertTrue(complement.isDeterministic());
      for (List<String> word : Words.upTo(original.getAlphabet(), 6)) {
        Assertions.assertEquals(!original.accept(word), complement.accept(word), word.toString());
      }
    }
  }

  @Test
  void testComplementOfEmptyAutomatonAcceptsEverything() {
    Automaton a = new Automaton();
    a.addSymbol("a");
    a.complement();
    Assertions.assertTrue(a.accept(""));
    Assertions.assertTrue(a.accept("aaa"));
  }

  @Test
  void testUnionLaw() {
    Automaton left = AutomatonTest.endsWithAB();
    Automaton right = evenAs();
    Automaton rightBefore = right.copy();
    Automaton union = left.copy();
    union.union(right);

    Assertions.assertEquals(rightBefore, right); // operand untouched
    Assertions.assertEquals("q" + (union.size() - 1), union.getInitialState());
    for (List<String> word : Words.upTo(union.getAlphabet(), 6)) {
      Assertions.assertEquals(left.accept(word) || right.accept(word), union.accept(word), word.toString());
    }
  }

  @Test
  void testUnionMergesAlphabets() {
    Automaton onlyA = new Automaton(List.of("p"), List.of("a"), "p", List.of());
    onlyA.setTransition("p", "a", Set.of("p"));
    onlyA.toggleFinalState("p");
    Automaton onlyC = new Automaton(List.of("r", "s"), List.of("c"), "r", List.of("s"));
    onlyC.setTransition("r", "c", Set.of("s"));

    onlyA.union(onlyC);
    Assertions.assertEquals(Set.of("a", "c"), onlyA.getAlphabet());
    Assertions.assertTrue(onlyA.accept(""));
    Assertions.assertTrue(onlyA.accept("aaa"));
    Assertions.assertTrue(onlyA.accept("c"));
    Assertions.assertFalse(onlyA.accept("ac"));
    Assertions.assertFalse(onlyA.accept("cc"));
  }

  @Test
  void testIntersectionLaw() {
    Automaton left = AutomatonTest.endsWithAB();
    Automaton right = evenAs();
    Automaton rightBefore = right.copy();
    Automaton intersection = left.copy();
    intersection.intersection(right);

    Assertions.assertEquals(rightBefore, right);
    Assertions.assertTrue(intersection.isDeterministic());
    for (List<String> word : Words.upTo(intersection.getAlphabet(), 7)) {
      Assertions.assertEquals(left.accept(word) && right.accept(word), intersection.accept(word),
          word.toString());
    }
  }

  @Test
  void testRandomIntersections() {
    for (int seed = 0; seed < 20; seed++) {
      Automaton left = TabakovVardiRandomAutomaton.getRandomAutomaton(seed, 4);
      Automaton right = TabakovVardiRandomAutomaton.getRandomAutomaton(seed + 1000, 4);
      Automaton intersection = left.copy();
      intersection.intersection(right);
      for (List<String> word : Words.upTo(left.getAlphabet(), 6)) {
        Assertions.assertEquals(left.accept(word) && right.accept(word), intersection.accept(word),
            "seed " + seed + ": " + word);
      }
    }
  }

  @Test
  void testIsEmpty() {
    Automaton noFinals = new Automaton(List.of("q0", "q1"), List.of("a"), "q0", List.of());
    noFinals.setTransition("q0", "a", Set.of("q1"));
    Assertions.assertTrue(noFinals.isEmpty());

    Automaton unreachableFinal = new Automaton(List.of("q0", "q1"), List.of("a"), "q0", List.of("q1"));
    unreachableFinal.setTransition("q1", "a", Set.of("q0"));
    Automaton before = unreachableFinal.copy();
    Assertions.assertTrue(unreachableFinal.isEmpty());
    Assertions.assertEquals(before, unreachableFinal); // queries never mutate

    Assertions.assertFalse(AutomatonTest.endsWithAB().isEmpty());
    Assertions.assertTrue(new Automaton().isEmpty());
  }

  @Test
  void testIsFinite() {
    Automaton loop = new Automaton(List.of("q0"), List.of("a"), "q0", List.of("q0"));
    loop.setTransition("q0", "a", Set.of("q0"));
    Assertions.assertFalse(loop.isFinite());

    Assertions.assertTrue(finiteLanguage("a", "ab", "bba").isFinite());
    Assertions.assertFalse(AutomatonTest.endsWithAB().isFinite());
    Assertions.assertFalse(evenAs().isFinite());

    // a cycle that can never reach acceptance does not make the language infinite
    Automaton deadLoop = finiteLanguage("a");
    deadLoop.addState("d");
    deadLoop.setTransition("", "b", Set.of("d"));
    deadLoop.setTransition("d", "b", Set.of("d"));
    Automaton before = deadLoop.copy();
    Assertions.assertTrue(deadLoop.isFinite());
    Assertions.assertEquals(before, deadLoop);

    // diamond shape revisits a state without a cycle
    Automaton diamond = new Automaton(List.of("q0", "q1", "q2", "q3"), List.of("a", "b"), "q0", List.of("q3"));
    diamond.setTransition("q0", "a", Set.of("q1"));
    diamond.setTransition("q0", "b", Set.of("q2"));
    diamond.setTransition("q1", "a", Set.of("q3"));
    diamond.setTransition("q2", "a", Set.of("q3"));
    Assertions.assertTrue(diamond.isFinite());
  }

  @Test
  void testContains() {
    Automaton a = AutomatonTest.endsWithAB();
    Assertions.assertTrue(a.contains(a.copy()));
    Assertions.assertTrue(a.contains(a));
    Assertions.assertTrue(a.contains(finiteLanguage("ab", "aab", "bab")));
    Assertions.assertFalse(a.contains(finiteLanguage("ab", "ba")));
    Assertions.assertFalse(finiteLanguage("ab").contains(a));
    Assertions.assertEquals(AutomatonTest.endsWithAB(), a); // untouched
  }

  @Test
  void testContainsWithForeignSymbols() {
    Automaton onlyA = new Automaton(List.of("p"), List.of("a"), "p", List.of("p"));
    onlyA.setTransition("p", "a", Set.of("p"));
    Automaton withC = new Automaton(List.of("r", "s"), List.of("c"), "r", List.of("s"));
    withC.setTransition("r", "c", Set.of("s"));
    Assertions.assertFalse(onlyA.contains(withC));
    Assertions.assertTrue(onlyA.contains(new Automaton(List.of("x"), List.of("a"), "x", List.of())));
  }

  @Test
  void testIsEqual() {
    Automaton trie = finiteLanguage("a", "ab");
    // a -> q1 (final) -b-> q2 (final), built independently
    Automaton other = new Automaton(List.of("q0", "q1", "q2"), List.of("a", "b"), "q0", List.of("q1", "q2"));
    other.setTransition("q0", "a", Set.of("q1"));
    other.setTransition("q1", "b", Set.of("q2"));
    Assertions.assertTrue(trie.isEqual(other));
    Assertions.assertTrue(other.isEqual(trie));

    Automaton minimized = AutomatonTest.endsWithAB();
    minimized.determinize();
    minimized.minimize();
    Assertions.assertTrue(minimized.isEqual(AutomatonTest.endsWithAB()));
    Assertions.assertFalse(evenAs().isEqual(AutomatonTest.endsWithAB()));
  }
}
