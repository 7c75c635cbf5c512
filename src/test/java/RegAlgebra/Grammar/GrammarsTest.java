package RegAlgebra.Grammar;

import java.util.List;
import java.util.Set;

import RegAlgebra.Automaton;
import RegAlgebra.Words;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class GrammarsTest {
  /**
   * S -> aA | b | &, A -> bS | a: words (ab)^n followed by nothing, b or aa.
   */
  private static MapGrammar sample() {
    return new MapGrammar("S")
        .addProductions("S", "aA", "b", RegularGrammar.EPSILON)
        .addProductions("A", "bS", "a");
  }

  @Test
  void testToAutomaton() {
    Automaton a = Automaton.fromRegularGrammar(sample());
    Assertions.assertEquals("S", a.getInitialState());
    Assertions.assertEquals(List.of("S", "A", "X"), a.getStates());
    Assertions.assertEquals(Set.of("a", "b"), a.getAlphabet());
    Assertions.assertEquals(Set.of("S", "X"), a.getFinalStates());
    Assertions.assertEquals(Set.of("X"), a.getTransition("S", "b"));

    Assertions.assertTrue(a.accept(""));
    Assertions.assertTrue(a.accept("b"));
    Assertions.assertTrue(a.accept("aa"));
    Assertions.assertTrue(a.accept("abab"));
    Assertions.assertTrue(a.accept("abb"));
    Assertions.assertFalse(a.accept("a"));
    Assertions.assertFalse(a.accept("ba"));
  }

  @Test
  void testNonDeterministicProductions() {
    MapGrammar g = new MapGrammar("S").addProductions("S", "aS", "a");
    Automaton a = Grammars.toAutomaton(g);
    Assertions.assertEquals(Set.of("S", "X"), a.getTransition("S", "a"));
    Assertions.assertFalse(a.isDeterministic());
    Assertions.assertFalse(a.accept(""));
    Assertions.assertTrue(a.accept("aaa"));
  }

  @Test
  void testAcceptStateAvoidsNonTerminals() {
    MapGrammar g = new MapGrammar("S").addProductions("S", "aX").addProductions("X", "b");
    Automaton a = Grammars.toAutomaton(g);
    Assertions.assertEquals(Set.of("X0"), a.getFinalStates());
    Assertions.assertTrue(a.accept("ab"));
    Assertions.assertFalse(a.accept("a"));
  }

  @Test
  void testEpsilonOnNonInitialSymbol() {
    // S -> aA, A -> bA | &: a followed by any number of b's
    MapGrammar g = new MapGrammar("S").addProductions("S", "aA").addProductions("A", "bA", RegularGrammar.EPSILON);
    Automaton a = Grammars.toAutomaton(g);
    Assertions.assertEquals(Set.of("A", "X"), a.getFinalStates());
    Assertions.assertFalse(a.isFinal("S"));
    Assertions.assertFalse(a.accept(""));
    Assertions.assertTrue(a.accept("a"));
    Assertions.assertTrue(a.accept("abbb"));
    Assertions.assertFalse(a.accept("ba"));
  }

  @Test
  void testMalformedProductions() {
    assertThrows(IllegalArgumentException.class,
        () -> Grammars.toAutomaton(new MapGrammar("S").addProductions("S", "abc")));
    assertThrows(IllegalArgumentException.class,
        () -> Grammars.toAutomaton(new MapGrammar("S").addProductions("S", "")));
    assertThrows(IllegalArgumentException.class,
        () -> Grammars.toAutomaton(new MapGrammar("S").addProductions("S", "aB")));
  }

  @Test
  void testFromAutomaton() {
    Automaton a = Automaton.fromRegularGrammar(sample());
    a.relabelAlphabetic();
    MapGrammar g = Grammars.fromAutomaton(a);
    Assertions.assertEquals("S", g.getInitialSymbol());
    Assertions.assertTrue(g.getProductions().get("S").contains(RegularGrammar.EPSILON));
    Assertions.assertTrue(g.toString().startsWith("S -> "));

    Automaton back = Grammars.toAutomaton(g);
    for (List<String> word : Words.upTo(a.getAlphabet(), 6)) {
      Assertions.assertEquals(a.accept(word), back.accept(word), word.toString());
    }
    Assertions.assertTrue(back.isEqual(a));
  }

  @Test
  void testFromAutomatonNeedsSingleCharacterLabels() {
    Automaton a = new Automaton(List.of("q0"), List.of("a"), "q0", List.of("q0"));
    assertThrows(IllegalArgumentException.class, () -> Grammars.fromAutomaton(a));
    a.relabelAlphabetic();
    Assertions.assertEquals("S -> &\n", Grammars.fromAutomaton(a).toString());
    assertThrows(IllegalArgumentException.class, () -> Grammars.fromAutomaton(new Automaton()));
  }
}
