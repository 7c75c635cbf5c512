package RegAlgebra;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SubsetConstructionTest {
  @Test
  void testEndsWithAB() {
    Automaton nfa = AutomatonTest.endsWithAB();
    Automaton dfa = nfa.copy();
    dfa.determinize();

    Assertions.assertTrue(dfa.isDeterministic());
    // q0, {q0,q1}, {q0,q2}; the original q1 and q2 become unreachable
    Assertions.assertEquals(List.of("q0", "P0", "P1"), dfa.getStates());
    Assertions.assertEquals(Set.of("P1"), dfa.getFinalStates());
    Assertions.assertEquals(Set.of("P0"), dfa.getTransition("q0", "a"));
    Assertions.assertEquals(Set.of("P1"), dfa.getTransition("P0", "b"));
    Assertions.assertEquals(Set.of("q0"), dfa.getTransition("P1", "b"));

    for (List<String> word : Words.upTo(nfa.getAlphabet(), 7)) {
      Assertions.assertEquals(nfa.accept(word), dfa.accept(word), word.toString());
    }
  }

  @Test
  void testLabelsNeverCollide() {
    // label concatenation of {a, b} would clash with the existing state "ab"
    Automaton nfa = new Automaton(List.of("a", "b", "ab", "P0"), List.of("x"), "a", List.of("ab"));
    nfa.setTransition("a", "x", Set.of("a", "b"));
    nfa.setTransition("b", "x", Set.of("ab"));
    nfa.setTransition("P0", "x", Set.of("P0"));
    Automaton dfa = nfa.copy();
    dfa.determinize();

    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(Set.of("P1"), dfa.getTransition("a", "x"));
    Assertions.assertFalse(dfa.hasState("P0")); // pre-existing, unreachable, pruned
    for (List<String> word : Words.upTo(nfa.getAlphabet(), 5)) {
      Assertions.assertEquals(nfa.accept(word), dfa.accept(word), word.toString());
    }
  }

  @Test
  void testDeterministicInputOnlyPrunes() {
    Automaton dfa = new Automaton(List.of("q0", "q1", "q2"), List.of("a"), "q0", List.of("q1"));
    dfa.setTransition("q0", "a", Set.of("q1"));
    dfa.setTransition("q2", "a", Set.of("q1"));
    dfa.determinize();
    Assertions.assertEquals(List.of("q0", "q1"), dfa.getStates());
  }

  @Test
  void testRandomAutomataPreserveLanguage() {
    for (int seed = 0; seed < 50; seed++) {
      Automaton nfa = TabakovVardiRandomAutomaton.getRandomAutomaton(seed, 6);
      Automaton dfa = nfa.copy();
      dfa.determinize();
      Assertions.assertTrue(dfa.isDeterministic());
      for (List<String> word : Words.upTo(nfa.getAlphabet(), 6)) {
        Assertions.assertEquals(nfa.accept(word), dfa.accept(word), "seed " + seed + ": " + word);
      }
      Assertions.assertTrue(AutomataLibAdapter.referenceEquivalent(nfa, dfa), "seed " + seed);
    }
  }

  @Test
  void testSubsetCountMatchesAutomataLib() {
    for (int seed = 0; seed < 20; seed++) {
      Automaton nfa = TabakovVardiRandomAutomaton.getRandomAutomaton(seed, 8);
      // AutomataLib keeps a state for the empty subset; compare trimmed state counts
      CompactNFA<String> compact = AutomataLibAdapter.toCompactNFA(nfa);
      CompactDFA<String> reference = NFAs.determinize(compact, compact.getInputAlphabet(), true, false);
      Automaton dfa = nfa.copy();
      dfa.determinize();
      Assertions.assertEquals(trimmedSize(AutomataLibAdapter.fromDFA(reference, nfa.getAlphabet())),
          trimmedSize(dfa), "seed " + seed);
    }
  }

  private static int trimmedSize(Automaton automaton) {
    Set<String> useful = new HashSet<>(Reachability.reachableStates(automaton));
    useful.retainAll(Reachability.aliveStates(automaton));
    return useful.size();
  }
}
