package RegAlgebra.Format;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import RegAlgebra.Automaton;
import RegAlgebra.Model.Transition;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * JSON record of an automaton:
 * <pre>
 * { "states": [...], "alphabet": [...], "transitions": [[state, symbol, [targets...]], ...],
 *   "initial_state": state, "final_states": [...] }
 * </pre>
 * Lists are written in sorted order. Loading validates that every referenced state and symbol is declared.
 */
public class JsonFormat {
    public static final String STATES = "states";
    public static final String ALPHABET = "alphabet";
    public static final String TRANSITIONS = "transitions";
    public static final String INITIAL_STATE = "initial_state";
    public static final String FINAL_STATES = "final_states";

    private static final int INDENT = 4;

    private JsonFormat() {
    }

    public static JSONObject toJson(Automaton automaton) {
        JSONObject data = new JSONObject();
        data.put(STATES, new JSONArray(new TreeSet<>(automaton.getStates())));
        data.put(ALPHABET, new JSONArray(automaton.getAlphabet()));
        JSONArray transitions = new JSONArray();
        for (Transition t : automaton.getTransitions()) {
            transitions.put(new JSONArray().put(t.state()).put(t.symbol()).put(new JSONArray(t.targets())));
        }
        data.put(TRANSITIONS, transitions);
        data.put(INITIAL_STATE, automaton.getInitialState() == null ? JSONObject.NULL : automaton.getInitialState());
        data.put(FINAL_STATES, new JSONArray(automaton.getFinalStates()));
        return data;
    }

    public static String toJsonString(Automaton automaton) {
        return toJson(automaton).toString(INDENT);
    }

    public static void write(Automaton automaton, OutputStream os) throws IOException {
        Writer writer = new OutputStreamWriter(os, StandardCharsets.UTF_8);
        writer.write(toJsonString(automaton));
        writer.write('\n');
        writer.flush();
    }

    public static void save(Automaton automaton, Path path) throws IOException {
        try (OutputStream os = Files.newOutputStream(path)) {
            write(automaton, os);
        }
    }

    /**
     * @param data - JSON record
     * @return automaton described by the record
     * @throws AutomatonFormatException if a key is missing or has the wrong shape, or a reference is dangling
     */
    public static Automaton fromJson(JSONObject data) throws AutomatonFormatException {
        try {
            Set<String> states = stringSet(data.getJSONArray(STATES));
            Set<String> alphabet = stringSet(data.getJSONArray(ALPHABET));
            Set<String> finals = stringSet(data.getJSONArray(FINAL_STATES));
            String initial = data.isNull(INITIAL_STATE) ? null : data.getString(INITIAL_STATE);

            if (initial == null) {
                if (!states.isEmpty()) {
                    throw new AutomatonFormatException("Missing initial state");
                }
                return new Automaton();
            }
            requireDeclared(STATES, states, Set.of(initial), INITIAL_STATE);
            requireDeclared(STATES, states, finals, FINAL_STATES);

            List<Transition> transitions = new ArrayList<>();
            JSONArray rows = data.getJSONArray(TRANSITIONS);
            for (int i = 0; i < rows.length(); i++) {
                JSONArray row = rows.getJSONArray(i);
                if (row.length() != 3) {
                    throw new AutomatonFormatException("Transition " + i + " must be [state, symbol, [targets]]");
                }
                Transition t = new Transition(row.getString(0), row.getString(1), stringSet(row.getJSONArray(2)));
                String where = TRANSITIONS + "[" + i + "]";
                requireDeclared(STATES, states, Set.of(t.state()), where);
                requireDeclared(ALPHABET, alphabet, Set.of(t.symbol()), where);
                requireDeclared(STATES, states, t.targets(), where);
                transitions.add(t);
            }

            Automaton automaton = new Automaton(states, alphabet, initial, finals);
            for (Transition t : transitions) {
                for (String target : t.targets()) {
                    automaton.addTransition(t.state(), t.symbol(), target);
                }
            }
            return automaton;
        } catch (JSONException e) {
            throw new AutomatonFormatException("Malformed automaton record: " + e.getMessage(), e);
        }
    }

    public static Automaton parse(String json) throws AutomatonFormatException {
        try {
            return fromJson(new JSONObject(json));
        } catch (JSONException e) {
            throw new AutomatonFormatException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    public static Automaton read(InputStream is) throws AutomatonFormatException {
        try {
            return fromJson(new JSONObject(new JSONTokener(is)));
        } catch (JSONException e) {
            throw new AutomatonFormatException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    public static Automaton load(Path path) throws IOException, AutomatonFormatException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    public static Automaton getJsonFile(String filePath) {
        try {
            return load(Paths.get(filePath));
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    private static Set<String> stringSet(JSONArray array) {
        Set<String> result = new LinkedHashSet<>();
        for (int i = 0; i < array.length(); i++) {
            result.add(array.getString(i));
        }
        return result;
    }

    private static void requireDeclared(String kind, Set<String> declared, Set<String> used, String where)
            throws AutomatonFormatException {
        Set<String> missing = new TreeSet<>(used);
        missing.removeAll(declared);
        if (!missing.isEmpty()) {
            throw new AutomatonFormatException(
                where + " references " + String.join(", ", missing) + " not declared in " + kind);
        }
    }
}
