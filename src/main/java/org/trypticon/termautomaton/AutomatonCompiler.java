package org.trypticon.termautomaton;

import org.trypticon.termautomaton.automaton.Automata;
import org.trypticon.termautomaton.automaton.Automaton;
import org.trypticon.termautomaton.automaton.CompiledAutomaton;
import org.trypticon.termautomaton.automaton.LevenshteinAutomata;
import org.trypticon.termautomaton.automaton.MinimizationOperations;
import org.trypticon.termautomaton.automaton.Operations;
import org.trypticon.termautomaton.util.BytesRef;
import org.trypticon.termautomaton.util.UnicodeUtil;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Collection;

/**
 * Turns query-level descriptions of term sets (automata, fuzzy terms, term lists)
 * into {@link CompiledAutomaton}s ready to be matched against UTF-8 terms.
 */
public class AutomatonCompiler {

    private static final String COMPONENT = "AC";

    private final int maxDeterminizedStates;

    @Nonnull
    private final InfoStream infoStream;

    /**
     * Constructs a compiler with the default determinization limit and no logging.
     */
    public AutomatonCompiler() {
        this(Operations.DEFAULT_MAX_DETERMINIZED_STATES, InfoStream.NO_OUTPUT);
    }

    /**
     * Constructs a compiler.
     *
     * @param maxDeterminizedStates the maximum number of states any determinization may create.
     * @param infoStream the stream to log diagnostics to.
     */
    public AutomatonCompiler(int maxDeterminizedStates, @Nonnull InfoStream infoStream) {
        if (maxDeterminizedStates <= 0) {
            throw new IllegalArgumentException("maxDeterminizedStates must be positive, got " + maxDeterminizedStates);
        }
        this.maxDeterminizedStates = maxDeterminizedStates;
        this.infoStream = infoStream;
    }

    /**
     * Compiles an automaton over code points.
     *
     * @param automaton the automaton.
     * @return the compiled automaton.
     * @throws org.trypticon.termautomaton.automaton.TooComplexToDeterminizeException
     *         if determinization exceeds the limit.
     */
    @Nonnull
    public CompiledAutomaton compile(@Nonnull Automaton automaton) {
        return compile(automaton, false);
    }

    /**
     * Compiles an automaton whose labels are already bytes.
     *
     * @param automaton the automaton.
     * @return the compiled automaton.
     */
    @Nonnull
    public CompiledAutomaton compileBinary(@Nonnull Automaton automaton) {
        return compile(automaton, true);
    }

    /**
     * Compiles the automaton of all terms within {@code maxEdits} edits of {@code term}.
     * The first {@code prefixLength} code points must match exactly.
     *
     * @param term the term.
     * @param maxEdits the maximum edit distance, between 0 and
     *                 {@link LevenshteinAutomata#MAXIMUM_SUPPORTED_DISTANCE}.
     * @param transpositions whether swapping two adjacent characters counts as one edit.
     * @param prefixLength the number of leading code points which must match exactly.
     * @return the compiled automaton.
     */
    @Nonnull
    public CompiledAutomaton compileFuzzy(@Nonnull String term, int maxEdits, boolean transpositions,
                                          int prefixLength) {
        if (prefixLength < 0) {
            throw new IllegalArgumentException("prefixLength cannot be negative, got " + prefixLength);
        }
        int[] codePoints = term.codePoints().toArray();
        int split = Math.min(prefixLength, codePoints.length);
        String prefix = UnicodeUtil.newString(codePoints, 0, split);
        int[] suffix = Arrays.copyOfRange(codePoints, split, codePoints.length);

        LevenshteinAutomata builder = new LevenshteinAutomata(suffix, Character.MAX_CODE_POINT, transpositions);
        Automaton automaton = builder.toAutomaton(maxEdits, prefix);
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "fuzzy term=" + term + " maxEdits=" + maxEdits +
                                          " transpositions=" + transpositions + " prefix=" + prefix);
        }
        return compile(automaton, false);
    }

    /**
     * Compiles the automaton accepting exactly the given terms.
     *
     * @param sortedTerms UTF-8 terms in ascending byte order.
     * @return the compiled automaton.
     * @throws IllegalArgumentException if the terms are not sorted.
     */
    @Nonnull
    public CompiledAutomaton compileTerms(@Nonnull Collection<BytesRef> sortedTerms) {
        Automaton automaton = Automata.makeStringUnion(sortedTerms);
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "term union of " + sortedTerms.size() + " terms: " + describe(automaton));
        }
        CompiledAutomaton compiled = new CompiledAutomaton(automaton, true, true, maxDeterminizedStates, false);
        logResult(compiled);
        return compiled;
    }

    private CompiledAutomaton compile(Automaton automaton, boolean isBinary) {
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "input: " + describe(automaton));
        }

        Automaton determinized = Operations.determinize(automaton, maxDeterminizedStates);
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "determinized: " + describe(determinized));
        }

        Automaton minimized = MinimizationOperations.minimize(determinized, maxDeterminizedStates);
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "minimized: " + describe(minimized));
        }

        // already minimal, so the compiled automaton skips its own minimization
        CompiledAutomaton compiled = new CompiledAutomaton(minimized, null, true, maxDeterminizedStates, isBinary, true);
        logResult(compiled);
        return compiled;
    }

    private void logResult(CompiledAutomaton compiled) {
        if (infoStream.isEnabled(COMPONENT)) {
            infoStream.message(COMPONENT, "compiled: " + compiled);
        }
    }

    private static String describe(Automaton automaton) {
        if (automaton.isSingleton()) {
            return "literal of length " + automaton.getSingleton().length();
        }
        return automaton.getNumStates() + " states, " + automaton.getNumTransitions() + " transitions";
    }
}
