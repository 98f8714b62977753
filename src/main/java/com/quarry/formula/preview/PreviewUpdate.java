package com.quarry.formula.preview;

import java.util.Set;

import com.quarry.formula.parser.EvaluationResult;

/** A finished preview evaluation, tagged with the generation that requested it. */
public final class PreviewUpdate {
    private final long generation;
    private final String formula;
    private final EvaluationResult result;
    private final Set<String> dependencies;
    private final PreviewState outcome;

    PreviewUpdate(long generation, String formula, EvaluationResult result, Set<String> dependencies, PreviewState outcome) {
        this.generation = generation;
        this.formula = formula;
        this.result = result;
        this.dependencies = dependencies;
        this.outcome = outcome;
    }

    public long generation() { return generation; }
    public String formula() { return formula; }
    public EvaluationResult result() { return result; }
    public Set<String> dependencies() { return dependencies; }

    /** SETTLED when published, SUPERSEDED when discarded as stale. */
    public PreviewState outcome() { return outcome; }

    @Override
    public String toString() {
        return "PreviewUpdate[gen=" + generation + " " + outcome + " \"" + formula + "\" -> " + result + "]";
    }
}
