package proofSearch;

import java.util.Comparator;
import modal.formula.Formula;
import modal.formula.FormulaParser;

/**
 * Orders search spaces before they are handed to the worker pool.
 */
public class Heuristics {

    public interface Heuristic extends Comparator<SearchSpace> {
        String getName();
    }

    /**
     * First come, first served.
     */
    public static class SubmissionOrder implements Heuristic {
        @Override
        public int compare(SearchSpace space, SearchSpace other) {
            return Long.compare(space.id(), other.id());
        }

        @Override
        public String getName() {
            return "Submission order";
        }
    }

    /**
     * Smallest problems first: fewest literals, then shallowest modal nesting, then fewest
     * assumptions. Strings that do not parse are measured by their length and go last among
     * equals.
     */
    public static class SimplestFirst implements Heuristic {
        @Override
        public int compare(SearchSpace space, SearchSpace other) {
            int comp = Integer.compare(literals(space), literals(other));
            if (comp != 0)
                return comp;
            comp = Integer.compare(modalDepth(space), modalDepth(other));
            if (comp != 0)
                return comp;
            comp = Integer.compare(space.assumptions().size(), other.assumptions().size());
            if (comp != 0)
                return comp;
            return Long.compare(space.id(), other.id());
        }

        @Override
        public String getName() {
            return "Simplest first";
        }

        private static int literals(SearchSpace space) {
            int total = literals(space.goal());
            for (var assumption : space.assumptions()) {
                total += literals(assumption);
            }
            return total;
        }

        private static int literals(String formula) {
            return FormulaParser.parse(formula).map(Formula::countLiterals).orElse(formula.length());
        }

        private static int modalDepth(SearchSpace space) {
            int deepest = modalDepth(space.goal());
            for (var assumption : space.assumptions()) {
                deepest = Math.max(deepest, modalDepth(assumption));
            }
            return deepest;
        }

        private static int modalDepth(String formula) {
            return FormulaParser.parse(formula).map(Formula::modalDepth).orElse(formula.length());
        }
    }
}
