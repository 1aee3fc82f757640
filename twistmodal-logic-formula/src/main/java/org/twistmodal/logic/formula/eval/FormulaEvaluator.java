package org.twistmodal.logic.formula.eval;

import org.twistmodal.logic.algebra.TruthPair;
import org.twistmodal.logic.algebra.TwistStructure;
import org.twistmodal.logic.common.InvalidModelException;
import org.twistmodal.logic.common.UndefinedAtomException;
import org.twistmodal.logic.formula.ast.Formula;
import org.twistmodal.logic.formula.parser.FormulaParser;
import org.twistmodal.logic.formula.parser.Grammar;
import org.twistmodal.logic.model.Model;
import org.twistmodal.logic.model.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
entry point for the presentation layer: parse, check the assignments, evaluate in one world or in all of them
 */
public class FormulaEvaluator {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaEvaluator.class);

    public record Options(Grammar grammar, boolean checkAtomsFirst) {
        public static class Builder {
            private Grammar grammar = Grammar.RESIDUATED;
            private boolean checkAtomsFirst = true;

            public Builder setGrammar(Grammar grammar) {
                this.grammar = grammar;
                return this;
            }

            public Builder setCheckAtomsFirst(boolean checkAtomsFirst) {
                this.checkAtomsFirst = checkAtomsFirst;
                return this;
            }

            public Options build() {
                return new Options(grammar, checkAtomsFirst);
            }
        }
    }

    private final Options options;
    private final FormulaParser parser;

    public FormulaEvaluator() {
        this(new Options.Builder().build());
    }

    public FormulaEvaluator(Options options) {
        this.options = options;
        this.parser = new FormulaParser(new FormulaParser.Options.Builder().setGrammar(options.grammar()).build());
    }

    public Formula parse(String text) {
        return parser.parse(text);
    }

    /**
     * @throws InvalidModelException when the model has no world with that long name
     */
    public TruthPair evaluate(String text, Model model, String worldLongName) {
        World world = model.world(worldLongName).orElseThrow(() -> new InvalidModelException(model.name(),
                "no state with long name '" + worldLongName + "'"));
        return evaluate(parse(text), model, world);
    }

    public TruthPair evaluate(Formula formula, Model model, World world) {
        if (options.checkAtomsFirst()) checkAssignments(formula, world);
        return formula.evaluate(model, world, model.twistStructure());
    }

    /*
    only the world of evaluation is checked; a modality can still reach a world without the assignment,
    in which case the atom fails during evaluation
     */
    private static void checkAssignments(Formula formula, World world) {
        List<String> missing = world.missingAssignments(formula.atoms());
        if (!missing.isEmpty()) {
            throw new UndefinedAtomException(world.shortName(), missing);
        }
    }

    public ValidityResult checkValidity(String text, Model model) {
        return checkValidity(parse(text), model);
    }

    /**
     * Evaluates the formula in every world of the model, in the order of the worlds' long names.
     * A model without worlds is valid, with aggregate {@code (top, bottom)}.
     */
    public ValidityResult checkValidity(Formula formula, Model model) {
        TwistStructure twist = model.twistStructure();
        TruthPair truthTop = twist.truthTop();
        List<World> sorted = model.worlds().stream().sorted(Comparator.comparing(World::longName)).toList();

        Map<String, TruthPair> results = new LinkedHashMap<>();
        List<String> failedWorlds = new ArrayList<>();
        for (World world : sorted) {
            TruthPair value = evaluate(formula, model, world);
            LOGGER.debug("{} in {}: {}", formula.print(), world.longName(), value);
            results.put(world.longName(), value);
            if (!truthTop.equals(value)) failedWorlds.add(world.longName());
        }
        TruthPair aggregate = twist.weakMeetSet(new ArrayList<>(results.values()));
        boolean valid = truthTop.equals(aggregate) && failedWorlds.isEmpty();
        LOGGER.info("{} is {} in {}, aggregate {}, failing in {} of {} states", formula.print(),
                valid ? "valid" : "not valid", model.name(), aggregate, failedWorlds.size(), sorted.size());
        return new ValidityResult(aggregate, valid, results, failedWorlds);
    }
}
