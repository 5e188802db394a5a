package com.huntflow.syntax;

import com.huntflow.syntax.parser.HuntflowParser;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.atn.ATN;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.atn.NotSetTransition;
import org.antlr.v4.runtime.atn.RuleStopState;
import org.antlr.v4.runtime.atn.RuleTransition;
import org.antlr.v4.runtime.atn.Transition;
import org.antlr.v4.runtime.atn.WildcardTransition;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the symbols the parser would accept at a given ATN state and rule stack.
 *
 * <p>Walks epsilon transitions from the failure state, descending into invoked rules and
 * returning through the invocation stack when a rule may end. Single-token rules that
 * stand for a user-defined name (variables, entity types, attributes..) are reported by
 * slot name instead of by token.
 */
public class ExpectedSymbolCollector {

    public static final String VARIABLE = "VARIABLE";
    public static final String ENTITY_TYPE = "ENTITY_TYPE";
    public static final String RELATION = "RELATION";
    public static final String ATTRIBUTE = "ATTRIBUTE";
    public static final String FUNCNAME = "FUNCNAME";
    public static final String TRANSFORM = "TRANSFORM";
    public static final String DATASRC = "DATASRC";
    public static final String ANALYTICS = "ANALYTICS";

    private static final Map<Integer, String> SLOTS = Map.of(
            HuntflowParser.RULE_variable, VARIABLE,
            HuntflowParser.RULE_entityType, ENTITY_TYPE,
            HuntflowParser.RULE_relation, RELATION,
            HuntflowParser.RULE_attribute, ATTRIBUTE,
            HuntflowParser.RULE_funcName, FUNCNAME,
            HuntflowParser.RULE_transformName, TRANSFORM,
            HuntflowParser.RULE_datasource, DATASRC,
            HuntflowParser.RULE_analyticsUri, ANALYTICS);

    private static final int MAX_DEPTH = 64;

    private final ATN atn;
    private final Vocabulary vocabulary;

    public ExpectedSymbolCollector(Parser parser) {
        this.atn = parser.getATN();
        this.vocabulary = parser.getVocabulary();
    }

    /**
     * Slot name of a rule, or null for ordinary rules
     */
    public static String slotOf(int ruleIndex) {
        return SLOTS.get(ruleIndex);
    }

    public Set<String> collect(int stateNumber, RuleContext context) {
        Set<String> expected = new TreeSet<>();
        RuleContext slotContext = context;
        if (slotContext != null && slotContext.getRuleIndex() == HuntflowParser.RULE_name) {
            // names only occur inside a slot
            slotContext = slotContext.parent;
        }
        if (slotContext != null && SLOTS.containsKey(slotContext.getRuleIndex())) {
            expected.add(SLOTS.get(slotContext.getRuleIndex()));
            return expected;
        }
        if (stateNumber < 0 || stateNumber >= atn.states.size()) {
            return expected;
        }
        walk(atn.states.get(stateNumber), context, new IdentityHashMap<>(), expected, 0);
        return expected;
    }

    private void walk(ATNState state, RuleContext context, Map<RuleContext, Set<Integer>> visited,
                      Set<String> expected, int depth) {
        if (!visited.computeIfAbsent(context, c -> new HashSet<>()).add(state.stateNumber)) {
            return;
        }
        if (state instanceof RuleStopState) {
            if (context == null || context.invokingState < 0) {
                return;
            }
            RuleTransition call = (RuleTransition) atn.states.get(context.invokingState).transition(0);
            walk(call.followState, context.parent, visited, expected, depth);
            return;
        }
        for (int i = 0; i < state.getNumberOfTransitions(); i++) {
            Transition transition = state.transition(i);
            if (transition instanceof RuleTransition) {
                RuleTransition call = (RuleTransition) transition;
                String slot = SLOTS.get(call.ruleIndex);
                if (slot != null) {
                    expected.add(slot);
                } else if (depth < MAX_DEPTH) {
                    walk(call.target, new RuleContext(context, state.stateNumber), visited, expected, depth + 1);
                }
            } else if (transition.isEpsilon()) {
                walk(transition.target, context, visited, expected, depth);
            } else if (!(transition instanceof NotSetTransition) && !(transition instanceof WildcardTransition)) {
                IntervalSet label = transition.label();
                if (label != null) {
                    for (int type : label.toList()) {
                        expected.add(tokenName(type));
                    }
                }
            }
        }
    }

    private String tokenName(int type) {
        if (type == Token.EOF) {
            return "EOF";
        }
        return vocabulary.getSymbolicName(type);
    }
}
