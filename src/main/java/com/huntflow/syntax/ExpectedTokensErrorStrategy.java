package com.huntflow.syntax;

import com.huntflow.syntax.parser.HuntflowLexer;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.ATNState;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.Set;

/**
 * Bail-out strategy: the first error aborts the parse with a {@link HuntflowSyntaxException}
 * listing what would have been legal.
 *
 * <p>When an optional element or loop is skipped because the lookahead does not fit, the
 * parser may only notice the problem after returning from several rules. The earliest
 * such decision point at the current token is remembered so the expected set reflects
 * every alternative that was still open, not only the one where parsing stopped.
 */
public class ExpectedTokensErrorStrategy extends DefaultErrorStrategy {

    private int pendingState = ATNState.INVALID_STATE_NUMBER;
    private ParserRuleContext pendingContext;
    private int pendingTokenIndex = -1;

    @Override
    public void sync(Parser recognizer) {
        ATNState state = recognizer.getInterpreter().atn.states.get(recognizer.getState());
        int la = recognizer.getInputStream().LA(1);
        IntervalSet next = recognizer.getATN().nextTokens(state);
        if (next.contains(la)) {
            clearPending();
            return;
        }
        if (next.contains(Token.EPSILON)) {
            int index = recognizer.getInputStream().index();
            if (pendingContext == null || pendingTokenIndex != index) {
                pendingState = state.stateNumber;
                pendingContext = recognizer.getContext();
                pendingTokenIndex = index;
            }
            return;
        }
        throw failure(recognizer, recognizer.getState(), recognizer.getContext(), recognizer.getCurrentToken());
    }

    @Override
    public Token recoverInline(Parser recognizer) {
        throw failure(recognizer, recognizer.getState(), recognizer.getContext(), recognizer.getCurrentToken());
    }

    @Override
    public void recover(Parser recognizer, RecognitionException e) {
        Token offending = e.getOffendingToken() != null ? e.getOffendingToken() : recognizer.getCurrentToken();
        ParserRuleContext context = e.getCtx() instanceof ParserRuleContext
                ? (ParserRuleContext) e.getCtx()
                : recognizer.getContext();
        int state = e.getOffendingState() >= 0 ? e.getOffendingState() : recognizer.getState();
        throw failure(recognizer, state, context, offending);
    }

    @Override
    public void reportError(Parser recognizer, RecognitionException e) {
        // recover() raises the failure with full context
    }

    private HuntflowSyntaxException failure(Parser recognizer, int state, ParserRuleContext context, Token offending) {
        if (pendingContext != null && pendingTokenIndex == offending.getTokenIndex()) {
            state = pendingState;
            context = pendingContext;
        }
        Set<String> expected = new ExpectedSymbolCollector(recognizer).collect(state, context);
        clearPending();
        return new HuntflowSyntaxException(offending.getLine(), offending.getCharPositionInLine(),
                kindOf(offending), fragmentOf(offending), expected);
    }

    private static String kindOf(Token token) {
        if (token.getType() == Token.EOF) {
            return HuntflowSyntaxException.KIND_END;
        }
        if (token.getType() == HuntflowLexer.ERROR_CHAR) {
            return HuntflowSyntaxException.KIND_CHARACTER;
        }
        return HuntflowSyntaxException.KIND_TOKEN;
    }

    private static String fragmentOf(Token token) {
        return token.getType() == Token.EOF ? "" : token.getText();
    }

    private void clearPending() {
        pendingState = ATNState.INVALID_STATE_NUMBER;
        pendingContext = null;
        pendingTokenIndex = -1;
    }
}
