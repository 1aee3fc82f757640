package org.twistmodal.logic.formula.parser;

import org.twistmodal.logic.common.FormulaSyntaxException;
import org.twistmodal.logic.formula.ast.*;
import org.twistmodal.logic.formula.lexer.Lexer;
import org.twistmodal.logic.formula.lexer.Token;
import org.twistmodal.logic.formula.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
Recursive descent, lowest precedence first:

formula   := iff
iff       := implies ( ('<->' | '<=>') implies )*
implies   := or_expr ( ('->' | '=>') or_expr )*
or_expr   := and_expr ( '|' and_expr )*
and_expr  := unary ( '&' unary )*
unary     := '~' unary | '[' IDENT ']' unary | '<' IDENT '>' unary | '(' formula ')' | ATOM

All binary operators associate to the left. Prefixes bind tighter than any binary operator,
so [a]~p & q is ([a]~p) & q.

Prefixes and parentheses may be nested at most MAX_NESTING deep.
 */
public class FormulaParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaParser.class);
    public static final int MAX_NESTING = 1000;

    public record Options(Grammar grammar) {
        public static class Builder {
            private Grammar grammar = Grammar.RESIDUATED;

            public Builder setGrammar(Grammar grammar) {
                this.grammar = grammar;
                return this;
            }

            public Options build() {
                return new Options(grammar);
            }
        }
    }

    private final Options options;

    public FormulaParser() {
        this(new Options.Builder().build());
    }

    public FormulaParser(Options options) {
        this.options = options;
    }

    public Options options() {
        return options;
    }

    /**
     * @throws FormulaSyntaxException on the first lexical or grammatical error; no partial tree is returned
     */
    public Formula parse(String text) {
        Formula formula = new Run(text).parse();
        LOGGER.debug("Parsed '{}' as {}", text, formula.print());
        return formula;
    }

    // one per call of parse(), so that the parser itself holds no state
    private class Run {
        private final Lexer lexer;
        private Token current;
        private int nesting;

        Run(String text) {
            lexer = new Lexer(text);
            current = lexer.next();
        }

        Formula parse() {
            Formula formula = iff();
            if (!current.is(TokenKind.EOF)) {
                throw new FormulaSyntaxException(current.position(), "Unexpected characters at end of formula");
            }
            return formula;
        }

        private void eat(TokenKind kind) {
            if (current.kind() != kind) {
                throw new FormulaSyntaxException(current.position(), "Expected " + kind + ", got " + current.kind());
            }
            current = lexer.next();
        }

        private void checkAllowed(Token token) {
            if (options.grammar() == Grammar.MATERIAL) {
                throw new FormulaSyntaxException(token.position(), "Residuated connective '" + token.value()
                                                                   + "' is not part of the material grammar");
            }
        }

        private Formula iff() {
            Formula node = implies();
            while (current.is(TokenKind.MAT_IFF) || current.is(TokenKind.IFF)) {
                Token operator = current;
                if (operator.is(TokenKind.IFF)) checkAllowed(operator);
                eat(operator.kind());
                Formula right = implies();
                node = operator.is(TokenKind.MAT_IFF) ? new MaterialIff(node, right) : new Iff(node, right);
            }
            return node;
        }

        private Formula implies() {
            Formula node = or();
            while (current.is(TokenKind.MAT_IMPLIES) || current.is(TokenKind.IMPLIES)) {
                Token operator = current;
                if (operator.is(TokenKind.IMPLIES)) checkAllowed(operator);
                eat(operator.kind());
                Formula right = or();
                node = operator.is(TokenKind.MAT_IMPLIES) ? new MaterialImplies(node, right)
                        : new Implies(node, right);
            }
            return node;
        }

        private Formula or() {
            Formula node = and();
            while (current.is(TokenKind.OR)) {
                eat(TokenKind.OR);
                node = new Or(node, and());
            }
            return node;
        }

        private Formula and() {
            Formula node = unary();
            while (current.is(TokenKind.AND)) {
                eat(TokenKind.AND);
                node = new And(node, unary());
            }
            return node;
        }

        private Formula unary() {
            Token token = current;
            return switch (token.kind()) {
                case NOT -> new Not(nested(token));
                case BOX -> new Box(nested(token), token.value());
                case DIAMOND -> new Diamond(nested(token), token.value());
                case LPAREN -> nested(token);
                case ATOM -> {
                    eat(TokenKind.ATOM);
                    yield atom(token.value());
                }
                case EOF -> throw new FormulaSyntaxException(token.position(),
                        "Unexpected end of formula; is a closing parenthesis or an atom missing?");
                default -> throw new FormulaSyntaxException(token.position(), "Unexpected token: " + token.kind());
            };
        }

        /*
        the operand of a prefix operator, or the formula between parentheses
         */
        private Formula nested(Token token) {
            if (++nesting > MAX_NESTING) {
                throw new FormulaSyntaxException(token.position(), "Formula nested more than " + MAX_NESTING
                                                                   + " levels deep");
            }
            eat(token.kind());
            Formula node;
            if (token.is(TokenKind.LPAREN)) {
                node = iff();
                eat(TokenKind.RPAREN);
            } else {
                node = unary();
            }
            nesting--;
            return node;
        }

        private Formula atom(String name) {
            if (Lexer.TOP.equals(name)) return Atom.TOP;
            if (Lexer.BOT.equals(name)) return Atom.BOT;
            return new Atom(name);
        }
    }
}
