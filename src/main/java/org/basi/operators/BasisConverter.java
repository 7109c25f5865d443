package org.basi.operators;

import org.basi.syntax.Formula;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.basi.syntax.Formula.and;
import static org.basi.syntax.Formula.implies;
import static org.basi.syntax.Formula.nand;
import static org.basi.syntax.Formula.not;
import static org.basi.syntax.Formula.or;

/**
 * CONVERTITORE DI BASI - Riscrittura sintattica verso insiemi ridotti di operatori
 *
 * Ogni metodo pubblico restituisce una formula nuova con la stessa tabella di
 * verità dell'input, che usa solo gli operatori della base di destinazione.
 * La formula di input non viene mai modificata.
 *
 * BASI SUPPORTATE:
 * - {~, &, |}: toNotAndOr
 * - {~, &}: toNotAnd
 * - {-&}: toNand, costruito su toNotAnd
 * - {->, ~}: toImpliesNot
 * - {->, F}: toImpliesFalse, costruito su toImpliesNot
 *
 * Le costanti T e F sono codificate con la variabile ausiliaria
 * {@value #HELPER_VARIABLE}, scelta per convenzione e non garantita nuova
 * rispetto alle variabili della formula: le codifiche sono tautologie o
 * contraddizioni, quindi il loro valore non dipende da essa.
 */
public final class BasisConverter {

    private static final Logger LOGGER = Logger.getLogger(BasisConverter.class.getName());

    /** Nome della variabile usata per codificare le costanti */
    public static final String HELPER_VARIABLE = "p";

    /**
     * Previene istanziazione - classe utility
     */
    private BasisConverter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region BASE {~, &, |}

    /**
     * Converte la formula in una equivalente senza costanti né operatori
     * diversi da ~, & e |.
     *
     * TRASFORMAZIONI (a', b' operandi già convertiti):
     * - T -> (p|~p), F -> (p&~p)
     * - a->b -> ~a'|b'
     * - a+b -> (a'&~b')|(~a'&b')
     * - a<->b -> (a'&b')|(~a'&~b')
     * - a-&b -> ~(a'&b'), a-|b -> ~(a'|b')
     *
     * @param formula formula da convertire
     * @return formula equivalente nella base {~, &, |}
     */
    public static Formula toNotAndOr(Formula formula) {
        trace("toNotAndOr", formula);
        return notAndOr(formula);
    }

    private static Formula notAndOr(Formula formula) {
        return switch (formula.getType()) {
            case VARIABLE -> formula;
            case TRUE -> or(helper(), not(helper()));
            case FALSE -> and(helper(), not(helper()));
            case NOT -> not(notAndOr(formula.getFirst()));
            case AND, OR, IMPLIES, XOR, IFF, NAND, NOR -> {
                Formula first = notAndOr(formula.getFirst());
                Formula second = notAndOr(formula.getSecond());
                yield switch (formula.getType()) {
                    case AND -> and(first, second);
                    case OR -> or(first, second);
                    case IMPLIES -> or(not(first), second);
                    case XOR -> or(and(first, not(second)), and(not(first), second));
                    case IFF -> or(and(first, second), and(not(first), not(second)));
                    case NAND -> not(and(first, second));
                    case NOR -> not(or(first, second));
                    default -> throw unknownOperator(formula);
                };
            }
        };
    }

    //endregion

    //region BASE {~, &}

    /**
     * Converte la formula in una equivalente senza costanti né operatori
     * diversi da ~ e &.
     *
     * Ricalca toNotAndOr applicando De Morgan (a|b ~ ~(~a&~b)) in ogni punto
     * in cui comparirebbe una disgiunzione, senza mai costruire nodi |.
     * La biimplicazione è la negazione della disgiunzione esclusiva.
     *
     * @param formula formula da convertire
     * @return formula equivalente nella base {~, &}
     */
    public static Formula toNotAnd(Formula formula) {
        trace("toNotAnd", formula);
        return notAnd(formula);
    }

    private static Formula notAnd(Formula formula) {
        return switch (formula.getType()) {
            case VARIABLE -> formula;
            case TRUE -> not(contradiction());
            case FALSE -> contradiction();
            case NOT -> not(notAnd(formula.getFirst()));
            case IFF -> not(notAnd(Formula.binary(
                    Formula.Type.XOR, formula.getFirst(), formula.getSecond())));
            case AND, OR, IMPLIES, XOR, NAND, NOR -> {
                Formula first = notAnd(formula.getFirst());
                Formula second = notAnd(formula.getSecond());
                yield switch (formula.getType()) {
                    case AND -> and(first, second);
                    case OR -> not(and(not(first), not(second)));
                    case IMPLIES -> not(and(first, not(second)));
                    case XOR -> {
                        Formula left = and(first, not(second));
                        Formula right = and(not(first), second);
                        yield not(and(not(left), not(right)));
                    }
                    case NAND -> not(and(first, second));
                    case NOR -> and(not(first), not(second));
                    default -> throw unknownOperator(formula);
                };
            }
        };
    }

    //endregion

    //region BASE {-&}

    /**
     * Converte la formula in una equivalente che usa solo l'operatore -&.
     *
     * PIPELINE:
     * 1. toNotAnd: riduzione a ~ e &
     * 2. ~a -> a'-&a', a&b -> (a'-&b')-&(a'-&b')
     *
     * @param formula formula da convertire
     * @return formula equivalente nella base {-&}
     */
    public static Formula toNand(Formula formula) {
        Formula notAnd = toNotAnd(formula);
        trace("toNand, forma {~, &}", notAnd);
        return eliminateNotAnd(notAnd);
    }

    private static Formula eliminateNotAnd(Formula formula) {
        return switch (formula.getType()) {
            case VARIABLE -> formula;
            case NOT -> {
                Formula inner = eliminateNotAnd(formula.getFirst());
                yield nand(inner, inner);
            }
            case AND -> {
                Formula inner = nand(eliminateNotAnd(formula.getFirst()), eliminateNotAnd(formula.getSecond()));
                yield nand(inner, inner);
            }
            default -> throw unknownOperator(formula);
        };
    }

    //endregion

    //region BASE {->, ~}

    /**
     * Converte la formula in una equivalente senza costanti né operatori
     * diversi da -> e ~.
     *
     * TRASFORMAZIONI (a', b' operandi già convertiti):
     * - T -> (p->p), F -> ~(p->p)
     * - a|b -> ~a'->b'
     * - a&b -> ~(a'->~b')
     * - a+b -> (a'->b')->~(b'->a')
     * - a<->b -> ~((a'->b')->~(b'->a'))
     * - a-&b -> a'->~b', a-|b -> ~(~a'->b')
     *
     * @param formula formula da convertire
     * @return formula equivalente nella base {->, ~}
     */
    public static Formula toImpliesNot(Formula formula) {
        trace("toImpliesNot", formula);
        return impliesNot(formula);
    }

    private static Formula impliesNot(Formula formula) {
        return switch (formula.getType()) {
            case VARIABLE -> formula;
            case TRUE -> implies(helper(), helper());
            case FALSE -> not(implies(helper(), helper()));
            case NOT -> not(impliesNot(formula.getFirst()));
            case AND, OR, IMPLIES, XOR, IFF, NAND, NOR -> {
                Formula first = impliesNot(formula.getFirst());
                Formula second = impliesNot(formula.getSecond());
                yield switch (formula.getType()) {
                    case IMPLIES -> implies(first, second);
                    case OR -> implies(not(first), second);
                    case AND -> not(implies(first, not(second)));
                    case XOR -> implies(implies(first, second), not(implies(second, first)));
                    case IFF -> not(implies(implies(first, second), not(implies(second, first))));
                    case NAND -> implies(first, not(second));
                    case NOR -> not(implies(not(first), second));
                    default -> throw unknownOperator(formula);
                };
            }
        };
    }

    //endregion

    //region BASE {->, F}

    /**
     * Converte la formula in una equivalente che usa solo -> e la costante F.
     *
     * PIPELINE:
     * 1. toImpliesNot: riduzione a -> e ~
     * 2. ~a -> (a'->F), a->b -> a'->b'
     *
     * @param formula formula da convertire
     * @return formula equivalente nella base {->, F}
     */
    public static Formula toImpliesFalse(Formula formula) {
        Formula impliesNot = toImpliesNot(formula);
        trace("toImpliesFalse, forma {->, ~}", impliesNot);
        return eliminateNot(impliesNot);
    }

    private static Formula eliminateNot(Formula formula) {
        return switch (formula.getType()) {
            case VARIABLE -> formula;
            case NOT -> implies(eliminateNot(formula.getFirst()), Formula.constant(false));
            case IMPLIES -> implies(eliminateNot(formula.getFirst()), eliminateNot(formula.getSecond()));
            default -> throw unknownOperator(formula);
        };
    }

    //endregion

    //region SUPPORTO

    private static void trace(String step, Formula formula) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(step + ": " + formula);
        }
    }

    private static Formula helper() {
        return Formula.variable(HELPER_VARIABLE);
    }

    /** p&~p */
    private static Formula contradiction() {
        return and(helper(), not(helper()));
    }

    private static IllegalStateException unknownOperator(Formula formula) {
        return new IllegalStateException("Operatore non riconosciuto: " + formula.getType()
                + " in " + formula);
    }

    //endregion
}
