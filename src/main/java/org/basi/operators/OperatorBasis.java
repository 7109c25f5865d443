package org.basi.operators;

import org.basi.syntax.Formula;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Basi di operatori verso cui una formula può essere convertita.
 *
 * Ogni base conosce gli operatori (e le costanti) ammessi nel risultato e il
 * metodo di {@link BasisConverter} che la produce. Le variabili sono sempre
 * ammesse.
 */
public enum OperatorBasis {

    NOT_AND_OR("not-and-or", BasisConverter::toNotAndOr,
            EnumSet.of(Formula.Type.NOT, Formula.Type.AND, Formula.Type.OR)),

    NOT_AND("not-and", BasisConverter::toNotAnd,
            EnumSet.of(Formula.Type.NOT, Formula.Type.AND)),

    NAND("nand", BasisConverter::toNand,
            EnumSet.of(Formula.Type.NAND)),

    IMPLIES_NOT("implies-not", BasisConverter::toImpliesNot,
            EnumSet.of(Formula.Type.IMPLIES, Formula.Type.NOT)),

    IMPLIES_FALSE("implies-false", BasisConverter::toImpliesFalse,
            EnumSet.of(Formula.Type.IMPLIES, Formula.Type.FALSE));

    private final String symbol;
    private final UnaryOperator<Formula> converter;
    private final Set<Formula.Type> allowedTypes;

    OperatorBasis(String symbol, UnaryOperator<Formula> converter, Set<Formula.Type> allowedTypes) {
        this.symbol = symbol;
        this.converter = converter;
        this.allowedTypes = Collections.unmodifiableSet(allowedTypes);
    }

    /** Identificativo usato da linea di comando e nei nomi dei file di output */
    public String getSymbol() {
        return symbol;
    }

    public Set<Formula.Type> getAllowedTypes() {
        return allowedTypes;
    }

    /**
     * Converte la formula in questa base.
     */
    public Formula convert(Formula formula) {
        return converter.apply(formula);
    }

    /**
     * Verifica che ogni operatore e costante della formula appartenga alla base.
     */
    public boolean accepts(Formula formula) {
        return allowedTypes.containsAll(formula.operators());
    }

    /**
     * Cerca la base con l'identificativo dato (senza distinzione maiuscole/minuscole).
     *
     * @throws IllegalArgumentException se nessuna base corrisponde
     */
    public static OperatorBasis fromSymbol(String symbol) {
        if (symbol != null) {
            for (OperatorBasis basis : values()) {
                if (basis.symbol.equalsIgnoreCase(symbol.trim())) {
                    return basis;
                }
            }
        }
        throw new IllegalArgumentException("Base di operatori sconosciuta: " + symbol);
    }
}
