package org.basi.operators;

import org.basi.syntax.Formula;
import org.basi.syntax.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OperatorBasis")
class OperatorBasisTest {

    @ParameterizedTest
    @EnumSource(OperatorBasis.class)
    @DisplayName("fromSymbol ritrova ogni base dal suo identificativo")
    void symbolLookup(OperatorBasis basis) {
        assertSame(basis, OperatorBasis.fromSymbol(basis.getSymbol()));
        assertSame(basis, OperatorBasis.fromSymbol(" " + basis.getSymbol().toUpperCase() + " "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "all", "nor", "not-or"})
    @DisplayName("Identificativi sconosciuti sono rifiutati")
    void unknownSymbol(String symbol) {
        assertThrows(IllegalArgumentException.class, () -> OperatorBasis.fromSymbol(symbol));
        assertThrows(IllegalArgumentException.class, () -> OperatorBasis.fromSymbol(null));
    }

    @Test
    @DisplayName("Operatori ammessi da ciascuna base")
    void allowedTypes() {
        assertEquals(EnumSet.of(Formula.Type.NOT, Formula.Type.AND, Formula.Type.OR),
                OperatorBasis.NOT_AND_OR.getAllowedTypes());
        assertEquals(EnumSet.of(Formula.Type.NOT, Formula.Type.AND), OperatorBasis.NOT_AND.getAllowedTypes());
        assertEquals(EnumSet.of(Formula.Type.NAND), OperatorBasis.NAND.getAllowedTypes());
        assertEquals(EnumSet.of(Formula.Type.IMPLIES, Formula.Type.NOT), OperatorBasis.IMPLIES_NOT.getAllowedTypes());
        assertEquals(EnumSet.of(Formula.Type.IMPLIES, Formula.Type.FALSE),
                OperatorBasis.IMPLIES_FALSE.getAllowedTypes());
        assertThrows(UnsupportedOperationException.class,
                () -> OperatorBasis.NAND.getAllowedTypes().add(Formula.Type.AND));
    }

    @Test
    @DisplayName("accepts verifica la chiusura rispetto alla base")
    void accepts() {
        assertTrue(OperatorBasis.NOT_AND.accepts(FormulaParser.parse("~(x&~y)")));
        assertFalse(OperatorBasis.NOT_AND.accepts(FormulaParser.parse("x|y")));
        assertFalse(OperatorBasis.NOT_AND_OR.accepts(FormulaParser.parse("x|T")));
        assertTrue(OperatorBasis.IMPLIES_FALSE.accepts(FormulaParser.parse("(x->F)->y")));
        assertTrue(OperatorBasis.NAND.accepts(Formula.variable("x")));
    }

    @Test
    @DisplayName("convert delega al metodo corrispondente di BasisConverter")
    void convertDelegates() {
        Formula formula = FormulaParser.parse("(x-|y)<->~(z+T)");

        assertEquals(BasisConverter.toNotAndOr(formula), OperatorBasis.NOT_AND_OR.convert(formula));
        assertEquals(BasisConverter.toNotAnd(formula), OperatorBasis.NOT_AND.convert(formula));
        assertEquals(BasisConverter.toNand(formula), OperatorBasis.NAND.convert(formula));
        assertEquals(BasisConverter.toImpliesNot(formula), OperatorBasis.IMPLIES_NOT.convert(formula));
        assertEquals(BasisConverter.toImpliesFalse(formula), OperatorBasis.IMPLIES_FALSE.convert(formula));
    }
}
