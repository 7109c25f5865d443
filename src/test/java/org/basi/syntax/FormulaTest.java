package org.basi.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.List;

import static org.basi.syntax.Formula.and;
import static org.basi.syntax.Formula.not;
import static org.basi.syntax.Formula.variable;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Formula")
class FormulaTest {

    private final Formula x = variable("x");
    private final Formula y = variable("y");

    @Nested
    @DisplayName("Costruzione")
    class Construction {

        @Test
        @DisplayName("Le foglie hanno il tipo atteso")
        void leaves() {
            assertTrue(x.isVariable());
            assertEquals("x", x.getName());
            assertEquals(Formula.Type.TRUE, Formula.constant(true).getType());
            assertEquals(Formula.Type.FALSE, Formula.constant(false).getType());
            assertTrue(Formula.constant(false).isConstant());
        }

        @Test
        @DisplayName("I nodi binari espongono entrambi gli operandi in ordine")
        void binaryOperands() {
            Formula formula = Formula.binary(Formula.Type.NOR, x, y);

            assertTrue(formula.isBinary());
            assertSame(x, formula.getFirst());
            assertSame(y, formula.getSecond());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "1x", "x-y", "T", "F", "and", "NOT", "iff"})
        @DisplayName("Nomi di variabile non validi sono rifiutati")
        void invalidVariableNames(String name) {
            assertThrows(IllegalArgumentException.class, () -> variable(name));
        }

        @Test
        @DisplayName("Operandi null e tipi non binari sono rifiutati")
        void invalidNodes() {
            assertThrows(IllegalArgumentException.class, () -> variable(null));
            assertThrows(IllegalArgumentException.class, () -> not(null));
            assertThrows(IllegalArgumentException.class, () -> and(x, null));
            assertThrows(IllegalArgumentException.class, () -> Formula.binary(Formula.Type.NOT, x, y));
            assertThrows(IllegalArgumentException.class, () -> Formula.binary(Formula.Type.TRUE, x, y));
        }

        @Test
        @DisplayName("Accesso a campi assenti segnala errore")
        void missingParts() {
            assertThrows(IllegalStateException.class, () -> not(x).getSecond());
            assertThrows(IllegalStateException.class, () -> x.getFirst());
            assertThrows(IllegalStateException.class, () -> and(x, y).getName());
        }
    }

    @Nested
    @DisplayName("Analisi")
    class Analysis {

        @Test
        @DisplayName("variables() restituisce i nomi ordinati senza duplicati")
        void variables() {
            Formula formula = and(variable("z"), Formula.or(x, not(variable("z"))));

            assertEquals(List.of("x", "z"), List.copyOf(formula.variables()));
            assertTrue(Formula.constant(true).variables().isEmpty());
        }

        @Test
        @DisplayName("operators() contiene operatori e costanti ma non variabili")
        void operators() {
            Formula formula = Formula.implies(x, and(Formula.constant(true), not(y)));

            assertEquals(EnumSet.of(Formula.Type.IMPLIES, Formula.Type.AND, Formula.Type.TRUE, Formula.Type.NOT),
                    formula.operators());
            assertTrue(x.operators().isEmpty());
        }

        @Test
        @DisplayName("Conteggio nodi e profondità")
        void sizeAndDepth() {
            Formula formula = and(x, not(y));

            assertEquals(4, formula.countNodes());
            assertEquals(2, formula.calculateDepth());
            assertEquals(0, x.calculateDepth());
        }
    }

    @Nested
    @DisplayName("Uguaglianza e stampa")
    class EqualityAndPrinting {

        @Test
        @DisplayName("L'uguaglianza è strutturale e dipende dall'ordine degli operandi")
        void structuralEquality() {
            assertEquals(and(variable("x"), variable("y")), and(x, y));
            assertEquals(and(x, y).hashCode(), and(variable("x"), variable("y")).hashCode());
            assertNotEquals(and(y, x), and(x, y));
            assertNotEquals(Formula.or(x, y), and(x, y));
        }

        @Test
        @DisplayName("Ogni nodo binario è stampato tra parentesi")
        void printing() {
            assertEquals("x", x.toString());
            assertEquals("T", Formula.constant(true).toString());
            assertEquals("~~x", not(not(x)).toString());
            assertEquals("(x&~y)", and(x, not(y)).toString());
            assertEquals("((x-|y)<->F)", Formula.binary(Formula.Type.IFF,
                    Formula.binary(Formula.Type.NOR, x, y), Formula.constant(false)).toString());
            assertEquals("~(x+y)", not(Formula.binary(Formula.Type.XOR, x, y)).toString());
        }
    }
}
