package org.basi.semantics;

import org.basi.syntax.Formula;
import org.basi.syntax.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaEvaluator")
class FormulaEvaluatorTest {

    @ParameterizedTest(name = "x {0} y con x={1}, y={2} -> {3}")
    @CsvSource({
            "&,   true,  true,  true",
            "&,   true,  false, false",
            "|,   false, false, false",
            "|,   false, true,  true",
            "->,  true,  false, false",
            "->,  false, false, true",
            "+,   true,  true,  false",
            "+,   true,  false, true",
            "<->, false, false, true",
            "<->, true,  false, false",
            "-&,  true,  true,  false",
            "-&,  false, true,  true",
            "-|,  false, false, true",
            "-|,  true,  false, false"
    })
    @DisplayName("Semantica degli operatori binari")
    void binaryOperators(String operator, boolean x, boolean y, boolean expected) {
        Formula formula = FormulaParser.parse("x" + operator + "y");

        assertEquals(expected, FormulaEvaluator.evaluate(formula, Map.of("x", x, "y", y)));
    }

    @Test
    @DisplayName("Costanti e negazione")
    void constantsAndNegation() {
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("T"), Map.of()));
        assertFalse(FormulaEvaluator.evaluate(FormulaParser.parse("F"), Map.of()));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("~x"), Map.of("x", false)));
        assertTrue(FormulaEvaluator.evaluate(FormulaParser.parse("~~x"), Map.of("x", true)));
    }

    @Test
    @DisplayName("Una variabile non assegnata segnala errore")
    void missingVariable() {
        Formula formula = FormulaParser.parse("x&y");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> FormulaEvaluator.evaluate(formula, Map.of("x", true)));
        assertTrue(error.getMessage().contains("y"));
    }

    @Test
    @DisplayName("allModels enumera tutti i 2^n modelli")
    void allModels() {
        List<Map<String, Boolean>> models = FormulaEvaluator.allModels(List.of("x", "y", "z"));

        assertEquals(8, models.size());
        assertEquals(Map.of("x", false, "y", false, "z", false), models.get(0));
        assertEquals(Map.of("x", true, "y", false, "z", false), models.get(1));
        assertEquals(Map.of("x", true, "y", true, "z", true), models.get(7));
        assertEquals(8, models.stream().distinct().count());
    }

    @Test
    @DisplayName("Senza variabili esiste un solo modello vuoto")
    void noVariables() {
        List<Map<String, Boolean>> models = FormulaEvaluator.allModels(List.of());

        assertEquals(1, models.size());
        assertTrue(models.get(0).isEmpty());
        assertEquals(List.of(true), FormulaEvaluator.truthTable(FormulaParser.parse("T|F")));
    }

    @Test
    @DisplayName("truthTable segue l'ordine dei modelli sulle variabili ordinate")
    void truthTable() {
        assertEquals(List.of(false, false, false, true), FormulaEvaluator.truthTable(FormulaParser.parse("y&x")));
        assertEquals(List.of(true, false, true, true), FormulaEvaluator.truthTable(FormulaParser.parse("x->y")));
    }
}
