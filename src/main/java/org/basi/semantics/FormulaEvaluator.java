package org.basi.semantics;

import org.basi.syntax.Formula;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Valutazione di formule proposizionali sotto un'assegnazione di verità.
 *
 * Un modello è una mappa nome variabile -> valore di verità. Utilizzato per
 * confrontare le tabelle di verità di una formula e della sua conversione.
 */
public final class FormulaEvaluator {

    /**
     * Previene istanziazione - classe utility
     */
    private FormulaEvaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Calcola il valore di verità della formula nel modello dato.
     *
     * @param formula formula da valutare
     * @param model assegnazione che copre tutte le variabili della formula
     * @return valore di verità della formula
     * @throws IllegalArgumentException se una variabile non è assegnata nel modello
     */
    public static boolean evaluate(Formula formula, Map<String, Boolean> model) {
        return switch (formula.getType()) {
            case VARIABLE -> {
                Boolean value = model.get(formula.getName());
                if (value == null) {
                    throw new IllegalArgumentException(
                            "Variabile non assegnata nel modello: " + formula.getName());
                }
                yield value;
            }
            case TRUE -> true;
            case FALSE -> false;
            case NOT -> !evaluate(formula.getFirst(), model);
            case AND -> evaluate(formula.getFirst(), model) && evaluate(formula.getSecond(), model);
            case OR -> evaluate(formula.getFirst(), model) || evaluate(formula.getSecond(), model);
            case IMPLIES -> !evaluate(formula.getFirst(), model) || evaluate(formula.getSecond(), model);
            case XOR -> evaluate(formula.getFirst(), model) != evaluate(formula.getSecond(), model);
            case IFF -> evaluate(formula.getFirst(), model) == evaluate(formula.getSecond(), model);
            case NAND -> !(evaluate(formula.getFirst(), model) && evaluate(formula.getSecond(), model));
            case NOR -> !(evaluate(formula.getFirst(), model) || evaluate(formula.getSecond(), model));
        };
    }

    /**
     * Enumera tutti i 2^n modelli sulle variabili date.
     *
     * Il modello i-esimo assegna alla variabile j-esima il bit j di i, quindi
     * il primo modello è tutto falso e l'ultimo tutto vero.
     *
     * @param variables variabili, nell'ordine di iterazione della collezione
     * @return lista immutabile di modelli
     */
    public static List<Map<String, Boolean>> allModels(Collection<String> variables) {
        List<String> names = new ArrayList<>(variables);
        if (names.size() >= Integer.SIZE - 1) {
            throw new IllegalArgumentException("Troppe variabili per enumerare i modelli: " + names.size());
        }

        int count = 1 << names.size();
        List<Map<String, Boolean>> models = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Boolean> model = new LinkedHashMap<>();
            for (int j = 0; j < names.size(); j++) {
                model.put(names.get(j), ((i >> j) & 1) == 1);
            }
            models.add(Collections.unmodifiableMap(model));
        }
        return Collections.unmodifiableList(models);
    }

    /**
     * Valori della formula su tutti i modelli delle sue variabili, in ordine
     * alfabetico delle variabili.
     */
    public static List<Boolean> truthTable(Formula formula) {
        List<Boolean> values = new ArrayList<>();
        for (Map<String, Boolean> model : allModels(formula.variables())) {
            values.add(evaluate(formula, model));
        }
        return values;
    }
}
