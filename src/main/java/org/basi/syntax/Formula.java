package org.basi.syntax;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Formula proposizionale immutabile rappresentata come albero.
 *
 * Ogni nodo ha un tipo fissato alla costruzione:
 * - VARIABLE: foglia con nome (x, y, p1, ...)
 * - TRUE / FALSE: costanti logiche T e F
 * - NOT: nodo unario con un solo operando
 * - AND, OR, IMPLIES, XOR, IFF, NAND, NOR: nodi binari con due operandi
 *
 * I nodi non vengono mai modificati: tutte le trasformazioni costruiscono
 * alberi nuovi, quindi la stessa formula può essere convertita più volte e
 * condivisa tra thread senza sincronizzazione.
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati, con il simbolo usato nella notazione infissa.
     */
    public enum Type {
        VARIABLE(null),
        TRUE("T"),
        FALSE("F"),
        NOT("~"),
        AND("&"),
        OR("|"),
        IMPLIES("->"),
        XOR("+"),
        IFF("<->"),
        NAND("-&"),
        NOR("-|");

        private final String symbol;

        Type(String symbol) {
            this.symbol = symbol;
        }

        /** Simbolo infisso dell'operatore o della costante (null per VARIABLE) */
        public String getSymbol() {
            return symbol;
        }

        public boolean isConstant() {
            return this == TRUE || this == FALSE;
        }

        public boolean isUnary() {
            return this == NOT;
        }

        public boolean isBinary() {
            return this != VARIABLE && !isConstant() && !isUnary();
        }
    }

    /** Parole riservate dalla grammatica, non utilizzabili come nomi di variabile */
    private static final Set<String> RESERVED_WORDS = Set.of(
            "T", "F", "top", "TOP", "bottom", "BOTTOM", "not", "NOT", "and", "AND", "or", "OR",
            "xor", "XOR", "nand", "NAND", "nor", "NOR", "implies", "IMPLIES", "iff", "IFF");

    private static final Pattern VARIABLE_NAME = Pattern.compile("[a-zA-Z][a-zA-Z0-9_]*");

    private static final Formula TRUE_CONSTANT = new Formula(Type.TRUE, null, null, null);
    private static final Formula FALSE_CONSTANT = new Formula(Type.FALSE, null, null, null);

    /** Tipo del nodo, immutabile */
    private final Type type;

    /** Nome della variabile (solo per nodi VARIABLE) */
    private final String name;

    /** Primo operando (nodi unari e binari) */
    private final Formula first;

    /** Secondo operando (solo nodi binari) */
    private final Formula second;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, Formula first, Formula second) {
        this.type = type;
        this.name = name;
        this.first = first;
        this.second = second;
    }

    /**
     * Costruisce una foglia variabile.
     *
     * @param name nome della variabile: una lettera seguita da lettere, cifre o '_'
     * @return nuovo nodo VARIABLE
     * @throws IllegalArgumentException se il nome è null o non valido
     */
    public static Formula variable(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
        String trimmed = name.trim();
        if (!isValidVariableName(trimmed)) {
            throw new IllegalArgumentException("Nome variabile non valido: " + trimmed);
        }
        return new Formula(Type.VARIABLE, trimmed, null, null);
    }

    /**
     * Restituisce la costante T o F.
     */
    public static Formula constant(boolean value) {
        return value ? TRUE_CONSTANT : FALSE_CONSTANT;
    }

    /**
     * Costruisce la negazione dell'operando.
     *
     * @throws IllegalArgumentException se operand è null
     */
    public static Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new Formula(Type.NOT, null, operand, null);
    }

    /**
     * Costruisce un nodo binario.
     *
     * @param type operatore binario (AND, OR, IMPLIES, XOR, IFF, NAND, NOR)
     * @param first primo operando (non null)
     * @param second secondo operando (non null)
     * @return nuovo nodo binario
     * @throws IllegalArgumentException se il tipo non è binario o gli operandi sono null
     */
    public static Formula binary(Type type, Formula first, Formula second) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        if (first == null || second == null) {
            throw new IllegalArgumentException("Operandi per " + type + " non possono essere null");
        }
        return new Formula(type, null, first, second);
    }

    public static Formula and(Formula first, Formula second) {
        return binary(Type.AND, first, second);
    }

    public static Formula or(Formula first, Formula second) {
        return binary(Type.OR, first, second);
    }

    public static Formula implies(Formula first, Formula second) {
        return binary(Type.IMPLIES, first, second);
    }

    public static Formula nand(Formula first, Formula second) {
        return binary(Type.NAND, first, second);
    }

    private static boolean isValidVariableName(String name) {
        return VARIABLE_NAME.matcher(name).matches()
                && !RESERVED_WORDS.contains(name);
    }

    //endregion

    //region INTERROGAZIONE STRUTTURALE

    public Type getType() {
        return type;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public String getName() {
        if (type != Type.VARIABLE) {
            throw new IllegalStateException("Nodo " + type + " non ha un nome");
        }
        return name;
    }

    /**
     * @return operando di un nodo unario o primo operando di un nodo binario
     * @throws IllegalStateException se il nodo è una foglia
     */
    public Formula getFirst() {
        if (first == null) {
            throw new IllegalStateException("Nodo " + type + " non ha operandi");
        }
        return first;
    }

    /**
     * @return secondo operando di un nodo binario
     * @throws IllegalStateException se il nodo non è binario
     */
    public Formula getSecond() {
        if (second == null) {
            throw new IllegalStateException("Nodo " + type + " non ha un secondo operando");
        }
        return second;
    }

    public boolean isVariable() {
        return type == Type.VARIABLE;
    }

    public boolean isConstant() {
        return type.isConstant();
    }

    public boolean isUnary() {
        return type.isUnary();
    }

    public boolean isBinary() {
        return type.isBinary();
    }

    //endregion

    //region UTILITÀ E ANALISI

    /**
     * Raccoglie i nomi di tutte le variabili, in ordine alfabetico.
     */
    public SortedSet<String> variables() {
        SortedSet<String> variables = new TreeSet<>();
        collectVariables(variables);
        return variables;
    }

    private void collectVariables(Set<String> variables) {
        switch (type) {
            case VARIABLE -> variables.add(name);
            case TRUE, FALSE -> { /* nessuna variabile */ }
            case NOT -> first.collectVariables(variables);
            default -> {
                first.collectVariables(variables);
                second.collectVariables(variables);
            }
        }
    }

    /**
     * Raccoglie tutti gli operatori e le costanti presenti nell'albero.
     * Le variabili non compaiono nel risultato.
     */
    public Set<Type> operators() {
        Set<Type> operators = EnumSet.noneOf(Type.class);
        collectOperators(operators);
        return operators;
    }

    private void collectOperators(Set<Type> operators) {
        if (type == Type.VARIABLE) {
            return;
        }
        operators.add(type);
        if (first != null) {
            first.collectOperators(operators);
        }
        if (second != null) {
            second.collectOperators(operators);
        }
    }

    /**
     * Conta i nodi dell'albero, foglie comprese.
     */
    public int countNodes() {
        int count = 1;
        if (first != null) {
            count += first.countNodes();
        }
        if (second != null) {
            count += second.countNodes();
        }
        return count;
    }

    /**
     * Calcola la profondità massima dell'albero (0 per le foglie).
     */
    public int calculateDepth() {
        if (first == null) {
            return 0;
        }
        int depth = first.calculateDepth();
        if (second != null) {
            depth = Math.max(depth, second.calculateDepth());
        }
        return 1 + depth;
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Uguaglianza strutturale. L'ordine degli operandi conta anche per gli
     * operatori commutativi.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(first, other.first)
                && Objects.equals(second, other.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, first, second);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Notazione infissa canonica: ogni nodo binario tra parentesi.
     *
     * FORMATO OUTPUT:
     * - Variabili: nome (x, p1)
     * - Costanti: T, F
     * - Negazioni: ~operando (~x, ~(x&y))
     * - Binari: (primo op secondo), es. (x->y), ((x-&y)<->~z)
     *
     * L'output è riletto da {@link FormulaParser} nella stessa formula.
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        appendTo(result);
        return result.toString();
    }

    private void appendTo(StringBuilder result) {
        switch (type) {
            case VARIABLE -> result.append(name);
            case TRUE, FALSE -> result.append(type.getSymbol());
            case NOT -> {
                result.append(type.getSymbol());
                first.appendTo(result);
            }
            default -> {
                result.append('(');
                first.appendTo(result);
                result.append(type.getSymbol());
                second.appendTo(result);
                result.append(')');
            }
        }
    }

    //endregion
}
