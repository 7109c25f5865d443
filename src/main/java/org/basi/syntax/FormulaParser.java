package org.basi.syntax;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.basi.antlr.LogicFormulaBaseVisitor;
import org.basi.antlr.LogicFormulaLexer;
import org.basi.antlr.LogicFormulaParser;
import org.basi.antlr.LogicFormulaParser.AndContext;
import org.basi.antlr.LogicFormulaParser.FalseContext;
import org.basi.antlr.LogicFormulaParser.FormulaContext;
import org.basi.antlr.LogicFormulaParser.IdContext;
import org.basi.antlr.LogicFormulaParser.IffContext;
import org.basi.antlr.LogicFormulaParser.ImpliesContext;
import org.basi.antlr.LogicFormulaParser.NotContext;
import org.basi.antlr.LogicFormulaParser.OrContext;
import org.basi.antlr.LogicFormulaParser.ParContext;
import org.basi.antlr.LogicFormulaParser.TrueContext;
import org.basi.antlr.LogicFormulaParser.VarContext;
import org.basi.antlr.LogicFormulaParser.XorContext;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Convertitore da albero sintattico ANTLR a Formula
 *
 * Implementa un visitor sull'albero di parsing generato dalla grammatica
 * LogicFormula, costruendo un albero {@link Formula} con un nodo per ogni
 * operatore, senza alcuna trasformazione semantica.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Biimplicazione (<->): associativa a sinistra
 * - Implicazione (->): associativa a destra, A -> B -> C ~ A -> (B -> C)
 * - Disgiunzione (|) e NOR (-|): associative a sinistra, stesso livello
 * - Disgiunzione esclusiva (+): associativa a sinistra
 * - Congiunzione (&) e NAND (-&): associative a sinistra, stesso livello
 * - Negazione (~): prefissa
 * - Variabili, costanti T/F e parentesi
 *
 * UTILIZZO TIPICO:
 * - Input: testo della formula, es. "~(x<->y)"
 * - Output: Formula pronta per la conversione di base
 * - Errori: IllegalArgumentException con riga e colonna del primo errore
 */
public class FormulaParser extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza il testo di una formula e costruisce l'albero corrispondente.
     *
     * PIPELINE:
     * 1. Lexing con LogicFormulaLexer
     * 2. Parsing con LogicFormulaParser (regola formula, fino a EOF)
     * 3. Visita dell'albero sintattico e costruzione Formula
     *
     * @param formulaText formula in notazione infissa
     * @return formula costruita
     * @throws IllegalArgumentException se il testo è null, vuoto o sintatticamente errato
     */
    public static Formula parse(String formulaText) {
        if (formulaText == null || formulaText.trim().isEmpty()) {
            throw new IllegalArgumentException("Testo della formula non può essere null o vuoto");
        }

        LOGGER.fine("Parsing formula: " + formulaText);

        CharStream input = CharStreams.fromString(formulaText);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaParser().visit(tree);

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Formula costruita: " + formula);
        }
        return formula;
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.biconditional());
    }

    //endregion

    //region OPERATORI BINARI

    @Override
    public Formula visitIff(IffContext ctx) {
        Formula result = visit(ctx.implication(0));
        for (int i = 1; i < ctx.implication().size(); i++) {
            result = Formula.binary(Formula.Type.IFF, result, visit(ctx.implication(i)));
        }
        return result;
    }

    /**
     * Implicazione associativa a destra: il conseguente è a sua volta
     * un'implicazione visitata ricorsivamente.
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }
        return Formula.implies(antecedent, visit(ctx.implication()));
    }

    @Override
    public Formula visitOr(OrContext ctx) {
        Formula result = visit(ctx.exclusive(0));
        for (int i = 1; i < ctx.exclusive().size(); i++) {
            Token operator = ctx.ops.get(i - 1);
            Formula.Type type = operator.getType() == LogicFormulaParser.NOR
                    ? Formula.Type.NOR
                    : Formula.Type.OR;
            result = Formula.binary(type, result, visit(ctx.exclusive(i)));
        }
        return result;
    }

    @Override
    public Formula visitXor(XorContext ctx) {
        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = Formula.binary(Formula.Type.XOR, result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public Formula visitAnd(AndContext ctx) {
        Formula result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            Token operator = ctx.ops.get(i - 1);
            Formula.Type type = operator.getType() == LogicFormulaParser.NAND
                    ? Formula.Type.NAND
                    : Formula.Type.AND;
            result = Formula.binary(type, result, visit(ctx.negation(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONI, ATOMI E COSTANTI

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.biconditional());
    }

    @Override
    public Formula visitTrue(TrueContext ctx) {
        return Formula.constant(true);
    }

    @Override
    public Formula visitFalse(FalseContext ctx) {
        return Formula.constant(false);
    }

    @Override
    public Formula visitId(IdContext ctx) {
        String variableName = ctx.IDENTIFIER().getText();
        LOGGER.finest("Variabile: " + variableName);
        return Formula.variable(variableName);
    }

    //endregion

    /**
     * Interrompe il parsing al primo errore lessicale o sintattico.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            throw new IllegalArgumentException(String.format(
                    "Errore di sintassi alla riga %d:%d: %s", line, charPositionInLine, msg), e);
        }
    }
}
