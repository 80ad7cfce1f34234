package org.proplogic.formula;

/**
 * ALBERO SINTATTICO TIKZ - Codice LaTeX che disegna l'albero di una formula
 *
 * Ogni nodo dell'albero diventa un'istruzione {@code node}, ogni operando un'istruzione
 * {@code child} annidata; l'indentazione cresce di un livello a ogni profondità.
 * I connettivi usano sempre i comandi LaTeX, gli atomi la propria etichetta.
 *
 * Esempio per implies(p, q) con parametri di default:
 * <pre>
 * \begin{tikzpicture}
 * [level/.style={sibling distance=25mm/#1}]
 *     \node {$\rightarrow$}
 *         child {node {$p$}}
 *         child {node {$q$}};
 * \end{tikzpicture}
 * </pre>
 */
final class TikzParseTree {

    static final String DEFAULT_PARAMETERS = "sibling distance=25mm/#1";

    private static final String SPACES = "    ";
    private static final String TAB = "\t";

    private TikzParseTree() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param formula radice dell'albero
     * @param tikzParameters parametri dello stile {@code level} (non null)
     * @param useSpaces true per indentare con quattro spazi, false per tabulazioni
     * @return ambiente tikzpicture completo
     */
    static String render(Formula formula, String tikzParameters, boolean useSpaces) {
        if (tikzParameters == null) {
            throw new IllegalArgumentException("Parametri TikZ non possono essere null");
        }
        String indent = useSpaces ? SPACES : TAB;

        StringBuilder tree = new StringBuilder();
        tree.append(indent).append("\\node {$").append(nodeText(formula)).append("$}");
        for (Formula operand : formula.getOperands()) {
            appendChild(tree, operand, 2, indent);
        }
        tree.append(';');

        return "\\begin{tikzpicture}\n"
                + "[level/.style={" + tikzParameters + "}]\n"
                + tree + "\n"
                + "\\end{tikzpicture}";
    }

    private static void appendChild(StringBuilder out, Formula node, int level, String indent) {
        out.append('\n').append(indent.repeat(level))
                .append("child {node {$").append(nodeText(node)).append("$}");
        for (Formula operand : node.getOperands()) {
            appendChild(out, operand, level + 1, indent);
        }
        out.append('}');
    }

    private static String nodeText(Formula node) {
        if (node.isAtomic()) {
            return node.getLabel();
        }
        return SymbolTable.LATEX.symbolOf(node.getType()).strip();
    }
}
