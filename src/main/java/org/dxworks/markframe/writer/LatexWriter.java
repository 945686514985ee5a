package org.dxworks.markframe.writer;

import org.dxworks.markframe.model.Alignment;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Table;
import org.dxworks.markframe.model.block.TableCell;
import org.dxworks.markframe.model.block.TableRow;
import org.dxworks.markframe.model.inline.Inline;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a document as a standalone LaTeX article. Not thread-safe.
 */
public class LatexWriter extends MarkupWriter {

    static final String PREAMBLE = "\\documentclass{article}\n"
            + "\\usepackage[utf8]{inputenc}\n"
            + "\\usepackage[normalem]{ulem}\n"
            + "\\usepackage{graphicx}\n"
            + "\\usepackage{listings}\n"
            + "\\usepackage{hyperref}\n"
            + "\\providecommand{\\tightlist}{\\setlength{\\itemsep}{0pt}\\setlength{\\parskip}{0pt}}\n"
            + "\\begin{document}\n";
    static final String END = "\\end{document}\n";

    private static final String[] SECTIONS = {"section", "subsection", "subsubsection", "paragraph", "subparagraph"};
    private static final String[] ENUM_COUNTERS = {"enumi", "enumii", "enumiii", "enumiv"};

    private int enumLevel;

    @Override
    protected String formatName() {
        return "LaTeX";
    }

    @Override
    protected String document(String body) {
        return PREAMBLE + (body.isEmpty() ? "" : body + "\n") + END;
    }

    @Override
    protected String paragraph(List<Inline> content) throws UnsupportedConstructException {
        return inlines(content);
    }

    @Override
    protected String heading(int level, List<Inline> content) throws UnsupportedConstructException {
        if (level > SECTIONS.length) {
            return inlines(content);
        }
        return "\\" + SECTIONS[level - 1] + "{" + inlines(content) + "}";
    }

    @Override
    protected String thematicBreak() {
        return "\\begin{center}\\rule{0.5\\linewidth}{0.5pt}\\end{center}";
    }

    @Override
    protected String codeBlock(String language, String text) {
        String options = language.isEmpty() ? "" : "[language=" + language + "]";
        return "\\begin{lstlisting}" + options + "\n" + text + "\n\\end{lstlisting}";
    }

    @Override
    protected String blockQuote(List<Block> blocks) throws UnsupportedConstructException {
        return "\\begin{quote}\n" + blocks(blocks) + "\n\\end{quote}";
    }

    @Override
    protected String bulletList(List<List<Block>> items, boolean tight) throws UnsupportedConstructException {
        return "\\begin{itemize}\n" + (tight ? "\\tightlist\n" : "") + items(items, tight) + "\n\\end{itemize}";
    }

    @Override
    protected String orderedList(int start, List<List<Block>> items, boolean tight)
            throws UnsupportedConstructException {
        StringBuilder result = new StringBuilder("\\begin{enumerate}\n");
        if (start != 1 && enumLevel < ENUM_COUNTERS.length) {
            result.append("\\setcounter{").append(ENUM_COUNTERS[enumLevel]).append("}{").append(start - 1).append("}\n");
        }
        if (tight) {
            result.append("\\tightlist\n");
        }
        enumLevel++;
        try {
            result.append(items(items, tight));
        } finally {
            enumLevel--;
        }
        return result.append("\n\\end{enumerate}").toString();
    }

    private String items(List<List<Block>> items, boolean tight) throws UnsupportedConstructException {
        List<String> rendered = new ArrayList<>();
        for (List<Block> item : items) {
            rendered.add("\\item " + item(item, tight));
        }
        return String.join("\n", rendered);
    }

    @Override
    protected String table(Table table) throws UnsupportedConstructException {
        StringBuilder result = new StringBuilder("\\begin{tabular}{|");
        for (Alignment alignment : table.alignments()) {
            result.append(switch (alignment) {
                case RIGHT -> "r|";
                case CENTER -> "c|";
                case LEFT, DEFAULT -> "l|";
            });
        }
        result.append("}\n\\hline\n");
        List<TableRow> rows = new ArrayList<>(table.head);
        rows.addAll(table.body);
        rows.addAll(table.foot);
        for (TableRow row : rows) {
            List<String> cells = new ArrayList<>();
            for (TableCell cell : row.cells) {
                cells.add(inlines(cellContent(cell)));
            }
            result.append(String.join(" & ", cells)).append(" \\\\\n\\hline\n");
        }
        return result.append("\\end{tabular}").toString();
    }

    @Override
    protected String escape(String text) {
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&', '%', '$', '#', '_', '{', '}' -> result.append('\\').append(c);
                case '~' -> result.append("\\textasciitilde{}");
                case '^' -> result.append("\\^{}");
                case '\\' -> result.append("\\textbackslash{}");
                case '`' -> result.append("\\textasciigrave{}");
                default -> result.append(c);
            }
        }
        return result.toString();
    }

    @Override
    protected String lineBreak() {
        return "\\\\\n";
    }

    @Override
    protected String emph(List<Inline> content) throws UnsupportedConstructException {
        return "\\emph{" + inlines(content) + "}";
    }

    @Override
    protected String strong(List<Inline> content) throws UnsupportedConstructException {
        return "\\textbf{" + inlines(content) + "}";
    }

    @Override
    protected String strikeout(List<Inline> content) throws UnsupportedConstructException {
        return "\\sout{" + inlines(content) + "}";
    }

    @Override
    protected String code(String text) {
        return "\\texttt{" + escape(text) + "}";
    }

    @Override
    protected String link(String url, List<Inline> content) throws UnsupportedConstructException {
        return "\\href{" + escapeUrl(url) + "}{" + inlines(content) + "}";
    }

    @Override
    protected String image(String url, List<Inline> description) {
        return "\\includegraphics[width=\\linewidth]{" + escapeUrl(url) + "}";
    }

    private static String escapeUrl(String url) {
        return url.replace("\\", "\\\\").replace("%", "\\%").replace("#", "\\#");
    }
}
