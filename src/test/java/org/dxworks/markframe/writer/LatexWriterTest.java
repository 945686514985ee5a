package org.dxworks.markframe.writer;

import org.dxworks.markframe.model.Alignment;
import org.dxworks.markframe.model.Document;
import org.dxworks.markframe.model.block.Block;
import org.dxworks.markframe.model.block.Table;
import org.dxworks.markframe.model.block.TableCell;
import org.dxworks.markframe.model.block.TableRow;
import org.dxworks.markframe.model.block.ThematicBreak;
import org.dxworks.markframe.reader.markdown.MarkdownReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;

import static org.dxworks.markframe.Trees.blocks;
import static org.dxworks.markframe.Trees.bullets;
import static org.dxworks.markframe.Trees.code;
import static org.dxworks.markframe.Trees.codeBlock;
import static org.dxworks.markframe.Trees.emph;
import static org.dxworks.markframe.Trees.heading;
import static org.dxworks.markframe.Trees.image;
import static org.dxworks.markframe.Trees.item;
import static org.dxworks.markframe.Trees.lineBreak;
import static org.dxworks.markframe.Trees.link;
import static org.dxworks.markframe.Trees.of;
import static org.dxworks.markframe.Trees.ordered;
import static org.dxworks.markframe.Trees.para;
import static org.dxworks.markframe.Trees.plain;
import static org.dxworks.markframe.Trees.quote;
import static org.dxworks.markframe.Trees.space;
import static org.dxworks.markframe.Trees.str;
import static org.dxworks.markframe.Trees.strikeout;
import static org.dxworks.markframe.Trees.strong;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LatexWriterTest {

    private static String body(Block... blocks) throws UnsupportedConstructException {
        String output = new LatexWriter().write(new Document(blocks(blocks)));
        assertTrue(output.startsWith(LatexWriter.PREAMBLE));
        assertTrue(output.endsWith(LatexWriter.END));
        return output.substring(LatexWriter.PREAMBLE.length(), output.length() - LatexWriter.END.length());
    }

    @Test
    void emptyDocument_isPreambleAndEnd() throws Exception {
        assertEquals(LatexWriter.PREAMBLE + LatexWriter.END, new LatexWriter().write(new Document()));
    }

    @Test
    void headingLevels() throws Exception {
        assertEquals("\\section{A}\n\n\\paragraph{D}\n\nF\n", body(heading(1, "A"), heading(4, "D"), heading(6, "F")));
    }

    @Test
    void specialCharacters_areEscaped() throws Exception {
        assertEquals("50\\% \\& \\$x \\#1 a\\_b \\{c\\} \\textasciitilde{} \\^{} \\textbackslash{}\n",
                body(para("50% & $x #1 a_b {c} ~ ^ \\")));
    }

    @Test
    void inlineMarkup() throws Exception {
        assertEquals("\\emph{a} \\textbf{b} \\sout{c} \\texttt{x\\_y}\n",
                body(para(of(emph(str("a")), space(), strong(str("b")), space(), strikeout(str("c")), space(),
                        code("x_y")))));
    }

    @Test
    void linksImagesAndLineBreaks() throws Exception {
        assertEquals("\\href{http://x/\\#frag}{go}\\\\\n\\includegraphics[width=\\linewidth]{/i.png}\n",
                body(para(of(link("http://x/#frag", "", str("go")), lineBreak(), image("/i.png", "", str("alt"))))));
    }

    @Test
    void codeQuoteAndRule() throws Exception {
        assertEquals("\\begin{lstlisting}[language=c]\nint x;\n\\end{lstlisting}\n\n"
                        + "\\begin{lstlisting}\nplain\n\\end{lstlisting}\n\n"
                        + "\\begin{quote}\nq\n\\end{quote}\n\n"
                        + "\\begin{center}\\rule{0.5\\linewidth}{0.5pt}\\end{center}\n",
                body(codeBlock("c", "int x;"), codeBlock("", "plain"), quote(para("q")), new ThematicBreak()));
    }

    @Test
    void tightAndLooseLists() throws Exception {
        assertEquals("\\begin{itemize}\n\\tightlist\n\\item a\n\\item b\n\\end{itemize}\n",
                body(bullets(item(plain("a")), item(plain("b")))));
        assertEquals("\\begin{itemize}\n\\item a\n\\item b\n\\end{itemize}\n",
                body(bullets(item(para("a")), item(para("b")))));
    }

    @Test
    void looseListOfCodeBlocks_hasNoTightlist() throws Exception {
        Document document = new MarkdownReader().read("- ```\n  x\n  ```\n\n- ```\n  y\n  ```");
        assertEquals(LatexWriter.PREAMBLE
                        + "\\begin{itemize}\n"
                        + "\\item \\begin{lstlisting}\nx\n\\end{lstlisting}\n"
                        + "\\item \\begin{lstlisting}\ny\n\\end{lstlisting}\n"
                        + "\\end{itemize}\n"
                        + LatexWriter.END,
                new LatexWriter().write(document));
    }

    @Test
    void orderedList_startNumberSetsCounterOfItsDepth() throws Exception {
        String expected = "\\begin{enumerate}\n\\setcounter{enumi}{2}\n\\tightlist\n"
                + "\\item a\n"
                + "\\begin{enumerate}\n\\setcounter{enumii}{4}\n\\tightlist\n\\item b\n\\end{enumerate}\n"
                + "\\end{enumerate}\n";
        assertEquals(expected, body(ordered(3, '.', item(plain("a"), ordered(5, ')', item(plain("b")))))));
        assertEquals("\\begin{enumerate}\n\\tightlist\n\\item a\n\\end{enumerate}\n",
                body(ordered(1, '.', item(plain("a")))));
    }

    @Test
    void table() throws Exception {
        Table table = Table.of(List.of(Alignment.LEFT, Alignment.CENTER, Alignment.RIGHT), List.of(
                new TableRow(List.of(TableCell.of(of(str("a"))), TableCell.of(of(str("b"))), TableCell.of(of(str("c"))))),
                new TableRow(List.of(TableCell.of(of(str("1_0")))))));

        assertEquals("\\begin{tabular}{|l|c|r|}\n\\hline\na & b & c \\\\\n\\hline\n1\\_0 &  &  \\\\\n\\hline\n\\end{tabular}\n",
                body(table));
    }

    @ParameterizedTest
    @MethodSource("org.dxworks.markframe.writer.UnsupportedConstructs#blocks")
    void unsupportedVariants_areRejected(Block block) {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> body(block));
        String name = UnsupportedConstructs.nameOf(block);
        assertEquals(name, e.getConstruct());
        assertEquals(name + " is not supported by the LaTeX writer", e.getMessage());
    }
}
