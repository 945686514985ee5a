package org.dxworks.markframe.writer;

import org.approvaltests.Approvals;
import org.dxworks.markframe.TestUtils;
import org.dxworks.markframe.model.Document;
import org.junit.jupiter.api.Test;

public class WriterApprovalTest {

    @Test
    void typst_Basic() throws Exception {
        verify("Basic.md", new TypstWriter());
    }

    @Test
    void latex_Basic() throws Exception {
        verify("Basic.md", new LatexWriter());
    }

    @Test
    void typst_Tables() throws Exception {
        verify("Tables.md", new TypstWriter());
    }

    @Test
    void latex_Tables() throws Exception {
        verify("Tables.md", new LatexWriter());
    }

    @Test
    void typst_Nested() throws Exception {
        verify("Nested.md", new TypstWriter());
    }

    @Test
    void latex_Nested() throws Exception {
        verify("Nested.md", new LatexWriter());
    }

    private static void verify(String fileName, DocumentWriter writer) throws Exception {
        Document document = TestUtils.read(TestUtils.sample(fileName));
        Approvals.verify(writer.write(document));
    }
}
