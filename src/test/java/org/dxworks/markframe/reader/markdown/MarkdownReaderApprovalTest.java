package org.dxworks.markframe.reader.markdown;

import org.approvaltests.Approvals;
import org.dxworks.markframe.TestUtils;
import org.dxworks.markframe.model.Document;
import org.junit.jupiter.api.Test;

import java.io.IOException;

public class MarkdownReaderApprovalTest {

    @Test
    void read_Emphasis() throws IOException {
        verify("Emphasis.md");
    }

    private static void verify(String fileName) throws IOException {
        Document document = new MarkdownReader().read(TestUtils.sample(fileName));
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(document) + "\n");
    }
}
