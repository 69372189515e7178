package com.depgraph.engine.scan;

import com.depgraph.engine.graph.ReferenceForm;
import com.depgraph.engine.graph.RelationKind;
import com.depgraph.engine.graph.SymbolIds;
import org.junit.jupiter.api.Test;

import static com.depgraph.engine.scan.ScanAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

class PythonSourceScannerTest {

    private static final String SERVICE = String.join("\n",
            "import os",
            "from app.util import helper, other as o",
            "",
            "",
            "class Service:",
            "    def __init__(self, repo):",
            "        self.repo = repo",
            "",
            "    def run(self, job):",
            "        # helper(ignored) is only mentioned in a comment",
            "        helper(job)",
            "        if job.urgent:",
            "            self.notify(job)",
            "        else:",
            "            log(job)",
            "        fn = getattr(self, \"notify\")",
            "        return fn(job)",
            "",
            "    def notify(self, job):",
            "        pass",
            "",
            "",
            "def standalone(a, b=1):",
            "    return Service(a)",
            "",
            "",
            "double = lambda x: x * 2",
            "");

    private final PatternSourceScanner scanner = PatternSourceScanner.python();

    @Test
    void methodsAreQualifiedAndSelfIsNotCounted() throws Exception {
        ScanResult result = scanner.scan("app/service.py", SERVICE);

        assertEquals("python", result.language());
        symbol(result, "Service.__init__", 1);
        symbol(result, "Service.notify", 1);
        symbol(result, "standalone", 2);
        symbol(result, "double", 1);

        SymbolDraft run = symbol(result, "Service.run", 1);
        assertEquals(9, run.lineStart());
        assertEquals(17, run.lineEnd());
    }

    @Test
    void branchBodiesAreConditional() throws Exception {
        ScanResult result = scanner.scan("app/service.py", SERVICE);

        assertForm(ReferenceForm.DIRECT, reference(result, "Service.run", "helper", RelationKind.CALL));
        assertForm(ReferenceForm.CONDITIONAL, reference(result, "Service.run", "Service.notify", RelationKind.CALL));
        assertForm(ReferenceForm.CONDITIONAL, reference(result, "Service.run", "log", RelationKind.CALL));
        assertNoReference(result, "Service.run", "ignored");
    }

    @Test
    void getattrWithLiteralNameIsDynamic() throws Exception {
        ScanResult result = scanner.scan("app/service.py", SERVICE);

        ReferenceDraft dynamic = reference(result, "Service.run", "notify", RelationKind.CALL);
        assertForm(ReferenceForm.DYNAMIC, dynamic);
        assertEquals(-1, dynamic.targetArity());
        assertEquals(16, dynamic.line());
    }

    @Test
    void capitalisedBareCallIsConstruction() throws Exception {
        ScanResult result = scanner.scan("app/service.py", SERVICE);

        ReferenceDraft construct = reference(result, "standalone", "Service.__init__", RelationKind.CALL);
        assertEquals(1, construct.targetArity());
    }

    @Test
    void importsAreRecordedOnTheModule() throws Exception {
        ScanResult result = scanner.scan("app/service.py", SERVICE);

        reference(result, SymbolIds.MODULE_NAME, "os", RelationKind.IMPORT);
        reference(result, SymbolIds.MODULE_NAME, "app.util.helper", RelationKind.IMPORT);
        reference(result, SymbolIds.MODULE_NAME, "app.util.other", RelationKind.IMPORT);
    }

    @Test
    void shortCircuitRightHandSideIsConditional() throws Exception {
        String source = String.join("\n",
                "def check(order):",
                "    return validate(order) and persist(order)",
                "");
        ScanResult result = scanner.scan("check.py", source);

        assertForm(ReferenceForm.DIRECT, reference(result, "check", "validate", RelationKind.CALL));
        assertForm(ReferenceForm.CONDITIONAL, reference(result, "check", "persist", RelationKind.CALL));
    }

    @Test
    void armsOfAnInlineConditionalAreConditional() throws Exception {
        String source = String.join("\n",
                "def price(order):",
                "    total = discounted(order) if eligible(order) else full(order)",
                "    return wrap(fallback() if missing else total)",
                "");
        ScanResult result = scanner.scan("price.py", source);

        assertForm(ReferenceForm.CONDITIONAL, reference(result, "price", "discounted", RelationKind.CALL));
        assertForm(ReferenceForm.DIRECT, reference(result, "price", "eligible", RelationKind.CALL));
        assertForm(ReferenceForm.CONDITIONAL, reference(result, "price", "full", RelationKind.CALL));
        assertForm(ReferenceForm.DIRECT, reference(result, "price", "wrap", RelationKind.CALL));
        assertForm(ReferenceForm.CONDITIONAL, reference(result, "price", "fallback", RelationKind.CALL));
    }

    @Test
    void unterminatedStringIsRejected() {
        assertThrows(SourceScanner.ScanException.class,
                () -> scanner.scan("bad.py", "def a():\n    s = \"\"\"never closed\n"));
    }

    @Test
    void binaryContentIsRejected() {
        assertThrows(SourceScanner.ScanException.class,
                () -> scanner.scan("blob.py", "def a():\0\n"));
    }
}
