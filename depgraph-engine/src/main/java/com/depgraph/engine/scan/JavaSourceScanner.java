package com.depgraph.engine.scan;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Java scanner backed by Eclipse JDT's ASTParser.
 * Files are parsed one at a time without a classpath, so bindings are never resolved: targets are
 * named the way the source names them and resolved later against the whole graph.
 */
public class JavaSourceScanner implements SourceScanner {

    @Override
    public String language() {
        return "java";
    }

    @Override
    public Set<String> fileExtensions() {
        return Set.of("java");
    }

    @Override
    public ScanResult scan(String path, String content) throws ScanException {
        CompilationUnit cu = parse(path, content);

        for (IProblem problem : cu.getProblems()) {
            if (problem.isError()) {
                throw new ScanException(path + ":" + problem.getSourceLineNumber() + ": " + problem.getMessage());
            }
        }

        JavaReferenceVisitor visitor = new JavaReferenceVisitor(path, cu);
        cu.accept(visitor);
        return new ScanResult(language(), visitor.getSymbols(), visitor.getReferences());
    }

    private CompilationUnit parse(String path, String content) throws ScanException {
        ASTParser parser = ASTParser.newParser(AST.JLS21);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(false);
        parser.setStatementsRecovery(false);

        Map<String, String> options = new HashMap<>();
        JavaCore.setComplianceOptions(JavaCore.VERSION_21, options);
        parser.setCompilerOptions(options);

        int slash = path.lastIndexOf('/');
        parser.setUnitName(slash >= 0 ? path.substring(slash + 1) : path);
        parser.setSource(content.toCharArray());
        try {
            return (CompilationUnit) parser.createAST(null);
        } catch (RuntimeException e) {
            throw new ScanException("JDT failed to parse " + path + ": " + e.getMessage(), e);
        }
    }
}
