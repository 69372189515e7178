package com.depgraph.engine.scan;

import com.depgraph.engine.graph.ReferenceForm;
import com.depgraph.engine.graph.RelationKind;
import com.depgraph.engine.graph.SymbolIds;
import com.depgraph.engine.scan.ImportReaders.ImportReader;
import com.depgraph.engine.scan.LineMasker.MaskedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented scanner for languages without a bundled parser. Each language is described by a
 * {@link Dialect}: declaration patterns, block structure (indentation or braces), import forms and
 * the idioms that make a call dynamic.
 *
 * <p>Comments and string contents are masked before matching. Block structure is tracked with a
 * scope stack so that every reference is attributed to its enclosing declaration and marked
 * conditional when it sits inside a branch of that declaration.
 */
public class PatternSourceScanner implements SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(PatternSourceScanner.class);

    enum Scoping { INDENT, BRACES }

    /**
     * A declaration form. Group indexes of 0 mean "not captured"; without a params group the
     * match must end just after the opening parenthesis of the parameter list.
     */
    record DeclPattern(Pattern pattern, int nameGroup, int typeGroup, int aliasGroup, int paramsGroup,
                       boolean insideClassOnly) {

        static DeclPattern of(String regex) {
            return new DeclPattern(Pattern.compile(regex), 1, 0, 0, 0, false);
        }
    }

    /** Names a target inside a string; {@code kind} is CALL or IMPORT. */
    record DynamicPattern(Pattern pattern, RelationKind kind) {
        static DynamicPattern call(String regex) {
            return new DynamicPattern(Pattern.compile(regex), RelationKind.CALL);
        }
    }

    /** Language description. Fields are filled in by the factory methods below. */
    static final class Dialect {
        final String language;
        final Set<String> extensions;
        final Scoping scoping;

        String lineComment = "//";
        boolean blockComments = true;
        boolean tripleQuotes = false;
        String quotes = "\"'";
        String multilineQuotes = "";
        boolean rustCharLiterals = false;

        List<DeclPattern> declarations = List.of();
        List<Pattern> classes = List.of();
        Pattern conditionalHeader;
        Set<String> alwaysConditional = Set.of("else", "elif", "case", "default", "except", "catch");
        List<String> shortCircuit = List.of("&&", "||");
        boolean inlineIfElse = false;

        Set<String> selfWords = Set.of("this");
        Pattern implicitParam;
        boolean angleGenerics = false;
        boolean arrowFunctions = false;
        String constructorName;
        boolean newKeyword = false;
        boolean bareUppercaseIsConstructor = false;

        List<DynamicPattern> dynamics = List.of();
        Supplier<ImportReader> imports;
        boolean importsFromCode = false;

        Dialect(String language, Scoping scoping, String... extensions) {
            this.language = language;
            this.scoping = scoping;
            this.extensions = Set.of(extensions);
        }
    }

    private static final Pattern CALL = Pattern.compile("(?<![\\w$])([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Pattern IDENT_CHAIN =
            Pattern.compile("[A-Za-z_$][\\w$]*(?:\\s*(?:\\.|::)\\s*[A-Za-z_$][\\w$]*)*");

    private static final Set<String> KEYWORDS = Set.of(
            "if", "elif", "else", "for", "while", "switch", "catch", "return", "function", "def", "fn",
            "func", "and", "or", "not", "in", "is", "with", "assert", "yield", "typeof", "sizeof", "new",
            "super", "lambda", "del", "except", "raise", "throw", "case", "import", "from", "async", "await",
            "defer", "void", "class", "struct", "enum", "trait", "interface", "impl", "dyn", "unsafe");

    private static final Set<String> COMPOSE_ALL = Set.of("compose", "pipe", "flow");
    private static final Set<String> COMPOSE_FIRST = Set.of("partial", "map", "filter", "reduce", "then",
            "forEach", "flatMap", "sorted");
    private static final Set<String> LITERALS = Set.of("true", "false", "null", "undefined", "None", "True",
            "False", "self", "this", "nil", "cls");

    private static final int MAX_CONTINUATION_LINES = 50;

    private final Dialect dialect;

    PatternSourceScanner(Dialect dialect) {
        this.dialect = dialect;
    }

    // -----------------------------------------------------------------------
    // Languages
    // -----------------------------------------------------------------------

    public static PatternSourceScanner python() {
        Dialect d = new Dialect("python", Scoping.INDENT, "py", "pyi");
        d.lineComment = "#";
        d.blockComments = false;
        d.tripleQuotes = true;
        d.declarations = List.of(
                DeclPattern.of("^\\s*(?:async\\s+)?def\\s+(\\w+)\\s*\\("),
                new DeclPattern(Pattern.compile("^\\s*(\\w+)\\s*=\\s*lambda\\b([^:]*):"), 1, 0, 0, 2, false));
        d.classes = List.of(Pattern.compile("^\\s*class\\s+(\\w+)"));
        d.conditionalHeader = Pattern.compile("^\\s*(if|elif|else|except|match|case)\\b");
        d.shortCircuit = List.of(" and ", " or ");
        d.inlineIfElse = true;
        d.selfWords = Set.of("self", "cls");
        d.implicitParam = Pattern.compile("(?:self|cls)\\s*(?::.*)?");
        d.constructorName = "__init__";
        d.bareUppercaseIsConstructor = true;
        d.dynamics = List.of(
                DynamicPattern.call("\\bgetattr\\(\\s*[^,]+,\\s*[\"'](\\w+)[\"']"),
                DynamicPattern.call("\\bglobals\\(\\)\\s*\\[\\s*[\"'](\\w+)[\"']\\s*\\]"),
                DynamicPattern.call("\\b(?:eval|exec)\\(\\s*[\"'](\\w+)\\s*\\("),
                new DynamicPattern(Pattern.compile("\\bimportlib\\.import_module\\(\\s*[\"']([\\w.]+)[\"']"),
                        RelationKind.IMPORT),
                new DynamicPattern(Pattern.compile("\\b__import__\\(\\s*[\"']([\\w.]+)[\"']"), RelationKind.IMPORT));
        d.imports = ImportReaders.python();
        d.importsFromCode = true;
        return new PatternSourceScanner(d);
    }

    public static PatternSourceScanner javascript() {
        return new PatternSourceScanner(ecmascript(new Dialect("javascript", Scoping.BRACES, "js", "jsx", "mjs", "cjs"),
                "(?:\\s*:\\s*[^=]+)?"));
    }

    public static PatternSourceScanner typescript() {
        Dialect d = ecmascript(new Dialect("typescript", Scoping.BRACES, "ts", "tsx", "mts", "cts"),
                "(?:\\s*:\\s*[^=]+)?");
        d.angleGenerics = true;
        return new PatternSourceScanner(d);
    }

    private static Dialect ecmascript(Dialect d, String typeAnnotation) {
        d.multilineQuotes = "`";
        d.arrowFunctions = true;
        d.declarations = List.of(
                DeclPattern.of("(?<![\\w$.])function\\s*\\*?\\s+([\\w$]+)\\s*(?:<[^>(]*>)?\\s*\\("),
                DeclPattern.of("(?<![\\w$.])(?:const|let|var)\\s+([\\w$]+)" + typeAnnotation
                        + "\\s*=\\s*(?:async\\s+)?function\\b[^(]*\\("),
                DeclPattern.of("(?<![\\w$.])(?:const|let|var)\\s+([\\w$]+)" + typeAnnotation
                        + "\\s*=\\s*(?:async\\s+)?(?:<[^>(]*>)?\\s*\\((?=[^)]*\\)\\s*(?::[^=]+)?=>|[^)]*$)"),
                new DeclPattern(Pattern.compile("(?<![\\w$.])(?:const|let|var)\\s+([\\w$]+)" + typeAnnotation
                        + "\\s*=\\s*(?:async\\s+)?([\\w$]+)\\s*=>"), 1, 0, 0, 2, false),
                new DeclPattern(Pattern.compile("^\\s*(?:(?:static|readonly|private|public|protected|override)\\s+)*"
                        + "(#?[\\w$]+)\\s*(?:\\?)?" + typeAnnotation + "\\s*=\\s*(?:async\\s+)?\\("), 1, 0, 0, 0, true),
                new DeclPattern(Pattern.compile("^\\s*(?:(?:public|private|protected|static|readonly|async|override"
                        + "|abstract|get|set)\\s+)*\\*?(#?[\\w$]+)\\s*(?:<[^>(]*>)?\\s*\\("), 1, 0, 0, 0, true));
        d.classes = List.of(Pattern.compile(
                "^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?class\\s+([\\w$]+)"));
        d.conditionalHeader = Pattern.compile("^\\s*(?:\\}\\s*)?(if|else|switch|case|default|catch)\\b");
        d.shortCircuit = List.of("&&", "||", "?");
        d.selfWords = Set.of("this");
        d.constructorName = "constructor";
        d.newKeyword = true;
        d.dynamics = List.of(
                DynamicPattern.call("\\[\\s*[\"'`]([\\w$]+)[\"'`]\\s*\\]\\s*\\("),
                DynamicPattern.call("\\beval\\(\\s*[\"'`]([\\w$]+)\\s*\\("),
                new DynamicPattern(Pattern.compile("\\bimport\\(\\s*[\"'`]([^\"'`]+)[\"'`]\\s*\\)"), RelationKind.IMPORT));
        d.imports = ImportReaders.javascript();
        return d;
    }

    public static PatternSourceScanner go() {
        Dialect d = new Dialect("go", Scoping.BRACES, "go");
        d.multilineQuotes = "`";
        d.declarations = List.of(new DeclPattern(Pattern.compile(
                "^\\s*func\\s+(?:\\(\\s*(?:(\\w+)\\s+)?\\*?\\s*(\\w+)(?:\\[[^\\]]*\\])?\\s*\\)\\s*)?(\\w+)"
                        + "\\s*(?:\\[[^\\]]*\\])?\\s*\\("), 3, 2, 1, 0, false));
        d.conditionalHeader = Pattern.compile("^\\s*(?:\\}\\s*)?(if|else|switch|select|case|default)\\b");
        d.selfWords = Set.of();
        d.dynamics = List.of(DynamicPattern.call("\\bMethodByName\\(\\s*\"(\\w+)\"\\s*\\)"));
        d.imports = ImportReaders.go();
        return new PatternSourceScanner(d);
    }

    public static PatternSourceScanner rust() {
        Dialect d = new Dialect("rust", Scoping.BRACES, "rs");
        d.quotes = "\"";
        d.rustCharLiterals = true;
        d.declarations = List.of(DeclPattern.of(
                "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:default\\s+)?(?:const\\s+)?(?:async\\s+)?(?:unsafe\\s+)?"
                        + "(?:extern\\s+\"[^\"]*\"\\s+)?fn\\s+(\\w+)\\s*(?:<[^(]*>)?\\s*\\("));
        d.classes = List.of(
                Pattern.compile("^\\s*(?:unsafe\\s+)?impl(?:\\s*<[^>]*>)?\\s+(?:[\\w:]+(?:<[^>]*>)?\\s+for\\s+)?(?:[\\w]+::)*(\\w+)"),
                Pattern.compile("^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:unsafe\\s+)?trait\\s+(\\w+)"));
        d.conditionalHeader = Pattern.compile("^\\s*(?:\\}\\s*)?(if|else|match)\\b");
        d.selfWords = Set.of("self", "Self");
        d.implicitParam = Pattern.compile("&?\\s*(?:'\\w+\\s+)?(?:mut\\s+)?self\\b.*");
        d.angleGenerics = true;
        d.imports = ImportReaders.rust();
        d.importsFromCode = true;
        return new PatternSourceScanner(d);
    }

    // -----------------------------------------------------------------------
    // SourceScanner
    // -----------------------------------------------------------------------

    @Override
    public String language() {
        return dialect.language;
    }

    @Override
    public Set<String> fileExtensions() {
        return dialect.extensions;
    }

    @Override
    public ScanResult scan(String path, String content) throws ScanException {
        if (content.indexOf('\0') >= 0) {
            throw new ScanException(path + ": binary content");
        }
        return new FileWalk(path, content).run();
    }

    // -----------------------------------------------------------------------
    // Per-file walk
    // -----------------------------------------------------------------------

    private enum ScopeKind { FUNCTION, CLASS, CONDITIONAL, BLOCK }

    private static final class Scope {
        final ScopeKind kind;
        final String name;
        final int arity;
        final String typeName;
        final String selfAlias;
        final int indent;
        // A brace opens this scope only at or after this position.
        int attachLine;
        int attachCol;
        boolean owns;
        boolean arrow;

        Scope(ScopeKind kind, String name, int arity, String typeName, String selfAlias, int indent) {
            this.kind = kind;
            this.name = name;
            this.arity = arity;
            this.typeName = typeName;
            this.selfAlias = selfAlias;
            this.indent = indent;
        }

        static Scope block() {
            return new Scope(ScopeKind.BLOCK, null, 0, null, null, 0);
        }
    }

    /** Header recognised at the start of a line. */
    private static final class Header {
        int nameLine = -1;
        int nameCol = -1;
        boolean conditional;
        boolean wholeLine;
        int bodyStart;
        Scope scope;
    }

    private record Receiver(String name, boolean present, boolean optional) {
        static final Receiver NONE = new Receiver(null, false, false);
    }

    private record Balanced(String text, int endLine, int endCol) {}

    private final class FileWalk {

        private final String path;
        private final String[] raw;
        private final MaskedLine[] lines;

        private final Map<String, SymbolDraft> symbols = new LinkedHashMap<>();
        private final List<ReferenceDraft> references = new ArrayList<>();
        private final Deque<Scope> stack = new ArrayDeque<>();
        private final ImportReader importReader;

        private Scope pending;
        private int pendingSince;
        private int lastCodeLine;
        private int parenDepth;
        private boolean backslashContinuation;

        FileWalk(String path, String content) throws ScanException {
            this.path = path;
            this.raw = content.split("\r?\n", -1);
            this.lines = new MaskedLine[raw.length];
            LineMasker masker = new LineMasker(dialect.lineComment, dialect.blockComments, dialect.tripleQuotes,
                    dialect.quotes, dialect.multilineQuotes, dialect.rustCharLiterals);
            for (int i = 0; i < raw.length; i++) {
                lines[i] = masker.mask(raw[i]);
            }
            if (masker.unterminated() != null) {
                throw new ScanException(path + ": unterminated " + masker.unterminated() + " at end of file");
            }
            this.importReader = dialect.imports != null ? dialect.imports.get() : null;
        }

        ScanResult run() throws ScanException {
            for (int i = 0; i < lines.length; i++) {
                processLine(i);
            }
            if (dialect.scoping == Scoping.BRACES) {
                if (!stack.isEmpty()) {
                    throw new ScanException(path + ": " + stack.size() + " unclosed '{' at end of file");
                }
                dropPending(lastCodeLine);
            } else {
                while (!stack.isEmpty()) close(stack.pop(), lastCodeLine);
            }
            return new ScanResult(dialect.language, new ArrayList<>(symbols.values()), references);
        }

        private void processLine(int i) throws ScanException {
            String code = lines[i].code();
            if (code.isBlank()) return;
            int lineNo = i + 1;

            boolean continuation = dialect.scoping == Scoping.INDENT && (parenDepth > 0 || backslashContinuation);
            boolean lineConditional = false;

            if (dialect.scoping == Scoping.INDENT && !continuation) {
                int indent = indentOf(code);
                while (!stack.isEmpty() && stack.peek().indent >= indent) {
                    close(stack.pop(), lastCodeLine);
                }
            }
            if (dialect.scoping == Scoping.BRACES && pending != null && pendingSince < i
                    && pending.kind == ScopeKind.CONDITIONAL && !code.trim().startsWith("{")) {
                // Brace-less branch body on the line after its header.
                lineConditional = true;
                pending = null;
            }
            lastCodeLine = lineNo;

            Header header = continuation ? null : matchHeader(i, code);
            if (header != null && header.wholeLine) lineConditional = true;

            if (importReader != null) {
                List<String> targets = new ArrayList<>();
                importReader.read(dialect.importsFromCode ? code : lines[i].text(), targets);
                for (String target : targets) {
                    addReference(i, 0, target, -1, RelationKind.IMPORT,
                            formAt(i, 0, header, lineConditional, -1));
                }
            }

            scanCalls(i, code, header, lineConditional);
            scanDynamics(i);

            if (dialect.scoping == Scoping.BRACES) {
                walkBraces(i, code);
            } else {
                for (char c : code.toCharArray()) {
                    if (c == '(' || c == '[' || c == '{') parenDepth++;
                    else if (c == ')' || c == ']' || c == '}') parenDepth = Math.max(0, parenDepth - 1);
                }
                backslashContinuation = code.stripTrailing().endsWith("\\");
            }
        }

        // --- headers ---

        private Header matchHeader(int i, String code) {
            for (Pattern classPattern : dialect.classes) {
                Matcher m = classPattern.matcher(code);
                if (m.find()) {
                    Header h = new Header();
                    h.nameLine = i;
                    h.nameCol = m.start(1);
                    Scope scope = new Scope(ScopeKind.CLASS, m.group(1), 0, null, null, indentOf(code));
                    open(scope, i, m.end());
                    h.scope = scope;
                    return h;
                }
            }

            boolean inClass = currentFunction() == null && innermostIsClass();
            for (DeclPattern decl : dialect.declarations) {
                if (decl.insideClassOnly() && !inClass) continue;
                Matcher m = decl.pattern().matcher(code);
                if (!m.find()) continue;
                if (decl.insideClassOnly() && KEYWORDS.contains(m.group(decl.nameGroup()))) continue;
                return declare(i, code, decl, m);
            }

            if (dialect.conditionalHeader != null) {
                Matcher m = dialect.conditionalHeader.matcher(code);
                if (m.find()) {
                    String keyword = m.group(1);
                    if (dialect.scoping == Scoping.INDENT && (keyword.equals("match") || keyword.equals("case"))
                            && !code.stripTrailing().endsWith(":")) {
                        return null;
                    }
                    Header h = new Header();
                    h.conditional = true;
                    h.wholeLine = dialect.alwaysConditional.contains(keyword);
                    h.bodyStart = bodyStart(code, m.end(1));
                    Scope scope = new Scope(ScopeKind.CONDITIONAL, keyword, 0, null, null, indentOf(code));
                    open(scope, i, m.end(1));
                    h.scope = scope;
                    return h;
                }
            }
            return null;
        }

        private Header declare(int i, String code, DeclPattern decl, Matcher m) {
            String name = m.group(decl.nameGroup());
            String typeName = decl.typeGroup() > 0 ? m.group(decl.typeGroup()) : null;
            String alias = decl.aliasGroup() > 0 ? m.group(decl.aliasGroup()) : null;

            String params;
            int endLine;
            int endCol;
            if (decl.paramsGroup() > 0) {
                params = m.group(decl.paramsGroup()) == null ? "" : m.group(decl.paramsGroup());
                endLine = i;
                endCol = m.end();
            } else {
                Balanced b = balanced(i, m.end() - 1);
                if (b == null) {
                    params = code.substring(m.end());
                    endLine = i;
                    endCol = code.length();
                } else {
                    params = b.text();
                    endLine = b.endLine();
                    endCol = b.endCol();
                }
            }

            int arity = countParams(params);
            String owner = typeName != null ? typeName : classChain();
            String fullName = owner != null ? owner + "." + name : name;
            int lineNo = i + 1;

            Scope scope = new Scope(ScopeKind.FUNCTION, fullName, arity, typeName != null ? typeName : owner,
                    alias, indentOf(code));
            String key = fullName + "/" + arity;
            if (symbols.containsKey(key)) {
                log.warn("{}: duplicate declaration of {} at line {}; keeping the first", path, key, lineNo);
            } else {
                String signature = fullName + "(" + params.replaceAll("\\s+", " ").trim() + ")";
                symbols.put(key, new SymbolDraft(fullName, signature, arity, lineNo, lineNo));
                scope.owns = true;
            }
            String tail = lines[endLine].code().substring(Math.min(endCol, lines[endLine].code().length()));
            scope.arrow = dialect.arrowFunctions && (tail.contains("=>") || m.group().contains("=>"));
            open(scope, endLine, endCol);

            Header h = new Header();
            h.nameLine = i;
            h.nameCol = m.start(decl.nameGroup());
            h.scope = scope;
            return h;
        }

        private void open(Scope scope, int line, int col) {
            if (dialect.scoping == Scoping.INDENT) {
                stack.push(scope);
                return;
            }
            if (pending != null) dropPending(pendingSince + 1);
            scope.attachLine = line;
            scope.attachCol = col;
            pending = scope;
            pendingSince = line;
        }

        private int bodyStart(String code, int afterKeyword) {
            if (dialect.scoping == Scoping.INDENT) {
                int depth = 0;
                for (int c = afterKeyword; c < code.length(); c++) {
                    char ch = code.charAt(c);
                    if (ch == '(' || ch == '[' || ch == '{') depth++;
                    else if (ch == ')' || ch == ']' || ch == '}') depth--;
                    else if (ch == ':' && depth == 0) return c + 1;
                }
                return code.length();
            }
            int next = afterKeyword;
            while (next < code.length() && Character.isWhitespace(code.charAt(next))) next++;
            if (next < code.length() && code.charAt(next) == '(') {
                int close = matchingParen(code, next);
                if (close >= 0) return close + 1;
            }
            int brace = code.indexOf('{', afterKeyword);
            return brace >= 0 ? brace : code.length();
        }

        // --- braces ---

        private void walkBraces(int i, String code) throws ScanException {
            int lineNo = i + 1;
            for (int col = 0; col < code.length(); col++) {
                char c = code.charAt(col);
                if (c == '{') {
                    if (pending != null && atOrAfter(i, col, pending.attachLine, pending.attachCol)) {
                        stack.push(pending);
                        pending = null;
                    } else {
                        stack.push(Scope.block());
                    }
                } else if (c == '}') {
                    if (stack.isEmpty()) {
                        throw new ScanException(path + ":" + lineNo + ": unbalanced '}'");
                    }
                    close(stack.pop(), lineNo);
                } else if (c == ';' && pending != null && atOrAfter(i, col, pending.attachLine, pending.attachCol)) {
                    dropPending(lineNo);
                }
            }

            if (pending == null || pending.attachLine > i) return;
            String tail = code.trim();
            if (pending.kind == ScopeKind.FUNCTION && pending.arrow && !tail.endsWith("=>")) {
                // Expression-bodied arrow function ends with its line.
                dropPending(lineNo);
            } else if (pending.kind == ScopeKind.CONDITIONAL && (tail.endsWith(";") || tail.endsWith("}"))) {
                pending = null;
            } else if (pending.kind == ScopeKind.CLASS && tail.endsWith(";")) {
                pending = null;
            }
        }

        private void dropPending(int lineNo) {
            if (pending != null && pending.kind == ScopeKind.FUNCTION) close(pending, lineNo);
            pending = null;
        }

        private void close(Scope scope, int lineNo) {
            if (scope.kind != ScopeKind.FUNCTION || !scope.owns) return;
            String key = scope.name + "/" + scope.arity;
            SymbolDraft draft = symbols.get(key);
            if (draft != null && lineNo > draft.lineEnd()) {
                symbols.put(key, new SymbolDraft(draft.name(), draft.signature(), draft.arity(),
                        draft.lineStart(), lineNo));
            }
        }

        // --- references ---

        private void scanCalls(int i, String code, Header header, boolean lineConditional) {
            int shortCircuit = firstShortCircuit(code);
            int[] ifElse = dialect.inlineIfElse ? inlineIfElse(code) : null;
            Matcher m = CALL.matcher(code);
            while (m.find()) {
                String name = m.group(1);
                int start = m.start(1);
                if (header != null && header.nameLine == i && header.nameCol == start) continue;
                if (KEYWORDS.contains(name)) continue;

                Receiver receiver = receiverOf(code, start);
                Balanced args = balanced(i, m.end() - 1);
                int arity = args == null ? -1 : countArgs(args.text());
                Scope fn = ownerAt(i, start);
                boolean inlineBranch = ifElse != null && inInlineBranch(code, start, ifElse);
                ReferenceForm form = formAt(i, start, header,
                        lineConditional || receiver.optional() || inlineBranch, shortCircuit);

                String target;
                if (dialect.newKeyword && precededByNew(code, start)) {
                    target = name + "." + dialect.constructorName;
                } else {
                    target = qualify(receiver, name, fn);
                }
                addReference(i, start, target, arity, RelationKind.CALL, form);

                if (args != null && (COMPOSE_ALL.contains(name) || COMPOSE_FIRST.contains(name))) {
                    List<String> parts = splitTopLevel(args.text(), false);
                    int limit = COMPOSE_ALL.contains(name) ? parts.size() : Math.min(1, parts.size());
                    for (int p = 0; p < limit; p++) {
                        String arg = parts.get(p).trim();
                        if (!IDENT_CHAIN.matcher(arg).matches() || LITERALS.contains(arg)) continue;
                        String[] chain = arg.split("\\s*(?:\\.|::)\\s*");
                        String fnName = chain[chain.length - 1];
                        Receiver r = chain.length > 1 ? new Receiver(chain[chain.length - 2], true, false) : Receiver.NONE;
                        addReference(i, start, qualifyReference(r, fnName, fn), -1, RelationKind.COMPOSE, form);
                    }
                }
            }
        }

        private void scanDynamics(int i) {
            String text = lines[i].text();
            for (DynamicPattern dynamic : dialect.dynamics) {
                Matcher m = dynamic.pattern().matcher(text);
                while (m.find()) {
                    addReference(i, m.start(), m.group(1), -1, dynamic.kind(), ReferenceForm.DYNAMIC);
                }
            }
        }

        private void addReference(int i, int col, String target, int arity, RelationKind kind, ReferenceForm form) {
            Scope fn = ownerAt(i, col);
            String caller = fn != null ? fn.name : SymbolIds.MODULE_NAME;
            int callerArity = fn != null ? fn.arity : 0;
            references.add(new ReferenceDraft(caller, callerArity, target, arity, kind, form, i + 1));
        }

        private ReferenceForm formAt(int i, int col, Header header, boolean lineConditional, int shortCircuit) {
            if (lineConditional) return ReferenceForm.CONDITIONAL;
            if (shortCircuit >= 0 && col > shortCircuit) return ReferenceForm.CONDITIONAL;
            boolean inHeaderBody = header != null && header.conditional && col >= header.bodyStart;
            if (inHeaderBody) return ReferenceForm.CONDITIONAL;
            Scope exclude = header != null && header.conditional ? header.scope : null;
            return insideBranch(i, col, exclude) ? ReferenceForm.CONDITIONAL : ReferenceForm.DIRECT;
        }

        /** Whether a conditional scope lies between the position and its enclosing declaration. */
        private boolean insideBranch(int i, int col, Scope exclude) {
            Scope fn = ownerAt(i, col);
            if (fn != null && fn == pending) return false;
            for (Scope s : stack) {
                if (s == fn) return false;
                if (s.kind == ScopeKind.CONDITIONAL && s != exclude) return true;
            }
            return false;
        }

        private Scope ownerAt(int i, int col) {
            if (pending != null && pending.kind == ScopeKind.FUNCTION
                    && atOrAfter(i, col, pending.attachLine, pending.attachCol)) {
                return pending;
            }
            return currentFunction();
        }

        private Scope currentFunction() {
            for (Scope s : stack) {
                if (s.kind == ScopeKind.FUNCTION) return s;
            }
            return null;
        }

        private boolean innermostIsClass() {
            for (Scope s : stack) {
                if (s.kind == ScopeKind.CLASS) return true;
                if (s.kind != ScopeKind.BLOCK) return false;
            }
            return false;
        }

        private String classChain() {
            StringBuilder chain = new StringBuilder();
            Iterator<Scope> outerFirst = stack.descendingIterator();
            while (outerFirst.hasNext()) {
                Scope s = outerFirst.next();
                if (s.kind != ScopeKind.CLASS) continue;
                if (chain.length() > 0) chain.append('.');
                chain.append(s.name);
            }
            return chain.length() == 0 ? null : chain.toString();
        }

        private String currentType(Scope fn) {
            if (fn != null && fn.typeName != null) return fn.typeName;
            return classChain();
        }

        private String qualify(Receiver receiver, String name, Scope fn) {
            if (!receiver.present() && dialect.bareUppercaseIsConstructor && Character.isUpperCase(name.charAt(0))) {
                return name + "." + dialect.constructorName;
            }
            return qualifyReference(receiver, name, fn);
        }

        private String qualifyReference(Receiver receiver, String name, Scope fn) {
            if (!receiver.present() || receiver.name() == null) return name;
            String r = receiver.name();
            if (dialect.selfWords.contains(r) || (fn != null && r.equals(fn.selfAlias))) {
                String type = currentType(fn);
                return type != null ? type + "." + name : name;
            }
            if (Character.isUpperCase(r.charAt(0))) return r + "." + name;
            return name;
        }

        // --- text helpers ---

        private Receiver receiverOf(String code, int start) {
            int j = start - 1;
            while (j >= 0 && Character.isWhitespace(code.charAt(j))) j--;
            if (j < 0) return Receiver.NONE;
            int k;
            boolean optional = false;
            if (code.charAt(j) == '.') {
                optional = j > 0 && code.charAt(j - 1) == '?';
                k = optional ? j - 2 : j - 1;
            } else if (code.charAt(j) == ':' && j > 0 && code.charAt(j - 1) == ':') {
                k = j - 2;
            } else {
                return Receiver.NONE;
            }
            while (k >= 0 && Character.isWhitespace(code.charAt(k))) k--;
            if (k < 0 || !isIdentifierChar(code.charAt(k))) return new Receiver(null, true, optional);
            int end = k + 1;
            while (k >= 0 && isIdentifierChar(code.charAt(k))) k--;
            String name = code.substring(k + 1, end);
            if (Character.isDigit(name.charAt(0))) return new Receiver(null, true, optional);
            return new Receiver(name, true, optional);
        }

        private boolean precededByNew(String code, int start) {
            String before = code.substring(0, start).stripTrailing();
            if (!before.endsWith("new")) return false;
            int k = before.length() - 4;
            return k < 0 || !isIdentifierChar(before.charAt(k));
        }

        private int firstShortCircuit(String code) {
            int first = -1;
            for (String op : dialect.shortCircuit) {
                int at = code.indexOf(op);
                if (at >= 0 && (first < 0 || at < first)) first = at;
            }
            return first;
        }

        /** Columns of {@code if} and {@code else} in an inline {@code a if cond else b}; null if absent. */
        private int[] inlineIfElse(String code) {
            int indent = 0;
            while (indent < code.length() && Character.isWhitespace(code.charAt(indent))) indent++;
            int ifAt = code.indexOf(" if ", indent);
            if (ifAt < 0) return null;
            int elseAt = code.indexOf(" else ", ifAt + 4);
            if (elseAt < 0) return null;
            return new int[] {ifAt + 1, elseAt + 1};
        }

        /**
         * Whether a call is evaluated only on one arm of an inline conditional: after {@code else},
         * or before {@code if} inside the same brackets as the {@code if}.
         */
        private boolean inInlineBranch(String code, int col, int[] ifElse) {
            if (col > ifElse[1]) return true;
            return col < ifElse[0] && depthAt(code, col) == depthAt(code, ifElse[0]);
        }

        private int depthAt(String code, int col) {
            int depth = 0;
            for (int c = 0; c < col && c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '(' || ch == '[' || ch == '{') depth++;
                else if (ch == ')' || ch == ']' || ch == '}') depth--;
            }
            return depth;
        }

        /**
         * Text between the parenthesis at {@code openCol} and its match, following continuation
         * lines; null if it does not close within a bounded number of lines.
         */
        private Balanced balanced(int line, int openCol) {
            StringBuilder text = new StringBuilder();
            int depth = 0;
            int col = openCol;
            for (int l = line; l < lines.length && l <= line + MAX_CONTINUATION_LINES; l++) {
                String code = lines[l].code();
                for (int c = (l == line ? col : 0); c < code.length(); c++) {
                    char ch = code.charAt(c);
                    if (ch == '(' || ch == '[' || ch == '{') {
                        if (depth++ == 0) continue;
                    } else if (ch == ')' || ch == ']' || ch == '}') {
                        if (--depth == 0) return new Balanced(text.toString(), l, c + 1);
                    }
                    text.append(ch);
                }
                text.append(' ');
            }
            return null;
        }

        private int matchingParen(String code, int open) {
            int depth = 0;
            for (int c = open; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '(') depth++;
                else if (ch == ')' && --depth == 0) return c;
            }
            return -1;
        }

        private int countParams(String params) {
            int count = 0;
            boolean first = true;
            for (String segment : splitTopLevel(params, dialect.angleGenerics)) {
                String p = segment.trim();
                if (p.isEmpty()) continue;
                boolean implicit = first && dialect.implicitParam != null && dialect.implicitParam.matcher(p).matches();
                first = false;
                if (implicit) continue;
                if (dialect.scoping == Scoping.INDENT && (p.equals("*") || p.equals("/"))) continue;
                count++;
            }
            return count;
        }

        private int countArgs(String args) {
            int count = 0;
            for (String segment : splitTopLevel(args, false)) {
                if (!segment.isBlank()) count++;
            }
            return count;
        }
    }

    private static List<String> splitTopLevel(String text, boolean angleBrackets) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || (angleBrackets && c == '<')) {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || (angleBrackets && c == '>' && depth > 0)) {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static int indentOf(String line) {
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') column++;
            else if (c == '\t') column += 8 - (column % 8);
            else break;
        }
        return column;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean atOrAfter(int line, int col, int refLine, int refCol) {
        return line > refLine || (line == refLine && col >= refCol);
    }
}
