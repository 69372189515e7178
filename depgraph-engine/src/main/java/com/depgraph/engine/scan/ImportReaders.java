package com.depgraph.engine.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-language extraction of import targets. Readers are stateful (multi-line import forms) and
 * a fresh one is created for every scanned file.
 */
final class ImportReaders {

    /** Reads one comment-free line, appending the dotted names it imports. */
    interface ImportReader {
        void read(String line, List<String> targets);
    }

    private static final Pattern PY_FROM = Pattern.compile("^from\\s+([\\w.]+)\\s+import\\s+(.*)$");
    private static final Pattern PY_IMPORT = Pattern.compile("^import\\s+(.*)$");
    private static final Pattern AS = Pattern.compile("\\s+as\\s+");

    private static final Pattern JS_FROM = Pattern.compile("\\bimport\\s+(.+?)\\s+from\\s+[\"']([^\"']+)[\"']");
    private static final Pattern JS_BARE = Pattern.compile("^\\s*import\\s+[\"']([^\"']+)[\"']");
    private static final Pattern JS_REQUIRE = Pattern.compile("\\brequire\\(\\s*[\"']([^\"']+)[\"']\\s*\\)");

    private static final Pattern GO_SINGLE = Pattern.compile("^import\\s+(?:[\\w.]+\\s+)?\"([^\"]+)\"");
    private static final Pattern GO_BLOCK_START = Pattern.compile("^import\\s*\\(\\s*$");
    private static final Pattern GO_BLOCK_ENTRY = Pattern.compile("^(?:[\\w.]+\\s+)?\"([^\"]+)\"");

    private static final Pattern RUST_USE = Pattern.compile("^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?use\\s+(.+?)\\s*;");
    private static final Pattern RUST_USE_START = Pattern.compile("^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?use\\b");

    private ImportReaders() {}

    static Supplier<ImportReader> python() {
        return () -> new ImportReader() {
            private String openModule;

            @Override
            public void read(String line, List<String> targets) {
                String t = line.trim();
                if (openModule != null) {
                    boolean closes = t.contains(")");
                    addNames(openModule, t.replace(")", ""), targets);
                    if (closes) openModule = null;
                    return;
                }
                Matcher from = PY_FROM.matcher(t);
                if (from.find()) {
                    String module = from.group(1);
                    String names = from.group(2).trim();
                    if (names.startsWith("(")) {
                        names = names.substring(1);
                        if (!names.contains(")")) openModule = module;
                        names = names.replace(")", "");
                    }
                    addNames(module, names, targets);
                    return;
                }
                Matcher plain = PY_IMPORT.matcher(t);
                if (plain.find()) {
                    for (String part : plain.group(1).split(",")) {
                        String name = AS.split(part.trim())[0].trim();
                        if (!name.isEmpty()) targets.add(name);
                    }
                }
            }

            private void addNames(String module, String names, List<String> targets) {
                for (String part : names.split(",")) {
                    String name = AS.split(part.trim())[0].replace("\\", "").trim();
                    if (name.isEmpty() || name.equals("*")) continue;
                    targets.add(module + "." + name);
                }
            }
        };
    }

    static Supplier<ImportReader> javascript() {
        return () -> new ImportReader() {
            private StringBuilder buffer;

            @Override
            public void read(String line, List<String> targets) {
                String t = line.trim();
                if (buffer != null) {
                    buffer.append(' ').append(t);
                    if (!t.contains("from")) return;
                    t = buffer.toString();
                    buffer = null;
                } else if (t.startsWith("import") && t.contains("{") && !t.contains("}")) {
                    buffer = new StringBuilder(t);
                    return;
                }

                Matcher from = JS_FROM.matcher(t);
                if (from.find()) {
                    addClause(from.group(1), from.group(2), targets);
                    return;
                }
                Matcher bare = JS_BARE.matcher(t);
                if (bare.find()) {
                    targets.add(bare.group(1));
                    return;
                }
                Matcher require = JS_REQUIRE.matcher(t);
                while (require.find()) {
                    targets.add(require.group(1));
                }
            }

            private void addClause(String clause, String module, List<String> targets) {
                String c = clause.trim();
                if (c.startsWith("type ")) c = c.substring(5).trim();
                int brace = c.indexOf('{');
                String defaultPart = brace >= 0 ? c.substring(0, brace) : c;
                if (!defaultPart.replace(",", "").isBlank()) {
                    targets.add(module);
                }
                if (brace >= 0) {
                    int close = c.indexOf('}', brace);
                    String named = c.substring(brace + 1, close < 0 ? c.length() : close);
                    for (String part : named.split(",")) {
                        String name = AS.split(part.trim())[0].trim();
                        if (name.startsWith("type ")) name = name.substring(5).trim();
                        if (!name.isEmpty()) targets.add(module + "." + name);
                    }
                }
            }
        };
    }

    static Supplier<ImportReader> go() {
        return () -> new ImportReader() {
            private boolean inBlock;

            @Override
            public void read(String line, List<String> targets) {
                String t = line.trim();
                if (inBlock) {
                    if (t.startsWith(")")) {
                        inBlock = false;
                        return;
                    }
                    Matcher entry = GO_BLOCK_ENTRY.matcher(t);
                    if (entry.find()) targets.add(entry.group(1));
                    return;
                }
                if (GO_BLOCK_START.matcher(t).find()) {
                    inBlock = true;
                    return;
                }
                Matcher single = GO_SINGLE.matcher(t);
                if (single.find()) targets.add(single.group(1));
            }
        };
    }

    static Supplier<ImportReader> rust() {
        return () -> new ImportReader() {
            private StringBuilder buffer;

            @Override
            public void read(String line, List<String> targets) {
                String t = line;
                if (buffer != null) {
                    buffer.append(' ').append(line.trim());
                    if (!line.contains(";")) return;
                    t = buffer.toString();
                    buffer = null;
                } else if (RUST_USE_START.matcher(line).find() && !line.contains(";")) {
                    buffer = new StringBuilder(line.trim());
                    return;
                }
                Matcher use = RUST_USE.matcher(t);
                if (use.find()) expand("", use.group(1).replaceAll("\\s*(::|\\{|\\}|,)\\s*", "$1"), targets);
            }

            private void expand(String prefix, String tree, List<String> targets) {
                int brace = tree.indexOf('{');
                if (brace < 0) {
                    String path = tree;
                    int as = path.indexOf(" as ");
                    if (as >= 0) path = path.substring(0, as);
                    if (path.endsWith("*")) return;
                    if (path.equals("self")) path = "";
                    String full = prefix.isEmpty() ? path : path.isEmpty() ? prefix : prefix + "::" + path;
                    if (!full.isEmpty()) targets.add(full.replace("::", "."));
                    return;
                }
                String head = tree.substring(0, brace);
                if (head.endsWith("::")) head = head.substring(0, head.length() - 2);
                String nested = prefix.isEmpty() ? head : prefix + "::" + head;
                int close = tree.lastIndexOf('}');
                String inner = tree.substring(brace + 1, close < 0 ? tree.length() : close);
                for (String item : splitTopLevel(inner)) {
                    if (!item.isBlank()) expand(nested, item.trim(), targets);
                }
            }
        };
    }

    private static List<String> splitTopLevel(String s) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '{') depth++;
            else if (c == '}') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }
}
