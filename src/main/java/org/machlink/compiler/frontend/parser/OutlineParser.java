package org.machlink.compiler.frontend.parser;

import org.machlink.compiler.frontend.parser.ast.DefinitionNode;
import org.machlink.compiler.frontend.parser.ast.EdgeNode;
import org.machlink.compiler.frontend.parser.ast.ImportStatement;
import org.machlink.compiler.frontend.parser.ast.ImportedSymbol;
import org.machlink.compiler.frontend.parser.ast.MachineNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented parser for the structural outline of a machine file: the title, imports,
 * named (nested) definitions, attributes and edges. Definition bodies beyond
 * {@code key: value} attributes are not interpreted.
 *
 * <p>Accepted statements:
 * <pre>
 * machine "Title"
 * import { Start, Process as P, Group.Child } from "./lib.dygram"
 * state Start "Start State"
 * task Process {
 *     prompt: "do it"
 *     state Inner
 * }
 * Start -&gt; Process --&gt; End
 * </pre>
 * Statements are separated by newlines or {@code ;}; {@code //} starts a comment.</p>
 */
public final class OutlineParser implements ModuleParser {

    private static final String NAME = "[A-Za-z_][\\w]*";
    private static final String QUALIFIED_NAME = NAME + "(?:\\." + NAME + ")*";

    private static final Pattern MACHINE_PATTERN = Pattern.compile(
            "^machine\\s+\"([^\"]*)\"$");
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^import\\s*\\{([^}]*)\\}\\s*from\\s*\"([^\"]*)\"\\s*;?$");
    private static final Pattern SYMBOL_PATTERN = Pattern.compile(
            "^(" + QUALIFIED_NAME + ")(?:\\s+as(?:\\s+(\\S*))?)?$");
    private static final Pattern DEFINITION_PATTERN = Pattern.compile(
            "^(?:(" + NAME + ")\\s+)?(" + NAME + ")(?:\\s+\"([^\"]*)\")?$");
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile(
            "^(" + NAME + ")\\s*:\\s*(.*)$");
    private static final Pattern ARROW_PATTERN = Pattern.compile("-->|->|=>");
    private static final Pattern QUOTED_PATTERN = Pattern.compile("\"[^\"]*\"");
    private static final Pattern ENDPOINT_PATTERN = Pattern.compile("^" + QUALIFIED_NAME + "$");

    @Override
    public MachineNode parse(String content, String sourceFile) throws SyntaxException {
        return new Run(sourceFile).parse(content);
    }

    /**
     * Mutable definition under construction.
     */
    private static final class DefinitionBuilder {
        private final String name;
        private final String type;
        private final String title;
        private final String containerPath;
        private final int line;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<DefinitionBuilder> children = new ArrayList<>();
        private final List<EdgeNode> edges = new ArrayList<>();

        DefinitionBuilder(String name, String type, String title, String containerPath, int line) {
            this.name = name;
            this.type = type;
            this.title = title;
            this.containerPath = containerPath;
            this.line = line;
        }

        String qualifiedName() {
            return containerPath == null ? name : containerPath + "." + name;
        }

        DefinitionNode build(String sourceFile) {
            List<DefinitionNode> built = new ArrayList<>(children.size());
            for (DefinitionBuilder child : children) {
                built.add(child.build(sourceFile));
            }
            return new DefinitionNode(name, type, title, attributes, built, edges, containerPath, sourceFile, line);
        }
    }

    /**
     * State of a single parse.
     */
    private static final class Run {
        private final String sourceFile;
        private final Deque<DefinitionBuilder> open = new ArrayDeque<>();
        private final List<ImportStatement> imports = new ArrayList<>();
        private final Map<String, String> machineAttributes = new LinkedHashMap<>();
        private final List<DefinitionBuilder> definitions = new ArrayList<>();
        private final List<EdgeNode> edges = new ArrayList<>();
        private String title;
        private DefinitionBuilder lastDefinition;

        Run(String sourceFile) {
            this.sourceFile = sourceFile;
        }

        MachineNode parse(String content) throws SyntaxException {
            String[] lines = content.split("\\r?\\n", -1);
            for (int i = 0; i < lines.length; i++) {
                int lineNumber = i + 1;
                String line = stripComment(lines[i]).trim();
                if (line.isEmpty()) continue;

                if (line.startsWith("import") && (line.length() == 6 || !Character.isJavaIdentifierPart(line.charAt(6)))) {
                    parseImport(line, lineNumber);
                    continue;
                }
                for (String statement : splitStatements(line, lineNumber)) {
                    parseStatement(statement, lineNumber);
                }
            }
            if (!open.isEmpty()) {
                DefinitionBuilder unclosed = open.peek();
                throw new SyntaxException("Unclosed block for '" + unclosed.name + "'.", sourceFile, unclosed.line);
            }

            List<DefinitionNode> built = new ArrayList<>(definitions.size());
            for (DefinitionBuilder definition : definitions) {
                built.add(definition.build(sourceFile));
            }
            return new MachineNode(title, imports, machineAttributes, built, edges, sourceFile);
        }

        private void parseImport(String line, int lineNumber) throws SyntaxException {
            if (!open.isEmpty()) {
                throw new SyntaxException("Imports are only allowed at the top level.", sourceFile, lineNumber);
            }
            Matcher matcher = IMPORT_PATTERN.matcher(line);
            if (!matcher.matches()) {
                throw new SyntaxException("Malformed import statement: " + line, sourceFile, lineNumber);
            }
            List<ImportedSymbol> symbols = new ArrayList<>();
            for (String entry : matcher.group(1).split(",")) {
                String trimmed = entry.trim();
                if (trimmed.isEmpty()) continue;
                Matcher symbolMatcher = SYMBOL_PATTERN.matcher(trimmed);
                if (!symbolMatcher.matches()) {
                    throw new SyntaxException("Malformed imported symbol: " + trimmed, sourceFile, lineNumber);
                }
                String alias = symbolMatcher.group(2);
                if (alias == null && trimmed.matches(".*\\sas$")) {
                    alias = "";
                }
                symbols.add(new ImportedSymbol(symbolMatcher.group(1), alias, sourceFile, lineNumber));
            }
            imports.add(new ImportStatement(matcher.group(2), symbols, sourceFile, lineNumber));
            lastDefinition = null;
        }

        private void parseStatement(String statement, int lineNumber) throws SyntaxException {
            if (statement.equals("{")) {
                if (lastDefinition == null) {
                    throw new SyntaxException("Block without a preceding definition.", sourceFile, lineNumber);
                }
                open.push(lastDefinition);
                lastDefinition = null;
                return;
            }
            if (statement.equals("}")) {
                if (open.isEmpty()) {
                    throw new SyntaxException("Unbalanced '}'.", sourceFile, lineNumber);
                }
                open.pop();
                lastDefinition = null;
                return;
            }
            lastDefinition = null;

            Matcher machineMatcher = MACHINE_PATTERN.matcher(statement);
            if (machineMatcher.matches() && open.isEmpty()) {
                title = machineMatcher.group(1);
                return;
            }

            Matcher attributeMatcher = ATTRIBUTE_PATTERN.matcher(statement);
            if (attributeMatcher.matches()) {
                Map<String, String> target = open.isEmpty() ? machineAttributes : open.peek().attributes;
                target.put(attributeMatcher.group(1), unquote(attributeMatcher.group(2).trim()));
                return;
            }

            // arrows inside titles are text
            if (ARROW_PATTERN.matcher(QUOTED_PATTERN.matcher(statement).replaceAll("\"\"")).find()) {
                parseEdgeChain(statement, lineNumber);
                return;
            }

            Matcher definitionMatcher = DEFINITION_PATTERN.matcher(statement);
            if (definitionMatcher.matches()) {
                DefinitionBuilder parent = open.peek();
                DefinitionBuilder definition = new DefinitionBuilder(
                        definitionMatcher.group(2),
                        definitionMatcher.group(1),
                        definitionMatcher.group(3),
                        parent == null ? null : parent.qualifiedName(),
                        lineNumber);
                if (parent == null) {
                    definitions.add(definition);
                } else {
                    parent.children.add(definition);
                }
                lastDefinition = definition;
                return;
            }

            throw new SyntaxException("Unrecognized statement: " + statement, sourceFile, lineNumber);
        }

        private void parseEdgeChain(String statement, int lineNumber) throws SyntaxException {
            List<String> endpoints = new ArrayList<>();
            List<String> arrows = new ArrayList<>();
            Matcher arrowMatcher = ARROW_PATTERN.matcher(statement);
            int start = 0;
            while (arrowMatcher.find()) {
                endpoints.add(statement.substring(start, arrowMatcher.start()).trim());
                arrows.add(arrowMatcher.group());
                start = arrowMatcher.end();
            }
            endpoints.add(statement.substring(start).trim());

            for (String endpoint : endpoints) {
                if (!ENDPOINT_PATTERN.matcher(endpoint).matches()) {
                    throw new SyntaxException("Malformed edge endpoint '" + endpoint + "'.", sourceFile, lineNumber);
                }
            }
            List<EdgeNode> target = open.isEmpty() ? edges : open.peek().edges;
            for (int i = 0; i < arrows.size(); i++) {
                target.add(new EdgeNode(endpoints.get(i), endpoints.get(i + 1), arrows.get(i), sourceFile, lineNumber));
            }
        }

        /**
         * Splits a line into statements at {@code ;} and around braces, ignoring quoted text.
         */
        private List<String> splitStatements(String line, int lineNumber) throws SyntaxException {
            List<String> statements = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inQuote = false;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (c == '"') {
                    inQuote = !inQuote;
                    current.append(c);
                } else if (!inQuote && (c == ';' || c == '{' || c == '}')) {
                    flush(current, statements);
                    if (c != ';') {
                        statements.add(String.valueOf(c));
                    }
                } else {
                    current.append(c);
                }
            }
            if (inQuote) {
                throw new SyntaxException("Unterminated string literal.", sourceFile, lineNumber);
            }
            flush(current, statements);
            return statements;
        }

        private static void flush(StringBuilder current, List<String> statements) {
            String text = current.toString().trim();
            if (!text.isEmpty()) {
                statements.add(text);
            }
            current.setLength(0);
        }

        private static String stripComment(String line) {
            boolean inQuote = false;
            for (int i = 0; i < line.length() - 1; i++) {
                char c = line.charAt(i);
                if (c == '"') {
                    inQuote = !inQuote;
                } else if (!inQuote && c == '/' && line.charAt(i + 1) == '/') {
                    return line.substring(0, i);
                }
            }
            return line;
        }

        private static String unquote(String value) {
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                return value.substring(1, value.length() - 1);
            }
            return value;
        }
    }
}
