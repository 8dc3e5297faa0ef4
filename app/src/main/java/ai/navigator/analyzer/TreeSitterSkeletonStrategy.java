package ai.navigator.analyzer;

import ai.navigator.exception.ParseException;
import ai.navigator.util.FileUtil;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * Skeleton extraction for every tree-sitter language. The grammar specific knowledge lives in the
 * {@link LanguageSyntaxProfile}; this class only walks the tree and renders.
 */
public final class TreeSitterSkeletonStrategy implements SkeletonStrategy {
    static final int MAX_DOC_LINES = 3;
    private static final int MAX_SIGNATURE_LINES = 4;

    private static final Set<String> IDENTIFIER_NODE_TYPES = Set.of(
            "identifier",
            "type_identifier",
            "field_identifier",
            "property_identifier",
            "private_property_identifier",
            "namespace_identifier",
            "destructor_name",
            "operator_name",
            "constant");

    private static final List<String> NAME_DESCENT_FIELDS = List.of("name", "declarator", "type");

    private final LanguageSyntaxProfile profile;
    private final ThreadLocal<TSParser> parser;

    public TreeSitterSkeletonStrategy(LanguageSyntaxProfile profile) {
        this.profile = profile;
        // TSParser is not thread safe; each worker gets its own
        this.parser = ThreadLocal.withInitial(() -> {
            var p = new TSParser();
            TSLanguage grammar = profile.grammar().get();
            if (!p.setLanguage(grammar)) {
                throw new ParseException("Could not load tree-sitter grammar for " + profile.language());
            }
            return p;
        });
    }

    public LanguageSyntaxProfile profile() {
        return profile;
    }

    @Override
    public Skeleton extract(String fileName, byte[] content) {
        // re-encode so tree-sitter byte offsets line up with our slices even for malformed input
        String source = FileUtil.decodeLenient(content);
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        int totalLines = FileUtil.countLines(bytes);

        TSTree tree = parser.get().parseString(null, source);
        if (tree == null) {
            throw new ParseException("tree-sitter returned no tree for " + fileName);
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new ParseException("tree-sitter returned an empty tree for " + fileName);
        }

        var declarations = new ArrayList<Declaration>();
        collectChildren(root, 0, null, bytes, totalLines, declarations);

        var symbols = declarations.stream().map(Declaration::symbol).toList();
        return new Skeleton(profile.language(), render(fileName, totalLines, declarations), symbols, totalLines);
    }

    private record Declaration(Symbol symbol, String signature, List<String> precedingDoc, List<String> docstring) {}

    private void collectChildren(
            TSNode parent,
            int depth,
            @Nullable String enclosingType,
            byte[] bytes,
            int totalLines,
            List<Declaration> out) {
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (child != null && !child.isNull()) {
                visit(child, depth, enclosingType, bytes, totalLines, out);
            }
        }
    }

    private void visit(
            TSNode node,
            int depth,
            @Nullable String enclosingType,
            byte[] bytes,
            int totalLines,
            List<Declaration> out) {
        TSNode outer = node;
        TSNode decl = unwrap(node);
        if (decl == null) {
            collectChildren(node, depth, enclosingType, bytes, totalLines, out);
            return;
        }

        SymbolKind kind = profile.declarationKinds().get(decl.getType());
        String name = kind != null && accepts(decl) ? resolveName(decl, bytes) : null;
        if (kind == null || name == null) {
            collectChildren(node, depth, enclosingType, bytes, totalLines, out);
            return;
        }

        if ("variable_declarator".equals(decl.getType())) {
            TSNode holder = decl.getParent();
            if (holder != null && !holder.isNull() && holder.getNamedChildCount() == 1 && decl == node) {
                outer = holder;
            }
        }
        if (kind == SymbolKind.FUNCTION && enclosingType != null && profile.classLikeNodeTypes().contains(enclosingType)) {
            kind = SymbolKind.METHOD;
        }

        int startLine = outer.getStartPoint().getRow() + 1;
        int endLine = endLine(outer, totalLines);
        var symbol = new Symbol(name, kind, startLine, Math.max(startLine, endLine), depth);

        TSNode body = bodyOf(decl);
        String signature = signature(outer, body, bytes);
        List<String> precedingDoc = profile.docStyle() == LanguageSyntaxProfile.DocStyle.PRECEDING_COMMENTS
                ? precedingComments(outer, bytes)
                : List.of();
        List<String> docstring = profile.docStyle() == LanguageSyntaxProfile.DocStyle.DOCSTRING && body != null
                ? docstring(body, bytes)
                : List.of();
        out.add(new Declaration(symbol, signature, precedingDoc, docstring));

        collectChildren(body != null ? body : decl, depth + 1, decl.getType(), bytes, totalLines, out);
    }

    /** Follows wrapper nodes (decorators, exports, templates) to the declaration they hold. */
    private @Nullable TSNode unwrap(TSNode node) {
        TSNode current = node;
        while (profile.wrapperFields().containsKey(current.getType())) {
            String field = profile.wrapperFields().get(current.getType());
            TSNode inner = field.isEmpty() ? firstDeclarationChild(current) : current.getChildByFieldName(field);
            if (inner == null || inner.isNull()) {
                return null;
            }
            current = inner;
        }
        return current;
    }

    private @Nullable TSNode firstDeclarationChild(TSNode node) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            String type = child.getType();
            if (profile.declarationKinds().containsKey(type) || profile.wrapperFields().containsKey(type)) {
                return child;
            }
        }
        return null;
    }

    private boolean accepts(TSNode decl) {
        String type = decl.getType();
        if (profile.bodyRequiredNodeTypes().contains(type)) {
            return bodyOf(decl) != null;
        }
        if ("variable_declarator".equals(type)) {
            TSNode value = decl.getChildByFieldName("value");
            return value != null && !value.isNull() && profile.functionValueTypes().contains(value.getType());
        }
        return true;
    }

    private @Nullable TSNode bodyOf(TSNode decl) {
        TSNode target = decl;
        if ("variable_declarator".equals(decl.getType())) {
            target = decl.getChildByFieldName("value");
            if (target == null || target.isNull()) {
                return null;
            }
        }
        TSNode body = target.getChildByFieldName(profile.bodyFieldName());
        return body == null || body.isNull() ? null : body;
    }

    private @Nullable String resolveName(TSNode decl, byte[] bytes) {
        for (String field : profile.nameFields()) {
            TSNode candidate = decl.getChildByFieldName(field);
            String name = identifierIn(candidate, bytes, 0);
            if (name != null) {
                return name;
            }
        }
        // Go type_declaration keeps its name on the nested type_spec
        for (int i = 0; i < decl.getNamedChildCount(); i++) {
            TSNode child = decl.getNamedChild(i);
            TSNode nameNode = child.getChildByFieldName("name");
            String name = identifierIn(nameNode, bytes, 0);
            if (name != null) {
                return name;
            }
        }
        return null;
    }

    private @Nullable String identifierIn(@Nullable TSNode node, byte[] bytes, int level) {
        if (node == null || node.isNull() || level > 6) {
            return null;
        }
        if (IDENTIFIER_NODE_TYPES.contains(node.getType())) {
            return text(node, bytes);
        }
        for (String field : NAME_DESCENT_FIELDS) {
            String name = identifierIn(node.getChildByFieldName(field), bytes, level + 1);
            if (name != null) {
                return name;
            }
        }
        return null;
    }

    private static int endLine(TSNode node, int totalLines) {
        int endRow = node.getEndPoint().getRow();
        int startRow = node.getStartPoint().getRow();
        // a span ending at column 0 ends on the previous line
        if (node.getEndPoint().getColumn() == 0 && endRow > startRow) {
            endRow--;
        }
        return Math.min(endRow + 1, Math.max(totalLines, 1));
    }

    private String signature(TSNode outer, @Nullable TSNode body, byte[] bytes) {
        int start = outer.getStartByte();
        String raw;
        if (body != null && body.getStartByte() > start) {
            raw = slice(bytes, start, body.getStartByte());
        } else {
            raw = slice(bytes, start, outer.getEndByte());
            int brace = raw.indexOf('{');
            if (brace >= 0) {
                raw = raw.substring(0, brace);
            }
        }
        var lines = raw.stripTrailing().split("\n", -1);
        int column = outer.getStartPoint().getColumn();
        var sb = new StringBuilder();
        int limit = Math.min(lines.length, MAX_SIGNATURE_LINES);
        for (int i = 0; i < limit; i++) {
            String line = lines[i].stripTrailing();
            if (i > 0) {
                sb.append('\n');
                line = dedent(line, column);
            }
            sb.append(line);
        }
        if (lines.length > limit) {
            sb.append(" ...");
        }
        return sb.toString();
    }

    private static String dedent(String line, int column) {
        int n = 0;
        while (n < column && n < line.length() && (line.charAt(n) == ' ' || line.charAt(n) == '\t')) {
            n++;
        }
        return line.substring(n);
    }

    private List<String> precedingComments(TSNode outer, byte[] bytes) {
        var comments = new ArrayList<String>();
        int expectedRow = outer.getStartPoint().getRow();
        TSNode prev = outer.getPrevSibling();
        while (prev != null && !prev.isNull() && profile.commentNodeTypes().contains(prev.getType())) {
            if (prev.getEndPoint().getRow() < expectedRow - 1) {
                break;
            }
            comments.add(0, text(prev, bytes));
            expectedRow = prev.getStartPoint().getRow();
            prev = prev.getPrevSibling();
        }
        if (comments.isEmpty()) {
            return List.of();
        }
        var lines = new ArrayList<String>();
        for (String comment : comments) {
            for (String line : comment.split("\n", -1)) {
                lines.add(line.strip());
            }
        }
        return limitDoc(lines, "...");
    }

    private static List<String> docstring(TSNode body, byte[] bytes) {
        if (body.getNamedChildCount() == 0) {
            return List.of();
        }
        TSNode first = body.getNamedChild(0);
        if (!"expression_statement".equals(first.getType()) || first.getNamedChildCount() == 0) {
            return List.of();
        }
        TSNode literal = first.getNamedChild(0);
        if (!"string".equals(literal.getType())) {
            return List.of();
        }
        var lines = new ArrayList<String>();
        for (String line : text(literal, bytes).split("\n", -1)) {
            lines.add(line.strip());
        }
        return limitDoc(lines, "...\"\"\"");
    }

    private static List<String> limitDoc(List<String> lines, String ellipsis) {
        if (lines.size() <= MAX_DOC_LINES) {
            return List.copyOf(lines);
        }
        var limited = new ArrayList<>(lines.subList(0, MAX_DOC_LINES));
        limited.add(ellipsis);
        return List.copyOf(limited);
    }

    private String render(String fileName, int totalLines, List<Declaration> declarations) {
        String cmt = profile.lineComment();
        var sb = new StringBuilder();
        if (declarations.isEmpty()) {
            sb.append("%s %s: no structural elements found (%d lines)\n".formatted(cmt, fileName, totalLines));
            return sb.toString();
        }
        sb.append("%s %s: %d symbols, %d lines\n\n".formatted(cmt, fileName, declarations.size(), totalLines));
        for (Declaration d : declarations) {
            String indent = "  ".repeat(d.symbol().scopeDepth());
            for (String doc : d.precedingDoc()) {
                sb.append(indent).append(doc).append('\n');
            }
            String[] sigLines = d.signature().split("\n", -1);
            for (int i = 0; i < sigLines.length; i++) {
                sb.append(indent).append(i > 0 ? "  " : "").append(sigLines[i]);
                if (i == sigLines.length - 1) {
                    sb.append("  ")
                            .append(cmt)
                            .append(" L")
                            .append(d.symbol().startLine())
                            .append('-')
                            .append(d.symbol().endLine());
                }
                sb.append('\n');
            }
            for (String doc : d.docstring()) {
                sb.append(indent).append("    ").append(doc).append('\n');
            }
            sb.append(indent).append("    ...\n\n");
        }
        return sb.toString();
    }

    private static String text(TSNode node, byte[] bytes) {
        return slice(bytes, node.getStartByte(), node.getEndByte());
    }

    private static String slice(byte[] bytes, int start, int end) {
        int from = Math.max(0, Math.min(start, bytes.length));
        int to = Math.max(from, Math.min(end, bytes.length));
        return new String(bytes, from, to - from, StandardCharsets.UTF_8);
    }
}
