package ai.navigator.analyzer;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRust;
import org.treesitter.TreeSitterTypescript;

/**
 * Everything the tree-sitter strategy needs to know about one language's syntax tree.
 *
 * @param language language identifier, see {@link Languages}
 * @param grammar creates a fresh grammar handle; called once per parsing thread
 * @param declarationKinds node types that declare a symbol, with the kind they declare
 * @param classLikeNodeTypes declarations whose directly nested functions are methods
 * @param nameFields fields tried in order to find a declaration's name
 * @param bodyFieldName field holding the body that the skeleton elides
 * @param bodyRequiredNodeTypes declarations that only count when they have a body (C++ forward declarations)
 * @param wrapperFields wrapper node type to the field holding the wrapped declaration (decorators, exports)
 * @param functionValueTypes value node types that turn a {@code variable_declarator} into a function symbol
 * @param commentNodeTypes node types holding comments
 * @param docStyle where documentation lives
 * @param lineComment line comment prefix used for line references in the rendered skeleton
 */
public record LanguageSyntaxProfile(
        String language,
        Supplier<TSLanguage> grammar,
        Map<String, SymbolKind> declarationKinds,
        Set<String> classLikeNodeTypes,
        List<String> nameFields,
        String bodyFieldName,
        Set<String> bodyRequiredNodeTypes,
        Map<String, String> wrapperFields,
        Set<String> functionValueTypes,
        Set<String> commentNodeTypes,
        DocStyle docStyle,
        String lineComment) {

    public enum DocStyle {
        /** Comment block directly above the declaration. */
        PRECEDING_COMMENTS,
        /** String literal as the first statement of the body. */
        DOCSTRING
    }

    public static LanguageSyntaxProfile python() {
        return new LanguageSyntaxProfile(
                Languages.PYTHON,
                TreeSitterPython::new,
                Map.of("class_definition", SymbolKind.CLASS, "function_definition", SymbolKind.FUNCTION),
                Set.of("class_definition"),
                List.of("name"),
                "body",
                Set.of(),
                Map.of("decorated_definition", "definition"),
                Set.of(),
                Set.of("comment"),
                DocStyle.DOCSTRING,
                "#");
    }

    public static LanguageSyntaxProfile javascript() {
        return new LanguageSyntaxProfile(
                Languages.JAVASCRIPT,
                TreeSitterJavascript::new,
                Map.of(
                        "class_declaration", SymbolKind.CLASS,
                        "function_declaration", SymbolKind.FUNCTION,
                        "generator_function_declaration", SymbolKind.FUNCTION,
                        "method_definition", SymbolKind.METHOD,
                        "variable_declarator", SymbolKind.FUNCTION),
                Set.of("class_declaration"),
                List.of("name"),
                "body",
                Set.of(),
                Map.of("export_statement", "declaration"),
                Set.of("arrow_function", "function_expression", "function", "generator_function"),
                Set.of("comment"),
                DocStyle.PRECEDING_COMMENTS,
                "//");
    }

    public static LanguageSyntaxProfile typescript(String language) {
        return new LanguageSyntaxProfile(
                language,
                TreeSitterTypescript::new,
                Map.ofEntries(
                        Map.entry("class_declaration", SymbolKind.CLASS),
                        Map.entry("abstract_class_declaration", SymbolKind.CLASS),
                        Map.entry("interface_declaration", SymbolKind.CLASS),
                        Map.entry("enum_declaration", SymbolKind.CLASS),
                        Map.entry("type_alias_declaration", SymbolKind.OTHER),
                        Map.entry("internal_module", SymbolKind.OTHER),
                        Map.entry("function_declaration", SymbolKind.FUNCTION),
                        Map.entry("generator_function_declaration", SymbolKind.FUNCTION),
                        Map.entry("method_definition", SymbolKind.METHOD),
                        Map.entry("variable_declarator", SymbolKind.FUNCTION)),
                Set.of("class_declaration", "abstract_class_declaration", "interface_declaration"),
                List.of("name"),
                "body",
                Set.of(),
                Map.of("export_statement", "declaration"),
                Set.of("arrow_function", "function_expression", "function", "generator_function"),
                Set.of("comment"),
                DocStyle.PRECEDING_COMMENTS,
                "//");
    }

    public static LanguageSyntaxProfile go() {
        return new LanguageSyntaxProfile(
                Languages.GO,
                TreeSitterGo::new,
                Map.of(
                        "function_declaration", SymbolKind.FUNCTION,
                        "method_declaration", SymbolKind.METHOD,
                        "type_declaration", SymbolKind.CLASS),
                Set.of(),
                List.of("name"),
                "body",
                Set.of(),
                Map.of(),
                Set.of(),
                Set.of("comment"),
                DocStyle.PRECEDING_COMMENTS,
                "//");
    }

    public static LanguageSyntaxProfile rust() {
        return new LanguageSyntaxProfile(
                Languages.RUST,
                TreeSitterRust::new,
                Map.of(
                        "function_item", SymbolKind.FUNCTION,
                        "struct_item", SymbolKind.CLASS,
                        "enum_item", SymbolKind.CLASS,
                        "trait_item", SymbolKind.CLASS,
                        "impl_item", SymbolKind.CLASS,
                        "mod_item", SymbolKind.OTHER,
                        "type_item", SymbolKind.OTHER),
                Set.of("impl_item", "trait_item"),
                List.of("name", "type"),
                "body",
                Set.of(),
                Map.of(),
                Set.of(),
                Set.of("line_comment", "block_comment"),
                DocStyle.PRECEDING_COMMENTS,
                "//");
    }

    public static LanguageSyntaxProfile java() {
        return new LanguageSyntaxProfile(
                Languages.JAVA,
                TreeSitterJava::new,
                Map.of(
                        "class_declaration", SymbolKind.CLASS,
                        "interface_declaration", SymbolKind.CLASS,
                        "enum_declaration", SymbolKind.CLASS,
                        "record_declaration", SymbolKind.CLASS,
                        "annotation_type_declaration", SymbolKind.CLASS,
                        "method_declaration", SymbolKind.METHOD,
                        "constructor_declaration", SymbolKind.METHOD),
                Set.of(
                        "class_declaration",
                        "interface_declaration",
                        "enum_declaration",
                        "record_declaration",
                        "annotation_type_declaration"),
                List.of("name"),
                "body",
                Set.of(),
                Map.of(),
                Set.of(),
                Set.of("line_comment", "block_comment"),
                DocStyle.PRECEDING_COMMENTS,
                "//");
    }

    /** C and C++ share the C++ grammar, which accepts nearly all C. */
    public static LanguageSyntaxProfile cpp(String language) {
        return new LanguageSyntaxProfile(
                language,
                TreeSitterCpp::new,
                Map.of(
                        "function_definition", SymbolKind.FUNCTION,
                        "class_specifier", SymbolKind.CLASS,
                        "struct_specifier", SymbolKind.CLASS,
                        "union_specifier", SymbolKind.CLASS,
                        "enum_specifier", SymbolKind.CLASS,
                        "namespace_definition", SymbolKind.OTHER),
                Set.of("class_specifier", "struct_specifier"),
                List.of("name", "declarator"),
                "body",
                Set.of("class_specifier", "struct_specifier", "union_specifier", "enum_specifier"),
                Map.of("template_declaration", ""),
                Set.of(),
                Set.of("comment"),
                DocStyle.PRECEDING_COMMENTS,
                "//");
    }
}
