package com.architecture.memory.recall.service.extract;

import java.util.Locale;
import java.util.Map;

/**
 * Language tag by file extension.
 */
public final class SourceLanguage {

    public static final String JAVA = "java";
    public static final String UNKNOWN = "text";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".java", JAVA),
            Map.entry(".py", "python"),
            Map.entry(".kt", "kotlin"),
            Map.entry(".kts", "kotlin"),
            Map.entry(".scala", "scala"),
            Map.entry(".groovy", "groovy"),
            Map.entry(".js", "javascript"),
            Map.entry(".jsx", "javascript"),
            Map.entry(".ts", "typescript"),
            Map.entry(".tsx", "typescript"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".rb", "ruby"),
            Map.entry(".cs", "csharp"),
            Map.entry(".md", "markdown"),
            Map.entry(".yml", "yaml"),
            Map.entry(".yaml", "yaml"),
            Map.entry(".xml", "xml"),
            Map.entry(".sql", "sql"));

    private SourceLanguage() {
    }

    public static String extensionOf(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) {
            return "";
        }
        return path.substring(dot).toLowerCase(Locale.ROOT);
    }

    public static String forPath(String path) {
        return BY_EXTENSION.getOrDefault(extensionOf(path), UNKNOWN);
    }
}
