package de.burger.slf4j.refactor.verify;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// English comments only in code.
// Guards the text engine: a rewrite is only accepted when the result still parses as Java
// whenever the original did. A fresh parser per call keeps this safe for parallel workers.
public final class JavaSyntaxVerifier {
    private static final Logger log = LoggerFactory.getLogger(JavaSyntaxVerifier.class);

    private final ParserConfiguration.LanguageLevel languageLevel;

    public JavaSyntaxVerifier() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public JavaSyntaxVerifier(ParserConfiguration.LanguageLevel languageLevel) {
        this.languageLevel = languageLevel;
    }

    public boolean parses(String source) {
        ParserConfiguration configuration = new ParserConfiguration().setLanguageLevel(languageLevel);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        if (!result.isSuccessful() && log.isDebugEnabled()) {
            log.debug("Source does not parse: {}", result.getProblems().stream()
                    .map(p -> p.getVerboseMessage().lines().findFirst().orElse(""))
                    .collect(Collectors.joining("; ")));
        }
        return result.isSuccessful();
    }

    /**
     * True when the rewrite may be kept: either the original did not parse to begin with
     * (nothing to compare against) or the rewritten text parses as well.
     */
    public boolean acceptsRewrite(String original, String rewritten) {
        return parses(rewritten) || !parses(original);
    }
}
