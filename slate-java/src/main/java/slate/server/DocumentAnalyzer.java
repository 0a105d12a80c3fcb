package slate.server;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import slate.Analysis;
import slate.Slate;
import slate.config.ConfigurationException;
import slate.diag.Diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Finds programs embedded in host documents and analyzes them. Each document type maps to a
 * regular expression whose single capturing group is the program text, e.g. for Markdown
 * <pre>
 *   "markdown" -> "```slate\n([\\s\\S]*?)```"
 * </pre>
 * Patterns are compiled with {@link Pattern#MULTILINE}. Safe for concurrent use.
 */
public final class DocumentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DocumentAnalyzer.class);

    private final ImmutableMap<String, Pattern> patterns;
    private final Slate slate;

    /**
     * @throws ConfigurationException if a pattern does not compile or does not have exactly one
     *                                capturing group
     */
    public DocumentAnalyzer(Map<String, String> patterns, Slate slate) {
        ImmutableMap.Builder<String, Pattern> compiled = ImmutableMap.builder();
        for (Map.Entry<String, String> e : patterns.entrySet()) {
            compiled.put(e.getKey(), compile(e.getKey(), e.getValue()));
        }
        this.patterns = compiled.build();
        this.slate = slate;
    }

    public boolean supports(String docType) {
        return patterns.containsKey(docType);
    }

    public List<Fragment> fragments(String docType, String text) {
        Pattern p = patterns.get(docType);
        if (p == null) {
            log.debug("No fragment pattern for document type {}", docType);
            return List.of();
        }
        List<Fragment> out = new ArrayList<>();
        Matcher m = p.matcher(text);
        while (m.find()) {
            if (m.group(1) != null) out.add(new Fragment(m.start(1), m.group(1)));
        }
        return out;
    }

    /** Analyzes every fragment of the document; diagnostics are moved to host offsets. */
    public List<FragmentResult> analyze(String docType, String text) {
        List<FragmentResult> out = new ArrayList<>();
        for (Fragment f : fragments(docType, text)) {
            Analysis a = slate.analyze(f.text());
            List<Diagnostic> moved = new ArrayList<>();
            for (Diagnostic d : a.diagnostics()) moved.add(d.translate(text, f.start()));
            out.add(new FragmentResult(f, a, moved));
        }
        return out;
    }

    /** All diagnostics of the document, in host offsets. */
    public List<Diagnostic> diagnostics(String docType, String text) {
        List<Diagnostic> out = new ArrayList<>();
        for (FragmentResult r : analyze(docType, text)) out.addAll(r.diagnostics());
        return out;
    }

    /** Hover text for a host offset, if it falls inside a fragment. See {@link Slate#hover}. */
    public Optional<String> hover(String docType, String text, int offset) {
        for (Fragment f : fragments(docType, text)) {
            if (f.contains(offset)) return slate.hover(f.text(), offset - f.start());
        }
        return Optional.empty();
    }

    // ================= helpers =================

    private static Pattern compile(String docType, String regex) {
        Pattern p;
        try {
            p = Pattern.compile(regex, Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Fragment pattern for \"" + docType + "\" does not compile: "
                    + e.getDescription(), e);
        }
        int groups = p.matcher("").groupCount();
        if (groups != 1) {
            throw new ConfigurationException("Fragment pattern for \"" + docType
                    + "\" must have exactly one capturing group, found " + groups);
        }
        return p;
    }
}
