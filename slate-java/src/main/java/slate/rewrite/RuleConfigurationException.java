package slate.rewrite;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when a rule set cannot be built. Carries every problem found, not just the first.
 */
public class RuleConfigurationException extends RuntimeException {
    private final List<String> problems;

    public RuleConfigurationException(List<String> problems) {
        super(format(problems));
        this.problems = ImmutableList.copyOf(problems);
    }

    public RuleConfigurationException(String problem) {
        this(List.of(problem));
    }

    public List<String> problems() {
        return problems;
    }

    private static String format(List<String> problems) {
        StringBuilder sb = new StringBuilder("Failed to build rules with ")
                .append(problems.size()).append(problems.size() == 1 ? " error." : " errors.");
        for (int i = 0; i < problems.size(); i++) {
            sb.append("\n    (").append(i + 1).append(") ").append(problems.get(i));
        }
        return sb.toString();
    }
}
