package org.pgbulk.cli;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${NAME}} references in option values with the value of the environment
 * variable {@code NAME}. Unknown variables resolve to an empty string.
 */
public final class EnvironmentVariableEvaluator {

    private static final Pattern ENV_VAR = Pattern.compile("\\$\\{([A-Za-z0-9_.]+)}");

    private EnvironmentVariableEvaluator() {
    }

    public static String resolveEnvVars(String input) {
        return resolveEnvVars(input, System.getenv());
    }

    static String resolveEnvVars(String input, Map<String, String> environment) {
        if (input == null) return null;

        Matcher m = ENV_VAR.matcher(input);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            String value = environment.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
