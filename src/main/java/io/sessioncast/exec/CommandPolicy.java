package io.sessioncast.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Allow list of remote commands. Each entry matches as a literal prefix or, failing that, as a
 * regular expression found anywhere in the command. An empty list allows everything.
 */
public final class CommandPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandPolicy.class);

    private final List<String> prefixes;
    private final List<Pattern> patterns;

    public CommandPolicy(List<String> allowedCommands) {
        this.prefixes = allowedCommands == null ? List.of() : List.copyOf(allowedCommands);
        List<Pattern> compiled = new ArrayList<>(prefixes.size());
        for (String entry : prefixes) {
            try {
                compiled.add(Pattern.compile(entry));
            } catch (PatternSyntaxException e) {
                LOGGER.warn("Allowed command entry is not a valid pattern, prefix match only: {}", entry);
                compiled.add(null);
            }
        }
        this.patterns = compiled;
    }

    public boolean restricted() {
        return !prefixes.isEmpty();
    }

    public boolean allows(String command) {
        if (prefixes.isEmpty()) {
            return true;
        }
        for (int i = 0; i < prefixes.size(); i++) {
            if (command.startsWith(prefixes.get(i))) {
                return true;
            }
            Pattern pattern = patterns.get(i);
            if (pattern != null && pattern.matcher(command).find()) {
                return true;
            }
        }
        return false;
    }
}
