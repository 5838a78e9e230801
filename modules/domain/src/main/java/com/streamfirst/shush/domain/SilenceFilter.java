package com.streamfirst.shush.domain;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Narrows a registry listing by regular expressions on the subscription and
 * the check. Absent parts match everything.
 */
public record SilenceFilter(Optional<Pattern> subscription, Optional<Pattern> check) {

    private static final SilenceFilter ALL = new SilenceFilter(Optional.empty(), Optional.empty());

    public static SilenceFilter all() {
        return ALL;
    }

    /**
     * @throws ValidationException if either expression does not compile
     */
    public static SilenceFilter of(String subscriptionRegex, String checkRegex) {
        return new SilenceFilter(compile(subscriptionRegex), compile(checkRegex));
    }

    private static Optional<Pattern> compile(String regex) {
        if (regex == null || regex.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            throw new ValidationException("Invalid filter expression '" + regex + "': " + e.getDescription(), e);
        }
    }

    public boolean matches(Target target) {
        String sub = target.subject().subscription().orElse("");
        return subscription.map(p -> p.matcher(sub).find()).orElse(true)
                && check.map(p -> p.matcher(target.check()).find()).orElse(true);
    }

    public boolean matches(SilenceRecord record) {
        return matches(record.getTarget());
    }
}
