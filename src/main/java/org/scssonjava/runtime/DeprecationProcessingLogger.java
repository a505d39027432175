package org.scssonjava.runtime;

import org.scssonjava.lexer.SourceSpan;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * A logger that applies the user's deprecation settings before forwarding
 * warnings to another logger.
 * <p>
 * Silenced deprecations are dropped, fatal deprecations are turned into errors,
 * and a deprecation that repeats more than {@link #MAX_REPETITIONS} times is only
 * counted unless the logger is verbose.
 */
public class DeprecationProcessingLogger implements Logger {
    public static final int MAX_REPETITIONS = 5;

    private final Logger inner;
    private final Set<Deprecation> silenceDeprecations;
    private final Set<Deprecation> fatalDeprecations;
    private final boolean limitRepetition;
    private final Map<Deprecation, Integer> repetitions = new EnumMap<>(Deprecation.class);

    /**
     * @param inner               the logger that receives surviving warnings
     * @param silenceDeprecations deprecations to drop
     * @param fatalDeprecations   deprecations to report as errors
     * @param limitRepetition     false in verbose mode
     * @throws IllegalArgumentException if a deprecation is both silenced and fatal
     */
    public DeprecationProcessingLogger(Logger inner, Set<Deprecation> silenceDeprecations,
                                       Set<Deprecation> fatalDeprecations, boolean limitRepetition) {
        this.inner = inner;
        this.silenceDeprecations = silenceDeprecations.isEmpty()
                ? EnumSet.noneOf(Deprecation.class) : EnumSet.copyOf(silenceDeprecations);
        this.fatalDeprecations = fatalDeprecations.isEmpty()
                ? EnumSet.noneOf(Deprecation.class) : EnumSet.copyOf(fatalDeprecations);
        this.limitRepetition = limitRepetition;
        for (Deprecation deprecation : this.fatalDeprecations) {
            if (this.silenceDeprecations.contains(deprecation)) {
                throw new IllegalArgumentException(
                        "Ignoring setting to silence " + deprecation.getId() + " deprecation, since it has also been made fatal.");
            }
        }
    }

    @Override
    public void warn(String message, SourceSpan span, Deprecation deprecation) {
        if (deprecation == null) {
            inner.warn(message, span, null);
            return;
        }
        if (fatalDeprecations.contains(deprecation)) {
            throw new ScssCompilerException(message + "\n\nThis is only an error because you've set the "
                    + deprecation.getId() + " deprecation to be fatal.\n"
                    + "Remove this setting if you need to keep using this feature.", span, (String) null);
        }
        if (silenceDeprecations.contains(deprecation)) {
            return;
        }
        if (limitRepetition) {
            int count = repetitions.merge(deprecation, 1, Integer::sum);
            if (count > MAX_REPETITIONS) {
                return;
            }
        }
        inner.warn(message, span, deprecation);
    }

    @Override
    public void debug(String message, SourceSpan span) {
        inner.debug(message, span);
    }

    /**
     * Number of warnings that were counted but not forwarded.
     */
    public int getOmittedCount() {
        int total = 0;
        for (int count : repetitions.values()) {
            total += Math.max(0, count - MAX_REPETITIONS);
        }
        return total;
    }

    /**
     * Reports how many repetitive warnings were omitted, if any.
     */
    public void summarize() {
        int total = getOmittedCount();
        if (total > 0) {
            inner.warn(total + " repetitive deprecation warnings omitted.\n"
                    + "Run in verbose mode to see all warnings.", null, null);
        }
    }
}
