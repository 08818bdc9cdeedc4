package org.shadowlang.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test when it logs at WARN or above (or the level set by {@link FailOnLog}) without a
 * matching {@link AllowLog} or {@link ExpectLog}, and when an {@link ExpectLog} is not met.
 * Events are captured by a Logback turbo filter installed for the lifetime of the test class;
 * allowed and expected events are kept out of the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.of(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter != null) {
            filter.clear();
            filter.rules = Rules.of(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = filter.events();
        filter.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            events.stream()
                    .filter(e -> e.level.isGreaterOrEqual(rules.minLevel))
                    .filter(e -> !rules.permits(e))
                    .forEach(e -> problems.add("Unexpected log: " + e));
        }
        for (ExpectLog expect : rules.expects) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d.",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingFilter filter(ExtensionContext context) {
        // The filter lives in the class-level store; method contexts see it through their parent.
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        private Rules(Level minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        static Rules of(ExtensionContext context) {
            List<AnnotatedElement> elements = new ArrayList<>();
            context.getTestClass().ifPresent(elements::add);
            context.getTestMethod().ifPresent(elements::add);

            FailOnLog fail = null;
            for (AnnotatedElement element : elements) {
                FailOnLog candidate = element.getAnnotation(FailOnLog.class);
                if (candidate != null) {
                    fail = candidate;
                }
            }
            List<AllowLog> allows = elements.stream()
                    .flatMap(el -> Arrays.stream(el.getAnnotationsByType(AllowLog.class)))
                    .toList();
            List<ExpectLog> expects = elements.stream()
                    .flatMap(el -> Arrays.stream(el.getAnnotationsByType(ExpectLog.class)))
                    .toList();
            return new Rules(
                    toLogback(fail != null ? fail.level() : LogLevel.WARN),
                    fail != null && fail.disabled(),
                    allows,
                    expects);
        }

        boolean permits(Event e) {
            return Stream.concat(
                    allows.stream().map(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern())),
                    expects.stream().map(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern())))
                    .anyMatch(Boolean::booleanValue);
        }
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // A null format is an isXxxEnabled() probe, not an event.
            if (format != null && level.isGreaterOrEqual(Level.INFO)) {
                String message = MessageFormatter.arrayFormat(format, params).getMessage();
                Event event = new Event(logger.getName(), level, message);
                events.add(event);
                if (level.isGreaterOrEqual(rules.minLevel) && rules.permits(event)) {
                    return FilterReply.DENY;
                }
            }
            return FilterReply.NEUTRAL;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        void clear() {
            events.clear();
        }
    }

    private static final class Event {
        final String loggerName;
        final Level level;
        final String message;

        Event(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
