package org.opencraft.junit.extensions.logging;

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

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is announced with {@link AllowLog} or
 * {@link ExpectLog}, and fails it when an {@link ExpectLog} event does not occur. Announced events
 * are swallowed so they do not clutter the build output.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE =
        ExtensionContext.Namespace.create(LogWatchExtension.class.getName());

    @Override
    public void beforeAll(final ExtensionContext context) {
        final WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(final ExtensionContext context) {
        final WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.updateRules(resolveRules(context));
        }
    }

    @Override
    public void afterEach(final ExtensionContext context) {
        final WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter == null) {
            return;
        }
        final Rules rules = resolveRules(context);
        final List<Event> events = filter.getEvents();
        filter.clearEvents();

        final List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (final Event event : events) {
                if (event.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.announces(event)) {
                    unexpected.add(String.format("[%s] %s - %s", event.level, event.loggerName, event.message));
                }
            }
        }

        final List<String> missing = new ArrayList<>();
        for (final ExpectLog expect : rules.expects) {
            final long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                    expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            final StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(final ExtensionContext context) {
        final WatchFilter filter = context.getStore(NAMESPACE).remove("filter", WatchFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(final ExtensionContext context) {
        final FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
            .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        return new Rules(
            fail != null ? fail.level() : LogLevel.WARN,
            fail != null && fail.disabled(),
            collect(context, AllowLog.class),
            collect(context, ExpectLog.class));
    }

    // Class-level annotations first, then those of the current method
    private static <A extends Annotation> List<A> collect(final ExtensionContext context, final Class<A> type) {
        final List<A> result = new ArrayList<>();
        context.getTestClass().ifPresent(c -> result.addAll(List.of(c.getAnnotationsByType(type))));
        context.getTestMethod().map(AnnotatedElement.class::cast)
            .ifPresent(m -> result.addAll(List.of(m.getAnnotationsByType(type))));
        return result;
    }

    private static boolean matches(final Event event, final LogLevel level, final String loggerPattern,
                                   final String messagePattern) {
        return event.level.isGreaterOrEqual(toLogback(level))
            && Pattern.matches(loggerPattern, event.loggerName)
            && Pattern.matches(messagePattern, event.message);
    }

    private static Level toLogback(final LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class WatchFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        WatchFilter(final Rules rules) {
            this.rules = rules;
        }

        void updateRules(final Rules newRules) {
            this.rules = newRules;
        }

        @Override
        public FilterReply decide(final Marker marker, final ch.qos.logback.classic.Logger logger, final Level level,
                                  final String format, final Object[] params, final Throwable t) {
            final Rules current = rules;
            // INFO is captured regardless of the failure level so it can be expected
            // Without a format the event is only an isEnabled() probe
            if (!level.isGreaterOrEqual(Level.INFO) || format == null) {
                return FilterReply.NEUTRAL;
            }
            final Event event = new Event(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return current.announces(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<Event> getEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }

    private static final class Event {
        final String loggerName;
        final Level level;
        final String message;

        Event(final String loggerName, final Level level, final String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }
    }

    private static final class Rules {
        final LogLevel minLevel;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        Rules(final LogLevel minLevel, final boolean disabled, final List<AllowLog> allows, final List<ExpectLog> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        boolean announces(final Event event) {
            for (final AllowLog allow : allows) {
                if (matches(event, allow.level(), allow.loggerPattern(), allow.messagePattern())) {
                    return true;
                }
            }
            for (final ExpectLog expect : expects) {
                if (matches(event, expect.level(), expect.loggerPattern(), expect.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }
}
