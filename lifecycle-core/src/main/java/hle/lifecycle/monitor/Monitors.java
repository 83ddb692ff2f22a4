package hle.lifecycle.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory and helper methods for {@link Monitor} instances.
 */
public final class Monitors {

    private static final Logger logger = LoggerFactory.getLogger(Monitors.class);

    private static final Monitor NOOP = new Monitor() {
        @Override
        public String name() {
            return "noop";
        }

        @Override
        public void recordEvent(MonitorEvent event) {
        }
    };

    private Monitors() {
    }

    /**
     * A monitor that drops every event.
     */
    public static Monitor noop() {
        return NOOP;
    }

    /**
     * A monitor that writes every event to the {@code hle.lifecycle.events}
     * logger at DEBUG level.
     */
    public static Monitor logging() {
        return new LoggingMonitor();
    }

    /**
     * Delivers an event, logging instead of propagating any failure of the monitor.
     */
    public static void emit(Monitor monitor, MonitorEvent event) {
        try {
            monitor.recordEvent(event);
        } catch (RuntimeException e) {
            logger.warn("Monitor '{}' failed to record {} event", monitor.name(), event.getType(), e);
        }
    }

    private static final class LoggingMonitor implements Monitor {

        private static final Logger events = LoggerFactory.getLogger("hle.lifecycle.events");

        @Override
        public String name() {
            return "logging";
        }

        @Override
        public void recordEvent(MonitorEvent event) {
            events.debug("{}", event);
        }
    }
}
