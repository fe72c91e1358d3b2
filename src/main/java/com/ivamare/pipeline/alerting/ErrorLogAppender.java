package com.ivamare.pipeline.alerting;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logback appender that turns matching log lines into metric data points.
 *
 * <p>Attached to the root logger by {@link #install()}. Events from the alerting
 * package are skipped so notifications never count as errors.
 */
public class ErrorLogAppender extends AppenderBase<ILoggingEvent> {

    static final String APPENDER_NAME = "PIPELINE_ALERTING";
    private static final String OWN_PACKAGE = ErrorLogAppender.class.getPackageName();

    private final MetricWindowStore metrics;
    private final List<LogPatternFilter> filters;

    public ErrorLogAppender(MetricWindowStore metrics, List<LogPatternFilter> filters) {
        this.metrics = metrics;
        this.filters = List.copyOf(filters);
        setName(APPENDER_NAME);
    }

    @Override
    protected void append(ILoggingEvent event) {
        String loggerName = event.getLoggerName();
        if (loggerName != null && loggerName.startsWith(OWN_PACKAGE)) {
            return;
        }
        String message = event.getFormattedMessage();
        for (LogPatternFilter filter : filters) {
            if (filter.matches(message)) {
                metrics.record(filter.metric());
            }
        }
    }

    /**
     * Start the appender and attach it to the root logger.
     *
     * @return false if the logging backend is not Logback
     */
    public boolean install() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return false;
        }
        setContext(context);
        start();
        context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(this);
        return true;
    }

    public void uninstall() {
        if (getContext() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(this);
        }
        stop();
    }

    public List<LogPatternFilter> filters() {
        return filters;
    }
}
