package com.pagewright.core.event;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.pagewright.core.error.UnknownFilterException;
import com.pagewright.core.error.UnmetDependencyException;
import com.pagewright.core.rep.Representation;
import com.pagewright.core.rep.RepresentationTestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LoggingCompilationListener}.
 */
class LoggingCompilationListenerTest extends RepresentationTestBase {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(LoggingCompilationListener.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        bus.addListener(new LoggingCompilationListener());
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    @Test
    void filtering_isLoggedAtDebug() {
        Representation rep = textualRep("/about/", "hello");

        rep.filter("upcase");

        assertThat(appender.list)
            .extracting(ILoggingEvent::getLevel, ILoggingEvent::getFormattedMessage)
            .contains(
                tuple(Level.DEBUG, "Started filtering " + rep + " with upcase"),
                tuple(Level.DEBUG, "Ended filtering " + rep + " with upcase")
            );
    }

    @Test
    void suspensionAndFailure_useHigherLevels() {
        Representation rep = textualRep("/about/", "hello");

        bus.compilationSuspended(rep, new UnmetDependencyException(rep));
        bus.compilationFailed(rep, new UnknownFilterException("nope"));

        assertThat(appender.list).extracting(ILoggingEvent::getLevel)
            .containsExactly(Level.INFO, Level.WARN);
        assertThat(appender.list.get(1).getFormattedMessage()).contains("\"nope\"");
    }
}
