package io.nosqlbench.glm.family;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.glm.links.IdentityLink;
import io.nosqlbench.glm.links.LogLink;
import io.nosqlbench.glm.links.SqrtLink;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unsafe links are reported once at construction, except for a family's own default link.
 */
@Tag("unit")
public class LinkSafetyLoggingTest {

    private final CapturingAppender appender = new CapturingAppender();
    private LoggerContext context;
    private LoggerConfig loggerConfig;

    @BeforeEach
    void attachAppender() {
        context = (LoggerContext) LogManager.getContext(false);
        loggerConfig = context.getConfiguration().getLoggerConfig(Family.class.getName());
        appender.start();
        loggerConfig.addAppender(appender, Level.WARN, null);
        context.updateLoggers();
    }

    @AfterEach
    void detachAppender() {
        loggerConfig.removeAppender(appender.getName());
        appender.stop();
        context.updateLoggers();
    }

    private List<String> familyWarnings() {
        return appender.events.stream()
            .filter(e -> e.getLevel() == Level.WARN)
            .filter(e -> Family.class.getName().equals(e.getLoggerName()))
            .map(e -> e.getMessage().getFormattedMessage())
            .collect(Collectors.toList());
    }

    @Test
    void defaultCanonicalGammaLinkIsQuiet() {
        new Gamma();
        FamilyKind.GAMMA.create();
        FamilyKind.GAMMA.create(FamilyKind.GAMMA.defaultLink());
        assertThat(familyWarnings()).isEmpty();
    }

    @Test
    void safeLinksAreQuiet() {
        new Gamma(new LogLink());
        new Poisson();
        new Binomial();
        new NegativeBinomial();
        new Gaussian();
        assertThat(familyWarnings()).isEmpty();
    }

    @Test
    void nonDefaultUnsafeLinkWarns() {
        new Gamma(new IdentityLink());
        assertThat(familyWarnings()).hasSize(1);
        assertThat(familyWarnings().get(0)).contains("identity").contains("gamma");

        new Poisson(new SqrtLink());
        new Binomial(new LogLink());
        assertThat(familyWarnings()).hasSize(3);
    }

    private static final class CapturingAppender extends AbstractAppender {

        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        CapturingAppender() {
            super("link-safety-capture", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }
}
