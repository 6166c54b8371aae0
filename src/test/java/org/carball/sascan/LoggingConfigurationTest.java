package org.carball.sascan;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import org.junit.jupiter.api.Test;

import java.net.URL;

import static org.assertj.core.api.Assertions.assertThat;

public class LoggingConfigurationTest {

    @Test
    void shouldLogApplicationProgressAtInfoAndEverythingElseAtWarn() throws Exception {
        URL runtimeConfig = getClass().getClassLoader().getResource("logback.xml");
        assertThat(runtimeConfig).isNotNull();

        LoggerContext context = new LoggerContext();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        configurator.doConfigure(runtimeConfig);

        assertThat(context.getLogger("org.carball.sascan.analyzer.SasAnalyzer").getEffectiveLevel())
                .isEqualTo(Level.INFO);
        assertThat(context.getLogger("org.carball.sascan.analyzer.SasAnalyzer").isDebugEnabled()).isFalse();
        assertThat(context.getLogger("com.fasterxml.jackson").getEffectiveLevel()).isEqualTo(Level.WARN);

        context.stop();
    }
}
