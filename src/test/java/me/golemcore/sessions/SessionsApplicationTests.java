package me.golemcore.sessions;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class SessionsApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(SessionsApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(SessionsApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(SessionsApplication.class.getMethod("main", String[].class));
    }
}
