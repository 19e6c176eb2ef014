package me.golemcore.guard;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class GuardApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(GuardApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(GuardApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(GuardApplication.class.getMethod("main", String[].class));
    }
}
