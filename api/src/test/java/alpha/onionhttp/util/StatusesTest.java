package alpha.onionhttp.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link Statuses}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class StatusesTest
{
    @ParameterizedTest
    @ValueSource(ints = {100, 101, 199, 204, 205, 304})
    void bodyless(int code) {
        assertThat(Statuses.isBodyless(code)).isTrue();
    }
    
    @ParameterizedTest
    @ValueSource(ints = {200, 201, 206, 301, 404, 500})
    void notBodyless(int code) {
        assertThat(Statuses.isBodyless(code)).isFalse();
    }
    
    @Test
    void message() {
        assertThat(Statuses.message(404)).hasValue("Not Found");
        assertThat(Statuses.message(418)).hasValue("I'm a Teapot");
        assertThat(Statuses.message(799)).isEmpty();
    }
    
    @Test
    void isValid() {
        assertThat(Statuses.isValid(100)).isTrue();
        assertThat(Statuses.isValid(999)).isTrue();
        assertThat(Statuses.isValid(99)).isFalse();
        assertThat(Statuses.isValid(1000)).isFalse();
    }
}
