package alpha.framedhttp.message;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link HeaderField}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class HeaderFieldTest
{
    @Test
    void hasName_ignoresCase() {
        var h = new HeaderField("Content-Type", "text/plain");
        assertThat(h.hasName("content-type")).isTrue();
        assertThat(h.hasName("Content-Length")).isFalse();
        assertThat(h).hasToString("Content-Type: text/plain");
    }
    
    @Test
    void emptyValue_isAllowed() {
        assertThat(new HeaderField("X", "").value()).isEmpty();
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"", "Has Space", "Colon:", "Tab\t", "Nul\0"})
    void invalidName(String name) {
        assertThatThrownBy(() -> new HeaderField(name, "v"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid field name: \"" + name + "\".");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {" lead", "trail ", "cr\rlf", "new\nline"})
    void invalidValue(String value) {
        assertThatThrownBy(() -> new HeaderField("Name", value))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid value for field \"Name\".");
    }
}
