package alpha.framedhttp.message;

import static java.util.Objects.requireNonNull;

/**
 * A header field.<p>
 * 
 * The name must not be empty, and it must not contain a control character, a
 * colon, nor whitespace. The value must not contain CR or LF, and it has no
 * leading or trailing whitespace.
 * 
 * @param name of field
 * @param value of field
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record HeaderField(String name, String value)
{
    /**
     * Constructs this object.
     * 
     * @param name of field
     * @param value of field
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if the name is not a valid field-name, or
     *             if the value has CR/LF or surrounding whitespace
     */
    public HeaderField {
        if (!isValidName(requireNonNull(name))) {
            throw new IllegalArgumentException(
                    "Invalid field name: \"" + name + "\".");
        }
        if (!isValidValue(requireNonNull(value))) {
            throw new IllegalArgumentException(
                    "Invalid value for field \"" + name + "\".");
        }
    }
    
    /**
     * Returns {@code true} if this field's name equals the given name,
     * ignoring case.
     * 
     * @param name to compare with
     * @return see JavaDoc
     */
    public boolean hasName(String name) {
        return this.name.equalsIgnoreCase(name);
    }
    
    /**
     * Returns {@code true} if the given string is a valid field-name.
     * 
     * @param name to test
     * @return see JavaDoc
     */
    public static boolean isValidName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); ++i) {
            char c = name.charAt(i);
            if (Char.isControl(c) || c == ':' || c == ' ') {
                return false;
            }
        }
        return true;
    }
    
    private static boolean isValidValue(String value) {
        if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            return false;
        }
        return value.equals(value.strip());
    }
    
    @Override
    public String toString() {
        return name + ": " + value;
    }
}
