package alpha.framedhttp.message;

/**
 * Utils for characters.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Char
{
    private Char() {
        // Empty
    }
    
    /** Carriage return. */
    public static final byte CR = 13;
    
    /** Line feed. */
    public static final byte LF = 10;
    
    /** Space. */
    public static final byte SP = 32;
    
    /**
     * Returns {@code true} if the char is a US-ASCII control character, i.e.
     * 0 - 31 or DEL.
     * 
     * @param c char to test
     * @return see JavaDoc
     */
    public static boolean isControl(char c) {
        return c < 32 || c == 127;
    }
    
    /**
     * Returns {@code true} if the char is a "tchar", the building block of
     * tokens such as the request method.
     * 
     * @param c char to test
     * @return see JavaDoc
     * @see <a href="https://tools.ietf.org/html/rfc7230#section-3.2.6">RFC 7230 §3.2.6</a>
     */
    public static boolean isTokenChar(char c) {
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') ||
            (c >= '0' && c <= '9')) {
            return true;
        }
        return "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
    }
    
    /**
     * Returns a debug-friendly {@code String} of the char.<p>
     * 
     * Control characters are replaced by their names, e.g. "\r" becomes
     * "\\r" and a NUL becomes "(0)".
     * 
     * @param c char to transform
     * @return a debug-friendly string
     */
    public static String toDebugString(char c) {
        switch (c) {
            case '\r': return "\\r";
            case '\n': return "\\n";
            case '\t': return "\\t";
            default:
                return isControl(c) ? "(" + (int) c + ")" : Character.toString(c);
        }
    }
}
