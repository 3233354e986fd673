package alpha.framedhttp.internal;

import alpha.framedhttp.HttpConstants.Version;
import alpha.framedhttp.message.Char;
import alpha.framedhttp.message.HeaderField;
import alpha.framedhttp.message.HeaderParseException;
import alpha.framedhttp.message.HttpVersionNotSupportedException;
import alpha.framedhttp.message.HttpVersionParseException;
import alpha.framedhttp.message.Request;
import alpha.framedhttp.message.RequestLineParseException;

import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Parses the head of an HTTP request.<p>
 * 
 * The input is one head, not including the empty line that terminates it.
 * Lines are separated by CRLF. The first line is the request-line, each line
 * thereafter is a header field.
 * 
 * <h2>Request-line rules</h2>
 * 
 * The request-line is method, request-target and HTTP-version, separated by
 * exactly one space each. Contrary to what RFC 7230 §3.5 allows, this parser
 * is strict; other forms of whitespace are not accepted as a word boundary.
 * 
 * <h2>Header rules</h2>
 * 
 * A header line is a name, a colon, and a value. The name must be a non-empty
 * string without control characters or whitespace. The value is everything
 * after the first colon with leading and trailing space and tab removed, and
 * must not contain control characters other than tab. Folded lines (obs-fold)
 * are rejected. Empty values are fine.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RequestParser
{
    private RequestParser() {
        // Empty
    }
    
    /**
     * Parses a request head.
     * 
     * @param head the bytes, without the terminating empty line
     * 
     * @return the request
     * 
     * @throws RequestLineParseException
     *             if the request-line is malformed
     * @throws HttpVersionParseException
     *             if the version token is malformed
     * @throws HttpVersionNotSupportedException
     *             if the version is not 1.0 or 1.1
     * @throws HeaderParseException
     *             if a header line is malformed
     */
    static Request parse(byte[] head) {
        final String str = new String(head, ISO_8859_1);
        int eol = str.indexOf("\r\n");
        final String line = eol < 0 ? str : str.substring(0, eol);
        
        String[] tokens = line.split(" ", -1);
        if (tokens.length != 3) {
            throw new RequestLineParseException(
                    "Expected three space-separated tokens in request-line, got " + tokens.length + ".");
        }
        final String method = tokens[0],
                     target = tokens[1];
        requireValidMethod(method);
        requireValidTarget(target);
        final Version version = Version.parse(tokens[2]);
        
        List<HeaderField> headers = new ArrayList<>();
        while (eol >= 0) {
            final int start = eol + 2;
            eol = str.indexOf("\r\n", start);
            headers.add(parseHeader(eol < 0 ?
                    str.substring(start) : str.substring(start, eol)));
        }
        
        return new Request(method, target.getBytes(ISO_8859_1), version, headers);
    }
    
    private static void requireValidMethod(String method) {
        if (method.isEmpty()) {
            throw new RequestLineParseException("Empty method.");
        }
        for (int i = 0; i < method.length(); ++i) {
            char c = method.charAt(i);
            if (!Char.isTokenChar(c)) {
                throw new RequestLineParseException(
                        "Illegal char in method: " + Char.toDebugString(c));
            }
        }
    }
    
    private static void requireValidTarget(String target) {
        if (target.isEmpty()) {
            throw new RequestLineParseException("Empty request-target.");
        }
        for (int i = 0; i < target.length(); ++i) {
            char c = target.charAt(i);
            if (Char.isControl(c)) {
                throw new RequestLineParseException(
                        "Illegal char in request-target: " + Char.toDebugString(c));
            }
        }
    }
    
    private static HeaderField parseHeader(String line) {
        if (!line.isEmpty() && isSpaceOrTab(line.charAt(0))) {
            throw new HeaderParseException("Folded header line not supported.");
        }
        final int colon = line.indexOf(':');
        if (colon < 0) {
            throw new HeaderParseException("No colon in header line.");
        }
        final String name = line.substring(0, colon);
        if (!HeaderField.isValidName(name)) {
            throw new HeaderParseException("Invalid header name: \"" + name + "\".");
        }
        int from = colon + 1, to = line.length();
        while (from < to && isSpaceOrTab(line.charAt(from))) {
            ++from;
        }
        while (to > from && isSpaceOrTab(line.charAt(to - 1))) {
            --to;
        }
        final String value = line.substring(from, to);
        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);
            if (c != '\t' && Char.isControl(c)) {
                throw new HeaderParseException(
                        "Illegal char in value of header \"" + name + "\": " + Char.toDebugString(c));
            }
        }
        try {
            return new HeaderField(name, value);
        } catch (IllegalArgumentException e) {
            throw new HeaderParseException(e.getMessage());
        }
    }
    
    private static boolean isSpaceOrTab(char c) {
        return c == ' ' || c == '\t';
    }
}
