package alpha.framedhttp.message;

import alpha.framedhttp.HttpConstants.Version;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP request head.<p>
 * 
 * Header fields are kept in the order received, and duplicated names are
 * not merged. {@link #header(String)} returns the first field matching a name,
 * {@link #headers(String)} returns all of them.<p>
 * 
 * The request body is not part of this type, it is given to the {@code
 * RequestHandler} as a separate argument.<p>
 * 
 * The implementation is immutable.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Request
{
    private final String method;
    private final byte[] target;
    private final Version version;
    private final List<HeaderField> headers;
    
    /**
     * Constructs this object.
     * 
     * @param method of request
     * @param target of request
     * @param version of request
     * @param headers of request
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public Request(
            String method, byte[] target, Version version,
            List<HeaderField> headers)
    {
        this.method  = requireNonNull(method);
        this.target  = target.clone();
        this.version = requireNonNull(version);
        this.headers = List.copyOf(headers);
    }
    
    /**
     * {@return the request method, e.g. "GET"}
     */
    public String method() {
        return method;
    }
    
    /**
     * Returns the request-target as received.<p>
     * 
     * The server does not interpret the target, it is opaque bytes.
     * 
     * @return a copy of the request-target bytes
     */
    public byte[] targetBytes() {
        return target.clone();
    }
    
    /**
     * {@return the request-target decoded as ISO-8859-1, e.g. "/echo"}
     */
    public String target() {
        return new String(target, ISO_8859_1);
    }
    
    /**
     * {@return the protocol version}
     */
    public Version version() {
        return version;
    }
    
    /**
     * {@return all header fields, in received order (unmodifiable)}
     */
    public List<HeaderField> headers() {
        return headers;
    }
    
    /**
     * Returns the value of the first header field with the given name.<p>
     * 
     * The name is compared case-insensitively.
     * 
     * @param name of header
     * @return the value, or an empty optional if there is no such field
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public Optional<String> header(String name) {
        requireNonNull(name);
        return headers.stream()
                      .filter(h -> h.hasName(name))
                      .map(HeaderField::value)
                      .findFirst();
    }
    
    /**
     * Returns the values of all header fields with the given name.<p>
     * 
     * The name is compared case-insensitively.
     * 
     * @param name of header
     * @return all values in received order (unmodifiable, possibly empty)
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public List<String> headers(String name) {
        requireNonNull(name);
        return headers.stream()
                      .filter(h -> h.hasName(name))
                      .map(HeaderField::value)
                      .toList();
    }
    
    /**
     * Returns {@code true} if a header contains the given token.<p>
     * 
     * Each field value is split on commas and the trimmed tokens are compared
     * case-insensitively, e.g. {@code hasToken("Connection", "close")}.
     * 
     * @param name of header
     * @param token to look for
     * @return see JavaDoc
     */
    public boolean hasToken(String name, String token) {
        return headers(name).stream()
                .flatMap(v -> Arrays.stream(v.split(",")))
                .anyMatch(t -> t.strip().equalsIgnoreCase(token));
    }
    
    @Override
    public String toString() {
        return method + " " + target() + " " + version;
    }
}
