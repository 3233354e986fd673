package alpha.framedhttp.message;

import alpha.framedhttp.HttpConstants.ReasonPhrase;
import alpha.framedhttp.util.BodyReaders;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An HTTP response.<p>
 * 
 * The server owns the framing of the body. The response must not carry a
 * {@code Content-Length} nor a {@code Transfer-Encoding} header; the server
 * sets one of them depending on whether the length of the body is known. Doing
 * otherwise fails the write with an {@link IllegalResponseHeaderException}.<p>
 * 
 * The implementation is immutable, but the body reader is of course consumed
 * when written.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Responses
 */
public final class Response
{
    /**
     * Returns a builder of a response with the given status code.<p>
     * 
     * The reason phrase defaults to {@link ReasonPhrase#of(int)}, and the body
     * defaults to empty.
     * 
     * @param statusCode of response
     * @return a builder
     */
    public static Builder builder(int statusCode) {
        return new Builder(statusCode);
    }
    
    private final int statusCode;
    private final String reasonPhrase;
    private final List<HeaderField> headers;
    private final BodyReader body;
    
    private Response(Builder b) {
        statusCode   = b.statusCode;
        reasonPhrase = b.reasonPhrase != null ?
                b.reasonPhrase : ReasonPhrase.of(b.statusCode);
        headers      = List.copyOf(b.headers);
        body         = b.body;
    }
    
    /**
     * {@return the status code, e.g. 200}
     */
    public int statusCode() {
        return statusCode;
    }
    
    /**
     * {@return the reason phrase, e.g. "OK"}
     */
    public String reasonPhrase() {
        return reasonPhrase;
    }
    
    /**
     * {@return the header fields, in the order they will be written}
     */
    public List<HeaderField> headers() {
        return headers;
    }
    
    /**
     * {@return the body}
     */
    public BodyReader body() {
        return body;
    }
    
    /**
     * Returns a copy of this response with one more header field appended.<p>
     * 
     * The body reader is shared with this response.
     * 
     * @param name of header
     * @param value of header
     * @return a new response
     */
    public Response withHeader(String name, String value) {
        return toBuilder().header(name, value).build();
    }
    
    /**
     * Returns a builder initialized with the state of this response.
     * 
     * @return a builder
     */
    public Builder toBuilder() {
        var b = new Builder(statusCode);
        b.reasonPhrase = reasonPhrase;
        b.headers.addAll(headers);
        b.body = body;
        return b;
    }
    
    @Override
    public String toString() {
        return statusCode + " " + reasonPhrase;
    }
    
    /**
     * Builder of a {@link Response}.<p>
     * 
     * This builder is not thread-safe.
     */
    public static final class Builder {
        private final int statusCode;
        private String reasonPhrase;
        private final List<HeaderField> headers;
        private BodyReader body;
        
        private Builder(int statusCode) {
            if (statusCode < 100 || statusCode > 999) {
                throw new IllegalArgumentException(
                        "Status code must have three digits, got: " + statusCode);
            }
            this.statusCode = statusCode;
            this.headers = new ArrayList<>();
            this.body = BodyReaders.empty();
        }
        
        /**
         * Sets the reason phrase.
         * 
         * @param reasonPhrase of response
         * @return this builder
         * @throws NullPointerException if {@code reasonPhrase} is {@code null}
         */
        public Builder reasonPhrase(String reasonPhrase) {
            this.reasonPhrase = requireNonNull(reasonPhrase);
            return this;
        }
        
        /**
         * Appends a header field.
         * 
         * @param name of header
         * @param value of header
         * @return this builder
         * @throws IllegalArgumentException if the field is not valid
         */
        public Builder header(String name, String value) {
            headers.add(new HeaderField(name, value));
            return this;
        }
        
        /**
         * Sets the body.
         * 
         * @param body of response
         * @return this builder
         * @throws NullPointerException if {@code body} is {@code null}
         */
        public Builder body(BodyReader body) {
            this.body = requireNonNull(body);
            return this;
        }
        
        /**
         * Builds the response.
         * 
         * @return a response
         */
        public Response build() {
            return new Response(this);
        }
    }
}
