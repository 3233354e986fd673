package alpha.framedhttp.internal;

import alpha.framedhttp.Config;
import alpha.framedhttp.HttpConstants.Version;
import alpha.framedhttp.handler.HasResponse;
import alpha.framedhttp.handler.RequestHandler;
import alpha.framedhttp.message.BodyReader;
import alpha.framedhttp.message.HttpProtocolException;
import alpha.framedhttp.message.IllegalResponseHeaderException;
import alpha.framedhttp.message.Request;
import alpha.framedhttp.message.Response;
import alpha.framedhttp.message.Responses;
import alpha.framedhttp.util.AsyncLoop;
import alpha.framedhttp.util.BodyReaders;

import java.io.IOException;
import java.lang.System.Logger.Level;
import java.util.concurrent.CompletionStage;

import static alpha.framedhttp.HttpConstants.HeaderName.CONNECTION;
import static alpha.framedhttp.HttpConstants.Method.HEAD;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Locale.ROOT;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedStage;
import static java.util.concurrent.CompletableFuture.failedStage;

/**
 * Drives HTTP exchanges over one connection.<p>
 * 
 * Each exchange moves through three states: awaiting the next request head,
 * dispatching it to the handler, and writing the response followed by
 * discarding whatever is left of the request body. Then the connection is
 * either reused for the next exchange, or closed. It is closed if the request
 * was HTTP/1.0, if the client asked for it ({@code Connection: close}), or if
 * the request body was delimited by the end of the stream. When the connection
 * is about to close after a successful exchange, the response is given a
 * {@code Connection: close} header.<p>
 * 
 * A failure while awaiting or dispatching a request produces an error
 * response, if the connection is still writable, after which the connection
 * closes. The response comes from the exception if it implements {@link
 * HasResponse}, else it is a 500 (Internal Server Error). A failure after the
 * response has begun to be written, or while discarding the request body,
 * closes the connection without a response.<p>
 * 
 * Requests are processed one at a time, in the order received. Pipelined
 * requests wait in the connection's buffer.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class HttpConnection
{
    private static final System.Logger LOG
            = System.getLogger(HttpConnection.class.getPackageName());
    
    private enum State {
        AWAITING_MESSAGE, DISPATCHING, WRITING
    }
    
    private final SequentialStream stream;
    private final Config config;
    private final RequestHandler handler;
    private final ChannelReader in;
    private final MessageReader<Request> heads;
    private final ResponseWriter writer;
    
    private volatile State state;
    private int exchanges;
    
    HttpConnection(SequentialStream stream, Config config, RequestHandler handler) {
        this.stream  = requireNonNull(stream);
        this.config  = requireNonNull(config);
        this.handler = requireNonNull(handler);
        this.in      = new ChannelReader(stream);
        this.heads   = new MessageReader<>(in, new RequestHeadFramer(config.maxRequestHeadSize()));
        this.writer  = new ResponseWriter(stream);
        this.state   = State.AWAITING_MESSAGE;
    }
    
    /**
     * Runs exchanges until the connection closes.<p>
     * 
     * The returned stage never completes exceptionally. When it completes, the
     * stream has been closed.
     * 
     * @return a stage that completes when the connection is done
     */
    CompletionStage<Void> run() {
        return AsyncLoop.repeat(this::exchange)
                .handle((nil, thr) -> thr == null ?
                        completedStage((Void) null) : onError(AsyncLoop.unwrap(thr)))
                .thenCompose(s -> s)
                .whenComplete((nil, thr) -> {
                    stream.close();
                    LOG.log(DEBUG, () -> "Connection closed after " + exchanges + " exchange(s).");
                });
    }
    
    /**
     * {@return the number of exchanges started on this connection}
     */
    int exchanges() {
        return exchanges;
    }
    
    private CompletionStage<Boolean> exchange() {
        state = State.AWAITING_MESSAGE;
        return heads.next().thenCompose(head -> {
            if (head.isEmpty()) {
                LOG.log(DEBUG, "Client closed the connection.");
                return completedStage(false);
            }
            final Request req = head.get();
            ++exchanges;
            LOG.log(DEBUG, () -> "Received request: " + req);
            state = State.DISPATCHING;
            final BodyReader body = RequestBodies.of(req, in, config);
            return dispatch(req, body).thenCompose(rsp -> write(req, body, rsp));
        });
    }
    
    private CompletionStage<Response> dispatch(Request req, BodyReader body) {
        final CompletionStage<Response> stage;
        try {
            stage = requireNonNull(handler.handle(req, body), "Handler returned null.");
        } catch (Throwable t) {
            return failedStage(t);
        }
        return stage.thenApply(rsp -> requireNonNull(rsp, "Handler returned a null response."));
    }
    
    private CompletionStage<Boolean> write(Request req, BodyReader body, Response rsp) {
        state = State.WRITING;
        final boolean close = req.version() == Version.HTTP_1_0 ||
                req.hasToken(CONNECTION, "close") ||
                body instanceof UntilEofBody;
        final Response use = close ? withConnectionClose(rsp) : rsp;
        return writer.write(use, req.version(), req.method().equals(HEAD)).thenCompose(nil -> {
            LOG.log(DEBUG, () -> "Wrote response: " + use);
            if (close) {
                LOG.log(DEBUG, "Closing the connection after the exchange.");
                return completedStage(false);
            }
            return BodyReaders.drain(body).thenApply(n -> {
                if (n > 0) {
                    LOG.log(DEBUG, () -> "Discarded " + n + " unread byte(s) of request body.");
                }
                return true;
            });
        });
    }
    
    private CompletionStage<Void> onError(Throwable exc) {
        final State s = state;
        if (exc instanceof IOException) {
            log(DEBUG, "Channel failed", exc);
            return completedStage(null);
        }
        if (s == State.WRITING && !(exc instanceof IllegalResponseHeaderException)) {
            // Bytes may already be on the wire
            log(ERROR, "Exchange failed while writing the response", exc);
            return completedStage(null);
        }
        if (exc instanceof HttpProtocolException) {
            log(WARNING, "Protocol error", exc);
        } else {
            log(ERROR, "Exchange failed while " + s.name().toLowerCase(ROOT).replace('_', ' '), exc);
        }
        if (!stream.isWritable()) {
            LOG.log(DEBUG, "Stream is not writable, can not respond to this error.");
            return completedStage(null);
        }
        final Response rsp;
        try {
            rsp = withConnectionClose(errorResponse(exc));
        } catch (RuntimeException e) {
            log(ERROR, "Failed to create error response", e);
            return completedStage(null);
        }
        return writer.write(rsp, Version.HTTP_1_1).handle((nil, thr) -> {
            if (thr != null) {
                LOG.log(DEBUG, "Failed to write error response.", AsyncLoop.unwrap(thr));
            } else {
                LOG.log(DEBUG, () -> "Wrote error response: " + rsp);
            }
            return null;
        });
    }
    
    private static Response errorResponse(Throwable exc) {
        if (exc instanceof HasResponse hr && !(exc instanceof IllegalResponseHeaderException)) {
            return requireNonNull(hr.getResponse(), "Exception returned a null response.");
        }
        return Responses.internalServerError();
    }
    
    private static Response withConnectionClose(Response rsp) {
        boolean has = rsp.headers().stream()
                .anyMatch(h -> h.hasName(CONNECTION) && h.value().equalsIgnoreCase("close"));
        return has ? rsp : rsp.withHeader(CONNECTION, "close");
    }
    
    private static void log(Level level, String why, Throwable exc) {
        if (level == WARNING) {
            LOG.log(level, () -> why + " (closing connection): " + exc.getMessage());
        } else {
            LOG.log(level, () -> why + " (closing connection).", exc);
        }
    }
}
