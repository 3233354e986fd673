package alpha.framedhttp.internal;

import alpha.framedhttp.Config;
import alpha.framedhttp.HttpServer;
import alpha.framedhttp.handler.RequestHandler;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * The default implementation of {@link HttpServer}.<p>
 * 
 * Each accepted connection is driven by an {@link HttpConnection}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultServer extends AbstractServer implements HttpServer
{
    private final RequestHandler handler;
    
    /**
     * Constructs this object.
     * 
     * @param config of server
     * @param handler of requests
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public DefaultServer(Config config, RequestHandler handler) {
        super(config);
        this.handler = requireNonNull(handler);
    }
    
    @Override
    CompletionStage<Void> serve(SequentialStream child) {
        return new HttpConnection(child, getConfig(), handler).run();
    }
    
    @Override
    public RequestHandler getHandler() {
        return handler;
    }
}
