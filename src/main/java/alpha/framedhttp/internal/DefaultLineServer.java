package alpha.framedhttp.internal;

import alpha.framedhttp.Config;
import alpha.framedhttp.LineServer;
import alpha.framedhttp.handler.LineHandler;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * The default implementation of {@link LineServer}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class DefaultLineServer extends AbstractServer implements LineServer
{
    private final LineHandler handler;
    
    /**
     * Constructs this object.
     * 
     * @param config of server
     * @param handler of lines
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public DefaultLineServer(Config config, LineHandler handler) {
        super(config);
        this.handler = requireNonNull(handler);
    }
    
    @Override
    CompletionStage<Void> serve(SequentialStream child) {
        return new LineConnection(child, handler).run();
    }
}
