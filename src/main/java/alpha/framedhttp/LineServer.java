package alpha.framedhttp;

import alpha.framedhttp.handler.LineHandler;
import alpha.framedhttp.internal.DefaultLineServer;

/**
 * Listens on a port for connections speaking a line-delimited text
 * protocol.<p>
 * 
 * Each line received, terminated by LF, is passed to the {@link LineHandler}
 * and the reply written back. The line {@code "quit\n"} is answered by the
 * server with {@code "Bye\n"} and the connection is closed.<p>
 * 
 * Of the configuration, only {@link Config#readBufferSize()} and {@link
 * Config#timeoutWrite()} apply.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface LineServer extends Server
{
    /**
     * Creates a server using {@linkplain Config#DEFAULT default
     * configuration}.
     * 
     * @param handler of lines
     * 
     * @return an instance of {@link DefaultLineServer}
     * 
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    static LineServer create(LineHandler handler) {
        return create(Config.DEFAULT, handler);
    }
    
    /**
     * Creates a server.
     * 
     * @param config of server
     * @param handler of lines
     * 
     * @return an instance of {@link DefaultLineServer}
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    static LineServer create(Config config, LineHandler handler) {
        return new DefaultLineServer(config, handler);
    }
}
