package alpha.framedhttp.internal;

import alpha.framedhttp.HttpServer;
import alpha.framedhttp.Server;
import alpha.framedhttp.examples.HelloWorld;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.channels.SocketChannel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests of the HTTP server, using the handler of {@link
 * HelloWorld}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class HttpEndToEndTest extends AbstractEndToEndTest
{
    private static final String CRLF = "\r\n";
    
    private static final String HELLO =
        "HTTP/1.1 200 OK" + CRLF +
        "Server: " + HelloWorld.SERVER_NAME + CRLF +
        "Content-Length: 13" + CRLF + CRLF +
        
        "hello world.\n";
    
    @Override
    Server createServer() {
        return HttpServer.create(HelloWorld.handler());
    }
    
    @Test
    void helloWorld() throws IOException, InterruptedException {
        String req = "GET / HTTP/1.1" + CRLF + CRLF;
        assertThat(writeReadText(req, "world.\n")).isEqualTo(HELLO);
    }
    
    @Test
    void echo_contentLength() throws IOException, InterruptedException {
        String req =
            "POST /echo HTTP/1.1" + CRLF +
            "Content-Length: 4" + CRLF + CRLF +
            
            "John";
        
        assertThat(writeReadText(req, "John")).isEqualTo(
            "HTTP/1.1 200 OK" + CRLF +
            "Server: " + HelloWorld.SERVER_NAME + CRLF +
            "Content-Length: 4" + CRLF + CRLF +
            
            "John");
    }
    
    @Test
    void echo_chunked() throws IOException, InterruptedException {
        String req =
            "POST /echo HTTP/1.1" + CRLF +
            "Transfer-Encoding: chunked" + CRLF + CRLF +
            
            "4" + CRLF + "John" + CRLF +
            "0" + CRLF + CRLF;
        
        assertThat(writeReadText(req, "0" + CRLF + CRLF)).isEqualTo(
            "HTTP/1.1 200 OK" + CRLF +
            "Server: " + HelloWorld.SERVER_NAME + CRLF +
            "Transfer-Encoding: chunked" + CRLF + CRLF +
            
            "4" + CRLF + "John" + CRLF +
            "0" + CRLF + CRLF);
    }
    
    @Test
    void persistentConnection() throws IOException, InterruptedException {
        try (SocketChannel client = openConnection()) {
            String req = "GET / HTTP/1.1" + CRLF + CRLF;
            assertThat(writeReadText(client, req, "world.\n")).isEqualTo(HELLO);
            assertThat(writeReadText(client, req, "world.\n")).isEqualTo(HELLO);
        }
    }
    
    @Test
    void pipelining() throws IOException, InterruptedException {
        String req =
            "GET /first HTTP/1.1" + CRLF + CRLF +
            "POST /echo HTTP/1.1" + CRLF +
            "Content-Length: 4" + CRLF + CRLF +
            "bye!";
        
        assertThat(writeReadText(req, "bye!")).isEqualTo(HELLO +
            "HTTP/1.1 200 OK" + CRLF +
            "Server: " + HelloWorld.SERVER_NAME + CRLF +
            "Content-Length: 4" + CRLF + CRLF +
            
            "bye!");
    }
    
    @Test
    void http10_serverCloses() throws IOException, InterruptedException {
        try (SocketChannel client = openConnection()) {
            String rsp = writeReadTextUntilEOS(client, "GET / HTTP/1.0" + CRLF + CRLF);
            assertThat(rsp).isEqualTo(
                "HTTP/1.1 200 OK" + CRLF +
                "Server: " + HelloWorld.SERVER_NAME + CRLF +
                "Connection: close" + CRLF +
                "Content-Length: 13" + CRLF + CRLF +
                
                "hello world.\n");
        }
    }
    
    @Test
    void badRequest_serverCloses() throws IOException, InterruptedException {
        try (SocketChannel client = openConnection()) {
            String rsp = writeReadTextUntilEOS(client, "GET /" + CRLF + CRLF);
            assertThat(rsp)
                .startsWith("HTTP/1.1 400 Bad Request" + CRLF)
                .contains("Connection: close" + CRLF);
        }
    }
    
    @Test
    void stop() throws IOException, InterruptedException {
        Server s = server();
        assertThat(s.isRunning()).isTrue();
        assertThat(s.getPort()).isPositive();
        s.stop();
        assertThat(s.isRunning()).isFalse();
        assertThatThrownBy(s::getLocalAddress)
            .isExactlyInstanceOf(IllegalStateException.class)
            .hasMessage("Server is not running.");
        // Idempotent
        s.stop();
    }
    
    @Test
    void startTwice() {
        assertThatThrownBy(() -> server().start())
            .isExactlyInstanceOf(IllegalStateException.class)
            .hasMessage("Server has started once before.");
    }
}
