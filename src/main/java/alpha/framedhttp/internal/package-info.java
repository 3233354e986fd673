/**
 * The library-provided server implementations.<p>
 * 
 * The only public types in this package are {@link
 * alpha.framedhttp.internal.DefaultServer} and {@link
 * alpha.framedhttp.internal.DefaultLineServer}, which are used by the {@link
 * alpha.framedhttp.HttpServer} and {@link alpha.framedhttp.LineServer}
 * interfaces as the default implementations. All other types in this package
 * can therefore be regarded as an implementation detail.
 * 
 * <h2>Layers</h2>
 * 
 * From the socket and up:
 * <ol>
 *   <li>{@link alpha.framedhttp.internal.Transport} pushes received bytes to a
 *       listener and can be paused.</li>
 *   <li>{@link alpha.framedhttp.internal.SequentialStream} turns the push
 *       model into "read next chunk", with exactly one read outstanding.</li>
 *   <li>{@link alpha.framedhttp.internal.ChannelReader} accumulates chunks in
 *       a {@link alpha.framedhttp.internal.ByteBuf}.</li>
 *   <li>{@link alpha.framedhttp.internal.MessageFramer}s cut messages from
 *       the buffer; body readers serve what follows a request head.</li>
 *   <li>{@link alpha.framedhttp.internal.HttpConnection} and {@link
 *       alpha.framedhttp.internal.LineConnection} drive the exchanges.</li>
 * </ol>
 * 
 * <h2>Threading model specifics</h2>
 * 
 * Nothing blocks. A connection is a chain of {@code CompletionStage}s, each
 * read, write and handler invocation being one link. Links complete on
 * whichever thread completed the channel operation, which is one of the
 * server's channel group threads. Within a connection, links execute strictly
 * one after the other.
 */
package alpha.framedhttp.internal;
