package alpha.onionhttp.transport;

import alpha.onionhttp.Application;

import java.util.concurrent.CompletionStage;

/**
 * Is the entry point of a transport into an application.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * 
 * @see Application#callback()
 */
@FunctionalInterface
public interface RequestListener
{
    /**
     * Processes one HTTP exchange.<p>
     * 
     * The returned stage completes when the request has been dispatched and
     * the response serialized. It never completes exceptionally because of a
     * failure in the application's middleware; such failures are handled by
     * the application.
     * 
     * @param in the request
     * @param out the response
     * 
     * @return a completion stage (never {@code null})
     */
    CompletionStage<Void> handle(IncomingRequest in, OutgoingResponse out);
}
