package alpha.onionhttp.core;

import alpha.onionhttp.Application;
import alpha.onionhttp.ApplicationFactory;
import alpha.onionhttp.Config;
import alpha.onionhttp.handler.ErrorHandler;

/**
 * Default {@code ApplicationFactory}.<p>
 * 
 * This class is specified in the provider configuration file, and is loaded
 * by {@link Application#create(Config, ErrorHandler)}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class DefaultApplicationFactory implements ApplicationFactory
{
    /**
     * Constructs this object.
     */
    public DefaultApplicationFactory() {
        // Empty
    }
    
    @Override
    public Application create(Config config, ErrorHandler eh) {
        return new DefaultApplication(config, eh);
    }
}
