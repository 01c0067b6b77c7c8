package alpha.onionhttp.handler;

import alpha.onionhttp.Application;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.stream.Collectors;

import static alpha.onionhttp.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static java.lang.System.Logger.Level.ERROR;

/**
 * Implementation of {@link ErrorHandler#BASE}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class BaseErrorHandler implements ErrorHandler
{
    private static final System.Logger LOG
            = System.getLogger(BaseErrorHandler.class.getPackageName());
    
    BaseErrorHandler() {
        // Empty
    }
    
    @Override
    public void handle(Throwable err, Application app) {
        if (err == null) {
            throw new IllegalArgumentException("non-error thrown: null");
        }
        if (err instanceof HasStatus s &&
                (s.status() == FOUR_HUNDRED_FOUR || s.expose())) {
            return;
        }
        if (app != null && app.getConfig().silent()) {
            return;
        }
        LOG.log(ERROR, () -> format(err));
    }
    
    private static String format(Throwable err) {
        var sw = new StringWriter();
        err.printStackTrace(new PrintWriter(sw));
        String indented = sw.toString().lines()
                .map(l -> "  " + l)
                .collect(Collectors.joining(System.lineSeparator()));
        return System.lineSeparator() + indented + System.lineSeparator();
    }
    
    @Override
    public String toString() {
        return "ErrorHandler.BASE";
    }
}
