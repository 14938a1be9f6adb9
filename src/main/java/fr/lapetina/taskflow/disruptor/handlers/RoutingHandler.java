package fr.lapetina.taskflow.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.taskflow.api.routing.RouteMatch;
import fr.lapetina.taskflow.api.routing.RouteTable;
import fr.lapetina.taskflow.auth.AuthenticatedUser;
import fr.lapetina.taskflow.domain.error.ErrorFactory;
import fr.lapetina.taskflow.domain.error.StructuredError;
import fr.lapetina.taskflow.domain.event.RequestEvent;
import fr.lapetina.taskflow.domain.model.ApiRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage: resolves the route and enforces admin-only access.
 *
 * Unknown path → 404, wrong method → 405, admin route without a caller → 401,
 * admin route with a non-admin caller → 403.
 */
public final class RoutingHandler implements EventHandler<RequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(RoutingHandler.class);

    private final RouteTable routes;

    public RoutingHandler(RouteTable routes) {
        this.routes = routes;
    }

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        event.setSequence(sequence);
        ApiRequest request = event.getRequest();
        if (request == null) {
            return;
        }

        try {
            RouteMatch match = routes.resolve(request.method(), request.path());
            if (match.route().adminOnly()) {
                checkAdmin(request);
            }
            event.markRouted(match);

            log.debug("Request routed: requestId={}, route={}, sequence={}",
                    request.requestId(), match.route().name(), sequence);

        } catch (StructuredError e) {
            event.markRouteRejected(e);

            log.debug("Routing rejected: requestId={}, method={}, path={}, code={}, sequence={}",
                    request.requestId(), request.method(), request.path(), e.getCode(), sequence);
        }
    }

    private static void checkAdmin(ApiRequest request) {
        AuthenticatedUser user = request.currentUser()
                .orElseThrow(() -> ErrorFactory.authentication("Authentication required for admin route"));
        if (!user.isAdmin()) {
            throw ErrorFactory.authorization("Admin role required, caller role: " + user.role());
        }
    }
}
