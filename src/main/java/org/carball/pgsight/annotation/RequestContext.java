package org.carball.pgsight.annotation;

/**
 * The controller and action handling the request on whose behalf a query runs.
 * Hosts pass it explicitly with each query event instead of keeping it in thread-local state.
 */
public record RequestContext(String controller, String action) {

    private static final RequestContext NONE = new RequestContext(null, null);

    public static RequestContext none() {
        return NONE;
    }

    public static RequestContext of(String controller, String action) {
        return new RequestContext(controller, action);
    }

    public boolean isEmpty() {
        return controller == null || controller.isBlank();
    }
}
