package org.surff.handlers;

import org.surff.utils.PageLoader;
import org.surff.utils.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Picks the response for a request from its request line.
 */
public class RequestRouter {
    private static final Logger logger = LoggerFactory.getLogger(RequestRouter.class);

    static final String HELLO_PAGE = "hello.html";
    static final String NOT_FOUND_PAGE = "404.html";

    private final PageLoader pages;
    private final long sleepDelayMillis;
    private final HealthRoute health;

    public RequestRouter(PageLoader pages, long sleepDelayMillis, HealthRoute health) {
        this.pages = pages;
        this.sleepDelayMillis = sleepDelayMillis;
        this.health = health;
    }

    public Response route(byte[] request, int length) throws IOException {
        Route route = Route.match(request, length);
        switch (route) {
            case ROOT:
                return page(Response.OK, HELLO_PAGE);
            case SLEEP:
                pause();
                return page(Response.OK, HELLO_PAGE);
            case HEALTH:
                return new Response(Response.OK, Response.JSON, health.body());
            default:
                return page(Response.NOT_FOUND, NOT_FOUND_PAGE);
        }
    }

    private Response page(String statusLine, String name) throws IOException {
        return new Response(statusLine, Response.HTML, pages.load(name));
    }

    private void pause() {
        try {
            Thread.sleep(sleepDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Slow request interrupted after less than {} ms", sleepDelayMillis);
        }
    }
}
