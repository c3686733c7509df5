package com.microblog.infrastructure.context;

import com.microblog.domain.model.User;
import org.slf4j.MDC;

public final class RequestContext {

    private static final String USER_ID_KEY = "userId";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<User> currentUser = new ThreadLocal<>();

    private RequestContext() {}

    public static void setRequestId(String requestId) {
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    public static void setUser(User user) {
        currentUser.set(user);
        MDC.put(USER_ID_KEY, user.id().toString());
    }

    /**
     * The authenticated caller, or null on public paths.
     */
    public static User getUser() {
        return currentUser.get();
    }

    public static void clear() {
        currentUser.remove();
        MDC.remove(USER_ID_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
