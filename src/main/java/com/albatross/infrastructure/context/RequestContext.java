package com.albatross.infrastructure.context;

import com.albatross.domain.model.AuthenticatedUser;
import org.slf4j.MDC;

public final class RequestContext {

    private static final String USER_ID_KEY = "userId";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<AuthenticatedUser> currentUser = new ThreadLocal<>();
    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(AuthenticatedUser user, String requestId) {
        currentUser.set(user);
        MDC.put(USER_ID_KEY, user.userId());
        setRequestId(requestId);
    }

    public static void setRequestId(String requestId) {
        currentRequestId.set(requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    public static AuthenticatedUser getUser() {
        return currentUser.get();
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentUser.remove();
        currentRequestId.remove();
        MDC.remove(USER_ID_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
