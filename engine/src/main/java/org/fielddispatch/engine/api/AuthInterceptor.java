package org.fielddispatch.engine.api;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

/**
 * Interceptor that adds the Authorization header with the engine's service token.
 * Requests pass through untouched when no token is configured.
 */
public class AuthInterceptor implements Interceptor {

    private final String serviceToken;

    public AuthInterceptor(String serviceToken) {
        this.serviceToken = serviceToken;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request original = chain.request();
        if (serviceToken == null || serviceToken.isBlank()) {
            return chain.proceed(original);
        }
        Request.Builder builder = original.newBuilder()
                .header("Authorization", "Bearer " + serviceToken);

        return chain.proceed(builder.build());
    }
}
