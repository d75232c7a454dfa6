package gpulane.coordinator.auth;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Set;

/**
 * Request authentication. Credentials are checked in order:
 * <ol>
 * <li>{@code X-API-Key} header</li>
 * <li>{@code api_key} query parameter</li>
 * <li>{@code gen_session} cookie, via the {@link SessionValidator}</li>
 * </ol>
 * With no API key configured every request passes.
 */
public class ApiKeyAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthenticator.class);

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String API_KEY_PARAM = "api_key";
    public static final String SESSION_COOKIE = "gen_session";

    private final byte[] apiKey;
    private final SessionValidator sessionValidator;

    public ApiKeyAuthenticator(String apiKey, SessionValidator sessionValidator) {
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.getBytes(StandardCharsets.UTF_8);
        this.sessionValidator = sessionValidator;
    }

    public boolean isEnabled() {
        return apiKey != null;
    }

    public boolean authenticate(FullHttpRequest req) {
        if (apiKey == null) {
            return true;
        }

        String header = req.headers().get(API_KEY_HEADER);
        if (header != null) {
            return keyMatches(header);
        }

        List<String> params = new QueryStringDecoder(req.uri()).parameters().get(API_KEY_PARAM);
        if (params != null && !params.isEmpty()) {
            return keyMatches(params.get(0));
        }

        String cookieHeader = req.headers().get(HttpHeaderNames.COOKIE);
        if (cookieHeader != null) {
            Set<Cookie> cookies = ServerCookieDecoder.STRICT.decode(cookieHeader);
            for (Cookie cookie : cookies) {
                if (SESSION_COOKIE.equals(cookie.name())) {
                    return sessionValid(cookie.value());
                }
            }
        }
        return false;
    }

    private boolean keyMatches(String provided) {
        return MessageDigest.isEqual(apiKey, provided.getBytes(StandardCharsets.UTF_8));
    }

    private boolean sessionValid(String token) {
        try {
            return sessionValidator.isValid(token);
        } catch (RuntimeException e) {
            log.warn("Session validation failed: {}", e.getMessage());
            return false;
        }
    }
}
