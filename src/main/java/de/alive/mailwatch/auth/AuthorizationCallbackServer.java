package de.alive.mailwatch.auth;

import de.alive.mailwatch.util.LogUtils;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.resources.LoopResources;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Short-lived loopback HTTP listener that receives the OAuth2 redirect.
 * The listener and its event loop exist only while {@link #awaitCallback} runs.
 */
@Slf4j
public class AuthorizationCallbackServer {

    public static final String CALLBACK_PATH = "/callback";

    public record CallbackResult(@Nullable String code, @Nullable String error, @Nullable String state) {

        public boolean isSuccess() {
            return code != null && !code.isBlank();
        }
    }

    /**
     * Blocks until the browser hits the callback path or {@code timeout} passes.
     *
     * @return the callback parameters, or empty on timeout
     */
    public Optional<CallbackResult> awaitCallback(int port, Duration timeout) {
        Sinks.One<CallbackResult> callback = Sinks.one();
        LoopResources loop = LoopResources.create("oauth-callback", 1, true);
        DisposableServer server = null;
        try {
            server = HttpServer.create()
                    .runOn(loop)
                    .bindAddress(() -> new InetSocketAddress(InetAddress.getLoopbackAddress(), port))
                    .route(routes -> routes.get(CALLBACK_PATH,
                            (request, response) -> handle(request, response, callback)))
                    .bindNow();
            log.info("{} Waiting up to {} for the authorization callback on port {}",
                    LogUtils.KEY_EMOJI, LogUtils.formatDuration(timeout), server.port());

            Optional<CallbackResult> result = callback.asMono()
                    .timeout(timeout, Mono.empty())
                    .blockOptional();
            if (result.isEmpty()) {
                log.error("{} Authorization timeout - no callback received", LogUtils.ERROR_EMOJI);
            }
            return result;
        } finally {
            if (server != null) {
                server.disposeNow();
            }
            loop.disposeLater().block(Duration.ofSeconds(5));
            log.debug("Authorization callback listener stopped");
        }
    }

    private Mono<Void> handle(HttpServerRequest request, HttpServerResponse response,
                              Sinks.One<CallbackResult> callback) {
        Map<String, List<String>> parameters = new QueryStringDecoder(request.uri()).parameters();
        CallbackResult result = new CallbackResult(
                first(parameters, "code"), first(parameters, "error"), first(parameters, "state"));

        if (result.isSuccess()) {
            return send(response, HttpResponseStatus.OK,
                    "<html><body><h2>Authorization successful!</h2>"
                            + "<p>You can close this window and return to mailwatch.</p></body></html>",
                    callback, result);
        }
        if (result.error() != null) {
            return send(response, HttpResponseStatus.BAD_REQUEST,
                    "<html><body><h2>Authorization failed!</h2><p>Error: "
                            + HtmlUtils.htmlEscape(result.error()) + "</p></body></html>",
                    callback, result);
        }
        return response.status(HttpResponseStatus.BAD_REQUEST)
                .sendString(Mono.just("Missing code or error parameter"))
                .then();
    }

    private Mono<Void> send(HttpServerResponse response, HttpResponseStatus status, String html,
                            Sinks.One<CallbackResult> callback, CallbackResult result) {
        return response.status(status)
                .header("Content-Type", "text/html; charset=utf-8")
                .sendString(Mono.just(html))
                .then()
                .doOnTerminate(() -> callback.tryEmitValue(result));
    }

    @Nullable
    private static String first(Map<String, List<String>> parameters, String name) {
        List<String> values = parameters.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
