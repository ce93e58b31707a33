package com.omnifuzz.framework;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.http.HttpService;
import burp.api.montoya.http.message.HttpHeader;
import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.http.message.requests.HttpRequest;
import burp.api.montoya.http.message.responses.HttpResponse;
import com.omnifuzz.model.HeaderField;
import com.omnifuzz.model.HttpTarget;
import com.omnifuzz.model.MaterializedRequest;
import com.omnifuzz.model.TransportException;
import com.omnifuzz.model.TransportResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Sends materialized requests through Burp's HTTP stack. Burp applies its own
 * connection and timeout settings; failures come back as runtime exceptions
 * and are mapped to {@link TransportException} types here.
 */
public class MontoyaTransport implements Transport {

    private final MontoyaApi api;
    private final boolean defaultSecure;

    /**
     * @param defaultSecure TLS setting for requests whose target is derived from
     *                      the Host header without an explicit port
     */
    public MontoyaTransport(MontoyaApi api, boolean defaultSecure) {
        this.api = api;
        this.defaultSecure = defaultSecure;
    }

    @Override
    public TransportResponse send(MaterializedRequest request) throws TransportException, InterruptedException {
        HttpTarget target = resolveTarget(request, defaultSecure);
        HttpService service = HttpService.httpService(target.getHost(), target.getPort(), target.isSecure());
        HttpRequest httpRequest = HttpRequest.httpRequest(service, request.getRaw());

        long start = System.nanoTime();
        HttpRequestResponse exchange;
        try {
            exchange = api.http().sendRequest(httpRequest);
        } catch (RuntimeException e) {
            throw classify(e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted during send to " + target);
        }
        if (exchange == null || exchange.response() == null) {
            throw new TransportException(TransportException.ErrorType.NO_RESPONSE,
                    "No response from " + target);
        }
        return toTransportResponse(exchange.response(), elapsedMs);
    }

    static HttpTarget resolveTarget(MaterializedRequest request, boolean defaultSecure) throws TransportException {
        if (request.getTarget() != null) {
            return request.getTarget();
        }
        String host = request.header("Host");
        if (host == null || host.isBlank()) {
            throw new TransportException(TransportException.ErrorType.CONNECTION_FAILED,
                    "Request has no target and no Host header");
        }
        try {
            return HttpTarget.fromHostHeader(host, defaultSecure);
        } catch (IllegalArgumentException e) {
            throw new TransportException(TransportException.ErrorType.CONNECTION_FAILED,
                    "Invalid Host header: " + host, e);
        }
    }

    static TransportResponse toTransportResponse(HttpResponse response, long elapsedMs) {
        List<HeaderField> headers = new ArrayList<>();
        for (HttpHeader h : response.headers()) {
            headers.add(new HeaderField(h.name(), h.value()));
        }
        return new TransportResponse(response.statusCode(), headers, response.bodyToString(),
                elapsedMs, response.toString());
    }

    static TransportException classify(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        String lower = message.toLowerCase(Locale.ROOT);
        TransportException.ErrorType type;
        if (lower.contains("timed out") || lower.contains("timeout")) {
            type = TransportException.ErrorType.TIMEOUT;
        } else if (lower.contains("connect") || lower.contains("refused") || lower.contains("unknown host")
                || lower.contains("resolve")) {
            type = TransportException.ErrorType.CONNECTION_FAILED;
        } else {
            type = TransportException.ErrorType.IO_ERROR;
        }
        return new TransportException(type, message, e);
    }
}
