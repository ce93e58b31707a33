package com.omnifuzz.framework;

import com.omnifuzz.model.MaterializedRequest;
import com.omnifuzz.model.TransportException;
import com.omnifuzz.model.TransportResponse;

/**
 * The "send request, get response" capability the engine runs on. Implementations
 * own network I/O, TLS and per-request timeouts, and must be safe to call from
 * several worker threads at once.
 */
public interface Transport {

    /**
     * Sends one request and blocks until its response arrives.
     *
     * @throws TransportException   on timeout, refused connection or any other send failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    TransportResponse send(MaterializedRequest request) throws TransportException, InterruptedException;
}
