package com.example.mailmerge.service;

import com.example.mailmerge.model.Credential;
import com.example.mailmerge.model.RenderedMessage;
import com.example.mailmerge.model.SendResult;
import reactor.core.publisher.Mono;

public interface MailTransport {

    /**
     * Emits the recipient's result. Failures that only concern this recipient are emitted as a
     * failed {@link SendResult}; a rejected access token is signalled as
     * {@link com.example.mailmerge.exception.TransportAuthenticationException} and run-fatal
     * conditions as {@link com.example.mailmerge.exception.AuthException}.
     *
     * @param credential may be null for transports that never reach the network
     */
    Mono<SendResult> send(RenderedMessage message, Credential credential);
}
