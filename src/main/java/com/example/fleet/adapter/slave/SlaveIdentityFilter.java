package com.example.fleet.adapter.slave;

import com.example.fleet.config.FleetProperties;
import com.example.fleet.core.slave.PairingService;
import com.example.fleet.core.slave.SlaveIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.SslInfo;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import java.security.cert.X509Certificate;
import java.util.Locale;
import java.util.Optional;

/**
 * Authenticates connections to the slave link path before the WebSocket upgrade.
 * The identity comes from the TLS client certificate, or from forwarding headers
 * when a trusted proxy terminates TLS.
 */
@Slf4j
@Component
public class SlaveIdentityFilter implements WebFilter {
    public static final String IDENTITY_ATTRIBUTE = SlaveIdentityFilter.class.getName() + ".identity";
    static final String HOST_HEADER = "X-Slave-Host";
    static final String SERIAL_HEADER = "X-Slave-Cert-Serial";

    private final PairingService pairing;
    private final String path;
    private final boolean trustForwardedIdentity;

    public SlaveIdentityFilter(PairingService pairing, FleetProperties props) {
        this.pairing = pairing;
        this.path = props.getLink().getPath();
        this.trustForwardedIdentity = props.getLink().isTrustForwardedIdentity();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!path.equals(exchange.getRequest().getPath().pathWithinApplication().value())) {
            return chain.filter(exchange);
        }
        Optional<SlaveIdentity> identity = resolveIdentity(exchange.getRequest());
        if (identity.isEmpty()) {
            log.warn("Rejected slave connection from {}: no client identity", exchange.getRequest().getRemoteAddress());
            return reject(exchange, HttpStatus.UNAUTHORIZED);
        }
        SlaveIdentity id = identity.get();
        return Mono.fromCallable(() -> pairing.verify(id))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(verdict -> switch (verdict) {
                    case ACCEPTED -> {
                        exchange.getAttributes().put(IDENTITY_ATTRIBUTE, id);
                        yield chain.filter(exchange);
                    }
                    case UNKNOWN -> {
                        log.warn("Rejected slave connection: unknown host {}", id.hostId());
                        yield reject(exchange, HttpStatus.UNAUTHORIZED);
                    }
                    case REVOKED -> {
                        log.warn("Rejected slave connection: credential of {} revoked", id.hostId());
                        yield reject(exchange, HttpStatus.FORBIDDEN);
                    }
                });
    }

    Optional<SlaveIdentity> resolveIdentity(ServerHttpRequest request) {
        SslInfo ssl = request.getSslInfo();
        if (ssl != null && ssl.getPeerCertificates() != null && ssl.getPeerCertificates().length > 0) {
            X509Certificate cert = ssl.getPeerCertificates()[0];
            return commonName(cert).map(cn -> new SlaveIdentity(cn, cert.getSerialNumber().toString(16)));
        }
        if (trustForwardedIdentity) {
            String host = request.getHeaders().getFirst(HOST_HEADER);
            if (host != null && !host.isBlank()) {
                String serial = request.getHeaders().getFirst(SERIAL_HEADER);
                return Optional.of(new SlaveIdentity(host.trim(),
                        serial == null || serial.isBlank() ? null : serial.trim().toLowerCase(Locale.ROOT)));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> commonName(X509Certificate cert) {
        try {
            LdapName dn = new LdapName(cert.getSubjectX500Principal().getName());
            return dn.getRdns().stream()
                    .filter(rdn -> "CN".equalsIgnoreCase(rdn.getType()))
                    .map(Rdn::getValue)
                    .map(String::valueOf)
                    .findFirst();
        } catch (InvalidNameException e) {
            log.warn("Unparseable client certificate subject: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Mono<Void> reject(ServerWebExchange exchange, HttpStatus status) {
        exchange.getResponse().setStatusCode(status);
        return exchange.getResponse().setComplete();
    }
}
