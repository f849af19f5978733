package me.golemcore.relay.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.UrlValidationResult;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classifies agent callback URLs as routable or blocked to prevent SSRF.
 *
 * <p>
 * Rules, in order:
 * <ol>
 * <li>The URL must parse and use {@code http} or {@code https}.</li>
 * <li>{@code https} is required, except for {@code localhost}/loopback hosts
 * outside production, which are accepted outright.</li>
 * <li>Unless private networks are allowed, literal private, link-local,
 * CGNAT and loopback addresses (IPv4, IPv6 and IPv4-mapped forms) are
 * rejected; production also rejects {@code localhost} and {@code .local}
 * names.</li>
 * <li>In production, host names are resolved and rejected if any address is
 * private. Resolution failure is a rejection (fail closed), which defeats DNS
 * rebinding to internal targets.</li>
 * </ol>
 *
 * <p>
 * Runs when a connection is registered; the send path trusts stored URLs.
 */
@Component
@Slf4j
public class CallbackUrlValidator {

    static final String INVALID_FORMAT = "Invalid URL format";
    static final String HTTPS_REQUIRED = "Callback URL must use HTTPS (except localhost in development)";
    static final String PRIVATE_ADDRESS = "Callback URL cannot point to private/internal addresses";
    static final String LOCALHOST_IN_PRODUCTION = "Callback URL cannot point to localhost in production";
    static final String UNRESOLVABLE = "Callback URL host could not be resolved";
    static final String RESOLVES_PRIVATE = "Callback URL resolves to a private/internal address";

    private static final Pattern NUMERIC_HOST = Pattern.compile("^[0-9.]+$");

    private final RelayProperties properties;
    private final HostResolver hostResolver;

    @Autowired
    public CallbackUrlValidator(RelayProperties properties) {
        this(properties, HostResolver.system());
    }

    public CallbackUrlValidator(RelayProperties properties, HostResolver hostResolver) {
        this.properties = properties;
        this.hostResolver = hostResolver;
    }

    public UrlValidationResult validate(String url) {
        if (url == null || url.isBlank()) {
            return UrlValidationResult.invalid(INVALID_FORMAT);
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return UrlValidationResult.invalid(INVALID_FORMAT);
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
        String host = normalizeHost(uri.getHost());
        if (scheme == null || host == null || host.isEmpty()) {
            return UrlValidationResult.invalid(INVALID_FORMAT);
        }
        // URI accepts any digit run as a port
        int port = uri.getPort();
        if (port != -1 && (port < 1 || port > 65535)) {
            return UrlValidationResult.invalid(INVALID_FORMAT);
        }
        if (!"https".equals(scheme) && !"http".equals(scheme)) {
            return UrlValidationResult.invalid(HTTPS_REQUIRED);
        }

        InetAddress literal;
        try {
            literal = parseLiteral(host);
        } catch (UnknownHostException e) {
            return UrlValidationResult.invalid(INVALID_FORMAT);
        }

        RelayProperties.ModeProperties mode = properties.getMode();
        boolean loopback = "localhost".equals(host) || (literal != null && isLoopback(literal));

        if (!"https".equals(scheme) && (!loopback || mode.isProduction())) {
            return UrlValidationResult.invalid(HTTPS_REQUIRED);
        }

        if (!mode.isProduction() && loopback) {
            return UrlValidationResult.ok();
        }

        if (mode.isAllowPrivateIps()) {
            return UrlValidationResult.ok();
        }

        if (literal != null && isPrivate(literal)) {
            return UrlValidationResult.invalid(PRIVATE_ADDRESS);
        }

        if (mode.isProduction()) {
            if (loopback || host.endsWith(".local")) {
                return UrlValidationResult.invalid(LOCALHOST_IN_PRODUCTION);
            }
            if (literal == null) {
                return validateResolvedAddresses(host);
            }
        }

        return UrlValidationResult.ok();
    }

    private UrlValidationResult validateResolvedAddresses(String host) {
        InetAddress[] addresses;
        try {
            addresses = hostResolver.resolve(host);
        } catch (UnknownHostException e) {
            log.warn("[UrlValidator] Failed to resolve callback host {}: {}", host, e.getMessage());
            return UrlValidationResult.invalid(UNRESOLVABLE);
        }
        if (addresses == null || addresses.length == 0) {
            return UrlValidationResult.invalid(UNRESOLVABLE);
        }
        for (InetAddress address : addresses) {
            if (isPrivate(address)) {
                log.warn("[UrlValidator] Callback host {} resolves to private address {}",
                        host, address.getHostAddress());
                return UrlValidationResult.invalid(RESOLVES_PRIVATE);
            }
        }
        return UrlValidationResult.ok();
    }

    private String normalizeHost(String host) {
        if (host == null) {
            return null;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("[") && normalized.endsWith("]")) {
            normalized = normalized.substring(1, normalized.length() - 1);
        }
        return normalized;
    }

    /**
     * Parses IP literals without touching DNS. Returns {@code null} for names.
     */
    private InetAddress parseLiteral(String host) throws UnknownHostException {
        if (host.indexOf(':') >= 0 || NUMERIC_HOST.matcher(host).matches()) {
            return InetAddress.getByName(host);
        }
        return null;
    }

    private boolean isLoopback(InetAddress address) {
        if (address.isLoopbackAddress()) {
            return true;
        }
        InetAddress embedded = embeddedIpv4(address);
        return embedded != null && embedded.isLoopbackAddress();
    }

    static boolean isPrivate(InetAddress address) {
        InetAddress embedded = embeddedIpv4(address);
        if (embedded != null) {
            return isPrivate(embedded);
        }
        if (address.isLoopbackAddress() || address.isAnyLocalAddress()
                || address.isSiteLocalAddress() || address.isLinkLocalAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = bytes[0] & 0xFF;
            int second = bytes[1] & 0xFF;
            // 0.0.0.0/8 and 100.64.0.0/10
            return first == 0 || (first == 100 && (second & 0xC0) == 64);
        }
        // fc00::/7 unique local
        return (bytes[0] & 0xFE) == 0xFC;
    }

    /**
     * IPv4 address embedded in an IPv4-compatible IPv6 address. IPv4-mapped
     * literals are already converted to {@link Inet4Address} by the JDK.
     */
    private static InetAddress embeddedIpv4(InetAddress address) {
        if (address instanceof Inet6Address inet6 && inet6.isIPv4CompatibleAddress()) {
            byte[] bytes = inet6.getAddress();
            byte[] v4 = new byte[] { bytes[12], bytes[13], bytes[14], bytes[15] };
            try {
                return InetAddress.getByAddress(v4);
            } catch (UnknownHostException e) {
                return null;
            }
        }
        return null;
    }
}
