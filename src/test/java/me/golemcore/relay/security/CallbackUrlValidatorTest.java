package me.golemcore.relay.security;

import me.golemcore.relay.domain.model.UrlValidationResult;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetAddress;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallbackUrlValidatorTest {

    private static final HostResolver NEVER_CALLED = host -> {
        throw new AssertionError("DNS lookup not expected for " + host);
    };

    private static CallbackUrlValidator validator(boolean production, boolean allowPrivateIps, HostResolver resolver) {
        RelayProperties properties = new RelayProperties();
        properties.getMode().setProduction(production);
        properties.getMode().setAllowPrivateIps(allowPrivateIps);
        return new CallbackUrlValidator(properties, resolver);
    }

    private static HostResolver resolvesTo(String... addresses) {
        return host -> {
            InetAddress[] result = new InetAddress[addresses.length];
            for (int i = 0; i < addresses.length; i++) {
                result[i] = InetAddress.getByName(addresses[i]);
            }
            return result;
        };
    }

    @Test
    void shouldRejectMalformedUrls() {
        CallbackUrlValidator validator = validator(false, false, NEVER_CALLED);

        assertEquals(CallbackUrlValidator.INVALID_FORMAT, validator.validate("not a url").error());
        assertEquals(CallbackUrlValidator.INVALID_FORMAT, validator.validate("").error());
        assertEquals(CallbackUrlValidator.INVALID_FORMAT, validator.validate(null).error());
        assertEquals(CallbackUrlValidator.INVALID_FORMAT, validator.validate("/relative/path").error());
    }

    @Test
    void shouldRejectPortsOutsideValidRange() {
        CallbackUrlValidator validator = validator(false, false, NEVER_CALLED);

        assertEquals(CallbackUrlValidator.INVALID_FORMAT, validator.validate("https://example.com:99999/hook").error());
        assertEquals(CallbackUrlValidator.INVALID_FORMAT, validator.validate("https://example.com:0/hook").error());
        assertTrue(validator.validate("https://example.com:8443/hook").valid());
    }

    @Test
    void shouldRejectNonHttpSchemes() {
        UrlValidationResult result = validator(false, false, NEVER_CALLED).validate("ftp://example.com/hook");

        assertFalse(result.valid());
        assertEquals(CallbackUrlValidator.HTTPS_REQUIRED, result.error());
    }

    @Test
    void shouldAcceptPublicHttpsUrl() {
        assertTrue(validator(false, false, NEVER_CALLED).validate("https://agents.example.com/hook").valid());
    }

    @Test
    void shouldRequireHttpsForRemoteHosts() {
        UrlValidationResult result = validator(false, false, NEVER_CALLED).validate("http://agents.example.com/hook");

        assertEquals(CallbackUrlValidator.HTTPS_REQUIRED, result.error());
    }

    @ParameterizedTest
    @ValueSource(strings = { "http://localhost:3000/hook", "http://127.0.0.1:8080/hook", "http://[::1]:9000/hook",
            "https://localhost/hook" })
    void shouldAcceptLoopbackOutsideProduction(String url) {
        assertTrue(validator(false, false, NEVER_CALLED).validate(url).valid());
    }

    @Test
    void shouldRejectHttpLoopbackInProduction() {
        UrlValidationResult result = validator(true, false, NEVER_CALLED).validate("http://localhost:3000/hook");

        assertEquals(CallbackUrlValidator.HTTPS_REQUIRED, result.error());
    }

    @Test
    void shouldRejectHttpsLocalhostInProduction() {
        CallbackUrlValidator validator = validator(true, false, NEVER_CALLED);

        assertEquals(CallbackUrlValidator.LOCALHOST_IN_PRODUCTION,
                validator.validate("https://localhost/hook").error());
        assertEquals(CallbackUrlValidator.LOCALHOST_IN_PRODUCTION,
                validator.validate("https://printer.local/hook").error());
    }

    @ParameterizedTest
    @ValueSource(strings = { "https://10.0.0.1/hook", "https://172.16.5.4/hook", "https://192.168.1.10/hook",
            "https://169.254.169.254/latest/meta-data", "https://100.64.0.1/hook", "https://0.0.0.0/hook",
            "https://[fc00::1]/hook", "https://[fd12:3456::1]/hook", "https://[fe80::1]/hook",
            "https://[::ffff:10.0.0.1]/hook" })
    void shouldRejectPrivateLiteralsInHostedMode(String url) {
        UrlValidationResult result = validator(true, false, NEVER_CALLED).validate(url);

        assertFalse(result.valid());
        assertEquals(CallbackUrlValidator.PRIVATE_ADDRESS, result.error());
    }

    @Test
    void shouldRejectPrivateLiteralsOutsideProduction() {
        UrlValidationResult result = validator(false, false, NEVER_CALLED).validate("https://10.0.0.1/hook");

        assertEquals(CallbackUrlValidator.PRIVATE_ADDRESS, result.error());
    }

    @Test
    void shouldAcceptPrivateLiteralWhenExplicitlyAllowed() {
        assertTrue(validator(true, true, NEVER_CALLED).validate("https://10.0.0.1/hook").valid());
    }

    @Test
    void shouldRejectHostnameResolvingToPrivateAddressInProduction() {
        CallbackUrlValidator validator = validator(true, false, resolvesTo("93.184.216.34", "10.1.2.3"));

        UrlValidationResult result = validator.validate("https://rebind.example.com/hook");

        assertEquals(CallbackUrlValidator.RESOLVES_PRIVATE, result.error());
    }

    @Test
    void shouldAcceptHostnameResolvingToPublicAddressesInProduction() {
        CallbackUrlValidator validator = validator(true, false, resolvesTo("93.184.216.34"));

        assertTrue(validator.validate("https://agents.example.com/hook").valid());
    }

    @Test
    void shouldFailClosedWhenResolutionFails() {
        HostResolver failing = host -> {
            throw new UnknownHostException(host);
        };

        UrlValidationResult result = validator(true, false, failing).validate("https://nowhere.invalid/hook");

        assertEquals(CallbackUrlValidator.UNRESOLVABLE, result.error());
    }

    @Test
    void shouldNotResolveNamesOutsideProduction() {
        assertTrue(validator(false, false, NEVER_CALLED).validate("https://agents.example.com/hook").valid());
    }

    @Test
    void shouldClassifyPrivateAddresses() throws Exception {
        assertTrue(CallbackUrlValidator.isPrivate(InetAddress.getByName("127.0.0.1")));
        assertTrue(CallbackUrlValidator.isPrivate(InetAddress.getByName("100.127.255.255")));
        assertFalse(CallbackUrlValidator.isPrivate(InetAddress.getByName("100.128.0.1")));
        assertFalse(CallbackUrlValidator.isPrivate(InetAddress.getByName("8.8.8.8")));
        assertFalse(CallbackUrlValidator.isPrivate(InetAddress.getByName("2606:4700::1111")));
    }
}
