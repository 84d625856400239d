package org.stellarcalendar.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.stellarcalendar.exception.RemoteFetchException;
import org.stellarcalendar.exception.UnsafeUrlException;
import org.stellarcalendar.model.activitypub.ActivityStreams;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Single egress point for outbound federation HTTP.
 * Rejects unsafe destinations before any network activity.
 */
@Service
@Slf4j
public class SafeHttpClient {

    private static final List<String> ALLOWED_SCHEMES = List.of("http", "https");

    private static final List<Pattern> PRIVATE_IPV4_RANGES = List.of(
        Pattern.compile("^127\\."),
        Pattern.compile("^10\\."),
        Pattern.compile("^172\\.(1[6-9]|2\\d|3[01])\\."),
        Pattern.compile("^192\\.168\\."),
        Pattern.compile("^169\\.254\\."),
        Pattern.compile("^0\\.")
    );

    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d+\\.\\d+\\.\\d+\\.\\d+$");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${stellar.activitypub.development-mode:false}")
    private boolean developmentMode;

    public SafeHttpClient(@Qualifier("federationRestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Checks a URL against scheme and literal-address rules. No DNS lookups are made.
     *
     * @param url the URL to check
     * @return true if the URL may be fetched
     */
    public boolean isUrlSafe(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }

        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return false;
        }

        String scheme = uri.getScheme();
        if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
            return false;
        }

        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            return false;
        }
        host = host.toLowerCase(Locale.ROOT);

        if (developmentMode && (host.equals("localhost") || host.equals("127.0.0.1") || host.endsWith(".local"))) {
            return true;
        }

        if (IPV4_LITERAL.matcher(host).matches() && isPrivateIpv4(host)) {
            return false;
        }

        if (host.contains(":")) {
            String bare = host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
            if (!isPublicIpv6Literal(bare)) {
                return false;
            }
        }

        return !host.equals("localhost") && !host.endsWith(".local");
    }

    /**
     * Performs a request after the URL passed {@link #isUrlSafe(String)}.
     * Connect, pool lease and response are bounded by the configured timeout.
     *
     * @throws UnsafeUrlException if the URL is rejected
     * @throws RemoteFetchException on network failure or a non-2xx response
     */
    public ResponseEntity<String> exchange(String url, HttpMethod method, HttpHeaders headers, String body) {
        requireSafe(url);
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(URI.create(url), method, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw new RemoteFetchException(method + " " + url + " failed: " + e.getMessage(), e);
        }
        // redirects are not followed, so a 3xx is a failure
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new RemoteFetchException(method + " " + url + " returned " + response.getStatusCode().value());
        }
        return response;
    }

    /**
     * Fetches an ActivityPub document as JSON.
     *
     * @throws UnsafeUrlException if the URL is rejected
     * @throws RemoteFetchException if the fetch fails or the body is not JSON
     */
    public JsonNode fetchJson(String url) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, ActivityStreams.ACTIVITY_JSON + ", " + ActivityStreams.LD_JSON);
        return fetchJson(url, headers);
    }

    /**
     * Fetches a JSON document with caller-supplied headers.
     */
    public JsonNode fetchJson(String url, HttpHeaders headers) {
        ResponseEntity<String> response = exchange(url, HttpMethod.GET, headers, null);
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            throw new RemoteFetchException("Empty response from: " + url);
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new RemoteFetchException("Invalid JSON from: " + url, e);
        }
    }

    private static boolean isPrivateIpv4(String dottedQuad) {
        for (Pattern range : PRIVATE_IPV4_RANGES) {
            if (range.matcher(dottedQuad).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses an IPv6 literal (no lookup is made for literals) and checks the address the socket would
     * actually connect to. IPv4-mapped and IPv4-compatible forms are checked as the embedded IPv4 address.
     */
    private static boolean isPublicIpv6Literal(String literal) {
        InetAddress address;
        try {
            address = InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            return false;
        }
        if (address instanceof Inet6Address ipv6 && ipv6.isIPv4CompatibleAddress()) {
            byte[] bytes = ipv6.getAddress();
            try {
                address = InetAddress.getByAddress(Arrays.copyOfRange(bytes, 12, 16));
            } catch (UnknownHostException e) {
                return false;
            }
        }
        if (address.isLoopbackAddress() || address.isLinkLocalAddress() || address.isSiteLocalAddress()
            || address.isAnyLocalAddress() || address.isMulticastAddress()) {
            return false;
        }
        if (address instanceof Inet4Address) {
            return !isPrivateIpv4(address.getHostAddress());
        }
        // unique local fc00::/7
        return (address.getAddress()[0] & 0xfe) != 0xfc;
    }

    private void requireSafe(String url) {
        if (!isUrlSafe(url)) {
            log.warn("Refusing outbound request to unsafe URL: {}", url);
            throw new UnsafeUrlException("URL is not safe to fetch: " + url);
        }
    }
}
