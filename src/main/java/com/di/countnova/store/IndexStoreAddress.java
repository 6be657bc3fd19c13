package com.di.countnova.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Address of an index store node: {@code scheme://host:port}.
 * <p>
 * Accepted forms (missing parts take the defaults {@code http}, {@code localhost}, {@code 10101}):
 * <ul>
 *   <li>{@code index1.example.com}</li>
 *   <li>{@code index1.example.com:3333}, {@code :3333}</li>
 *   <li>{@code https://index1.example.com}, {@code http+protobuf://index1.example.com:3333}</li>
 *   <li>{@code [::1]}, {@code https://[fd42::1]:3333} (bracketed IPv6)</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IndexStoreAddress {

    public static final String DEFAULT_SCHEME = "http";
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 10101;

    private static final Pattern SCHEME = Pattern.compile("^[+a-z]+$");
    private static final Pattern HOST = Pattern.compile("^[0-9a-z.-]+$|^\\[[:0-9a-fA-F]+]$");
    private static final Pattern ADDRESS = Pattern.compile(
            "^(?:([+a-z]+)://)?([0-9a-z.-]+|\\[[:0-9a-fA-F]+])?(?::([0-9]+))?$");

    String scheme;
    String host;
    int port;

    public static IndexStoreAddress defaultAddress() {
        return new IndexStoreAddress(DEFAULT_SCHEME, DEFAULT_HOST, DEFAULT_PORT);
    }

    public static IndexStoreAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Index store address cannot be null or empty");
        }
        Matcher m = ADDRESS.matcher(address.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid index store address: " + address);
        }
        String scheme = m.group(1) != null ? m.group(1) : DEFAULT_SCHEME;
        String host = m.group(2) != null ? m.group(2) : DEFAULT_HOST;
        int port = m.group(3) != null ? parsePort(m.group(3), address) : DEFAULT_PORT;
        return new IndexStoreAddress(scheme, host, port);
    }

    public static IndexStoreAddress of(String host, int port) {
        return defaultAddress().withHost(host).withPort(port);
    }

    public IndexStoreAddress withScheme(String scheme) {
        if (scheme == null || !SCHEME.matcher(scheme).matches()) {
            throw new IllegalArgumentException("Invalid scheme: " + scheme);
        }
        return new IndexStoreAddress(scheme, host, port);
    }

    public IndexStoreAddress withHost(String host) {
        if (host == null || !HOST.matcher(host).matches()) {
            throw new IllegalArgumentException("Invalid host: " + host);
        }
        return new IndexStoreAddress(scheme, host, port);
    }

    public IndexStoreAddress withPort(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        return new IndexStoreAddress(scheme, host, port);
    }

    public String hostPort() {
        return host + ":" + port;
    }

    /** Transport-only form: any {@code +encoding} suffix is dropped from the scheme. */
    public String normalize() {
        int plus = scheme.indexOf('+');
        String transport = plus >= 0 ? scheme.substring(0, plus) : scheme;
        return transport + "://" + hostPort();
    }

    public String path(String path) {
        return normalize() + path;
    }

    @Override
    public String toString() {
        return scheme + "://" + hostPort();
    }

    private static int parsePort(String port, String address) {
        try {
            int value = Integer.parseInt(port);
            if (value > 65_535) {
                throw new IllegalArgumentException("Invalid port in index store address: " + address);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in index store address: " + address, e);
        }
    }
}
