package com.leadhunter.search.throttle;

import java.net.URI;

public final class ProxyEntry {
    private final String address;
    private volatile boolean failed;

    ProxyEntry(String address) {
        this.address = address;
    }

    public String address() {
        return address;
    }

    public boolean isFailed() {
        return failed;
    }

    void markFailed() {
        failed = true;
    }

    public URI toUri() {
        String value = address.startsWith("http://") || address.startsWith("https://") ? address : "http://" + address;
        return URI.create(value);
    }

    @Override
    public String toString() {
        return address;
    }
}
